package com.ai.consultas.service;

import com.ai.consultas.entity.Course;
import com.ai.consultas.entity.StaffMember;
import com.ai.consultas.repository.CourseRepository;
import com.ai.consultas.repository.StaffMemberRepository;
import com.ai.consultas.selector.SelectorDataSource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lookup data offered by the selectors. Each fetch queries the database again.
 */
@Service
public class RegistryDataService {

    private final CourseRepository courseRepository;
    private final StaffMemberRepository staffMemberRepository;

    public RegistryDataService(CourseRepository courseRepository, StaffMemberRepository staffMemberRepository) {
        this.courseRepository = courseRepository;
        this.staffMemberRepository = staffMemberRepository;
    }

    @Transactional(readOnly = true)
    public List<String> fetchCourseNames() {
        return courseRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(Course::getName)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<String> fetchStaffNames() {
        return staffMemberRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(StaffMember::getName)
                .collect(Collectors.toList());
    }

    public SelectorDataSource courseNames() {
        return this::fetchCourseNames;
    }

    public SelectorDataSource staffNames() {
        return this::fetchStaffNames;
    }
}
