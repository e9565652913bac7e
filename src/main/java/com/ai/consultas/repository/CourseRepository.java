package com.ai.consultas.repository;

import com.ai.consultas.entity.Course;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CourseRepository extends JpaRepository<Course, Long> {

    List<Course> findByActiveTrueOrderByNameAsc();

    Optional<Course> findFirstByName(String name);
}
