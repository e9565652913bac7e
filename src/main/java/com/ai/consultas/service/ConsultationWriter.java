package com.ai.consultas.service;

import com.ai.consultas.conversation.FormRecord;
import com.ai.consultas.entity.Course;
import com.ai.consultas.entity.ConsultationEntry;
import com.ai.consultas.repository.ConsultationEntryRepository;
import com.ai.consultas.repository.CourseRepository;
import com.ai.consultas.selector.DateWheelSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Durable write of one completed record. Resolves the course code from the
 * course name and derives response time and duration from the timestamps.
 */
@Service
public class ConsultationWriter {

    private static final Logger log = LoggerFactory.getLogger(ConsultationWriter.class);

    static final String UNKNOWN_COURSE_CODE = "N/A";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern(DateWheelSelector.TIMESTAMP_PATTERN);

    private final CourseRepository courseRepository;
    private final ConsultationEntryRepository entryRepository;

    public ConsultationWriter(CourseRepository courseRepository, ConsultationEntryRepository entryRepository) {
        this.courseRepository = courseRepository;
        this.entryRepository = entryRepository;
    }

    @Transactional
    public ConsultationEntry write(FormRecord record) {
        if (!record.isComplete()) {
            throw new IllegalArgumentException("Record is missing fields: " + record);
        }
        LocalDateTime received = LocalDateTime.parse(record.getReceivedDate(), TIMESTAMP);
        LocalDateTime started = LocalDateTime.parse(record.getStartDate(), TIMESTAMP);
        LocalDateTime ended = LocalDateTime.parse(record.getEndDate(), TIMESTAMP);

        ConsultationEntry entry = ConsultationEntry.builder()
                .studentName(record.getStudentName())
                .courseName(record.getCourseName())
                .courseCode(resolveCourseCode(record.getCourseName()))
                .receivedAt(received)
                .startedAt(started)
                .endedAt(ended)
                .responseMinutes(Duration.between(received, started).toMinutes())
                .durationMinutes(Duration.between(started, ended).toMinutes())
                .assistantName(record.getAssistantName())
                .auxiliaryName(record.getAuxiliaryName())
                .build();
        entry = entryRepository.save(entry);
        log.info("Consultation {} written | course={} code={} student={}",
                entry.getId(), entry.getCourseName(), entry.getCourseCode(), entry.getStudentName());
        return entry;
    }

    public String resolveCourseCode(String courseName) {
        return courseRepository.findFirstByName(courseName)
                .map(Course::getCode)
                .orElse(UNKNOWN_COURSE_CODE);
    }
}
