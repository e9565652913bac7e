package com.ai.consultas.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import com.ai.consultas.conversation.FormRecord;
import com.ai.consultas.entity.ConsultationEntry;
import com.ai.consultas.entity.Course;
import com.ai.consultas.repository.ConsultationEntryRepository;
import com.ai.consultas.repository.CourseRepository;

@DataJpaTest
@Import(ConsultationWriter.class)
class ConsultationWriterTest {

    @Autowired
    private ConsultationWriter writer;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private ConsultationEntryRepository entryRepository;

    @BeforeEach
    void setUp() {
        courseRepository.save(Course.builder().name("Cálculo I").code("CALC1").build());
    }

    private static FormRecord record(String course) {
        FormRecord record = new FormRecord();
        record.setStudentName("Ana");
        record.setCourseName(course);
        record.setAssistantName("Luis");
        record.setAuxiliaryName("Marta");
        record.setReceivedDate("2024/03/10 10:30:00");
        record.setStartDate("2024/03/10 10:35:00");
        record.setEndDate("2024/03/10 11:30:00");
        return record;
    }

    @Test
    void writesEntryWithCourseCodeAndDerivedMinutes() {
        ConsultationEntry entry = writer.write(record("Cálculo I"));

        assertThat(entry.getId()).isNotNull();
        assertThat(entry.getCourseCode()).isEqualTo("CALC1");
        assertThat(entry.getReceivedAt()).isEqualTo(LocalDateTime.of(2024, 3, 10, 10, 30));
        assertThat(entry.getResponseMinutes()).isEqualTo(5);
        assertThat(entry.getDurationMinutes()).isEqualTo(55);
        assertThat(entry.getCreatedAt()).isNotNull();

        List<ConsultationEntry> stored = entryRepository.findByCourseCodeOrderByReceivedAtAsc("CALC1");
        assertThat(stored).extracting(ConsultationEntry::getStudentName).containsExactly("Ana");
        assertThat(stored.get(0).getAssistantName()).isEqualTo("Luis");
        assertThat(stored.get(0).getAuxiliaryName()).isEqualTo("Marta");
    }

    @Test
    void unknownCourseGetsPlaceholderCode() {
        ConsultationEntry entry = writer.write(record("Filosofía"));

        assertThat(entry.getCourseCode()).isEqualTo(ConsultationWriter.UNKNOWN_COURSE_CODE);
    }

    @Test
    void endBeforeStartYieldsNegativeDuration() {
        FormRecord record = record("Cálculo I");
        record.setEndDate("2024/03/10 10:00:00");

        assertThat(writer.write(record).getDurationMinutes()).isEqualTo(-35);
    }

    @Test
    void incompleteRecordIsRejected() {
        FormRecord record = record("Cálculo I");
        record.setAuxiliaryName(" ");

        assertThatThrownBy(() -> writer.write(record)).isInstanceOf(IllegalArgumentException.class);
        assertThat(entryRepository.count()).isZero();
    }

    @Test
    void storesTheLongestStudentNameTheDialogAccepts() {
        FormRecord record = record("Cálculo I");
        record.setStudentName("x".repeat(FormRecord.MAX_STUDENT_NAME_LENGTH));

        ConsultationEntry entry = writer.write(record);
        entryRepository.flush();

        assertThat(entryRepository.findById(entry.getId()))
                .get()
                .extracting(ConsultationEntry::getStudentName)
                .asString()
                .hasSize(FormRecord.MAX_STUDENT_NAME_LENGTH);
    }
}
