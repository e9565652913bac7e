package com.ai.consultas.entity;

import com.ai.consultas.conversation.FormRecord;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * One registered consultation, as written by the record sink.
 */
@Entity
@Table(name = "consultation_entry", indexes = {
    @Index(name = "idx_consultation_course_code", columnList = "course_code")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsultationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_name", nullable = false, length = FormRecord.MAX_STUDENT_NAME_LENGTH)
    private String studentName;

    @Column(name = "course_name", nullable = false, length = 150)
    private String courseName;

    @Column(name = "course_code", nullable = false, length = 30)
    private String courseCode;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at", nullable = false)
    private LocalDateTime endedAt;

    /** Minutes between receiving the consultation and starting it. */
    @Column(name = "response_minutes", nullable = false)
    private long responseMinutes;

    @Column(name = "duration_minutes", nullable = false)
    private long durationMinutes;

    @Column(name = "assistant_name", nullable = false, length = 100)
    private String assistantName;

    @Column(name = "auxiliary_name", nullable = false, length = 100)
    private String auxiliaryName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
