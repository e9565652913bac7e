package com.ai.consultas.conversation;

import org.apache.commons.lang3.StringUtils;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Consultation data collected across one entry flow. Fields are filled in
 * pipeline order; the course code is resolved later by the record sink.
 */
@Getter
@Setter
@ToString
public class FormRecord {

    /** Widest student name the consultation table stores. */
    public static final int MAX_STUDENT_NAME_LENGTH = 200;

    private String studentName;

    private String courseName;

    private String assistantName;

    private String auxiliaryName;

    private String receivedDate;

    private String startDate;

    private String endDate;

    public boolean isComplete() {
        return StringUtils.isNoneBlank(studentName, courseName, assistantName, auxiliaryName,
                receivedDate, startDate, endDate);
    }
}
