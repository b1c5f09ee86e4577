package com.approvalgate.domain.model;

import lombok.Value;

/**
 * An extra column written alongside the status change in the guarded update.
 */
@Value
public class ColumnAssignment {

    public enum Source {
        /** The executing caller's user id. */
        CALLER_ID,
        CURRENT_TIMESTAMP,
        CURRENT_DATE,
        /** A user-supplied field staged with the confirmation. */
        INPUT_FIELD
    }

    String column;
    Source source;
    String inputField;

    public static ColumnAssignment callerId(String column) {
        return new ColumnAssignment(column, Source.CALLER_ID, null);
    }

    public static ColumnAssignment now(String column) {
        return new ColumnAssignment(column, Source.CURRENT_TIMESTAMP, null);
    }

    public static ColumnAssignment today(String column) {
        return new ColumnAssignment(column, Source.CURRENT_DATE, null);
    }

    public static ColumnAssignment fromInput(String column, String inputField) {
        return new ColumnAssignment(column, Source.INPUT_FIELD, inputField);
    }
}
