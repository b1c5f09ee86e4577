package com.approvalgate.application;

import lombok.Getter;

/**
 * Tool input failed validation; reported as {@code INVALID_INPUT}.
 */
@Getter
public class InvalidActionInputException extends RuntimeException {

    private final String field;

    public InvalidActionInputException(String field, String message) {
        super(message);
        this.field = field;
    }
}
