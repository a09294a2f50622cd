package com.fastrelay.exception;

public class DeadLetterNotFoundException extends RuntimeException {

    public DeadLetterNotFoundException(String recordId) {
        super("dead letter record not found: " + recordId);
    }
}
