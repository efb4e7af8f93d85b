package com.sfuplan.prereq.exception;

public class MalformedPrerequisiteTreeException extends RuntimeException {

    public MalformedPrerequisiteTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
