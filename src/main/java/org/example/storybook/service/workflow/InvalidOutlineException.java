package org.example.storybook.service.workflow;

public class InvalidOutlineException extends RuntimeException {

    public InvalidOutlineException(String message) {
        super(message);
    }

    public InvalidOutlineException(String message, Throwable cause) {
        super(message, cause);
    }
}
