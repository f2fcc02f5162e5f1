package com.humanizer.domain.language.exception;

public class AnnotationUnavailableException extends RuntimeException {

    public AnnotationUnavailableException(String message) {
        super(message);
    }

    public AnnotationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
