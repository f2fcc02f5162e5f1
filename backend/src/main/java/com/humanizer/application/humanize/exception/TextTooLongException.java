package com.humanizer.application.humanize.exception;

public class TextTooLongException extends RuntimeException {

    public TextTooLongException(String message) {
        super(message);
    }
}
