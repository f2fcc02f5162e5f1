package com.humanizer.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
