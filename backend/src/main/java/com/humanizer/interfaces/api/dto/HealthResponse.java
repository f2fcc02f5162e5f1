package com.humanizer.interfaces.api.dto;

public record HealthResponse(String status, String service) {}
