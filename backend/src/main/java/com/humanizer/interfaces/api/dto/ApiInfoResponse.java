package com.humanizer.interfaces.api.dto;

import java.util.Map;

public record ApiInfoResponse(
        String message,
        String version,
        Map<String, String> endpoints
) {}
