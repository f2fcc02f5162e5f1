package com.humanizer.interfaces.api.info;

import com.humanizer.interfaces.api.dto.ApiInfoResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ApiInfoController {

    private static final ApiInfoResponse INFO;

    static {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/api/v1/humanize", "POST - Rewrite text in a style profile");
        endpoints.put("/api/v1/humanize/styles", "GET - List the style profiles and their settings");
        endpoints.put("/api/v1/health", "GET - Service health");
        INFO = new ApiInfoResponse("Text Humanizer API", "0.1.0", Collections.unmodifiableMap(endpoints));
    }

    @GetMapping("/")
    public ResponseEntity<ApiInfoResponse> info() {
        return ResponseEntity.ok(INFO);
    }
}
