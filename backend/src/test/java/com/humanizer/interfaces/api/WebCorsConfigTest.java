package com.humanizer.interfaces.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;

import java.lang.reflect.Field;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebCorsConfigTest {

    // exposes the registered mappings
    private static class InspectableCorsRegistry extends CorsRegistry {
        Map<String, CorsConfiguration> configurations() {
            return getCorsConfigurations();
        }
    }

    @Test
    @DisplayName("every path accepts cross-origin GET and POST from the configured origins")
    void allows_browser_clients() throws Exception {
        WebCorsConfig config = new WebCorsConfig();
        Field field = WebCorsConfig.class.getDeclaredField("allowedOrigins");
        field.setAccessible(true);
        field.set(config, new String[]{"*"});

        InspectableCorsRegistry registry = new InspectableCorsRegistry();
        config.addCorsMappings(registry);

        CorsConfiguration cors = registry.configurations().get("/**");
        assertThat(cors).isNotNull();
        assertThat(cors.getAllowedOriginPatterns()).containsExactly("*");
        assertThat(cors.getAllowedMethods()).contains("GET", "POST");
        assertThat(cors.getAllowCredentials()).isFalse();
    }
}
