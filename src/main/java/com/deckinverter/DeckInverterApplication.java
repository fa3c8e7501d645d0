package com.deckinverter;

import com.deckinverter.controller.DeckController;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Main application class for the Deck Inverter backend.
 *
 * @author Deck Inverter Team
 * @version 1.0.0
 */
@SpringBootApplication
public class DeckInverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckInverterApplication.class, args);
    }

    /**
     * Cross-origin access for external API consumers, enabled only when
     * CORS_ORIGINS is set.
     *
     * Example: CORS_ORIGINS=https://example.com,https://app.example.com
     */
    @Value("${CORS_ORIGINS:}")
    private String corsOrigins;

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                if (corsOrigins != null && !corsOrigins.isBlank()) {
                    registry.addMapping("/api/**")
                            .allowedOrigins(corsOrigins.split(","))
                            .allowedMethods("GET", "POST", "OPTIONS")
                            .allowedHeaders("*")
                            .exposedHeaders(DeckController.WARNINGS_HEADER, DeckController.SUCCEEDED_HEADER)
                            .maxAge(3600);
                }
            }
        };
    }
}
