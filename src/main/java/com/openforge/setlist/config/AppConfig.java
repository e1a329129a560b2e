package com.openforge.setlist.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Core infrastructure beans:
 *  - Jackson ObjectMapper → snake_case on the wire, ISO-8601 dates, tolerant reads
 *  - PasswordEncoder      → BCrypt for credential hashing
 *  - Clock                → single time source for token issue / verify
 */
@Configuration
public class AppConfig {

    /**
     * Shared ObjectMapper:
     *  - snake_case property names (access_token, display_name …)
     *  - ISO-8601 dates, NOT timestamps
     *  - unknown properties ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * BCrypt, default strength. Hashing is deliberately slow, tens of ms per
     * call.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
