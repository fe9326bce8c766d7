package com.gnovoa.tennis.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;
import tools.jackson.databind.module.SimpleModule;

/**
 * Explicit Jackson configuration.
 *
 * <p>The catalog loader reads seed files through its own {@link ObjectMapper}: dates and times are
 * ISO strings ({@code 2025-04-07}, {@code 09:00}) and unknown fields are ignored. The REST layer
 * uses Boot's mapper, extended here so problem details keep their extra properties at the top
 * level.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public SimpleModule problemDetailModule() {
        SimpleModule module = new SimpleModule("problem-details");
        module.setMixInAnnotation(ProblemDetail.class, ProblemDetailJacksonMixin.class);
        return module;
    }
}
