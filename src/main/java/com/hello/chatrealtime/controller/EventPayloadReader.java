package com.hello.chatrealtime.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hello.chatrealtime.exception.InvalidEventException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;

/**
 * Binds the {@code data} of an inbound event to its request type and validates it.
 */
@Component
public class EventPayloadReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public EventPayloadReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public <T> T read(JsonNode data, Class<T> type) {
        if (data == null || !data.isObject()) {
            throw new InvalidEventException("Event data must be an object");
        }

        T request;
        try {
            request = objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new InvalidEventException("Malformed event data");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            // report one violation, picked deterministically
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .min(Comparator.naturalOrder())
                    .orElse("Invalid event data");
            throw new InvalidEventException(message);
        }
        return request;
    }
}
