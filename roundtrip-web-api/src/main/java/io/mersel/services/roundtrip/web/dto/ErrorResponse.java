package io.mersel.services.roundtrip.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Basit hata yanıtı (ProblemDetail dışı kısa yanıtlar için).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message) {
}
