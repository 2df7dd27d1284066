package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.DiffSummary;
import io.mersel.services.roundtrip.application.models.PreservationMetrics;
import io.mersel.services.roundtrip.application.models.SemanticDifference;

import java.util.List;

/**
 * Fark analizi yanıtı.
 * <p>
 * {@code summary} filtrelenmemiş tüm farkları, {@code differences} yalnızca filtreden geçenleri içerir.
 */
public record DiffResponse(
        DocumentType documentType,
        DiffSummary summary,
        List<SemanticDifference> differences,
        PreservationMetrics preservationMetrics,
        int comparableItems
) {
}
