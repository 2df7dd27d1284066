package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.UsageContext;

/**
 * Önerilen tolerans profili yanıtı.
 */
public record RecommendationResponse(DocumentType documentType, UsageContext usageContext, String profileName) {
}
