package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.CarrierComparison;

/**
 * İki versiyon taşıyıcı karşılaştırması yanıtı (metin raporu dahil).
 */
public record CarrierComparisonResponse(
        DocumentType documentType,
        CarrierComparison comparison,
        String report
) {
}
