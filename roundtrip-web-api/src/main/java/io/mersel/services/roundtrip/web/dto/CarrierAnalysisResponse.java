package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.CarrierAnalysisResult;
import io.mersel.services.roundtrip.application.models.CriticalCarrierSurvival;

/**
 * Tek belge taşıyıcı analizi yanıtı.
 */
public record CarrierAnalysisResponse(
        DocumentType documentType,
        CarrierAnalysisResult analysis,
        CriticalCarrierSurvival criticalSurvival
) {
}
