package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.PlatformType;

import java.util.List;

/**
 * Tek bir platformda yapılan round-trip testinin taşıyıcı sonucu.
 *
 * @param platform         Test edilen platform
 * @param documentType     Belge türü
 * @param platformVersion  Platform sürümü (opsiyonel)
 * @param carrierMetrics   Taşıyıcı korunma metrikleri; analiz başarısız olduysa {@code null}
 * @param criticalFailures Eksik kritik taşıyıcı tanımlayıcıları
 */
public record PlatformTestResult(
        PlatformType platform,
        DocumentType documentType,
        String platformVersion,
        CarrierPreservationMetrics carrierMetrics,
        List<String> criticalFailures
) {

    public PlatformTestResult {
        criticalFailures = criticalFailures == null ? List.of() : List.copyOf(criticalFailures);
    }
}
