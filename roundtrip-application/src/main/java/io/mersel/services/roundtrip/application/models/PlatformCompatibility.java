package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.PlatformType;

import java.util.List;

/**
 * Platform ve belge türü bazında birleştirilmiş taşıyıcı istatistikleri.
 */
public record PlatformCompatibility(
        PlatformType platform,
        DocumentType documentType,
        String version,
        int totalCarriers,
        int preservedCarriers,
        int modifiedCarriers,
        int lostCarriers,
        double survivalRate,
        List<String> criticalFailures
) {
}
