package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;

/**
 * Round-trip testi isteği.
 *
 * @param original          Orijinal belge (OOXML paketi veya tek XML parçası)
 * @param originalName      Orijinal dosya adı
 * @param converted         Dönüştürülmüş belge
 * @param convertedName     Dönüştürülmüş dosya adı
 * @param documentType      Belge türü; {@code null} ise orijinalden tespit edilir
 * @param profileName       Tolerans profili adı
 * @param failThreshold     Genel korunma eşiği (0–100)
 * @param criticalThreshold Kritik taşıyıcı eşiği (0–100)
 */
public record RoundTripTestRequest(
        byte[] original,
        String originalName,
        byte[] converted,
        String convertedName,
        DocumentType documentType,
        String profileName,
        double failThreshold,
        double criticalThreshold
) {
}
