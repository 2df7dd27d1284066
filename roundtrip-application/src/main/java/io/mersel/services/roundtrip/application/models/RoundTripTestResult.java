package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;

import java.util.List;

/**
 * Round-trip testinin sonucu.
 *
 * @param passed                 Eşikler ve tolerans profili sağlandıysa {@code true}
 * @param banner                 "PASS" veya "FAIL"
 * @param failureReasons         Başarısızlık nedenleri (ölçülen değer ve sınır ile)
 * @param documentType           Kullanılan belge türü
 * @param profileUsed            Kullanılan tolerans profili
 * @param overallSurvivalRate    Token korunma oranı
 * @param criticalSurvivalRate   Kritik taşıyıcı hayatta kalma oranı
 * @param failThreshold          Uygulanan genel eşik
 * @param criticalThreshold      Uygulanan kritik eşik
 * @param diffSummary            Fark özeti
 * @param preservationMetrics    Bağlama göre korunma oranları
 * @param carrierMetrics         Taşıyıcı korunma metrikleri
 * @param criticalCarrierSurvival Kritik taşıyıcı özeti
 * @param toleranceEvaluation    Tolerans değerlendirmesi
 * @param carrierReport          Metin taşıyıcı raporu
 * @param durationMs             Toplam süre
 */
public record RoundTripTestResult(
        boolean passed,
        String banner,
        List<String> failureReasons,
        DocumentType documentType,
        String profileUsed,
        double overallSurvivalRate,
        double criticalSurvivalRate,
        double failThreshold,
        double criticalThreshold,
        DiffSummary diffSummary,
        PreservationMetrics preservationMetrics,
        CarrierPreservationMetrics carrierMetrics,
        CriticalCarrierSurvival criticalCarrierSurvival,
        ToleranceEvaluation toleranceEvaluation,
        String carrierReport,
        long durationMs
) {
}
