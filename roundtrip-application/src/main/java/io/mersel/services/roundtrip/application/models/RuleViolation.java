package io.mersel.services.roundtrip.application.models;

/**
 * İhlal edilen tek bir tolerans kuralı.
 *
 * @param rule               İhlal edilen kural
 * @param changeCount        Kurala giren değişiklik sayısı
 * @param totalCount         Yüzde paydası
 * @param measuredPercentage Ölçülen yüzde
 * @param message            Ölçülen değer ve yapılandırılmış sınırı içeren mesaj
 */
public record RuleViolation(
        ToleranceRule rule,
        int changeCount,
        int totalCount,
        double measuredPercentage,
        String message
) {
}
