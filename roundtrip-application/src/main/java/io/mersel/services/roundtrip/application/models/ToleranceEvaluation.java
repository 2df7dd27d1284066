package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.ChangeType;

import java.util.List;
import java.util.Map;

/**
 * Bir değişiklik kümesinin profile göre değerlendirme sonucu.
 * <p>
 * Tolerans aşımı bir hata değil, {@code passed=false} ile ifade edilen bir sonuçtur.
 *
 * @param passed             Kritik yol ihlali ve kural ihlali yoksa {@code true}
 * @param profileUsed        Kullanılan profil adı
 * @param criticalViolations Kritik yollardaki CRITICAL değişiklikler
 * @param ruleViolations     İhlal edilen kurallar
 * @param ignoredChanges     Yok sayılan yollara düşen değişiklikler
 * @param changesByType      Sayıma giren değişiklikler, tür başına (her tür mevcut)
 * @param totalChanges       Yok sayılanlar dahil tüm değişiklik sayısı
 * @param summary            Kısa özet; başarısızlıkta "failed" içerir
 */
public record ToleranceEvaluation(
        boolean passed,
        String profileUsed,
        List<ChangeRecord> criticalViolations,
        List<RuleViolation> ruleViolations,
        List<ChangeRecord> ignoredChanges,
        Map<ChangeType, List<ChangeRecord>> changesByType,
        int totalChanges,
        String summary
) {
}
