package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fark listesinin özeti.
 * <p>
 * {@code byCategory} ve {@code bySeverity} her zaman tüm kategori/seviyeleri içerir.
 *
 * @param totalDifferences Toplam fark sayısı
 * @param byCategory       Kategori başına sayı
 * @param bySeverity       Önem seviyesi başına sayı
 * @param criticalChanges  CRITICAL seviyedeki farklar
 * @param preservationRate Değişmeden (veya yalnızca önemsiz değişiklikle) kalan içerik yüzdesi, [0,100]
 */
public record DiffSummary(
        int totalDifferences,
        Map<DiffCategory, Integer> byCategory,
        Map<DiffSeverity, Integer> bySeverity,
        List<SemanticDifference> criticalChanges,
        double preservationRate
) {

    public static DiffSummary of(List<SemanticDifference> differences, double preservationRate) {
        var byCategory = new EnumMap<DiffCategory, Integer>(DiffCategory.class);
        for (DiffCategory category : DiffCategory.values()) {
            byCategory.put(category, 0);
        }
        var bySeverity = new EnumMap<DiffSeverity, Integer>(DiffSeverity.class);
        for (DiffSeverity severity : DiffSeverity.values()) {
            bySeverity.put(severity, 0);
        }
        for (SemanticDifference diff : differences) {
            byCategory.merge(diff.category(), 1, Integer::sum);
            bySeverity.merge(diff.severity(), 1, Integer::sum);
        }
        var critical = differences.stream()
                .filter(d -> d.severity() == DiffSeverity.CRITICAL)
                .toList();
        double clamped = Math.max(0.0, Math.min(100.0, preservationRate));
        return new DiffSummary(
                differences.size(),
                Collections.unmodifiableMap(byCategory),
                Collections.unmodifiableMap(bySeverity),
                critical,
                clamped);
    }
}
