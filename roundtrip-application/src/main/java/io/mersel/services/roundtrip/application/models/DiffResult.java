package io.mersel.services.roundtrip.application.models;

import java.util.List;

/**
 * Fark analizinin sonucu.
 *
 * @param differences     Belge sırasıyla tüm farklar
 * @param summary         Özet
 * @param comparableItems Orijinal belgedeki karşılaştırılabilir öğe + öznitelik sayısı
 */
public record DiffResult(List<SemanticDifference> differences, DiffSummary summary, int comparableItems) {
}
