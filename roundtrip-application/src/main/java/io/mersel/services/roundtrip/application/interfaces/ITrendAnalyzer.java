package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.models.CompatibilityReport;
import io.mersel.services.roundtrip.application.models.TrendAnalysisReport;

import java.util.List;

/**
 * Uyumluluk raporlarını çalıştırmalar boyunca izler ve gerilemeleri işaretler.
 */
public interface ITrendAnalyzer {

    /**
     * Raporu geçmişe ekler. Geçmiş dolduysa en eski rapor düşer.
     */
    void record(CompatibilityReport report);

    /**
     * Kayıtlı raporlar, eskiden yeniye.
     */
    List<CompatibilityReport> history();

    /**
     * Kayıtlı geçmişi analiz eder.
     *
     * @param analysisDays Analiz penceresi (gün); {@code null} ise yapılandırılmış varsayılan
     * @throws IllegalArgumentException Geçmiş boşsa
     */
    TrendAnalysisReport analyzeTrends(Integer analysisDays);

    /**
     * Verilen raporları analiz eder. Penceredeki rapor yoksa tüm raporlar kullanılır.
     *
     * @throws IllegalArgumentException Rapor listesi boşsa
     */
    TrendAnalysisReport analyzeTrends(List<CompatibilityReport> reports, Integer analysisDays);

    /**
     * Geçmişi temizler ve silinen rapor sayısını döner.
     */
    int clearHistory();
}
