package io.mersel.services.roundtrip.web.controllers;

import io.mersel.services.roundtrip.application.interfaces.ICompatibilityAggregator;
import io.mersel.services.roundtrip.application.interfaces.ITrendAnalyzer;
import io.mersel.services.roundtrip.application.models.CompatibilityReport;
import io.mersel.services.roundtrip.application.models.TrendAnalysisReport;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.dto.CompatibilityMatrixRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Çok platformlu uyumluluk matrisi ve eğilim analizi endpoint'leri.
 * <p>
 * Üretilen her rapor eğilim geçmişine eklenir.
 */
@RestController
@RequestMapping("/v1/compatibility")
@Tag(name = "Compatibility", description = "Platformlar ve taşıyıcı türleri genelinde uyumluluk raporu")
public class CompatibilityController {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityController.class);

    private final ICompatibilityAggregator aggregator;
    private final ITrendAnalyzer trendAnalyzer;
    private final RoundTripMetrics metrics;

    public CompatibilityController(ICompatibilityAggregator aggregator,
                                   ITrendAnalyzer trendAnalyzer,
                                   RoundTripMetrics metrics) {
        this.aggregator = aggregator;
        this.trendAnalyzer = trendAnalyzer;
        this.metrics = metrics;
    }

    @Operation(
            summary = "Uyumluluk Matrisi",
            description = """
                    Platform bazlı taşıyıcı korunma sonuçlarını ve token sonuçlarını tek bir raporda birleştirir.
                    
                    **Genel metrikler:** overall_survival_rate, best/worst_platform_rate, platform_variance,
                    critical_carrier_success, overall_carrier_success, reliability_score.
                    
                    Metrikleri eksik platform girdileri `analysis-unavailable` hatasıyla raporlanır; rapor yine üretilir.
                    """
    )
    @PostMapping("/matrix")
    public ResponseEntity<CompatibilityReport> generateMatrix(@RequestBody CompatibilityMatrixRequest request) {
        CompatibilityReport report = aggregator.generateMatrix(
                request.platformResults(), request.carrierResults(), request.configuration());
        metrics.recordMatrix(report.platformResults().size());
        trendAnalyzer.record(report);

        log.info("Uyumluluk raporu: {} (platform={}, öneri={})",
                report.reportId(), report.platformResults().size(), report.recommendations().size());
        return ResponseEntity.ok(report);
    }

    @Operation(
            summary = "Eğilim Analizi",
            description = """
                    Geçmişteki uyumluluk raporlarından platform, taşıyıcı ve genel metrik eğilimlerini çıkarır.
                    
                    Eğilim yönleri: IMPROVING, STABLE, DECLINING, VOLATILE. Düşüş eğilimindeki
                    platform ve taşıyıcılar `regressions` listesinde döner.
                    
                    Geçmiş boşsa 400 döner.
                    """
    )
    @GetMapping("/trends")
    public ResponseEntity<TrendAnalysisReport> analyzeTrends(
            @Parameter(description = "Analiz penceresi (gün). Boşsa roundtrip.trend.analysis-window-days kullanılır.")
            @RequestParam(value = "analysisDays", required = false) Integer analysisDays) {
        TrendAnalysisReport report = trendAnalyzer.analyzeTrends(analysisDays);
        metrics.recordTrendAnalysis(report.regressions().size());
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Eğilim Geçmişini Temizle", description = "Bellekteki uyumluluk raporu geçmişini siler.")
    @DeleteMapping("/trends")
    public ResponseEntity<Map<String, Integer>> clearTrendHistory() {
        int removed = trendAnalyzer.clearHistory();
        return ResponseEntity.ok(Map.of("removed_reports", removed));
    }
}
