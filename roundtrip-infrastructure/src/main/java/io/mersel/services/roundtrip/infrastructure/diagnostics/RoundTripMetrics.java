package io.mersel.services.roundtrip.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Round-trip servisi özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan tüm uygulama metriklerini yönetir.
 */
@Component
public class RoundTripMetrics {

    public static final String METER_NAME = "roundtrip-service";

    private final MeterRegistry registry;

    public RoundTripMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Fark analizi metrikleri kaydet.
     *
     * @param documentType    Belge türü (WORD, PRESENTATION, SPREADSHEET veya "unknown")
     * @param differenceCount Bulunan fark sayısı
     * @param criticalCount   CRITICAL fark sayısı
     * @param durationMs      İşlem süresi (milisaniye)
     */
    public void recordDiff(String documentType, int differenceCount, int criticalCount, long durationMs) {
        Counter.builder("roundtrip_diff_total")
                .tag("document_type", documentType)
                .description("Toplam fark analizi sayısı")
                .register(registry)
                .increment();

        if (differenceCount > 0) {
            Counter.builder("roundtrip_differences_total")
                    .tag("document_type", documentType)
                    .description("Bulunan toplam fark sayısı")
                    .register(registry)
                    .increment(differenceCount);
        }
        if (criticalCount > 0) {
            Counter.builder("roundtrip_critical_differences_total")
                    .tag("document_type", documentType)
                    .description("Bulunan kritik fark sayısı")
                    .register(registry)
                    .increment(criticalCount);
        }

        Timer.builder("roundtrip_diff_duration")
                .tag("document_type", documentType)
                .description("Fark analizi süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Taşıyıcı analizi sayısını kaydet.
     *
     * @param operation "analyze" veya "compare"
     */
    public void recordCarrierAnalysis(String documentType, String operation) {
        Counter.builder("roundtrip_carrier_analysis_total")
                .tag("document_type", documentType)
                .tag("operation", operation)
                .description("Taşıyıcı analizi sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Tolerans değerlendirmesi sonucunu kaydet.
     */
    public void recordToleranceEvaluation(String profile, boolean passed) {
        Counter.builder("roundtrip_tolerance_evaluations_total")
                .tag("profile", profile)
                .tag("result", passed ? "passed" : "failed")
                .description("Tolerans değerlendirme sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Round-trip testi metrikleri kaydet.
     *
     * @param documentType Belge türü
     * @param passed       Test geçti mi
     * @param durationMs   Toplam süre (milisaniye)
     */
    public void recordRoundTripTest(String documentType, boolean passed, long durationMs) {
        Counter.builder("roundtrip_tests_total")
                .tag("document_type", documentType)
                .tag("result", passed ? "pass" : "fail")
                .description("Round-trip test sayısı")
                .register(registry)
                .increment();

        Timer.builder("roundtrip_test_duration")
                .tag("document_type", documentType)
                .description("Round-trip test süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Uyumluluk matrisi üretimini kaydet.
     *
     * @param platformCount Rapordaki platform sayısı
     */
    public void recordMatrix(int platformCount) {
        Counter.builder("roundtrip_compatibility_reports_total")
                .description("Üretilen uyumluluk raporu sayısı")
                .register(registry)
                .increment();

        registry.summary("roundtrip_compatibility_report_platforms").record(platformCount);
    }

    /**
     * Eğilim analizi sayısını ve tespit edilen gerileme sayısını kaydet.
     */
    public void recordTrendAnalysis(int regressionCount) {
        Counter.builder("roundtrip_trend_analyses_total")
                .description("Eğilim analizi sayısı")
                .register(registry)
                .increment();

        if (regressionCount > 0) {
            Counter.builder("roundtrip_trend_regressions_total")
                    .description("Eğilim analizinde tespit edilen gerileme sayısı")
                    .register(registry)
                    .increment(regressionCount);
        }
    }

    /**
     * Profil reload metrikleri kaydet.
     *
     * @param success    Tüm dosyalar başarıyla yüklendi mi
     * @param durationMs Reload süresi (milisaniye)
     */
    public void recordReload(boolean success, long durationMs) {
        Counter.builder("roundtrip_profile_reload_total")
                .tag("status", success ? "success" : "failure")
                .description("Tolerans profili reload sayısı")
                .register(registry)
                .increment();

        Timer.builder("roundtrip_profile_reload_duration_seconds")
                .description("Tolerans profili reload süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Hata metrikleri kaydet.
     */
    public void recordError(String operation) {
        Counter.builder("roundtrip_errors_total")
                .tag("operation", operation)
                .description("Toplam hata sayısı")
                .register(registry)
                .increment();
    }
}
