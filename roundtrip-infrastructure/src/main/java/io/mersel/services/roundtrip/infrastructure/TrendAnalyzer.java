package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.RiskLevel;
import io.mersel.services.roundtrip.application.enums.TrendDirection;
import io.mersel.services.roundtrip.application.interfaces.ITrendAnalyzer;
import io.mersel.services.roundtrip.application.models.CarrierCompatibility;
import io.mersel.services.roundtrip.application.models.CarrierTrend;
import io.mersel.services.roundtrip.application.models.CompatibilityReport;
import io.mersel.services.roundtrip.application.models.PlatformCompatibility;
import io.mersel.services.roundtrip.application.models.PlatformTrend;
import io.mersel.services.roundtrip.application.models.TrendAnalysisReport;
import io.mersel.services.roundtrip.application.models.TrendMetric;
import io.mersel.services.roundtrip.infrastructure.config.RoundTripProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Uyumluluk raporlarını çalıştırmalar boyunca izleyen eğilim analizcisi.
 * <p>
 * Raporlar bellekte, {@code roundtrip.trend.max-history} ile sınırlı bir geçmişte tutulur.
 * Eğilim yönü doğrusal regresyon eğimi ve değişim katsayısından çıkarılır:
 * <ul>
 *   <li>3'ten az değer → STABLE</li>
 *   <li>değişim katsayısı &gt; 0.15 → VOLATILE</li>
 *   <li>eğim &gt; 0.5 → IMPROVING, eğim &lt; -0.5 → DECLINING</li>
 * </ul>
 * Düşüş eğilimindeki platform ve taşıyıcılar gerileme olarak işaretlenir.
 */
@Service
public class TrendAnalyzer implements ITrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    private static final DateTimeFormatter REPORT_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    // ── Eğilim eşikleri ──
    private static final int MIN_TREND_POINTS = 3;
    private static final double VOLATILITY_THRESHOLD = 0.15;
    private static final double SLOPE_THRESHOLD = 0.5;

    // ── Gözlem ve öneri eşikleri ──
    private static final double URGENT_PLATFORM_RATE = 75.0;
    private static final double STABLE_PLATFORM_RATE = 85.0;
    private static final double STABLE_PLATFORM_SHARE = 0.8;
    private static final double STABLE_CARRIER_RATE = 90.0;
    private static final int STABLE_CARRIER_INSIGHT_COUNT = 5;
    private static final double HIGH_PLATFORM_VARIANCE = 20.0;
    private static final int MIN_RELIABLE_RUNS = 5;
    private static final double LOW_TEST_FREQUENCY = 0.2;
    private static final double HIGH_TEST_FREQUENCY = 2.0;
    private static final int MAX_RECOMMENDATIONS = 8;
    private static final int MAX_VOLATILE_CARRIERS_LISTED = 3;

    static final String OVERALL_SURVIVAL = "overall_survival_rate";
    static final String CRITICAL_CARRIER_SUCCESS = "critical_carrier_success";
    static final String RELIABILITY_SCORE = "reliability_score";
    static final String PLATFORM_VARIANCE = "platform_variance";
    private static final List<String> OVERALL_METRICS =
            List.of(OVERALL_SURVIVAL, CRITICAL_CARRIER_SUCCESS, RELIABILITY_SCORE, PLATFORM_VARIANCE);

    private final RoundTripProperties properties;
    private final ReentrantLock historyLock = new ReentrantLock();
    private final Deque<CompatibilityReport> history = new ArrayDeque<>();

    public TrendAnalyzer(RoundTripProperties properties) {
        this.properties = properties;
    }

    // ── Geçmiş ──────────────────────────────────────────────────────

    @Override
    public void record(CompatibilityReport report) {
        if (report == null || report.generatedAt() == null) {
            log.warn("Zaman bilgisi olmayan uyumluluk raporu geçmişe eklenmedi");
            return;
        }
        int limit = properties.getTrend().getMaxHistory();
        historyLock.lock();
        try {
            history.addLast(report);
            while (history.size() > limit) {
                CompatibilityReport dropped = history.removeFirst();
                log.debug("Geçmiş dolu, en eski rapor düşürüldü: {}", dropped.reportId());
            }
        } finally {
            historyLock.unlock();
        }
        log.debug("Uyumluluk raporu geçmişe eklendi: {}", report.reportId());
    }

    @Override
    public List<CompatibilityReport> history() {
        historyLock.lock();
        try {
            return List.copyOf(history);
        } finally {
            historyLock.unlock();
        }
    }

    @Override
    public int clearHistory() {
        historyLock.lock();
        try {
            int removed = history.size();
            history.clear();
            log.info("Eğilim geçmişi temizlendi: {} rapor silindi", removed);
            return removed;
        } finally {
            historyLock.unlock();
        }
    }

    // ── Analiz ──────────────────────────────────────────────────────

    @Override
    public TrendAnalysisReport analyzeTrends(Integer analysisDays) {
        List<CompatibilityReport> snapshot = history();
        if (snapshot.isEmpty()) {
            throw new IllegalArgumentException("Eğilim analizi için kayıtlı uyumluluk raporu yok");
        }
        return analyzeTrends(snapshot, analysisDays);
    }

    @Override
    public TrendAnalysisReport analyzeTrends(List<CompatibilityReport> reports, Integer analysisDays) {
        List<CompatibilityReport> sorted = reports == null ? List.of() : reports.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.generatedAt() != null)
                .sorted(Comparator.comparing(CompatibilityReport::generatedAt))
                .toList();
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("Eğilim analizi için en az bir uyumluluk raporu gerekli");
        }
        int days = analysisDays != null ? analysisDays : properties.getTrend().getAnalysisWindowDays();
        if (days < 1) {
            throw new IllegalArgumentException("Analiz penceresi en az 1 gün olmalı (verilen: " + days + ")");
        }

        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofDays(days));
        List<CompatibilityReport> window = sorted.stream()
                .filter(r -> !r.generatedAt().isBefore(cutoff))
                .toList();
        if (window.isEmpty()) {
            log.debug("{} günlük pencerede rapor yok, tüm {} rapor kullanılıyor", days, sorted.size());
            window = sorted;
        }

        Map<String, PlatformTrend> platformTrends = platformTrends(window);
        Map<CarrierKind, CarrierTrend> carrierTrends = carrierTrends(window);
        Map<String, TrendMetric> overall = overallTrends(window);
        Instant start = window.get(0).generatedAt();
        Instant end = window.get(window.size() - 1).generatedAt();

        var report = new TrendAnalysisReport(
                "trend_analysis_" + REPORT_ID_FORMAT.format(now),
                now,
                start,
                end,
                window.size(),
                platformTrends,
                carrierTrends,
                overall,
                regressions(platformTrends, carrierTrends, overall),
                insights(platformTrends, carrierTrends, overall, window.size(), start, end),
                recommendations(platformTrends, carrierTrends, overall, window.size()),
                risks(platformTrends, carrierTrends));

        log.info("Eğilim analizi: {} rapor, platform={}, taşıyıcı={}, gerileme={}",
                window.size(), platformTrends.size(), carrierTrends.size(), report.regressions().size());
        return report;
    }

    private static Map<String, PlatformTrend> platformTrends(List<CompatibilityReport> reports) {
        var series = new LinkedHashMap<String, PlatformSeries>();
        for (CompatibilityReport report : reports) {
            if (report.platformResults() == null) {
                continue;
            }
            for (PlatformCompatibility platform : report.platformResults()) {
                String key = platformKey(platform);
                PlatformSeries data = series.computeIfAbsent(key, k -> new PlatformSeries(platform));
                data.survival.add(platform.survivalRate());
                data.criticalFailures.add((double) platform.criticalFailures().size());
                data.carrierSuccess.add(carrierSuccessOn(report, platform));
                data.testCounts.add((double) platform.totalCarriers());
                data.timestamps.add(report.generatedAt());
            }
        }
        var trends = new LinkedHashMap<String, PlatformTrend>();
        series.forEach((key, data) -> trends.put(key, new PlatformTrend(
                data.source.platform(),
                data.source.documentType(),
                metric("survival_rate", data.survival, data.timestamps),
                metric("critical_failures", data.criticalFailures, data.timestamps),
                metric("carrier_success_rate", data.carrierSuccess, data.timestamps),
                metric("test_count", data.testCounts, data.timestamps))));
        return Collections.unmodifiableMap(trends);
    }

    static String platformKey(PlatformCompatibility platform) {
        return platform.platform() + "_" + (platform.documentType() == null ? "ALL" : platform.documentType());
    }

    private static double carrierSuccessOn(CompatibilityReport report, PlatformCompatibility platform) {
        if (report.carrierResults() == null) {
            return 0.0;
        }
        return report.carrierResults().values().stream()
                .filter(c -> c.platformResults().containsKey(platform.platform()))
                .mapToDouble(CarrierCompatibility::successRate)
                .average()
                .orElse(0.0);
    }

    private static final class PlatformSeries {
        private final PlatformCompatibility source;
        private final List<Double> survival = new ArrayList<>();
        private final List<Double> criticalFailures = new ArrayList<>();
        private final List<Double> carrierSuccess = new ArrayList<>();
        private final List<Double> testCounts = new ArrayList<>();
        private final List<Instant> timestamps = new ArrayList<>();

        private PlatformSeries(PlatformCompatibility source) {
            this.source = source;
        }
    }

    /**
     * Yalnızca en az bir raporda test edilmiş taşıyıcı türleri izlenir; test edilmediği raporlar seriye girmez.
     */
    private static Map<CarrierKind, CarrierTrend> carrierTrends(List<CompatibilityReport> reports) {
        var success = new EnumMap<CarrierKind, List<Double>>(CarrierKind.class);
        var crossPlatform = new EnumMap<CarrierKind, List<Double>>(CarrierKind.class);
        var failures = new EnumMap<CarrierKind, List<Double>>(CarrierKind.class);
        var timestamps = new EnumMap<CarrierKind, List<Instant>>(CarrierKind.class);

        for (CompatibilityReport report : reports) {
            if (report.carrierResults() == null) {
                continue;
            }
            report.carrierResults().forEach((kind, stats) -> {
                if (stats.totalTests() == 0) {
                    return;
                }
                long passing = stats.platformResults().values().stream().filter(Boolean::booleanValue).count();
                double crossRate = stats.platformResults().isEmpty()
                        ? 0.0 : 100.0 * passing / stats.platformResults().size();
                success.computeIfAbsent(kind, k -> new ArrayList<>()).add(stats.successRate());
                crossPlatform.computeIfAbsent(kind, k -> new ArrayList<>()).add(crossRate);
                failures.computeIfAbsent(kind, k -> new ArrayList<>())
                        .add((double) (stats.totalTests() - stats.successfulTests()));
                timestamps.computeIfAbsent(kind, k -> new ArrayList<>()).add(report.generatedAt());
            });
        }

        var trends = new EnumMap<CarrierKind, CarrierTrend>(CarrierKind.class);
        success.forEach((kind, values) -> trends.put(kind, new CarrierTrend(
                kind,
                metric("success_rate", values, timestamps.get(kind)),
                metric("cross_platform_compatibility", crossPlatform.get(kind), timestamps.get(kind)),
                metric("failure_frequency", failures.get(kind), timestamps.get(kind)))));
        return Collections.unmodifiableMap(trends);
    }

    private static Map<String, TrendMetric> overallTrends(List<CompatibilityReport> reports) {
        var timestamps = reports.stream().map(CompatibilityReport::generatedAt).toList();
        var trends = new LinkedHashMap<String, TrendMetric>();
        for (String name : OVERALL_METRICS) {
            List<Double> values = reports.stream()
                    .map(r -> overallValue(r, name))
                    .toList();
            trends.put(name, metric(name, values, timestamps));
        }
        return Collections.unmodifiableMap(trends);
    }

    private static double overallValue(CompatibilityReport report, String name) {
        Double value = report.overallMetrics() == null ? null : report.overallMetrics().get(name);
        return value == null ? 0.0 : value;
    }

    // ── Metrik hesapları ────────────────────────────────────────────

    static TrendMetric metric(String name, List<Double> values, List<Instant> timestamps) {
        return new TrendMetric(name, values, timestamps,
                values.isEmpty() ? null : values.get(values.size() - 1),
                direction(values),
                changeRate(values));
    }

    static TrendDirection direction(List<Double> values) {
        int n = values.size();
        if (n < MIN_TREND_POINTS) {
            return TrendDirection.STABLE;
        }
        double xMean = (n - 1) / 2.0;
        double yMean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double numerator = 0.0;
        double denominator = 0.0;
        double squares = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            double dy = values.get(i) - yMean;
            numerator += dx * dy;
            denominator += dx * dx;
            squares += dy * dy;
        }
        double slope = numerator / denominator;
        // örneklem standart sapması (n - 1)
        double coefficientOfVariation = yMean > 0 ? Math.sqrt(squares / (n - 1)) / yMean : 0.0;

        if (coefficientOfVariation > VOLATILITY_THRESHOLD) {
            return TrendDirection.VOLATILE;
        }
        if (slope > SLOPE_THRESHOLD) {
            return TrendDirection.IMPROVING;
        }
        if (slope < -SLOPE_THRESHOLD) {
            return TrendDirection.DECLINING;
        }
        return TrendDirection.STABLE;
    }

    /**
     * İlk ve son değer arasındaki yüzde değişim. İlk değer 0 iken artış tanımsızdır, {@code null} döner.
     */
    static Double changeRate(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double first = values.get(0);
        double last = values.get(values.size() - 1);
        if (first == 0.0) {
            return last > 0.0 ? null : 0.0;
        }
        return (last - first) / first * 100.0;
    }

    // ── Gerilemeler, gözlemler, öneriler ────────────────────────────

    private static List<String> regressions(Map<String, PlatformTrend> platforms,
                                            Map<CarrierKind, CarrierTrend> carriers,
                                            Map<String, TrendMetric> overall) {
        var regressions = new ArrayList<String>();
        if (overall.get(OVERALL_SURVIVAL).direction() == TrendDirection.DECLINING) {
            regressions.add(OVERALL_SURVIVAL);
        }
        platforms.forEach((key, trend) -> {
            if (trend.survivalRate().direction() == TrendDirection.DECLINING) {
                regressions.add(key);
            }
        });
        carriers.forEach((kind, trend) -> {
            if (trend.successRate().direction() == TrendDirection.DECLINING) {
                regressions.add(carrierKey(kind));
            }
        });
        return List.copyOf(regressions);
    }

    private static List<String> insights(Map<String, PlatformTrend> platforms,
                                         Map<CarrierKind, CarrierTrend> carriers,
                                         Map<String, TrendMetric> overall,
                                         int runs, Instant start, Instant end) {
        var insights = new ArrayList<String>();

        TrendMetric survival = overall.get(OVERALL_SURVIVAL);
        double current = valueOrZero(survival);
        switch (survival.direction()) {
            case IMPROVING -> insights.add(String.format(Locale.ROOT,
                    "System compatibility is improving: %s change, current rate %.1f%%",
                    formatChange(survival.changeRate()), current));
            case DECLINING -> insights.add(String.format(Locale.ROOT,
                    "System compatibility is declining: %s change, current rate %.1f%%",
                    formatChange(survival.changeRate()), current));
            case VOLATILE -> insights.add(String.format(Locale.ROOT,
                    "System compatibility shows high volatility: current rate %.1f%%", current));
            default -> {
            }
        }

        List<String> declining = platformsWith(platforms, TrendDirection.DECLINING);
        List<String> improving = platformsWith(platforms, TrendDirection.IMPROVING);
        if (!declining.isEmpty()) {
            insights.add("Platforms showing declining compatibility: " + String.join(", ", declining));
        }
        if (!improving.isEmpty()) {
            insights.add("Platforms showing improved compatibility: " + String.join(", ", improving));
        }

        var problematic = new ArrayList<String>();
        int stable = 0;
        for (CarrierTrend trend : carriers.values()) {
            TrendDirection direction = trend.successRate().direction();
            if (direction == TrendDirection.DECLINING) {
                problematic.add(trend.carrierKind().name());
            } else if (direction == TrendDirection.STABLE && valueOrZero(trend.successRate()) >= STABLE_CARRIER_RATE) {
                stable++;
            }
        }
        if (!problematic.isEmpty()) {
            insights.add("Design token carriers with declining reliability: " + String.join(", ", problematic));
        }
        if (stable >= STABLE_CARRIER_INSIGHT_COUNT) {
            insights.add(String.format(Locale.ROOT,
                    "Strong stability in core design tokens: %d carriers maintaining >90%% success", stable));
        }

        long days = Duration.between(start, end).toDays();
        if (days > 0) {
            double frequency = (double) runs / days;
            if (frequency < LOW_TEST_FREQUENCY) {
                insights.add(String.format(Locale.ROOT,
                        "Low test frequency detected: %.2f tests/day over %d days", frequency, days));
            } else if (frequency > HIGH_TEST_FREQUENCY) {
                insights.add(String.format(Locale.ROOT,
                        "High test frequency: %.1f tests/day indicating active development", frequency));
            }
        }
        return List.copyOf(insights);
    }

    private static List<String> recommendations(Map<String, PlatformTrend> platforms,
                                                Map<CarrierKind, CarrierTrend> carriers,
                                                Map<String, TrendMetric> overall,
                                                int runs) {
        var recommendations = new ArrayList<String>();

        var urgent = new ArrayList<String>();
        platforms.forEach((key, trend) -> {
            if (trend.survivalRate().direction() == TrendDirection.DECLINING
                    && valueOrZero(trend.survivalRate()) < URGENT_PLATFORM_RATE) {
                urgent.add(key);
            }
        });
        if (!urgent.isEmpty()) {
            recommendations.add("URGENT: Address critical compatibility regression on " + String.join(", ", urgent));
        }

        List<String> volatileCarriers = carriers.values().stream()
                .filter(t -> t.successRate().direction() == TrendDirection.VOLATILE)
                .map(t -> t.carrierKind().name())
                .limit(MAX_VOLATILE_CARRIERS_LISTED)
                .toList();
        if (!volatileCarriers.isEmpty()) {
            recommendations.add("Investigate volatile design token carriers for root cause: "
                    + String.join(", ", volatileCarriers));
        }

        if (valueOrZero(overall.get(PLATFORM_VARIANCE)) > HIGH_PLATFORM_VARIANCE) {
            recommendations.add("High platform variance detected - consider platform-specific optimization strategies");
        }

        if (runs < MIN_RELIABLE_RUNS) {
            recommendations.add("Insufficient test data for reliable trend analysis - increase test frequency");
        }

        long stablePlatforms = platforms.values().stream()
                .filter(t -> t.survivalRate().direction() == TrendDirection.STABLE
                        && valueOrZero(t.survivalRate()) >= STABLE_PLATFORM_RATE)
                .count();
        if (!platforms.isEmpty() && stablePlatforms >= platforms.size() * STABLE_PLATFORM_SHARE) {
            recommendations.add("Strong platform stability achieved - consider expanding test coverage to new scenarios");
        }

        return List.copyOf(recommendations.subList(0, Math.min(MAX_RECOMMENDATIONS, recommendations.size())));
    }

    private static Map<String, RiskLevel> risks(Map<String, PlatformTrend> platforms,
                                                Map<CarrierKind, CarrierTrend> carriers) {
        var risks = new LinkedHashMap<String, RiskLevel>();
        platforms.forEach((key, trend) -> risks.put(key, riskOf(trend.survivalRate(), 60.0, 75.0)));
        carriers.forEach((kind, trend) -> risks.put(carrierKey(kind), riskOf(trend.successRate(), 70.0, 85.0)));
        return Collections.unmodifiableMap(risks);
    }

    static RiskLevel riskOf(TrendMetric metric, double criticalBelow, double highBelow) {
        double current = valueOrZero(metric);
        if (current < criticalBelow) {
            return RiskLevel.CRITICAL;
        }
        if (current < highBelow || metric.direction() == TrendDirection.DECLINING) {
            return RiskLevel.HIGH;
        }
        if (metric.direction() == TrendDirection.VOLATILE) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static List<String> platformsWith(Map<String, PlatformTrend> platforms, TrendDirection direction) {
        return platforms.entrySet().stream()
                .filter(e -> e.getValue().survivalRate().direction() == direction)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String carrierKey(CarrierKind kind) {
        return "carrier_" + kind;
    }

    private static double valueOrZero(TrendMetric metric) {
        return metric == null || metric.currentValue() == null ? 0.0 : metric.currentValue();
    }

    private static String formatChange(Double changeRate) {
        return changeRate == null ? "n/a" : String.format(Locale.ROOT, "%+.1f%%", changeRate);
    }
}
