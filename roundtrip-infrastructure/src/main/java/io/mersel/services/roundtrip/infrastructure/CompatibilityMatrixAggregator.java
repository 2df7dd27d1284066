package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.PlatformType;
import io.mersel.services.roundtrip.application.enums.RiskLevel;
import io.mersel.services.roundtrip.application.enums.TokenOutcome;
import io.mersel.services.roundtrip.application.interfaces.ICompatibilityAggregator;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CarrierCompatibility;
import io.mersel.services.roundtrip.application.models.CarrierPreservationMetrics;
import io.mersel.services.roundtrip.application.models.CarrierTestResult;
import io.mersel.services.roundtrip.application.models.CompatibilityReport;
import io.mersel.services.roundtrip.application.models.PlatformCompatibility;
import io.mersel.services.roundtrip.application.models.PlatformTestResult;
import io.mersel.services.roundtrip.application.models.TokenChanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Platform ve taşıyıcı sonuçlarını uyumluluk raporunda birleştirir.
 * <p>
 * Her çağrı yalnızca kendi girdileri üzerinde çalışır; paylaşılan durum tutulmaz.
 * Eksik veya hatalı tek bir girdi rapordan düşülmez, sıfır değerlerle raporlanır.
 */
@Service
public class CompatibilityMatrixAggregator implements ICompatibilityAggregator {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityMatrixAggregator.class);

    static final String ANALYSIS_UNAVAILABLE = "analysis-unavailable";

    // ── Eşikler ──
    private static final double PLATFORM_RECOMMENDATION_THRESHOLD = 70.0;
    private static final double CARRIER_RECOMMENDATION_THRESHOLD = 50.0;
    private static final double CRITICAL_CARRIER_THRESHOLD = 80.0;
    private static final double LOW_RISK_SUCCESS = 90.0;
    private static final double MEDIUM_RISK_SUCCESS = 75.0;
    private static final double MEDIUM_RISK_PLATFORM_SHARE = 0.7;

    private static final Map<CarrierKind, CarrierSignificance> KIND_CATEGORIES = new EnumMap<>(Map.of(
            CarrierKind.COLOR_SCHEME, CarrierSignificance.CRITICAL,
            CarrierKind.FONT_SCHEME, CarrierSignificance.CRITICAL,
            CarrierKind.LAYOUT_MASTER, CarrierSignificance.CRITICAL,
            CarrierKind.PARAGRAPH_STYLE, CarrierSignificance.IMPORTANT,
            CarrierKind.CHARACTER_STYLE, CarrierSignificance.IMPORTANT,
            CarrierKind.TABLE_STYLE, CarrierSignificance.IMPORTANT,
            CarrierKind.LIST_STYLE, CarrierSignificance.IMPORTANT));

    private final CarrierCatalog catalog;

    public CompatibilityMatrixAggregator(CarrierCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public CompatibilityReport generateMatrix(List<PlatformTestResult> platformResults,
                                              List<CarrierTestResult> carrierResults,
                                              Map<String, String> configuration) {
        List<PlatformTestResult> platforms = platformResults == null ? List.of()
                : platformResults.stream().filter(Objects::nonNull).filter(r -> r.platform() != null).toList();
        List<CarrierTestResult> carriers = carrierResults == null ? List.of()
                : carrierResults.stream().filter(Objects::nonNull).filter(r -> r.platform() != null).toList();

        List<PlatformCompatibility> platformStats = aggregatePlatforms(platforms);
        Map<CarrierKind, CarrierCompatibility> carrierStats = aggregateCarriers(carriers);
        Map<String, Double> overall = overallMetrics(platformStats, carrierStats);
        Map<CarrierKind, RiskLevel> risks = assessRisks(carrierStats);

        var report = new CompatibilityReport(
                UUID.randomUUID().toString(),
                Instant.now(),
                configuration == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(configuration)),
                platformStats,
                carrierStats,
                overall,
                risks,
                summary(platformStats, carriers.size(), overall),
                recommendations(platformStats, carrierStats));

        log.debug("Uyumluluk raporu üretildi: {} (platform={}, token sonucu={})",
                report.reportId(), platformStats.size(), carriers.size());
        return report;
    }

    // ── Platformlar ─────────────────────────────────────────────────

    private List<PlatformCompatibility> aggregatePlatforms(List<PlatformTestResult> results) {
        var groups = new LinkedHashMap<PlatformKey, List<PlatformTestResult>>();
        for (PlatformTestResult result : results) {
            groups.computeIfAbsent(new PlatformKey(result.platform(), result.documentType()), k -> new ArrayList<>())
                    .add(result);
        }

        var stats = new ArrayList<PlatformCompatibility>();
        groups.forEach((key, group) -> {
            int total = 0;
            int preserved = 0;
            int modified = 0;
            int lost = 0;
            var failures = new LinkedHashSet<String>();
            String version = null;
            for (PlatformTestResult result : group) {
                if (version == null) {
                    version = result.platformVersion();
                }
                CarrierPreservationMetrics metrics = result.carrierMetrics();
                if (metrics == null) {
                    failures.add(ANALYSIS_UNAVAILABLE);
                    log.warn("Platform sonucu metrik içermiyor: {} / {}", key.platform(), key.documentType());
                } else {
                    total += metrics.totalOriginalTokens();
                    preserved += metrics.preservedTokens();
                    modified += metrics.modifiedTokens();
                    lost += metrics.lostTokens();
                }
                failures.addAll(result.criticalFailures());
            }
            stats.add(new PlatformCompatibility(key.platform(), key.documentType(), version,
                    total, preserved, modified, lost, percentage(preserved, total), List.copyOf(failures)));
        });
        return List.copyOf(stats);
    }

    private record PlatformKey(PlatformType platform, DocumentType documentType) {
    }

    // ── Taşıyıcı türleri ────────────────────────────────────────────

    private Map<CarrierKind, CarrierCompatibility> aggregateCarriers(List<CarrierTestResult> results) {
        var byKind = new EnumMap<CarrierKind, List<CarrierTestResult>>(CarrierKind.class);
        for (CarrierKind kind : CarrierKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
        for (CarrierTestResult result : results) {
            byKind.get(resolveKind(result.carrierKind(), result.tokenPath())).add(result);
        }

        var stats = new EnumMap<CarrierKind, CarrierCompatibility>(CarrierKind.class);
        byKind.forEach((kind, tests) -> {
            int scored = 0;
            int successful = 0;
            var platformPass = new EnumMap<PlatformType, Boolean>(PlatformType.class);
            var failures = new LinkedHashSet<String>();
            for (CarrierTestResult test : tests) {
                // Dönüşümde eklenen token'lar korunma oranına girmez
                if (test.outcome() == TokenOutcome.GAINED) {
                    continue;
                }
                scored++;
                boolean success = isSuccess(test.outcome());
                if (success) {
                    successful++;
                } else {
                    failures.add("Lost on " + test.platform());
                }
                platformPass.merge(test.platform(), success, Boolean::logicalAnd);
            }
            stats.put(kind, new CarrierCompatibility(kind, categoryOf(kind), scored, successful,
                    percentage(successful, scored), Collections.unmodifiableMap(platformPass),
                    List.copyOf(failures)));
        });
        return Collections.unmodifiableMap(stats);
    }

    private static boolean isSuccess(TokenOutcome outcome) {
        return outcome == TokenOutcome.PRESERVED || outcome == TokenOutcome.MODIFIED;
    }

    static CarrierSignificance categoryOf(CarrierKind kind) {
        return KIND_CATEGORIES.getOrDefault(kind, CarrierSignificance.MODERATE);
    }

    // ── Genel metrikler ─────────────────────────────────────────────

    private static Map<String, Double> overallMetrics(List<PlatformCompatibility> platforms,
                                                      Map<CarrierKind, CarrierCompatibility> carriers) {
        var metrics = new LinkedHashMap<String, Double>();
        if (!platforms.isEmpty()) {
            double mean = platforms.stream().mapToDouble(PlatformCompatibility::survivalRate).average().orElse(0.0);
            double variance = platforms.stream()
                    .mapToDouble(p -> (p.survivalRate() - mean) * (p.survivalRate() - mean))
                    .average().orElse(0.0);
            long reliable = platforms.stream().filter(p -> p.criticalFailures().isEmpty()).count();
            metrics.put("overall_survival_rate", mean);
            metrics.put("best_platform_rate",
                    platforms.stream().mapToDouble(PlatformCompatibility::survivalRate).max().orElse(0.0));
            metrics.put("worst_platform_rate",
                    platforms.stream().mapToDouble(PlatformCompatibility::survivalRate).min().orElse(0.0));
            metrics.put("platform_variance", variance);
            metrics.put("reliability_score", 100.0 * reliable / platforms.size());
        } else {
            metrics.put("overall_survival_rate", 0.0);
            metrics.put("best_platform_rate", 0.0);
            metrics.put("worst_platform_rate", 0.0);
            metrics.put("platform_variance", 0.0);
            metrics.put("reliability_score", 0.0);
        }

        int criticalTests = 0;
        int criticalSuccess = 0;
        int allTests = 0;
        int allSuccess = 0;
        for (CarrierCompatibility stats : carriers.values()) {
            allTests += stats.totalTests();
            allSuccess += stats.successfulTests();
            if (stats.category() == CarrierSignificance.CRITICAL) {
                criticalTests += stats.totalTests();
                criticalSuccess += stats.successfulTests();
            }
        }
        metrics.put("critical_carrier_success", percentage(criticalSuccess, criticalTests));
        metrics.put("overall_carrier_success", percentage(allSuccess, allTests));
        return Collections.unmodifiableMap(metrics);
    }

    private static Map<CarrierKind, RiskLevel> assessRisks(Map<CarrierKind, CarrierCompatibility> carriers) {
        var risks = new EnumMap<CarrierKind, RiskLevel>(CarrierKind.class);
        carriers.forEach((kind, stats) -> risks.put(kind, riskOf(stats)));
        return Collections.unmodifiableMap(risks);
    }

    static RiskLevel riskOf(CarrierCompatibility stats) {
        if (stats.totalTests() == 0) {
            return RiskLevel.HIGH;
        }
        long passing = stats.platformResults().values().stream().filter(Boolean::booleanValue).count();
        double passShare = stats.platformResults().isEmpty() ? 0.0 : (double) passing / stats.platformResults().size();
        if (stats.successRate() >= LOW_RISK_SUCCESS && passShare == 1.0) {
            return RiskLevel.LOW;
        }
        if (stats.successRate() >= MEDIUM_RISK_SUCCESS && passShare >= MEDIUM_RISK_PLATFORM_SHARE) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    // ── Özet ve öneriler ────────────────────────────────────────────

    private static String summary(List<PlatformCompatibility> platforms, int carrierTestCount,
                                  Map<String, Double> overall) {
        double survival = overall.get("overall_survival_rate");
        return String.format(Locale.ROOT,
                "Compatibility grade: %s. Tested %d platform/document combination(s) and %d token result(s). "
                        + "Overall survival %.1f%%, critical carrier success %.1f%%, reliability %.1f%%.",
                grade(survival), platforms.size(), carrierTestCount, survival,
                overall.get("critical_carrier_success"), overall.get("reliability_score"));
    }

    static String grade(double rate) {
        if (rate >= 90.0) {
            return "Excellent";
        }
        if (rate >= 75.0) {
            return "Good";
        }
        if (rate >= 60.0) {
            return "Fair";
        }
        return "Poor";
    }

    private static List<String> recommendations(List<PlatformCompatibility> platforms,
                                                Map<CarrierKind, CarrierCompatibility> carriers) {
        var recommendations = new ArrayList<String>();
        for (PlatformCompatibility platform : platforms) {
            if (platform.survivalRate() < PLATFORM_RECOMMENDATION_THRESHOLD) {
                recommendations.add(String.format(Locale.ROOT,
                        "Improve %s support for %s documents: carrier survival is %.1f%% (target %.0f%%).",
                        platform.platform(), label(platform.documentType()), platform.survivalRate(),
                        PLATFORM_RECOMMENDATION_THRESHOLD));
            }
        }
        for (CarrierCompatibility stats : carriers.values()) {
            if (stats.totalTests() == 0) {
                continue;
            }
            if (stats.successRate() < CARRIER_RECOMMENDATION_THRESHOLD) {
                recommendations.add(String.format(Locale.ROOT,
                        "Review %s carriers: only %.1f%% of tokens survived (target %.0f%%).",
                        stats.carrierKind(), stats.successRate(), CARRIER_RECOMMENDATION_THRESHOLD));
            }
            if (stats.category() == CarrierSignificance.CRITICAL && stats.successRate() < CRITICAL_CARRIER_THRESHOLD) {
                recommendations.add(String.format(Locale.ROOT,
                        "CRITICAL: Fix %s preservation, success rate %.1f%% is below %.0f%%.",
                        stats.carrierKind(), stats.successRate(), CRITICAL_CARRIER_THRESHOLD));
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Compatibility looks good across all tested platforms and carriers.");
        }
        return List.copyOf(recommendations);
    }

    private static String label(DocumentType documentType) {
        return documentType == null ? "unknown" : documentType.name().toLowerCase(Locale.ROOT);
    }

    private static double percentage(int count, int total) {
        return total == 0 ? 0.0 : 100.0 * count / total;
    }

    // ── Karşılaştırmadan token sonuçları ────────────────────────────

    @Override
    public List<CarrierTestResult> toCarrierResults(PlatformType platform, CarrierComparison comparison) {
        if (comparison == null) {
            return List.of();
        }
        TokenChanges changes = comparison.tokenChanges();
        var results = new ArrayList<CarrierTestResult>();
        changes.preserved().keySet().forEach(t -> results.add(toResult(platform, t, TokenOutcome.PRESERVED)));
        changes.modified().keySet().forEach(t -> results.add(toResult(platform, t, TokenOutcome.MODIFIED)));
        changes.lost().keySet().forEach(t -> results.add(toResult(platform, t, TokenOutcome.LOST)));
        changes.gained().keySet().forEach(t -> results.add(toResult(platform, t, TokenOutcome.GAINED)));
        return List.copyOf(results);
    }

    private CarrierTestResult toResult(PlatformType platform, String tokenPath, TokenOutcome outcome) {
        return new CarrierTestResult(platform, tokenPath, resolveKind(null, tokenPath), outcome);
    }

    CarrierKind resolveKind(CarrierKind declared, String tokenPath) {
        if (declared != null) {
            return declared;
        }
        return catalog.kindOfToken(tokenPath).orElseGet(() -> kindFromKeywords(tokenPath));
    }

    /**
     * Katalogda bulunmayan token yolları için anahtar kelime eşlemesi.
     */
    static CarrierKind kindFromKeywords(String tokenPath) {
        String path = tokenPath == null ? "" : tokenPath;
        if (path.contains("color")) {
            return CarrierKind.COLOR_SCHEME;
        }
        if (path.contains("typography.fontFamily")) {
            return CarrierKind.FONT_SCHEME;
        }
        if (path.contains("typography.fontSize") || path.contains("typography.styles")) {
            return CarrierKind.CHARACTER_STYLE;
        }
        if (path.contains("spacing")) {
            return CarrierKind.PARAGRAPH_STYLE;
        }
        if (path.contains("table")) {
            return CarrierKind.TABLE_STYLE;
        }
        if (path.contains("list")) {
            return CarrierKind.LIST_STYLE;
        }
        if (path.contains("layout")) {
            return CarrierKind.LAYOUT_MASTER;
        }
        if (path.contains("cell")) {
            return CarrierKind.CELL_STYLE;
        }
        return CarrierKind.THEME_VARIANT;
    }
}
