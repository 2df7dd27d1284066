package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.PlatformType;
import io.mersel.services.roundtrip.application.enums.RiskLevel;
import io.mersel.services.roundtrip.application.enums.TokenOutcome;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CarrierCompatibility;
import io.mersel.services.roundtrip.application.models.CarrierPreservationMetrics;
import io.mersel.services.roundtrip.application.models.CarrierTestResult;
import io.mersel.services.roundtrip.application.models.CompatibilityReport;
import io.mersel.services.roundtrip.application.models.PlatformTestResult;
import io.mersel.services.roundtrip.application.models.TokenChanges;
import io.mersel.services.roundtrip.application.models.TokenValueChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CompatibilityMatrixAggregator")
class CompatibilityMatrixAggregatorTest {

    private final CompatibilityMatrixAggregator aggregator = new CompatibilityMatrixAggregator(new CarrierCatalog());

    private static CarrierPreservationMetrics metrics(int total, int preserved, int modified, int lost) {
        return new CarrierPreservationMetrics(total, preserved, modified, lost, 0,
                100.0 * preserved / total, 100.0 * modified / total, 100.0 * lost / total,
                100.0 * (modified + lost) / total);
    }

    private static CarrierTestResult token(PlatformType platform, CarrierKind kind, TokenOutcome outcome) {
        return new CarrierTestResult(platform, "tokens.test", kind, outcome);
    }

    // ── Platform birleştirme ────────────────────────────────────────

    @Nested
    @DisplayName("Platform sonuçları")
    class Platforms {

        @Test
        @DisplayName("Aynı platform ve belge türü sonuçları toplanır")
        void mergesSamePlatform() {
            var first = new PlatformTestResult(PlatformType.LIBREOFFICE, DocumentType.WORD, "7.6",
                    metrics(10, 8, 1, 1), List.of("Primary brand color"));
            var second = new PlatformTestResult(PlatformType.LIBREOFFICE, DocumentType.WORD, "7.6",
                    metrics(10, 6, 2, 2), List.of("Primary brand color"));

            CompatibilityReport report = aggregator.generateMatrix(List.of(first, second), List.of(), Map.of());

            assertThat(report.platformResults()).singleElement().satisfies(p -> {
                assertThat(p.totalCarriers()).isEqualTo(20);
                assertThat(p.preservedCarriers()).isEqualTo(14);
                assertThat(p.lostCarriers()).isEqualTo(3);
                assertThat(p.survivalRate()).isEqualTo(70.0);
                assertThat(p.version()).isEqualTo("7.6");
                assertThat(p.criticalFailures()).containsExactly("Primary brand color");
            });
        }

        @Test
        @DisplayName("Metrik içermeyen sonuç sıfır değerlerle raporlanır")
        void missingMetrics() {
            var broken = new PlatformTestResult(PlatformType.WPS_OFFICE, DocumentType.SPREADSHEET, null, null, null);

            CompatibilityReport report = aggregator.generateMatrix(List.of(broken), List.of(), null);

            assertThat(report.platformResults()).singleElement().satisfies(p -> {
                assertThat(p.totalCarriers()).isZero();
                assertThat(p.survivalRate()).isZero();
                assertThat(p.criticalFailures()).containsExactly(CompatibilityMatrixAggregator.ANALYSIS_UNAVAILABLE);
            });
            assertThat(report.recommendations()).anyMatch(r -> r.startsWith("Improve WPS_OFFICE support"));
        }

        @Test
        @DisplayName("Genel metrikler ortalama, en iyi, en kötü ve güvenilirlik içerir")
        void overallMetrics() {
            var msOffice = new PlatformTestResult(PlatformType.MICROSOFT_OFFICE, DocumentType.WORD, "16",
                    metrics(10, 10, 0, 0), List.of());
            var pages = new PlatformTestResult(PlatformType.APPLE_PAGES, DocumentType.WORD, "13",
                    metrics(10, 6, 0, 4), List.of("Heading font"));

            CompatibilityReport report = aggregator.generateMatrix(List.of(msOffice, pages), List.of(), Map.of());

            assertThat(report.overallMetrics())
                    .containsEntry("overall_survival_rate", 80.0)
                    .containsEntry("best_platform_rate", 100.0)
                    .containsEntry("worst_platform_rate", 60.0)
                    .containsEntry("platform_variance", 400.0)
                    .containsEntry("reliability_score", 50.0);
            assertThat(report.summary()).startsWith("Compatibility grade: Good.");
        }

        @Test
        @DisplayName("Girdi yoksa sıfır metrik ve olumlu öneri")
        void emptyInput() {
            CompatibilityReport report = aggregator.generateMatrix(List.of(), List.of(), Map.of("run", "nightly"));

            assertThat(report.reportId()).isNotBlank();
            assertThat(report.testConfiguration()).containsEntry("run", "nightly");
            assertThat(report.overallMetrics().values()).allMatch(v -> v == 0.0);
            assertThat(report.recommendations())
                    .containsExactly("Compatibility looks good across all tested platforms and carriers.");
            assertThat(report.riskAssessment()).containsOnlyKeys(CarrierKind.values());
            assertThat(report.riskAssessment().values()).allMatch(r -> r == RiskLevel.HIGH);
        }
    }

    // ── Taşıyıcı türleri ────────────────────────────────────────────

    @Nested
    @DisplayName("Taşıyıcı türü sonuçları")
    class Carriers {

        @Test
        @DisplayName("Her taşıyıcı türü raporda yer alır")
        void everyKindPresent() {
            CompatibilityReport report = aggregator.generateMatrix(List.of(),
                    List.of(token(PlatformType.LIBREOFFICE, CarrierKind.COLOR_SCHEME, TokenOutcome.PRESERVED)),
                    Map.of());

            assertThat(report.carrierResults()).containsOnlyKeys(CarrierKind.values());
            assertThat(report.carrierResults().get(CarrierKind.TABLE_STYLE).totalTests()).isZero();
            assertThat(report.carrierResults().get(CarrierKind.COLOR_SCHEME).category())
                    .isEqualTo(CarrierSignificance.CRITICAL);
            assertThat(report.carrierResults().get(CarrierKind.CELL_STYLE).category())
                    .isEqualTo(CarrierSignificance.MODERATE);
        }

        @Test
        @DisplayName("Değişen token başarılı, kaybolan başarısız sayılır")
        void successCounting() {
            CompatibilityReport report = aggregator.generateMatrix(List.of(), List.of(
                    token(PlatformType.LIBREOFFICE, CarrierKind.FONT_SCHEME, TokenOutcome.PRESERVED),
                    token(PlatformType.LIBREOFFICE, CarrierKind.FONT_SCHEME, TokenOutcome.MODIFIED),
                    token(PlatformType.GOOGLE_WORKSPACE, CarrierKind.FONT_SCHEME, TokenOutcome.LOST)), Map.of());

            CarrierCompatibility fonts = report.carrierResults().get(CarrierKind.FONT_SCHEME);
            assertThat(fonts.successfulTests()).isEqualTo(2);
            assertThat(fonts.platformResults())
                    .containsEntry(PlatformType.LIBREOFFICE, true)
                    .containsEntry(PlatformType.GOOGLE_WORKSPACE, false);
            assertThat(fonts.commonFailures()).containsExactly("Lost on GOOGLE_WORKSPACE");
            assertThat(report.riskAssessment()).containsEntry(CarrierKind.FONT_SCHEME, RiskLevel.HIGH);
            assertThat(report.recommendations())
                    .anyMatch(r -> r.startsWith("CRITICAL: Fix FONT_SCHEME preservation"));
        }

        @Test
        @DisplayName("Eklenen token başarı hesabına girmez ve kayıp sayılmaz")
        void gainedTokenIsNotCountedAsLost() {
            CompatibilityReport report = aggregator.generateMatrix(List.of(), List.of(
                    token(PlatformType.LIBREOFFICE, CarrierKind.COLOR_SCHEME, TokenOutcome.PRESERVED),
                    token(PlatformType.LIBREOFFICE, CarrierKind.COLOR_SCHEME, TokenOutcome.GAINED)), Map.of());

            CarrierCompatibility colors = report.carrierResults().get(CarrierKind.COLOR_SCHEME);
            assertThat(colors.totalTests()).isEqualTo(1);
            assertThat(colors.successfulTests()).isEqualTo(1);
            assertThat(colors.successRate()).isEqualTo(100.0);
            assertThat(colors.platformResults()).containsExactly(Map.entry(PlatformType.LIBREOFFICE, true));
            assertThat(colors.commonFailures()).isEmpty();
            assertThat(report.overallMetrics()).containsEntry("critical_carrier_success", 100.0);
            assertThat(report.recommendations()).noneMatch(r -> r.startsWith("CRITICAL:"));
        }

        @Test
        @DisplayName("Yalnızca eklenen token'ı olan tür test edilmemiş sayılır")
        void gainedOnlyKind() {
            CompatibilityReport report = aggregator.generateMatrix(List.of(),
                    List.of(token(PlatformType.WPS_OFFICE, CarrierKind.LIST_STYLE, TokenOutcome.GAINED)), Map.of());

            CarrierCompatibility lists = report.carrierResults().get(CarrierKind.LIST_STYLE);
            assertThat(lists.totalTests()).isZero();
            assertThat(lists.platformResults()).isEmpty();
            assertThat(lists.commonFailures()).isEmpty();
        }

        @Test
        @DisplayName("Tür belirtilmemişse token yolundan çözülür")
        void resolvesKindFromTokenPath() {
            var undeclared = new CarrierTestResult(PlatformType.LIBREOFFICE, "tokens.spacing.custom.gap",
                    null, TokenOutcome.PRESERVED);

            CompatibilityReport report = aggregator.generateMatrix(List.of(), List.of(undeclared), Map.of());

            assertThat(report.carrierResults().get(CarrierKind.PARAGRAPH_STYLE).totalTests()).isEqualTo(1);
        }
    }

    // ── Risk ve not ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Risk seviyesi")
    class Risk {

        private CarrierCompatibility stats(double successRate, Map<PlatformType, Boolean> platforms) {
            return new CarrierCompatibility(CarrierKind.TABLE_STYLE, CarrierSignificance.IMPORTANT, 10,
                    (int) (successRate / 10), successRate, platforms, List.of());
        }

        @Test
        @DisplayName("Yüksek başarı ve tüm platformlar → LOW")
        void low() {
            assertThat(CompatibilityMatrixAggregator.riskOf(stats(95.0,
                    Map.of(PlatformType.LIBREOFFICE, true, PlatformType.WPS_OFFICE, true))))
                    .isEqualTo(RiskLevel.LOW);
        }

        @Test
        @DisplayName("Orta başarı ve platformların çoğu → MEDIUM")
        void medium() {
            assertThat(CompatibilityMatrixAggregator.riskOf(stats(80.0, Map.of(
                    PlatformType.LIBREOFFICE, true,
                    PlatformType.WPS_OFFICE, true,
                    PlatformType.MICROSOFT_OFFICE, true,
                    PlatformType.APPLE_PAGES, false))))
                    .isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("Düşük başarı → HIGH")
        void high() {
            assertThat(CompatibilityMatrixAggregator.riskOf(stats(60.0, Map.of(PlatformType.LIBREOFFICE, true))))
                    .isEqualTo(RiskLevel.HIGH);
        }

        @Test
        @DisplayName("Not sınırları")
        void grades() {
            assertThat(CompatibilityMatrixAggregator.grade(90.0)).isEqualTo("Excellent");
            assertThat(CompatibilityMatrixAggregator.grade(75.0)).isEqualTo("Good");
            assertThat(CompatibilityMatrixAggregator.grade(60.0)).isEqualTo("Fair");
            assertThat(CompatibilityMatrixAggregator.grade(59.9)).isEqualTo("Poor");
        }
    }

    @Test
    @DisplayName("Karşılaştırma token sonuçlarına dönüştürülür")
    void toCarrierResults() {
        var changes = new TokenChanges(
                Map.of("tokens.color.primary", "4472C4"),
                Map.of("tokens.typography.fontFamily.heading", new TokenValueChange("Calibri Light", "Carlito")),
                Map.of("tokens.table.header.fill", "D9E2F3"),
                Map.of("tokens.color.accent1", "ED7D31"));
        var comparison = new CarrierComparison(null, null, null, changes);

        List<CarrierTestResult> results = aggregator.toCarrierResults(PlatformType.LIBREOFFICE, comparison);

        assertThat(results).hasSize(4).allMatch(r -> r.platform() == PlatformType.LIBREOFFICE);
        assertThat(results).extracting(CarrierTestResult::outcome)
                .containsExactly(TokenOutcome.PRESERVED, TokenOutcome.MODIFIED, TokenOutcome.LOST, TokenOutcome.GAINED);

        CompatibilityReport report = aggregator.generateMatrix(List.of(), results, Map.of());
        assertThat(report.carrierResults().values())
                .flatExtracting(CarrierCompatibility::commonFailures)
                .containsExactly("Lost on LIBREOFFICE");
        assertThat(results).extracting(CarrierTestResult::carrierKind)
                .doesNotContainNull();
        assertThat(aggregator.toCarrierResults(PlatformType.LIBREOFFICE, null)).isEmpty();
    }
}
