package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.DiffContext;
import io.mersel.services.roundtrip.application.models.DiffResult;
import io.mersel.services.roundtrip.application.models.DiffSummary;
import io.mersel.services.roundtrip.application.models.PreservationMetrics;
import io.mersel.services.roundtrip.application.models.SemanticDifference;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.mersel.services.roundtrip.infrastructure.OoxmlFixtures.W_NS;
import static io.mersel.services.roundtrip.infrastructure.OoxmlFixtures.parse;
import static io.mersel.services.roundtrip.infrastructure.OoxmlFixtures.wordDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * SemanticDiffEngine birim testleri.
 * <p>
 * Gerçek taşıyıcı kataloğu ile namespace'e duyarlı hizalama, önem seviyeleri ve
 * korunma oranı hesabını doğrular.
 */
@DisplayName("SemanticDiffEngine")
class SemanticDiffEngineTest {

    private static SemanticDiffEngine engine;

    @BeforeAll
    static void setUp() {
        engine = new SemanticDiffEngine(new CarrierCatalog());
    }

    private static DiffResult diff(String original, String converted) throws Exception {
        return engine.analyzeDifferences(parse(original, DocumentType.WORD), parse(converted, DocumentType.WORD),
                DocumentType.WORD);
    }

    // ── Eşdeğer belgeler ────────────────────────────────────────────

    @Nested
    @DisplayName("Eşdeğer belgeler")
    class Equivalent {

        @Test
        @DisplayName("Aynı belge → fark yok, korunma %100")
        void identicalDocuments() throws Exception {
            String xml = wordDocument("FF0000", "Merhaba");

            DiffResult result = diff(xml, xml);

            assertThat(result.differences()).isEmpty();
            assertThat(result.summary().totalDifferences()).isZero();
            assertThat(result.summary().preservationRate()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Farklı prefix, aynı namespace URI → fark yok")
        void prefixIndependence() throws Exception {
            String original = wordDocument("00A1", "FF0000", "24", null, "Merhaba");
            String converted = """
                    <ns0:document xmlns:ns0="%s">
                      <ns0:body>
                        <ns0:p ns0:rsidR="00A1">
                          <ns0:r>
                            <ns0:rPr><ns0:color ns0:val="FF0000"/><ns0:sz ns0:val="24"/></ns0:rPr>
                            <ns0:t>Merhaba</ns0:t>
                          </ns0:r>
                        </ns0:p>
                      </ns0:body>
                    </ns0:document>
                    """.formatted(W_NS);

            DiffResult result = diff(original, converted);

            assertThat(result.differences()).isEmpty();
        }

        @Test
        @DisplayName("Yeniden sıralanmış stiller styleId ile hizalanır")
        void identityAlignment() throws Exception {
            String original = """
                    <w:styles xmlns:w="%s">
                      <w:style w:styleId="Heading1"><w:name w:val="heading 1"/></w:style>
                      <w:style w:styleId="Normal"><w:name w:val="Normal"/></w:style>
                    </w:styles>
                    """.formatted(W_NS);
            String converted = """
                    <w:styles xmlns:w="%s">
                      <w:style w:styleId="Normal"><w:name w:val="Normal"/></w:style>
                      <w:style w:styleId="Heading1"><w:name w:val="heading 1"/></w:style>
                    </w:styles>
                    """.formatted(W_NS);

            assertThat(diff(original, converted).differences()).isEmpty();
        }

        @Test
        @DisplayName("Yalnızca revizyon kimliği değişmiş → tüm farklar IGNORABLE, korunma > %95")
        void revisionIdOnly() throws Exception {
            DiffResult result = diff(
                    wordDocument("00A1B2C3", "FF0000", "24", "Calibri", "Merhaba"),
                    wordDocument("00D4E5F6", "FF0000", "24", "Calibri", "Merhaba"));

            assertThat(result.differences()).isNotEmpty()
                    .allMatch(d -> d.severity() == DiffSeverity.IGNORABLE);
            assertThat(result.summary().criticalChanges()).isEmpty();
            assertThat(result.summary().preservationRate()).isGreaterThan(95.0);
        }
    }

    // ── Önem seviyeleri ─────────────────────────────────────────────

    @Nested
    @DisplayName("Önem seviyeleri")
    class Severities {

        @Test
        @DisplayName("Metin rengi değişimi → CRITICAL veya MAJOR, stil bağlamı")
        void colorChange() throws Exception {
            DiffResult result = diff(wordDocument("FF0000", "Merhaba"), wordDocument("0000FF", "Merhaba"));

            assertThat(result.differences()).hasSize(1);
            SemanticDifference difference = result.differences().get(0);
            assertThat(difference.category()).isEqualTo(DiffCategory.MODIFIED);
            assertThat(difference.severity().isAtLeast(DiffSeverity.MAJOR)).isTrue();
            assertThat(difference.location()).endsWith("/w:color[1]/@w:val");
            assertThat(difference.oldValue()).isEqualTo("FF0000");
            assertThat(difference.newValue()).isEqualTo("0000FF");
            assertThat(difference.context().affectsStyling()).isTrue();
        }

        @Test
        @DisplayName("Görünür metin değişimi → CRITICAL, içerik bağlamı")
        void textChange() throws Exception {
            DiffResult result = diff(wordDocument("FF0000", "Merhaba"), wordDocument("FF0000", "Hello"));

            assertThat(result.summary().criticalChanges()).hasSize(1);
            SemanticDifference difference = result.summary().criticalChanges().get(0);
            assertThat(difference.location()).endsWith("/w:t[1]/text()");
            assertThat(difference.description()).contains("Merhaba").contains("Hello");
            assertThat(difference.context().affectsContent()).isTrue();
            assertThat(result.summary().preservationRate()).isLessThan(100.0);
        }

        @Test
        @DisplayName("Metinli paragraf kaybı → DROPPED CRITICAL, korunma düşer")
        void droppedParagraph() throws Exception {
            String converted = """
                    <w:document xmlns:w="%s"><w:body/></w:document>
                    """.formatted(W_NS);

            DiffResult result = diff(wordDocument("FF0000", "Merhaba"), converted);

            assertThat(result.differences()).hasSize(1);
            assertThat(result.differences().get(0).category()).isEqualTo(DiffCategory.DROPPED);
            assertThat(result.differences().get(0).severity()).isEqualTo(DiffSeverity.CRITICAL);
            assertThat(result.differences().get(0).location()).isEqualTo("/w:document[1]/w:body[1]/w:p[1]");
            assertThat(result.summary().preservationRate()).isLessThan(50.0);
        }

        @Test
        @DisplayName("Eklenen yazım denetimi işareti → IGNORABLE")
        void addedProofingMarkIsIgnorable() throws Exception {
            String original = """
                    <w:document xmlns:w="%s"><w:body><w:p><w:r><w:t>A</w:t></w:r></w:p></w:body></w:document>
                    """.formatted(W_NS);
            String converted = """
                    <w:document xmlns:w="%s"><w:body><w:p><w:proofErr w:type="spellStart"/><w:r><w:t>A</w:t></w:r></w:p></w:body></w:document>
                    """.formatted(W_NS);

            DiffResult result = diff(original, converted);

            assertThat(result.differences()).hasSize(1);
            assertThat(result.differences().get(0).category()).isEqualTo(DiffCategory.ADDED);
            assertThat(result.differences().get(0).severity()).isEqualTo(DiffSeverity.IGNORABLE);
        }

        @Test
        @DisplayName("Belge özelliği metni değişimi → MINOR")
        void metadataChangeIsMinor() throws Exception {
            String template = """
                    <cp:coreProperties xmlns:cp="%s" xmlns:dc="%s"><dc:title>%s</dc:title></cp:coreProperties>
                    """;
            String original = template.formatted(OoxmlNamespaces.CP, OoxmlNamespaces.DC, "Rapor");
            String converted = template.formatted(OoxmlNamespaces.CP, OoxmlNamespaces.DC, "Report");

            DiffResult result = diff(original, converted);

            assertThat(result.differences()).hasSize(1);
            assertThat(result.differences().get(0).severity()).isEqualTo(DiffSeverity.MINOR);
        }

        @Test
        @DisplayName("Farklı kök öğeler → DROPPED + ADDED")
        void rootMismatch() throws Exception {
            DiffResult result = engine.analyzeDifferences(
                    parse(wordDocument("FF0000", "Merhaba"), DocumentType.WORD),
                    parse(OoxmlFixtures.theme("4472C4", "Calibri"), DocumentType.WORD),
                    DocumentType.WORD);

            assertThat(result.differences()).extracting(SemanticDifference::category)
                    .containsExactly(DiffCategory.DROPPED, DiffCategory.ADDED);
        }

        @Test
        @DisplayName("Belge türü verilmezse genel kurallar uygulanır")
        void unknownDocumentType() throws Exception {
            DiffResult result = engine.analyzeDifferences(
                    parse(wordDocument("FF0000", "Merhaba"), null),
                    parse(wordDocument("FF0000", "Hello"), null),
                    null);

            assertThat(result.summary().criticalChanges()).hasSize(1);
        }
    }

    // ── Paketler ────────────────────────────────────────────────────

    @Test
    @DisplayName("ZIP paketi: parçalar ada göre hizalanır, yalnızca değişen parça raporlanır")
    void packageComparison() throws Exception {
        byte[] original = OoxmlFixtures.zip(Map.of(
                "word/document.xml", wordDocument("FF0000", "Merhaba"),
                "word/theme/theme1.xml", OoxmlFixtures.theme("4472C4", "Calibri")));
        byte[] converted = OoxmlFixtures.zip(Map.of(
                "word/theme/theme1.xml", OoxmlFixtures.theme("4472C4", "Calibri"),
                "word/document.xml", wordDocument("FF0000", "Hello")));

        DiffResult result = engine.analyzeDifferences(parse(original, DocumentType.WORD),
                parse(converted, DocumentType.WORD), DocumentType.WORD);

        assertThat(result.differences()).hasSize(1);
        assertThat(result.differences().get(0).location()).contains("pkg:part").endsWith("/text()");
    }

    // ── Filtreleme ve metrikler ─────────────────────────────────────

    @Nested
    @DisplayName("Filtreleme ve metrikler")
    class FilteringAndMetrics {

        @Test
        @DisplayName("Minimum önem ve kategori filtresi")
        void filterDifferences() throws Exception {
            DiffResult result = diff(
                    wordDocument("00A1", "FF0000", "24", "Calibri", "Merhaba"),
                    wordDocument("00B2", "0000FF", "24", "Calibri", "Merhaba"));

            List<SemanticDifference> major = engine.filterDifferences(result.differences(), DiffSeverity.MAJOR, null);
            List<SemanticDifference> dropped = engine.filterDifferences(result.differences(), null,
                    Set.of(DiffCategory.DROPPED));

            assertThat(result.differences()).hasSize(2);
            assertThat(major).hasSize(1);
            assertThat(major.get(0).location()).endsWith("@w:val");
            assertThat(dropped).isEmpty();
        }

        @Test
        @DisplayName("Fark yoksa tüm korunma oranları 1.0")
        void metricsWithoutDifferences() {
            PreservationMetrics metrics = engine.getPreservationMetrics(List.of(), 0);

            assertThat(metrics.contentPreservation()).isEqualTo(1.0);
            assertThat(metrics.stylePreservation()).isEqualTo(1.0);
            assertThat(metrics.structurePreservation()).isEqualTo(1.0);
            assertThat(metrics.changeRatio()).isZero();
        }

        @Test
        @DisplayName("Metin değişimi içerik korunmasını düşürür, stil korunması 1.0 kalır")
        void metricsWithContentChange() throws Exception {
            DiffResult result = diff(wordDocument("FF0000", "Merhaba"), wordDocument("FF0000", "Hello"));

            PreservationMetrics metrics = engine.getPreservationMetrics(result.differences(), result.comparableItems());

            assertThat(metrics.contentPreservation()).isLessThan(1.0).isGreaterThanOrEqualTo(0.0);
            assertThat(metrics.stylePreservation()).isEqualTo(1.0);
            assertThat(metrics.changeRatio()).isGreaterThan(0.0);
        }
    }

    // ── Özet tutarlılığı ────────────────────────────────────────────

    @Nested
    @DisplayName("Özet tutarlılığı")
    class SummaryConsistency {

        private DiffResult mixed() throws Exception {
            // revizyon kimliği (IGNORABLE), renk ve metin birlikte değişir
            return diff(
                    wordDocument("00A1", "FF0000", "24", "Calibri", "Merhaba"),
                    wordDocument("00B2", "0000FF", "24", "Calibri", "Hello"));
        }

        @Test
        @DisplayName("Kategori ve seviye sayımları tüm değerleri içerir, toplamları fark sayısına eşit")
        void countsCoverEveryTagAndSumToTotal() throws Exception {
            DiffSummary summary = mixed().summary();

            assertThat(summary.totalDifferences()).isGreaterThanOrEqualTo(3);
            assertThat(summary.byCategory()).containsOnlyKeys(DiffCategory.values());
            assertThat(summary.bySeverity()).containsOnlyKeys(DiffSeverity.values());
            assertThat(summary.byCategory().values().stream().mapToInt(Integer::intValue).sum())
                    .isEqualTo(summary.totalDifferences());
            assertThat(summary.bySeverity().values().stream().mapToInt(Integer::intValue).sum())
                    .isEqualTo(summary.totalDifferences());
            assertThat(summary.bySeverity().get(DiffSeverity.IGNORABLE)).isPositive();
            assertThat(summary.criticalChanges()).hasSize(summary.bySeverity().get(DiffSeverity.CRITICAL));
        }

        @Test
        @DisplayName("Fark yoksa tüm kategori ve seviyeler sıfır sayımla listelenir")
        void zeroCountsListed() throws Exception {
            String xml = wordDocument("FF0000", "Merhaba");

            DiffSummary summary = diff(xml, xml).summary();

            assertThat(summary.byCategory()).containsOnlyKeys(DiffCategory.values())
                    .allSatisfy((category, count) -> assertThat(count).isZero());
            assertThat(summary.bySeverity()).containsOnlyKeys(DiffSeverity.values())
                    .allSatisfy((severity, count) -> assertThat(count).isZero());
        }

        @Test
        @DisplayName("Genel korunma oranı IGNORABLE farkları saymaz")
        void overallPreservationExcludesIgnorable() {
            var ignorable = new SemanticDifference("/w:document[1]/w:body[1]/w:p[1]/@w:rsidR",
                    DiffCategory.MODIFIED, DiffSeverity.IGNORABLE, "rsidR changed", "00A1", "00B2", DiffContext.NONE);
            var color = new SemanticDifference("/w:document[1]/w:body[1]/w:p[1]/w:r[1]/w:rPr[1]/w:color[1]/@w:val",
                    DiffCategory.MODIFIED, DiffSeverity.MAJOR, "color changed", "FF0000", "0000FF",
                    DiffContext.styling());

            PreservationMetrics metrics = engine.getPreservationMetrics(List.of(ignorable, color), 10);
            PreservationMetrics onlyIgnorable = engine.getPreservationMetrics(List.of(ignorable), 10);

            assertThat(metrics.overallPreservation()).isCloseTo(0.9, within(1e-9));
            assertThat(metrics.stylePreservation()).isCloseTo(0.9, within(1e-9));
            assertThat(metrics.changeRatio()).isCloseTo(0.2, within(1e-9));
            assertThat(onlyIgnorable.overallPreservation()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Karışık değişikliklerde genel oran yalnızca IGNORABLE dışı farklardan hesaplanır")
        void overallPreservationOnMixedChanges() throws Exception {
            DiffResult result = mixed();
            long significant = result.differences().stream()
                    .filter(d -> d.severity() != DiffSeverity.IGNORABLE)
                    .count();

            PreservationMetrics metrics = engine.getPreservationMetrics(result.differences(), result.comparableItems());

            double expected = Math.max(0.0, 1.0 - (double) significant / Math.max(result.comparableItems(), 1));
            assertThat(metrics.overallPreservation()).isCloseTo(expected, within(1e-9));
            assertThat(metrics.changeRatio())
                    .isCloseTo((double) result.differences().size() / Math.max(result.comparableItems(), 1),
                            within(1e-9));
        }
    }
}
