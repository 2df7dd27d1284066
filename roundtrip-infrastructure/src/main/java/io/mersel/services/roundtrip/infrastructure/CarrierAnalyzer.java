package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.ICarrierAnalyzer;
import io.mersel.services.roundtrip.application.interfaces.IDocumentParser;
import io.mersel.services.roundtrip.application.models.CarrierAnalysisResult;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CarrierMapping;
import io.mersel.services.roundtrip.application.models.CarrierPreservationMetrics;
import io.mersel.services.roundtrip.application.models.CriticalCarrierSurvival;
import io.mersel.services.roundtrip.application.models.DetectedCarrier;
import io.mersel.services.roundtrip.application.models.ParsedDocument;
import io.mersel.services.roundtrip.application.models.SignificanceStats;
import io.mersel.services.roundtrip.application.models.TokenChanges;
import io.mersel.services.roundtrip.application.models.TokenSummary;
import io.mersel.services.roundtrip.application.models.TokenValueChange;
import io.mersel.services.roundtrip.application.models.XmlAttribute;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.MatchMode;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Katalog tabanlı tasarım token taşıyıcı analizörü.
 * <p>
 * Her uygulanabilir katalog girdisi için ağaç taranır: önce nitelikli ad kademesi,
 * hiçbir şey bulunamazsa yerel ad kademesi denenir. Öznitelik hedefleyen desenlerde
 * çıkarılan değer özniteliğin değeridir; öğe hedefleyen desenlerde doğrudan metin,
 * o da yoksa {@code null}.
 * <p>
 * Ayrıştırılamayan girdi hata fırlatmaz; uyarı loglanır ve sıfır sonuç döner.
 */
@Service
public class CarrierAnalyzer implements ICarrierAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CarrierAnalyzer.class);

    private static final String VALUE_SEPARATOR = "|";

    private final CarrierCatalog catalog;
    private final IDocumentParser parser;

    public CarrierAnalyzer(CarrierCatalog catalog, IDocumentParser parser) {
        this.catalog = catalog;
        this.parser = parser;
    }

    // ── Analiz ──────────────────────────────────────────────────────

    @Override
    public CarrierAnalysisResult analyzeCarriers(byte[] content, DocumentType documentType) {
        try {
            return analyzeCarriers(parser.parse(content, "belge", documentType), documentType);
        } catch (DocumentParseException e) {
            log.warn("Taşıyıcı analizi için belge ayrıştırılamadı: {}", e.getMessage());
            return CarrierAnalysisResult.empty();
        }
    }

    @Override
    public CarrierAnalysisResult analyzeCarriers(ParsedDocument document, DocumentType documentType) {
        List<CarrierMapping> applicable = catalog.getApplicableMappings(documentType);
        var detected = new ArrayList<DetectedCarrier>();
        var missing = new ArrayList<CarrierMapping>();

        for (CarrierMapping mapping : applicable) {
            LocationPattern pattern = catalog.compiledPattern(mapping);
            List<DetectedCarrier> found = scan(document, mapping, pattern, MatchMode.QUALIFIED);
            if (found.isEmpty()) {
                found = scan(document, mapping, pattern, MatchMode.LOCAL_NAME);
            }
            if (found.isEmpty()) {
                missing.add(mapping);
            } else {
                detected.addAll(found);
            }
        }

        int detectedMappings = applicable.size() - missing.size();
        double survivalRate = applicable.isEmpty() ? 0.0 : 100.0 * detectedMappings / applicable.size();

        List<String> criticalFailures = missing.stream()
                .filter(m -> m.significance() == CarrierSignificance.CRITICAL)
                .map(CarrierMapping::description)
                .toList();

        var breakdown = new EnumMap<CarrierSignificance, SignificanceStats>(CarrierSignificance.class);
        for (CarrierSignificance significance : CarrierSignificance.values()) {
            int total = (int) applicable.stream().filter(m -> m.significance() == significance).count();
            int missed = (int) missing.stream().filter(m -> m.significance() == significance).count();
            breakdown.put(significance, SignificanceStats.of(total - missed, missed));
        }

        log.debug("Taşıyıcı analizi: {} ({}) → {}/{} girdi bulundu, {} kritik eksik",
                document.sourceName(), documentType, detectedMappings, applicable.size(),
                criticalFailures.size());

        return new CarrierAnalysisResult(
                List.copyOf(detected),
                List.copyOf(missing),
                survivalRate,
                criticalFailures,
                Collections.unmodifiableMap(breakdown));
    }

    private static List<DetectedCarrier> scan(ParsedDocument document, CarrierMapping mapping,
                                              LocationPattern pattern, MatchMode mode) {
        var found = new ArrayList<DetectedCarrier>();
        boolean targetsAttribute = pattern.targetsAttribute();
        XmlTreeWalker.walk(document.root(), (node, path, location) -> {
            if (!targetsAttribute) {
                if (pattern.matches(path, mode)) {
                    String text = node.text().strip();
                    found.add(new DetectedCarrier(mapping, location, text.isEmpty() ? null : text));
                }
                return;
            }
            for (XmlAttribute attribute : node.attributes()) {
                if (pattern.matches(XmlTreeWalker.child(path, PathStep.attribute(attribute.name())), mode)) {
                    found.add(new DetectedCarrier(mapping,
                            XmlTreeWalker.attributeLocation(location, attribute.name()),
                            attribute.value()));
                }
            }
        });
        return found;
    }

    // ── Karşılaştırma ───────────────────────────────────────────────

    @Override
    public CarrierComparison compareCarriers(byte[] original, byte[] converted, DocumentType documentType) {
        return compare(analyzeCarriers(original, documentType), analyzeCarriers(converted, documentType));
    }

    @Override
    public CarrierComparison compareCarriers(ParsedDocument original, ParsedDocument converted,
                                             DocumentType documentType) {
        return compare(analyzeCarriers(original, documentType), analyzeCarriers(converted, documentType));
    }

    private CarrierComparison compare(CarrierAnalysisResult original, CarrierAnalysisResult converted) {
        Map<String, String> originalTokens = tokenValues(original);
        Map<String, String> convertedTokens = tokenValues(converted);

        var preserved = new LinkedHashMap<String, String>();
        var modified = new LinkedHashMap<String, TokenValueChange>();
        var lost = new LinkedHashMap<String, String>();
        var gained = new LinkedHashMap<String, String>();

        for (var entry : originalTokens.entrySet()) {
            String token = entry.getKey();
            if (!convertedTokens.containsKey(token)) {
                lost.put(token, entry.getValue());
            } else if (Objects.equals(entry.getValue(), convertedTokens.get(token))) {
                preserved.put(token, entry.getValue());
            } else {
                modified.put(token, new TokenValueChange(entry.getValue(), convertedTokens.get(token)));
            }
        }
        for (var entry : convertedTokens.entrySet()) {
            if (!originalTokens.containsKey(entry.getKey())) {
                gained.put(entry.getKey(), entry.getValue());
            }
        }

        int compared = preserved.size() + modified.size() + lost.size();
        var seen = new TreeSet<String>(originalTokens.keySet());
        seen.addAll(convertedTokens.keySet());

        var metrics = new CarrierPreservationMetrics(
                originalTokens.size(),
                preserved.size(),
                modified.size(),
                lost.size(),
                gained.size(),
                rate(preserved.size(), compared),
                rate(modified.size(), compared),
                rate(lost.size(), compared),
                (double) (modified.size() + lost.size() + gained.size()) / Math.max(1, seen.size()));

        log.debug("Taşıyıcı karşılaştırması: korunan={}, değişen={}, kaybolan={}, kazanılan={}",
                preserved.size(), modified.size(), lost.size(), gained.size());

        return new CarrierComparison(original, converted, metrics,
                new TokenChanges(preserved, modified, lost, gained));
    }

    /**
     * Token yolu → değer. Aynı token'a düşen farklı değerler belge sırasıyla birleştirilir.
     * <p>
     * Değer taşımayan taşıyıcılar için token {@code null} değerle yer alır.
     */
    private static Map<String, String> tokenValues(CarrierAnalysisResult result) {
        var values = new LinkedHashMap<String, LinkedHashSet<String>>();
        for (DetectedCarrier carrier : result.detectedCarriers()) {
            var set = values.computeIfAbsent(carrier.mapping().designTokenPath(), k -> new LinkedHashSet<>());
            if (carrier.extractedValue() != null) {
                set.add(carrier.extractedValue());
            }
        }
        var joined = new LinkedHashMap<String, String>();
        values.forEach((token, set) -> joined.put(token, set.isEmpty() ? null : String.join(VALUE_SEPARATOR, set)));
        return joined;
    }

    private static double rate(int count, int total) {
        return total == 0 ? 0.0 : 100.0 * count / total;
    }

    // ── Kritik taşıyıcılar ──────────────────────────────────────────

    @Override
    public CriticalCarrierSurvival getCriticalCarrierSurvival(CarrierAnalysisResult result) {
        var detectedTokens = new ArrayList<TokenSummary>();
        var seen = new LinkedHashSet<CarrierMapping>();
        for (DetectedCarrier carrier : result.detectedCarriers()) {
            CarrierMapping mapping = carrier.mapping();
            if (mapping.significance() == CarrierSignificance.CRITICAL && seen.add(mapping)) {
                detectedTokens.add(new TokenSummary(mapping.carrierKind(), mapping.designTokenPath(),
                        carrier.extractedValue(), mapping.description()));
            }
        }
        List<TokenSummary> missingTokens = result.missingCarriers().stream()
                .filter(m -> m.significance() == CarrierSignificance.CRITICAL)
                .map(m -> new TokenSummary(m.carrierKind(), m.designTokenPath(), null, m.description()))
                .toList();

        int total = detectedTokens.size() + missingTokens.size();
        double rate = total == 0 ? 0.0 : 100.0 * detectedTokens.size() / total;
        return new CriticalCarrierSurvival(detectedTokens.size(), missingTokens.size(), rate,
                List.copyOf(detectedTokens), missingTokens);
    }

    // ── Rapor ───────────────────────────────────────────────────────

    @Override
    public String generateCarrierReport(CarrierComparison comparison) {
        CarrierPreservationMetrics metrics = comparison.preservationMetrics();
        var sb = new StringBuilder();
        String title = "Design Token Carrier Analysis";
        sb.append(title).append('\n');
        sb.append("=".repeat(title.length())).append('\n');
        sb.append('\n');
        sb.append("Total Original Tokens: ").append(metrics.totalOriginalTokens()).append('\n');
        sb.append("Preserved Tokens: ").append(metrics.preservedTokens()).append('\n');
        sb.append("Modified Tokens: ").append(metrics.modifiedTokens()).append('\n');
        sb.append("Lost Tokens: ").append(metrics.lostTokens()).append('\n');
        sb.append("Gained Tokens: ").append(metrics.gainedTokens()).append('\n');
        sb.append(String.format(Locale.ROOT, "Preservation Rate: %.1f%%\n", metrics.preservationRate()));
        sb.append(String.format(Locale.ROOT, "Modification Rate: %.1f%%\n", metrics.modificationRate()));
        sb.append(String.format(Locale.ROOT, "Loss Rate: %.1f%%\n", metrics.lossRate()));
        sb.append('\n');

        sb.append("Category Breakdown:").append('\n');
        var originalBreakdown = comparison.originalAnalysis().categoryBreakdown();
        var convertedBreakdown = comparison.convertedAnalysis().categoryBreakdown();
        for (CarrierSignificance significance : CarrierSignificance.values()) {
            SignificanceStats before = originalBreakdown.getOrDefault(significance, SignificanceStats.of(0, 0));
            SignificanceStats after = convertedBreakdown.getOrDefault(significance, SignificanceStats.of(0, 0));
            sb.append("  ").append(significance).append(':').append('\n');
            sb.append("    Original: ").append(before.detected()).append('/').append(before.total()).append('\n');
            sb.append("    Converted: ").append(after.detected()).append('/').append(after.total()).append('\n');
            sb.append(String.format(Locale.ROOT, "    Survival: %.1f%%\n", after.survivalRate()));
        }

        List<String> failures = comparison.convertedAnalysis().criticalFailures();
        if (!failures.isEmpty()) {
            sb.append('\n');
            sb.append("Critical Failures:").append('\n');
            for (String failure : failures) {
                sb.append("  - ").append(failure).append('\n');
            }
        }
        return sb.toString();
    }
}
