package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.ICarrierAnalyzer;
import io.mersel.services.roundtrip.application.interfaces.IDocumentParser;
import io.mersel.services.roundtrip.application.interfaces.IDocumentTypeDetector;
import io.mersel.services.roundtrip.application.interfaces.IRoundTripTestService;
import io.mersel.services.roundtrip.application.interfaces.ISemanticDiffEngine;
import io.mersel.services.roundtrip.application.interfaces.IToleranceProfileService;
import io.mersel.services.roundtrip.application.interfaces.ToleranceConfigurationException;
import io.mersel.services.roundtrip.application.interfaces.UnknownToleranceProfileException;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CarrierMapping;
import io.mersel.services.roundtrip.application.models.CarrierPreservationMetrics;
import io.mersel.services.roundtrip.application.models.ChangeRecord;
import io.mersel.services.roundtrip.application.models.CriticalCarrierSurvival;
import io.mersel.services.roundtrip.application.models.DetectedCarrier;
import io.mersel.services.roundtrip.application.models.DiffResult;
import io.mersel.services.roundtrip.application.models.ParsedDocument;
import io.mersel.services.roundtrip.application.models.PreservationMetrics;
import io.mersel.services.roundtrip.application.models.RoundTripTestRequest;
import io.mersel.services.roundtrip.application.models.RoundTripTestResult;
import io.mersel.services.roundtrip.application.models.RuleViolation;
import io.mersel.services.roundtrip.application.models.TokenChanges;
import io.mersel.services.roundtrip.application.models.ToleranceEvaluation;
import io.mersel.services.roundtrip.infrastructure.config.RoundTripProperties;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Bir orijinal/dönüştürülmüş belge çiftini uçtan uca değerlendirir.
 * <p>
 * Akış: eşik ve profil doğrulaması → tür tespiti → ayrıştırma → fark analizi →
 * taşıyıcı karşılaştırması → değişiklik sınıflandırması → tolerans değerlendirmesi → eşik kontrolü.
 * Yapılandırma hataları hiçbir analiz yapılmadan fırlatılır.
 */
@Service
public class RoundTripTestService implements IRoundTripTestService {

    private static final Logger log = LoggerFactory.getLogger(RoundTripTestService.class);

    static final String PASS = "PASS";
    static final String FAIL = "FAIL";

    private final IDocumentParser parser;
    private final IDocumentTypeDetector typeDetector;
    private final ISemanticDiffEngine diffEngine;
    private final ICarrierAnalyzer carrierAnalyzer;
    private final ChangeClassifier changeClassifier;
    private final IToleranceProfileService toleranceService;
    private final RoundTripProperties properties;
    private final RoundTripMetrics metrics;

    public RoundTripTestService(IDocumentParser parser,
                                IDocumentTypeDetector typeDetector,
                                ISemanticDiffEngine diffEngine,
                                ICarrierAnalyzer carrierAnalyzer,
                                ChangeClassifier changeClassifier,
                                IToleranceProfileService toleranceService,
                                RoundTripProperties properties,
                                RoundTripMetrics metrics) {
        this.parser = parser;
        this.typeDetector = typeDetector;
        this.diffEngine = diffEngine;
        this.carrierAnalyzer = carrierAnalyzer;
        this.changeClassifier = changeClassifier;
        this.toleranceService = toleranceService;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public RoundTripTestResult run(RoundTripTestRequest request)
            throws DocumentParseException, DocumentTypeDetectionException {
        long startTime = System.currentTimeMillis();

        // ── Yapılandırma doğrulaması ──
        validateThreshold("fail_threshold", request.failThreshold());
        validateThreshold("critical_threshold", request.criticalThreshold());
        String profileName = request.profileName() == null || request.profileName().isBlank()
                ? properties.getDefaultProfile()
                : request.profileName().trim();
        if (toleranceService.getProfile(profileName).isEmpty()) {
            throw new UnknownToleranceProfileException(profileName);
        }

        DocumentType documentType = request.documentType() != null
                ? request.documentType()
                : typeDetector.detect(request.original());

        ParsedDocument original = parser.parse(request.original(), request.originalName(), documentType);
        ParsedDocument converted = parser.parse(request.converted(), request.convertedName(), documentType);

        // ── Analiz ──
        long diffStart = System.currentTimeMillis();
        DiffResult diff = diffEngine.analyzeDifferences(original, converted, documentType);
        PreservationMetrics preservation = diffEngine.getPreservationMetrics(diff.differences(), diff.comparableItems());
        metrics.recordDiff(documentType.name(), diff.summary().totalDifferences(),
                diff.summary().criticalChanges().size(), System.currentTimeMillis() - diffStart);

        CarrierComparison carriers = carrierAnalyzer.compareCarriers(original, converted, documentType);
        CriticalCarrierSurvival criticalSurvival =
                carrierAnalyzer.getCriticalCarrierSurvival(carriers.convertedAnalysis());
        metrics.recordCarrierAnalysis(documentType.name(), "compare");

        List<ChangeRecord> changes = changeClassifier.classify(diff.differences());
        ToleranceEvaluation evaluation =
                toleranceService.evaluateChanges(changes, profileName, diff.comparableItems());
        metrics.recordToleranceEvaluation(profileName, evaluation.passed());

        // ── Eşikler ──
        double overallRate = overallSurvivalRate(carriers);
        double criticalRate = criticalSurvivalRate(carriers);
        var reasons = new ArrayList<String>();
        if (overallRate < request.failThreshold()) {
            reasons.add(String.format(Locale.ROOT, "Overall carrier preservation %.1f%% is below threshold %.1f%%",
                    overallRate, request.failThreshold()));
        }
        if (criticalRate < request.criticalThreshold()) {
            reasons.add(String.format(Locale.ROOT, "Critical carrier survival %.1f%% is below threshold %.1f%%",
                    criticalRate, request.criticalThreshold()));
        }
        for (ChangeRecord violation : evaluation.criticalViolations()) {
            reasons.add("Critical path violation: " + violation.type() + " at " + violation.location());
        }
        for (RuleViolation violation : evaluation.ruleViolations()) {
            reasons.add("Tolerance rule violation: " + violation.message());
        }

        boolean passed = reasons.isEmpty();
        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordRoundTripTest(documentType.name(), passed, elapsed);

        log.info("Round-trip testi tamamlandı: {} ({} / {}), tür={}, profil={}, korunma={}%, kritik={}%, süre={}ms",
                passed ? PASS : FAIL, request.originalName(), request.convertedName(), documentType, profileName,
                String.format(Locale.ROOT, "%.1f", overallRate), String.format(Locale.ROOT, "%.1f", criticalRate),
                elapsed);

        return new RoundTripTestResult(
                passed,
                passed ? PASS : FAIL,
                List.copyOf(reasons),
                documentType,
                profileName,
                overallRate,
                criticalRate,
                request.failThreshold(),
                request.criticalThreshold(),
                diff.summary(),
                preservation,
                carriers.preservationMetrics(),
                criticalSurvival,
                evaluation,
                carrierAnalyzer.generateCarrierReport(carriers),
                elapsed);
    }

    /**
     * Orijinalde bulunan token'lardan değeri aynı kalanların oranı.
     * Orijinal hiç token taşımıyorsa kaybedilecek bir şey yoktur, oran %100'dür.
     */
    static double overallSurvivalRate(CarrierComparison carriers) {
        CarrierPreservationMetrics tokenMetrics = carriers.preservationMetrics();
        int compared = tokenMetrics.preservedTokens() + tokenMetrics.modifiedTokens() + tokenMetrics.lostTokens();
        return compared == 0 ? 100.0 : tokenMetrics.preservationRate();
    }

    /**
     * Orijinaldeki CRITICAL token'lardan dönüştürülmüş belgede hâlâ bulunanların oranı.
     * Değeri değişen token hayatta kalmış sayılır.
     */
    static double criticalSurvivalRate(CarrierComparison carriers) {
        Set<String> criticalTokens = carriers.originalAnalysis().detectedCarriers().stream()
                .map(DetectedCarrier::mapping)
                .filter(mapping -> mapping.significance() == CarrierSignificance.CRITICAL)
                .map(CarrierMapping::designTokenPath)
                .collect(Collectors.toCollection(TreeSet::new));
        if (criticalTokens.isEmpty()) {
            return 100.0;
        }
        TokenChanges changes = carriers.tokenChanges();
        long survived = criticalTokens.stream()
                .filter(token -> changes.preserved().containsKey(token) || changes.modified().containsKey(token))
                .count();
        return 100.0 * survived / criticalTokens.size();
    }

    private static void validateThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new ToleranceConfigurationException(name + " 0-100 aralığında olmalı (verilen: " + value + ")");
        }
    }
}
