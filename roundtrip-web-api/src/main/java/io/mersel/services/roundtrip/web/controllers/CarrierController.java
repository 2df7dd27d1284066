package io.mersel.services.roundtrip.web.controllers;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.ICarrierAnalyzer;
import io.mersel.services.roundtrip.application.interfaces.IDocumentTypeDetector;
import io.mersel.services.roundtrip.application.models.CarrierAnalysisResult;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.RoundTripServiceResponse;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.dto.CarrierAnalysisResponse;
import io.mersel.services.roundtrip.web.dto.CarrierComparisonResponse;
import io.mersel.services.roundtrip.web.infrastructure.RequestParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Tasarım token taşıyıcı analizi endpoint'leri.
 * <p>
 * Ayrıştırılamayan belgeler hata değil, {@code survival_rate = 0} olan bir sonuç döner.
 */
@RestController
@RequestMapping("/v1/carriers")
@Tag(name = "Carriers", description = "Tasarım token taşıyıcı tespiti ve korunma analizi")
public class CarrierController {

    private static final Logger log = LoggerFactory.getLogger(CarrierController.class);

    private final ICarrierAnalyzer carrierAnalyzer;
    private final IDocumentTypeDetector documentTypeDetector;
    private final RoundTripMetrics metrics;

    public CarrierController(ICarrierAnalyzer carrierAnalyzer,
                             IDocumentTypeDetector documentTypeDetector,
                             RoundTripMetrics metrics) {
        this.carrierAnalyzer = carrierAnalyzer;
        this.documentTypeDetector = documentTypeDetector;
        this.metrics = metrics;
    }

    @Operation(
            summary = "Taşıyıcı Analizi",
            description = """
                    Belgedeki tasarım token taşıyıcılarını (tema renkleri, yazı tipleri, stiller) bulur,
                    önem seviyesi bazında hayatta kalma oranlarını ve kritik taşıyıcı özetini döner.
                    """
    )
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RoundTripServiceResponse<CarrierAnalysisResponse>> analyze(
            @RequestParam("document") MultipartFile document,
            @RequestParam(value = "documentType", required = false) String documentTypeParam)
            throws IOException, DocumentTypeDetectionException {

        if (document.isEmpty()) {
            return ResponseEntity.badRequest().body(RoundTripServiceResponse.error("Belge boş olamaz"));
        }

        byte[] content = document.getBytes();
        DocumentType documentType = resolveDocumentType(documentTypeParam, content);

        CarrierAnalysisResult analysis = carrierAnalyzer.analyzeCarriers(content, documentType);
        metrics.recordCarrierAnalysis(documentType.name(), "analyze");

        log.info("Taşıyıcı analizi: {} ({}), bulunan={}, eksik={}, hayatta kalma=%{}",
                document.getOriginalFilename(), documentType, analysis.detectedCarriers().size(),
                analysis.missingCarriers().size(), Math.round(analysis.survivalRate()));

        return ResponseEntity.ok(RoundTripServiceResponse.success(new CarrierAnalysisResponse(
                documentType, analysis, carrierAnalyzer.getCriticalCarrierSurvival(analysis))));
    }

    @Operation(
            summary = "Taşıyıcı Karşılaştırması",
            description = """
                    İki belge versiyonundaki token değerlerini karşılaştırır; korunan, değişen, kaybolan ve
                    kazanılan token'ları ve deterministik metin raporunu döner.
                    """
    )
    @PostMapping(value = "/compare", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RoundTripServiceResponse<CarrierComparisonResponse>> compare(
            @RequestParam("original") MultipartFile original,
            @RequestParam("converted") MultipartFile converted,
            @RequestParam(value = "documentType", required = false) String documentTypeParam)
            throws IOException, DocumentTypeDetectionException {

        if (original.isEmpty() || converted.isEmpty()) {
            return ResponseEntity.badRequest().body(RoundTripServiceResponse.error(
                    "Orijinal ve dönüştürülmüş belge birlikte gönderilmelidir"));
        }

        byte[] originalBytes = original.getBytes();
        DocumentType documentType = resolveDocumentType(documentTypeParam, originalBytes);

        CarrierComparison comparison =
                carrierAnalyzer.compareCarriers(originalBytes, converted.getBytes(), documentType);
        metrics.recordCarrierAnalysis(documentType.name(), "compare");

        log.info("Taşıyıcı karşılaştırması: {} → {} ({}), korunma=%{}",
                original.getOriginalFilename(), converted.getOriginalFilename(), documentType,
                Math.round(comparison.preservationMetrics().preservationRate()));

        return ResponseEntity.ok(RoundTripServiceResponse.success(new CarrierComparisonResponse(
                documentType, comparison, carrierAnalyzer.generateCarrierReport(comparison))));
    }

    private DocumentType resolveDocumentType(String requested, byte[] content) throws DocumentTypeDetectionException {
        DocumentType documentType = RequestParams.documentType(requested);
        return documentType != null ? documentType : documentTypeDetector.detect(content);
    }
}
