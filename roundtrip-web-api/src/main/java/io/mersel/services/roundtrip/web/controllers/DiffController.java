package io.mersel.services.roundtrip.web.controllers;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.IDocumentParser;
import io.mersel.services.roundtrip.application.interfaces.IDocumentTypeDetector;
import io.mersel.services.roundtrip.application.interfaces.ISemanticDiffEngine;
import io.mersel.services.roundtrip.application.models.DiffResult;
import io.mersel.services.roundtrip.application.models.ParsedDocument;
import io.mersel.services.roundtrip.application.models.PreservationMetrics;
import io.mersel.services.roundtrip.application.models.RoundTripServiceResponse;
import io.mersel.services.roundtrip.application.models.SemanticDifference;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.dto.DiffRequestDto;
import io.mersel.services.roundtrip.web.dto.DiffResponse;
import io.mersel.services.roundtrip.web.infrastructure.RequestParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Anlamsal fark analizi endpoint'i.
 * <p>
 * İki belge versiyonunu namespace'e duyarlı olarak karşılaştırır, farkları önem
 * seviyesine göre sınıflandırır ve bağlam bazlı korunma oranlarını döner.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Diff", description = "Namespace'e duyarlı anlamsal fark analizi")
public class DiffController {

    private static final Logger log = LoggerFactory.getLogger(DiffController.class);

    private final IDocumentParser documentParser;
    private final IDocumentTypeDetector documentTypeDetector;
    private final ISemanticDiffEngine diffEngine;
    private final RoundTripMetrics metrics;

    public DiffController(IDocumentParser documentParser,
                          IDocumentTypeDetector documentTypeDetector,
                          ISemanticDiffEngine diffEngine,
                          RoundTripMetrics metrics) {
        this.documentParser = documentParser;
        this.documentTypeDetector = documentTypeDetector;
        this.diffEngine = diffEngine;
        this.metrics = metrics;
    }

    @Operation(
            summary = "Anlamsal Fark Analizi",
            description = """
                    Orijinal ve round-trip sonrası belgeyi karşılaştırır.
                    
                    **Girdi:** docx/pptx/xlsx paketi veya tek XML parçası.
                    
                    **Önem seviyeleri:** CRITICAL > MAJOR > MINOR > IGNORABLE. Revizyon kimlikleri (`w:rsid*`),
                    yazım denetimi işaretleri ve belge özellikleri değişiklikleri IGNORABLE veya MINOR sayılır.
                    
                    **Filtre:** `minSeverity` ve `categories` yalnızca `differences` listesini filtreler;
                    `summary` tüm farkları yansıtır.
                    """
    )
    @PostMapping(value = "/diff", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RoundTripServiceResponse<DiffResponse>> diff(
            @ModelAttribute @Valid DiffRequestDto requestDto) throws IOException, DocumentParseException {

        // ── Input doğrulama ──
        if (requestDto.getOriginal() == null || requestDto.getOriginal().isEmpty()
                || requestDto.getConverted() == null || requestDto.getConverted().isEmpty()) {
            return ResponseEntity.badRequest().body(RoundTripServiceResponse.error(
                    "Orijinal ve dönüştürülmüş belge birlikte gönderilmelidir"));
        }

        DiffSeverity minSeverity = RequestParams.severity(requestDto.getMinSeverity());
        Set<DiffCategory> categories = RequestParams.categories(requestDto.getCategories());
        byte[] originalBytes = requestDto.getOriginal().getBytes();
        byte[] convertedBytes = requestDto.getConverted().getBytes();

        DocumentType documentType = resolveDocumentType(requestDto.getDocumentType(), originalBytes);

        long startTime = System.currentTimeMillis();
        ParsedDocument original = documentParser.parse(
                originalBytes, requestDto.getOriginal().getOriginalFilename(), documentType);
        ParsedDocument converted = documentParser.parse(
                convertedBytes, requestDto.getConverted().getOriginalFilename(), documentType);

        DiffResult result = diffEngine.analyzeDifferences(original, converted, documentType);
        List<SemanticDifference> filtered = diffEngine.filterDifferences(result.differences(), minSeverity, categories);
        PreservationMetrics preservation =
                diffEngine.getPreservationMetrics(result.differences(), result.comparableItems());
        long elapsed = System.currentTimeMillis() - startTime;

        metrics.recordDiff(documentType != null ? documentType.name() : "unknown",
                result.summary().totalDifferences(), result.summary().criticalChanges().size(), elapsed);

        log.info("Fark analizi tamamlandı: tür={}, fark={}, kritik={}, korunma=%{}, süre={}ms",
                documentType, result.summary().totalDifferences(), result.summary().criticalChanges().size(),
                Math.round(result.summary().preservationRate()), elapsed);

        return ResponseEntity.ok(RoundTripServiceResponse.success(new DiffResponse(
                documentType, result.summary(), filtered, preservation, result.comparableItems())));
    }

    /**
     * Tür verilmişse onu, verilmemişse tespit edileni kullanır.
     * Tespit edilemezse genel kurallarla ({@code null}) devam edilir.
     */
    private DocumentType resolveDocumentType(String requested, byte[] original) {
        DocumentType documentType = RequestParams.documentType(requested);
        if (documentType != null) {
            return documentType;
        }
        try {
            return documentTypeDetector.detect(original);
        } catch (DocumentTypeDetectionException e) {
            log.debug("Belge türü tespit edilemedi, genel kurallar uygulanacak: {}", e.getMessage());
            return null;
        }
    }
}
