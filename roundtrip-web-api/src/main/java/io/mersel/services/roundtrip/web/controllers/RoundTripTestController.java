package io.mersel.services.roundtrip.web.controllers;

import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.IRoundTripTestService;
import io.mersel.services.roundtrip.application.models.RoundTripServiceResponse;
import io.mersel.services.roundtrip.application.models.RoundTripTestRequest;
import io.mersel.services.roundtrip.application.models.RoundTripTestResult;
import io.mersel.services.roundtrip.infrastructure.config.RoundTripProperties;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.dto.RoundTripTestRequestDto;
import io.mersel.services.roundtrip.web.infrastructure.RequestParams;
import io.mersel.services.roundtrip.web.infrastructure.RoundTripHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Uçtan uca round-trip testi endpoint'i.
 * <p>
 * Durum kodları:
 * <ul>
 *   <li>{@code 200}: test tamamlandı (PASS veya FAIL, sonuç gövdede)</li>
 *   <li>{@code 400}: eksik belge, 0-100 dışı eşik, ayrıştırılamayan belge</li>
 *   <li>{@code 404}: bilinmeyen tolerans profili</li>
 *   <li>{@code 422}: {@code exitOnFailure=true} ve test başarısız</li>
 * </ul>
 */
@RestController
@RequestMapping("/v1/roundtrip")
@Tag(name = "Round-Trip Test", description = "Eşik ve tolerans profili ile uçtan uca PASS/FAIL değerlendirmesi")
public class RoundTripTestController {

    private static final Logger log = LoggerFactory.getLogger(RoundTripTestController.class);

    private final IRoundTripTestService testService;
    private final RoundTripProperties properties;
    private final RoundTripMetrics metrics;

    public RoundTripTestController(IRoundTripTestService testService,
                                   RoundTripProperties properties,
                                   RoundTripMetrics metrics) {
        this.testService = testService;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Operation(
            summary = "Round-Trip Testi",
            description = """
                    Orijinal şablon ile dönüşüm hattından geçmiş belgeyi karşılaştırır: fark analizi, taşıyıcı
                    karşılaştırması, tolerans değerlendirmesi ve eşik kontrolü.
                    
                    **Geçme koşulu:** taşıyıcı korunma oranı ≥ `failThreshold`, kritik taşıyıcı hayatta kalma
                    oranı ≥ `criticalThreshold` ve tolerans profili ihlal edilmemiş.
                    
                    **Başarısızlık:** Varsayılan olarak `200` + `banner=FAIL`; `exitOnFailure=true` ise `422`.
                    """
    )
    @PostMapping(value = "/test", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RoundTripServiceResponse<RoundTripTestResult>> test(
            @ModelAttribute @Valid RoundTripTestRequestDto requestDto)
            throws IOException, DocumentParseException, DocumentTypeDetectionException {

        // ── Input doğrulama ──
        if (requestDto.getOriginal() == null || requestDto.getOriginal().isEmpty()) {
            return ResponseEntity.badRequest().body(RoundTripServiceResponse.error("Orijinal belge boş olamaz"));
        }
        if (requestDto.getConverted() == null || requestDto.getConverted().isEmpty()) {
            return ResponseEntity.badRequest().body(RoundTripServiceResponse.error("Dönüştürülmüş belge boş olamaz"));
        }

        var request = new RoundTripTestRequest(
                requestDto.getOriginal().getBytes(),
                requestDto.getOriginal().getOriginalFilename(),
                requestDto.getConverted().getBytes(),
                requestDto.getConverted().getOriginalFilename(),
                RequestParams.documentType(requestDto.getDocumentType()),
                requestDto.getProfile(),
                requestDto.getFailThreshold() != null ? requestDto.getFailThreshold() : properties.getFailThreshold(),
                requestDto.getCriticalThreshold() != null
                        ? requestDto.getCriticalThreshold()
                        : properties.getCriticalThreshold());

        RoundTripTestResult result;
        try {
            result = testService.run(request);
        } catch (DocumentParseException | DocumentTypeDetectionException e) {
            metrics.recordError("roundtrip-test");
            throw e;
        }

        var response = result.passed()
                ? RoundTripServiceResponse.success(result)
                : RoundTripServiceResponse.failure(result, String.join("; ", result.failureReasons()));

        if (!result.passed() && requestDto.isExitOnFailure()) {
            log.info("Round-trip testi başarısız, exitOnFailure etkin: {} neden", result.failureReasons().size());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .header(RoundTripHeaders.RESULT, result.banner())
                    .header(RoundTripHeaders.PROFILE, result.profileUsed())
                    .header(RoundTripHeaders.DURATION_MS, String.valueOf(result.durationMs()))
                    .body(response);
        }

        return ResponseEntity.ok()
                .header(RoundTripHeaders.RESULT, result.banner())
                .header(RoundTripHeaders.PROFILE, result.profileUsed())
                .header(RoundTripHeaders.DURATION_MS, String.valueOf(result.durationMs()))
                .body(response);
    }
}
