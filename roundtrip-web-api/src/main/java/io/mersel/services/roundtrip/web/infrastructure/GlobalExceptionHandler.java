package io.mersel.services.roundtrip.web.infrastructure;

import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.ToleranceConfigurationException;
import io.mersel.services.roundtrip.application.interfaces.UnknownToleranceProfileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Global hata yöneticisi (RFC 7807 Problem Details).
 * <p>
 * Tüm controller'lardan çıkan istisnaları tutarlı bir JSON formatta döner:
 * <pre>
 * {
 *   "type": "https://mersel.io/roundtrip/errors/unknown-profile",
 *   "title": "Profil Bulunamadı",
 *   "status": 404,
 *   "detail": "Tolerans profili bulunamadı: kurumsal"
 * }
 * </pre>
 * Tolerans aşımı bir hata değildir; değerlendirme sonucunda {@code passed=false} olarak döner.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://mersel.io/roundtrip/errors/";

    /**
     * Ayrıştırılamayan belge → 400 Bad Request.
     */
    @ExceptionHandler(DocumentParseException.class)
    public ProblemDetail handleParseException(DocumentParseException ex) {
        log.warn("Belge ayrıştırılamadı ({}): {}", ex.getSourceName(), ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "parse-error"));
        problem.setTitle("Belge Ayrıştırılamadı");
        if (ex.getSourceName() != null) {
            problem.setProperty("source", ex.getSourceName());
        }
        return problem;
    }

    /**
     * Belge türü tespit edilemedi → 400 Bad Request.
     */
    @ExceptionHandler(DocumentTypeDetectionException.class)
    public ProblemDetail handleDetectionException(DocumentTypeDetectionException ex) {
        log.warn("Belge türü tespit edilemedi: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST,
                "Belge türü tespit edilemedi: " + ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "document-type-undetected"));
        problem.setTitle("Belge Türü Tespit Edilemedi");
        return problem;
    }

    /**
     * Kayıtlı olmayan tolerans profili → 404 Not Found.
     */
    @ExceptionHandler(UnknownToleranceProfileException.class)
    public ProblemDetail handleUnknownProfile(UnknownToleranceProfileException ex) {
        log.warn("Bilinmeyen tolerans profili: {}", ex.getProfileName());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "unknown-profile"));
        problem.setTitle("Profil Bulunamadı");
        problem.setProperty("profile", ex.getProfileName());
        return problem;
    }

    /**
     * Geçersiz eşik, sınır veya profil tanımı → 400 Bad Request.
     */
    @ExceptionHandler(ToleranceConfigurationException.class)
    public ProblemDetail handleToleranceConfiguration(ToleranceConfigurationException ex) {
        log.warn("Tolerans yapılandırma hatası: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "tolerance-configuration"));
        problem.setTitle("Geçersiz Tolerans Yapılandırması");
        return problem;
    }

    /**
     * Dosya boyutu aşımı → 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Dosya boyutu aşımı: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "Yüklenen dosya boyutu izin verilen sınırı aşıyor");
        problem.setType(URI.create(ERROR_BASE_URI + "payload-too-large"));
        problem.setTitle("Dosya Boyutu Aşımı");
        return problem;
    }

    /**
     * Genel istek hatası → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "bad-request"));
        problem.setTitle("Geçersiz İstek");
        return problem;
    }

    /**
     * Eksik parça/parametre, okunamayan gövde veya tip uyuşmazlığı → 400 Bad Request.
     */
    @ExceptionHandler({
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleMalformedRequest(Exception ex) {
        log.warn("Hatalı istek: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "bad-request"));
        problem.setTitle("Geçersiz İstek");
        return problem;
    }

    /**
     * Bean Validation hatası → 400 Bad Request.
     * Jakarta @Valid / @NotBlank / @NotNull gibi annotation hataları.
     */
    @ExceptionHandler(BindException.class)
    public ProblemDetail handleBindException(BindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Doğrulama hatası: {}", detail);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setType(URI.create(ERROR_BASE_URI + "validation-error"));
        problem.setTitle("Doğrulama Hatası");
        return problem;
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.");
        problem.setType(URI.create(ERROR_BASE_URI + "internal-error"));
        problem.setTitle("Sunucu Hatası");
        return problem;
    }
}
