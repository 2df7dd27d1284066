package io.mersel.services.roundtrip.web.infrastructure;

import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.ToleranceConfigurationException;
import io.mersel.services.roundtrip.application.interfaces.UnknownToleranceProfileException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * GlobalExceptionHandler birim testleri.
 * <p>
 * Her handler'ın doğru HTTP durum kodu, ProblemDetail başlığı ve type URI'si döndüğünü doğrular.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("handleParseException → 400, kaynak adı özellik olarak eklenir")
    void handleParseException() {
        var ex = new DocumentParseException("cikti.docx!word/document.xml", "XML ayrıştırılamadı: satır 3");

        var problem = handler.handleParseException(ex);

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(problem.getTitle()).isEqualTo("Belge Ayrıştırılamadı");
        assertThat(problem.getDetail()).contains("satır 3");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/parse-error");
        assertThat(problem.getProperties()).containsEntry("source", "cikti.docx!word/document.xml");
    }

    @Test
    @DisplayName("handleDetectionException → 400")
    void handleDetectionException() {
        var problem = handler.handleDetectionException(new DocumentTypeDetectionException("localName=root"));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(problem.getTitle()).isEqualTo("Belge Türü Tespit Edilemedi");
        assertThat(problem.getDetail()).endsWith("localName=root");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/document-type-undetected");
    }

    @Test
    @DisplayName("handleUnknownProfile → 404, profil adı özellik olarak eklenir")
    void handleUnknownProfile() {
        var problem = handler.handleUnknownProfile(new UnknownToleranceProfileException("kurumsal"));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(problem.getTitle()).isEqualTo("Profil Bulunamadı");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/unknown-profile");
        assertThat(problem.getProperties()).containsEntry("profile", "kurumsal");
    }

    @Test
    @DisplayName("handleToleranceConfiguration → 400")
    void handleToleranceConfiguration() {
        var problem = handler.handleToleranceConfiguration(
                new ToleranceConfigurationException("Yerleşik profil silinemez: strict"));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(problem.getTitle()).isEqualTo("Geçersiz Tolerans Yapılandırması");
        assertThat(problem.getDetail()).isEqualTo("Yerleşik profil silinemez: strict");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/tolerance-configuration");
    }

    @Test
    @DisplayName("handleMaxUploadSize → 413")
    void handleMaxUploadSize() {
        var problem = handler.handleMaxUploadSize(new MaxUploadSizeExceededException(1024));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE.value());
        assertThat(problem.getTitle()).isEqualTo("Dosya Boyutu Aşımı");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/payload-too-large");
    }

    @Test
    @DisplayName("handleIllegalArgument ve eksik parça → 400 bad-request")
    void handleBadRequest() {
        var illegal = handler.handleIllegalArgument(new IllegalArgumentException("Geçersiz belge türü: 'visio'"));
        var missing = handler.handleMalformedRequest(new MissingServletRequestPartException("original"));

        assertThat(illegal.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(illegal.getTitle()).isEqualTo("Geçersiz İstek");
        assertThat(illegal.getType()).hasPath("/roundtrip/errors/bad-request");
        assertThat(missing.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(missing.getDetail()).contains("original");
    }

    @Test
    @DisplayName("handleBindException → alan hataları detayda birleştirilir")
    void handleBindException() {
        var bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "profileName", "boş olamaz"));

        var problem = handler.handleBindException(new BindException(bindingResult));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(problem.getTitle()).isEqualTo("Doğrulama Hatası");
        assertThat(problem.getDetail()).contains("profileName: boş olamaz");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/validation-error");
    }

    @Test
    @DisplayName("handleGenericException → 500, iç hata detayı sızdırılmaz")
    void handleGenericException() {
        var problem = handler.handleGenericException(new RuntimeException("NullPointerException at line 42"));

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(problem.getTitle()).isEqualTo("Sunucu Hatası");
        assertThat(problem.getDetail()).doesNotContain("NullPointerException");
        assertThat(problem.getDetail()).contains("Beklenmeyen bir hata oluştu");
        assertThat(problem.getType()).hasPath("/roundtrip/errors/internal-error");
    }
}
