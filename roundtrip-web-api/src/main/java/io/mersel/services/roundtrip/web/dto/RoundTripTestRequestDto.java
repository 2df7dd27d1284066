package io.mersel.services.roundtrip.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import org.springframework.web.multipart.MultipartFile;

/**
 * Round-trip testi isteği DTO'su.
 * <p>
 * multipart/form-data olarak alınır. Eşikler verilmezse yapılandırmadaki
 * varsayılanlar ({@code roundtrip.fail-threshold}, {@code roundtrip.critical-threshold}) kullanılır.
 */
public class RoundTripTestRequestDto {

    @Schema(description = "Orijinal şablon", requiredMode = Schema.RequiredMode.REQUIRED)
    private MultipartFile original;

    @Schema(description = "Dönüşüm hattından geçmiş belge", requiredMode = Schema.RequiredMode.REQUIRED)
    private MultipartFile converted;

    @Size(max = 32)
    @Schema(description = "Belge türü; verilmezse orijinalden tespit edilir", example = "word", nullable = true)
    private String documentType;

    @Size(max = 64)
    @Schema(description = "Tolerans profili", example = "normal", nullable = true)
    private String profile;

    @Schema(description = "Genel taşıyıcı korunma eşiği (0-100)", example = "70", nullable = true)
    private Double failThreshold;

    @Schema(description = "Kritik taşıyıcı hayatta kalma eşiği (0-100)", example = "90", nullable = true)
    private Double criticalThreshold;

    @Schema(description = "Test başarısız olursa 422 döndür", example = "false")
    private boolean exitOnFailure;

    public MultipartFile getOriginal() {
        return original;
    }

    public void setOriginal(MultipartFile original) {
        this.original = original;
    }

    public MultipartFile getConverted() {
        return converted;
    }

    public void setConverted(MultipartFile converted) {
        this.converted = converted;
    }

    public String getDocumentType() {
        return documentType;
    }

    public void setDocumentType(String documentType) {
        this.documentType = documentType;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public Double getFailThreshold() {
        return failThreshold;
    }

    public void setFailThreshold(Double failThreshold) {
        this.failThreshold = failThreshold;
    }

    public Double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(Double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public boolean isExitOnFailure() {
        return exitOnFailure;
    }

    public void setExitOnFailure(boolean exitOnFailure) {
        this.exitOnFailure = exitOnFailure;
    }
}
