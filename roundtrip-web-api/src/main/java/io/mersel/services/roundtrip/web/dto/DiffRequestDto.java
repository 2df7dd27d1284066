package io.mersel.services.roundtrip.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import org.springframework.web.multipart.MultipartFile;

/**
 * Fark analizi isteği DTO'su.
 * <p>
 * multipart/form-data olarak alınır. Belge türü verilmezse orijinal belgeden tespit edilir.
 */
public class DiffRequestDto {

    @Schema(description = "Orijinal belge (docx/pptx/xlsx paketi veya tek XML parçası)",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private MultipartFile original;

    @Schema(description = "Round-trip sonrası belge", requiredMode = Schema.RequiredMode.REQUIRED)
    private MultipartFile converted;

    @Size(max = 32)
    @Schema(description = "Belge türü (word, powerpoint, excel veya docx, pptx, xlsx)", example = "word", nullable = true)
    private String documentType;

    @Size(max = 16)
    @Schema(description = "En düşük önem seviyesi (CRITICAL, MAJOR, MINOR, IGNORABLE)", example = "MINOR", nullable = true)
    private String minSeverity;

    @Size(max = 64)
    @Schema(description = "Virgülle ayrılmış kategoriler (ADDED, DROPPED, MODIFIED)", example = "DROPPED,MODIFIED",
            nullable = true)
    private String categories;

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

    public String getMinSeverity() {
        return minSeverity;
    }

    public void setMinSeverity(String minSeverity) {
        this.minSeverity = minSeverity;
    }

    public String getCategories() {
        return categories;
    }

    public void setCategories(String categories) {
        this.categories = categories;
    }
}
