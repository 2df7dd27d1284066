package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.models.ChangeRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

/**
 * Değerlendirme isteğindeki tek bir değişiklik kaydı.
 */
public record ChangeRecordDto(
        @NotNull
        @Schema(description = "Değişiklik türü", example = "COLOR_SHIFT")
        ChangeType type,

        @Schema(description = "Değişikliğin konumu", example = "/w:document[1]/w:body[1]/w:p[1]")
        String location,

        @NotNull
        @Schema(description = "Önem seviyesi", example = "MINOR")
        DiffSeverity severity
) {

    public ChangeRecord toRecord() {
        return new ChangeRecord(type, location, severity);
    }
}
