package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.models.ChangeRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Değişiklik kayıtlarını bir profile göre değerlendirme isteği.
 */
public record EvaluateChangesRequest(
        @NotBlank
        @Schema(description = "Tolerans profili", example = "normal")
        String profileName,

        @NotNull
        @Valid
        @Schema(description = "Değişiklik kayıtları (type, location, severity)")
        List<@NotNull ChangeRecordDto> changes,

        @Schema(description = "Yüzde paydası; verilmezse değişiklik sayısı kullanılır", nullable = true)
        Integer totalElements
) {

    public List<ChangeRecord> toChangeRecords() {
        return changes.stream().map(ChangeRecordDto::toRecord).toList();
    }
}
