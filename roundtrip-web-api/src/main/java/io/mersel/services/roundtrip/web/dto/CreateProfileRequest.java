package io.mersel.services.roundtrip.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Özel tolerans profili oluşturma isteği.
 */
public record CreateProfileRequest(
        @NotBlank @Size(max = 64)
        @Schema(description = "Yeni profil adı", example = "kurumsal-sablon")
        String name,

        @NotBlank @Size(max = 64)
        @Schema(description = "Temel alınacak profil", example = "strict")
        String baseProfile
) {
}
