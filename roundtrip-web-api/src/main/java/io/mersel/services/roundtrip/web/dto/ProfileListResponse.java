package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.models.ToleranceProfile;

import java.util.List;
import java.util.Map;

/**
 * Tolerans profilleri listesi.
 */
public record ProfileListResponse(
        int totalProfiles,
        List<String> builtInProfiles,
        Map<String, ToleranceProfile> profiles
) {
}
