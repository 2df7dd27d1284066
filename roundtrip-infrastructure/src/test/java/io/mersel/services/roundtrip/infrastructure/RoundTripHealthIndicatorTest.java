package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.ToleranceLevel;
import io.mersel.services.roundtrip.application.interfaces.IToleranceProfileService;
import io.mersel.services.roundtrip.application.models.CarrierMapping;
import io.mersel.services.roundtrip.application.models.ToleranceProfile;
import io.mersel.services.roundtrip.infrastructure.config.RoundTripProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * RoundTripHealthIndicator birim testleri.
 * <p>
 * UP (katalog ve varsayılan profil hazır), DOWN (eksik belge türü), DOWN (varsayılan profil yok).
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RoundTripHealthIndicator")
class RoundTripHealthIndicatorTest {

    @Mock
    private IToleranceProfileService toleranceService;

    @Test
    @DisplayName("health_up: yerleşik katalog ve profiller → UP")
    void health_up() {
        var registry = new ToleranceProfileRegistry(new RoundTripProperties());
        registry.createCustomProfile("kurumsal", "strict");

        var health = new RoundTripHealthIndicator(new CarrierCatalog(), registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsKey("carrier_catalog_by_type");
        assertThat(health.getDetails()).containsEntry("custom_profiles", List.of("kurumsal"));
        assertThat(health.getDetails()).doesNotContainKey("warning");
    }

    @Test
    @DisplayName("health_down_missing_type: bir belge türü için girdi yok → DOWN")
    void health_down_missing_type() {
        var wordOnly = new CarrierCatalog(List.of(new CarrierMapping("//w:color/@w:val",
                CarrierKind.CHARACTER_STYLE, CarrierSignificance.IMPORTANT, "tokens.color.text", "Text color",
                EnumSet.of(DocumentType.WORD), Set.of())));
        var registry = new ToleranceProfileRegistry(new RoundTripProperties());

        var health = new RoundTripHealthIndicator(wordOnly, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("catalog_missing_types", List.of("presentation", "spreadsheet"));
    }

    @Test
    @DisplayName("health_down_no_default_profile: varsayılan profil yüklenmemiş → DOWN + warning")
    void health_down_no_default_profile() {
        var custom = new ToleranceProfile("kurumsal", ToleranceLevel.STRICT, List.of(), Set.of(), Set.of());
        when(toleranceService.getAvailableProfiles()).thenReturn(Map.of("kurumsal", custom));
        when(toleranceService.isBuiltIn("kurumsal")).thenReturn(false);

        var health = new RoundTripHealthIndicator(new CarrierCatalog(), toleranceService).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsKey("warning");
        assertThat(health.getDetails()).containsEntry("built_in_profiles", List.of());
    }
}
