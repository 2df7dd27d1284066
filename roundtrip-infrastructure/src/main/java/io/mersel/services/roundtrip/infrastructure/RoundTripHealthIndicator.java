package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.IToleranceProfileService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Taşıyıcı kataloğu ve tolerans profillerinin durumunu raporlayan sağlık göstergesi.
 * <p>
 * Kontroller:
 * <ul>
 *   <li>Katalog boşsa veya bir belge türü için hiç girdi yoksa → DOWN</li>
 *   <li>Varsayılan profil kayıtlı değilse → DOWN</li>
 *   <li>Profil sayıları → detay bilgisi olarak raporlanır</li>
 * </ul>
 */
@Component
public class RoundTripHealthIndicator implements HealthIndicator {

    private final CarrierCatalog carrierCatalog;
    private final IToleranceProfileService toleranceService;

    public RoundTripHealthIndicator(CarrierCatalog carrierCatalog, IToleranceProfileService toleranceService) {
        this.carrierCatalog = carrierCatalog;
        this.toleranceService = toleranceService;
    }

    @Override
    public Health health() {
        var catalogSizes = new LinkedHashMap<String, Integer>();
        carrierCatalog.sizeByDocumentType()
                .forEach((type, size) -> catalogSizes.put(type.name().toLowerCase(Locale.ROOT), size));

        var profiles = toleranceService.getAvailableProfiles();
        var builtIn = new ArrayList<String>();
        var custom = new ArrayList<String>();
        profiles.keySet().forEach(name -> (toleranceService.isBuiltIn(name) ? builtIn : custom).add(name));

        boolean catalogReady = !carrierCatalog.getMappings().isEmpty()
                && carrierCatalog.sizeByDocumentType().values().stream().allMatch(size -> size > 0);
        boolean defaultProfileReady = profiles.containsKey(ToleranceProfileRegistry.DEFAULT_PROFILE);

        var builder = (catalogReady && defaultProfileReady ? Health.up() : Health.down())
                .withDetail("carrier_catalog_entries", carrierCatalog.getMappings().size())
                .withDetail("carrier_catalog_by_type", catalogSizes)
                .withDetail("built_in_profiles", builtIn)
                .withDetail("custom_profiles", custom);

        // Eksik belge türlerini açıkça göster
        if (!catalogReady) {
            var missing = new ArrayList<String>();
            for (Map.Entry<DocumentType, Integer> entry : carrierCatalog.sizeByDocumentType().entrySet()) {
                if (entry.getValue() == 0) {
                    missing.add(entry.getKey().name().toLowerCase(Locale.ROOT));
                }
            }
            builder.withDetail("catalog_missing_types", missing);
        }
        if (!defaultProfileReady) {
            builder.withDetail("warning", "Varsayılan tolerans profili yüklenmemiş: " + ToleranceProfileRegistry.DEFAULT_PROFILE);
        }
        return builder.build();
    }
}
