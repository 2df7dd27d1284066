package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.CarrierMapping;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.MatchMode;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tasarım token taşıyıcı kataloğu.
 * <p>
 * Girdiler başlangıçta classpath'teki {@code carrier-catalog.yml} dosyasından bir kez okunur,
 * desenler derlenir ve belge türüne göre indekslenir. Katalog çalışma süresince değişmez.
 * <p>
 * Hatalı bir girdi, indeksini ve alan adını içeren bir {@link IllegalStateException}
 * ile uygulamanın açılmasını durdurur.
 */
@Component
public class CarrierCatalog {

    private static final Logger log = LoggerFactory.getLogger(CarrierCatalog.class);

    static final String CATALOG_RESOURCE = "carrier-catalog.yml";

    private final List<CarrierMapping> mappings;
    private final Map<CarrierMapping, LocationPattern> patterns;
    private final Map<DocumentType, List<CarrierMapping>> byDocumentType;

    public CarrierCatalog() {
        this(loadResource(CATALOG_RESOURCE));
    }

    CarrierCatalog(List<CarrierMapping> mappings) {
        this.mappings = List.copyOf(mappings);
        var compiled = new IdentityHashMap<CarrierMapping, LocationPattern>();
        for (CarrierMapping mapping : this.mappings) {
            LocationPattern pattern = LocationPattern.compile(mapping.locationPattern());
            if (!pattern.unresolvedPrefixes().isEmpty()) {
                log.warn("Taşıyıcı deseninde tanınmayan prefix: {} → {} (yalnızca yerel ad ile eşleşir)",
                        mapping.locationPattern(), pattern.unresolvedPrefixes());
            }
            compiled.put(mapping, pattern);
        }
        this.patterns = Collections.unmodifiableMap(compiled);

        var index = new EnumMap<DocumentType, List<CarrierMapping>>(DocumentType.class);
        for (DocumentType type : DocumentType.values()) {
            index.put(type, this.mappings.stream().filter(m -> m.appliesTo(type)).toList());
        }
        this.byDocumentType = Collections.unmodifiableMap(index);

        log.info("Taşıyıcı kataloğu yüklendi: {} girdi (word={}, presentation={}, spreadsheet={})",
                this.mappings.size(),
                index.get(DocumentType.WORD).size(),
                index.get(DocumentType.PRESENTATION).size(),
                index.get(DocumentType.SPREADSHEET).size());
    }

    // ── Sorgular ────────────────────────────────────────────────────

    public List<CarrierMapping> getMappings() {
        return mappings;
    }

    /**
     * Belge türüne uygulanabilen girdiler; tür {@code null} ise tüm girdiler.
     */
    public List<CarrierMapping> getApplicableMappings(DocumentType documentType) {
        return documentType == null ? mappings : byDocumentType.get(documentType);
    }

    /**
     * Belge türü başına girdi sayısı (health endpoint için).
     */
    public Map<DocumentType, Integer> sizeByDocumentType() {
        var sizes = new EnumMap<DocumentType, Integer>(DocumentType.class);
        byDocumentType.forEach((type, list) -> sizes.put(type, list.size()));
        return sizes;
    }

    LocationPattern compiledPattern(CarrierMapping mapping) {
        LocationPattern pattern = patterns.get(mapping);
        return pattern != null ? pattern : LocationPattern.compile(mapping.locationPattern());
    }

    /**
     * Verilen düğüm yoluyla eşleşen uygulanabilir girdilerin en yüksek önem seviyesi.
     * <p>
     * Prefix bağlamından bağımsız olması için yerel ad kademesinde eşleştirilir.
     */
    public Optional<CarrierSignificance> significanceOf(DocumentType documentType, List<PathStep> path) {
        CarrierSignificance best = null;
        for (CarrierMapping mapping : getApplicableMappings(documentType)) {
            if (best != null && mapping.significance().ordinal() >= best.ordinal()) {
                continue;
            }
            if (compiledPattern(mapping).matches(path, MatchMode.LOCAL_NAME)) {
                best = mapping.significance();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Token yolunun katalogdaki taşıyıcı türü.
     */
    public Optional<CarrierKind> kindOfToken(String tokenPath) {
        if (tokenPath == null) {
            return Optional.empty();
        }
        return mappings.stream()
                .filter(m -> tokenPath.equals(m.designTokenPath()))
                .map(CarrierMapping::carrierKind)
                .findFirst();
    }

    // ── YAML Loading ────────────────────────────────────────────────

    private static List<CarrierMapping> loadResource(String resource) {
        ClassLoader loader = CarrierCatalog.class.getClassLoader();
        try (InputStream is = loader.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Taşıyıcı kataloğu bulunamadı: classpath:" + resource);
            }
            return parse(is);
        } catch (IOException e) {
            throw new IllegalStateException("Taşıyıcı kataloğu okunamadı: " + e.getMessage(), e);
        }
    }

    static List<CarrierMapping> parse(InputStream is) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(is);
        if (!(root instanceof Map<?, ?> rootMap) || !(rootMap.get("carriers") instanceof List<?> entries)) {
            throw new IllegalStateException("Taşıyıcı kataloğunda 'carriers' listesi bulunamadı");
        }

        var result = new ArrayList<CarrierMapping>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Map<?, ?> entry)) {
                throw new IllegalStateException("Taşıyıcı girdisi #" + i + " bir map değil");
            }
            result.add(parseEntry(i, entry));
        }
        return result;
    }

    private static CarrierMapping parseEntry(int index, Map<?, ?> entry) {
        String pattern = requiredString(index, entry, "pattern");
        CarrierKind kind = enumValue(index, entry, "kind", CarrierKind.class);
        CarrierSignificance significance = enumValue(index, entry, "significance", CarrierSignificance.class);
        String token = requiredString(index, entry, "token");
        Object descriptionObj = entry.get("description");
        String description = descriptionObj != null ? descriptionObj.toString() : token;

        Set<DocumentType> types = EnumSet.noneOf(DocumentType.class);
        Object typesObj = entry.get("document-types");
        if (typesObj instanceof List<?> typeList) {
            for (Object value : typeList) {
                types.add(DocumentType.parse(String.valueOf(value)).orElseThrow(() -> new IllegalStateException(
                        "Taşıyıcı girdisi #" + index + " 'document-types' alanında geçersiz değer: " + value)));
            }
        } else if (typesObj != null) {
            throw new IllegalStateException(
                    "Taşıyıcı girdisi #" + index + " 'document-types' alanı liste olmalı");
        }
        if (types.isEmpty()) {
            types = EnumSet.allOf(DocumentType.class);
        }

        LocationPattern compiled;
        try {
            compiled = LocationPattern.compile(pattern);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Taşıyıcı girdisi #" + index + " 'pattern' alanı geçersiz: " + e.getMessage(), e);
        }

        return new CarrierMapping(pattern, kind, significance, token, description, types,
                new LinkedHashSet<>(compiled.namespaceUris()));
    }

    private static String requiredString(int index, Map<?, ?> entry, String field) {
        Object value = entry.get(field);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalStateException("Taşıyıcı girdisi #" + index + " '" + field + "' alanı eksik");
        }
        return value.toString().trim();
    }

    private static <E extends Enum<E>> E enumValue(int index, Map<?, ?> entry, String field, Class<E> type) {
        String value = requiredString(index, entry, field);
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Taşıyıcı girdisi #" + index + " '" + field + "' alanında geçersiz değer: " + value, e);
        }
    }
}
