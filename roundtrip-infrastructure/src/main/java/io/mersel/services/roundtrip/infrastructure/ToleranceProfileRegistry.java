package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.ToleranceLevel;
import io.mersel.services.roundtrip.application.enums.UsageContext;
import io.mersel.services.roundtrip.application.interfaces.IToleranceProfileService;
import io.mersel.services.roundtrip.application.interfaces.ReloadResult;
import io.mersel.services.roundtrip.application.interfaces.Reloadable;
import io.mersel.services.roundtrip.application.interfaces.ToleranceConfigurationException;
import io.mersel.services.roundtrip.application.interfaces.UnknownToleranceProfileException;
import io.mersel.services.roundtrip.application.models.ChangeRecord;
import io.mersel.services.roundtrip.application.models.RuleViolation;
import io.mersel.services.roundtrip.application.models.ToleranceEvaluation;
import io.mersel.services.roundtrip.application.models.ToleranceProfile;
import io.mersel.services.roundtrip.application.models.ToleranceRule;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.MatchMode;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;
import io.mersel.services.roundtrip.infrastructure.config.RoundTripProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Tolerans profilleri kayıt defteri ve değerlendirme motoru.
 * <p>
 * Yerleşik profiller classpath'teki {@code tolerance-profiles.yml} dosyasından yüklenir.
 * Özel profiller çalışma zamanında türetilir veya {@code roundtrip.tolerance.profiles-dir}
 * dizinindeki {@code *.yml} dosyalarından okunur ve {@link Reloadable} ile yeniden yüklenir.
 * <p>
 * Profiller değişmez kayıtlardır; ayarlama ve türetme kayıt defterindeki girdiyi yeni bir
 * kayıtla değiştirir. Eşzamanlı okuyucular her zaman tutarlı bir profil görür.
 * Aynı profilin eşzamanlı ayarlanması çağıran tarafından sıralanmalıdır.
 */
@Service
public class ToleranceProfileRegistry implements IToleranceProfileService, Reloadable {

    private static final Logger log = LoggerFactory.getLogger(ToleranceProfileRegistry.class);

    static final String BUILT_IN_RESOURCE = "tolerance-profiles.yml";
    static final String DEFAULT_PROFILE = "normal";

    private static final Pattern PROFILE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");
    private static final String PASSED_SUMMARY = "Tolerance check passed: all changes are within tolerance limits.";

    // ── Önerilen profil tablosu ──
    private static final Map<DocumentType, Map<UsageContext, String>> RECOMMENDATIONS = new EnumMap<>(Map.of(
            DocumentType.WORD, Map.of(
                    UsageContext.PRODUCTION, "strict",
                    UsageContext.DRAFT, "lenient",
                    UsageContext.TEST, "permissive"),
            DocumentType.PRESENTATION, Map.of(
                    UsageContext.PRODUCTION, "normal",
                    UsageContext.DRAFT, "lenient"),
            DocumentType.SPREADSHEET, Map.of(
                    UsageContext.PRODUCTION, "strict",
                    UsageContext.ANALYSIS, "normal",
                    UsageContext.TEST, "lenient")));

    private final RoundTripProperties properties;
    private final Set<String> builtInNames;
    private final Map<String, ToleranceProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, LocationPattern> patternCache = new ConcurrentHashMap<>();

    public ToleranceProfileRegistry(RoundTripProperties properties) {
        this.properties = properties;
        List<ToleranceProfile> builtIns = loadBuiltIns();
        var names = new LinkedHashSet<String>();
        for (ToleranceProfile profile : builtIns) {
            validatePatterns(profile);
            profiles.put(profile.name(), profile);
            names.add(profile.name());
        }
        this.builtInNames = Collections.unmodifiableSet(names);
        log.info("Yerleşik tolerans profilleri yüklendi: {}", builtInNames);
    }

    @PostConstruct
    void loadProfilesDirectory() {
        if (properties.getTolerance().hasProfilesDir()) {
            ReloadResult result = reload();
            log.info("Profil dizini yüklendi: {} ({} profil, durum={})",
                    properties.getTolerance().getProfilesDir(), result.loadedCount(), result.status());
        }
    }

    // ── Reloadable ──────────────────────────────────────────────────

    @Override
    public String getName() {
        return "Tolerance Profiles";
    }

    /**
     * Profil dizinindeki {@code *.yml} dosyalarını yeniden okur.
     * <p>
     * Dosyalar önce bütünüyle okunur, ardından kayıt defterine yazılır; okunamayan dosyalar
     * mevcut profilleri etkilemez ve sonuçta hata olarak raporlanır.
     */
    @Override
    public ReloadResult reload() {
        long startTime = System.currentTimeMillis();
        if (!properties.getTolerance().hasProfilesDir()) {
            return ReloadResult.success(getName(), 0, System.currentTimeMillis() - startTime);
        }

        Path directory = Path.of(properties.getTolerance().getProfilesDir());
        if (!Files.isDirectory(directory)) {
            log.warn("Profil dizini bulunamadı: {}", directory);
            return ReloadResult.failed(getName(), System.currentTimeMillis() - startTime,
                    "Profil dizini bulunamadı: " + directory);
        }

        var loaded = new LinkedHashMap<String, ToleranceProfile>();
        var errors = new ArrayList<String>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.yml")) {
            for (Path file : files) {
                try {
                    ToleranceProfile profile = loadProfile(file);
                    if (builtInNames.contains(profile.name())) {
                        throw new ToleranceConfigurationException(
                                "Yerleşik profil adı kullanılamaz: " + profile.name());
                    }
                    loaded.put(profile.name(), profile);
                    log.debug("  Profil yüklendi: {} ({} kural)", profile.name(), profile.rules().size());
                } catch (IOException | RuntimeException e) {
                    errors.add(file.getFileName() + ": " + e.getMessage());
                    log.warn("  Profil dosyası atlandı: {} - {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.error("Profil dizini okunamadı: {}", e.getMessage());
            return ReloadResult.failed(getName(), elapsed, e.getMessage());
        }

        profiles.putAll(loaded);
        long elapsed = System.currentTimeMillis() - startTime;
        if (errors.isEmpty()) {
            return ReloadResult.success(getName(), loaded.size(), elapsed);
        }
        return ReloadResult.partial(getName(), loaded.size(), elapsed, errors);
    }

    // ── Sorgular ────────────────────────────────────────────────────

    @Override
    public Optional<ToleranceProfile> getProfile(String profileName) {
        return profileName == null ? Optional.empty() : Optional.ofNullable(profiles.get(profileName));
    }

    @Override
    public Map<String, ToleranceProfile> getAvailableProfiles() {
        return Collections.unmodifiableMap(new TreeMap<>(profiles));
    }

    @Override
    public boolean isBuiltIn(String profileName) {
        return builtInNames.contains(profileName);
    }

    @Override
    public String getRecommendedProfile(DocumentType documentType, UsageContext usageContext) {
        if (documentType == null || usageContext == null) {
            return DEFAULT_PROFILE;
        }
        return RECOMMENDATIONS.getOrDefault(documentType, Map.of()).getOrDefault(usageContext, DEFAULT_PROFILE);
    }

    private ToleranceProfile require(String profileName) {
        return getProfile(profileName).orElseThrow(() -> new UnknownToleranceProfileException(profileName));
    }

    // ── Değerlendirme ───────────────────────────────────────────────

    @Override
    public ToleranceEvaluation evaluateChanges(List<ChangeRecord> changes, String profileName) {
        return evaluateChanges(changes, profileName, null);
    }

    @Override
    public ToleranceEvaluation evaluateChanges(List<ChangeRecord> changes, String profileName, Integer totalElements) {
        ToleranceProfile profile = require(profileName);
        List<ChangeRecord> input = changes != null ? changes : List.of();
        requireComplete(input);

        var ignored = new ArrayList<ChangeRecord>();
        var critical = new ArrayList<ChangeRecord>();
        var byType = new EnumMap<ChangeType, List<ChangeRecord>>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            byType.put(type, new ArrayList<>());
        }

        for (ChangeRecord change : input) {
            List<PathStep> location = LocationPattern.parseLocation(change.location());
            if (coversAny(profile.ignorablePaths(), location)) {
                ignored.add(change);
            } else if (change.severity() == DiffSeverity.CRITICAL && coversAny(profile.criticalPaths(), location)) {
                critical.add(change);
            } else {
                byType.get(change.type()).add(change);
            }
        }

        int denominator = totalElements != null && totalElements > 0 ? totalElements : input.size();
        var violations = new ArrayList<RuleViolation>();
        for (ToleranceRule rule : profile.rules()) {
            int count = countForRule(rule, byType.get(rule.changeType()));
            if (!rule.isWithinTolerance(count, denominator)) {
                double measured = ToleranceRule.percentage(count, denominator);
                violations.add(new RuleViolation(rule, count, denominator, measured,
                        violationMessage(rule, count, denominator, measured)));
            }
        }

        boolean passed = critical.isEmpty() && violations.isEmpty();
        String summary = passed
                ? PASSED_SUMMARY
                : "Tolerance check failed: " + critical.size() + " critical path violation(s), "
                + violations.size() + " tolerance rule violation(s)";

        var frozenByType = new EnumMap<ChangeType, List<ChangeRecord>>(ChangeType.class);
        byType.forEach((type, list) -> frozenByType.put(type, List.copyOf(list)));

        log.debug("Tolerans değerlendirmesi: profil={}, değişiklik={}, yok sayılan={}, kritik={}, kural ihlali={}",
                profile.name(), input.size(), ignored.size(), critical.size(), violations.size());

        return new ToleranceEvaluation(passed, profile.name(), List.copyOf(critical), List.copyOf(violations),
                List.copyOf(ignored), Collections.unmodifiableMap(frozenByType), input.size(), summary);
    }

    private static void requireComplete(List<ChangeRecord> changes) {
        for (int i = 0; i < changes.size(); i++) {
            ChangeRecord change = changes.get(i);
            if (change == null) {
                throw new ToleranceConfigurationException("Değişiklik kaydı #" + i + " boş olamaz");
            }
            if (change.type() == null) {
                throw new ToleranceConfigurationException("Değişiklik kaydı #" + i + " için type belirtilmeli");
            }
            if (change.severity() == null) {
                throw new ToleranceConfigurationException("Değişiklik kaydı #" + i + " için severity belirtilmeli");
            }
        }
    }

    private int countForRule(ToleranceRule rule, List<ChangeRecord> candidates) {
        if (rule.locationPattern() == null) {
            return candidates.size();
        }
        LocationPattern pattern = compiled(rule.locationPattern());
        return (int) candidates.stream()
                .filter(c -> pattern.covers(c.location(), MatchMode.QUALIFIED))
                .count();
    }

    private boolean coversAny(Collection<String> patterns, List<PathStep> location) {
        for (String pattern : patterns) {
            if (compiled(pattern).covers(location, MatchMode.QUALIFIED)) {
                return true;
            }
        }
        return false;
    }

    private static String violationMessage(ToleranceRule rule, int count, int total, double measured) {
        String scope = rule.locationPattern() != null ? " at " + rule.locationPattern() : "";
        return String.format(Locale.ROOT, "%s%s: %d change(s) (%.1f%% of %d) exceeds limit (%s)",
                rule.changeType(), scope, count, measured, total, rule.describeLimits());
    }

    private LocationPattern compiled(String pattern) {
        return patternCache.computeIfAbsent(pattern, LocationPattern::compile);
    }

    private void validatePatterns(ToleranceProfile profile) {
        var all = new ArrayList<String>(profile.criticalPaths());
        all.addAll(profile.ignorablePaths());
        profile.rules().stream()
                .map(ToleranceRule::locationPattern)
                .filter(p -> p != null)
                .forEach(all::add);
        for (String pattern : all) {
            try {
                LocationPattern compiledPattern = compiled(pattern);
                if (!compiledPattern.unresolvedPrefixes().isEmpty()) {
                    log.warn("Profil '{}' deseninde tanınmayan prefix: {} → {}",
                            profile.name(), pattern, compiledPattern.unresolvedPrefixes());
                }
            } catch (IllegalArgumentException e) {
                throw new ToleranceConfigurationException(
                        "Profil '" + profile.name() + "' geçersiz konum deseni içeriyor: " + e.getMessage(), e);
            }
        }
    }

    // ── Profil yönetimi ─────────────────────────────────────────────

    @Override
    public ToleranceProfile adjustTolerance(String profileName, ChangeType changeType,
                                            Double newPercentage, Integer newAbsolute) {
        if (changeType == null) {
            throw new ToleranceConfigurationException("Değişiklik türü belirtilmeli");
        }
        ToleranceProfile current = require(profileName);
        var rules = new ArrayList<ToleranceRule>();
        boolean found = false;
        for (ToleranceRule rule : current.rules()) {
            if (rule.changeType() == changeType) {
                rules.add(rule.withLimits(newPercentage, newAbsolute));
                found = true;
            } else {
                rules.add(rule);
            }
        }
        if (!found) {
            rules.add(new ToleranceRule(changeType, newAbsolute, newPercentage, null, "Adjusted at runtime"));
        }

        ToleranceProfile adjusted = current.withRules(rules);
        profiles.put(adjusted.name(), adjusted);
        log.info("Tolerans sınırı ayarlandı: {} / {} → yüzde={}, mutlak={}",
                profileName, changeType, newPercentage, newAbsolute);
        return adjusted;
    }

    @Override
    public ToleranceProfile createCustomProfile(String name, String baseProfile) {
        validateCustomName(name);
        if (profiles.containsKey(name)) {
            throw new ToleranceConfigurationException("Profil zaten mevcut: " + name);
        }
        ToleranceProfile derived = require(baseProfile).withName(name);
        profiles.put(name, derived);
        log.info("Özel tolerans profili oluşturuldu: {} (temel: {})", name, baseProfile);
        return derived;
    }

    @Override
    public void registerProfile(ToleranceProfile profile) {
        validateCustomName(profile.name());
        validatePatterns(profile);
        profiles.put(profile.name(), profile);
        log.info("Tolerans profili kaydedildi: {}", profile.name());
    }

    @Override
    public boolean removeProfile(String profileName) {
        if (isBuiltIn(profileName)) {
            throw new ToleranceConfigurationException("Yerleşik profil silinemez: " + profileName);
        }
        if (profileName == null || profiles.remove(profileName) == null) {
            return false;
        }
        if (properties.getTolerance().hasProfilesDir()) {
            Path file = Path.of(properties.getTolerance().getProfilesDir()).resolve(profileName + ".yml");
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Profil dosyası silinemedi: {} - {}", file, e.getMessage());
            }
        }
        log.info("Özel tolerans profili silindi: {}", profileName);
        return true;
    }

    private void validateCustomName(String name) {
        if (name == null || !PROFILE_NAME.matcher(name).matches()) {
            throw new ToleranceConfigurationException(
                    "Geçersiz profil adı: '" + name + "' (harf, rakam, '.', '_', '-'; en fazla 64 karakter)");
        }
        if (isBuiltIn(name)) {
            throw new ToleranceConfigurationException("Yerleşik profil adı kullanılamaz: " + name);
        }
    }

    // ── Kalıcılık ───────────────────────────────────────────────────

    @Override
    public void saveProfile(String profileName, Path target) throws IOException {
        String yamlContent = exportProfile(profileName);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, yamlContent, StandardCharsets.UTF_8);
        log.debug("Tolerans profili yazıldı: {} → {}", profileName, target);
    }

    @Override
    public Path persistProfile(String profileName) throws IOException {
        if (!properties.getTolerance().hasProfilesDir()) {
            throw new ToleranceConfigurationException(
                    "Profil dizini yapılandırılmamış. roundtrip.tolerance.profiles-dir ayarlayın "
                            + "(env: ROUNDTRIP_TOLERANCE_PROFILES_DIR).");
        }
        Path target = Path.of(properties.getTolerance().getProfilesDir()).resolve(profileName + ".yml");
        saveProfile(profileName, target);
        log.info("Tolerans profili kalıcı hale getirildi: {}", target);
        return target;
    }

    @Override
    public ToleranceProfile loadProfile(Path source) throws IOException {
        return importProfile(Files.readString(source, StandardCharsets.UTF_8));
    }

    @Override
    public String exportProfile(String profileName) {
        return newDumper().dump(ProfileYaml.toMap(require(profileName)));
    }

    @Override
    public ToleranceProfile importProfile(String yamlContent) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlContent);
        } catch (RuntimeException e) {
            throw new ToleranceConfigurationException("Profil YAML'ı okunamadı: " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ToleranceConfigurationException("Profil YAML'ı bir map olmalı");
        }
        ToleranceProfile profile = ProfileYaml.fromMap(map);
        validatePatterns(profile);
        return profile;
    }

    private static Yaml newDumper() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        options.setIndent(2);
        options.setIndicatorIndent(0);
        return new Yaml(options);
    }

    // ── YAML Loading ────────────────────────────────────────────────

    private static List<ToleranceProfile> loadBuiltIns() {
        try (InputStream is = ToleranceProfileRegistry.class.getClassLoader().getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Yerleşik tolerans profilleri bulunamadı: classpath:" + BUILT_IN_RESOURCE);
            }
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(is);
            if (!(root instanceof Map<?, ?> rootMap) || !(rootMap.get("profiles") instanceof List<?> entries)) {
                throw new IllegalStateException(BUILT_IN_RESOURCE + " içinde 'profiles' listesi bulunamadı");
            }
            var result = new ArrayList<ToleranceProfile>();
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> map) {
                    result.add(ProfileYaml.fromMap(map));
                }
            }
            return result;
        } catch (IOException e) {
            throw new IllegalStateException("Yerleşik tolerans profilleri okunamadı: " + e.getMessage(), e);
        }
    }

    /**
     * Profil ↔ YAML map dönüşümü (snake_case anahtarlar).
     */
    static final class ProfileYaml {

        private ProfileYaml() {
        }

        static Map<String, Object> toMap(ToleranceProfile profile) {
            var root = new LinkedHashMap<String, Object>();
            root.put("name", profile.name());
            root.put("level", profile.level().name());
            var rules = new ArrayList<Map<String, Object>>();
            for (ToleranceRule rule : profile.rules()) {
                var ruleMap = new LinkedHashMap<String, Object>();
                ruleMap.put("change_type", rule.changeType().name());
                if (rule.maxAbsolute() != null) {
                    ruleMap.put("max_absolute", rule.maxAbsolute());
                }
                if (rule.maxPercentage() != null) {
                    ruleMap.put("max_percentage", rule.maxPercentage());
                }
                if (rule.locationPattern() != null) {
                    ruleMap.put("location_pattern", rule.locationPattern());
                }
                ruleMap.put("description", rule.description());
                rules.add(ruleMap);
            }
            root.put("rules", rules);
            root.put("critical_paths", new ArrayList<>(profile.criticalPaths()));
            root.put("ignorable_paths", new ArrayList<>(profile.ignorablePaths()));
            return root;
        }

        static ToleranceProfile fromMap(Map<?, ?> map) {
            Object nameObj = map.get("name");
            if (nameObj == null || nameObj.toString().isBlank()) {
                throw new ToleranceConfigurationException("Profilde 'name' alanı eksik");
            }
            String name = nameObj.toString().trim();
            ToleranceLevel level = enumValue(ToleranceLevel.class, map.get("level"), "level", name);

            var rules = new ArrayList<ToleranceRule>();
            if (map.get("rules") instanceof List<?> ruleList) {
                for (Object item : ruleList) {
                    if (!(item instanceof Map<?, ?> ruleMap)) {
                        throw new ToleranceConfigurationException("Profil '" + name + "' kuralı bir map değil");
                    }
                    rules.add(new ToleranceRule(
                            enumValue(ChangeType.class, ruleMap.get("change_type"), "change_type", name),
                            ruleMap.get("max_absolute") instanceof Number n ? Integer.valueOf(n.intValue()) : null,
                            ruleMap.get("max_percentage") instanceof Number n ? Double.valueOf(n.doubleValue()) : null,
                            ruleMap.get("location_pattern") != null ? ruleMap.get("location_pattern").toString() : null,
                            ruleMap.get("description") != null ? ruleMap.get("description").toString() : ""));
                }
            }
            return new ToleranceProfile(name, level, rules,
                    stringSet(map.get("critical_paths")), stringSet(map.get("ignorable_paths")));
        }

        private static Set<String> stringSet(Object value) {
            var result = new LinkedHashSet<String>();
            if (value instanceof List<?> list) {
                for (Object item : list) {
                    if (item != null && !item.toString().isBlank()) {
                        result.add(item.toString().trim());
                    }
                }
            }
            return result;
        }

        private static <E extends Enum<E>> E enumValue(Class<E> type, Object value, String field, String profile) {
            if (value == null) {
                throw new ToleranceConfigurationException("Profil '" + profile + "' içinde '" + field + "' alanı eksik");
            }
            try {
                return Enum.valueOf(type, value.toString().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ToleranceConfigurationException(
                        "Profil '" + profile + "' içinde geçersiz '" + field + "' değeri: " + value, e);
            }
        }
    }
}
