package io.mersel.services.roundtrip.web.controllers;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.UsageContext;
import io.mersel.services.roundtrip.application.interfaces.IToleranceProfileService;
import io.mersel.services.roundtrip.application.interfaces.ReloadResult;
import io.mersel.services.roundtrip.application.interfaces.Reloadable;
import io.mersel.services.roundtrip.application.interfaces.UnknownToleranceProfileException;
import io.mersel.services.roundtrip.application.models.ToleranceEvaluation;
import io.mersel.services.roundtrip.application.models.ToleranceProfile;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.dto.AdjustToleranceRequest;
import io.mersel.services.roundtrip.web.dto.CreateProfileRequest;
import io.mersel.services.roundtrip.web.dto.ErrorResponse;
import io.mersel.services.roundtrip.web.dto.EvaluateChangesRequest;
import io.mersel.services.roundtrip.web.dto.ProfileListResponse;
import io.mersel.services.roundtrip.web.dto.RecommendationResponse;
import io.mersel.services.roundtrip.web.infrastructure.RequestParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Tolerans profili yönetimi ve değişiklik değerlendirme endpoint'leri.
 * <p>
 * Yerleşik profiller ({@code strict}, {@code normal}, {@code lenient}, {@code permissive})
 * silinemez. Özel profiller bu profillerden türetilir ve isteğe bağlı olarak profil
 * dizinine YAML olarak kaydedilir.
 */
@RestController
@RequestMapping("/v1/tolerance")
@Tag(name = "Tolerance", description = "Tolerans profilleri ve değişiklik değerlendirme")
public class ToleranceController {

    private static final Logger log = LoggerFactory.getLogger(ToleranceController.class);
    private static final MediaType APPLICATION_YAML = new MediaType("application", "yaml");

    private final IToleranceProfileService profileService;
    private final Reloadable profileReloader;
    private final RoundTripMetrics metrics;

    public ToleranceController(IToleranceProfileService profileService,
                               Reloadable profileReloader,
                               RoundTripMetrics metrics) {
        this.profileService = profileService;
        this.profileReloader = profileReloader;
        this.metrics = metrics;
    }

    // ── Profiller ───────────────────────────────────────────────────

    @GetMapping("/profiles")
    @Operation(summary = "Tolerans profillerini listele",
            description = "Yerleşik ve özel tüm profilleri kuralları ve yol kümeleriyle birlikte döner.")
    public ResponseEntity<ProfileListResponse> listProfiles() {
        Map<String, ToleranceProfile> profiles = profileService.getAvailableProfiles();
        var builtIn = profiles.keySet().stream().filter(profileService::isBuiltIn).toList();
        return ResponseEntity.ok(new ProfileListResponse(profiles.size(), builtIn, profiles));
    }

    @GetMapping("/profiles/{name}")
    @Operation(summary = "Tolerans profilini getir")
    public ResponseEntity<ToleranceProfile> getProfile(@PathVariable String name) {
        return ResponseEntity.ok(profileService.getProfile(name)
                .orElseThrow(() -> new UnknownToleranceProfileException(name)));
    }

    @PostMapping("/profiles")
    @Operation(summary = "Özel profil oluştur",
            description = "Temel profilin kurallarını ve yol kümelerini yeni bir ad altında kopyalar. "
                    + "Temel profil değişmez.")
    public ResponseEntity<ToleranceProfile> createProfile(@RequestBody @Valid CreateProfileRequest request) {
        ToleranceProfile created = profileService.createCustomProfile(request.name(), request.baseProfile());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/profiles/{name}/rules/{changeType}")
    @Operation(summary = "Tolerans sınırını ayarla",
            description = "Bir değişiklik türünün yüzde ve/veya mutlak sınırını değiştirir. Verilmeyen sınır korunur; "
                    + "profilde bu türe ait kural yoksa eklenir.")
    public ResponseEntity<ToleranceProfile> adjustTolerance(@PathVariable String name,
                                                            @PathVariable ChangeType changeType,
                                                            @RequestBody AdjustToleranceRequest request) {
        return ResponseEntity.ok(profileService.adjustTolerance(
                name, changeType, request.maxPercentage(), request.maxAbsolute()));
    }

    @DeleteMapping("/profiles/{name}")
    @Operation(summary = "Özel profili sil", description = "Yerleşik profiller silinemez (400).")
    public ResponseEntity<?> removeProfile(@PathVariable String name) {
        if (!profileService.removeProfile(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("Not found", "Tolerans profili bulunamadı: " + name));
        }
        return ResponseEntity.noContent().build();
    }

    // ── İçe / dışa aktarma ──────────────────────────────────────────

    @GetMapping(value = "/profiles/{name}/export", produces = "application/yaml")
    @Operation(summary = "Profili YAML olarak dışa aktar")
    public ResponseEntity<String> exportProfile(@PathVariable String name) {
        return ResponseEntity.ok().contentType(APPLICATION_YAML).body(profileService.exportProfile(name));
    }

    @PostMapping(value = "/profiles/import", consumes = {"application/yaml", MediaType.TEXT_PLAIN_VALUE})
    @Operation(summary = "YAML profilini içe aktar",
            description = "YAML metnini okur ve profili kaydeder. Yerleşik profil adları kullanılamaz.")
    public ResponseEntity<ToleranceProfile> importProfile(@RequestBody String yamlContent) {
        ToleranceProfile profile = profileService.importProfile(yamlContent);
        profileService.registerProfile(profile);
        return ResponseEntity.status(HttpStatus.CREATED).body(profile);
    }

    @PostMapping("/profiles/{name}/save")
    @Operation(summary = "Profili profil dizinine kaydet",
            description = "Profili roundtrip.tolerance.profiles-dir dizinine <ad>.yml olarak yazar.")
    public ResponseEntity<Map<String, String>> saveProfile(@PathVariable String name) throws IOException {
        Path saved = profileService.persistProfile(name);
        return ResponseEntity.ok(Map.of("profile", name, "path", saved.toString()));
    }

    @PostMapping("/profiles/reload")
    @Operation(summary = "Profil dizinini yeniden yükle")
    public ResponseEntity<ReloadResult> reloadProfiles() {
        ReloadResult result = profileReloader.reload();
        metrics.recordReload(result.status() == ReloadResult.Status.OK, result.durationMs());
        log.info("{} yeniden yüklendi: {} profil, durum={}", result.componentName(), result.loadedCount(),
                result.status());
        return ResponseEntity.ok(result);
    }

    // ── Değerlendirme ───────────────────────────────────────────────

    @PostMapping("/evaluate")
    @Operation(summary = "Değişiklikleri değerlendir",
            description = """
                    Değişiklik kayıtlarını profile göre değerlendirir.

                    Yok sayılan yollara düşen değişiklikler sayılmaz; kritik yollardaki CRITICAL değişiklikler
                    sınırlardan bağımsız olarak başarısız sayılır. Tolerans aşımı hata değildir, `passed=false` döner.
                    """)
    public ResponseEntity<ToleranceEvaluation> evaluate(@RequestBody @Valid EvaluateChangesRequest request) {
        ToleranceEvaluation evaluation = profileService.evaluateChanges(
                request.toChangeRecords(), request.profileName(), request.totalElements());
        metrics.recordToleranceEvaluation(evaluation.profileUsed(), evaluation.passed());
        return ResponseEntity.ok(evaluation);
    }

    @GetMapping("/recommendation")
    @Operation(summary = "Önerilen profil",
            description = "Belge türü ve kullanım bağlamına göre önerilen profili döner; tanınmayan kombinasyonlar "
                    + "için 'normal'.")
    public ResponseEntity<RecommendationResponse> recommend(
            @RequestParam(value = "documentType", required = false) String documentTypeParam,
            @RequestParam(value = "usageContext", required = false) String usageContextParam) {
        DocumentType documentType = RequestParams.documentType(documentTypeParam);
        UsageContext usageContext = RequestParams.usageContext(usageContextParam);
        return ResponseEntity.ok(new RecommendationResponse(documentType, usageContext,
                profileService.getRecommendedProfile(documentType, usageContext)));
    }
}
