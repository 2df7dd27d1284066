package io.mersel.services.roundtrip.web;

import io.mersel.services.roundtrip.infrastructure.ToleranceProfileRegistry;
import io.mersel.services.roundtrip.infrastructure.config.RoundTripProperties;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.controllers.ToleranceController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ToleranceController birim testleri.
 * <p>
 * Gerçek profil kayıt defteri ile çalışır; yerleşik profil koruması, özel profil yaşam döngüsü,
 * değerlendirme ve öneri endpoint'lerini doğrular.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("/v1/tolerance")
class ToleranceControllerTest {

    @Mock
    private RoundTripMetrics metrics;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var registry = new ToleranceProfileRegistry(new RoundTripProperties());
        mockMvc = WebTestSupport.mockMvc(new ToleranceController(registry, registry, metrics));
    }

    // ── Profiller ───────────────────────────────────────────────────

    @Nested
    @DisplayName("Profil yönetimi")
    class Profiles {

        @Test
        @DisplayName("GET /profiles → dört yerleşik profil")
        void listProfiles() throws Exception {
            mockMvc.perform(get("/v1/tolerance/profiles"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total_profiles").value(4))
                    .andExpect(jsonPath("$.built_in_profiles", hasItem("permissive")))
                    .andExpect(jsonPath("$.profiles.strict.level").value("STRICT"))
                    .andExpect(jsonPath("$.profiles.normal.critical_paths", hasItem("//w:t")));
        }

        @Test
        @DisplayName("GET /profiles/{name} bilinmeyen → 404")
        void unknownProfile() throws Exception {
            mockMvc.perform(get("/v1/tolerance/profiles/kurumsal"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.title").value("Profil Bulunamadı"));
        }

        @Test
        @DisplayName("POST /profiles → 201, yerleşik ad → 400")
        void createProfile() throws Exception {
            mockMvc.perform(post("/v1/tolerance/profiles")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"kurumsal\",\"base_profile\":\"strict\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.name").value("kurumsal"))
                    .andExpect(jsonPath("$.level").value("STRICT"));

            mockMvc.perform(post("/v1/tolerance/profiles")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"strict\",\"base_profile\":\"normal\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Geçersiz Tolerans Yapılandırması"));
        }

        @Test
        @DisplayName("PATCH /rules/{changeType} → sınır güncellenir")
        void adjustTolerance() throws Exception {
            mockMvc.perform(patch("/v1/tolerance/profiles/normal/rules/COLOR_SHIFT")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"max_percentage\":5.0}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rules[?(@.change_type == 'COLOR_SHIFT')].max_percentage", hasItem(5.0)));
        }

        @Test
        @DisplayName("PATCH geçersiz değişiklik türü veya sınır → 400")
        void adjustInvalid() throws Exception {
            mockMvc.perform(patch("/v1/tolerance/profiles/normal/rules/NOT_A_TYPE")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"max_percentage\":5.0}"))
                    .andExpect(status().isBadRequest());

            mockMvc.perform(patch("/v1/tolerance/profiles/normal/rules/COLOR_SHIFT")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"max_percentage\":120.0}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("DELETE yerleşik → 400, olmayan → 404, özel → 204")
        void removeProfile() throws Exception {
            mockMvc.perform(delete("/v1/tolerance/profiles/strict"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(delete("/v1/tolerance/profiles/yok"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("Not found"));

            mockMvc.perform(post("/v1/tolerance/profiles")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"gecici\",\"base_profile\":\"lenient\"}"))
                    .andExpect(status().isCreated());
            mockMvc.perform(delete("/v1/tolerance/profiles/gecici"))
                    .andExpect(status().isNoContent());
        }

        @Test
        @DisplayName("Profil dizini yokken /save → 400")
        void saveWithoutDirectory() throws Exception {
            mockMvc.perform(post("/v1/tolerance/profiles/normal/save"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail", containsString("profiles-dir")));
        }

        @Test
        @DisplayName("POST /profiles/reload → OK, metrik kaydedilir")
        void reload() throws Exception {
            mockMvc.perform(post("/v1/tolerance/profiles/reload"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("OK"))
                    .andExpect(jsonPath("$.component_name").value("Tolerance Profiles"));
        }
    }

    // ── YAML ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("YAML içe/dışa aktarma")
    class Yaml {

        @Test
        @DisplayName("GET /export → YAML metni")
        void exportProfile() throws Exception {
            mockMvc.perform(get("/v1/tolerance/profiles/strict/export"))
                    .andExpect(status().isOk())
                    .andExpect(content().string(containsString("name: strict")))
                    .andExpect(content().string(containsString("critical_paths:")));
        }

        @Test
        @DisplayName("POST /import → 201 ve profil kullanılabilir")
        void importProfile() throws Exception {
            String yaml = """
                    name: sunum
                    level: lenient
                    rules:
                      - change_type: FONT_SUBSTITUTION
                        max_percentage: 40
                    critical_paths:
                      - "//a:t"
                    """;

            mockMvc.perform(post("/v1/tolerance/profiles/import")
                            .contentType("application/yaml")
                            .content(yaml))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.name").value("sunum"))
                    .andExpect(jsonPath("$.rules[0].max_percentage").value(40.0));

            mockMvc.perform(get("/v1/tolerance/profiles/sunum"))
                    .andExpect(status().isOk());
        }
    }

    // ── Değerlendirme ───────────────────────────────────────────────

    @Nested
    @DisplayName("Değerlendirme ve öneri")
    class Evaluation {

        @Test
        @DisplayName("POST /evaluate → kritik yol ihlali passed=false döner (200)")
        void evaluate() throws Exception {
            String body = """
                    {
                      "profile_name": "normal",
                      "total_elements": 100,
                      "changes": [
                        {"type": "CONTENT_LOSS", "location": "/w:document[1]/w:body[1]/w:p[1]/w:r[1]/w:t[1]/text()",
                         "severity": "CRITICAL"},
                        {"type": "METADATA_CHANGE", "location": "/w:document[1]/w:body[1]/w:p[1]/@w:rsidR",
                         "severity": "IGNORABLE"}
                      ]
                    }
                    """;

            mockMvc.perform(post("/v1/tolerance/evaluate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.passed").value(false))
                    .andExpect(jsonPath("$.critical_violations.length()").value(1))
                    .andExpect(jsonPath("$.ignored_changes.length()").value(1))
                    .andExpect(jsonPath("$.summary", containsString("1 critical path violation(s)")));

            verify(metrics).recordToleranceEvaluation("normal", false);
        }

        @Test
        @DisplayName("Eksik profil adı → 400 doğrulama hatası")
        void evaluateValidation() throws Exception {
            mockMvc.perform(post("/v1/tolerance/evaluate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"changes\": []}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Türü eksik değişiklik kaydı → 400, alan yolu ayrıntıda")
        void evaluateChangeWithoutType() throws Exception {
            String body = """
                    {
                      "profile_name": "normal",
                      "changes": [
                        {"location": "/w:document[1]/w:body[1]/w:p[1]", "severity": "MINOR"}
                      ]
                    }
                    """;

            mockMvc.perform(post("/v1/tolerance/evaluate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail", containsString("changes[0].type")));

            verify(metrics, never()).recordToleranceEvaluation(anyString(), anyBoolean());
        }

        @Test
        @DisplayName("GET /recommendation → docx + draft = lenient")
        void recommendation() throws Exception {
            mockMvc.perform(get("/v1/tolerance/recommendation")
                            .param("documentType", "docx")
                            .param("usageContext", "draft"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.document_type").value("WORD"))
                    .andExpect(jsonPath("$.usage_context").value("DRAFT"))
                    .andExpect(jsonPath("$.profile_name").value("lenient"));
        }

        @Test
        @DisplayName("GET /recommendation parametresiz → normal; tanınmayan bağlam → 400")
        void recommendationDefaults() throws Exception {
            mockMvc.perform(get("/v1/tolerance/recommendation"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.profile_name").value("normal"));
            mockMvc.perform(get("/v1/tolerance/recommendation").param("usageContext", "archive"))
                    .andExpect(status().isBadRequest());
        }
    }
}
