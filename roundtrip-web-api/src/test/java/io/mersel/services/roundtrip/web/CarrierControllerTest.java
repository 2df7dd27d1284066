package io.mersel.services.roundtrip.web;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.ICarrierAnalyzer;
import io.mersel.services.roundtrip.application.interfaces.IDocumentTypeDetector;
import io.mersel.services.roundtrip.application.models.CarrierAnalysisResult;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CarrierPreservationMetrics;
import io.mersel.services.roundtrip.application.models.CriticalCarrierSurvival;
import io.mersel.services.roundtrip.application.models.TokenChanges;
import io.mersel.services.roundtrip.application.models.TokenValueChange;
import io.mersel.services.roundtrip.infrastructure.diagnostics.RoundTripMetrics;
import io.mersel.services.roundtrip.web.controllers.CarrierController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("CarrierController")
class CarrierControllerTest {

    @Mock
    private ICarrierAnalyzer carrierAnalyzer;

    @Mock
    private IDocumentTypeDetector documentTypeDetector;

    @Mock
    private RoundTripMetrics metrics;

    private MockMvc mockMvc;

    private final MockMultipartFile document =
            new MockMultipartFile("document", "sablon.xml", "application/xml", WebTestSupport.wordXml("00A1", "Merhaba"));

    @BeforeEach
    void setUp() {
        mockMvc = WebTestSupport.mockMvc(new CarrierController(carrierAnalyzer, documentTypeDetector, metrics));
    }

    @Test
    @DisplayName("POST /v1/carriers/analyze → açık belge türü ile analiz")
    void analyzeWithExplicitType() throws Exception {
        CarrierAnalysisResult analysis = CarrierAnalysisResult.empty();
        when(carrierAnalyzer.analyzeCarriers(any(byte[].class), eq(DocumentType.WORD))).thenReturn(analysis);
        when(carrierAnalyzer.getCriticalCarrierSurvival(analysis))
                .thenReturn(new CriticalCarrierSurvival(0, 0, 0.0, List.of(), List.of()));

        mockMvc.perform(multipart("/v1/carriers/analyze").file(document).param("documentType", "word"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.document_type").value("WORD"))
                .andExpect(jsonPath("$.result.analysis.survival_rate").value(0.0))
                .andExpect(jsonPath("$.result.analysis.category_breakdown.CRITICAL").exists())
                .andExpect(jsonPath("$.result.critical_survival.detected_count").value(0));

        verify(metrics).recordCarrierAnalysis("WORD", "analyze");
        verifyNoInteractions(documentTypeDetector);
    }

    @Test
    @DisplayName("POST /v1/carriers/analyze → tür tespit edilemezse 400")
    void analyzeUndetectedType() throws Exception {
        when(documentTypeDetector.detect(any(byte[].class)))
                .thenThrow(new DocumentTypeDetectionException("localName=document"));

        mockMvc.perform(multipart("/v1/carriers/analyze").file(document))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Belge Türü Tespit Edilemedi"));

        verifyNoInteractions(carrierAnalyzer);
    }

    @Test
    @DisplayName("POST /v1/carriers/analyze → geçersiz belge türü parametresi 400")
    void analyzeInvalidType() throws Exception {
        mockMvc.perform(multipart("/v1/carriers/analyze").file(document).param("documentType", "visio"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", startsWith("Geçersiz belge türü: 'visio'")));
    }

    @Test
    @DisplayName("POST /v1/carriers/analyze → boş belge 400")
    void analyzeEmptyDocument() throws Exception {
        var empty = new MockMultipartFile("document", "bos.xml", "application/xml", new byte[0]);

        mockMvc.perform(multipart("/v1/carriers/analyze").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_message").value("Belge boş olamaz"));
    }

    @Test
    @DisplayName("POST /v1/carriers/compare → tür orijinalden tespit edilir, rapor döner")
    void compare() throws Exception {
        var comparison = new CarrierComparison(
                CarrierAnalysisResult.empty(),
                CarrierAnalysisResult.empty(),
                new CarrierPreservationMetrics(2, 1, 1, 0, 0, 50.0, 50.0, 0.0, 0.5),
                new TokenChanges(
                        Map.of("tokens.color.primary", "4472C4"),
                        Map.of("tokens.typography.fontFamily.heading", new TokenValueChange("Calibri Light", "Carlito")),
                        Map.of(),
                        Map.of()));
        when(documentTypeDetector.detect(any(byte[].class))).thenReturn(DocumentType.WORD);
        when(carrierAnalyzer.compareCarriers(any(byte[].class), any(byte[].class), eq(DocumentType.WORD)))
                .thenReturn(comparison);
        when(carrierAnalyzer.generateCarrierReport(comparison)).thenReturn("Design Token Carrier Analysis Report");

        var original = new MockMultipartFile("original", "a.xml", "application/xml",
                WebTestSupport.wordXml("00A1", "Merhaba"));
        var converted = new MockMultipartFile("converted", "b.xml", "application/xml",
                WebTestSupport.wordXml("00B2", "Merhaba"));

        mockMvc.perform(multipart("/v1/carriers/compare").file(original).file(converted))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.document_type").value("WORD"))
                .andExpect(jsonPath("$.result.comparison.preservation_metrics.preservation_rate").value(50.0))
                .andExpect(jsonPath("$.result.comparison.token_changes.modified['tokens.typography.fontFamily.heading']"
                        + ".converted").value("Carlito"))
                .andExpect(jsonPath("$.result.report").value("Design Token Carrier Analysis Report"));

        verify(metrics).recordCarrierAnalysis("WORD", "compare");
    }
}
