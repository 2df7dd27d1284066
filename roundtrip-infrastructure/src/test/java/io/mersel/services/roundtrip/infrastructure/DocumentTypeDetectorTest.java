package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.mersel.services.roundtrip.infrastructure.OoxmlFixtures.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DocumentTypeDetector birim testleri.
 * <p>
 * Paketlerde ana parçadan, tek XML parçalarında kök namespace'ten tespit yapıldığını,
 * tanınmayan içerik için uygun exception fırlatıldığını test eder.
 */
@DisplayName("DocumentTypeDetector")
class DocumentTypeDetectorTest {

    private final DocumentTypeDetector detector = new DocumentTypeDetector();

    // ── Tek XML parçası ─────────────────────────────────────────────

    @Nested
    @DisplayName("XML parçası")
    class XmlParts {

        @Test
        @DisplayName("WordprocessingML namespace → WORD")
        void detect_word() throws Exception {
            assertThat(detector.detect(bytes(OoxmlFixtures.wordDocument("FF0000", "A"))))
                    .isEqualTo(DocumentType.WORD);
        }

        @Test
        @DisplayName("PresentationML namespace → PRESENTATION")
        void detect_presentation() throws Exception {
            byte[] xml = bytes("""
                    <p:presentation xmlns:p="http://schemas.openxmlformats.org/presentationml/2006/main">
                      <p:sldIdLst/>
                    </p:presentation>
                    """);

            assertThat(detector.detect(xml)).isEqualTo(DocumentType.PRESENTATION);
        }

        @Test
        @DisplayName("SpreadsheetML varsayılan namespace → SPREADSHEET")
        void detect_spreadsheet() throws Exception {
            byte[] xml = bytes("""
                    <worksheet xmlns="http://schemas.openxmlformats.org/spreadsheetml/2006/main">
                      <sheetData/>
                    </worksheet>
                    """);

            assertThat(detector.detect(xml)).isEqualTo(DocumentType.SPREADSHEET);
        }

        @Test
        @DisplayName("Tanınmayan namespace → DocumentTypeDetectionException")
        void unknownNamespace() {
            assertThatThrownBy(() -> detector.detect(bytes("<root xmlns=\"urn:example\"/>")))
                    .isInstanceOf(DocumentTypeDetectionException.class)
                    .hasMessageContaining("urn:example");
        }

        @Test
        @DisplayName("Namespace'siz kök → DocumentTypeDetectionException")
        void noNamespace() {
            assertThatThrownBy(() -> detector.detect(bytes("<document/>")))
                    .isInstanceOf(DocumentTypeDetectionException.class)
                    .hasMessageContaining("localName=document");
        }

        @Test
        @DisplayName("Geçersiz XML ve boş içerik reddedilir")
        void invalidInput() {
            assertThatThrownBy(() -> detector.detect(bytes("not xml")))
                    .isInstanceOf(DocumentTypeDetectionException.class);
            assertThatThrownBy(() -> detector.detect(new byte[0]))
                    .isInstanceOf(DocumentTypeDetectionException.class);
        }
    }

    // ── Paketler ────────────────────────────────────────────────────

    @Nested
    @DisplayName("OOXML paketi")
    class Packages {

        @Test
        @DisplayName("word/document.xml → WORD")
        void detect_docx() throws Exception {
            byte[] docx = OoxmlFixtures.zip(Map.of(
                    "word/document.xml", OoxmlFixtures.wordDocument("FF0000", "A"),
                    "word/theme/theme1.xml", OoxmlFixtures.theme("4472C4", "Calibri")));

            assertThat(detector.detect(docx)).isEqualTo(DocumentType.WORD);
        }

        @Test
        @DisplayName("xl/workbook.xml → SPREADSHEET")
        void detect_xlsx() throws Exception {
            byte[] xlsx = OoxmlFixtures.zip(Map.of(
                    "xl/workbook.xml",
                    "<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\"/>"));

            assertThat(detector.detect(xlsx)).isEqualTo(DocumentType.SPREADSHEET);
        }

        @Test
        @DisplayName("Ana parçası olmayan paket → DocumentTypeDetectionException")
        void missingMainPart() {
            byte[] pkg = OoxmlFixtures.zip(Map.of(
                    "docProps/core.xml", "<cp:coreProperties xmlns:cp=\"urn:x\"/>"));

            assertThatThrownBy(() -> detector.detect(pkg))
                    .isInstanceOf(DocumentTypeDetectionException.class)
                    .hasMessageContaining("docProps/core.xml");
        }
    }
}
