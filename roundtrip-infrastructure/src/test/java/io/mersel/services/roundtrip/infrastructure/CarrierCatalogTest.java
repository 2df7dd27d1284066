package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.CarrierMapping;
import io.mersel.services.roundtrip.application.models.QualifiedName;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CarrierCatalog")
class CarrierCatalogTest {

    private static List<CarrierMapping> parse(String yaml) {
        return CarrierCatalog.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Yerleşik katalog")
    class BuiltIn {

        private final CarrierCatalog catalog = new CarrierCatalog();

        @Test
        @DisplayName("Her belge türü için girdi içerir")
        void coversEveryDocumentType() {
            assertThat(catalog.getMappings()).isNotEmpty();
            assertThat(catalog.sizeByDocumentType()).allSatisfy((type, size) -> assertThat(size).isPositive());
        }

        @Test
        @DisplayName("Tema renkleri ve yazı tipleri CRITICAL")
        void themeCarriersAreCritical() {
            assertThat(catalog.getMappings())
                    .filteredOn(m -> m.locationPattern().contains("a:clrScheme//")
                            || m.locationPattern().contains("a:fontScheme//"))
                    .isNotEmpty()
                    .allMatch(m -> m.significance() == CarrierSignificance.CRITICAL);
        }

        @Test
        @DisplayName("Namespace kimlikleri desenden türetilir")
        void namespaceIdentities() {
            assertThat(catalog.getMappings())
                    .filteredOn(m -> m.locationPattern().equals("//w:color/@w:val"))
                    .singleElement()
                    .satisfies(m -> assertThat(m.namespaceIdentities()).containsExactly(OoxmlNamespaces.W));
        }

        @Test
        @DisplayName("Token yolundan taşıyıcı türü")
        void kindOfToken() {
            assertThat(catalog.kindOfToken("tokens.color.primary")).contains(CarrierKind.COLOR_SCHEME);
            assertThat(catalog.kindOfToken("tokens.unknown")).isEmpty();
            assertThat(catalog.kindOfToken(null)).isEmpty();
        }

        @Test
        @DisplayName("Düğüm yolunun önem seviyesi")
        void significanceOf() {
            var path = List.of(
                    PathStep.element(QualifiedName.of(OoxmlNamespaces.W, "rPr")),
                    PathStep.element(QualifiedName.of(OoxmlNamespaces.W, "color")),
                    PathStep.attribute(QualifiedName.of(OoxmlNamespaces.W, "val")));

            assertThat(catalog.significanceOf(DocumentType.WORD, path)).contains(CarrierSignificance.IMPORTANT);
            assertThat(catalog.significanceOf(DocumentType.SPREADSHEET, path)).isEmpty();
        }
    }

    @Nested
    @DisplayName("YAML ayrıştırma")
    class Parsing {

        @Test
        @DisplayName("Geçerli girdi; document-types boşsa tüm türler")
        void validEntry() {
            List<CarrierMapping> mappings = parse("""
                    carriers:
                      - pattern: "//a:clrScheme//a:srgbClr/@val"
                        kind: color_scheme
                        significance: critical
                        token: tokens.color.primary
                    """);

            assertThat(mappings).singleElement().satisfies(m -> {
                assertThat(m.carrierKind()).isEqualTo(CarrierKind.COLOR_SCHEME);
                assertThat(m.applicableDocumentTypes()).containsExactlyInAnyOrder(DocumentType.values());
                assertThat(m.description()).isEqualTo("tokens.color.primary");
            });
        }

        @Test
        @DisplayName("Eksik alan → indeks ve alan adıyla hata")
        void missingField() {
            assertThatThrownBy(() -> parse("""
                    carriers:
                      - pattern: "//w:b"
                        kind: CHARACTER_STYLE
                        significance: IMPORTANT
                        token: tokens.bold
                      - pattern: "//w:i"
                        kind: CHARACTER_STYLE
                        token: tokens.italic
                    """))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("#1")
                    .hasMessageContaining("significance");
        }

        @Test
        @DisplayName("Geçersiz enum değeri reddedilir")
        void invalidKind() {
            assertThatThrownBy(() -> parse("""
                    carriers:
                      - pattern: "//w:b"
                        kind: SHAPE_STYLE
                        significance: IMPORTANT
                        token: tokens.bold
                    """))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("kind")
                    .hasMessageContaining("SHAPE_STYLE");
        }

        @Test
        @DisplayName("Geçersiz belge türü reddedilir")
        void invalidDocumentType() {
            assertThatThrownBy(() -> parse("""
                    carriers:
                      - pattern: "//w:b"
                        kind: CHARACTER_STYLE
                        significance: IMPORTANT
                        token: tokens.bold
                        document-types: [visio]
                    """))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("visio");
        }

        @Test
        @DisplayName("'carriers' listesi yoksa hata")
        void missingRoot() {
            assertThatThrownBy(() -> parse("mappings: []"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("carriers");
        }
    }
}
