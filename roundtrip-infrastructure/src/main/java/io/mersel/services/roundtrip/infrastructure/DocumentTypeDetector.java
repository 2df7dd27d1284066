package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.DocumentTypeDetectionException;
import io.mersel.services.roundtrip.application.interfaces.IDocumentTypeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.ByteArrayInputStream;
import java.util.Map;

/**
 * OOXML belge türü tespit implementasyonu.
 * <p>
 * Paketlerde ana parça adına bakılır:
 * <ul>
 *   <li>{@code word/document.xml} → WORD</li>
 *   <li>{@code ppt/presentation.xml} → PRESENTATION</li>
 *   <li>{@code xl/workbook.xml} → SPREADSHEET</li>
 * </ul>
 * Tek XML parçalarında full DOM parse yapılmaz; SAX ile yalnızca kök öğenin
 * namespace URI'si okunur ve parse erken durdurulur.
 */
@Service
public class DocumentTypeDetector implements IDocumentTypeDetector {

    private static final Logger log = LoggerFactory.getLogger(DocumentTypeDetector.class);

    // ── Ana parça → DocumentType eşlemesi ──
    private static final Map<String, DocumentType> MAIN_PART_MAP = Map.of(
            "word/document.xml", DocumentType.WORD,
            "ppt/presentation.xml", DocumentType.PRESENTATION,
            "xl/workbook.xml", DocumentType.SPREADSHEET
    );

    // ── Kök namespace → DocumentType eşlemesi ──
    private static final Map<String, DocumentType> ROOT_NAMESPACE_MAP = Map.of(
            OoxmlNamespaces.W, DocumentType.WORD,
            OoxmlNamespaces.P, DocumentType.PRESENTATION,
            OoxmlNamespaces.X, DocumentType.SPREADSHEET
    );

    @Override
    public DocumentType detect(byte[] content) throws DocumentTypeDetectionException {
        if (content == null || content.length == 0) {
            throw new DocumentTypeDetectionException("Belge içeriği boş");
        }
        if (OoxmlPackageReader.isPackage(content)) {
            return detectPackage(content);
        }
        return detectXml(content);
    }

    private DocumentType detectPackage(byte[] content) throws DocumentTypeDetectionException {
        Map<String, byte[]> parts;
        try {
            parts = OoxmlPackageReader.readParts(content, "paket");
        } catch (DocumentParseException e) {
            throw new DocumentTypeDetectionException("OOXML paketi okunamadı: " + e.getMessage(), e);
        }
        for (var entry : MAIN_PART_MAP.entrySet()) {
            if (parts.containsKey(entry.getKey())) {
                log.debug("Belge türü tespit edildi: {} (ana parça={})", entry.getValue(), entry.getKey());
                return entry.getValue();
            }
        }
        throw new DocumentTypeDetectionException(
                "Belge türü tespit edilemedi. Pakette ana parça yok: " + parts.keySet());
    }

    private DocumentType detectXml(byte[] content) throws DocumentTypeDetectionException {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            // XXE koruma
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

            SAXParser parser = factory.newSAXParser();
            var handler = new RootElementHandler();

            try {
                parser.parse(new ByteArrayInputStream(content), handler);
            } catch (DetectionCompleteException e) {
                // Normal akış: parse kök öğede durduruldu
            }

            DocumentType result = handler.rootNamespace != null
                    ? ROOT_NAMESPACE_MAP.get(handler.rootNamespace)
                    : null;
            if (result == null) {
                throw new DocumentTypeDetectionException(
                        "Belge türü tespit edilemedi. Tanınmayan kök öğe: "
                                + "namespace=" + handler.rootNamespace
                                + ", localName=" + handler.rootLocalName);
            }

            log.debug("Belge türü tespit edildi: {} (namespace={}, root={})",
                    result, handler.rootNamespace, handler.rootLocalName);
            return result;

        } catch (DocumentTypeDetectionException e) {
            throw e;
        } catch (Exception e) {
            throw new DocumentTypeDetectionException("XML parse hatası: " + e.getMessage(), e);
        }
    }

    // ── SAX Handler ─────────────────────────────────────────────────

    /**
     * Parse'ı kök öğede durdurmak için kullanılan sentinel exception.
     */
    private static class DetectionCompleteException extends SAXException {
        DetectionCompleteException() {
            super("Detection complete");
        }
    }

    private static class RootElementHandler extends DefaultHandler {

        private String rootNamespace;
        private String rootLocalName;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes)
                throws SAXException {
            rootNamespace = uri;
            rootLocalName = localName;
            throw new DetectionCompleteException();
        }
    }
}
