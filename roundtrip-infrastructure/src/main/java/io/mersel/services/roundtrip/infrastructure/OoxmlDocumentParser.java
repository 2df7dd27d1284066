package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;
import io.mersel.services.roundtrip.application.interfaces.IDocumentParser;
import io.mersel.services.roundtrip.application.models.ParsedDocument;
import io.mersel.services.roundtrip.application.models.QualifiedName;
import io.mersel.services.roundtrip.application.models.XmlAttribute;
import io.mersel.services.roundtrip.application.models.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JAXP DOM tabanlı OOXML ayrıştırıcı.
 * <p>
 * Tek XML parçası veya ZIP paketi kabul eder. Paketlerde her XML parçası,
 * {@code name} özniteliği parça yolunu taşıyan bir {@code pkg:part} öğesine sarılır
 * ve tümü sentetik {@code pkg:package} kökü altında tek bir ağaç olur.
 * <p>
 * DOCTYPE bildirimleri reddedilir ve dış varlıklar kapalıdır (XXE koruması).
 * Namespace bildirimleri ağaca öznitelik olarak taşınmaz.
 */
@Service
public class OoxmlDocumentParser implements IDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(OoxmlDocumentParser.class);

    @Override
    public ParsedDocument parse(byte[] content, String sourceName, DocumentType documentType)
            throws DocumentParseException {
        String name = sourceName != null ? sourceName : "belge";
        if (content == null || content.length == 0) {
            throw new DocumentParseException(name, "Belge içeriği boş: " + name);
        }

        if (OoxmlPackageReader.isPackage(content)) {
            Map<String, byte[]> parts = OoxmlPackageReader.readParts(content, name);
            var partNodes = new ArrayList<XmlNode>(parts.size());
            for (var entry : parts.entrySet()) {
                XmlNode partRoot = parseXml(entry.getValue(), name + "!" + entry.getKey());
                partNodes.add(new XmlNode(
                        OoxmlNamespaces.PACKAGE_PART,
                        List.of(new XmlAttribute(OoxmlNamespaces.PART_NAME, entry.getKey())),
                        "",
                        List.of(partRoot)));
            }
            log.debug("OOXML paketi ayrıştırıldı: {} ({} parça)", name, partNodes.size());
            return new ParsedDocument(documentType, name,
                    new XmlNode(OoxmlNamespaces.PACKAGE_ROOT, List.of(), "", partNodes));
        }

        return new ParsedDocument(documentType, name, parseXml(content, name));
    }

    private XmlNode parseXml(byte[] xml, String sourceName) throws DocumentParseException {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            Document document = builder.parse(new ByteArrayInputStream(xml));
            return toNode(document.getDocumentElement());
        } catch (SAXException e) {
            throw new DocumentParseException(sourceName,
                    "XML ayrıştırılamadı: " + sourceName + " - " + e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new DocumentParseException(sourceName,
                    "XML okunamadı: " + sourceName + " - " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        // XXE koruma
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new StrictErrorHandler());
        return builder;
    }

    /**
     * Ayrıştırma hatalarını stderr'e yazmak yerine istisna olarak yükseltir.
     */
    private static class StrictErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            log.debug("XML uyarısı (satır {}): {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    private static XmlNode toNode(Element element) {
        var attributes = new ArrayList<XmlAttribute>();
        NamedNodeMap attributeMap = element.getAttributes();
        for (int i = 0; i < attributeMap.getLength(); i++) {
            Attr attr = (Attr) attributeMap.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            attributes.add(new XmlAttribute(qualifiedName(attr), attr.getValue()));
        }

        var text = new StringBuilder();
        var children = new ArrayList<XmlNode>();
        NodeList childNodes = element.getChildNodes();
        for (int i = 0; i < childNodes.getLength(); i++) {
            Node child = childNodes.item(i);
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE -> children.add(toNode((Element) child));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(child.getNodeValue());
                default -> {
                    // yorum ve işlem talimatları karşılaştırılmaz
                }
            }
        }
        return new XmlNode(qualifiedName(element), attributes, text.toString(), children);
    }

    private static QualifiedName qualifiedName(Node node) {
        String local = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        return QualifiedName.of(node.getNamespaceURI(), local);
    }
}
