package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.enums.DocumentType;

/**
 * Belge içeriğinden OOXML belge türünü tespit eden servis arayüzü.
 * <p>
 * Paketlerde ana parça adı, tek XML parçalarında kök öğenin namespace URI'si kullanılır.
 */
public interface IDocumentTypeDetector {

    /**
     * Belge türünü tespit eder.
     *
     * @param content OOXML paketi veya XML parçası
     * @return tespit edilen belge türü
     * @throws DocumentTypeDetectionException belge türü tespit edilemezse
     */
    DocumentType detect(byte[] content) throws DocumentTypeDetectionException;
}
