package io.mersel.services.roundtrip.application.interfaces;

/**
 * Belge türü tespit edilemediğinde fırlatılan istisna.
 * <p>
 * Tanınmayan kök namespace, ana parçası olmayan paket veya geçersiz XML
 * durumlarında kullanılır.
 */
public class DocumentTypeDetectionException extends Exception {

    public DocumentTypeDetectionException(String message) {
        super(message);
    }

    public DocumentTypeDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
