package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.CarrierAnalysisResult;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CriticalCarrierSurvival;
import io.mersel.services.roundtrip.application.models.ParsedDocument;

/**
 * Tasarım token taşıyıcılarını bulan ve korunmalarını ölçen analiz servisi.
 * <p>
 * Ayrıştırılamayan girdi hata fırlatmaz; sıfır taşıyıcılı ve
 * {@code survivalRate = 0.0} olan bir sonuç döner.
 */
public interface ICarrierAnalyzer {

    /**
     * Ham belge içeriğindeki taşıyıcıları bulur.
     *
     * @param content      OOXML paketi veya XML parçası
     * @param documentType Belge türü; yalnızca bu türe uygulanabilen katalog girdileri değerlendirilir
     */
    CarrierAnalysisResult analyzeCarriers(byte[] content, DocumentType documentType);

    /**
     * Ayrıştırılmış belgedeki taşıyıcıları bulur.
     */
    CarrierAnalysisResult analyzeCarriers(ParsedDocument document, DocumentType documentType);

    /**
     * İki ham belge versiyonunun taşıyıcılarını karşılaştırır.
     */
    CarrierComparison compareCarriers(byte[] original, byte[] converted, DocumentType documentType);

    /**
     * İki ayrıştırılmış belge versiyonunun taşıyıcılarını karşılaştırır.
     */
    CarrierComparison compareCarriers(ParsedDocument original, ParsedDocument converted, DocumentType documentType);

    /**
     * Yalnızca CRITICAL taşıyıcılar için hayatta kalma özetini çıkarır.
     */
    CriticalCarrierSurvival getCriticalCarrierSurvival(CarrierAnalysisResult result);

    /**
     * Karşılaştırmanın deterministik metin raporunu üretir.
     * <p>
     * Rapor "Preservation Rate" satırını ve "Category Breakdown" bölümünü içerir;
     * alt sistemler bu başlıklara göre ayrıştırma yapabilir.
     */
    String generateCarrierReport(CarrierComparison comparison);
}
