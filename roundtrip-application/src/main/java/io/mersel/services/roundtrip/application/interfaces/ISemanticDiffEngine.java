package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.DiffResult;
import io.mersel.services.roundtrip.application.models.ParsedDocument;
import io.mersel.services.roundtrip.application.models.PreservationMetrics;
import io.mersel.services.roundtrip.application.models.SemanticDifference;

import java.util.List;
import java.util.Set;

/**
 * İki belge ağacı arasında namespace'e duyarlı yapısal fark motoru.
 * <p>
 * Ağaçlar nitelikli ad ve kimlik öznitelikleri, yoksa ebeveyn içindeki sıra
 * ile hizalanır. Her fark kurallara göre bir önem seviyesi alır.
 * Prefix string'leri hiçbir zaman karşılaştırılmaz.
 */
public interface ISemanticDiffEngine {

    /**
     * İki belge versiyonunu karşılaştırır.
     *
     * @param original     Orijinal belge
     * @param converted    Round-trip sonrası belge
     * @param documentType Belge türü; {@code null} ise belgeden bağımsız genel kurallar uygulanır
     * @return Farklar ve özet; geçerli her ağaç çifti için hatasız döner
     */
    DiffResult analyzeDifferences(ParsedDocument original, ParsedDocument converted, DocumentType documentType);

    /**
     * Farkları önem seviyesine ve opsiyonel olarak kategoriye göre filtreler.
     *
     * @param differences Farklar
     * @param minSeverity En düşük önem seviyesi (dahil)
     * @param categories  İzin verilen kategoriler; {@code null} veya boş ise tümü
     * @return Sırası korunmuş filtrelenmiş liste
     */
    List<SemanticDifference> filterDifferences(List<SemanticDifference> differences,
                                               DiffSeverity minSeverity,
                                               Set<DiffCategory> categories);

    /**
     * Farkları bağlam bayraklarına göre bölümleyerek korunma oranlarını hesaplar.
     *
     * @param differences   Farklar
     * @param totalElements Payda olarak kullanılacak öğe sayısı
     * @return [0,1] aralığında oranlar; {@code changeRatio} sınırlandırılmaz
     */
    PreservationMetrics getPreservationMetrics(List<SemanticDifference> differences, int totalElements);
}
