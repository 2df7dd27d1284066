package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.enums.PlatformType;
import io.mersel.services.roundtrip.application.models.CarrierComparison;
import io.mersel.services.roundtrip.application.models.CarrierTestResult;
import io.mersel.services.roundtrip.application.models.CompatibilityReport;
import io.mersel.services.roundtrip.application.models.PlatformTestResult;

import java.util.List;
import java.util.Map;

/**
 * Platform ve taşıyıcı sonuçlarını tek bir uyumluluk raporunda birleştirir.
 */
public interface ICompatibilityAggregator {

    /**
     * Uyumluluk matrisini üretir.
     * <p>
     * Eksik veya hatalı tek bir girdi raporun üretilmesini engellemez.
     *
     * @param platformResults Platform sonuçları
     * @param carrierResults  Token sonuçları
     * @param configuration   Rapora taşınacak test yapılandırması
     */
    CompatibilityReport generateMatrix(List<PlatformTestResult> platformResults,
                                       List<CarrierTestResult> carrierResults,
                                       Map<String, String> configuration);

    /**
     * Bir taşıyıcı karşılaştırmasını platform bazlı token sonuçlarına dönüştürür.
     */
    List<CarrierTestResult> toCarrierResults(PlatformType platform, CarrierComparison comparison);
}
