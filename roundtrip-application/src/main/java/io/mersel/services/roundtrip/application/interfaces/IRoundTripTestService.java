package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.models.RoundTripTestRequest;
import io.mersel.services.roundtrip.application.models.RoundTripTestResult;

/**
 * Bir round-trip çiftini uçtan uca değerlendiren servis.
 * <p>
 * Eşik ve profil kontrolleri analizden önce yapılır. Eşiklerin sağlanmaması
 * bir hata değildir; {@link RoundTripTestResult#passed()} ile bildirilir.
 */
public interface IRoundTripTestService {

    /**
     * @throws ToleranceConfigurationException  eşik değerleri 0–100 dışındaysa
     * @throws UnknownToleranceProfileException profil kayıtlı değilse
     * @throws DocumentParseException           belgelerden biri ayrıştırılamazsa
     * @throws DocumentTypeDetectionException   tür verilmemiş ve tespit edilemiyorsa
     */
    RoundTripTestResult run(RoundTripTestRequest request)
            throws DocumentParseException, DocumentTypeDetectionException;
}
