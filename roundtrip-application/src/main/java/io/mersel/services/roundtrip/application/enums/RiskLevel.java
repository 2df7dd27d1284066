package io.mersel.services.roundtrip.application.enums;

/**
 * Risk değerlendirmesi seviyesi.
 * <p>
 * Uyumluluk raporu LOW/MEDIUM/HIGH kullanır; CRITICAL yalnızca eğilim analizinde,
 * güncel oran kabul edilemez düzeydeyken verilir.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
