package io.mersel.services.roundtrip.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (ayrıştırıcı, fark motoru, taşıyıcı analizi, tolerans, metrikler)
 * otomatik tarar ve round-trip yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.roundtrip.infrastructure")
@EnableConfigurationProperties(RoundTripProperties.class)
public class InfrastructureConfig {
}
