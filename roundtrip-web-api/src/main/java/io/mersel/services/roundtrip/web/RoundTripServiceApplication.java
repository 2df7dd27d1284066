package io.mersel.services.roundtrip.web;

import io.mersel.services.roundtrip.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL OOXML Round-Trip Service - Ana uygulama giriş noktası.
 * <p>
 * OOXML şablonlarının dönüşüm hatlarından sonra tasarım token'larını ve içeriğini
 * koruyup korumadığını ölçen fark, taşıyıcı, tolerans ve uyumluluk servisi.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class RoundTripServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoundTripServiceApplication.class, args);
    }
}
