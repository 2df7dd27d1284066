package io.mersel.services.roundtrip.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI roundTripServiceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL OOXML Round-Trip Service API")
                        .description("""
                                OOXML (docx, pptx, xlsx) şablonlarının round-trip uyumluluğunu ölçen servis.
                                
                                ## Özellikler
                                - **Anlamsal Fark Analizi**: Namespace'e duyarlı, önem seviyeli yapısal karşılaştırma
                                - **Taşıyıcı Analizi**: Tema renkleri, yazı tipleri ve stiller gibi tasarım token taşıyıcılarının korunması
                                - **Tolerans Profilleri**: Değişiklik türü başına mutlak ve yüzde sınırları, kritik ve yok sayılan yollar
                                - **Uyumluluk Matrisi**: Platformlar ve taşıyıcı türleri genelinde risk ve öneri raporu
                                - **Round-Trip Testi**: Eşik kontrollü uçtan uca PASS/FAIL değerlendirmesi
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT"))
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
