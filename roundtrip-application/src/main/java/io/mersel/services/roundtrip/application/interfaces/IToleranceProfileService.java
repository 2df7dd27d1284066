package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.UsageContext;
import io.mersel.services.roundtrip.application.models.ChangeRecord;
import io.mersel.services.roundtrip.application.models.ToleranceEvaluation;
import io.mersel.services.roundtrip.application.models.ToleranceProfile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tolerans profili yönetimi ve değişiklik değerlendirme servisi arayüzü.
 * <p>
 * Dört yerleşik profil ({@code strict}, {@code normal}, {@code lenient},
 * {@code permissive}) her zaman mevcuttur. Özel profiller bunlardan türetilir;
 * türetme kuralları ve yol kümelerini kopyalar, temel profil hiçbir zaman yerinde
 * değiştirilmez.
 * <p>
 * Bilinmeyen profil adı {@link UnknownToleranceProfileException} ile bildirilir,
 * varsayılan profile sessizce düşülmez.
 */
public interface IToleranceProfileService {

    /**
     * Belirtilen isimdeki profili döndürür.
     *
     * @param profileName Profil adı (örn: "strict", "kurumsal-sablon")
     * @return Profil, bulunamazsa {@link Optional#empty()}
     */
    Optional<ToleranceProfile> getProfile(String profileName);

    /**
     * Mevcut tüm profilleri döndürür.
     *
     * @return Profil adı → profil eşleşmesi (ada göre sıralı)
     */
    Map<String, ToleranceProfile> getAvailableProfiles();

    /**
     * Profil yerleşik profillerden biri mi?
     */
    boolean isBuiltIn(String profileName);

    /**
     * Değişiklikleri profile göre değerlendirir.
     * <p>
     * Yüzdeler toplam değişiklik sayısına göre hesaplanır.
     *
     * @param changes     Değişiklik kayıtları
     * @param profileName Profil adı
     * @return Değerlendirme sonucu
     * @throws UnknownToleranceProfileException profil kayıtlı değilse
     */
    ToleranceEvaluation evaluateChanges(List<ChangeRecord> changes, String profileName);

    /**
     * Değişiklikleri profile göre değerlendirir; yüzdeler verilen öğe sayısına göre hesaplanır.
     *
     * @param totalElements Yüzde paydası; {@code null} ise toplam değişiklik sayısı kullanılır
     */
    ToleranceEvaluation evaluateChanges(List<ChangeRecord> changes, String profileName, Integer totalElements);

    /**
     * Bir değişiklik türünün sınırlarını ayarlar.
     * <p>
     * Verilmeyen ({@code null}) sınırlar korunur. Profilde o türe ait kural yoksa eklenir.
     *
     * @return Ayarlanmış profil
     * @throws UnknownToleranceProfileException profil kayıtlı değilse
     * @throws ToleranceConfigurationException  sınırlar aralık dışındaysa
     */
    ToleranceProfile adjustTolerance(String profileName, ChangeType changeType,
                                     Double newPercentage, Integer newAbsolute);

    /**
     * Mevcut bir profilden yeni bir profil türetir ve kaydeder.
     *
     * @param name        Yeni profil adı (yerleşik adlarla çakışamaz)
     * @param baseProfile Temel profil adı
     * @return Yeni profil
     */
    ToleranceProfile createCustomProfile(String name, String baseProfile);

    /**
     * Profili olduğu gibi kaydeder (yüklenen veya içe aktarılan profiller için).
     */
    void registerProfile(ToleranceProfile profile);

    /**
     * Özel profili siler. Yerleşik profiller silinemez.
     *
     * @return Profil silindiyse {@code true}
     */
    boolean removeProfile(String profileName);

    /**
     * Profili YAML dosyasına yazar.
     */
    void saveProfile(String profileName, Path target) throws IOException;

    /**
     * Profili yapılandırılmış profil dizinine {@code <ad>.yml} olarak yazar.
     *
     * @return Yazılan dosyanın yolu
     * @throws ToleranceConfigurationException profil dizini yapılandırılmamışsa
     */
    Path persistProfile(String profileName) throws IOException;

    /**
     * YAML dosyasından profil okur (kaydetmez).
     */
    ToleranceProfile loadProfile(Path source) throws IOException;

    /**
     * Profili YAML metnine dönüştürür.
     */
    String exportProfile(String profileName);

    /**
     * YAML metninden profil okur (kaydetmez).
     */
    ToleranceProfile importProfile(String yamlContent);

    /**
     * Belge türü ve kullanım bağlamı için önerilen profil adını döner.
     * Tanınmayan kombinasyonlar için {@code "normal"}.
     */
    String getRecommendedProfile(DocumentType documentType, UsageContext usageContext);
}
