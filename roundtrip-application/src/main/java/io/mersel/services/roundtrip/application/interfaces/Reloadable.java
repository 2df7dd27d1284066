package io.mersel.services.roundtrip.application.interfaces;

/**
 * Diskten yeniden yüklenebilen bileşenler için arayüz.
 */
public interface Reloadable {

    /**
     * Bileşene ait dış kaynakları yeniden yükler.
     * <p>
     * Uygulama, mevcut durumu koruyarak yeni durumu hazırlamalı
     * ve hazır olduğunda tek adımda değiştirmelidir.
     *
     * @return Yeniden yükleme sonucu
     */
    ReloadResult reload();

    /**
     * Bileşenin loglama ve raporlama için kullanılacak adı.
     */
    String getName();
}
