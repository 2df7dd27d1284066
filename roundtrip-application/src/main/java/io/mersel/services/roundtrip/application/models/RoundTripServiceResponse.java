package io.mersel.services.roundtrip.application.models;

/**
 * Genel servis yanıt zarfı.
 * <p>
 * Analiz endpoint'leri gibi yapısal JSON yanıtlar için kullanılır.
 *
 * @param <T> Sonuç tipi
 */
public class RoundTripServiceResponse<T> {

    private String errorMessage;
    private T result;

    public RoundTripServiceResponse() {
    }

    public RoundTripServiceResponse(T result) {
        this.result = result;
    }

    public RoundTripServiceResponse(T result, String errorMessage) {
        this.result = result;
        this.errorMessage = errorMessage;
    }

    public static <T> RoundTripServiceResponse<T> success(T result) {
        return new RoundTripServiceResponse<>(result);
    }

    public static <T> RoundTripServiceResponse<T> error(String errorMessage) {
        return new RoundTripServiceResponse<>(null, errorMessage);
    }

    /**
     * Sonuç ile birlikte hata mesajı döner (örn: eşik aşımında rapor yine de iletilir).
     */
    public static <T> RoundTripServiceResponse<T> failure(T result, String errorMessage) {
        return new RoundTripServiceResponse<>(result, errorMessage);
    }

    public boolean hasError() {
        return errorMessage != null && !errorMessage.isBlank();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public T getResult() {
        return result;
    }

    public void setResult(T result) {
        this.result = result;
    }
}
