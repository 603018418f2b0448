package com.cankv.error;

/**
 * Tek bir isteği geçersiz kılan ancak bağlantıyı sonlandırmayan hataların ortak
 * üst sınıfıdır. Bağlantı işçisi bu hataları yakalar, kaydeder ve bir sonraki
 * isteği beklemeye devam eder.
 */
public abstract class RequestException extends RuntimeException
{
    protected RequestException(String message)
    {
        super(message);
    }

    protected RequestException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
