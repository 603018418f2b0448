package com.cankv.error;

/**
 * Ağdan okunan çerçevenin bozuk olduğunu bildirir: sayısal olmayan uzunluk,
 * eksik satır sonu ya da izin verilen sınırı aşan gövde gibi.
 */
public class ProtocolException extends RequestException
{
    public ProtocolException(String message)
    {
        super(message);
    }

    public ProtocolException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
