package com.cankv.error;

/**
 * Sayısal bir değer hedef aralığa sığmadığında fırlatılır.
 */
public class ConversionException extends RequestException
{
    public ConversionException(String message)
    {
        super(message);
    }

    public ConversionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
