package com.cankv.error;

/**
 * Komutun argüman sayısı, argüman tipi ya da adı desteklenmediğinde fırlatılır.
 */
public class ArgumentException extends RequestException
{
    public ArgumentException(String message)
    {
        super(message);
    }
}
