package com.cankv;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus uygulaması için giriş noktasıdır. Ana thread'i Quarkus runtime
 * üzerinde bekleterek RESP sunucusunun ve temizleyicinin ayakta kalmasını
 * sağlar.
 */
@QuarkusMain
public class CanKvApplication implements QuarkusApplication
{
    @Override
    public int run(String... args)
    {
        Quarkus.waitForExit();
        return 0;
    }

    public static void main(String... args)
    {
        Quarkus.run(CanKvApplication.class, args);
    }
}
