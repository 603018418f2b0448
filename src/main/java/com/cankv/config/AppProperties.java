package com.cankv.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * şekilde sunan yapılandırma arayüzüdür. Dinlenecek adres ve port, protokol
 * sınırları, süresi dolan anahtarları temizleme sıklığı ve metrik raporlama
 * aralığı buradan okunur.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Network network();
    Protocol protocol();
    Store store();
    Metrics metrics();

    interface Network {
        @WithDefault("127.0.0.1")
        String host();

        @WithDefault("6379")
        int port();

        @WithDefault("128")
        int backlog();
    }

    interface Protocol {
        // 512 MiB, the largest bulk string a client may send
        @WithDefault("536870912")
        int maxBulkBytes();

        @WithDefault("65536")
        int maxLineBytes();
    }

    interface Store {
        @WithDefault("50")
        long sweepIntervalMillis();
    }

    interface Metrics {
        @WithDefault("60")
        long reportIntervalSeconds();
    }
}
