package com.cankv.config;

import com.cankv.command.CommandInterpreter;
import com.cankv.core.KeyValueStore;
import com.cankv.metric.MetricsRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Depo, komut yorumlayıcısı, metrik kaydı ve saat gibi uygulama genelinde
 * paylaşılan bean'leri üreten CDI yapılandırma sınıfıdır. Depo ve yorumlayıcı
 * aynı {@link Clock} örneğini kullanır; böylece PX ile hesaplanan son kullanma
 * zamanları ve okuma anındaki kontroller aynı zaman kaynağına dayanır.
 */
@ApplicationScoped
public class AppConfig
{
    @Produces
    @Singleton
    public Clock clock()
    {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry()
    {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public KeyValueStore keyValueStore(Clock clock, MetricsRegistry metrics)
    {
        return new KeyValueStore(clock, metrics);
    }

    @Produces
    @Singleton
    public CommandInterpreter commandInterpreter(Clock clock)
    {
        return new CommandInterpreter(clock);
    }
}
