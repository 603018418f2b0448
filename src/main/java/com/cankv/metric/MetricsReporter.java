package com.cankv.metric;

import com.cankv.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kayıttaki sayaç ve zamanlayıcıları belirli aralıklarla loga yazan servistir.
 * Aralık sıfır ya da negatifse raporlama başlatılmaz.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, AppProperties properties, Vertx vertx)
    {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx)
    {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
    }

    @PostConstruct
    void init()
    {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds)
    {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id -> vertx.executeBlocking(() -> {
            dump();
            return null;
        }, false));
    }

    public boolean isRunning()
    {
        return running.get();
    }

    void dump()
    {
        registry.counters().values().forEach(counter ->
                LOG.infof("counter %s = %d", counter.name(), counter.get())
        );
        registry.timers().values().forEach(timer -> {
            var sample = timer.snapshot();
            LOG.info(String.format(Locale.ROOT,
                    "timer %s count=%d avg=%.2fus p50=%.2fus p95=%.2fus min=%.2fus max=%.2fus",
                    sample.name(),
                    sample.count(),
                    sample.avgNs() / 1_000.0,
                    sample.p50Ns() / 1_000.0,
                    sample.p95Ns() / 1_000.0,
                    sample.minNs() / 1_000.0,
                    sample.maxNs() / 1_000.0
            ));
        });
    }

    @PreDestroy
    void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
