package com.cankv.core;

import com.cankv.config.AppProperties;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link KeyValueStore} üzerindeki süresi dolmuş kayıtları sabit aralıklarla
 * fiziksel olarak silen arka plan görevidir. Turlar arasında her zaman
 * sıfırdan büyük bir bekleme olur; tek bir turdaki hata loglanır ve zamanlama
 * devam eder.
 */
@Startup
@Singleton
public class ExpirySweeper implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(ExpirySweeper.class);

    private final KeyValueStore store;
    private final long intervalMillis;
    private ScheduledExecutorService scheduler;

    @Inject
    public ExpirySweeper(KeyValueStore store, AppProperties properties)
    {
        this(store, properties.store().sweepIntervalMillis());
    }

    public ExpirySweeper(KeyValueStore store, long intervalMillis)
    {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Sweep interval must be greater than 0 ms, got " + intervalMillis);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.intervalMillis = intervalMillis;
    }

    @PostConstruct
    void init()
    {
        start();
    }

    public synchronized void start()
    {
        if (isRunning()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "can-kv-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweepOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOG.debugf("Expiry sweeper started with a %d ms interval", intervalMillis);
    }

    void sweepOnce()
    {
        try {
            int removed = store.sweep();
            if (removed > 0 && LOG.isDebugEnabled()) {
                LOG.debugf("Removed %d expired keys", removed);
            }
        } catch (RuntimeException e) {
            LOG.error("Expiry sweep failed", e);
        }
    }

    public synchronized boolean isRunning()
    {
        return scheduler != null && !scheduler.isShutdown();
    }

    public long intervalMillis()
    {
        return intervalMillis;
    }

    @PreDestroy
    void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
