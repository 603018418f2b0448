package com.cankv.core;

import com.cankv.metric.Counter;
import com.cankv.metric.MetricsRegistry;
import com.cankv.metric.Timer;
import com.cankv.resp.Value;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bütün bağlantıların ve {@link ExpirySweeper}'ın paylaştığı anahtar-değer
 * tablosudur. Her operasyon (get, set ya da bir temizleme turu) tek bir kilit
 * altında atomik olarak çalışır; kilit hiçbir zaman G/Ç sırasında tutulmaz ve
 * iç harita dışarıya açılmaz.
 *
 * <p>Süresi dolmuş bir kayıt okunduğunda yok sayılır ama silinmez; fiziksel
 * silme işini temizleyici üstlenir. Değerler hem yazarken hem okurken
 * kopyalanır.</p>
 */
public final class KeyValueStore
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StoredEntry> entries = new HashMap<>();
    private final Clock clock;

    private final Counter hits, misses, sets, expiredRemoved;
    private final Timer tGet, tSet, tSweep;

    public KeyValueStore(Clock clock, MetricsRegistry metrics)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (metrics != null) {
            this.hits = metrics.counter("store_hits");
            this.misses = metrics.counter("store_misses");
            this.sets = metrics.counter("store_sets");
            this.expiredRemoved = metrics.counter("store_expired_removed");
            this.tGet = metrics.timer("store_get");
            this.tSet = metrics.timer("store_set");
            this.tSweep = metrics.timer("store_sweep");
        } else {
            this.hits = this.misses = this.sets = this.expiredRemoved = null;
            this.tGet = this.tSet = this.tSweep = null;
        }
    }

    public Optional<Value> get(String key)
    {
        Objects.requireNonNull(key, "key");
        long t0 = System.nanoTime();
        Value out = null;
        lock.lock();
        try {
            StoredEntry entry = entries.get(key);
            if (entry != null && !entry.expired(clock.millis())) {
                out = entry.value().copy();
            }
        } finally {
            lock.unlock();
        }
        if (out != null) {
            if (hits != null) hits.inc();
        } else if (misses != null) misses.inc();
        if (tGet != null) tGet.record(System.nanoTime() - t0);
        return Optional.ofNullable(out);
    }

    public void set(String key, Value value, OptionalLong expireAtMillis)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(expireAtMillis, "expireAtMillis");
        long t0 = System.nanoTime();
        // a present deadline must never collapse into the no-expiry sentinel
        long expireAt = expireAtMillis.isPresent() ? Math.max(1L, expireAtMillis.getAsLong()) : StoredEntry.NO_EXPIRY;
        StoredEntry entry = new StoredEntry(value.copy(), expireAt);
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
        if (sets != null) sets.inc();
        if (tSet != null) tSet.record(System.nanoTime() - t0);
    }

    public void set(String key, Value value)
    {
        set(key, value, OptionalLong.empty());
    }

    /**
     * Süresi dolmuş bütün kayıtları tek bir kilitli turda siler.
     *
     * @return silinen kayıt sayısı
     */
    public int sweep()
    {
        long t0 = System.nanoTime();
        int removed = 0;
        lock.lock();
        try {
            long now = clock.millis();
            Iterator<StoredEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().expired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0 && expiredRemoved != null) expiredRemoved.add(removed);
        if (tSweep != null) tSweep.record(System.nanoTime() - t0);
        return removed;
    }

    /**
     * Henüz temizlenmemiş süresi dolmuş kayıtlar dahil fiziksel kayıt sayısı.
     */
    public int size()
    {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String key)
    {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public void clear()
    {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
