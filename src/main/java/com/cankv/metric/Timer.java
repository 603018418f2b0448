package com.cankv.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Depo operasyonlarının sürelerini nanosaniye olarak toplayan zamanlayıcıdır.
 * Son ölçümleri sabit boyutlu bir halka tamponda tutar ve anlık görüntü
 * alınırken p50/p95 değerlerini bu tampondan kestirir.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private volatile long minNs = Long.MAX_VALUE;
    private volatile long maxNs = Long.MIN_VALUE;

    private final long[] reservoir;
    private final AtomicInteger cursor = new AtomicInteger();

    public Timer(String name) { this(name, 1024); }

    public Timer(String name, int reservoirSize)
    {
        this.name = name;
        this.reservoir = new long[Math.max(128, reservoirSize)];
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        if (durationNs < minNs) minNs = durationNs;
        if (durationNs > maxNs) maxNs = durationNs;
        reservoir[Math.floorMod(cursor.getAndIncrement(), reservoir.length)] = durationNs;
    }

    public Sample snapshot()
    {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        long min = (minNs == Long.MAX_VALUE) ? 0 : minNs;
        long max = (maxNs == Long.MIN_VALUE) ? 0 : maxNs;

        int filled = (int) Math.min(c, reservoir.length);
        long[] copy = Arrays.copyOf(reservoir, filled);
        Arrays.sort(copy);
        long p50 = filled == 0 ? 0 : copy[(int) (0.50 * (filled - 1))];
        long p95 = filled == 0 ? 0 : copy[(int) (0.95 * (filled - 1))];

        return new Sample(name, c, t, avg, min, max, p50, p95);
    }

    public String name() { return name; }

    /**
     * Zamanlayıcının belirli bir andaki değerleri.
     */
    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
