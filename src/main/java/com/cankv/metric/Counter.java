package com.cankv.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * İsimlendirilmiş, thread-safe olay sayacıdır. Bağlantı sayısı gibi azalabilen
 * değerler için {@link #dec()} de desteklenir.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();

    public Counter(String name) { this.name = name; }
    public void inc() { value.increment(); }
    public void dec() { value.decrement(); }
    public void add(long delta) { value.add(delta); }
    public long get() { return value.sum(); }
    public String name() { return name; }
}
