package com.cankv.core;

import com.cankv.resp.Value;

/**
 * Depoda tutulan değeri ve varsa mutlak son kullanma zamanını taşır.
 *
 * @param expireAtMillis <=0: no expiry
 */
record StoredEntry(Value value, long expireAtMillis)
{
    static final long NO_EXPIRY = 0L;

    boolean expired(long now)
    {
        return expireAtMillis > 0 && now >= expireAtMillis;
    }
}
