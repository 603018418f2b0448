package com.cankv.command;

import com.cankv.constants.RespProtocol;
import com.cankv.resp.Value;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Tamamlanmış bir istekten üretilen, doğrulanmış komutlardır. Yarım kurulmuş
 * bir komut hiçbir zaman oluşmaz.
 */
public sealed interface Command permits Command.Ping, Command.Echo, Command.Get, Command.Set
{
    /**
     * Metriklerde ve loglarda kullanılan küçük harfli komut adı.
     */
    String name();

    record Ping() implements Command
    {
        @Override
        public String name()
        {
            return RespProtocol.PING;
        }
    }

    record Echo(Value.BulkString message) implements Command
    {
        public Echo
        {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String name()
        {
            return RespProtocol.ECHO;
        }
    }

    record Get(String key) implements Command
    {
        public Get
        {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String name()
        {
            return RespProtocol.GET;
        }
    }

    /**
     * @param expireAtMillis mutlak son kullanma zamanı (epoch milisaniye), yoksa boş
     */
    record Set(String key, Value value, OptionalLong expireAtMillis) implements Command
    {
        public Set
        {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(expireAtMillis, "expireAtMillis");
        }

        @Override
        public String name()
        {
            return RespProtocol.SET;
        }
    }
}
