package com.cankv.command;

import com.cankv.constants.RespProtocol;
import com.cankv.error.ArgumentException;
import com.cankv.error.ConversionException;
import com.cankv.resp.Value;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Tamamlanmış bir {@link Value} ağacını doğrulanmış bir {@link Command}
 * nesnesine çevirir. Komut adları büyük/küçük harf duyarsızdır; argüman
 * sayısı ya da tipi hatalıysa {@link ArgumentException}, sayısal bir argüman
 * aralık dışındaysa {@link ConversionException} fırlatılır.
 */
public final class CommandInterpreter
{
    private static final String WRONG_TYPE = "wrong argument type";

    private final Clock clock;

    public CommandInterpreter(Clock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Command toCommand(Value value)
    {
        Objects.requireNonNull(value, "value");
        if (!value.isComplete()) {
            throw new IllegalStateException("Cannot interpret an incomplete value: " + value);
        }
        if (value instanceof Value.ArrayValue array) {
            return fromArray(array.elements());
        }
        if (value instanceof Value.BulkString text) {
            return fromString(text.utf8());
        }
        throw new ArgumentException(WRONG_TYPE);
    }

    private Command fromString(String text)
    {
        if (RespProtocol.PING.equals(text.toLowerCase(Locale.ROOT))) {
            return new Command.Ping();
        }
        throw new ArgumentException("not implemented: " + text);
    }

    private Command fromArray(List<Value> elements)
    {
        if (elements.isEmpty()) {
            throw new ArgumentException("empty command");
        }
        if (!(elements.get(0) instanceof Value.BulkString verb)) {
            throw new ArgumentException(WRONG_TYPE);
        }
        String name = verb.utf8();
        return switch (name.toLowerCase(Locale.ROOT)) {
            case RespProtocol.PING -> new Command.Ping();
            case RespProtocol.ECHO -> echo(elements);
            case RespProtocol.GET -> get(elements);
            case RespProtocol.SET -> set(elements);
            default -> throw new ArgumentException("not implemented: " + name);
        };
    }

    private Command echo(List<Value> elements)
    {
        requireArity("ECHO", elements, 2);
        if (!(elements.get(1) instanceof Value.BulkString message)) {
            throw new ArgumentException("ECHO: " + WRONG_TYPE);
        }
        return new Command.Echo(message);
    }

    private Command get(List<Value> elements)
    {
        requireArity("GET", elements, 2);
        return new Command.Get(key("GET", elements.get(1)));
    }

    private Command set(List<Value> elements)
    {
        int size = elements.size();
        if (size < 3) {
            throw new ArgumentException("SET: not enough arguments: " + size);
        }
        String key = key("SET", elements.get(1));
        Value value = elements.get(2);
        if (size == 3) {
            return new Command.Set(key, value, OptionalLong.empty());
        }
        if (size != 5) {
            throw new ArgumentException("SET: wrong number of arguments: " + size);
        }
        if (!(elements.get(3) instanceof Value.BulkString flag)) {
            throw new ArgumentException("SET: " + WRONG_TYPE);
        }
        if (!RespProtocol.PX.equals(flag.utf8().toLowerCase(Locale.ROOT))) {
            throw new ArgumentException("SET: flag not implemented: " + flag.utf8());
        }
        long millis = millis(elements.get(4));
        try {
            return new Command.Set(key, value, OptionalLong.of(Math.addExact(clock.millis(), millis)));
        } catch (ArithmeticException e) {
            throw new ConversionException("SET: PX " + millis + " overflows the expiry time", e);
        }
    }

    private static long millis(Value argument)
    {
        long millis;
        if (argument instanceof Value.IntegerValue integer) {
            millis = integer.value();
        } else if (argument instanceof Value.BulkString text) {
            try {
                millis = Long.parseLong(text.utf8().trim());
            } catch (NumberFormatException e) {
                throw new ConversionException("SET: PX is not a valid millisecond count: " + text.utf8(), e);
            }
        } else {
            throw new ArgumentException("SET: " + WRONG_TYPE);
        }
        if (millis < 0) {
            throw new ConversionException("SET: PX must not be negative: " + millis);
        }
        return millis;
    }

    private static String key(String command, Value argument)
    {
        if (argument instanceof Value.BulkString key) {
            return key.utf8();
        }
        throw new ArgumentException(command + ": " + WRONG_TYPE);
    }

    private static void requireArity(String command, List<Value> elements, int expected)
    {
        if (elements.size() != expected) {
            throw new ArgumentException(command + ": wrong number of arguments: " + elements.size());
        }
    }
}
