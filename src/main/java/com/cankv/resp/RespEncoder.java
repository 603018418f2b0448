package com.cankv.resp;

import com.cankv.constants.RespProtocol;
import io.vertx.core.buffer.Buffer;

import java.nio.charset.StandardCharsets;

/**
 * {@link Value} ağacını RESP baytlarına dönüştürür. {@link Value#NIL} her zaman
 * {@code $-1\r\n} olarak yazılır.
 */
public final class RespEncoder
{
    private static final byte[] CRLF = new byte[]{RespProtocol.CR, RespProtocol.LF};
    private static final byte[] NIL = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder()
    {
    }

    public static Buffer encode(Value value)
    {
        Buffer out = Buffer.buffer();
        encode(value, out);
        return out;
    }

    public static void encode(Value value, Buffer out)
    {
        if (value instanceof Value.ArrayValue array) {
            writeHeader(out, RespProtocol.ARRAY, array.declaredSize());
            for (Value element : array.elements()) {
                encode(element, out);
            }
        } else if (value instanceof Value.BulkString bulk) {
            writeHeader(out, RespProtocol.BULK_STRING, bulk.length());
            out.appendBytes(bulk.bytes());
            out.appendBytes(CRLF);
        } else if (value instanceof Value.IntegerValue integer) {
            writeHeader(out, RespProtocol.INTEGER, integer.value());
        } else {
            out.appendBytes(NIL);
        }
    }

    private static void writeHeader(Buffer out, byte tag, long number)
    {
        out.appendByte(tag);
        out.appendString(Long.toString(number), StandardCharsets.US_ASCII.name());
        out.appendBytes(CRLF);
    }
}
