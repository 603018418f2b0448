package com.cankv.resp;

import com.cankv.constants.RespProtocol;
import com.cankv.error.ConversionException;
import com.cankv.error.ProtocolException;
import io.vertx.core.buffer.Buffer;

import java.nio.charset.StandardCharsets;

/**
 * Soketten parça parça gelen baytları biriktirip her çağrıda tam olarak bir
 * RESP birimini çözen akış çözücüsüdür. Birimin baytları henüz tamamlanmadıysa
 * hiçbir şey tüketmeden {@code null} döner; böylece sonraki veri geldiğinde
 * aynı noktadan devam edilir.
 *
 * <p>Tanınmayan tip baytı yalnızca o bayt tüketilerek {@link Value#NIL} olarak
 * çözülür. Hatalı birimler tüketildikten sonra hata fırlatılır ki akış bir
 * sonraki birimden devam edebilsin.</p>
 */
public final class RespDecoder
{
    private final int maxBulkBytes;
    private final int maxLineBytes;

    private Buffer buffer = Buffer.buffer();
    private int position;

    public RespDecoder(int maxBulkBytes, int maxLineBytes)
    {
        if (maxBulkBytes <= 0) {
            throw new IllegalArgumentException("maxBulkBytes must be greater than 0");
        }
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be greater than 0");
        }
        this.maxBulkBytes = maxBulkBytes;
        this.maxLineBytes = maxLineBytes;
    }

    public void feed(Buffer chunk)
    {
        if (position > 0) {
            buffer = buffer.getBuffer(position, buffer.length());
            position = 0;
        }
        buffer.appendBuffer(chunk);
    }

    public int buffered()
    {
        return buffer.length() - position;
    }

    /**
     * Tamponun başındaki tek birimi çözer.
     *
     * @return çözülen değer ya da birim henüz tamamlanmadıysa {@code null}
     * @throws ProtocolException uzunluk veya tamsayı metni bozuksa, gövde CRLF ile bitmiyorsa
     * @throws ConversionException sayı temsil edilebilir aralığın dışındaysa
     */
    public Value decodeOne()
    {
        if (position >= buffer.length()) {
            return null;
        }
        byte tag = buffer.getByte(position);
        switch (tag) {
            case RespProtocol.ARRAY:
                return decodeArray();
            case RespProtocol.BULK_STRING:
                return decodeBulkString();
            case RespProtocol.SIMPLE_STRING:
                return decodeSimpleString();
            case RespProtocol.INTEGER:
                return decodeInteger();
            default:
                position++;
                return Value.NIL;
        }
    }

    private Value decodeArray()
    {
        int lineEnd = findLineEnd(position + 1);
        if (lineEnd < 0) {
            return null;
        }
        String text = lineText(position + 1, lineEnd);
        position = afterLine(lineEnd);
        long size = parseNumber(text, "array length");
        if (size < 0) {
            throw new ProtocolException("Invalid array length: " + text);
        }
        if (size > Integer.MAX_VALUE) {
            throw new ConversionException("Array length out of range: " + text);
        }
        return new Value.ArrayValue((int) size);
    }

    private Value decodeBulkString()
    {
        int lineEnd = findLineEnd(position + 1);
        if (lineEnd < 0) {
            return null;
        }
        String text = lineText(position + 1, lineEnd);
        int bodyStart = afterLine(lineEnd);
        long length;
        try {
            length = parseNumber(text, "bulk length");
        } catch (RuntimeException e) {
            position = bodyStart;
            throw e;
        }
        if (length <= 0) {
            position = bodyStart;
            return Value.NIL;
        }
        if (length > maxBulkBytes) {
            position = bodyStart;
            throw new ProtocolException("Bulk length " + length + " exceeds limit of " + maxBulkBytes + " bytes");
        }
        int size = (int) length;
        long frameEnd = (long) bodyStart + size + 2;
        if (buffer.length() < frameEnd) {
            return null;
        }
        if (buffer.getByte(bodyStart + size) != RespProtocol.CR || buffer.getByte(bodyStart + size + 1) != RespProtocol.LF) {
            position = (int) frameEnd;
            throw new ProtocolException("Bulk string of " + size + " bytes is not terminated by CRLF");
        }
        byte[] bytes = buffer.getBytes(bodyStart, bodyStart + size);
        position = (int) frameEnd;
        return new Value.BulkString(bytes);
    }

    private Value decodeSimpleString()
    {
        int lineEnd = findLineEnd(position + 1);
        if (lineEnd < 0) {
            return null;
        }
        byte[] bytes = buffer.getBytes(position + 1, lineEnd);
        position = afterLine(lineEnd);
        return new Value.BulkString(bytes);
    }

    private Value decodeInteger()
    {
        int lineEnd = findLineEnd(position + 1);
        if (lineEnd < 0) {
            return null;
        }
        String text = lineText(position + 1, lineEnd);
        position = afterLine(lineEnd);
        return new Value.IntegerValue(parseNumber(text, "integer"));
    }

    /**
     * Satır içeriğinin bittiği indeksi döndürür; satır LF ile biter, önündeki
     * CR içeriğe dahil edilmez.
     */
    private int findLineEnd(int from)
    {
        int length = buffer.length();
        for (int i = from; i < length; i++) {
            if (buffer.getByte(i) == RespProtocol.LF) {
                return (i > from && buffer.getByte(i - 1) == RespProtocol.CR) ? i - 1 : i;
            }
        }
        if (length - from > maxLineBytes) {
            position = length;
            throw new ProtocolException("Line exceeds limit of " + maxLineBytes + " bytes");
        }
        return -1;
    }

    private int afterLine(int lineEnd)
    {
        return buffer.getByte(lineEnd) == RespProtocol.CR ? lineEnd + 2 : lineEnd + 1;
    }

    private String lineText(int start, int end)
    {
        return buffer.getString(start, end, StandardCharsets.US_ASCII.name()).trim();
    }

    private static long parseNumber(String text, String what)
    {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            if (text.matches("[+-]?\\d+")) {
                throw new ConversionException("Invalid " + what + ", out of range: " + text, e);
            }
            throw new ProtocolException("Invalid " + what + ": '" + text + "'", e);
        }
    }
}
