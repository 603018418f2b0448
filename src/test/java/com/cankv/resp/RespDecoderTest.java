package com.cankv.resp;

import com.cankv.error.ConversionException;
import com.cankv.error.ProtocolException;
import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest
{
    private RespDecoder decoder;

    @BeforeEach
    void setup()
    {
        decoder = new RespDecoder(1024, 64);
    }

    private void feed(String text)
    {
        decoder.feed(Buffer.buffer(text));
    }

    @Nested
    class TypeTags
    {
        // Bu test dizi başlığının boş ve bildirilen boyutlu bir dizi ürettiğini doğrular.
        @Test
        void array_header_produces_empty_array()
        {
            feed("*3\r\n");
            Value value = decoder.decodeOne();
            Value.ArrayValue array = assertInstanceOf(Value.ArrayValue.class, value);
            assertEquals(3, array.declaredSize());
            assertTrue(array.elements().isEmpty());
            assertEquals(0, decoder.buffered());
        }

        // Bu test bulk string gövdesinin ikili güvenli okunduğunu gösterir.
        @Test
        void bulk_string_reads_exact_body()
        {
            feed("$5\r\nhe\r\no\r\n");
            assertEquals(new Value.BulkString(new byte[]{'h', 'e', '\r', '\n', 'o'}), decoder.decodeOne());
            assertEquals(0, decoder.buffered());
        }

        // Bu test sıfır ve negatif uzunlukların gövde okumadan Nil döndürdüğünü doğrular.
        @Test
        void non_positive_bulk_length_is_nil_without_body()
        {
            feed("$-1\r\n$0\r\n:4\r\n");
            assertEquals(Value.NIL, decoder.decodeOne());
            assertEquals(Value.NIL, decoder.decodeOne());
            assertEquals(Value.integer(4), decoder.decodeOne());
        }

        // Bu test simple string girdisinin bulk string ile aynı şekle çözüldüğünü gösterir.
        @Test
        void simple_string_decodes_as_bulk_string()
        {
            feed("+PING\r\n");
            assertEquals(Value.bulk("PING"), decoder.decodeOne());
        }

        // Bu test işaretli tamsayıların çözüldüğünü doğrular.
        @Test
        void integer_accepts_sign()
        {
            feed(":-42\r\n:+7\r\n:0\r\n");
            assertEquals(Value.integer(-42), decoder.decodeOne());
            assertEquals(Value.integer(7), decoder.decodeOne());
            assertEquals(Value.integer(0), decoder.decodeOne());
        }

        // Bu test tanınmayan tip baytının yalnızca kendisini tüketip Nil ürettiğini gösterir.
        @Test
        void unknown_tag_consumes_one_byte_and_yields_nil()
        {
            feed("?:1\r\n");
            assertEquals(Value.NIL, decoder.decodeOne());
            assertEquals(Value.integer(1), decoder.decodeOne());
        }

        // Bu test yalnızca LF ile biten satırların da kabul edildiğini doğrular.
        @Test
        void bare_line_feed_terminates_header_lines()
        {
            feed("*1\n$3\nGET\r\n");
            assertEquals(new Value.ArrayValue(1), decoder.decodeOne());
            assertEquals(Value.bulk("GET"), decoder.decodeOne());
        }
    }

    @Nested
    class Streaming
    {
        // Bu test boş tamponda çözücünün null döndürdüğünü doğrular.
        @Test
        void empty_buffer_needs_more_data()
        {
            assertNull(decoder.decodeOne());
        }

        // Bu test eksik başlık satırının tüketilmeden beklendiğini gösterir.
        @Test
        void partial_header_is_not_consumed()
        {
            feed("$1");
            assertNull(decoder.decodeOne());
            assertEquals(2, decoder.buffered());
            feed("0\r\n0123456789\r\n");
            assertEquals(Value.bulk("0123456789"), decoder.decodeOne());
        }

        // Bu test gövdesi parça parça gelen bulk string'in tamamlanınca çözüldüğünü doğrular.
        @Test
        void bulk_body_split_across_chunks()
        {
            feed("$6\r\nfoo");
            assertNull(decoder.decodeOne());
            feed("bar");
            assertNull(decoder.decodeOne());
            feed("\r");
            assertNull(decoder.decodeOne());
            feed("\n");
            assertEquals(Value.bulk("foobar"), decoder.decodeOne());
            assertNull(decoder.decodeOne());
        }

        // Bu test tüketilen baytların sonraki beslemede tampondan atıldığını gösterir.
        @Test
        void consumed_bytes_are_compacted_on_feed()
        {
            feed(":1\r\n:2");
            assertEquals(Value.integer(1), decoder.decodeOne());
            assertEquals(2, decoder.buffered());
            feed("\r\n");
            assertEquals(4, decoder.buffered());
            assertEquals(Value.integer(2), decoder.decodeOne());
        }
    }

    @Nested
    class Failures
    {
        // Bu test sayısal olmayan uzunluğun protokol hatası olduğunu ve akışın devam edebildiğini doğrular.
        @Test
        void non_numeric_length_is_protocol_error_and_stream_resyncs()
        {
            feed("*x\r\n:5\r\n");
            assertThrows(ProtocolException.class, decoder::decodeOne);
            assertEquals(Value.integer(5), decoder.decodeOne());
        }

        // Bu test boş uzunluk satırının protokol hatası sayıldığını gösterir.
        @Test
        void empty_length_is_protocol_error()
        {
            feed("$\r\n");
            assertThrows(ProtocolException.class, decoder::decodeOne);
            assertEquals(0, decoder.buffered());
        }

        // Bu test sayısal olmayan tamsayı gövdesinin protokol hatası olduğunu doğrular.
        @Test
        void non_numeric_integer_is_protocol_error()
        {
            feed(":12a\r\n");
            assertThrows(ProtocolException.class, decoder::decodeOne);
        }

        // Bu test aralık dışı sayıların dönüşüm hatası verdiğini gösterir.
        @Test
        void out_of_range_numbers_are_conversion_errors()
        {
            feed(":99999999999999999999\r\n*3000000000\r\n");
            assertThrows(ConversionException.class, decoder::decodeOne);
            assertThrows(ConversionException.class, decoder::decodeOne);
        }

        // Bu test negatif dizi uzunluğunun reddedildiğini doğrular.
        @Test
        void negative_array_length_is_protocol_error()
        {
            feed("*-1\r\n");
            assertThrows(ProtocolException.class, decoder::decodeOne);
        }

        // Bu test CRLF ile bitmeyen gövdenin atlanıp hata verdiğini gösterir.
        @Test
        void bulk_body_without_terminator_is_protocol_error()
        {
            feed("$3\r\nabcXY:1\r\n");
            assertThrows(ProtocolException.class, decoder::decodeOne);
            assertEquals(Value.integer(1), decoder.decodeOne());
        }

        // Bu test sınırı aşan bulk uzunluğunun gövde beklenmeden reddedildiğini doğrular.
        @Test
        void bulk_length_over_limit_is_rejected()
        {
            feed("$4096\r\n");
            ProtocolException e = assertThrows(ProtocolException.class, decoder::decodeOne);
            assertTrue(e.getMessage().contains("4096"));
            assertEquals(0, decoder.buffered());
        }

        // Bu test satır sonu gelmeden sınırı aşan başlığın atıldığını gösterir.
        @Test
        void overlong_line_is_discarded()
        {
            feed("*" + "1".repeat(100));
            assertThrows(ProtocolException.class, decoder::decodeOne);
            assertEquals(0, decoder.buffered());
        }

        // Bu test geçersiz sınırlarla çözücü oluşturulamadığını doğrular.
        @Test
        void constructor_rejects_non_positive_limits()
        {
            assertThrows(IllegalArgumentException.class, () -> new RespDecoder(0, 10));
            assertThrows(IllegalArgumentException.class, () -> new RespDecoder(10, 0));
        }
    }
}
