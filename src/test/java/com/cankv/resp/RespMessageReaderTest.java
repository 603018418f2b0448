package com.cankv.resp;

import com.cankv.error.ProtocolException;
import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespMessageReaderTest
{
    private RespMessageReader reader;

    @BeforeEach
    void setup()
    {
        reader = new RespMessageReader(new RespDecoder(1024, 1024));
    }

    private void feed(String text)
    {
        reader.feed(Buffer.buffer(text));
    }

    @Nested
    class Assembly
    {
        // Bu test düz birim dizisinden komut dizisinin yeniden kurulduğunu doğrular.
        @Test
        void reassembles_command_array_from_units()
        {
            feed("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
            Value message = reader.nextMessage();
            assertEquals(Value.array(Value.bulk("SET"), Value.bulk("foo"), Value.bulk("bar")), message);
            assertFalse(reader.hasPartialMessage());
            assertNull(reader.nextMessage());
        }

        // Bu test ağdan parça parça gelen mesajın yarım kökünün korunduğunu gösterir.
        @Test
        void partial_root_survives_between_chunks()
        {
            feed("*2\r\n$3\r\nGET\r");
            assertNull(reader.nextMessage());
            assertTrue(reader.hasPartialMessage());
            feed("\n$3\r\nfo");
            assertNull(reader.nextMessage());
            feed("o\r\n");
            assertEquals(Value.array(Value.bulk("GET"), Value.bulk("foo")), reader.nextMessage());
        }

        // Bu test ardışık gönderilen mesajların sırayla teslim edildiğini doğrular.
        @Test
        void pipelined_messages_are_returned_in_order()
        {
            feed("*1\r\n$4\r\nPING\r\n+PING\r\n*2\r\n$4\r\nECHO\r\n:5\r\n");
            assertEquals(Value.array(Value.bulk("PING")), reader.nextMessage());
            assertEquals(Value.bulk("PING"), reader.nextMessage());
            assertEquals(Value.array(Value.bulk("ECHO"), Value.integer(5)), reader.nextMessage());
            assertNull(reader.nextMessage());
        }

        // Bu test iç içe dizilerin tek mesaj olarak birleştirildiğini gösterir.
        @Test
        void nested_arrays_form_one_message()
        {
            feed("*2\r\n*2\r\n:1\r\n:2\r\n$1\r\nx\r\n");
            assertEquals(Value.array(Value.array(Value.integer(1), Value.integer(2)), Value.bulk("x")),
                    reader.nextMessage());
        }

        // Bu test Nil olarak çözülen elemanın da dizinin bir elemanı sayıldığını doğrular.
        @Test
        void nil_units_count_as_elements()
        {
            feed("*2\r\n$-1\r\n$1\r\na\r\n");
            assertEquals(Value.array(Value.NIL, Value.bulk("a")), reader.nextMessage());
        }
    }

    @Nested
    class Failures
    {
        // Bu test hatalı birimde yarım mesajın atıldığını ve sonraki mesajın okunabildiğini gösterir.
        @Test
        void failure_discards_partial_message()
        {
            feed("*2\r\n$3\r\nGET\r\n$zz\r\n");
            assertThrows(ProtocolException.class, reader::nextMessage);
            assertFalse(reader.hasPartialMessage());

            feed("*1\r\n$4\r\nPING\r\n");
            assertEquals(Value.array(Value.bulk("PING")), reader.nextMessage());
        }
    }
}
