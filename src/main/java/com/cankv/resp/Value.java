package com.cankv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * RESP protokolündeki değerleri temsil eden özyinelemeli veri modelidir. Bir
 * değer {@link Nil}, {@link IntegerValue}, {@link BulkString} ya da
 * {@link ArrayValue} olabilir. Diziler, elemanları ağdan henüz gelmemişken
 * yarım halde bulunabilir; {@link #isComplete()} ve {@link #append(Value)}
 * akış üzerinden parça parça mesaj kurmayı sağlar.
 */
public sealed interface Value permits Value.Nil, Value.IntegerValue, Value.BulkString, Value.ArrayValue
{
    Nil NIL = new Nil();

    /**
     * Dizi olmayan değerler her zaman tamamdır.
     */
    default boolean isComplete()
    {
        return true;
    }

    /**
     * Yeni çözülmüş bir değeri, kökten derinlik öncelikli aramayla bulunan ilk
     * tamamlanmamış diziye ekler.
     *
     * @throws IllegalStateException değer zaten tamamsa ya da dizi değilse
     */
    default void append(Value value)
    {
        throw new IllegalStateException("Only incomplete arrays accept appended values, got " + this);
    }

    /**
     * Değerin derin kopyasını döndürür; bayt içerikleri de kopyalanır.
     */
    Value copy();

    static BulkString bulk(String text)
    {
        return new BulkString(text.getBytes(StandardCharsets.UTF_8));
    }

    static IntegerValue integer(long value)
    {
        return new IntegerValue(value);
    }

    static ArrayValue array(Value... elements)
    {
        ArrayValue array = new ArrayValue(elements.length);
        for (Value element : elements) {
            array.append(element);
        }
        return array;
    }

    record Nil() implements Value
    {
        @Override
        public Value copy()
        {
            return this;
        }

        @Override
        public String toString()
        {
            return "Nil";
        }
    }

    record IntegerValue(long value) implements Value
    {
        @Override
        public Value copy()
        {
            return this;
        }
    }

    /**
     * İkili veri taşıyabilen, uzunluğu önceden bilinen metin birimidir.
     */
    record BulkString(byte[] bytes) implements Value
    {
        public BulkString
        {
            Objects.requireNonNull(bytes, "bytes");
        }

        public String utf8()
        {
            return new String(bytes, StandardCharsets.UTF_8);
        }

        public int length()
        {
            return bytes.length;
        }

        @Override
        public Value copy()
        {
            return new BulkString(bytes.clone());
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof BulkString other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode()
        {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString()
        {
            return "BulkString[" + utf8() + "]";
        }
    }

    /**
     * Bildirilen eleman sayısı ile o ana kadar toplanan elemanları ayrı ayrı
     * tutan dizi değeridir. Elemanlar yalnızca {@link #append(Value)} ile
     * eklenir; tamamlanmış bir dizi bir daha değişmez.
     */
    final class ArrayValue implements Value
    {
        private final int declaredSize;
        private final List<Value> elements;
        // elements before this index are known to be complete
        private int settled;

        public ArrayValue(int declaredSize)
        {
            if (declaredSize < 0) {
                throw new IllegalArgumentException("declaredSize must be greater than or equal to 0");
            }
            this.declaredSize = declaredSize;
            this.elements = new ArrayList<>(Math.min(declaredSize, 16));
        }

        public int declaredSize()
        {
            return declaredSize;
        }

        public List<Value> elements()
        {
            return Collections.unmodifiableList(elements);
        }

        @Override
        public boolean isComplete()
        {
            if (elements.size() != declaredSize) {
                return false;
            }
            advanceSettled();
            return settled == elements.size();
        }

        @Override
        public void append(Value value)
        {
            Objects.requireNonNull(value, "value");
            if (isComplete()) {
                throw new IllegalStateException("Cannot append to a complete array of size " + declaredSize);
            }
            advanceSettled();
            if (settled < elements.size()) {
                elements.get(settled).append(value);
                return;
            }
            elements.add(value);
        }

        private void advanceSettled()
        {
            while (settled < elements.size() && elements.get(settled).isComplete()) {
                settled++;
            }
        }

        @Override
        public Value copy()
        {
            ArrayValue copy = new ArrayValue(declaredSize);
            for (Value element : elements) {
                copy.elements.add(element.copy());
            }
            copy.settled = settled;
            return copy;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) {
                return true;
            }
            return o instanceof ArrayValue other
                    && declaredSize == other.declaredSize
                    && elements.equals(other.elements);
        }

        @Override
        public int hashCode()
        {
            return 31 * declaredSize + elements.hashCode();
        }

        @Override
        public String toString()
        {
            return "Array[" + declaredSize + "]" + elements;
        }
    }
}
