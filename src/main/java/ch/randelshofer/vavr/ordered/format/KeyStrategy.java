/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.ordered.format;

import ch.randelshofer.vavr.ordered.OrderedMap;
import io.vavr.Tuple2;
import io.vavr.collection.List;
import io.vavr.control.Option;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.function.Function;

/**
 * The ways in which an {@link OrderedMap} can be written to a structured
 * format, in the order of preference.
 * <p>
 * The first three strategies write a keyed container, with the fields in the
 * insertion order of the map. {@link #ALTERNATING_ENTRIES} writes an unkeyed
 * container that alternates between keys and values; it can represent any
 * key type.
 * <p>
 * When encoding, a strategy is selected by the declared key class and by the
 * keys actually present in the map. When decoding, it is selected by the
 * expected key class alone.
 * <p>
 * A key class of {@code Object} means that the key type is not known. Such a
 * map is written as a keyed container if all of its keys have a lossless
 * string form, and it is read back with the field names as {@code String}
 * keys. A map of unknown key type with opaque keys can be written, but not
 * read back.
 */
public enum KeyStrategy {
    /**
     * The key class is {@code String}. Each key is its own field name.
     * Maps of unknown key class are read with this strategy too.
     */
    STRING_KEYS {
        @Override
        public boolean canEncode(Class<?> declaredKeyClass, OrderedMap<?, ?> map, KeyConverters converters) {
            return declaredKeyClass == String.class;
        }

        @Override
        public boolean canDecode(Class<?> keyClass, KeyConverters converters) {
            return keyClass == String.class || keyClass == Object.class;
        }

        @Override
        <K, V> void encode(OrderedMap<K, V> map, StructuredEncoder encoder, Type keyType, Type valueType,
                           KeyConverters converters) throws IOException {
            encodeKeyed(map, encoder, valueType, String.class::cast);
        }

        @Override
        <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type keyType, Type valueType,
                                       KeyConverters converters) throws IOException {
            return decodeKeyed(decoder, keyClass, valueType, field -> Option.some(keyClass.cast(field)));
        }
    },
    /**
     * Every key has a lossless string form in the {@link KeyConverters}.
     * The rendered key is the field name. If even one key has no lossless
     * string form, this strategy does not apply to the map at all.
     * <p>
     * An empty map qualifies if its declared key class is convertible or is
     * not known ({@code Object}).
     */
    LOSSLESS_STRING_KEYS {
        @Override
        public boolean canEncode(Class<?> declaredKeyClass, OrderedMap<?, ?> map, KeyConverters converters) {
            if (map.isEmpty()) {
                return declaredKeyClass == Object.class || converters.isConvertible(declaredKeyClass);
            }
            return !map.containsKeyWhere(key -> converters.render(key).isEmpty());
        }

        @Override
        public boolean canDecode(Class<?> keyClass, KeyConverters converters) {
            return converters.isConvertible(keyClass);
        }

        @Override
        <K, V> void encode(OrderedMap<K, V> map, StructuredEncoder encoder, Type keyType, Type valueType,
                           KeyConverters converters) throws IOException {
            encodeKeyed(map, encoder, valueType, key -> converters.render(key).get());
        }

        @Override
        <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type keyType, Type valueType,
                                       KeyConverters converters) throws IOException {
            final KeyConverter<K> converter = converters.find(keyClass).get();
            return decodeKeyed(decoder, keyClass, valueType, converter::parse);
        }
    },
    /**
     * The key class is an enum. The raw value of each constant is its field
     * name, see {@link StringRawValue}.
     */
    RAW_STRING_KEYS {
        @Override
        public boolean canEncode(Class<?> declaredKeyClass, OrderedMap<?, ?> map, KeyConverters converters) {
            return declaredKeyClass.isEnum();
        }

        @Override
        public boolean canDecode(Class<?> keyClass, KeyConverters converters) {
            return keyClass.isEnum();
        }

        @Override
        <K, V> void encode(OrderedMap<K, V> map, StructuredEncoder encoder, Type keyType, Type valueType,
                           KeyConverters converters) throws IOException {
            encodeKeyed(map, encoder, valueType, KeyStrategy::rawValue);
        }

        @Override
        <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type keyType, Type valueType,
                                       KeyConverters converters) throws IOException {
            final List<K> constants = List.of(keyClass.getEnumConstants());
            return decodeKeyed(decoder, keyClass, valueType, field -> constants.find(c -> rawValue(c).equals(field)));
        }
    },
    /**
     * Any key class. Keys and values are written alternately into an unkeyed
     * container, and the keys are encoded as values in their own right.
     */
    ALTERNATING_ENTRIES {
        @Override
        public boolean canEncode(Class<?> declaredKeyClass, OrderedMap<?, ?> map, KeyConverters converters) {
            return true;
        }

        @Override
        public boolean canDecode(Class<?> keyClass, KeyConverters converters) {
            return true;
        }

        @Override
        <K, V> void encode(OrderedMap<K, V> map, StructuredEncoder encoder, Type keyType, Type valueType,
                           KeyConverters converters) throws IOException {
            final StructuredEncoder.UnkeyedEncodingContainer container = encoder.beginUnkeyedContainer();
            for (Tuple2<K, V> entry : map) {
                container.encode(entry._1, keyType);
                container.encode(entry._2, valueType);
            }
            container.end();
        }

        @Override
        <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type keyType, Type valueType,
                                       KeyConverters converters) throws IOException {
            final StructuredDecoder.UnkeyedDecodingContainer container = decoder.beginUnkeyedContainer();
            final OrderedMap<K, V> map = OrderedMap.empty();
            while (!container.isExhausted()) {
                final K key = container.decodeNext(keyType);
                final V value = container.decodeNext(valueType);
                map.put(key, value);
            }
            return map;
        }
    };

    /**
     * All strategies, in the order in which they are tried.
     */
    public static final List<KeyStrategy> PRIORITY = List.of(values());

    /**
     * Returns whether this strategy can write the given map.
     *
     * @param declaredKeyClass the key class the map was declared with, {@code Object} if unknown
     * @param map              the map
     * @param converters       the lossless key converters
     * @return true if this strategy applies
     */
    public abstract boolean canEncode(Class<?> declaredKeyClass, OrderedMap<?, ?> map, KeyConverters converters);

    /**
     * Returns whether this strategy can read a map with the given key class.
     *
     * @param keyClass   the key class of the map to read
     * @param converters the lossless key converters
     * @return true if this strategy applies
     */
    public abstract boolean canDecode(Class<?> keyClass, KeyConverters converters);

    abstract <K, V> void encode(OrderedMap<K, V> map, StructuredEncoder encoder, Type keyType, Type valueType,
                                KeyConverters converters) throws IOException;

    abstract <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type keyType, Type valueType,
                                            KeyConverters converters) throws IOException;

    /**
     * Selects the first strategy that can write the given map.
     *
     * @param declaredKeyClass the key class the map was declared with, {@code Object} if unknown
     * @param map              the map
     * @param converters       the lossless key converters
     * @return the strategy
     */
    public static KeyStrategy forEncoding(Class<?> declaredKeyClass, OrderedMap<?, ?> map, KeyConverters converters) {
        return PRIORITY.find(s -> s.canEncode(declaredKeyClass, map, converters)).get();
    }

    /**
     * Selects the first strategy that can read a map with the given key class.
     *
     * @param keyClass   the key class of the map to read
     * @param converters the lossless key converters
     * @return the strategy
     */
    public static KeyStrategy forDecoding(Class<?> keyClass, KeyConverters converters) {
        return PRIORITY.find(s -> s.canDecode(keyClass, converters)).get();
    }

    static String rawValue(Object key) {
        return key instanceof StringRawValue ? ((StringRawValue) key).rawValue() : ((Enum<?>) key).name();
    }

    private static <K, V> void encodeKeyed(OrderedMap<K, V> map, StructuredEncoder encoder, Type valueType,
                                           Function<? super K, String> fieldName) throws IOException {
        final StructuredEncoder.KeyedEncodingContainer container = encoder.beginKeyedContainer();
        for (Tuple2<K, V> entry : map) {
            container.encode(entry._2, valueType, AnyKey.of(fieldName.apply(entry._1)));
        }
        container.end();
    }

    private static <K, V> OrderedMap<K, V> decodeKeyed(StructuredDecoder decoder, Class<K> keyClass, Type valueType,
                                                       Function<String, Option<K>> parse) throws IOException {
        final StructuredDecoder.KeyedDecodingContainer container = decoder.beginKeyedContainer();
        final OrderedMap<K, V> map = OrderedMap.empty();
        for (AnyKey field : container.allKeys()) {
            final Option<K> key = parse.apply(field.stringValue());
            if (key.isEmpty()) {
                throw new KeyMismatchException(field.stringValue(), keyClass, decoder.codingPath().append(field));
            }
            final V value = container.decode(valueType, field);
            map.put(key.get(), value);
        }
        return map;
    }
}
