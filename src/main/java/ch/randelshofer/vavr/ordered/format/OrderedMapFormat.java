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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Writes and reads {@link OrderedMap}s through a {@link StructuredEncoder}
 * and {@link StructuredDecoder}, choosing the representation by the key type
 * as described in {@link KeyStrategy}.
 * <p>
 * Errors of the underlying format are propagated unchanged. A field name that
 * cannot be converted into the expected key type fails the whole decode with
 * a {@link KeyMismatchException}; it is never skipped.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class OrderedMapFormat {
    private static final Logger LOGGER = LoggerFactory.getLogger(OrderedMapFormat.class);
    private static final OrderedMapFormat STANDARD = new OrderedMapFormat(KeyConverters.defaults());

    private final KeyConverters converters;

    private OrderedMapFormat(KeyConverters converters) {
        this.converters = converters;
    }

    /**
     * @return a format that uses the {@linkplain KeyConverters#defaults() default} key converters
     */
    public static OrderedMapFormat standard() {
        return STANDARD;
    }

    public static OrderedMapFormat withConverters(KeyConverters converters) {
        return new OrderedMapFormat(Objects.requireNonNull(converters, "converters is null"));
    }

    public KeyConverters converters() {
        return converters;
    }

    public KeyStrategy strategyForEncoding(Class<?> declaredKeyClass, OrderedMap<?, ?> map) {
        Objects.requireNonNull(declaredKeyClass, "declaredKeyClass is null");
        Objects.requireNonNull(map, "map is null");
        return KeyStrategy.forEncoding(declaredKeyClass, map, converters);
    }

    public KeyStrategy strategyForDecoding(Class<?> keyClass) {
        Objects.requireNonNull(keyClass, "keyClass is null");
        return KeyStrategy.forDecoding(keyClass, converters);
    }

    /**
     * Writes the given map whose value type is not known. Keys are handed to
     * the encoder as of the declared key class, values as of {@code Object}.
     *
     * @param map              the map
     * @param declaredKeyClass the key class the map was declared with, {@code Object} if unknown
     * @param encoder          the encoder
     * @param <K>              the key type
     * @param <V>              the value type
     * @throws IOException if the encoder fails
     */
    public <K, V> void encode(OrderedMap<K, V> map, Class<?> declaredKeyClass, StructuredEncoder encoder) throws IOException {
        encode(map, declaredKeyClass, declaredKeyClass, Object.class, encoder);
    }

    /**
     * Writes the given map.
     *
     * @param map              the map
     * @param declaredKeyClass the raw key class the map was declared with, {@code Object} if unknown,
     *                         which selects the strategy
     * @param keyType          the full declared key type, used to write keys that are written as values
     * @param valueType        the full declared value type, {@code Object.class} if unknown
     * @param encoder          the encoder
     * @param <K>              the key type
     * @param <V>              the value type
     * @throws IOException if the encoder fails
     */
    public <K, V> void encode(OrderedMap<K, V> map, Class<?> declaredKeyClass, Type keyType, Type valueType,
                              StructuredEncoder encoder) throws IOException {
        Objects.requireNonNull(keyType, "keyType is null");
        Objects.requireNonNull(valueType, "valueType is null");
        Objects.requireNonNull(encoder, "encoder is null");
        final KeyStrategy strategy = strategyForEncoding(declaredKeyClass, map);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Encoding OrderedMap<{}> of size {} with {}", declaredKeyClass.getSimpleName(), map.size(), strategy);
            if (strategy == KeyStrategy.ALTERNATING_ENTRIES && map.containsKeyWhere(key -> converters.render(key).isDefined())) {
                LOGGER.debug("Not all keys of the OrderedMap have a lossless string form, writing all {} entries as alternating keys and values",
                        map.size());
            }
        }
        strategy.encode(map, encoder, keyType, valueType, converters);
    }

    /**
     * Reads a map whose key type is not generic.
     *
     * @param decoder   the decoder
     * @param keyClass  the key class
     * @param valueType the value type
     * @param <K>       the key type
     * @param <V>       the value type
     * @return the map
     * @throws KeyMismatchException if a field name cannot be converted into {@code keyClass}
     * @throws IOException          if the decoder fails
     */
    public <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type valueType) throws IOException {
        return decode(decoder, keyClass, keyClass, valueType);
    }

    /**
     * Reads a map.
     *
     * @param decoder   the decoder
     * @param keyClass  the raw key class, which selects the strategy
     * @param keyType   the full key type, used to read keys that are written as values
     * @param valueType the value type
     * @param <K>       the key type
     * @param <V>       the value type
     * @return the map
     * @throws KeyMismatchException if a field name cannot be converted into {@code keyClass}
     * @throws IOException          if the decoder fails
     */
    public <K, V> OrderedMap<K, V> decode(StructuredDecoder decoder, Class<K> keyClass, Type keyType, Type valueType) throws IOException {
        Objects.requireNonNull(decoder, "decoder is null");
        Objects.requireNonNull(keyType, "keyType is null");
        Objects.requireNonNull(valueType, "valueType is null");
        final KeyStrategy strategy = strategyForDecoding(keyClass);
        LOGGER.debug("Decoding OrderedMap<{}> with {}", keyClass.getSimpleName(), strategy);
        return strategy.decode(decoder, keyClass, keyType, valueType, converters);
    }
}
