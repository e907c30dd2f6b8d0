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

import io.vavr.collection.LinkedHashMap;
import io.vavr.collection.Map;
import io.vavr.control.Option;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable registry of the key types that can be losslessly converted to
 * strings and back.
 * <p>
 * A converter registered for a class applies to that class and, if no
 * converter is registered for it directly, to its subclasses and
 * implementations. Registrations are searched in the order in which they were
 * made.
 */
public final class KeyConverters {
    private static final KeyConverters EMPTY = new KeyConverters(LinkedHashMap.empty());
    private static final KeyConverters DEFAULTS = EMPTY
            .with(String.class, KeyConverter.of(s -> s, s -> s))
            .with(Integer.class, KeyConverter.of(String::valueOf, Integer::valueOf))
            .with(Long.class, KeyConverter.of(String::valueOf, Long::valueOf))
            .with(Short.class, KeyConverter.of(String::valueOf, Short::valueOf))
            .with(Byte.class, KeyConverter.of(String::valueOf, Byte::valueOf))
            .with(Double.class, KeyConverter.of(String::valueOf, Double::valueOf))
            .with(Float.class, KeyConverter.of(String::valueOf, Float::valueOf))
            .with(BigInteger.class, KeyConverter.of(BigInteger::toString, BigInteger::new))
            .with(BigDecimal.class, KeyConverter.of(BigDecimal::toString, BigDecimal::new))
            .with(Boolean.class, KeyConverter.of(String::valueOf, KeyConverters::parseBoolean))
            .with(Character.class, KeyConverter.of(String::valueOf, KeyConverters::parseCharacter))
            .with(UUID.class, KeyConverter.of(UUID::toString, UUID::fromString));

    private final Map<Class<?>, KeyConverter<?>> converters;

    private KeyConverters(Map<Class<?>, KeyConverter<?>> converters) {
        this.converters = converters;
    }

    /**
     * @return a registry without any converters
     */
    public static KeyConverters empty() {
        return EMPTY;
    }

    /**
     * Returns the registry with converters for {@code String}, the boxed
     * numeric types, {@code BigInteger}, {@code BigDecimal}, {@code Boolean},
     * {@code Character} and {@code UUID}.
     *
     * @return the default registry
     */
    public static KeyConverters defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a new registry that additionally converts keys of the given type.
     * A converter already registered for the same class is replaced.
     *
     * @param type      a key class
     * @param converter the converter for that class
     * @param <T>       the key type
     * @return a new registry
     */
    public <T> KeyConverters with(Class<T> type, KeyConverter<T> converter) {
        Objects.requireNonNull(type, "type is null");
        Objects.requireNonNull(converter, "converter is null");
        return new KeyConverters(converters.put(type, converter));
    }

    /**
     * Looks up the converter for the given class.
     *
     * @param type a key class
     * @param <T>  the key type
     * @return the converter, or {@code None} if keys of this class cannot be
     * losslessly converted
     */
    @SuppressWarnings("unchecked")
    public <T> Option<KeyConverter<T>> find(Class<T> type) {
        Objects.requireNonNull(type, "type is null");
        final Option<KeyConverter<?>> exact = converters.get(type);
        if (exact.isDefined()) {
            return exact.map(c -> (KeyConverter<T>) c);
        }
        return converters.find(entry -> entry._1.isAssignableFrom(type))
                .map(entry -> (KeyConverter<T>) entry._2);
    }

    public boolean isConvertible(Class<?> type) {
        return find(type).isDefined();
    }

    /**
     * Renders the given key, provided its runtime class has a converter.
     *
     * @param key a key
     * @return the rendered key, or {@code None} if the key has no lossless string form
     */
    @SuppressWarnings("unchecked")
    public Option<String> render(Object key) {
        return find((Class<Object>) key.getClass()).map(converter -> converter.render(key));
    }

    private static Boolean parseBoolean(String text) {
        switch (text) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Not a boolean: " + text);
        }
    }

    private static Character parseCharacter(String text) {
        if (text.length() != 1) {
            throw new IllegalArgumentException("Not a single character: " + text);
        }
        return text.charAt(0);
    }
}
