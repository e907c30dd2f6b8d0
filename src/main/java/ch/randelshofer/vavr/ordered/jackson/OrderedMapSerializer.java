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
package ch.randelshofer.vavr.ordered.jackson;

import ch.randelshofer.vavr.ordered.OrderedMap;
import ch.randelshofer.vavr.ordered.format.OrderedMapFormat;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Serializes an {@link OrderedMap} with the key and value types it was
 * declared with. A type that Jackson does not know (e.g. for a root value
 * written without a type reference) is {@code Object}.
 * <p>
 * Values, and keys written as values, are serialized with the serializer of
 * their declared type, so that a nested {@code OrderedMap} is written in the
 * representation that its declared key type selects.
 */
public class OrderedMapSerializer extends StdSerializer<OrderedMap<?, ?>> {
    private static final long serialVersionUID = 1L;

    private final transient OrderedMapFormat format;
    private final JavaType keyType;
    private final JavaType valueType;

    public OrderedMapSerializer(OrderedMapFormat format, JavaType keyType, JavaType valueType) {
        super(OrderedMap.class, false);
        this.format = format;
        this.keyType = keyType;
        this.valueType = valueType;
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, OrderedMap<?, ?> value) {
        return value.isEmpty();
    }

    @Override
    public void serialize(OrderedMap<?, ?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        format.encode(value, keyType.getRawClass(), keyType, valueType, new JacksonStructuredEncoder(gen, provider));
    }
}
