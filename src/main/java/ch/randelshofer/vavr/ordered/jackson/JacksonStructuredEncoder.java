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

import ch.randelshofer.vavr.ordered.format.AnyKey;
import ch.randelshofer.vavr.ordered.format.StructuredEncoder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.lang.reflect.Type;

/**
 * Writes containers to a {@link JsonGenerator}, serializing values with the
 * serializers known to the {@link SerializerProvider}.
 * <p>
 * A value whose runtime class is the raw class of its declared type is
 * written with the serializer of the declared type, which keeps its generic
 * type parameters. Any other value is written by its runtime class.
 */
public final class JacksonStructuredEncoder implements StructuredEncoder {
    private final JsonGenerator gen;
    private final SerializerProvider provider;

    public JacksonStructuredEncoder(JsonGenerator gen, SerializerProvider provider) {
        this.gen = gen;
        this.provider = provider;
    }

    @Override
    public KeyedEncodingContainer beginKeyedContainer() throws IOException {
        gen.writeStartObject();
        return new KeyedEncodingContainer() {
            @Override
            public void encode(Object value, Type type, AnyKey key) throws IOException {
                gen.writeFieldName(key.stringValue());
                write(value, type);
            }

            @Override
            public void end() throws IOException {
                gen.writeEndObject();
            }
        };
    }

    @Override
    public UnkeyedEncodingContainer beginUnkeyedContainer() throws IOException {
        gen.writeStartArray();
        return new UnkeyedEncodingContainer() {
            @Override
            public void encode(Object value, Type type) throws IOException {
                write(value, type);
            }

            @Override
            public void end() throws IOException {
                gen.writeEndArray();
            }
        };
    }

    private void write(Object value, Type type) throws IOException {
        final JavaType javaType = provider.constructType(type);
        if (javaType.hasRawClass(value.getClass())) {
            provider.findTypedValueSerializer(javaType, true, null).serialize(value, gen, provider);
        } else {
            provider.defaultSerializeValue(value, gen);
        }
    }
}
