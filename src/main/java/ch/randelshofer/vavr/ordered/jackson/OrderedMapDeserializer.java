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
import ch.randelshofer.vavr.ordered.format.KeyMismatchException;
import ch.randelshofer.vavr.ordered.format.OrderedMapFormat;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

/**
 * Deserializes an {@link OrderedMap} with the given key and value types.
 * <p>
 * A field name that cannot be converted into the key type is reported as an
 * {@link InvalidFormatException} whose value is the offending field name.
 */
public class OrderedMapDeserializer extends StdDeserializer<OrderedMap<?, ?>> {
    private static final long serialVersionUID = 1L;

    private final transient OrderedMapFormat format;
    private final JavaType keyType;
    private final JavaType valueType;

    public OrderedMapDeserializer(OrderedMapFormat format, JavaType keyType, JavaType valueType) {
        super(OrderedMap.class);
        this.format = format;
        this.keyType = keyType;
        this.valueType = valueType;
    }

    @Override
    public OrderedMap<?, ?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        final JsonNode node = ctxt.readTree(p);
        final JacksonStructuredDecoder decoder = new JacksonStructuredDecoder(node, ctxt,
                JacksonStructuredDecoder.pathOf(p.getParsingContext()));
        try {
            return format.decode(decoder, keyType.getRawClass(), keyType, valueType);
        } catch (KeyMismatchException e) {
            throw InvalidFormatException.from(p, e.getMessage(), e.getFieldName(), e.getKeyClass());
        }
    }
}
