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
import ch.randelshofer.vavr.ordered.format.AnyKey;
import ch.randelshofer.vavr.ordered.format.StructuredDecoder;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.collection.Seq;

import java.io.IOException;
import java.lang.reflect.Type;

/**
 * Reads containers from a {@link JsonNode} tree, deserializing values with
 * the deserializers known to the {@link DeserializationContext}.
 * <p>
 * The fields of an object node are reported in document order.
 */
public final class JacksonStructuredDecoder implements StructuredDecoder {
    private final JsonNode node;
    private final DeserializationContext ctxt;
    private final List<AnyKey> codingPath;

    public JacksonStructuredDecoder(JsonNode node, DeserializationContext ctxt, List<AnyKey> codingPath) {
        this.node = node;
        this.ctxt = ctxt;
        this.codingPath = codingPath;
    }

    /**
     * Returns the path of field names and array indices that leads to the
     * value the given context is positioned in.
     *
     * @param context a parsing context
     * @return the path, empty at the root
     */
    static List<AnyKey> pathOf(JsonStreamContext context) {
        List<AnyKey> path = List.empty();
        for (JsonStreamContext c = context; c != null && !c.inRoot(); c = c.getParent()) {
            if (c.inArray()) {
                path = path.prepend(AnyKey.of(String.valueOf(c.getCurrentIndex())));
            } else if (c.getCurrentName() != null) {
                path = path.prepend(AnyKey.of(c.getCurrentName()));
            }
        }
        return path;
    }

    @Override
    public List<AnyKey> codingPath() {
        return codingPath;
    }

    @Override
    public KeyedDecodingContainer beginKeyedContainer() throws IOException {
        if (!node.isObject()) {
            return ctxt.reportInputMismatch(OrderedMap.class,
                    "Expected an object for an OrderedMap with string-representable keys, found %s", node.getNodeType());
        }
        final Seq<AnyKey> keys = Iterator.ofAll(node.fieldNames()).map(AnyKey::of).toVector();
        return new KeyedDecodingContainer() {
            @Override
            public Seq<AnyKey> allKeys() {
                return keys;
            }

            @Override
            public <T> T decode(Type type, AnyKey key) throws IOException {
                final JsonNode child = node.get(key.stringValue());
                if (child == null) {
                    return ctxt.reportInputMismatch(OrderedMap.class, "No field '%s' in OrderedMap", key);
                }
                return readValue(child, type, key);
            }
        };
    }

    @Override
    public UnkeyedDecodingContainer beginUnkeyedContainer() throws IOException {
        if (!node.isArray()) {
            return ctxt.reportInputMismatch(OrderedMap.class,
                    "Expected an array of alternating keys and values for an OrderedMap, found %s", node.getNodeType());
        }
        return new UnkeyedDecodingContainer() {
            private int index;

            @Override
            public boolean isExhausted() {
                return index >= node.size();
            }

            @Override
            public <T> T decodeNext(Type type) throws IOException {
                if (isExhausted()) {
                    return ctxt.reportInputMismatch(OrderedMap.class,
                            "Unexpected end of OrderedMap entries after %d elements, keys and values must alternate", index);
                }
                final int i = index++;
                return readValue(node.get(i), type, AnyKey.of(String.valueOf(i)));
            }
        };
    }

    private <T> T readValue(JsonNode child, Type type, AnyKey key) throws IOException {
        final T value = ctxt.readTreeAsValue(child, ctxt.constructType(type));
        if (value == null) {
            return ctxt.reportInputMismatch(OrderedMap.class, "OrderedMap does not allow null at '%s'", key);
        }
        return value;
    }
}
