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

import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.collection.Seq;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * An in-memory structured format: keyed containers are {@link LinkedHashMap}s
 * from field name to value, unkeyed containers are {@link ArrayList}s. Values
 * are stored as they are.
 */
final class TreeCodec {
    private TreeCodec() {
    }

    static final class Encoder implements StructuredEncoder {
        private Object result;
        private final ArrayList<Type> types = new ArrayList<>();

        Object result() {
            return result;
        }

        /**
         * @return the declared types of the written values, in writing order
         */
        java.util.List<Type> types() {
            return types;
        }

        @Override
        public KeyedEncodingContainer beginKeyedContainer() {
            final LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
            result = fields;
            return new KeyedEncodingContainer() {
                @Override
                public void encode(Object value, Type type, AnyKey key) throws IOException {
                    if (fields.containsKey(key.stringValue())) {
                        throw new IOException("duplicate field " + key);
                    }
                    fields.put(key.stringValue(), value);
                    types.add(type);
                }

                @Override
                public void end() {
                }
            };
        }

        @Override
        public UnkeyedEncodingContainer beginUnkeyedContainer() {
            final ArrayList<Object> elements = new ArrayList<>();
            result = elements;
            return new UnkeyedEncodingContainer() {
                @Override
                public void encode(Object value, Type type) {
                    elements.add(value);
                    types.add(type);
                }

                @Override
                public void end() {
                }
            };
        }
    }

    static final class Decoder implements StructuredDecoder {
        private final Object tree;

        Decoder(Object tree) {
            this.tree = tree;
        }

        @Override
        public List<AnyKey> codingPath() {
            return List.of(AnyKey.of("root"));
        }

        @Override
        @SuppressWarnings("unchecked")
        public KeyedDecodingContainer beginKeyedContainer() throws IOException {
            if (!(tree instanceof LinkedHashMap)) {
                throw new IOException("expected keyed container");
            }
            final LinkedHashMap<String, Object> fields = (LinkedHashMap<String, Object>) tree;
            return new KeyedDecodingContainer() {
                @Override
                public Seq<AnyKey> allKeys() {
                    return Iterator.ofAll(fields.keySet()).map(AnyKey::of).toList();
                }

                @Override
                public <T> T decode(Type type, AnyKey key) throws IOException {
                    return (T) require(fields.get(key.stringValue()));
                }
            };
        }

        @Override
        @SuppressWarnings("unchecked")
        public UnkeyedDecodingContainer beginUnkeyedContainer() throws IOException {
            if (!(tree instanceof ArrayList)) {
                throw new IOException("expected unkeyed container");
            }
            final ArrayList<Object> elements = (ArrayList<Object>) tree;
            return new UnkeyedDecodingContainer() {
                private int index;

                @Override
                public boolean isExhausted() {
                    return index >= elements.size();
                }

                @Override
                public <T> T decodeNext(Type type) throws IOException {
                    if (isExhausted()) {
                        throw new IOException("no more elements");
                    }
                    return (T) require(elements.get(index++));
                }
            };
        }

        private static Object require(Object value) throws IOException {
            if (value == null) {
                throw new IOException("null value");
            }
            return value;
        }
    }
}
