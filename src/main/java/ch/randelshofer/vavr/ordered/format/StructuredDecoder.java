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

import io.vavr.collection.List;
import io.vavr.collection.Seq;

import java.io.IOException;
import java.lang.reflect.Type;

/**
 * The reading side of a structured format, e.g. JSON or YAML.
 * <p>
 * Decoded values are never null. A decoder that encounters a null where a
 * value is required reports it as an {@link IOException}.
 */
public interface StructuredDecoder {

    /**
     * Returns the path of field names from the document root to the value
     * this decoder reads.
     *
     * @return the coding path, empty at the root
     */
    List<AnyKey> codingPath();

    /**
     * Interprets the current value as a keyed container.
     *
     * @return the container
     * @throws IOException if the current value is not a keyed container
     */
    KeyedDecodingContainer beginKeyedContainer() throws IOException;

    /**
     * Interprets the current value as an unkeyed container.
     *
     * @return the container
     * @throws IOException if the current value is not an unkeyed container
     */
    UnkeyedDecodingContainer beginUnkeyedContainer() throws IOException;

    interface KeyedDecodingContainer {
        /**
         * Returns the field names in the order in which they appear in the source.
         *
         * @return the field names
         */
        Seq<AnyKey> allKeys();

        <T> T decode(Type type, AnyKey key) throws IOException;
    }

    interface UnkeyedDecodingContainer {
        boolean isExhausted();

        <T> T decodeNext(Type type) throws IOException;
    }
}
