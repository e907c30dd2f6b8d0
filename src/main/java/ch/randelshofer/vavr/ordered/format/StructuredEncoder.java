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

import java.io.IOException;
import java.lang.reflect.Type;

/**
 * The writing side of a structured format, e.g. JSON or YAML.
 * <p>
 * Every container that is begun must be ended before the next sibling value
 * is written.
 */
public interface StructuredEncoder {

    /**
     * Begins a container whose values are addressed by field names.
     *
     * @return the container
     * @throws IOException if the underlying format fails
     */
    KeyedEncodingContainer beginKeyedContainer() throws IOException;

    /**
     * Begins a container whose values appear in a flat positional sequence.
     *
     * @return the container
     * @throws IOException if the underlying format fails
     */
    UnkeyedEncodingContainer beginUnkeyedContainer() throws IOException;

    /**
     * Values are written with the type they were declared with, so that a
     * format can pick the same representation that a decoder of that type
     * expects. {@code Object.class} means the declared type is not known.
     */
    interface KeyedEncodingContainer {
        void encode(Object value, Type type, AnyKey key) throws IOException;

        void end() throws IOException;
    }

    interface UnkeyedEncodingContainer {
        void encode(Object value, Type type) throws IOException;

        void end() throws IOException;
    }
}
