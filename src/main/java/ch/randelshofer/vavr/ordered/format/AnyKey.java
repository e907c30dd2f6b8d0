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

import io.vavr.control.Option;

import java.io.Serializable;
import java.util.Objects;

/**
 * A string-backed field name in a keyed container.
 * <p>
 * An {@code OrderedMap} never addresses its fields by number, so
 * {@link #intValue()} is always {@code None}.
 */
public final class AnyKey implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String stringValue;

    private AnyKey(String stringValue) {
        this.stringValue = stringValue;
    }

    public static AnyKey of(String stringValue) {
        return new AnyKey(Objects.requireNonNull(stringValue, "stringValue is null"));
    }

    public String stringValue() {
        return stringValue;
    }

    public Option<Integer> intValue() {
        return Option.none();
    }

    @Override
    public boolean equals(Object o) {
        return o == this || o instanceof AnyKey && stringValue.equals(((AnyKey) o).stringValue);
    }

    @Override
    public int hashCode() {
        return stringValue.hashCode();
    }

    @Override
    public String toString() {
        return stringValue;
    }
}
