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

import java.io.IOException;

/**
 * Thrown when a field name of a keyed container cannot be converted into the
 * key type of the map that is being decoded.
 */
public class KeyMismatchException extends IOException {
    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final Class<?> keyClass;
    private final List<AnyKey> codingPath;

    public KeyMismatchException(String fieldName, Class<?> keyClass, List<AnyKey> codingPath) {
        super("OrderedMap key '" + fieldName + "' at " + codingPath.mkString("/", "/", "")
                + " could not be decoded as " + keyClass.getName());
        this.fieldName = fieldName;
        this.keyClass = keyClass;
        this.codingPath = codingPath;
    }

    /**
     * @return the field name that could not be converted
     */
    public String getFieldName() {
        return fieldName;
    }

    public Class<?> getKeyClass() {
        return keyClass;
    }

    /**
     * @return the path to the offending field, ending with the field itself
     */
    public List<AnyKey> getCodingPath() {
        return codingPath;
    }
}
