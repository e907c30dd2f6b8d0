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
import io.vavr.control.Try;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts keys of a type to strings and back without loss of information.
 * <p>
 * For every key {@code k}, {@code parse(render(k))} must be {@code Some(k')}
 * with {@code k'.equals(k)}.
 *
 * @param <T> the key type
 */
public interface KeyConverter<T> {

    String render(T key);

    /**
     * Parses a string back into a key.
     *
     * @param text a string
     * @return the key, or {@code None} if the string does not represent a key of this type
     */
    Option<T> parse(String text);

    /**
     * Creates a converter from a rendering function and a parsing function
     * that signals malformed input by throwing.
     * <p>
     * Only the text that {@code render} produces is accepted. Text that
     * {@code parse} accepts but that renders differently, e.g. a UUID without
     * leading zeros or an integer with a plus sign, is rejected, so that two
     * distinct field names never become the same key.
     *
     * @param render renders a key
     * @param parse  parses a key, throws if the text is malformed
     * @param <T>    the key type
     * @return a converter
     */
    static <T> KeyConverter<T> of(Function<? super T, String> render, Function<String, ? extends T> parse) {
        Objects.requireNonNull(render, "render is null");
        Objects.requireNonNull(parse, "parse is null");
        return new KeyConverter<T>() {
            @Override
            public String render(T key) {
                return render.apply(key);
            }

            @Override
            public Option<T> parse(String text) {
                return Try.<T>of(() -> parse.apply(text))
                        .filter(key -> text.equals(render.apply(key)))
                        .toOption();
            }
        };
    }
}
