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
package ch.randelshofer.vavr.ordered;

import io.vavr.CheckedFunction1;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Seq;
import io.vavr.collection.Vector;
import io.vavr.control.Option;
import io.vavr.control.Try;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * Implements a mutable map that remembers the order in which its keys were
 * first inserted.
 * <p>
 * Features:
 * <ul>
 *     <li>iterates in the order, in which keys were inserted</li>
 *     <li>updating the value of an existing key does not change its position</li>
 *     <li>removing a key and adding it again places it last</li>
 *     <li>does not allow null keys or null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>get, containsKey: O(1)</li>
 *     <li>put: O(1) in an amortized sense</li>
 *     <li>remove: O(N), because the key has to be located in the key sequence</li>
 *     <li>entryAt: O(1)</li>
 *     <li>copy: O(N)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * This map stores its entries twice: the keys in insertion order in an
 * {@link ArrayList}, and the key-value associations in a {@link HashMap}.
 * Both are owned exclusively by the map and are only ever changed together,
 * so that the key sequence is always a duplicate-free permutation of the key
 * set of the hash map.
 * <p>
 * Equality does not take the insertion order into account. Two maps are equal
 * if they contain the same key-value associations.
 * <p>
 * Iterators are fail-fast. If a key is inserted or removed while an iterator
 * is in use, the iterator throws a {@link ConcurrentModificationException}.
 * Replacing the value of an existing key is not a structural modification.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class OrderedMap<K, V> implements Iterable<Tuple2<K, V>>, Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * The keys in the order in which they were inserted.
     */
    private final ArrayList<K> orderedKeys;
    /**
     * The key-value associations.
     */
    private final HashMap<K, V> lookup;
    /**
     * Number of structural modifications, used by the fail-fast iterators.
     */
    private transient int modCount;

    private OrderedMap(ArrayList<K> orderedKeys, HashMap<K, V> lookup) {
        this.orderedKeys = orderedKeys;
        this.lookup = lookup;
    }

    /**
     * Returns a new empty {@code OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A new empty map.
     */
    public static <K, V> OrderedMap<K, V> empty() {
        return new OrderedMap<>(new ArrayList<>(), new HashMap<>());
    }

    /**
     * Returns a singleton {@code OrderedMap}, i.e. a {@code OrderedMap} of one element.
     *
     * @param key   A singleton map key.
     * @param value A singleton map value.
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new Map containing the given entry
     */
    public static <K, V> OrderedMap<K, V> of(K key, V value) {
        final OrderedMap<K, V> map = empty();
        map.put(key, value);
        return map;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2) {
        final OrderedMap<K, V> map = of(k1, v1);
        map.put(k2, v2);
        return map;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        final OrderedMap<K, V> map = of(k1, v1, k2, v2);
        map.put(k3, v3);
        return map;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param k4  a key for the map
     * @param v4  the value for k4
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3, K k4, V v4) {
        final OrderedMap<K, V> map = of(k1, v1, k2, v2, k3, v3);
        map.put(k4, v4);
        return map;
    }

    /**
     * Creates an OrderedMap of the given entries.
     * <p>
     * If a key occurs more than once, it keeps the position of its first
     * occurrence and the value of its last occurrence.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ofEntries(java.util.Arrays.asList(entries));
    }

    /**
     * Creates an OrderedMap of the given entries.
     * <p>
     * If a key occurs more than once, it keeps the position of its first
     * occurrence and the value of its last occurrence.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedMap<K, V> map = empty();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            map.put(entry._1, entry._2);
        }
        return map;
    }

    /**
     * Creates an OrderedMap of the given entries, combining the values of
     * duplicate keys with the given function.
     * <p>
     * For each entry whose key is already present, the stored value is
     * replaced by {@code combine.apply(storedValue, newValue)}. Keys are
     * ordered by their first occurrence.
     *
     * @param entries Map entries
     * @param combine The function that combines the stored and the new value of a duplicate key
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries,
                                                    BiFunction<? super V, ? super V, ? extends V> combine) {
        Objects.requireNonNull(entries, "entries is null");
        Objects.requireNonNull(combine, "combine is null");
        final OrderedMap<K, V> map = empty();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            final V existing = map.lookup.get(entry._1);
            map.put(entry._1, existing == null ? entry._2 : combine.apply(existing, entry._2));
        }
        return map;
    }

    /**
     * Returns an OrderedMap containing the entries of the given {@link java.util.Map},
     * in the iteration order of that map.
     *
     * @param map A map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given map
     */
    public static <K, V> OrderedMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        final OrderedMap<K, V> result = empty();
        for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Groups the given values by the key computed for each of them.
     * <p>
     * Keys are ordered by the first value that produced them. Each group
     * contains its values in the order in which they were consumed.
     *
     * @param values      The values to group
     * @param keyForValue Computes the key of a value
     * @param <T>         The value type
     * @param <K>         The key type
     * @return A new Map from key to the values that have that key
     */
    public static <T, K> OrderedMap<K, Seq<T>> groupingBy(Iterable<? extends T> values,
                                                          Function<? super T, ? extends K> keyForValue) {
        Objects.requireNonNull(values, "values is null");
        Objects.requireNonNull(keyForValue, "keyForValue is null");
        final OrderedMap<K, Seq<T>> map = empty();
        for (T value : values) {
            map.update(keyForValue.apply(value), Vector::empty, group -> group.append(value));
        }
        return map;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedMap} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedMap<K, V>> collector() {
        return Collector.of(ArrayList::new, ArrayList::add,
                (left, right) -> {
                    left.addAll(right);
                    return left;
                },
                entries -> ofEntries(entries));
    }

    /**
     * Returns the value associated with the given key.
     *
     * @param key a key
     * @return {@code Some(value)} if the key is present, {@code None} otherwise
     */
    public Option<V> get(K key) {
        return Option.of(lookup.get(key));
    }

    /**
     * Returns the value associated with the given key, or the value supplied
     * by {@code defaultValue} if the key is absent. Does not modify the map.
     *
     * @param key          a key
     * @param defaultValue supplies the value for an absent key; only called if needed
     * @return the value or the default value
     */
    public V getOrElse(K key, Supplier<? extends V> defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue is null");
        final V value = lookup.get(key);
        return value != null ? value : defaultValue.get();
    }

    /**
     * Associates the given value with the given key.
     * <p>
     * If the key is already present, only its value is replaced; the key keeps
     * its position. Otherwise, the key is appended to the end.
     *
     * @param key   a key
     * @param value a value
     * @return the previous value, or {@code None} if the key was absent
     */
    public Option<V> put(K key, V value) {
        Objects.requireNonNull(key, "key is null");
        Objects.requireNonNull(value, "value is null");
        final V old = lookup.put(key, value);
        if (old == null) {
            orderedKeys.add(key);
            modCount++;
        }
        return Option.of(old);
    }

    /**
     * Computes a new value for the given key from its current value, or from
     * the supplied default value if the key is absent, and stores it with the
     * same rules as {@link #put}.
     *
     * @param key          a key
     * @param defaultValue supplies the current value for an absent key
     * @param updater      computes the new value from the current value
     * @return the new value
     */
    public V update(K key, Supplier<? extends V> defaultValue, Function<? super V, ? extends V> updater) {
        Objects.requireNonNull(updater, "updater is null");
        final V value = updater.apply(getOrElse(key, defaultValue));
        put(key, value);
        return value;
    }

    /**
     * Removes the given key.
     *
     * @param key a key
     * @return the removed value, or {@code None} if the key was absent
     */
    public Option<V> remove(K key) {
        final V old = lookup.remove(key);
        if (old != null) {
            orderedKeys.remove(key);
            modCount++;
        }
        return Option.of(old);
    }

    /**
     * Returns whether this map contains the given key.
     *
     * @param key a key
     * @return true if the key is present
     */
    public boolean containsKey(K key) {
        return lookup.containsKey(key);
    }

    /**
     * Returns whether this map contains a key that satisfies the given predicate.
     *
     * @param predicate a predicate
     * @return true if at least one key satisfies the predicate
     */
    public boolean containsKeyWhere(Predicate<? super K> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        for (K key : orderedKeys) {
            if (predicate.test(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the entry at the given position in insertion order.
     *
     * @param index a position
     * @return the key-value pair at that position
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= size()}
     */
    public Tuple2<K, V> entryAt(int index) {
        Objects.checkIndex(index, orderedKeys.size());
        final K key = orderedKeys.get(index);
        return Tuple.of(key, lookup.get(key));
    }

    /**
     * Returns the keys in insertion order.
     *
     * @return the keys
     */
    public Seq<K> keys() {
        return iterator().map(Tuple2::_1).toVector();
    }

    /**
     * Returns the values in the insertion order of their keys.
     *
     * @return the values
     */
    public Seq<V> values() {
        return iterator().map(Tuple2::_2).toVector();
    }

    /**
     * Returns a new map with the same keys in the same order, and with each
     * value transformed by the given function.
     * <p>
     * If the function throws, the exception propagates and no map is returned.
     *
     * @param transform the value transformation
     * @param <W>       the new value type
     * @return a new map
     */
    public <W> OrderedMap<K, W> mapValues(Function<? super V, ? extends W> transform) {
        Objects.requireNonNull(transform, "transform is null");
        final OrderedMap<K, W> result = new OrderedMap<>(new ArrayList<>(orderedKeys.size()), new HashMap<>(lookup.size()));
        for (K key : orderedKeys) {
            result.put(key, transform.apply(lookup.get(key)));
        }
        return result;
    }

    /**
     * Returns a new map with each value transformed by the given function,
     * dropping the entries for which the function returns {@code None}.
     * The surviving entries keep their relative order.
     *
     * @param transform the value transformation
     * @param <W>       the new value type
     * @return a new map
     */
    public <W> OrderedMap<K, W> compactMapValues(Function<? super V, ? extends Option<? extends W>> transform) {
        Objects.requireNonNull(transform, "transform is null");
        final OrderedMap<K, W> result = empty();
        for (K key : orderedKeys) {
            final Option<? extends W> value = transform.apply(lookup.get(key));
            if (value.isDefined()) {
                result.put(key, value.get());
            }
        }
        return result;
    }

    /**
     * Like {@link #mapValues}, but for a transformation that may throw a
     * checked exception.
     *
     * @param transform the value transformation
     * @param <W>       the new value type
     * @return a {@code Success} with the new map, or a {@code Failure} with
     * the first exception thrown by {@code transform}
     */
    public <W> Try<OrderedMap<K, W>> tryMapValues(CheckedFunction1<? super V, ? extends W> transform) {
        Objects.requireNonNull(transform, "transform is null");
        return Try.of(() -> {
            final OrderedMap<K, W> result = empty();
            for (K key : orderedKeys) {
                result.put(key, transform.apply(lookup.get(key)));
            }
            return result;
        });
    }

    /**
     * Performs the given action for each entry in insertion order.
     *
     * @param action an action
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        for (Tuple2<K, V> entry : this) {
            action.accept(entry._1, entry._2);
        }
    }

    /**
     * Returns an independent copy of this map. Changes to the copy do not
     * affect this map and vice versa.
     *
     * @return a copy
     */
    public OrderedMap<K, V> copy() {
        return new OrderedMap<>(new ArrayList<>(orderedKeys), new HashMap<>(lookup));
    }

    public int size() {
        return orderedKeys.size();
    }

    public boolean isEmpty() {
        return orderedKeys.isEmpty();
    }

    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return Iterator.ofAll(new EntryIterator());
    }

    public java.util.LinkedHashMap<K, V> toJavaMap() {
        final java.util.LinkedHashMap<K, V> map = new java.util.LinkedHashMap<>(Math.max(16, orderedKeys.size() * 2));
        for (K key : orderedKeys) {
            map.put(key, lookup.get(key));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedMap)) {
            return false;
        }
        return lookup.equals(((OrderedMap<?, ?>) o).lookup);
    }

    @Override
    public int hashCode() {
        return lookup.hashCode();
    }

    @Override
    public String toString() {
        return iterator().mkString("OrderedMap(", ", ", ")");
    }

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream s) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    private final class EntryIterator implements java.util.Iterator<Tuple2<K, V>> {
        private final int expectedModCount = modCount;
        private int index;

        @Override
        public boolean hasNext() {
            return index < orderedKeys.size();
        }

        @Override
        public Tuple2<K, V> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final K key = orderedKeys.get(index++);
            return Tuple.of(key, lookup.get(key));
        }
    }

    /**
     * A serialization proxy which, in this context, is used to deserialize
     * the map from its entries in insertion order.
     *
     * @param <K> The key type
     * @param <V> The value type
     */
    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient OrderedMap<K, V> map;

        /**
         * Constructor for the case of serialization, called by {@link OrderedMap#writeReplace()}.
         *
         * @param map a map
         */
        SerializationProxy(OrderedMap<K, V> map) {
            this.map = map;
        }

        /**
         * Read an object from a deserialization stream.
         *
         * @param s An object deserialization stream.
         * @throws ClassNotFoundException If the object's class read from the stream cannot be found.
         * @throws InvalidObjectException If the stream contains a negative size.
         * @throws IOException            If an error occurs reading from the stream.
         */
        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            final OrderedMap<K, V> m = empty();
            for (int i = 0; i < size; i++) {
                final K key = (K) s.readObject();
                final V value = (V) s.readObject();
                m.put(key, value);
            }
            map = m;
        }

        /**
         * {@code readResolve} method for the serialization proxy pattern.
         *
         * @return A deserialized instance of the enclosing class.
         */
        private Object readResolve() {
            return map;
        }

        /**
         * Write an object to a serialization stream.
         *
         * @param s An object serialization stream.
         * @throws IOException If an error occurs writing to the stream.
         */
        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(map.size());
            for (Tuple2<K, V> e : map) {
                s.writeObject(e._1);
                s.writeObject(e._2);
            }
        }
    }
}
