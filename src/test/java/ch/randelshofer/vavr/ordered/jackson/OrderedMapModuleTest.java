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
import ch.randelshofer.vavr.ordered.format.StringRawValue;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OrderedMapModuleTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedMapModule());

    enum Signal implements StringRawValue {
        GO("green"), STOP("red");

        private final String rawValue;

        Signal(String rawValue) {
            this.rawValue = rawValue;
        }

        @Override
        public String rawValue() {
            return rawValue;
        }
    }

    @JsonPropertyOrder({"counts", "signals", "places"})
    public static class Plan {
        public OrderedMap<String, Integer> counts;
        public OrderedMap<Signal, String> signals;
        public OrderedMap<Coordinate, String> places;
    }

    public static class Ids {
        public OrderedMap<Integer, String> ids;
    }

    @JsonPropertyOrder({"bySignal", "byPlace"})
    public static class Nested {
        public OrderedMap<String, OrderedMap<Signal, String>> bySignal;
        public OrderedMap<String, OrderedMap<Coordinate, String>> byPlace;
    }

    // -- writing

    @Test
    public void shouldWriteStringKeysAsObjectInInsertionOrder() throws IOException {
        assertThat(mapper.writeValueAsString(OrderedMap.of("b", 1, "a", 2, "c", 3))).isEqualTo("{\"b\":1,\"a\":2,\"c\":3}");
    }

    @Test
    public void shouldWriteIntegerKeysAsObject() throws IOException {
        final String json = mapper.writerFor(new TypeReference<OrderedMap<Integer, String>>() {
        }).writeValueAsString(OrderedMap.of(10, "ten", 2, "two"));
        assertThat(json).isEqualTo("{\"10\":\"ten\",\"2\":\"two\"}");
    }

    @Test
    public void shouldWritePropertiesByTheirDeclaredKeyType() throws IOException {
        final Plan plan = new Plan();
        plan.counts = OrderedMap.of("b", 2, "a", 1);
        plan.signals = OrderedMap.of(Signal.STOP, "halt", Signal.GO, "drive");
        plan.places = OrderedMap.of(new Coordinate(1, 2), "home", new Coordinate(0, 0), "origin");
        assertThat(mapper.writeValueAsString(plan)).isEqualTo("{"
                + "\"counts\":{\"b\":2,\"a\":1},"
                + "\"signals\":{\"red\":\"halt\",\"green\":\"drive\"},"
                + "\"places\":[{\"x\":1,\"y\":2},\"home\",{\"x\":0,\"y\":0},\"origin\"]"
                + "}");
    }

    @Test
    public void shouldWriteEmptyMapWithOpaqueKeysAsArray() throws IOException {
        final Plan plan = new Plan();
        plan.counts = OrderedMap.empty();
        plan.signals = OrderedMap.empty();
        plan.places = OrderedMap.empty();
        assertThat(mapper.writeValueAsString(plan)).isEqualTo("{\"counts\":{},\"signals\":{},\"places\":[]}");
    }

    // -- reading

    @Test
    public void shouldReadObjectInDocumentOrder() throws IOException {
        final OrderedMap<String, Integer> map = mapper.readValue("{\"z\":1,\"a\":2,\"m\":3}",
                new TypeReference<OrderedMap<String, Integer>>() {
                });
        assertThat(map.keys()).containsExactly("z", "a", "m");
        assertThat(map.values()).containsExactly(1, 2, 3);
    }

    @Test
    public void shouldRoundTripProperties() throws IOException {
        final Plan plan = new Plan();
        plan.counts = OrderedMap.of("b", 2, "a", 1);
        plan.signals = OrderedMap.of(Signal.STOP, "halt", Signal.GO, "drive");
        plan.places = OrderedMap.of(new Coordinate(1, 2), "home", new Coordinate(0, 0), "origin");

        final Plan read = mapper.readValue(mapper.writeValueAsString(plan), Plan.class);
        assertThat(read.counts.keys()).containsExactly("b", "a");
        assertThat(read.signals.keys()).containsExactly(Signal.STOP, Signal.GO);
        assertThat(read.places.keys()).containsExactly(new Coordinate(1, 2), new Coordinate(0, 0));
        assertThat(read.places).isEqualTo(plan.places);
    }

    @Test
    public void shouldReadNestedMaps() throws IOException {
        final OrderedMap<String, OrderedMap<Integer, String>> map = mapper.readValue("{\"x\":{\"2\":\"two\",\"1\":\"one\"}}",
                new TypeReference<OrderedMap<String, OrderedMap<Integer, String>>>() {
                });
        assertThat(map.get("x").get().keys()).containsExactly(2, 1);
    }

    @Test
    public void shouldWriteNestedMapsByTheirDeclaredKeyType() throws IOException {
        final Nested nested = new Nested();
        nested.bySignal = OrderedMap.of("x", OrderedMap.of(Signal.STOP, "halt"), "y", OrderedMap.empty());
        nested.byPlace = OrderedMap.of("a", OrderedMap.of(new Coordinate(1, 2), "home"), "b", OrderedMap.empty());
        assertThat(mapper.writeValueAsString(nested)).isEqualTo("{"
                + "\"bySignal\":{\"x\":{\"red\":\"halt\"},\"y\":{}},"
                + "\"byPlace\":{\"a\":[{\"x\":1,\"y\":2},\"home\"],\"b\":[]}"
                + "}");
    }

    @Test
    public void shouldRoundTripNestedMaps() throws IOException {
        final Nested nested = new Nested();
        nested.bySignal = OrderedMap.of("x", OrderedMap.of(Signal.STOP, "halt", Signal.GO, "drive"), "y", OrderedMap.empty());
        nested.byPlace = OrderedMap.of("a", OrderedMap.of(new Coordinate(1, 2), "home"), "b", OrderedMap.empty());

        final Nested read = mapper.readValue(mapper.writeValueAsString(nested), Nested.class);
        assertThat(read.bySignal.keys()).containsExactly("x", "y");
        assertThat(read.bySignal.get("x").get().keys()).containsExactly(Signal.STOP, Signal.GO);
        assertThat(read.bySignal.get("y").get().isEmpty()).isTrue();
        assertThat(read.byPlace).isEqualTo(nested.byPlace);
    }

    @Test
    public void shouldRoundTripNestedMapsOfRootValue() throws IOException {
        final TypeReference<OrderedMap<String, OrderedMap<Signal, String>>> type =
                new TypeReference<OrderedMap<String, OrderedMap<Signal, String>>>() {
                };
        final OrderedMap<String, OrderedMap<Signal, String>> map = OrderedMap.of("x", OrderedMap.of(Signal.GO, "drive"));
        final String json = mapper.writerFor(type).writeValueAsString(map);
        assertThat(json).isEqualTo("{\"x\":{\"green\":\"drive\"}}");
        assertThat(mapper.readValue(json, type)).isEqualTo(map);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldRoundTripRootValueOfUnknownKeyType() throws IOException {
        final String json = mapper.writeValueAsString(OrderedMap.of("b", 1, "a", 2));
        assertThat(json).isEqualTo("{\"b\":1,\"a\":2}");
        final OrderedMap<Object, Object> read = mapper.readValue(json, OrderedMap.class);
        assertThat(read.keys()).containsExactly("b", "a");
        assertThat(read.values()).containsExactly(1, 2);
    }

    @Test
    public void shouldFailOnFieldNameThatIsNotAKey() {
        assertThatThrownBy(() -> mapper.readValue("{\"1\":\"a\",\"x\":\"b\"}", new TypeReference<OrderedMap<Integer, String>>() {
        })).isInstanceOfSatisfying(InvalidFormatException.class, e -> {
            assertThat(e.getValue()).isEqualTo("x");
            assertThat(e.getTargetType()).isEqualTo(Integer.class);
            assertThat(e.getOriginalMessage()).contains("'x'");
        });
    }

    @Test
    public void shouldReportPathOfFieldNameThatIsNotAKey() {
        assertThatThrownBy(() -> mapper.readValue("{\"ids\":{\"7\":\"seven\",\"seven\":\"7\"}}", Ids.class))
                .isInstanceOfSatisfying(InvalidFormatException.class, e -> {
                    assertThat(e.getValue()).isEqualTo("seven");
                    assertThat(e.getPath().get(0).getFieldName()).isEqualTo("ids");
                    assertThat(e.getOriginalMessage()).contains("/ids/seven");
                });
    }

    @Test
    public void shouldFailOnUnknownRawValue() {
        assertThatThrownBy(() -> mapper.readValue("{\"green\":\"go\",\"GO\":\"go\"}", new TypeReference<OrderedMap<Signal, String>>() {
        })).isInstanceOfSatisfying(InvalidFormatException.class, e -> assertThat(e.getValue()).isEqualTo("GO"));
    }

    @Test
    public void shouldFailOnWrongContainer() {
        assertThatThrownBy(() -> mapper.readValue("[\"a\",1]", new TypeReference<OrderedMap<String, Integer>>() {
        })).isInstanceOf(MismatchedInputException.class);
        assertThatThrownBy(() -> mapper.readValue("{\"a\":1}", new TypeReference<OrderedMap<Coordinate, Integer>>() {
        })).isInstanceOf(MismatchedInputException.class);
    }

    @Test
    public void shouldFailOnUnpairedKey() {
        assertThatThrownBy(() -> mapper.readValue("[{\"x\":1,\"y\":1},\"a\",{\"x\":2,\"y\":2}]",
                new TypeReference<OrderedMap<Coordinate, String>>() {
                }))
                .isInstanceOf(MismatchedInputException.class)
                .hasMessageContaining("alternate");
    }

    @Test
    public void shouldFailOnNullValue() {
        assertThatThrownBy(() -> mapper.readValue("{\"a\":null}", new TypeReference<OrderedMap<String, Integer>>() {
        })).isInstanceOf(MismatchedInputException.class);
    }

    @Test
    public void shouldKeepFirstPositionOfRepeatedKeyInArray() throws IOException {
        final OrderedMap<Coordinate, String> map = mapper.readValue(
                "[{\"x\":1,\"y\":1},\"a\",{\"x\":2,\"y\":2},\"b\",{\"x\":1,\"y\":1},\"c\"]",
                new TypeReference<OrderedMap<Coordinate, String>>() {
                });
        assertThat(map.keys()).containsExactly(new Coordinate(1, 1), new Coordinate(2, 2));
        assertThat(map.get(new Coordinate(1, 1))).isEqualTo(Option.some("c"));
    }

    // -- yaml

    @Test
    public void shouldWriteAndReadYamlInInsertionOrder() throws IOException {
        final ObjectMapper yaml = new YAMLMapper().registerModule(new OrderedMapModule());
        final String text = yaml.writeValueAsString(OrderedMap.of("zeta", 1, "alpha", 2));
        assertThat(text.indexOf("zeta")).isLessThan(text.indexOf("alpha"));

        final OrderedMap<String, Integer> read = yaml.readValue("b: 1\na: 2\nc: 3\n", new TypeReference<OrderedMap<String, Integer>>() {
        });
        assertThat(read.keys()).containsExactly("b", "a", "c");
    }
}
