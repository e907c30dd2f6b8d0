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
import ch.randelshofer.vavr.ordered.format.OrderedMapFormat;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;

import java.util.Objects;

/**
 * Jackson module that reads and writes {@link OrderedMap}s with an
 * {@link OrderedMapFormat}.
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedMapModule());
 * }</pre>
 * The module works with any Jackson data format, e.g. JSON or YAML.
 */
public class OrderedMapModule extends Module {
    private final OrderedMapFormat format;

    public OrderedMapModule() {
        this(OrderedMapFormat.standard());
    }

    public OrderedMapModule(OrderedMapFormat format) {
        this.format = Objects.requireNonNull(format, "format is null");
    }

    @Override
    public String getModuleName() {
        return "OrderedMapModule";
    }

    @Override
    public Version version() {
        return Version.unknownVersion();
    }

    @Override
    public void setupModule(SetupContext context) {
        context.addSerializers(new OrderedMapSerializers());
        context.addDeserializers(new OrderedMapDeserializers());
    }

    private final class OrderedMapSerializers extends Serializers.Base {
        @Override
        public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
            if (OrderedMap.class.isAssignableFrom(type.getRawClass())) {
                return new OrderedMapSerializer(format, type.containedTypeOrUnknown(0), type.containedTypeOrUnknown(1));
            }
            return null;
        }
    }

    private final class OrderedMapDeserializers extends Deserializers.Base {
        @Override
        public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
            if (OrderedMap.class.isAssignableFrom(type.getRawClass())) {
                return new OrderedMapDeserializer(format, type.containedTypeOrUnknown(0), type.containedTypeOrUnknown(1));
            }
            return null;
        }
    }
}
