/*******************************************************************************
 *     ___                  _   ____  ____
 *    / _ \ _   _  ___  ___| |_|  _ \| __ )
 *   | | | | | | |/ _ \/ __| __| | | |  _ \
 *   | |_| | |_| |  __/\__ \ |_| |_| | |_) |
 *    \__\_\\__,_|\___||___/\__|____/|____/
 *
 *  Copyright (c) 2014-2019 Appsicle
 *  Copyright (c) 2019-2026 QuestDB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 ******************************************************************************/

package io.hugenumber.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.hugenumber.std.HugeNumber;
import io.hugenumber.std.NumericException;
import io.hugenumber.std.fmt.HugeNumberFormat;
import io.hugenumber.std.fmt.HugeNumberFormatter;
import io.hugenumber.std.fmt.NumberStyles;
import io.hugenumber.std.str.StringSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Jackson binding for {@link HugeNumber}.
 * <p>
 * Numbers are written as JSON strings in their general text form, e.g. {@code "2.4e42"}, {@code "1/3"} or
 * {@code "NaN"}, because JSON numbers cannot hold the exponent range, the exact fractions or the special
 * values. Reading accepts such strings, plain JSON numbers and objects with {@code mantissa},
 * {@code exponent} and {@code denominator} fields. A zero denominator reads as NaN for a zero mantissa and as
 * the infinity of the mantissa's sign otherwise, which matches what the getters report for special values.
 * <p>
 * Unlike {@link HugeNumber#parse(CharSequence)}, which gives NaN for malformed text, a malformed non-empty
 * string fails with a {@link JsonMappingException}.
 * The empty string still reads as NaN.
 */
public final class HugeNumberJson {
    public static final HugeNumberModule MODULE = new HugeNumberModule();
    public static final ObjectMapper MAPPER = newMapper(false);
    public static final ObjectMapper MAPPER_INDENT = newMapper(true);
    private static final Logger LOG = LoggerFactory.getLogger(HugeNumberJson.class);

    private HugeNumberJson() {
    }

    public static ObjectMapper newMapper(boolean indent) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(MODULE);
        if (indent) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return mapper;
    }

    public static class HugeNumberModule extends SimpleModule {
        HugeNumberModule() {
            super("HugeNumberModule");
            addSerializer(HugeNumber.class, new HugeNumberSerializer());
            addDeserializer(HugeNumber.class, new HugeNumberDeserializer());
        }
    }

    static class HugeNumberSerializer extends JsonSerializer<HugeNumber> {
        private final ThreadLocal<StringSink> sinks = ThreadLocal.withInitial(StringSink::new);

        @Override
        public Class<HugeNumber> handledType() {
            return HugeNumber.class;
        }

        @Override
        public void serialize(HugeNumber value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            final StringSink sink = sinks.get();
            sink.clear();
            HugeNumberFormatter.format(sink, value, HugeNumberFormatter.GENERAL, HugeNumberFormat.INVARIANT);
            gen.writeString(sink.toString());
        }
    }

    static class HugeNumberDeserializer extends JsonDeserializer<HugeNumber> {

        @Override
        public HugeNumber deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
            final JsonToken token = p.currentToken();
            switch (token) {
                case VALUE_STRING:
                    return fromText(p, p.getText());
                case VALUE_NUMBER_INT:
                    if (p.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                        return HugeNumber.of(p.getBigIntegerValue());
                    }
                    return HugeNumber.of(p.getLongValue());
                case VALUE_NUMBER_FLOAT:
                    return HugeNumber.of(p.getDecimalValue());
                case START_OBJECT:
                    return fromFields(p, ctx);
                default:
                    throw JsonMappingException.from(p, "cannot read HugeNumber from " + token);
            }
        }

        @Override
        public Class<?> handledType() {
            return HugeNumber.class;
        }

        private static HugeNumber fromFields(JsonParser p, DeserializationContext ctx) throws IOException {
            long mantissa = 0;
            int exponent = 0;
            int denominator = 1;
            boolean hasMantissa = false;
            for (JsonToken token = p.nextToken(); token == JsonToken.FIELD_NAME; token = p.nextToken()) {
                final String name = p.currentName();
                p.nextToken();
                switch (name) {
                    case "mantissa":
                        mantissa = p.getLongValue();
                        hasMantissa = true;
                        break;
                    case "exponent":
                        exponent = p.getIntValue();
                        break;
                    case "denominator":
                        denominator = p.getIntValue();
                        break;
                    default:
                        ctx.handleUnknownProperty(p, null, HugeNumber.class, name);
                        p.skipChildren();
                        break;
                }
            }
            if (!hasMantissa) {
                throw JsonMappingException.from(p, "HugeNumber object has no mantissa");
            }
            if (denominator == 0) {
                // the triple reported by the getters for NaN and the infinities
                if (mantissa == 0) {
                    return HugeNumber.NaN;
                }
                return mantissa > 0 ? HugeNumber.POSITIVE_INFINITY : HugeNumber.NEGATIVE_INFINITY;
            }
            try {
                return denominator == 1 ? HugeNumber.of(mantissa, exponent) : HugeNumber.ofRational(mantissa, denominator, exponent);
            } catch (NumericException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }

        private static HugeNumber fromText(JsonParser p, String text) throws IOException {
            final HugeNumber value = HugeNumber.tryParse(text, NumberStyles.ANY, HugeNumberFormat.INVARIANT);
            if (value == null) {
                if (text.isEmpty()) {
                    LOG.debug("empty JSON string read as NaN");
                    return HugeNumber.NaN;
                }
                throw JsonMappingException.from(p, "not a HugeNumber: " + text);
            }
            return value;
        }
    }
}
