/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.gantry.workflow.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value produced by expression evaluation. A closed set of types with explicit coercion
 * rules; nothing is resolved by reflection.
 *
 * <p>Truthiness: {@code null}, {@code false}, {@code 0}, {@code NaN} and the empty string
 * are falsy, everything else is truthy. String conversion renders {@code null} as the
 * empty string and whole numbers without a fractional part.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ExpressionValue {

    public enum Type {
        NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT
    }

    public static final ExpressionValue NULL = new ExpressionValue(Type.NULL, false, 0, null, null, null);
    public static final ExpressionValue TRUE = new ExpressionValue(Type.BOOLEAN, true, 0, null, null, null);
    public static final ExpressionValue FALSE = new ExpressionValue(Type.BOOLEAN, false, 0, null, null, null);
    public static final ExpressionValue EMPTY_STRING = new ExpressionValue(Type.STRING, false, 0, "", null, null);

    private final Type type;
    private final boolean bool;
    private final double number;
    private final String string;
    private final List<ExpressionValue> array;
    private final Map<String, ExpressionValue> object;

    private ExpressionValue(Type type, boolean bool, double number, String string,
                            List<ExpressionValue> array, Map<String, ExpressionValue> object) {
        this.type = type;
        this.bool = bool;
        this.number = number;
        this.string = string;
        this.array = array;
        this.object = object;
    }

    public static ExpressionValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ExpressionValue of(double value) {
        return new ExpressionValue(Type.NUMBER, false, value, null, null, null);
    }

    public static ExpressionValue of(String value) {
        if (value == null) {
            return NULL;
        }
        return value.isEmpty() ? EMPTY_STRING : new ExpressionValue(Type.STRING, false, 0, value, null, null);
    }

    public static ExpressionValue ofArray(List<ExpressionValue> values) {
        return new ExpressionValue(Type.ARRAY, false, 0, null,
                Collections.unmodifiableList(new ArrayList<>(values)), null);
    }

    public static ExpressionValue ofObject(Map<String, ExpressionValue> values) {
        return new ExpressionValue(Type.OBJECT, false, 0, null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Converts plain Java data (scalars, lists and string-keyed maps, as produced by a YAML
     * loader) into a value.
     */
    public static ExpressionValue from(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof ExpressionValue) {
            return (ExpressionValue) value;
        }
        if (value instanceof Boolean) {
            return of((Boolean) value);
        }
        if (value instanceof Number) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof List) {
            List<ExpressionValue> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(from(item));
            }
            return ofArray(items);
        }
        if (value instanceof Map) {
            Map<String, ExpressionValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                entries.put(String.valueOf(entry.getKey()), from(entry.getValue()));
            }
            return ofObject(entries);
        }
        return of(value.toString());
    }

    public Type getType() {
        return type;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public boolean isTruthy() {
        switch (type) {
            case BOOLEAN:
                return bool;
            case NUMBER:
                return number != 0 && !Double.isNaN(number);
            case STRING:
                return !string.isEmpty();
            case ARRAY:
            case OBJECT:
                return true;
            default:
                return false;
        }
    }

    /**
     * Numeric coercion. Strings that are not numbers, arrays and objects yield {@code NaN}.
     */
    public double asNumber() {
        switch (type) {
            case NULL:
                return 0;
            case BOOLEAN:
                return bool ? 1 : 0;
            case NUMBER:
                return number;
            case STRING:
                String trimmed = string.trim();
                if (trimmed.isEmpty()) {
                    return 0;
                }
                Double parsed = parseNumber(trimmed);
                return parsed != null ? parsed : Double.NaN;
            default:
                return Double.NaN;
        }
    }

    public String asString() {
        switch (type) {
            case NULL:
                return "";
            case BOOLEAN:
                return bool ? "true" : "false";
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return string;
            default:
                return ExpressionJson.render(this);
        }
    }

    /**
     * Array elements; empty for any other type.
     */
    public List<ExpressionValue> asList() {
        return type == Type.ARRAY ? array : List.of();
    }

    /**
     * Object entries; empty for any other type.
     */
    public Map<String, ExpressionValue> asMap() {
        return type == Type.OBJECT ? object : Map.of();
    }

    /**
     * Property lookup. Object keys match exactly first, then case-insensitively; arrays
     * accept a numeric index. Anything else yields {@link #NULL}.
     */
    public ExpressionValue get(String key) {
        if (type == Type.OBJECT) {
            ExpressionValue value = object.get(key);
            if (value != null) {
                return value;
            }
            for (Map.Entry<String, ExpressionValue> entry : object.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(key)) {
                    return entry.getValue();
                }
            }
            return NULL;
        }
        if (type == Type.ARRAY) {
            Double index = parseNumber(key);
            if (index != null && index >= 0 && index == Math.floor(index) && index < array.size()) {
                return array.get(index.intValue());
            }
        }
        return NULL;
    }

    /**
     * Parses a decimal or {@code 0x} hexadecimal number, or returns {@code null}.
     */
    static Double parseNumber(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return (double) Long.parseLong(text.substring(2), 16);
            }
            if (text.startsWith("-0x") || text.startsWith("-0X")) {
                return (double) -Long.parseLong(text.substring(3), 16);
            }
            char last = text.charAt(text.length() - 1);
            // Double.parseDouble accepts type suffixes like 'd' and 'f'
            if (!Character.isDigit(last) && last != '.') {
                return null;
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpressionValue that = (ExpressionValue) o;
        return type == that.type &&
               bool == that.bool &&
               Double.compare(number, that.number) == 0 &&
               Objects.equals(string, that.string) &&
               Objects.equals(array, that.array) &&
               Objects.equals(object, that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bool, number, string, array, object);
    }

    @Override
    public String toString() {
        return type == Type.STRING ? "'" + string + "'" : type + "(" + asString() + ")";
    }
}
