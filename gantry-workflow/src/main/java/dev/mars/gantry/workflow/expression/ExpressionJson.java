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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Jackson bridge for {@code fromJSON}, {@code toJSON} and the string form of arrays
 * and objects.
 */
final class ExpressionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ExpressionJson() {
    }

    static ExpressionValue parse(String json) throws ExpressionException {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new ExpressionException("fromJSON: empty input");
            }
            return toValue(node);
        } catch (JsonProcessingException e) {
            throw new ExpressionException("fromJSON: invalid JSON: " + e.getOriginalMessage(), null, e);
        }
    }

    static String render(ExpressionValue value) {
        try {
            return MAPPER.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Expression value could not be rendered as JSON", e);
        }
    }

    private static ExpressionValue toValue(JsonNode node) {
        if (node.isNull()) {
            return ExpressionValue.NULL;
        }
        if (node.isBoolean()) {
            return ExpressionValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return ExpressionValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return ExpressionValue.of(node.textValue());
        }
        if (node.isArray()) {
            List<ExpressionValue> items = new ArrayList<>();
            for (JsonNode item : node) {
                items.add(toValue(item));
            }
            return ExpressionValue.ofArray(items);
        }
        Map<String, ExpressionValue> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), toValue(field.getValue()));
        }
        return ExpressionValue.ofObject(entries);
    }

    private static JsonNode toNode(ExpressionValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return NODES.booleanNode(value.isTruthy());
            case NUMBER:
                double number = value.asNumber();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return NODES.numberNode((long) number);
                }
                return NODES.numberNode(number);
            case STRING:
                return NODES.textNode(value.asString());
            case ARRAY:
                ArrayNode array = NODES.arrayNode();
                for (ExpressionValue item : value.asList()) {
                    array.add(toNode(item));
                }
                return array;
            case OBJECT:
                ObjectNode object = NODES.objectNode();
                for (Map.Entry<String, ExpressionValue> entry : value.asMap().entrySet()) {
                    object.set(entry.getKey(), toNode(entry.getValue()));
                }
                return object;
            default:
                return NODES.nullNode();
        }
    }
}
