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
import java.util.List;
import java.util.Locale;

/**
 * The fixed set of functions available to expressions. Names are case-insensitive and
 * arity is checked when the expression is parsed.
 */
final class BuiltinFunctions {

    enum Function {
        SUCCESS("success", 0, 0, true),
        FAILURE("failure", 0, 0, true),
        ALWAYS("always", 0, 0, true),
        CANCELLED("cancelled", 0, 0, true),
        CONTAINS("contains", 2, 2, false),
        STARTS_WITH("startswith", 2, 2, false),
        ENDS_WITH("endswith", 2, 2, false),
        JOIN("join", 1, 2, false),
        FORMAT("format", 1, Integer.MAX_VALUE, false),
        FROM_JSON("fromjson", 1, 1, false),
        TO_JSON("tojson", 1, 1, false);

        private final String name;
        private final int minArgs;
        private final int maxArgs;
        private final boolean statusFunction;

        Function(String name, int minArgs, int maxArgs, boolean statusFunction) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.statusFunction = statusFunction;
        }

        boolean isStatusFunction() {
            return statusFunction;
        }

        boolean acceptsArity(int count) {
            return count >= minArgs && count <= maxArgs;
        }

        static Function lookup(String name) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (Function function : values()) {
                if (function.name.equals(lower)) {
                    return function;
                }
            }
            return null;
        }
    }

    private BuiltinFunctions() {
    }

    static ExpressionValue call(Function function, List<ExpressionValue> args, ExpressionContext context)
            throws ExpressionException {
        switch (function) {
            case SUCCESS:
                return ExpressionValue.of(!context.anyFailure() && !context.isCancelled());
            case FAILURE:
                return ExpressionValue.of(context.anyFailure());
            case ALWAYS:
                return ExpressionValue.TRUE;
            case CANCELLED:
                return ExpressionValue.of(context.isCancelled());
            case CONTAINS:
                return ExpressionValue.of(contains(args.get(0), args.get(1)));
            case STARTS_WITH:
                return ExpressionValue.of(lower(args.get(0)).startsWith(lower(args.get(1))));
            case ENDS_WITH:
                return ExpressionValue.of(lower(args.get(0)).endsWith(lower(args.get(1))));
            case JOIN:
                return ExpressionValue.of(join(args.get(0), args.size() > 1 ? args.get(1).asString() : ","));
            case FORMAT:
                return ExpressionValue.of(format(args.get(0).asString(), args.subList(1, args.size())));
            case FROM_JSON:
                return ExpressionJson.parse(args.get(0).asString());
            case TO_JSON:
                return ExpressionValue.of(ExpressionJson.render(args.get(0)));
            default:
                throw new ExpressionException("Unsupported function: " + function.name);
        }
    }

    private static boolean contains(ExpressionValue search, ExpressionValue item) {
        if (search.getType() == ExpressionValue.Type.ARRAY) {
            for (ExpressionValue element : search.asList()) {
                if (Coercion.looseEquals(element, item)) {
                    return true;
                }
            }
            return false;
        }
        return lower(search).contains(lower(item));
    }

    private static String join(ExpressionValue value, String separator) {
        if (value.getType() != ExpressionValue.Type.ARRAY) {
            return value.asString();
        }
        List<String> parts = new ArrayList<>();
        for (ExpressionValue element : value.asList()) {
            parts.add(element.asString());
        }
        return String.join(separator, parts);
    }

    /**
     * Replaces {@code {0}}, {@code {1}}, ... with the arguments. {@code {{} and {@code }}}
     * produce literal braces.
     */
    static String format(String template, List<ExpressionValue> args) throws ExpressionException {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    sb.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i);
                if (close < 0) {
                    throw new ExpressionException("Unclosed placeholder in format string: " + template);
                }
                String index = template.substring(i + 1, close);
                int n;
                try {
                    n = Integer.parseInt(index);
                } catch (NumberFormatException e) {
                    throw new ExpressionException("Invalid placeholder '{" + index + "}' in format string", template, e);
                }
                if (n < 0 || n >= args.size()) {
                    throw new ExpressionException("Placeholder {" + n + "} has no argument", template);
                }
                sb.append(args.get(n).asString());
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    sb.append('}');
                    i += 2;
                    continue;
                }
                throw new ExpressionException("Unmatched '}' in format string", template);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static String lower(ExpressionValue value) {
        return value.asString().toLowerCase(Locale.ROOT);
    }
}
