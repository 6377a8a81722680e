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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates {@code ${{ }}} expressions and conditions against an {@link ExpressionContext}.
 *
 * <p>Parsed expressions are cached; evaluation never mutates the context, so the same
 * expression against the same context always yields the same value.</p>
 */
public class ExpressionEvaluator {

    private static final String OPEN = "${{";
    private static final String CLOSE = "}}";

    private final Map<String, ExpressionNode> cache = new ConcurrentHashMap<>();

    /**
     * Evaluates a bare expression. A value wrapped entirely in {@code ${{ }}} is unwrapped
     * first.
     */
    public ExpressionValue evaluate(String expression, ExpressionContext context) throws ExpressionException {
        return parse(unwrap(expression)).evaluate(context);
    }

    /**
     * Evaluates an {@code if} condition.
     *
     * <ul>
     *   <li>A blank condition means {@code success()}.</li>
     *   <li>A condition that calls no status function is {@code success() && (condition)}.</li>
     *   <li>Text that mixes literal parts with {@code ${{ }}} spans is interpolated and is
     *       true when the result is non-empty.</li>
     * </ul>
     */
    public boolean evaluateCondition(String condition, ExpressionContext context) throws ExpressionException {
        if (condition == null || condition.isBlank()) {
            return !context.anyFailure() && !context.isCancelled();
        }

        String trimmed = condition.trim();
        if (containsExpression(trimmed) && !isWholeExpression(trimmed)) {
            boolean implicit = !context.anyFailure() && !context.isCancelled();
            return implicit && !interpolate(trimmed, context).isEmpty();
        }

        ExpressionNode node = parse(unwrap(trimmed));
        if (!node.usesStatusFunction() && (context.anyFailure() || context.isCancelled())) {
            return false;
        }
        return node.evaluate(context).isTruthy();
    }

    /**
     * Replaces every {@code ${{ expr }}} span with its string value. Text outside the
     * spans is kept literally.
     */
    public String interpolate(String text, ExpressionContext context) throws ExpressionException {
        if (text == null || !text.contains(OPEN)) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        int pos = 0;
        while (true) {
            int start = text.indexOf(OPEN, pos);
            if (start < 0) {
                sb.append(text, pos, text.length());
                return sb.toString();
            }
            int end = findClose(text, start + OPEN.length());
            sb.append(text, pos, start);
            sb.append(parse(text.substring(start + OPEN.length(), end).trim()).evaluate(context).asString());
            pos = end + CLOSE.length();
        }
    }

    /**
     * Whether the expression calls {@code success()}, {@code failure()}, {@code always()}
     * or {@code cancelled()}.
     */
    public boolean referencesStatusFunction(String expression) throws ExpressionException {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        String trimmed = expression.trim();
        if (containsExpression(trimmed) && !isWholeExpression(trimmed)) {
            int pos = 0;
            while (true) {
                int start = trimmed.indexOf(OPEN, pos);
                if (start < 0) {
                    return false;
                }
                int end = findClose(trimmed, start + OPEN.length());
                if (parse(trimmed.substring(start + OPEN.length(), end).trim()).usesStatusFunction()) {
                    return true;
                }
                pos = end + CLOSE.length();
            }
        }
        return parse(unwrap(trimmed)).usesStatusFunction();
    }

    public static boolean containsExpression(String text) {
        return text != null && text.contains(OPEN);
    }

    private ExpressionNode parse(String expression) throws ExpressionException {
        ExpressionNode node = cache.get(expression);
        if (node == null) {
            node = ExpressionParser.parse(expression);
            cache.put(expression, node);
        }
        return node;
    }

    private static String unwrap(String expression) throws ExpressionException {
        String trimmed = expression.trim();
        if (isWholeExpression(trimmed)) {
            return trimmed.substring(OPEN.length(), trimmed.length() - CLOSE.length()).trim();
        }
        if (trimmed.contains(OPEN)) {
            throw new ExpressionException("Expression mixes literal text with ${{ }} spans", expression);
        }
        return trimmed;
    }

    private static boolean isWholeExpression(String trimmed) throws ExpressionException {
        return trimmed.startsWith(OPEN) && findClose(trimmed, OPEN.length()) == trimmed.length() - CLOSE.length();
    }

    /**
     * Finds the {@code }}} closing a span, skipping over quoted string literals.
     */
    private static int findClose(String text, int from) throws ExpressionException {
        boolean quoted = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '}' && i + 1 < text.length() && text.charAt(i + 1) == '}') {
                return i;
            }
        }
        throw new ExpressionException("Unterminated ${{ expression", text);
    }
}
