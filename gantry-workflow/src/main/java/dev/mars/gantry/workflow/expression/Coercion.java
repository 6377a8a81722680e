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

import java.util.Locale;

/**
 * Equality and ordering between expression values.
 *
 * <ul>
 *   <li>Values of the same type compare naturally; strings ignore case.</li>
 *   <li>A number and a string compare numerically when the string is a number.</li>
 *   <li>Every other cross-type comparison is false.</li>
 * </ul>
 */
final class Coercion {

    private Coercion() {
    }

    static boolean looseEquals(ExpressionValue left, ExpressionValue right) {
        ExpressionValue.Type lt = left.getType();
        ExpressionValue.Type rt = right.getType();

        if (lt == rt) {
            switch (lt) {
                case NULL:
                    return true;
                case BOOLEAN:
                    return left.isTruthy() == right.isTruthy();
                case NUMBER:
                    return left.asNumber() == right.asNumber();
                case STRING:
                    return left.asString().equalsIgnoreCase(right.asString());
                default:
                    // arrays and objects compare by identity
                    return left == right;
            }
        }

        if (lt == ExpressionValue.Type.NUMBER && rt == ExpressionValue.Type.STRING) {
            Double parsed = strictNumber(right.asString());
            return parsed != null && parsed == left.asNumber();
        }
        if (lt == ExpressionValue.Type.STRING && rt == ExpressionValue.Type.NUMBER) {
            Double parsed = strictNumber(left.asString());
            return parsed != null && parsed == right.asNumber();
        }
        return false;
    }

    /**
     * Ordering of two values, or {@code null} when they are not comparable.
     */
    static Integer compare(ExpressionValue left, ExpressionValue right) {
        ExpressionValue.Type lt = left.getType();
        ExpressionValue.Type rt = right.getType();

        if (lt == ExpressionValue.Type.STRING && rt == ExpressionValue.Type.STRING) {
            return Integer.signum(left.asString().toLowerCase(Locale.ROOT)
                    .compareTo(right.asString().toLowerCase(Locale.ROOT)));
        }

        Double l = numericOperand(left);
        Double r = numericOperand(right);
        if (l == null || r == null || l.isNaN() || r.isNaN()) {
            return null;
        }
        return Double.compare(l, r);
    }

    private static Double numericOperand(ExpressionValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.asNumber();
            case STRING:
                return strictNumber(value.asString());
            default:
                return null;
        }
    }

    private static Double strictNumber(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : ExpressionValue.parseNumber(trimmed);
    }
}
