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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parsed expression tree. Nodes are immutable, so a parsed expression can be cached and
 * evaluated concurrently against different contexts.
 */
abstract class ExpressionNode {

    abstract ExpressionValue evaluate(ExpressionContext context) throws ExpressionException;

    /**
     * Whether the tree calls one of the status functions, which disables the implicit
     * {@code success() &&} of conditions.
     */
    abstract boolean usesStatusFunction();

    static final class Literal extends ExpressionNode {
        private final ExpressionValue value;

        Literal(ExpressionValue value) {
            this.value = value;
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) {
            return value;
        }

        @Override
        boolean usesStatusFunction() {
            return false;
        }
    }

    /**
     * A bare name: the root of a context reference such as {@code env} or {@code steps}.
     */
    static final class Identifier extends ExpressionNode {
        private final String name;

        Identifier(String name) {
            this.name = name;
        }

        String getName() {
            return name;
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) throws ExpressionException {
            return context.resolve(List.of(name));
        }

        @Override
        boolean usesStatusFunction() {
            return false;
        }
    }

    /**
     * {@code target.name} or {@code target[key]}.
     */
    static final class PropertyAccess extends ExpressionNode {
        private final ExpressionNode target;
        private final String name;
        private final ExpressionNode key;

        PropertyAccess(ExpressionNode target, String name, ExpressionNode key) {
            this.target = target;
            this.name = name;
            this.key = key;
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) throws ExpressionException {
            Deque<String> keys = new ArrayDeque<>();
            ExpressionNode node = this;
            while (node instanceof PropertyAccess) {
                PropertyAccess access = (PropertyAccess) node;
                keys.addFirst(access.keyText(context));
                node = access.target;
            }

            if (node instanceof Identifier) {
                List<String> path = new ArrayList<>();
                path.add(((Identifier) node).getName());
                path.addAll(keys);
                return context.resolve(path);
            }

            ExpressionValue value = node.evaluate(context);
            for (String k : keys) {
                value = value.get(k);
            }
            return value;
        }

        private String keyText(ExpressionContext context) throws ExpressionException {
            return name != null ? name : key.evaluate(context).asString();
        }

        @Override
        boolean usesStatusFunction() {
            return target.usesStatusFunction() || (key != null && key.usesStatusFunction());
        }
    }

    static final class FunctionCall extends ExpressionNode {
        private final BuiltinFunctions.Function function;
        private final List<ExpressionNode> arguments;

        FunctionCall(BuiltinFunctions.Function function, List<ExpressionNode> arguments) {
            this.function = function;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) throws ExpressionException {
            List<ExpressionValue> values = new ArrayList<>(arguments.size());
            for (ExpressionNode argument : arguments) {
                values.add(argument.evaluate(context));
            }
            return BuiltinFunctions.call(function, values, context);
        }

        @Override
        boolean usesStatusFunction() {
            if (function.isStatusFunction()) {
                return true;
            }
            for (ExpressionNode argument : arguments) {
                if (argument.usesStatusFunction()) {
                    return true;
                }
            }
            return false;
        }
    }

    static final class Not extends ExpressionNode {
        private final ExpressionNode operand;

        Not(ExpressionNode operand) {
            this.operand = operand;
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) throws ExpressionException {
            return ExpressionValue.of(!operand.evaluate(context).isTruthy());
        }

        @Override
        boolean usesStatusFunction() {
            return operand.usesStatusFunction();
        }
    }

    /**
     * {@code &&} and {@code ||}. Short-circuiting; the result is the deciding operand.
     */
    static final class Logical extends ExpressionNode {
        private final boolean and;
        private final ExpressionNode left;
        private final ExpressionNode right;

        Logical(boolean and, ExpressionNode left, ExpressionNode right) {
            this.and = and;
            this.left = left;
            this.right = right;
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) throws ExpressionException {
            ExpressionValue l = left.evaluate(context);
            if (and != l.isTruthy()) {
                return l;
            }
            return right.evaluate(context);
        }

        @Override
        boolean usesStatusFunction() {
            return left.usesStatusFunction() || right.usesStatusFunction();
        }
    }

    static final class Comparison extends ExpressionNode {
        private final ExpressionLexer.TokenType operator;
        private final ExpressionNode left;
        private final ExpressionNode right;

        Comparison(ExpressionLexer.TokenType operator, ExpressionNode left, ExpressionNode right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        ExpressionValue evaluate(ExpressionContext context) throws ExpressionException {
            ExpressionValue l = left.evaluate(context);
            ExpressionValue r = right.evaluate(context);
            switch (operator) {
                case EQ:
                    return ExpressionValue.of(Coercion.looseEquals(l, r));
                case NE:
                    return ExpressionValue.of(!Coercion.looseEquals(l, r));
                default:
                    Integer order = Coercion.compare(l, r);
                    if (order == null) {
                        return ExpressionValue.FALSE;
                    }
                    switch (operator) {
                        case LT:
                            return ExpressionValue.of(order < 0);
                        case LE:
                            return ExpressionValue.of(order <= 0);
                        case GT:
                            return ExpressionValue.of(order > 0);
                        default:
                            return ExpressionValue.of(order >= 0);
                    }
            }
        }

        @Override
        boolean usesStatusFunction() {
            return left.usesStatusFunction() || right.usesStatusFunction();
        }
    }
}
