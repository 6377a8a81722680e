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

import dev.mars.gantry.workflow.expression.ExpressionLexer.Token;
import dev.mars.gantry.workflow.expression.ExpressionLexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser. Precedence, loosest first: {@code ||}, {@code &&},
 * equality, relational, {@code !}, property access.
 */
final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    static ExpressionNode parse(String expression) throws ExpressionException {
        ExpressionParser parser = new ExpressionParser(expression, new ExpressionLexer(expression).tokenize());
        if (parser.peek().type == TokenType.EOF) {
            throw new ExpressionException("Empty expression", expression);
        }
        ExpressionNode node = parser.or();
        parser.expect(TokenType.EOF);
        return node;
    }

    private ExpressionNode or() throws ExpressionException {
        ExpressionNode left = and();
        while (match(TokenType.OR)) {
            left = new ExpressionNode.Logical(false, left, and());
        }
        return left;
    }

    private ExpressionNode and() throws ExpressionException {
        ExpressionNode left = equality();
        while (match(TokenType.AND)) {
            left = new ExpressionNode.Logical(true, left, equality());
        }
        return left;
    }

    private ExpressionNode equality() throws ExpressionException {
        ExpressionNode left = relational();
        while (peek().type == TokenType.EQ || peek().type == TokenType.NE) {
            TokenType operator = advance().type;
            left = new ExpressionNode.Comparison(operator, left, relational());
        }
        return left;
    }

    private ExpressionNode relational() throws ExpressionException {
        ExpressionNode left = unary();
        while (true) {
            TokenType type = peek().type;
            if (type != TokenType.LT && type != TokenType.LE && type != TokenType.GT && type != TokenType.GE) {
                return left;
            }
            advance();
            left = new ExpressionNode.Comparison(type, left, unary());
        }
    }

    private ExpressionNode unary() throws ExpressionException {
        if (match(TokenType.NOT)) {
            return new ExpressionNode.Not(unary());
        }
        return postfix();
    }

    private ExpressionNode postfix() throws ExpressionException {
        ExpressionNode node = primary();
        while (true) {
            if (match(TokenType.DOT)) {
                Token name = advance();
                if (name.type == TokenType.IDENTIFIER || name.type == TokenType.TRUE
                        || name.type == TokenType.FALSE || name.type == TokenType.NULL) {
                    node = new ExpressionNode.PropertyAccess(node, name.text, null);
                } else {
                    throw unexpected(name, "property name");
                }
            } else if (match(TokenType.LBRACKET)) {
                ExpressionNode key = or();
                expect(TokenType.RBRACKET);
                node = new ExpressionNode.PropertyAccess(node, null, key);
            } else {
                return node;
            }
        }
    }

    private ExpressionNode primary() throws ExpressionException {
        Token token = advance();
        switch (token.type) {
            case STRING:
                return new ExpressionNode.Literal(ExpressionValue.of(token.text));
            case NUMBER:
                String text = token.text.startsWith("+") ? token.text.substring(1) : token.text;
                return new ExpressionNode.Literal(ExpressionValue.of(ExpressionValue.parseNumber(text)));
            case TRUE:
                return new ExpressionNode.Literal(ExpressionValue.TRUE);
            case FALSE:
                return new ExpressionNode.Literal(ExpressionValue.FALSE);
            case NULL:
                return new ExpressionNode.Literal(ExpressionValue.NULL);
            case LPAREN:
                ExpressionNode inner = or();
                expect(TokenType.RPAREN);
                return inner;
            case IDENTIFIER:
                if (peek().type == TokenType.LPAREN) {
                    return call(token);
                }
                return new ExpressionNode.Identifier(token.text);
            default:
                throw unexpected(token, "value");
        }
    }

    private ExpressionNode call(Token name) throws ExpressionException {
        BuiltinFunctions.Function function = BuiltinFunctions.Function.lookup(name.text);
        if (function == null) {
            throw new ExpressionException("Unknown function '" + name.text + "'", source);
        }
        expect(TokenType.LPAREN);
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!match(TokenType.RPAREN)) {
            do {
                arguments.add(or());
            } while (match(TokenType.COMMA));
            expect(TokenType.RPAREN);
        }
        if (!function.acceptsArity(arguments.size())) {
            throw new ExpressionException("Function '" + name.text + "' does not accept "
                    + arguments.size() + " argument(s)", source);
        }
        return new ExpressionNode.FunctionCall(function, arguments);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.type != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().type == type) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type) throws ExpressionException {
        Token token = advance();
        if (token.type != type) {
            throw unexpected(token, type == TokenType.EOF ? "end of expression" : type.name().toLowerCase());
        }
    }

    private ExpressionException unexpected(Token token, String wanted) {
        return new ExpressionException("Unexpected " + token + " at position " + token.position
                + ", expected " + wanted, source);
    }
}
