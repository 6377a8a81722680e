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

/**
 * Splits an expression into tokens. String literals use single quotes, with {@code ''}
 * as the escaped quote.
 */
final class ExpressionLexer {

    enum TokenType {
        STRING, NUMBER, TRUE, FALSE, NULL, IDENTIFIER,
        LPAREN, RPAREN, LBRACKET, RBRACKET, DOT, COMMA,
        NOT, AND, OR, EQ, NE, LT, LE, GT, GE,
        EOF
    }

    static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        @Override
        public String toString() {
            return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
        }
    }

    private final String input;
    private int pos;

    ExpressionLexer(String input) {
        this.input = input;
    }

    List<Token> tokenize() throws ExpressionException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() throws ExpressionException {
        int start = pos;
        char c = input.charAt(pos);

        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case '[':
                pos++;
                return new Token(TokenType.LBRACKET, "[", start);
            case ']':
                pos++;
                return new Token(TokenType.RBRACKET, "]", start);
            case ',':
                pos++;
                return new Token(TokenType.COMMA, ",", start);
            case '.':
                if (pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1))) {
                    return number();
                }
                pos++;
                return new Token(TokenType.DOT, ".", start);
            case '\'':
                return string();
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.NE, "!=", start);
                }
                pos++;
                return new Token(TokenType.NOT, "!", start);
            case '=':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.EQ, "==", start);
                }
                break;
            case '&':
                if (peek(1) == '&') {
                    pos += 2;
                    return new Token(TokenType.AND, "&&", start);
                }
                break;
            case '|':
                if (peek(1) == '|') {
                    pos += 2;
                    return new Token(TokenType.OR, "||", start);
                }
                break;
            case '<':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.LE, "<=", start);
                }
                pos++;
                return new Token(TokenType.LT, "<", start);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.GE, ">=", start);
                }
                pos++;
                return new Token(TokenType.GT, ">", start);
            case '-':
            case '+':
                if (pos + 1 < input.length() && (Character.isDigit(input.charAt(pos + 1)) || input.charAt(pos + 1) == '.')) {
                    return number();
                }
                break;
            default:
                if (Character.isDigit(c)) {
                    return number();
                }
                if (Character.isLetter(c) || c == '_') {
                    return identifier();
                }
                break;
        }
        throw new ExpressionException("Unexpected character '" + c + "' at position " + start, input);
    }

    private Token string() throws ExpressionException {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\'') {
                if (peek(1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new ExpressionException("Unterminated string literal at position " + start, input);
    }

    private Token number() throws ExpressionException {
        int start = pos;
        if (input.charAt(pos) == '-' || input.charAt(pos) == '+') {
            pos++;
        }
        while (pos < input.length() && isNumberChar(input.charAt(pos))) {
            pos++;
        }
        String text = input.substring(start, pos);
        if (ExpressionValue.parseNumber(text.startsWith("+") ? text.substring(1) : text) == null) {
            throw new ExpressionException("Invalid number '" + text + "' at position " + start, input);
        }
        return new Token(TokenType.NUMBER, text, start);
    }

    private boolean isNumberChar(char c) {
        if (Character.isLetterOrDigit(c) || c == '.') {
            return true;
        }
        // exponent sign
        char previous = input.charAt(pos - 1);
        return (c == '-' || c == '+') && (previous == 'e' || previous == 'E');
    }

    private Token identifier() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);
        switch (text) {
            case "true":
                return new Token(TokenType.TRUE, text, start);
            case "false":
                return new Token(TokenType.FALSE, text, start);
            case "null":
                return new Token(TokenType.NULL, text, start);
            default:
                return new Token(TokenType.IDENTIFIER, text, start);
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
