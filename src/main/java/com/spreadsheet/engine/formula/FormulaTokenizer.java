package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens. Positions are offsets into the full
 * formula string, so errors point at the character the user typed.
 */
class FormulaTokenizer {

    enum TokenType {
        NUMBER,
        STRING,
        CELL_REF,
        IDENTIFIER,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        COLON,
        END
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

        boolean is(TokenType expected) {
            return type == expected;
        }

        boolean isOperator(String symbol) {
            return type == TokenType.OPERATOR && text.equals(symbol);
        }

        @Override
        public String toString() {
            return type == TokenType.END ? "end of formula" : "'" + text + "'";
        }
    }

    private final String source;
    private int pos;

    FormulaTokenizer(String source, int offset) {
        this.source = source;
        this.pos = offset;
    }

    List<Token> tokenize() throws FormulaSyntaxException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.END, "", pos));
                return tokens;
            }
            char c = source.charAt(pos);
            if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (c == '"') {
                tokens.add(readString());
            } else if (isLetter(c)) {
                tokens.add(readWord());
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", pos++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", pos++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", pos++));
            } else if (c == ':') {
                tokens.add(new Token(TokenType.COLON, ":", pos++));
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() throws FormulaSyntaxException {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        // exponent only when a digit actually follows, otherwise "1E" is left for the parser to reject
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos + 1;
            if (mark < source.length() && (source.charAt(mark) == '+' || source.charAt(mark) == '-')) {
                mark++;
            }
            if (mark < source.length() && Character.isDigit(source.charAt(mark))) {
                pos = mark;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
        }
        if (pos < source.length() && (isLetter(source.charAt(pos)) || source.charAt(pos) == '.')) {
            throw new FormulaSyntaxException("Malformed number '" + source.substring(start, pos + 1) + "'", start);
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private Token readString() throws FormulaSyntaxException {
        int start = pos;
        StringBuilder text = new StringBuilder();
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '"') {
                    text.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, text.toString(), start);
            }
            text.append(c);
            pos++;
        }
        throw new FormulaSyntaxException("Unterminated text literal", start);
    }

    /**
     * Letters alone form an identifier (function name, TRUE, FALSE);
     * letters followed by digits form a cell reference.
     */
    private Token readWord() throws FormulaSyntaxException {
        int start = pos;
        while (pos < source.length() && isLetter(source.charAt(pos))) {
            pos++;
        }
        int digitsStart = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && (isLetter(source.charAt(pos)) || source.charAt(pos) == '.')) {
            throw new FormulaSyntaxException("Malformed reference '" + source.substring(start, pos + 1) + "'", start);
        }
        if (digitsStart == pos) {
            return new Token(TokenType.IDENTIFIER, source.substring(start, pos).toUpperCase(), start);
        }
        if (source.charAt(digitsStart) == '0') {
            throw new FormulaSyntaxException("Malformed reference '" + source.substring(start, pos) + "'", start);
        }
        return new Token(TokenType.CELL_REF, source.substring(start, pos).toUpperCase(), start);
    }

    private Token readOperator() throws FormulaSyntaxException {
        int start = pos;
        char c = source.charAt(pos);
        switch (c) {
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
            case '=':
                pos++;
                return new Token(TokenType.OPERATOR, String.valueOf(c), start);
            case '<':
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '=' || source.charAt(pos) == '>')) {
                    pos++;
                }
                return new Token(TokenType.OPERATOR, source.substring(start, pos), start);
            case '>':
                pos++;
                if (pos < source.length() && source.charAt(pos) == '=') {
                    pos++;
                }
                return new Token(TokenType.OPERATOR, source.substring(start, pos), start);
            default:
                throw new FormulaSyntaxException("Unexpected character '" + c + "'", start);
        }
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
