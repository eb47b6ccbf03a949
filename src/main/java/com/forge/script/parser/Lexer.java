package com.forge.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.forge.script.error.LexError;

/**
 * Turns source text into spanned tokens.
 *
 * The token sequence is lazy: every call to {@link #iterator()} starts a fresh scan of the
 * same source, so a lexer can be walked more than once. A scan ends with exactly one EOF
 * token and stops at the first malformed input with a {@link LexError}.
 */
public class Lexer implements Iterable<Token> {
    private final String source;
    private final int[] codePoints;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("var", TokenType.VAR);
        map.put("print", TokenType.PRINT);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("return", TokenType.RETURN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("null", TokenType.NULL);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("xor", TokenType.XOR);
        map.put("input", TokenType.INPUT);
        map.put("clone", TokenType.CLONE);
        map.put("mirror", TokenType.MIRROR);
        map.put("as", TokenType.AS);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
        this.codePoints = source.codePoints().toArray();
    }

    public String source() {
        return source;
    }

    /** Scans the whole source eagerly. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token t : this) {
            tokens.add(t);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    private final class Scanner implements Iterator<Token> {
        private int current = 0;
        private int line = 1;
        private int column = 1;

        private int start;
        private int startLine;
        private int startColumn;

        private Span lastEnd = Span.point(1, 1, 0);
        private boolean done = false;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) throw new NoSuchElementException();
            skipTrivia();
            if (isAtEnd()) {
                done = true;
                return new Token(TokenType.EOF, "", null, lastEnd);
            }
            Token token = scanToken();
            lastEnd = Span.point(token.span.endLine, token.span.endColumn, token.span.end);
            return token;
        }

        private void skipTrivia() {
            while (!isAtEnd()) {
                int c = peek();
                if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                    advance();
                } else if (c == '#' || (c == '/' && peekNext() == '/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    return;
                }
            }
        }

        private Token scanToken() {
            start = current;
            startLine = line;
            startColumn = column;

            int c = advance();
            switch (c) {
                case '(': return make(TokenType.LEFT_PAREN, null);
                case ')': return make(TokenType.RIGHT_PAREN, null);
                case '{': return make(TokenType.LEFT_BRACE, null);
                case '}': return make(TokenType.RIGHT_BRACE, null);
                case '[': return make(TokenType.LEFT_BRACKET, null);
                case ']': return make(TokenType.RIGHT_BRACKET, null);
                case ',': return make(TokenType.COMMA, null);
                case ':': return make(TokenType.COLON, null);
                case ';': return make(TokenType.SEMICOLON, null);
                case '|': return make(TokenType.PIPE, null);
                case '+': return make(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS, null);
                case '-': return make(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS, null);
                case '*': return make(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR, null);
                case '/': return make(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH, null);
                case '%': return make(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT, null);
                case '!': return make(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG, null);
                case '=': return make(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL, null);
                case '<': return make(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS, null);
                case '>': return make(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER, null);
                case '.':
                    if (match('.')) return make(TokenType.DOT_DOT, null);
                    throw error("unexpected character '.'");
                case '"':
                    return string();
                case '\'':
                    return character();
                default:
                    if (isDigit(c)) return number();
                    if (isIdentifierStart(c)) return identifier();
                    throw error("unexpected character '" + new String(Character.toChars(c)) + "'");
            }
        }

        private Token identifier() {
            while (!isAtEnd() && isIdentifierPart(peek())) advance();
            String text = text();
            TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
            return make(type, null);
        }

        private Token number() {
            while (isDigit(peek())) advance();
            // "1..4" is a range, so '.' only continues the number when a digit follows
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
            }
            return make(TokenType.NUMBER, Double.parseDouble(text()));
        }

        private Token string() {
            StringBuilder sb = new StringBuilder();
            while (!isAtEnd() && peek() != '"') {
                int c = advance();
                if (c == '\\') {
                    sb.appendCodePoint(escape());
                } else {
                    sb.appendCodePoint(c);
                }
            }
            if (isAtEnd()) throw error("unterminated string");
            advance();
            return make(TokenType.STRING, sb.toString());
        }

        private Token character() {
            if (isAtEnd() || peek() == '\n') throw error("unterminated character literal");
            if (peek() == '\'') {
                advance();
                throw error("empty character literal");
            }
            int c = advance();
            if (c == '\\') c = escape();
            if (peek() != '\'') {
                while (!isAtEnd() && peek() != '\'' && peek() != '\n') advance();
                if (peek() == '\'') {
                    advance();
                    throw error("character literal may only contain one character");
                }
                throw error("unterminated character literal");
            }
            advance();
            return make(TokenType.CHAR, c);
        }

        private int escape() {
            if (isAtEnd()) throw error("unterminated escape sequence");
            int c = advance();
            switch (c) {
                case 'n': return '\n';
                case 't': return '\t';
                case 'r': return '\r';
                case '0': return 0;
                case '\\': return '\\';
                case '"': return '"';
                case '\'': return '\'';
                default:
                    throw error("unknown escape sequence '\\" + new String(Character.toChars(c)) + "'");
            }
        }

        // -------------------------
        // Cursor helpers
        // -------------------------

        private boolean isAtEnd() { return current >= codePoints.length; }

        private int advance() {
            int c = codePoints[current++];
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }

        private boolean match(int expected) {
            if (isAtEnd() || codePoints[current] != expected) return false;
            advance();
            return true;
        }

        private int peek() { return isAtEnd() ? 0 : codePoints[current]; }
        private int peekNext() { return (current + 1 >= codePoints.length) ? 0 : codePoints[current + 1]; }

        private String text() {
            return new String(codePoints, start, current - start);
        }

        private Span span() {
            return new Span(startLine, startColumn, line, column, start, current);
        }

        private Token make(TokenType type, Object literal) {
            return new Token(type, text(), literal, span());
        }

        private LexError error(String message) {
            done = true;
            return new LexError(message, span());
        }
    }

    private static boolean isDigit(int c) { return c >= '0' && c <= '9'; }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
