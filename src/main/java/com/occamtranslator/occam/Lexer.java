package com.occamtranslator.occam;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.occamtranslator.occam.TokenType.*;

/**
 * Converts occam source text into tokens, one per call to {@link #nextToken()}.
 *
 * <p>Block structure is indentation based. At the start of every logical line
 * the leading whitespace is measured (a space counts 1, a tab counts
 * {@link #TAB_WIDTH}) and compared against the indentation stack: a deeper line
 * yields one INDENT, a shallower line one DEDENT per popped level. DEDENTs are
 * queued and handed out one per call before any further input is read.
 *
 * <p>Blank lines and comment-only lines never take part in the comparison and
 * produce no NEWLINE. Inside parentheses or brackets, and after a line that
 * ends in an operator, line breaks are not significant.
 *
 * <p>The lexer never fails: characters it does not recognise come back as
 * ILLEGAL tokens for the parser to report.
 */
public class Lexer {
    static final int TAB_WIDTH = 2;

    private static final Map<String, TokenType> keywords;
    // a line ending in one of these continues on the next line
    private static final Set<TokenType> continuations = EnumSet.of(
        PLUS, MINUS, MULTIPLY, DIVIDE, MODULO,
        EQ, NEQ, LT, GT, LE, GE,
        BITAND, BITOR, BITXOR, LSHIFT, RSHIFT,
        AND, OR, PLUS_KW, MINUS_KW, TIMES, AFTER,
        COMMA, ASSIGN
    );

    static {
        keywords = new HashMap<>();
        keywords.put("SEQ",      SEQ);
        keywords.put("PAR",      PAR);
        keywords.put("ALT",      ALT);
        keywords.put("PRI",      PRI);
        keywords.put("IF",       IF);
        keywords.put("CASE",     CASE);
        keywords.put("ELSE",     ELSE);
        keywords.put("WHILE",    WHILE);
        keywords.put("FOR",      FOR);
        keywords.put("FROM",     FROM);
        keywords.put("PROC",     PROC);
        keywords.put("FUNC",     FUNC);
        keywords.put("FUNCTION", FUNCTION);
        keywords.put("VALOF",    VALOF);
        keywords.put("RESULT",   RESULT);
        keywords.put("IS",       IS);
        keywords.put("CHAN",     CHAN);
        keywords.put("OF",       OF);
        keywords.put("TRUE",     TRUE);
        keywords.put("FALSE",    FALSE);
        keywords.put("NOT",      NOT);
        keywords.put("AND",      AND);
        keywords.put("OR",       OR);
        keywords.put("SKIP",     SKIP);
        keywords.put("STOP",     STOP);
        keywords.put("INT",      INT_TYPE);
        keywords.put("BYTE",     BYTE_TYPE);
        keywords.put("BOOL",     BOOL_TYPE);
        keywords.put("REAL",     REAL_TYPE);
        keywords.put("REAL32",   REAL32_TYPE);
        keywords.put("REAL64",   REAL64_TYPE);
        keywords.put("INT16",    INT16_TYPE);
        keywords.put("INT32",    INT32_TYPE);
        keywords.put("INT64",    INT64_TYPE);
        keywords.put("TIMER",    TIMER);
        keywords.put("AFTER",    AFTER);
        keywords.put("VAL",      VAL);
        keywords.put("PROTOCOL", PROTOCOL);
        keywords.put("RECORD",   RECORD);
        keywords.put("SIZE",     SIZE);
        keywords.put("STEP",     STEP);
        keywords.put("MOSTNEG",  MOSTNEG);
        keywords.put("MOSTPOS",  MOSTPOS);
        keywords.put("INITIAL",  INITIAL);
        keywords.put("RETYPES",  RETYPES);
        keywords.put("INLINE",   INLINE);
        keywords.put("PLUS",     PLUS_KW);
        keywords.put("MINUS",    MINUS_KW);
        keywords.put("TIMES",    TIMES);
        keywords.put("ROUND",    ROUND);
        keywords.put("TRUNC",    TRUNC);
    }

    private final String source;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0; // offset of the first character of the current line

    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private final Deque<Token> pending = new ArrayDeque<>();
    private boolean atLineStart = true;
    private int nesting = 0; // open ( and [
    private TokenType lastType = NEWLINE;

    public Lexer(String source) {
        // end of input counts as a line end
        this.source = source.endsWith("\n") ? source : source + "\n";
        this.indentStack.push(0);
    }

    static TokenType lookupIdent(String name) {
        TokenType ttype = keywords.get(name);
        return ttype == null ? IDENT : ttype;
    }

    /** Drains the lexer, returning every token up to and including EOF. */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token tok;
        do {
            tok = nextToken();
            tokens.add(tok);
        } while (tok.type != EOF);
        return tokens;
    }

    public Token nextToken() {
        Token tok = pending.isEmpty() ? scanToken() : pending.poll();
        lastType = tok.type;
        return tok;
    }

    int depth() {
        return indentStack.size() - 1;
    }

    private Token scanToken() {
        if (atLineStart) {
            atLineStart = false;
            skipBlankLines();
            if (!isAtEnd()) {
                Token dent = indentation();
                if (dent != null) return dent;
            }
        }

        while (true) {
            skipWhitespace();
            start = current;
            if (isAtEnd()) {
                if (indentStack.size() > 1) {
                    indentStack.pop();
                    return new Token(DEDENT, "", line, column());
                }
                return new Token(EOF, "", line, column());
            }

            char c = advance();
            switch (c) {
                case '(': nesting++; return token(LPAREN);
                case ')': if (nesting > 0) nesting--; return token(RPAREN);
                case '[': nesting++; return token(LBRACKET);
                case ']': if (nesting > 0) nesting--; return token(RBRACKET);
                case ',': return token(COMMA);
                case ';': return token(SEMICOLON);
                case '+': return token(PLUS);
                case '*': return token(MULTIPLY);
                case '~': return token(BITNOT);
                case '=': return token(EQ);
                case '!': return token(SEND);
                case '?': return token(RECEIVE);
                case '&': return token(AMPERSAND);
                case '/': return token(match('\\') ? BITAND : DIVIDE);
                case '\\': return token(match('/') ? BITOR : MODULO);
                case ':': return token(match('=') ? ASSIGN : COLON);
                case '<': {
                    if (match('=')) return token(LE);
                    if (match('>')) return token(NEQ);
                    if (match('<')) return token(LSHIFT);
                    return token(LT);
                }
                case '>': {
                    if (match('=')) return token(GE);
                    if (match('>')) return token(RSHIFT);
                    if (match('<')) return token(BITXOR);
                    return token(GT);
                }
                case '-': {
                    if (match('-')) {
                        // comment runs to the end of the line
                        while (peek() != '\n' && !isAtEnd()) advance();
                        continue;
                    }
                    return token(MINUS);
                }
                case '#': {
                    if (OccamUtil.isHexDigit(peek())) return hexNumber();
                    return token(ILLEGAL);
                }
                case '"': return string();
                case '\'': return byteLiteral();
                case '\n': {
                    if (nesting > 0 || continuations.contains(lastType)) {
                        nextLine();
                        continue;
                    }
                    Token tok = new Token(NEWLINE, "\\n", line, start - lineStart + 1);
                    nextLine();
                    atLineStart = true;
                    return tok;
                }
                default:
                    if (OccamUtil.isAlpha(c)) return identifier();
                    if (OccamUtil.isDigit(c)) return number();
                    return token(ILLEGAL);
            }
        }
    }

    // Compares the new line's indentation with the stack. Returns the first
    // structural token, or null when the level is unchanged.
    private Token indentation() {
        int indent = measureIndent();
        int top = indentStack.peek();
        if (indent > top) {
            indentStack.push(indent);
            return new Token(INDENT, "", line, 1);
        }
        if (indent < top) {
            // A width between two stacked levels is tolerated: the deeper
            // levels are closed and the line is read at the remaining level.
            while (indentStack.size() > 1 && indentStack.peek() > indent) {
                indentStack.pop();
                pending.add(new Token(DEDENT, "", line, 1));
            }
            return pending.poll();
        }
        return null;
    }

    private int measureIndent() {
        int indent = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent += TAB_WIDTH;
            } else {
                break;
            }
            advance();
        }
        return indent;
    }

    private void skipBlankLines() {
        while (!isAtEnd() && isBlankLine()) {
            while (peek() != '\n' && !isAtEnd()) advance();
            if (!isAtEnd()) {
                advance();
                nextLine();
            }
        }
    }

    // true for a line of whitespace, optionally followed by a -- comment
    private boolean isBlankLine() {
        int pos = current;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') return true;
            if (c == '-' && pos + 1 < source.length() && source.charAt(pos + 1) == '-') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r') return false;
            pos++;
        }
        return true;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c != ' ' && c != '\t' && c != '\r') return;
            advance();
        }
    }

    // called with the '\n' already consumed
    private void nextLine() {
        line++;
        lineStart = current;
    }

    private Token identifier() {
        while (OccamUtil.isNameChar(peek())) advance();
        String text = source.substring(start, current);
        return token(lookupIdent(text));
    }

    private Token number() {
        while (OccamUtil.isDigit(peek())) advance();
        String text = source.substring(start, current);
        Long value = null;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            // out of range: left undecoded, the parser reports it
        }
        return token(INT, value);
    }

    private Token hexNumber() {
        while (OccamUtil.isHexDigit(peek())) advance();
        String digits = source.substring(start + 1, current);
        Long value = null;
        if (digits.length() <= 16) {
            value = Long.parseUnsignedLong(digits, 16);
        }
        return token(INT, value);
    }

    private Token string() {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                return token(ILLEGAL); // unterminated string
            }
            char c = advance();
            if (c == '"') break;
            if (c == '*' && peek() != '\n' && !isAtEnd()) {
                char esc = advance();
                int decoded = OccamUtil.escapeValue(esc);
                if (decoded < 0) {
                    value.append('*').append(esc);
                } else {
                    value.append((char) decoded);
                }
            } else {
                value.append(c);
            }
        }
        return token(STRING, value.toString());
    }

    private Token byteLiteral() {
        StringBuilder value = new StringBuilder();
        boolean valid = true;
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                return token(ILLEGAL); // unterminated byte literal
            }
            char c = advance();
            if (c == '\'') break;
            if (c == '*' && peek() != '\n' && !isAtEnd()) {
                int decoded = OccamUtil.escapeValue(advance());
                if (decoded < 0) valid = false;
                value.append((char) decoded);
            } else {
                value.append(c);
            }
        }
        Integer literal = null;
        if (valid && value.length() == 1 && value.charAt(0) <= 0xFF) {
            literal = (int) value.charAt(0);
        }
        return token(BYTE_LIT, literal);
    }

    private Token token(TokenType ttype) {
        return token(ttype, null);
    }

    private Token token(TokenType ttype, Object literal) {
        String text = source.substring(start, current);
        return new Token(ttype, text, literal, line, start - lineStart + 1);
    }

    private int column() {
        return current - lineStart + 1;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        current++;
        return source.charAt(current - 1);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean match(char c) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != c) return false;
        current++;
        return true;
    }
}
