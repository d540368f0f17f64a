package com.occamtranslator.occam;

public final class Token {
    final TokenType type;
    final String lexeme;
    final Object literal; // decoded value: Long (INT), String (STRING), Integer (BYTE_LIT)
    final int line;
    final int column;

    Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, null, line, column);
    }

    public String toString() {
        return type.name() + " " + lexeme + " " + literal;
    }
}
