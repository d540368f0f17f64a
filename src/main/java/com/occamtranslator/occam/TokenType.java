package com.occamtranslator.occam;

public enum TokenType {
    // Special tokens
    ILLEGAL("ILLEGAL"),
    EOF("EOF"),
    NEWLINE("NEWLINE"),
    INDENT("INDENT"),
    DEDENT("DEDENT"),

    // Literals
    IDENT("IDENT"),
    INT("INT"),
    STRING("STRING"),
    BYTE_LIT("BYTE_LIT"),

    // Operators
    ASSIGN(":="),
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("\\"),
    EQ("="),
    NEQ("<>"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    SEND("!"),
    RECEIVE("?"),
    AMPERSAND("&"),
    BITAND("/\\"),
    BITOR("\\/"),
    BITXOR("><"),
    BITNOT("~"),
    LSHIFT("<<"),
    RSHIFT(">>"),

    // Delimiters
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    COLON(":"),
    SEMICOLON(";"),

    // Keywords
    SEQ("SEQ"),
    PAR("PAR"),
    ALT("ALT"),
    PRI("PRI"),
    IF("IF"),
    CASE("CASE"),
    ELSE("ELSE"),
    WHILE("WHILE"),
    FOR("FOR"),
    FROM("FROM"),
    PROC("PROC"),
    FUNC("FUNC"),
    FUNCTION("FUNCTION"),
    VALOF("VALOF"),
    RESULT("RESULT"),
    IS("IS"),
    CHAN("CHAN"),
    OF("OF"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    NOT("NOT"),
    AND("AND"),
    OR("OR"),
    SKIP("SKIP"),
    STOP("STOP"),
    INT_TYPE("INT"),
    BYTE_TYPE("BYTE"),
    BOOL_TYPE("BOOL"),
    REAL_TYPE("REAL"),
    REAL32_TYPE("REAL32"),
    REAL64_TYPE("REAL64"),
    INT16_TYPE("INT16"),
    INT32_TYPE("INT32"),
    INT64_TYPE("INT64"),
    TIMER("TIMER"),
    AFTER("AFTER"),
    VAL("VAL"),
    PROTOCOL("PROTOCOL"),
    RECORD("RECORD"),
    SIZE("SIZE"),
    STEP("STEP"),
    MOSTNEG("MOSTNEG"),
    MOSTPOS("MOSTPOS"),
    INITIAL("INITIAL"),
    RETYPES("RETYPES"),
    INLINE("INLINE"),
    PLUS_KW("PLUS"),     // modular addition, distinct from +
    MINUS_KW("MINUS"),   // modular subtraction, distinct from -
    TIMES("TIMES"),      // modular multiplication
    ROUND("ROUND"),
    TRUNC("TRUNC");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    // scalar type keywords: INT, BYTE, BOOL, REAL*, INT16/32/64
    public boolean isScalarType() {
        switch (this) {
            case INT_TYPE:
            case BYTE_TYPE:
            case BOOL_TYPE:
            case REAL_TYPE:
            case REAL32_TYPE:
            case REAL64_TYPE:
            case INT16_TYPE:
            case INT32_TYPE:
            case INT64_TYPE:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return display;
    }
}
