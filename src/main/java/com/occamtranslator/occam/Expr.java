package com.occamtranslator.occam;

import java.util.Collections;
import java.util.List;

public abstract class Expr {
    public interface Visitor<R> {
        R visitIdentifierExpr(Identifier expr);
        R visitIntegerLiteralExpr(IntegerLiteral expr);
        R visitBooleanLiteralExpr(BooleanLiteral expr);
        R visitStringLiteralExpr(StringLiteral expr);
        R visitByteLiteralExpr(ByteLiteral expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitGroupingExpr(Grouping expr);
        R visitIndexExpr(Index expr);
        R visitCallExpr(Call expr);
        R visitConversionExpr(Conversion expr);
        R visitSizeExpr(Size expr);
        R visitMostExpr(Most expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitSliceExpr(Slice expr);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    // token the node was built from, for diagnostics
    public abstract Token token();

    public static class Identifier extends Expr {
        Identifier(Token name) {
            this.name = name;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        public Token token() {
            return name;
        }

        public final Token name;
    }

    public static class IntegerLiteral extends Expr {
        IntegerLiteral(Token token, long value) {
            this.literal = token;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIntegerLiteralExpr(this);
        }

        public Token token() {
            return literal;
        }

        public final Token literal;
        public final long value;
    }

    public static class BooleanLiteral extends Expr {
        BooleanLiteral(Token token, boolean value) {
            this.literal = token;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBooleanLiteralExpr(this);
        }

        public Token token() {
            return literal;
        }

        public final Token literal;
        public final boolean value;
    }

    public static class StringLiteral extends Expr {
        StringLiteral(Token token, String value) {
            this.literal = token;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteralExpr(this);
        }

        public Token token() {
            return literal;
        }

        public final Token literal;
        public final String value; // escapes already decoded
    }

    public static class ByteLiteral extends Expr {
        ByteLiteral(Token token, int value) {
            this.literal = token;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitByteLiteralExpr(this);
        }

        public Token token() {
            return literal;
        }

        public final Token literal;
        public final int value; // 0..255
    }

    public static class Binary extends Expr {
        Binary(Expr left, Token operator, Expr right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        public Token token() {
            return operator;
        }

        public final Expr left;
        public final Token operator;
        public final Expr right;
    }

    public static class Unary extends Expr {
        Unary(Token operator, String op, Expr right) {
            this.operator = operator;
            this.op = op;
            this.right = right;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        public Token token() {
            return operator;
        }

        public final Token operator;
        public final String op; // "-", "NOT" or "~"; MINUS is folded into "-"
        public final Expr right;
    }

    public static class Grouping extends Expr {
        Grouping(Token lparen, Expr expression) {
            this.lparen = lparen;
            this.expression = expression;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }

        public Token token() {
            return lparen;
        }

        public final Token lparen;
        public final Expr expression;
    }

    public static class Index extends Expr {
        Index(Token lbracket, Expr left, Expr index) {
            this.lbracket = lbracket;
            this.left = left;
            this.index = index;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }

        public Token token() {
            return lbracket;
        }

        public final Token lbracket;
        public final Expr left;
        public final Expr index;
    }

    public static class Call extends Expr {
        Call(Token name, List<Expr> args) {
            this.name = name;
            this.args = Collections.unmodifiableList(args);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        public Token token() {
            return name;
        }

        public final Token name;
        public final List<Expr> args;
    }

    public static class Conversion extends Expr {
        Conversion(Token type, Token qualifier, Expr expression) {
            this.type = type;
            this.qualifier = qualifier;
            this.expression = expression;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConversionExpr(this);
        }

        public Token token() {
            return type;
        }

        public final Token type;
        public final Token qualifier; // ROUND, TRUNC or null
        public final Expr expression;
    }

    public static class Size extends Expr {
        Size(Token keyword, Expr expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSizeExpr(this);
        }

        public Token token() {
            return keyword;
        }

        public final Token keyword;
        public final Expr expression;
    }

    public static class Most extends Expr {
        Most(Token keyword, Token type) {
            this.keyword = keyword;
            this.type = type;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMostExpr(this);
        }

        public Token token() {
            return keyword;
        }

        public boolean isNegative() {
            return keyword.type == TokenType.MOSTNEG;
        }

        public final Token keyword;
        public final Token type;
    }

    public static class ArrayLiteral extends Expr {
        ArrayLiteral(Token lbracket, List<Expr> elements) {
            this.lbracket = lbracket;
            this.elements = Collections.unmodifiableList(elements);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }

        public Token token() {
            return lbracket;
        }

        public final Token lbracket;
        public final List<Expr> elements;
    }

    // [array FROM start FOR length]; start is a synthesized 0 for [array FOR length]
    public static class Slice extends Expr {
        Slice(Token lbracket, Expr array, Expr start, Expr length) {
            this.lbracket = lbracket;
            this.array = array;
            this.start = start;
            this.length = length;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSliceExpr(this);
        }

        public Token token() {
            return lbracket;
        }

        public final Token lbracket;
        public final Expr array;
        public final Expr start;
        public final Expr length;
    }
}
