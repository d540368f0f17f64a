package com.occamtranslator.occam;

import java.util.Collections;
import java.util.List;

public abstract class Stmt {
    public interface Visitor<R> {
        R visitVarDeclStmt(VarDecl stmt);
        R visitArrayDeclStmt(ArrayDecl stmt);
        R visitChanDeclStmt(ChanDecl stmt);
        R visitTimerDeclStmt(TimerDecl stmt);
        R visitAbbreviationStmt(Abbreviation stmt);
        R visitRetypesStmt(Retypes stmt);
        R visitAssignStmt(Assign stmt);
        R visitSliceAssignStmt(SliceAssign stmt);
        R visitMultiAssignStmt(MultiAssign stmt);
        R visitSendStmt(Send stmt);
        R visitReceiveStmt(Receive stmt);
        R visitTimerReadStmt(TimerRead stmt);
        R visitVariantReceiveStmt(VariantReceive stmt);
        R visitSeqStmt(Seq stmt);
        R visitParStmt(Par stmt);
        R visitAltStmt(Alt stmt);
        R visitIfStmt(If stmt);
        R visitCaseStmt(Case stmt);
        R visitWhileStmt(While stmt);
        R visitProcStmt(Proc stmt);
        R visitFunctionStmt(Function stmt);
        R visitProcCallStmt(ProcCall stmt);
        R visitProtocolStmt(Protocol stmt);
        R visitRecordStmt(Record stmt);
        R visitSkipStmt(Skip stmt);
        R visitStopStmt(Stop stmt);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    private static <T> List<T> frozen(List<T> list) {
        return Collections.unmodifiableList(list);
    }

    // INT x, y:  or a record-typed  POINT p:
    public static class VarDecl extends Stmt {
        VarDecl(Token type, List<Token> names) {
            this.type = type;
            this.names = frozen(names);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarDeclStmt(this);
        }

        public final Token type;
        public final List<Token> names;
    }

    // [3][4]INT grid:  one size per dimension, in declaration order
    public static class ArrayDecl extends Stmt {
        ArrayDecl(Token lbracket, List<Expr> sizes, Token type, List<Token> names) {
            this.lbracket = lbracket;
            this.sizes = frozen(sizes);
            this.type = type;
            this.names = frozen(names);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArrayDeclStmt(this);
        }

        public final Token lbracket;
        public final List<Expr> sizes;
        public final Token type;
        public final List<Token> names;
    }

    // CHAN OF INT c:  CHAN BYTE c:  [n]CHAN OF MSG cs:  (sizes empty for a scalar channel)
    public static class ChanDecl extends Stmt {
        ChanDecl(Token keyword, List<Expr> sizes, Token elemType, List<Token> names) {
            this.keyword = keyword;
            this.sizes = frozen(sizes);
            this.elemType = elemType;
            this.names = frozen(names);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChanDeclStmt(this);
        }

        public final Token keyword;
        public final List<Expr> sizes;
        public final Token elemType; // type keyword or protocol name
        public final List<Token> names;
    }

    public static class TimerDecl extends Stmt {
        TimerDecl(Token keyword, List<Token> names) {
            this.keyword = keyword;
            this.names = frozen(names);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTimerDeclStmt(this);
        }

        public final Token keyword;
        public final List<Token> names;
    }

    // [VAL|INITIAL] [[]...|[n]TYPE] name IS value:
    public static class Abbreviation extends Stmt {
        Abbreviation(Token keyword, boolean isVal, boolean isInitial, int openArrayDims,
                     Expr arraySize, Token type, Token name, Expr value) {
            this.keyword = keyword;
            this.isVal = isVal;
            this.isInitial = isInitial;
            this.openArrayDims = openArrayDims;
            this.arraySize = arraySize;
            this.type = type;
            this.name = name;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbbreviationStmt(this);
        }

        public final Token keyword; // VAL, INITIAL or the type token
        public final boolean isVal;
        public final boolean isInitial;
        public final int openArrayDims;
        public final Expr arraySize; // VAL [4]INT t IS ...:  else null
        public final Token type; // null for an untyped VAL x IS e:
        public final Token name;
        public final Expr value;
    }

    // VAL INT x RETYPES y:  VAL [2]INT x RETYPES y:
    public static class Retypes extends Stmt {
        Retypes(Token keyword, Expr arraySize, Token type, Token name, Token source) {
            this.keyword = keyword;
            this.arraySize = arraySize;
            this.type = type;
            this.name = name;
            this.source = source;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRetypesStmt(this);
        }

        public boolean isArray() {
            return arraySize != null;
        }

        public final Token keyword;
        public final Expr arraySize;
        public final Token type;
        public final Token name;
        public final Token source;
    }

    // x := e  or  grid[i][j] := e  (record fields use the same bracket form)
    public static class Assign extends Stmt {
        Assign(Token name, List<Expr> indices, Token operator, Expr value) {
            this.name = name;
            this.indices = frozen(indices);
            this.operator = operator;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignStmt(this);
        }

        public final Token name;
        public final List<Expr> indices;
        public final Token operator;
        public final Expr value;
    }

    public static class SliceAssign extends Stmt {
        SliceAssign(Expr.Slice target, Token operator, Expr value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSliceAssignStmt(this);
        }

        public final Expr.Slice target;
        public final Token operator;
        public final Expr value;
    }

    public static class AssignTarget {
        AssignTarget(Token name, List<Expr> indices) {
            this.name = name;
            this.indices = frozen(indices);
        }

        public final Token name;
        public final List<Expr> indices;
    }

    // a, b[i] := f(x)  or  a, b := b, a
    public static class MultiAssign extends Stmt {
        MultiAssign(List<AssignTarget> targets, Token operator, List<Expr> values) {
            this.targets = frozen(targets);
            this.operator = operator;
            this.values = frozen(values);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMultiAssignStmt(this);
        }

        public final List<AssignTarget> targets;
        public final Token operator;
        public final List<Expr> values;
    }

    /**
     * A channel output. {@code c ! x} has one value, {@code c ! x ; y} several.
     * A variant send {@code c ! tag ; x} carries the tag separately and only
     * the payload in {@code values}, which is empty for a bare tag.
     */
    public static class Send extends Stmt {
        Send(Token operator, Token channel, List<Expr> channelIndices, Token variantTag,
             List<Expr> values) {
            this.operator = operator;
            this.channel = channel;
            this.channelIndices = frozen(channelIndices);
            this.variantTag = variantTag;
            this.values = frozen(values);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSendStmt(this);
        }

        public boolean isVariant() {
            return variantTag != null;
        }

        public final Token operator;
        public final Token channel;
        public final List<Expr> channelIndices;
        public final Token variantTag;
        public final List<Expr> values;
    }

    // c ? x  or  c ? x ; y ; a[i]
    public static class Receive extends Stmt {
        Receive(Token operator, Token channel, List<Expr> channelIndices, List<Expr> targets) {
            this.operator = operator;
            this.channel = channel;
            this.channelIndices = frozen(channelIndices);
            this.targets = frozen(targets);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReceiveStmt(this);
        }

        public final Token operator;
        public final Token channel;
        public final List<Expr> channelIndices;
        public final List<Expr> targets; // Identifier or Index chains
    }

    public static class TimerRead extends Stmt {
        TimerRead(Token operator, Token timer, Expr target) {
            this.operator = operator;
            this.timer = timer;
            this.target = target;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTimerReadStmt(this);
        }

        public final Token operator;
        public final Token timer;
        public final Expr target;
    }

    public static class VariantCase {
        VariantCase(Token tag, List<Token> variables, List<Stmt> body) {
            this.tag = tag;
            this.variables = frozen(variables);
            this.body = frozen(body);
        }

        public final Token tag;
        public final List<Token> variables;
        public final List<Stmt> body;
    }

    // c ? CASE followed by an indented list of tagged cases
    public static class VariantReceive extends Stmt {
        VariantReceive(Token operator, Token channel, List<Expr> channelIndices,
                       List<VariantCase> cases) {
            this.operator = operator;
            this.channel = channel;
            this.channelIndices = frozen(channelIndices);
            this.cases = frozen(cases);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariantReceiveStmt(this);
        }

        public final Token operator;
        public final Token channel;
        public final List<Expr> channelIndices;
        public final List<VariantCase> cases;
    }

    public static class Seq extends Stmt {
        Seq(Token keyword, Replicator replicator, List<Stmt> statements) {
            this.keyword = keyword;
            this.replicator = replicator;
            this.statements = frozen(statements);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSeqStmt(this);
        }

        public final Token keyword;
        public final Replicator replicator; // null when not replicated
        public final List<Stmt> statements;
    }

    public static class Par extends Stmt {
        Par(Token keyword, boolean priority, Replicator replicator, List<Stmt> statements) {
            this.keyword = keyword;
            this.priority = priority;
            this.replicator = replicator;
            this.statements = frozen(statements);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParStmt(this);
        }

        public final Token keyword;
        public final boolean priority; // PRI PAR
        public final Replicator replicator;
        public final List<Stmt> statements;
    }

    /**
     * One alternative of an ALT. The input is either a channel input
     * ({@code channel}, optional {@code channelIndices}, {@code target}),
     * a timer timeout ({@code timer}, {@code deadline}) or, only behind a
     * guard, SKIP.
     */
    public static class AltCase {
        public enum Kind { CHANNEL, TIMER, SKIP }

        AltCase(List<Stmt> declarations, Expr guard, Kind kind,
                Token channel, List<Expr> channelIndices, Expr target,
                Expr deadline, List<Stmt> body) {
            this.declarations = frozen(declarations);
            this.guard = guard;
            this.kind = kind;
            this.channel = channel;
            this.channelIndices = frozen(channelIndices);
            this.target = target;
            this.deadline = deadline;
            this.body = frozen(body);
        }

        public final List<Stmt> declarations; // scoped to this alternative
        public final Expr guard;
        public final Kind kind;
        public final Token channel; // channel or timer name; null for SKIP
        public final List<Expr> channelIndices;
        public final Expr target;
        public final Expr deadline;
        public final List<Stmt> body;
    }

    public static class Alt extends Stmt {
        Alt(Token keyword, boolean priority, Replicator replicator, List<AltCase> cases) {
            this.keyword = keyword;
            this.priority = priority;
            this.replicator = replicator;
            this.cases = frozen(cases);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAltStmt(this);
        }

        public final Token keyword;
        public final boolean priority;
        public final Replicator replicator;
        public final List<AltCase> cases;
    }

    // either condition + body, or a nested IF standing in as the choice
    public static class IfChoice {
        IfChoice(Expr condition, List<Stmt> body, If nested) {
            this.condition = condition;
            this.body = frozen(body);
            this.nested = nested;
        }

        public final Expr condition;
        public final List<Stmt> body;
        public final If nested;
    }

    public static class If extends Stmt {
        If(Token keyword, Replicator replicator, List<IfChoice> choices) {
            this.keyword = keyword;
            this.replicator = replicator;
            this.choices = frozen(choices);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStmt(this);
        }

        public final Token keyword;
        public final Replicator replicator;
        public final List<IfChoice> choices;
    }

    public static class CaseChoice {
        CaseChoice(List<Expr> values, boolean isElse, List<Stmt> body) {
            this.values = frozen(values);
            this.isElse = isElse;
            this.body = frozen(body);
        }

        public final List<Expr> values; // empty for ELSE
        public final boolean isElse;
        public final List<Stmt> body;
    }

    public static class Case extends Stmt {
        Case(Token keyword, Expr selector, List<CaseChoice> choices) {
            this.keyword = keyword;
            this.selector = selector;
            this.choices = frozen(choices);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCaseStmt(this);
        }

        public final Token keyword;
        public final Expr selector;
        public final List<CaseChoice> choices;
    }

    public static class While extends Stmt {
        While(Token keyword, Expr condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = frozen(body);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileStmt(this);
        }

        public final Token keyword;
        public final Expr condition;
        public final List<Stmt> body;
    }

    // local declarations and nested PROC/FUNCTIONs are part of the body
    public static class Proc extends Stmt {
        Proc(Token name, List<Param> params, List<Stmt> body) {
            this.name = name;
            this.params = frozen(params);
            this.body = frozen(body);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProcStmt(this);
        }

        public final Token name;
        public final List<Param> params;
        public final List<Stmt> body;
    }

    /**
     * A FUNCTION. The IS form has an empty body and one result; the VALOF
     * form keeps its local declarations and VALOF statements in {@code body}
     * and one result per return type.
     */
    public static class Function extends Stmt {
        Function(List<Token> returnTypes, Token name, List<Param> params,
                 List<Stmt> body, List<Expr> results) {
            this.returnTypes = frozen(returnTypes);
            this.name = name;
            this.params = frozen(params);
            this.body = frozen(body);
            this.results = frozen(results);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionStmt(this);
        }

        public final List<Token> returnTypes;
        public final Token name;
        public final List<Param> params;
        public final List<Stmt> body;
        public final List<Expr> results;
    }

    public static class ProcCall extends Stmt {
        ProcCall(Token name, List<Expr> args) {
            this.name = name;
            this.args = frozen(args);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProcCallStmt(this);
        }

        public final Token name;
        public final List<Expr> args;
    }

    public static class ProtocolVariant {
        ProtocolVariant(Token tag, List<Token> types) {
            this.tag = tag;
            this.types = frozen(types);
        }

        public final Token tag;
        public final List<Token> types; // payload, empty for a bare tag
    }

    public static class Protocol extends Stmt {
        public enum Kind {
            SIMPLE, SEQUENTIAL, VARIANT;

            @Override
            public String toString() {
                return name().toLowerCase();
            }
        }

        Protocol(Token name, Kind kind, List<Token> types, List<ProtocolVariant> variants) {
            this.name = name;
            this.kind = kind;
            this.types = frozen(types);
            this.variants = frozen(variants);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProtocolStmt(this);
        }

        boolean hasTag(String tag) {
            if (kind != Kind.VARIANT) return false;
            for (ProtocolVariant variant : variants) {
                if (variant.tag.lexeme.equals(tag)) return true;
            }
            return false;
        }

        public final Token name;
        public final Kind kind;
        public final List<Token> types; // simple and sequential protocols
        public final List<ProtocolVariant> variants; // variant protocols
    }

    public static class RecordField {
        RecordField(Token type, Token name) {
            this.type = type;
            this.name = name;
        }

        public final Token type;
        public final Token name;
    }

    public static class Record extends Stmt {
        Record(Token name, List<RecordField> fields) {
            this.name = name;
            this.fields = frozen(fields);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRecordStmt(this);
        }

        public final Token name;
        public final List<RecordField> fields;
    }

    public static class Skip extends Stmt {
        Skip(Token keyword) {
            this.keyword = keyword;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSkipStmt(this);
        }

        public final Token keyword;
    }

    public static class Stop extends Stmt {
        Stop(Token keyword) {
            this.keyword = keyword;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStopStmt(this);
        }

        public final Token keyword;
    }
}
