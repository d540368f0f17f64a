package com.occamtranslator.occam;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.occamtranslator.occam.TokenType.*;

/**
 * Recursive-descent parser over the token stream of a {@link Lexer}, with a
 * Pratt loop for expressions.
 *
 * <p>The parser looks at the current token and one token of lookahead only.
 * Where that is not enough (timer reads, variant sends, record variables)
 * it asks its {@link SymbolTable}, which holds what has been declared so far.
 *
 * <p>Errors never abort the parse. Each one is recorded with its line number
 * and the failing production returns null; parsing then carries on from
 * wherever the cursor stopped, which can produce follow-on errors.
 */
public class Parser {
    private enum Precedence {
        LOWEST,
        OR,
        AND,
        EQUALS,      // = <>
        LESSGREATER, // < > <= >= AFTER
        SUM,         // + - PLUS MINUS \/ ><
        PRODUCT,     // * / \ TIMES /\ << >>
        PREFIX,      // -x NOT x ~x, conversions, SIZE
        INDEX        // a[i]
    }

    private static final Map<TokenType, Precedence> precedences;

    static {
        precedences = new EnumMap<>(TokenType.class);
        precedences.put(OR,       Precedence.OR);
        precedences.put(AND,      Precedence.AND);
        precedences.put(EQ,       Precedence.EQUALS);
        precedences.put(NEQ,      Precedence.EQUALS);
        precedences.put(LT,       Precedence.LESSGREATER);
        precedences.put(GT,       Precedence.LESSGREATER);
        precedences.put(LE,       Precedence.LESSGREATER);
        precedences.put(GE,       Precedence.LESSGREATER);
        precedences.put(AFTER,    Precedence.LESSGREATER);
        precedences.put(PLUS,     Precedence.SUM);
        precedences.put(MINUS,    Precedence.SUM);
        precedences.put(PLUS_KW,  Precedence.SUM);
        precedences.put(MINUS_KW, Precedence.SUM);
        precedences.put(BITOR,    Precedence.SUM);
        precedences.put(BITXOR,   Precedence.SUM);
        precedences.put(MULTIPLY, Precedence.PRODUCT);
        precedences.put(DIVIDE,   Precedence.PRODUCT);
        precedences.put(MODULO,   Precedence.PRODUCT);
        precedences.put(TIMES,    Precedence.PRODUCT);
        precedences.put(BITAND,   Precedence.PRODUCT);
        precedences.put(LSHIFT,   Precedence.PRODUCT);
        precedences.put(RSHIFT,   Precedence.PRODUCT);
        precedences.put(LBRACKET, Precedence.INDEX);
    }

    private final Lexer lexer;
    private final List<ParseError> errors = new ArrayList<>();
    private final SymbolTable symbols = new SymbolTable();

    private Token cur;
    private Token peek;
    // INDENTs minus DEDENTs consumed so far
    private int indentLevel = 0;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        advance();
        advance();
    }

    public static Parser newFromSource(String source) {
        return new Parser(new Lexer(source));
    }

    public Program parseProgram() {
        List<Stmt> statements = new ArrayList<>();
        while (!curIs(EOF)) {
            Stmt stmt = statement();
            if (stmt != null) {
                statements.add(stmt);
                checkLineEnd();
            }
            advance();
        }
        return new Program(statements);
    }

    /** Errors in source order, each formatted as {@code line N: message}. */
    public List<String> errors() {
        List<String> messages = new ArrayList<>();
        for (ParseError error : errors) {
            messages.add(error.toString());
        }
        return messages;
    }

    public List<ParseError> parseErrors() {
        return Collections.unmodifiableList(errors);
    }

    SymbolTable symbols() {
        return symbols;
    }

    // Statements

    private Stmt statement() {
        skipNewlines();
        if (cur.type.isScalarType()) {
            if (peekIs(FUNCTION) || peekIs(FUNC) || peekIs(INLINE) || peekIs(COMMA)) {
                return functionDecl();
            }
            return varDeclOrAbbreviation();
        }

        switch (cur.type) {
            case VAL:      return valAbbreviation();
            case INITIAL:  return initialDecl();
            case LBRACKET: return arrayDeclOrSliceAssign();
            case CHAN:     return chanDecl(new ArrayList<>());
            case PROTOCOL: return protocolDecl();
            case RECORD:   return recordDecl();
            case TIMER:    return timerDecl();
            case SEQ:      return seqBlock();
            case PAR:      return parBlock(cur, false);
            case ALT:      return altBlock(cur, false);
            case PRI:      return priBlock();
            case SKIP:     return new Stmt.Skip(cur);
            case STOP:     return new Stmt.Stop(cur);
            case PROC:     return procDecl();
            case WHILE:    return whileLoop();
            case IF:       return ifStatement();
            case CASE:     return caseStatement();
            case IDENT:    return identStatement();
            case INDENT:
            case DEDENT:
            case EOF:
                // structural tokens belong to the enclosing block
                return null;
            case ILLEGAL:
                error("illegal token '" + cur.lexeme + "'");
                return null;
            default:
                error("unexpected token: " + cur.type);
                return null;
        }
    }

    private Stmt identStatement() {
        Token name = cur;
        if (symbols.isRecord(name.lexeme) && peekIs(IDENT)) {
            return varDeclOrAbbreviation();
        }
        if (peekIs(LBRACKET)) {
            return indexedStatement();
        }
        if (peekIs(ASSIGN)) {
            return assignment(name, new ArrayList<>());
        }
        if (peekIs(COMMA)) {
            return multiAssignment(new Stmt.AssignTarget(name, new ArrayList<>()));
        }
        if (peekIs(SEND)) {
            return send(name, new ArrayList<>());
        }
        if (peekIs(RECEIVE)) {
            if (symbols.isTimer(name.lexeme)) {
                return timerRead();
            }
            return receive(name, new ArrayList<>());
        }
        return procCall();
    }

    // name[i][j] followed by := , ! or ?
    private Stmt indexedStatement() {
        Token name = cur;
        List<Expr> indices = new ArrayList<>();
        while (peekIs(LBRACKET)) {
            advance();
            advance();
            Expr index = expression(Precedence.LOWEST);
            if (index == null) return null;
            indices.add(index);
            if (!expectPeek(RBRACKET)) return null;
        }

        switch (peek.type) {
            case COMMA:   return multiAssignment(new Stmt.AssignTarget(name, indices));
            case ASSIGN:  return assignment(name, indices);
            case SEND:    return send(name, indices);
            case RECEIVE: return receive(name, indices);
            default:
                error("expected :=, ! or ? after " + name.lexeme + "[...], got " + peek.type);
                return null;
        }
    }

    private Stmt assignment(Token name, List<Expr> indices) {
        advance();
        Token operator = cur;
        advance();
        Expr value = expression(Precedence.LOWEST);
        if (value == null) return null;
        return new Stmt.Assign(name, indices, operator, value);
    }

    // cur is the last token of the first target, peek is ','
    private Stmt multiAssignment(Stmt.AssignTarget first) {
        List<Stmt.AssignTarget> targets = new ArrayList<>();
        targets.add(first);
        while (peekIs(COMMA)) {
            advance();
            if (!expectPeek(IDENT)) return null;
            Token name = cur;
            List<Expr> indices = new ArrayList<>();
            while (peekIs(LBRACKET)) {
                advance();
                advance();
                Expr index = expression(Precedence.LOWEST);
                if (index == null) return null;
                indices.add(index);
                if (!expectPeek(RBRACKET)) return null;
            }
            targets.add(new Stmt.AssignTarget(name, indices));
        }

        if (!expectPeek(ASSIGN)) return null;
        Token operator = cur;
        advance();
        List<Expr> values = expressionList();
        if (values == null) return null;
        return new Stmt.MultiAssign(targets, operator, values);
    }

    private Stmt send(Token channel, List<Expr> indices) {
        advance();
        Token operator = cur;
        advance();

        // c ! tag ; x  needs the tag to be known already
        if (curIs(IDENT) && peekIs(SEMICOLON) && symbols.isVariantTag(cur.lexeme)) {
            Token tag = cur;
            List<Expr> payload = new ArrayList<>();
            while (peekIs(SEMICOLON)) {
                advance();
                advance();
                Expr value = expression(Precedence.LOWEST);
                if (value == null) return null;
                payload.add(value);
            }
            return new Stmt.Send(operator, channel, indices, tag, payload);
        }

        List<Expr> values = new ArrayList<>();
        Expr first = expression(Precedence.LOWEST);
        if (first == null) return null;
        values.add(first);
        while (peekIs(SEMICOLON)) {
            advance();
            advance();
            Expr value = expression(Precedence.LOWEST);
            if (value == null) return null;
            values.add(value);
        }
        return new Stmt.Send(operator, channel, indices, null, values);
    }

    private Stmt receive(Token channel, List<Expr> indices) {
        advance();
        Token operator = cur;
        if (peekIs(CASE)) {
            advance();
            return variantReceive(operator, channel, indices);
        }

        List<Expr> targets = new ArrayList<>();
        do {
            if (!targets.isEmpty()) advance(); // onto ';'
            Expr target = receiveTarget();
            if (target == null) return null;
            targets.add(target);
        } while (peekIs(SEMICOLON));
        return new Stmt.Receive(operator, channel, indices, targets);
    }

    private Stmt timerRead() {
        Token timer = cur;
        advance();
        Token operator = cur;
        Expr target = receiveTarget();
        if (target == null) return null;
        return new Stmt.TimerRead(operator, timer, target);
    }

    // x or a[i][j]; cur is the token before it
    private Expr receiveTarget() {
        if (!expectPeek(IDENT)) return null;
        Expr target = new Expr.Identifier(cur);
        while (peekIs(LBRACKET)) {
            advance();
            target = index(target);
            if (target == null) return null;
        }
        return target;
    }

    private Stmt variantReceive(Token operator, Token channel, List<Expr> indices) {
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after ? CASE");
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();

        List<Stmt.VariantCase> cases = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            if (!curIs(IDENT)) {
                error("expected variant tag name, got " + cur.type);
                finishLine();
                continue;
            }
            Token tag = cur;
            List<Token> variables = new ArrayList<>();
            while (peekIs(SEMICOLON)) {
                advance();
                if (!expectPeek(IDENT)) break;
                variables.add(cur);
            }
            List<Stmt> body = indentedBlock("variant tag " + tag.lexeme);
            if (body != null) {
                cases.add(new Stmt.VariantCase(tag, variables, body));
            }
            finishLine();
        }
        return new Stmt.VariantReceive(operator, channel, indices, cases);
    }

    private Stmt procCall() {
        Token name = cur;
        List<Expr> args = new ArrayList<>();
        if (!peekIs(LPAREN)) {
            return new Stmt.ProcCall(name, args);
        }
        advance();
        if (peekIs(RPAREN)) {
            advance();
            return new Stmt.ProcCall(name, args);
        }

        do {
            advance();
            Expr arg = expression(Precedence.LOWEST);
            if (arg == null) return null;
            args.add(arg);
            // direction annotation at the call site: foo(out!, in?)
            if (peekIs(SEND) || peekIs(RECEIVE)) {
                advance();
            }
        } while (matchPeek(COMMA));

        if (!expectPeek(RPAREN)) return null;
        return new Stmt.ProcCall(name, args);
    }

    // Declarations

    // INT x, y:  INT x IS y:  and the record-typed  POINT p:
    private Stmt varDeclOrAbbreviation() {
        Token type = cur;
        if (!expectPeek(IDENT)) return null;
        Token name = cur;

        if (peekIs(IS)) {
            advance();
            advance();
            Expr value = expression(Precedence.LOWEST);
            if (value == null) return null;
            if (!expectPeek(COLON)) return null;
            return new Stmt.Abbreviation(type, false, false, 0, null, type, name, value);
        }

        List<Token> names = new ArrayList<>();
        names.add(name);
        while (peekIs(COMMA)) {
            advance();
            if (!expectPeek(IDENT)) return null;
            names.add(cur);
        }
        if (!expectPeek(COLON)) return null;
        return new Stmt.VarDecl(type, names);
    }

    /*
     * VAL INT x IS e:         VAL []BYTE s IS "abc":    VAL x IS e:
     * VAL [4]INT t IS e:      VAL INT x RETYPES y:      VAL [2]INT x RETYPES y:
     */
    private Stmt valAbbreviation() {
        Token keyword = cur;
        advance();

        int openDims = 0;
        while (curIs(LBRACKET) && peekIs(RBRACKET)) {
            openDims++;
            advance();
            advance();
        }
        Expr arraySize = null;
        if (openDims == 0 && curIs(LBRACKET)) {
            advance();
            arraySize = expression(Precedence.LOWEST);
            if (arraySize == null) return null;
            if (!expectPeek(RBRACKET)) return null;
            advance();
        }

        if (openDims == 0 && arraySize == null && curIs(IDENT) && peekIs(IS)) {
            Token name = cur;
            advance();
            advance();
            Expr value = expression(Precedence.LOWEST);
            if (value == null) return null;
            if (!expectPeek(COLON)) return null;
            return new Stmt.Abbreviation(keyword, true, false, 0, null, null, name, value);
        }

        if (!isTypeName(cur)) {
            error("expected type after VAL, got " + cur.type);
            return null;
        }
        Token type = cur;
        if (!expectPeek(IDENT)) return null;
        Token name = cur;

        if (peekIs(RETYPES)) {
            advance();
            if (!expectPeek(IDENT)) return null;
            Token source = cur;
            if (!expectPeek(COLON)) return null;
            return new Stmt.Retypes(keyword, arraySize, type, name, source);
        }
        if (!peekIs(IS)) {
            error("expected IS or RETYPES, got " + peek.type);
            return null;
        }
        advance();
        advance();
        Expr value = expression(Precedence.LOWEST);
        if (value == null) return null;
        if (!expectPeek(COLON)) return null;
        return new Stmt.Abbreviation(keyword, true, false, openDims, arraySize, type, name, value);
    }

    // INITIAL INT x IS e:
    private Stmt initialDecl() {
        Token keyword = cur;
        advance();
        if (!cur.type.isScalarType()) {
            error("expected type after INITIAL, got " + cur.type);
            return null;
        }
        Token type = cur;
        if (!expectPeek(IDENT)) return null;
        Token name = cur;
        if (!expectPeek(IS)) return null;
        advance();
        Expr value = expression(Precedence.LOWEST);
        if (value == null) return null;
        if (!expectPeek(COLON)) return null;
        return new Stmt.Abbreviation(keyword, false, true, 0, null, type, name, value);
    }

    /*
     * [3][4]INT grid:    [2]CHAN OF INT cs:
     * [arr FROM s FOR n] := v    [arr FOR n] := v
     */
    private Stmt arrayDeclOrSliceAssign() {
        Token lbracket = cur;
        advance();
        Expr first = expression(Precedence.LOWEST);
        if (first == null) return null;
        if (peekIs(FROM) || peekIs(FOR)) {
            return sliceAssignment(lbracket, first);
        }
        if (!expectPeek(RBRACKET)) return null;

        List<Expr> sizes = new ArrayList<>();
        sizes.add(first);
        while (peekIs(LBRACKET)) {
            advance();
            advance();
            Expr size = expression(Precedence.LOWEST);
            if (size == null) return null;
            sizes.add(size);
            if (!expectPeek(RBRACKET)) return null;
        }

        advance();
        if (curIs(CHAN)) {
            return chanDecl(sizes);
        }
        if (!isTypeName(cur)) {
            error("expected type after array size, got " + cur.type);
            return null;
        }
        Token type = cur;
        List<Token> names = nameList();
        if (names == null) return null;
        if (!expectPeek(COLON)) return null;
        return new Stmt.ArrayDecl(lbracket, sizes, type, names);
    }

    private Stmt sliceAssignment(Token lbracket, Expr array) {
        Expr.Slice target = slice(lbracket, array);
        if (target == null) return null;
        if (!expectPeek(ASSIGN)) return null;
        Token operator = cur;
        advance();
        Expr value = expression(Precedence.LOWEST);
        if (value == null) return null;
        return new Stmt.SliceAssign(target, operator, value);
    }

    // CHAN OF INT c:  or  CHAN INT c:  cur is CHAN
    private Stmt chanDecl(List<Expr> sizes) {
        Token keyword = cur;
        if (peekIs(OF)) {
            advance();
        }
        advance();
        if (!cur.type.isScalarType() && !curIs(IDENT)) {
            error("expected type after CHAN, got " + cur.type);
            return null;
        }
        Token elemType = cur;
        List<Token> names = nameList();
        if (names == null) return null;
        if (!expectPeek(COLON)) return null;
        return new Stmt.ChanDecl(keyword, sizes, elemType, names);
    }

    private Stmt timerDecl() {
        Token keyword = cur;
        List<Token> names = nameList();
        if (names == null) return null;
        if (!expectPeek(COLON)) return null;
        for (Token name : names) {
            symbols.declareTimer(name.lexeme);
        }
        return new Stmt.TimerDecl(keyword, names);
    }

    /*
     * PROTOCOL P IS INT:       PROTOCOL P IS INT; BYTE:
     * PROTOCOL P
     *   CASE
     *     tag; INT
     *     other
     * :
     */
    private Stmt protocolDecl() {
        int declLevel = indentLevel;
        if (!expectPeek(IDENT)) return null;
        Token name = cur;

        if (peekIs(NEWLINE) || peekIs(INDENT)) {
            skipPeekNewlines();
            if (peekIs(INDENT)) {
                advance();
                advance();
                if (curIs(CASE)) {
                    List<Stmt.ProtocolVariant> variants = protocolVariants();
                    if (variants == null) return null;
                    skipToLevel(declLevel, "variant protocol cases");
                    optionalColon();
                    Stmt.Protocol protocol = new Stmt.Protocol(name, Stmt.Protocol.Kind.VARIANT,
                            new ArrayList<>(), variants);
                    symbols.declareProtocol(protocol);
                    return protocol;
                }
            }
            error("expected IS or CASE in protocol declaration");
            return null;
        }

        if (!expectPeek(IS)) return null;
        List<Token> types = new ArrayList<>();
        do {
            advance();
            Token type = protocolType();
            if (type == null) return null;
            types.add(type);
        } while (matchPeek(SEMICOLON));
        optionalColon();

        Stmt.Protocol.Kind kind = types.size() == 1
            ? Stmt.Protocol.Kind.SIMPLE
            : Stmt.Protocol.Kind.SEQUENTIAL;
        Stmt.Protocol protocol = new Stmt.Protocol(name, kind, types, new ArrayList<>());
        symbols.declareProtocol(protocol);
        return protocol;
    }

    private List<Stmt.ProtocolVariant> protocolVariants() {
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after CASE in protocol");
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();

        List<Stmt.ProtocolVariant> variants = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            if (!curIs(IDENT)) {
                error("expected variant tag name, got " + cur.type);
                return null;
            }
            Token tag = cur;
            List<Token> types = new ArrayList<>();
            while (matchPeek(SEMICOLON)) {
                advance();
                Token type = protocolType();
                if (type == null) return null;
                types.add(type);
            }
            variants.add(new Stmt.ProtocolVariant(tag, types));
            finishLine();
        }
        return variants;
    }

    private Token protocolType() {
        if (cur.type.isScalarType() || curIs(IDENT)) {
            return cur;
        }
        error("expected type name in protocol, got " + cur.type);
        return null;
    }

    /*
     * RECORD POINT
     *   INT x, y:
     * :
     */
    private Stmt recordDecl() {
        if (!expectPeek(IDENT)) return null;
        Token name = cur;
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after RECORD declaration");
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();

        List<Stmt.RecordField> fields = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            if (!isTypeName(cur)) {
                error("expected type in record field, got " + cur.type);
                return null;
            }
            Token type = cur;
            List<Token> names = nameList();
            if (names == null) return null;
            if (!expectPeek(COLON)) return null;
            for (Token field : names) {
                fields.add(new Stmt.RecordField(type, field));
            }
            finishLine();
        }
        optionalColon();

        Stmt.Record record = new Stmt.Record(name, fields);
        symbols.declareRecord(record);
        return record;
    }

    private Stmt procDecl() {
        if (!expectPeek(IDENT)) return null;
        Token name = cur;
        if (!expectPeek(LPAREN)) return null;
        List<Param> params = params();
        if (params == null) return null;
        if (!expectPeek(RPAREN)) return null;

        List<Stmt> body = indentedBlock("PROC declaration");
        if (body == null) return null;
        optionalColon();
        return new Stmt.Proc(name, params, body);
    }

    /*
     * INT FUNCTION f(VAL INT x) IS x * x:
     * INT, INT FUNCTION g(VAL INT x)
     *   INT y:
     *   VALOF
     *     y := x
     *     RESULT x, y
     * :
     */
    private Stmt functionDecl() {
        int funcLevel = indentLevel;
        List<Token> returnTypes = new ArrayList<>();
        returnTypes.add(cur);
        while (matchPeek(COMMA)) {
            advance();
            if (!cur.type.isScalarType()) {
                error("expected return type, got " + cur.type);
                return null;
            }
            returnTypes.add(cur);
        }
        matchPeek(INLINE);
        if (!peekIs(FUNCTION) && !peekIs(FUNC)) {
            error("expected FUNCTION, got " + peek.type);
            return null;
        }
        advance();
        if (!expectPeek(IDENT)) return null;
        Token name = cur;
        if (!expectPeek(LPAREN)) return null;
        List<Param> declared = params();
        if (declared == null) return null;
        if (!expectPeek(RPAREN)) return null;

        // FUNCTION parameters are always passed by value
        List<Param> params = new ArrayList<>();
        for (Param param : declared) {
            params.add(param.asVal());
        }

        List<Stmt> body = new ArrayList<>();
        List<Expr> results = new ArrayList<>();

        if (peekIs(IS)) {
            advance();
            advance();
            Expr result = expression(Precedence.LOWEST);
            if (result == null) return null;
            results.add(result);
            optionalColon();
            return new Stmt.Function(returnTypes, name, params, body, results);
        }

        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented body after FUNCTION declaration");
            return null;
        }
        advance();
        int bodyLevel = indentLevel;
        advance();

        boolean ok;
        String end;
        if (curIs(IS)) {
            end = "IS expression";
            advance();
            Expr result = expression(Precedence.LOWEST);
            ok = result != null;
            results.add(result);
        } else {
            end = "RESULT";
            ok = valof(bodyLevel, body, results);
        }

        skipToLevel(funcLevel, ok ? end : null);
        optionalColon();
        if (!ok) return null;
        return new Stmt.Function(returnTypes, name, params, body, results);
    }

    // local declarations, VALOF, its process and the RESULT list
    private boolean valof(int bodyLevel, List<Stmt> body, List<Expr> results) {
        while (!atBlockEnd(bodyLevel) && !curIs(VALOF)) {
            Stmt decl = statement();
            if (decl != null) {
                body.add(decl);
                checkLineEnd();
            }
            finishLine();
        }
        if (!curIs(VALOF)) {
            error("expected VALOF or IS in function body, got " + cur.type);
            return false;
        }

        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after VALOF");
            return false;
        }
        advance();
        int valofLevel = indentLevel;
        advance();

        while (!atBlockEnd(valofLevel) && !curIs(RESULT)) {
            Stmt stmt = statement();
            if (stmt != null) {
                body.add(stmt);
                checkLineEnd();
            }
            finishLine();
        }
        if (!curIs(RESULT)) {
            error("expected RESULT in VALOF, got " + cur.type);
            return false;
        }
        advance();
        List<Expr> values = expressionList();
        if (values == null) return false;
        results.addAll(values);
        return true;
    }

    // cur is '('; leaves cur on the last token before ')'
    private List<Param> params() {
        List<Param> params = new ArrayList<>();
        if (peekIs(RPAREN)) {
            return params;
        }
        advance();

        Param prev = null;
        while (true) {
            skipNewlines();
            Param param;
            if (prev != null && curIs(IDENT) && !symbols.isRecord(cur.lexeme)) {
                // VAL INT a, b: b takes a's type
                Token name = cur;
                param = prev.sharing(name, direction(prev.isChan));
            } else {
                param = param();
                if (param == null) return null;
            }
            params.add(param);
            prev = param;

            if (!matchPeek(COMMA)) break;
            advance();
        }
        return params;
    }

    private Param param() {
        boolean isVal = false;
        boolean isResult = false;
        if (curIs(VAL)) {
            isVal = true;
            advance();
        }
        if (curIs(RESULT)) {
            isResult = true;
            advance();
        }

        int dims = 0;
        while (curIs(LBRACKET) && peekIs(RBRACKET)) {
            dims++;
            advance();
            advance();
        }
        Token arraySize = null;
        if (dims == 0 && curIs(LBRACKET)) {
            advance();
            if (!curIs(INT)) {
                error("expected array size, got " + cur.type);
                return null;
            }
            arraySize = cur;
            if (!expectPeek(RBRACKET)) return null;
            advance();
        }

        boolean isChan = false;
        Token type;
        if (curIs(CHAN)) {
            isChan = true;
            if (peekIs(OF)) {
                advance();
            }
            advance();
            if (!cur.type.isScalarType() && !curIs(IDENT)) {
                error("expected type after CHAN, got " + cur.type);
                return null;
            }
            type = cur;
        } else if (isTypeName(cur)) {
            type = cur;
        } else {
            error("expected type in parameter, got " + cur.type);
            return null;
        }

        if (!expectPeek(IDENT)) return null;
        Token name = cur;
        String dir = direction(isChan);
        return new Param(isVal, isResult, type, name, isChan,
                isChan ? dims : 0, isChan ? 0 : dims, arraySize, dir);
    }

    // optional ? or ! after a channel parameter name
    private String direction(boolean isChan) {
        if (isChan && (peekIs(RECEIVE) || peekIs(SEND))) {
            advance();
            return cur.lexeme;
        }
        return "";
    }

    // Blocks

    private Stmt seqBlock() {
        Token keyword = cur;
        Replicator replicator = null;
        if (peekIs(IDENT)) {
            replicator = replicatorAfter(keyword);
            if (replicator == null) return null;
        }
        List<Stmt> body = indentedBlock("SEQ");
        if (body == null) return null;
        return new Stmt.Seq(keyword, replicator, body);
    }

    private Stmt parBlock(Token keyword, boolean priority) {
        Replicator replicator = null;
        if (peekIs(IDENT)) {
            replicator = replicatorAfter(cur);
            if (replicator == null) return null;
        }
        List<Stmt> body = indentedBlock("PAR");
        if (body == null) return null;
        return new Stmt.Par(keyword, priority, replicator, body);
    }

    private Stmt priBlock() {
        Token keyword = cur;
        if (peekIs(PAR)) {
            advance();
            return parBlock(keyword, true);
        }
        if (peekIs(ALT)) {
            advance();
            return altBlock(keyword, true);
        }
        error("expected PAR or ALT after PRI, got " + peek.type);
        return null;
    }

    private Stmt altBlock(Token keyword, boolean priority) {
        Replicator replicator = null;
        if (peekIs(IDENT)) {
            replicator = replicatorAfter(cur);
            if (replicator == null) return null;
        }
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after ALT");
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();

        List<Stmt.AltCase> cases = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            Stmt.AltCase altCase = altCase();
            if (altCase != null) {
                cases.add(altCase);
            }
            finishLine();
        }
        return new Stmt.Alt(keyword, priority, replicator, cases);
    }

    /*
     * One alternative, optionally preceded by its own declarations:
     *   c ? x          cs[i] ? x        tim ? AFTER t
     *   ok & c ? x     ok & SKIP
     * followed by an indented body.
     */
    private Stmt.AltCase altCase() {
        List<Stmt> declarations = new ArrayList<>();
        while (isDeclarationStart()) {
            Stmt decl = statement();
            if (decl == null) return null;
            declarations.add(decl);
            checkLineEnd();
            finishLine();
            skipNewlines();
        }

        Expr guard = null;
        Expr input = expression(Precedence.LOWEST);
        if (input == null) return null;
        if (peekIs(AMPERSAND)) {
            guard = input;
            advance();
            advance();
            if (curIs(SKIP)) {
                List<Stmt> body = indentedBlock("ALT case");
                if (body == null) return null;
                return new Stmt.AltCase(declarations, guard, Stmt.AltCase.Kind.SKIP,
                        null, new ArrayList<>(), null, null, body);
            }
            input = expression(Precedence.LOWEST);
            if (input == null) return null;
        }

        List<Expr> indices = new ArrayList<>();
        Token channel = channelName(input, indices);
        if (channel == null) {
            error(input.token(), "expected channel input in ALT case");
            return null;
        }
        if (!expectPeek(RECEIVE)) return null;

        Stmt.AltCase.Kind kind;
        Expr target = null;
        Expr deadline = null;
        if (indices.isEmpty() && symbols.isTimer(channel.lexeme)) {
            kind = Stmt.AltCase.Kind.TIMER;
            if (!expectPeek(AFTER)) return null;
            advance();
            deadline = expression(Precedence.LOWEST);
            if (deadline == null) return null;
        } else {
            kind = Stmt.AltCase.Kind.CHANNEL;
            target = receiveTarget();
            if (target == null) return null;
        }

        List<Stmt> body = indentedBlock("ALT case");
        if (body == null) return null;
        return new Stmt.AltCase(declarations, guard, kind, channel, indices,
                target, deadline, body);
    }

    // name or name[i][j] used as a channel; indices are appended in order
    private Token channelName(Expr expr, List<Expr> indices) {
        if (expr instanceof Expr.Identifier) {
            return ((Expr.Identifier) expr).name;
        }
        if (expr instanceof Expr.Index) {
            Expr.Index index = (Expr.Index) expr;
            Token name = channelName(index.left, indices);
            indices.add(index.index);
            return name;
        }
        return null;
    }

    private boolean isDeclarationStart() {
        if (cur.type.isScalarType() || symbols.isRecord(cur.lexeme)) {
            return peekIs(IDENT);
        }
        switch (cur.type) {
            case VAL:
            case INITIAL:
            case CHAN:
            case TIMER:
            case LBRACKET:
                return true;
            default:
                return false;
        }
    }

    private Stmt ifStatement() {
        Token keyword = cur;
        Replicator replicator = null;
        if (peekIs(IDENT)) {
            replicator = replicatorAfter(keyword);
            if (replicator == null) return null;
        }
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after IF");
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();

        List<Stmt.IfChoice> choices = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            if (curIs(IF)) {
                Stmt nested = ifStatement();
                if (nested != null) {
                    choices.add(new Stmt.IfChoice(null, new ArrayList<>(), (Stmt.If) nested));
                }
            } else {
                Expr condition = expression(Precedence.LOWEST);
                List<Stmt> body = indentedBlock("IF condition");
                if (condition != null && body != null) {
                    choices.add(new Stmt.IfChoice(condition, body, null));
                }
            }
            finishLine();
        }
        return new Stmt.If(keyword, replicator, choices);
    }

    private Stmt caseStatement() {
        Token keyword = cur;
        advance();
        Expr selector = expression(Precedence.LOWEST);
        if (selector == null) return null;
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after CASE");
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();

        List<Stmt.CaseChoice> choices = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            boolean isElse = curIs(ELSE);
            List<Expr> values = new ArrayList<>();
            if (!isElse) {
                values = expressionList();
            }
            List<Stmt> body = indentedBlock("CASE choice");
            if (values != null && body != null) {
                choices.add(new Stmt.CaseChoice(values, isElse, body));
            }
            finishLine();
        }
        return new Stmt.Case(keyword, selector, choices);
    }

    private Stmt whileLoop() {
        Token keyword = cur;
        advance();
        Expr condition = expression(Precedence.LOWEST);
        if (condition == null) return null;
        List<Stmt> body = indentedBlock("WHILE condition");
        if (body == null) return null;
        return new Stmt.While(keyword, condition, body);
    }

    // keyword followed by an identifier: must be  i = start FOR count [STEP step]
    private Replicator replicatorAfter(Token keyword) {
        advance();
        if (!peekIs(EQ)) {
            error("unexpected identifier after " + keyword.lexeme);
            return null;
        }
        Token variable = cur;
        advance();
        advance();
        Expr start = expression(Precedence.LOWEST);
        if (start == null) return null;
        if (!expectPeek(FOR)) return null;
        advance();
        Expr count = expression(Precedence.LOWEST);
        if (count == null) return null;
        Expr step = null;
        if (matchPeek(STEP)) {
            advance();
            step = expression(Precedence.LOWEST);
            if (step == null) return null;
        }
        return new Replicator(variable, start, count, step);
    }

    /**
     * Parses the indented block that must follow the current line. Returns
     * the statements up to the DEDENT that closes it, or null after
     * recording an error when no block follows.
     */
    private List<Stmt> indentedBlock(String after) {
        skipPeekNewlines();
        if (!peekIs(INDENT)) {
            error("expected indented block after " + after);
            return null;
        }
        advance();
        int startLevel = indentLevel;
        advance();
        return blockStatements(startLevel);
    }

    private List<Stmt> blockStatements(int startLevel) {
        List<Stmt> statements = new ArrayList<>();
        while (!atBlockEnd(startLevel)) {
            Stmt stmt = statement();
            if (stmt != null) {
                statements.add(stmt);
                checkLineEnd();
            }
            finishLine();
        }
        return statements;
    }

    /*
     * Skips newlines and the DEDENTs of nested blocks. True once cur is the
     * DEDENT that takes the level below startLevel, or EOF.
     */
    private boolean atBlockEnd(int startLevel) {
        skipNewlines();
        while (curIs(DEDENT)) {
            if (indentLevel < startLevel) return true;
            advance();
            skipNewlines();
        }
        return curIs(EOF) || indentLevel < startLevel;
    }

    // moves off the last token of a statement, unless already at a line end
    private void finishLine() {
        if (!curIs(NEWLINE) && !curIs(DEDENT) && !curIs(EOF)) {
            advance();
        }
    }

    // cur is the last token of a statement: anything after it on the same
    // line is reported once and skipped
    private void checkLineEnd() {
        if (atLineEnd(cur) || atLineEnd(peek)) return;
        error(peek, "unexpected " + peek.type + " at end of statement");
        while (!atLineEnd(peek)) {
            advance();
        }
    }

    private boolean atLineEnd(Token token) {
        return token.type == NEWLINE || token.type == DEDENT || token.type == EOF;
    }

    /*
     * Discards the rest of a construct until the DEDENT back to level. The
     * first discarded token is reported as coming after the named part; with
     * no name the skip is silent, for constructs already in error.
     */
    private void skipToLevel(int level, String after) {
        finishLine();
        boolean reported = after == null;
        while (!curIs(EOF)) {
            if (curIs(DEDENT) && indentLevel <= level) break;
            if (!reported && !atLineEnd(cur)) {
                error("unexpected " + cur.type + " after " + after);
                reported = true;
            }
            advance();
        }
    }

    // PROC, FUNCTION, PROTOCOL and RECORD may end with a ':' line
    private void optionalColon() {
        matchPeek(COLON);
    }

    // Expressions

    private Expr expression(Precedence precedence) {
        Expr left = prefix();
        if (left == null) return null;

        while (!peekIs(NEWLINE) && !peekIs(EOF) && precedence.compareTo(peekPrecedence()) < 0) {
            advance();
            if (curIs(LBRACKET)) {
                left = index(left);
            } else {
                left = binary(left);
            }
            if (left == null) return null;
        }
        return left;
    }

    private Expr prefix() {
        if (cur.type.isScalarType()) {
            return conversion();
        }

        Token token = cur;
        switch (token.type) {
            case IDENT:
                if (peekIs(LPAREN)) return call();
                return new Expr.Identifier(token);
            case INT:
                if (token.literal == null) {
                    error("could not parse \"" + token.lexeme + "\" as integer");
                    return null;
                }
                return new Expr.IntegerLiteral(token, (Long) token.literal);
            case TRUE:
                return new Expr.BooleanLiteral(token, true);
            case FALSE:
                return new Expr.BooleanLiteral(token, false);
            case STRING:
                return new Expr.StringLiteral(token, (String) token.literal);
            case BYTE_LIT:
                if (token.literal == null) {
                    error("invalid byte literal " + token.lexeme);
                    return null;
                }
                return new Expr.ByteLiteral(token, (Integer) token.literal);
            case LPAREN: {
                advance();
                Expr inner = expression(Precedence.LOWEST);
                if (inner == null) return null;
                if (!expectPeek(RPAREN)) return null;
                return new Expr.Grouping(token, inner);
            }
            case MINUS:
            case MINUS_KW:
                return unary("-");
            case NOT:
                return unary("NOT");
            case BITNOT:
                return unary("~");
            case LBRACKET:
                return arrayLiteralOrSlice();
            case SIZE: {
                advance();
                Expr operand = expression(Precedence.PREFIX);
                if (operand == null) return null;
                return new Expr.Size(token, operand);
            }
            case MOSTNEG:
            case MOSTPOS:
                if (!peek.type.isScalarType()) {
                    error("expected type after " + token.lexeme + ", got " + peek.type);
                    return null;
                }
                advance();
                return new Expr.Most(token, cur);
            case ILLEGAL:
                error("illegal token '" + token.lexeme + "'");
                return null;
            default:
                error("unexpected token in expression: " + token.type);
                return null;
        }
    }

    private Expr unary(String op) {
        Token operator = cur;
        advance();
        Expr right = expression(Precedence.PREFIX);
        if (right == null) return null;
        return new Expr.Unary(operator, op, right);
    }

    // INT x, REAL32 ROUND x, INT TRUNC y
    private Expr conversion() {
        Token type = cur;
        Token qualifier = null;
        if (peekIs(ROUND) || peekIs(TRUNC)) {
            advance();
            qualifier = cur;
        }
        advance();
        Expr operand = expression(Precedence.PREFIX);
        if (operand == null) return null;
        return new Expr.Conversion(type, qualifier, operand);
    }

    private Expr binary(Expr left) {
        Token operator = cur;
        Precedence precedence = curPrecedence();
        advance();
        Expr right = expression(precedence);
        if (right == null) return null;
        return new Expr.Binary(left, operator, right);
    }

    // cur is '['
    private Expr index(Expr left) {
        Token lbracket = cur;
        advance();
        Expr index = expression(Precedence.LOWEST);
        if (index == null) return null;
        if (!expectPeek(RBRACKET)) return null;
        return new Expr.Index(lbracket, left, index);
    }

    private Expr call() {
        Token name = cur;
        advance();
        List<Expr> args = new ArrayList<>();
        if (matchPeek(RPAREN)) {
            return new Expr.Call(name, args);
        }
        advance();
        List<Expr> parsed = expressionList();
        if (parsed == null) return null;
        args.addAll(parsed);
        if (!expectPeek(RPAREN)) return null;
        return new Expr.Call(name, args);
    }

    // [a, b, c]  [a]  [arr FROM s FOR n]  [arr FOR n]
    private Expr arrayLiteralOrSlice() {
        Token lbracket = cur;
        advance();
        Expr first = expression(Precedence.LOWEST);
        if (first == null) return null;

        if (peekIs(COMMA) || peekIs(RBRACKET)) {
            List<Expr> elements = new ArrayList<>();
            elements.add(first);
            while (matchPeek(COMMA)) {
                advance();
                Expr element = expression(Precedence.LOWEST);
                if (element == null) return null;
                elements.add(element);
            }
            if (!expectPeek(RBRACKET)) return null;
            return new Expr.ArrayLiteral(lbracket, elements);
        }
        return slice(lbracket, first);
    }

    // cur is the last token of the array expression; consumes up to ']'
    private Expr.Slice slice(Token lbracket, Expr array) {
        Expr start;
        if (peekIs(FOR)) {
            Token zero = new Token(INT, "0", 0L, lbracket.line, lbracket.column);
            start = new Expr.IntegerLiteral(zero, 0);
        } else {
            if (!expectPeek(FROM)) return null;
            advance();
            start = expression(Precedence.LOWEST);
            if (start == null) return null;
        }
        if (!expectPeek(FOR)) return null;
        advance();
        Expr length = expression(Precedence.LOWEST);
        if (length == null) return null;
        if (!expectPeek(RBRACKET)) return null;
        return new Expr.Slice(lbracket, array, start, length);
    }

    // e, e, e starting at cur
    private List<Expr> expressionList() {
        List<Expr> exprs = new ArrayList<>();
        Expr first = expression(Precedence.LOWEST);
        if (first == null) return null;
        exprs.add(first);
        while (matchPeek(COMMA)) {
            advance();
            Expr next = expression(Precedence.LOWEST);
            if (next == null) return null;
            exprs.add(next);
        }
        return exprs;
    }

    // Helpers

    private List<Token> nameList() {
        List<Token> names = new ArrayList<>();
        do {
            if (!expectPeek(IDENT)) return null;
            names.add(cur);
        } while (matchPeek(COMMA));
        return names;
    }

    private boolean isTypeName(Token token) {
        return token.type.isScalarType()
            || (token.type == IDENT && symbols.isRecord(token.lexeme));
    }

    private Precedence peekPrecedence() {
        return precedences.getOrDefault(peek.type, Precedence.LOWEST);
    }

    private Precedence curPrecedence() {
        return precedences.getOrDefault(cur.type, Precedence.LOWEST);
    }

    private void advance() {
        cur = peek;
        peek = lexer.nextToken();
        if (cur == null) return;
        if (cur.type == INDENT) {
            indentLevel++;
        } else if (cur.type == DEDENT) {
            indentLevel--;
        }
    }

    private boolean curIs(TokenType ttype) {
        return cur.type == ttype;
    }

    private boolean peekIs(TokenType ttype) {
        return peek.type == ttype;
    }

    // advances onto peek when it has the given type
    private boolean matchPeek(TokenType ttype) {
        if (peekIs(ttype)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean expectPeek(TokenType ttype) {
        if (matchPeek(ttype)) {
            return true;
        }
        error("expected " + ttype + ", got " + peek.type);
        return false;
    }

    private void skipNewlines() {
        while (curIs(NEWLINE)) {
            advance();
        }
    }

    private void skipPeekNewlines() {
        while (peekIs(NEWLINE)) {
            advance();
        }
    }

    private void error(String message) {
        error(cur, message);
    }

    private void error(Token token, String message) {
        errors.add(new ParseError(token.line, message));
    }
}
