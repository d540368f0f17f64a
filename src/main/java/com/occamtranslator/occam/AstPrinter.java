package com.occamtranslator.occam;

import java.io.IOException;
import java.util.List;

public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
    private int indent = 0;

    public static boolean silenceErrorOutput = false;
    public static String PARSE_ERROR = "!error!";

    public static void main(String[] args) throws IOException {
        String fname = null;
        String src = null;
        boolean printTokens = false;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length) {
                fname = args[i+1];
                i = i + 2;
            } else if (args[i].equals("-s") && i + 1 < args.length) {
                src = args[i+1];
                i = i + 2;
            } else if (args[i].equals("-t")) {
                printTokens = true;
                i++;
            } else if (args[i].equals("-D") && i + 1 < args.length) {
                Occam.parseDebugKeys(args[i+1]);
                i = i + 2;
            } else {
                System.err.println("Usage: AstPrinter [-f FILENAME] [-s SRC] [-t] [-D KEYS]");
                System.exit(1);
            }
        }

        if (src == null && fname == null) {
            Occam.runPrompt();
            return;
        }
        if (src == null) {
            src = OccamUtil.readFile(fname);
        }

        if (printTokens || Occam.isDebug("tokens")) {
            System.out.print(tokensToString(src));
        }
        if (!printTokens) {
            Program program = Occam.parse(src);
            if (Occam.hadError) {
                System.err.println("[Warning]: parse error");
            }
            System.out.println("Result:");
            System.out.print(new AstPrinter().programToString(program));
        }
        if (Occam.hadError) System.exit(65);
    }

    /**
     * Returns the tree of {@code src}, one top-level statement per line, or
     * {@link #PARSE_ERROR} if the parser reported anything.
     */
    public static String print(String src) {
        boolean silenceErrorsOld = Occam.silenceParseErrors;
        if (silenceErrorOutput) {
            Occam.silenceParseErrors = true;
        }
        Parser parser = Parser.newFromSource(src);
        Program program = parser.parseProgram();
        for (ParseError error : parser.parseErrors()) {
            Occam.error(error.line(), error.message());
        }
        Occam.silenceParseErrors = silenceErrorsOld;
        if (!parser.parseErrors().isEmpty()) {
            return PARSE_ERROR;
        }
        return new AstPrinter().programToString(program);
    }

    // one token per line: line:column TYPE lexeme
    static String tokensToString(String src) {
        StringBuilder builder = new StringBuilder();
        for (Token tok : new Lexer(src).scanTokens()) {
            if (tok.type == TokenType.ILLEGAL) {
                Occam.error(tok, "unexpected character");
            }
            builder.append(tok.line).append(":").append(tok.column)
                   .append(" ").append(tok.type.name());
            if (!tok.lexeme.isEmpty() && tok.type != TokenType.NEWLINE) {
                builder.append(" ").append(tok.lexeme);
            }
            builder.append("\n");
        }
        return builder.toString();
    }

    public String programToString(Program program) {
        return stmtsToString(program.statements);
    }

    public String stmtsToString(List<Stmt> stmts) {
        StringBuilder builder = new StringBuilder();
        for (Stmt stmt : stmts) {
            builder.append(stmt.accept(this));
            builder.append("\n");
        }
        return builder.toString();
    }

    public String exprToString(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitVarDeclStmt(Stmt.VarDecl stmt) {
        return indent() + "(varDecl " + stmt.type.lexeme + tokens(stmt.names) + ")";
    }

    @Override
    public String visitArrayDeclStmt(Stmt.ArrayDecl stmt) {
        return indent() + "(arrayDecl " + dims(stmt.sizes) + stmt.type.lexeme +
            tokens(stmt.names) + ")";
    }

    @Override
    public String visitChanDeclStmt(Stmt.ChanDecl stmt) {
        return indent() + "(chanDecl " + dims(stmt.sizes) + stmt.elemType.lexeme +
            tokens(stmt.names) + ")";
    }

    @Override
    public String visitTimerDeclStmt(Stmt.TimerDecl stmt) {
        return indent() + "(timerDecl" + tokens(stmt.names) + ")";
    }

    @Override
    public String visitAbbreviationStmt(Stmt.Abbreviation stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(abbrev");
        if (stmt.isVal) builder.append(" VAL");
        if (stmt.isInitial) builder.append(" INITIAL");
        if (stmt.type != null) {
            builder.append(" ");
            for (int i = 0; i < stmt.openArrayDims; i++) {
                builder.append("[]");
            }
            if (stmt.arraySize != null) {
                builder.append("[" + exprToString(stmt.arraySize) + "]");
            }
            builder.append(stmt.type.lexeme);
        }
        builder.append(" " + stmt.name.lexeme + " " + exprToString(stmt.value) + ")");
        return builder.toString();
    }

    @Override
    public String visitRetypesStmt(Stmt.Retypes stmt) {
        String type = stmt.type.lexeme;
        if (stmt.isArray()) {
            type = "[" + exprToString(stmt.arraySize) + "]" + type;
        }
        return indent() + "(retypes " + type + " " + stmt.name.lexeme + " " +
            stmt.source.lexeme + ")";
    }

    @Override
    public String visitAssignStmt(Stmt.Assign stmt) {
        return indent() + "(assign " + target(stmt.name, stmt.indices) + " " +
            exprToString(stmt.value) + ")";
    }

    @Override
    public String visitSliceAssignStmt(Stmt.SliceAssign stmt) {
        return indent() + "(assign " + exprToString(stmt.target) + " " +
            exprToString(stmt.value) + ")";
    }

    @Override
    public String visitMultiAssignStmt(Stmt.MultiAssign stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(multiAssign (");
        for (int i = 0; i < stmt.targets.size(); i++) {
            Stmt.AssignTarget target = stmt.targets.get(i);
            if (i > 0) builder.append(" ");
            builder.append(target(target.name, target.indices));
        }
        builder.append(")" + exprs(stmt.values) + ")");
        return builder.toString();
    }

    @Override
    public String visitSendStmt(Stmt.Send stmt) {
        String channel = target(stmt.channel, stmt.channelIndices);
        if (stmt.isVariant()) {
            return indent() + "(send " + channel + " (tag " + stmt.variantTag.lexeme + ")" +
                exprs(stmt.values) + ")";
        }
        return indent() + "(send " + channel + exprs(stmt.values) + ")";
    }

    @Override
    public String visitReceiveStmt(Stmt.Receive stmt) {
        return indent() + "(receive " + target(stmt.channel, stmt.channelIndices) +
            exprs(stmt.targets) + ")";
    }

    @Override
    public String visitTimerReadStmt(Stmt.TimerRead stmt) {
        return indent() + "(timerRead " + stmt.timer.lexeme + " " +
            exprToString(stmt.target) + ")";
    }

    @Override
    public String visitVariantReceiveStmt(Stmt.VariantReceive stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(variantReceive " +
            target(stmt.channel, stmt.channelIndices) + "\n");
        indent++;
        for (Stmt.VariantCase variantCase : stmt.cases) {
            builder.append(indent() + "(case " + variantCase.tag.lexeme +
                tokens(variantCase.variables) + "\n");
            builder.append(body(variantCase.body));
            builder.append(indent() + ")\n");
        }
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitSeqStmt(Stmt.Seq stmt) {
        return block("seq" + replicator(stmt.replicator), stmt.statements);
    }

    @Override
    public String visitParStmt(Stmt.Par stmt) {
        String name = stmt.priority ? "priPar" : "par";
        return block(name + replicator(stmt.replicator), stmt.statements);
    }

    @Override
    public String visitAltStmt(Stmt.Alt stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(" + (stmt.priority ? "priAlt" : "alt") +
            replicator(stmt.replicator) + "\n");
        indent++;
        for (Stmt.AltCase altCase : stmt.cases) {
            builder.append(indent() + "(altCase");
            if (altCase.guard != null) {
                builder.append(" (guard " + exprToString(altCase.guard) + ")");
            }
            switch (altCase.kind) {
                case SKIP:
                    builder.append(" SKIP");
                    break;
                case TIMER:
                    builder.append(" (after " + altCase.channel.lexeme + " " +
                        exprToString(altCase.deadline) + ")");
                    break;
                default:
                    builder.append(" (receive " + target(altCase.channel, altCase.channelIndices) +
                        " " + exprToString(altCase.target) + ")");
            }
            builder.append("\n");
            indent++;
            for (Stmt decl : altCase.declarations) {
                builder.append(decl.accept(this) + "\n");
            }
            indent--;
            builder.append(body(altCase.body));
            builder.append(indent() + ")\n");
        }
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(if" + replicator(stmt.replicator) + "\n");
        indent++;
        for (Stmt.IfChoice choice : stmt.choices) {
            if (choice.nested != null) {
                builder.append(choice.nested.accept(this) + "\n");
                continue;
            }
            builder.append(indent() + "(choice " + exprToString(choice.condition) + "\n");
            builder.append(body(choice.body));
            builder.append(indent() + ")\n");
        }
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitCaseStmt(Stmt.Case stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(case " + exprToString(stmt.selector) + "\n");
        indent++;
        for (Stmt.CaseChoice choice : stmt.choices) {
            if (choice.isElse) {
                builder.append(indent() + "(else\n");
            } else {
                builder.append(indent() + "(choice" + exprs(choice.values) + "\n");
            }
            builder.append(body(choice.body));
            builder.append(indent() + ")\n");
        }
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitWhileStmt(Stmt.While stmt) {
        return block("while " + exprToString(stmt.condition), stmt.body);
    }

    @Override
    public String visitProcStmt(Stmt.Proc stmt) {
        return block("proc " + stmt.name.lexeme + " " + params(stmt.params), stmt.body);
    }

    @Override
    public String visitFunctionStmt(Stmt.Function stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(function (");
        for (int i = 0; i < stmt.returnTypes.size(); i++) {
            if (i > 0) builder.append(" ");
            builder.append(stmt.returnTypes.get(i).lexeme);
        }
        builder.append(") " + stmt.name.lexeme + " " + params(stmt.params) + "\n");
        builder.append(body(stmt.body));
        indent++;
        builder.append(indent() + "(result" + exprs(stmt.results) + ")\n");
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitProcCallStmt(Stmt.ProcCall stmt) {
        return indent() + "(call " + stmt.name.lexeme + exprs(stmt.args) + ")";
    }

    @Override
    public String visitProtocolStmt(Stmt.Protocol stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(protocol " + stmt.name.lexeme + " " + stmt.kind);
        if (stmt.kind != Stmt.Protocol.Kind.VARIANT) {
            return builder.append(tokens(stmt.types) + ")").toString();
        }
        for (Stmt.ProtocolVariant variant : stmt.variants) {
            builder.append(" (" + variant.tag.lexeme + tokens(variant.types) + ")");
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitRecordStmt(Stmt.Record stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(record " + stmt.name.lexeme);
        for (Stmt.RecordField field : stmt.fields) {
            builder.append(" (" + field.type.lexeme + " " + field.name.lexeme + ")");
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitSkipStmt(Stmt.Skip stmt) {
        return indent() + "(skip)";
    }

    @Override
    public String visitStopStmt(Stmt.Stop stmt) {
        return indent() + "(stop)";
    }

    @Override
    public String visitIdentifierExpr(Expr.Identifier expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitIntegerLiteralExpr(Expr.IntegerLiteral expr) {
        return Long.toString(expr.value);
    }

    @Override
    public String visitBooleanLiteralExpr(Expr.BooleanLiteral expr) {
        return expr.value ? "TRUE" : "FALSE";
    }

    @Override
    public String visitStringLiteralExpr(Expr.StringLiteral expr) {
        return "\"" + OccamUtil.escape(expr.value) + "\"";
    }

    @Override
    public String visitByteLiteralExpr(Expr.ByteLiteral expr) {
        return "'" + OccamUtil.escape(String.valueOf((char) expr.value)) + "'";
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return parenthesize(expr.op, expr.right);
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return parenthesize("group", expr.expression);
    }

    @Override
    public String visitIndexExpr(Expr.Index expr) {
        return parenthesize("index", expr.left, expr.index);
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        return "(call " + expr.name.lexeme + exprs(expr.args) + ")";
    }

    @Override
    public String visitConversionExpr(Expr.Conversion expr) {
        String name = expr.type.lexeme;
        if (expr.qualifier != null) {
            name = name + " " + expr.qualifier.lexeme;
        }
        return parenthesize(name, expr.expression);
    }

    @Override
    public String visitSizeExpr(Expr.Size expr) {
        return parenthesize("SIZE", expr.expression);
    }

    @Override
    public String visitMostExpr(Expr.Most expr) {
        return "(" + expr.keyword.lexeme + " " + expr.type.lexeme + ")";
    }

    @Override
    public String visitArrayLiteralExpr(Expr.ArrayLiteral expr) {
        return "(array" + exprs(expr.elements) + ")";
    }

    @Override
    public String visitSliceExpr(Expr.Slice expr) {
        return parenthesize("slice", expr.array, expr.start, expr.length);
    }

    private String block(String header, List<Stmt> stmts) {
        StringBuilder builder = new StringBuilder();
        if (stmts.size() == 0) {
            return builder.append(indent() + "(" + header + ")").toString();
        }
        builder.append(indent() + "(" + header + "\n");
        builder.append(body(stmts));
        builder.append(indent() + ")");
        return builder.toString();
    }

    // statements one level deeper, each on its own line
    private String body(List<Stmt> stmts) {
        StringBuilder builder = new StringBuilder();
        indent++;
        for (Stmt stmt : stmts) {
            builder.append(stmt.accept(this));
            builder.append("\n");
        }
        indent--;
        return builder.toString();
    }

    private String replicator(Replicator rep) {
        if (rep == null) return "";
        StringBuilder builder = new StringBuilder();
        builder.append(" (for " + rep.variable.lexeme + " " + exprToString(rep.start) +
            " " + exprToString(rep.count));
        if (rep.step != null) {
            builder.append(" " + exprToString(rep.step));
        }
        builder.append(")");
        return builder.toString();
    }

    private String params(List<Param> params) {
        StringBuilder builder = new StringBuilder();
        builder.append("(");
        for (int i = 0; i < params.size(); i++) {
            Param param = params.get(i);
            if (i > 0) builder.append(" ");
            builder.append("(");
            if (param.isVal) builder.append("VAL ");
            if (param.isResult) builder.append("RESULT ");
            if (param.arraySize != null) {
                builder.append("[" + param.arraySize.lexeme + "]");
            }
            for (int d = 0; d < param.chanArrayDims + param.openArrayDims; d++) {
                builder.append("[]");
            }
            if (param.isChan) builder.append("CHAN ");
            builder.append(param.type.lexeme + " " + param.name.lexeme + param.chanDir + ")");
        }
        builder.append(")");
        return builder.toString();
    }

    // name[i][j]
    private String target(Token name, List<Expr> indices) {
        StringBuilder builder = new StringBuilder(name.lexeme);
        for (Expr index : indices) {
            builder.append("[" + exprToString(index) + "]");
        }
        return builder.toString();
    }

    private String dims(List<Expr> sizes) {
        StringBuilder builder = new StringBuilder();
        for (Expr size : sizes) {
            builder.append("[" + exprToString(size) + "]");
        }
        return builder.toString();
    }

    private String tokens(List<Token> toks) {
        StringBuilder builder = new StringBuilder();
        for (Token tok : toks) {
            builder.append(" " + tok.lexeme);
        }
        return builder.toString();
    }

    private String exprs(List<Expr> exprs) {
        StringBuilder builder = new StringBuilder();
        for (Expr expr : exprs) {
            builder.append(" " + exprToString(expr));
        }
        return builder.toString();
    }

    private String parenthesize(String name, Expr... exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append("(").append(name);
        for (Expr expr : exprs) {
            builder.append(" ");
            builder.append(expr.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    private String indent() {
        StringBuilder builder = new StringBuilder();
        int i = indent;
        while (i > 0) {
            builder.append("  ");
            i--;
        }
        return builder.toString();
    }
}
