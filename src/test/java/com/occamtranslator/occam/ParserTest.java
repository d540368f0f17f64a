package com.occamtranslator.occam;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

import static com.occamtranslator.occam.TokenType.*;

public class ParserTest {

    private static List<Stmt> parse(String src) {
        Parser parser = Parser.newFromSource(src);
        Program program = parser.parseProgram();
        assertTrue("unexpected errors: " + parser.errors(), parser.errors().isEmpty());
        return program.statements;
    }

    private static List<String> errors(String src) {
        Parser parser = Parser.newFromSource(src);
        parser.parseProgram();
        return parser.errors();
    }

    @Test
    public void testEmptyProgram() {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("\n\n-- only a comment\n").isEmpty());
    }

    @Test
    public void testSeqWithDeclarationAssignmentAndSend() {
        String code = "SEQ\n" +
                      "  INT x:\n" +
                      "  x := 5\n" +
                      "  out ! x\n";
        List<Stmt> stmts = parse(code);
        assertEquals(1, stmts.size());
        Stmt.Seq seq = (Stmt.Seq) stmts.get(0);
        assertNull(seq.replicator);
        assertEquals(3, seq.statements.size());

        Stmt.VarDecl decl = (Stmt.VarDecl) seq.statements.get(0);
        assertEquals(INT_TYPE, decl.type.type);
        assertEquals("x", decl.names.get(0).lexeme);

        Stmt.Assign assign = (Stmt.Assign) seq.statements.get(1);
        assertEquals("x", assign.name.lexeme);
        assertEquals(5L, ((Expr.IntegerLiteral) assign.value).value);

        Stmt.Send send = (Stmt.Send) seq.statements.get(2);
        assertEquals("out", send.channel.lexeme);
        assertFalse(send.isVariant());
        assertEquals("x", ((Expr.Identifier) send.values.get(0)).name.lexeme);
    }

    @Test
    public void testVarDeclWithSeveralNames() {
        Stmt.VarDecl decl = (Stmt.VarDecl) parse("BOOL a, b, c:\n").get(0);
        assertEquals(BOOL_TYPE, decl.type.type);
        assertEquals(3, decl.names.size());
        assertEquals("c", decl.names.get(2).lexeme);
    }

    @Test
    public void testMultiDimensionalArray() {
        List<Stmt> stmts = parse("[3][4]INT grid:\n" +
                                 "grid[i][j] := 42\n");
        Stmt.ArrayDecl decl = (Stmt.ArrayDecl) stmts.get(0);
        assertEquals(2, decl.sizes.size());
        assertEquals(3L, ((Expr.IntegerLiteral) decl.sizes.get(0)).value);
        assertEquals(4L, ((Expr.IntegerLiteral) decl.sizes.get(1)).value);
        assertEquals("grid", decl.names.get(0).lexeme);

        Stmt.Assign assign = (Stmt.Assign) stmts.get(1);
        assertEquals(2, assign.indices.size());
        assertEquals("j", ((Expr.Identifier) assign.indices.get(1)).name.lexeme);
    }

    @Test
    public void testChannelArray() {
        List<Stmt> stmts = parse("[2]CHAN OF INT cs:\n" +
                                 "cs[0] ! 42\n");
        Stmt.ChanDecl decl = (Stmt.ChanDecl) stmts.get(0);
        assertEquals(1, decl.sizes.size());
        assertEquals(INT_TYPE, decl.elemType.type);
        assertEquals("cs", decl.names.get(0).lexeme);

        Stmt.Send send = (Stmt.Send) stmts.get(1);
        assertEquals(1, send.channelIndices.size());
        assertEquals(42L, ((Expr.IntegerLiteral) send.values.get(0)).value);
    }

    @Test
    public void testChanWithoutOf() {
        Stmt.ChanDecl decl = (Stmt.ChanDecl) parse("CHAN BYTE in, out:\n").get(0);
        assertTrue(decl.sizes.isEmpty());
        assertEquals(BYTE_TYPE, decl.elemType.type);
        assertEquals(2, decl.names.size());
    }

    @Test
    public void testTimerReadVersusReceive() {
        String code = "TIMER tim:\n" +
                      "SEQ\n" +
                      "  tim ? t\n" +
                      "  c ? x\n";
        List<Stmt> stmts = parse(code);
        assertTrue(stmts.get(0) instanceof Stmt.TimerDecl);
        Stmt.Seq seq = (Stmt.Seq) stmts.get(1);
        Stmt.TimerRead read = (Stmt.TimerRead) seq.statements.get(0);
        assertEquals("tim", read.timer.lexeme);
        Stmt.Receive receive = (Stmt.Receive) seq.statements.get(1);
        assertEquals("c", receive.channel.lexeme);
    }

    @Test
    public void testTimerReadInsideNestedBlocks() {
        String code = "TIMER tim:\n" +
                      "PROC p(CHAN OF INT c)\n" +
                      "  PAR\n" +
                      "    SEQ\n" +
                      "      tim ? t\n" +
                      "      c ? x\n" +
                      ":\n";
        Stmt.Proc proc = (Stmt.Proc) parse(code).get(1);
        Stmt.Par par = (Stmt.Par) proc.body.get(0);
        Stmt.Seq seq = (Stmt.Seq) par.statements.get(0);
        assertEquals("tim", ((Stmt.TimerRead) seq.statements.get(0)).timer.lexeme);
        assertTrue(seq.statements.get(1) instanceof Stmt.Receive);
    }

    @Test
    public void testTimerDeclaredInsideProc() {
        String code = "PROC q()\n" +
                      "  TIMER clock:\n" +
                      "  SEQ\n" +
                      "    clock ? now\n" +
                      ":\n";
        Stmt.Proc proc = (Stmt.Proc) parse(code).get(0);
        Stmt.Seq seq = (Stmt.Seq) proc.body.get(1);
        assertTrue(seq.statements.get(0) instanceof Stmt.TimerRead);
    }

    @Test
    public void testReceiveBeforeTimerDeclared() {
        List<Stmt> stmts = parse("tim ? t\n" +
                                 "TIMER tim:\n");
        assertTrue(stmts.get(0) instanceof Stmt.Receive);
    }

    @Test
    public void testSequentialReceiveAndIndexedTarget() {
        Stmt.Receive receive = (Stmt.Receive) parse("c ? x; buf[i]\n").get(0);
        assertEquals(2, receive.targets.size());
        assertTrue(receive.targets.get(0) instanceof Expr.Identifier);
        assertTrue(receive.targets.get(1) instanceof Expr.Index);
    }

    @Test
    public void testSequentialSend() {
        Stmt.Send send = (Stmt.Send) parse("c ! 1; x + 1; 'a'\n").get(0);
        assertEquals(3, send.values.size());
        assertTrue(send.values.get(1) instanceof Expr.Binary);
    }

    @Test
    public void testVariantProtocolRegistersTags() {
        String code = "PROTOCOL MSG\n" +
                      "  CASE\n" +
                      "    text; INT\n" +
                      "    quit\n" +
                      ":\n";
        Parser parser = Parser.newFromSource(code);
        List<Stmt> stmts = parser.parseProgram().statements;
        assertTrue(parser.errors().isEmpty());

        Stmt.Protocol protocol = (Stmt.Protocol) stmts.get(0);
        assertEquals(Stmt.Protocol.Kind.VARIANT, protocol.kind);
        assertEquals(2, protocol.variants.size());
        assertEquals("text", protocol.variants.get(0).tag.lexeme);
        assertEquals(INT_TYPE, protocol.variants.get(0).types.get(0).type);
        assertEquals("quit", protocol.variants.get(1).tag.lexeme);
        assertTrue(protocol.variants.get(1).types.isEmpty());

        assertTrue(parser.symbols().isProtocol("MSG"));
        assertTrue(parser.symbols().isVariantTag("text"));
        assertTrue(parser.symbols().isVariantTag("quit"));
    }

    @Test
    public void testSimpleAndSequentialProtocols() {
        List<Stmt> stmts = parse("PROTOCOL P IS INT:\n" +
                                 "PROTOCOL Q IS INT; BYTE; REAL32:\n");
        Stmt.Protocol simple = (Stmt.Protocol) stmts.get(0);
        assertEquals(Stmt.Protocol.Kind.SIMPLE, simple.kind);
        assertEquals(1, simple.types.size());
        Stmt.Protocol sequential = (Stmt.Protocol) stmts.get(1);
        assertEquals(Stmt.Protocol.Kind.SEQUENTIAL, sequential.kind);
        assertEquals(3, sequential.types.size());
    }

    @Test
    public void testVariantSendAfterProtocol() {
        String code = "PROTOCOL MSG\n" +
                      "  CASE\n" +
                      "    pair; INT; INT\n" +
                      "    quit\n" +
                      ":\n" +
                      "SEQ\n" +
                      "  c ! pair; 1; 2\n" +
                      "  c ! quit\n";
        Stmt.Seq seq = (Stmt.Seq) parse(code).get(1);

        Stmt.Send pair = (Stmt.Send) seq.statements.get(0);
        assertTrue(pair.isVariant());
        assertEquals("pair", pair.variantTag.lexeme);
        assertEquals(2, pair.values.size());

        // a bare tag has nothing after it to mark it as a tag
        Stmt.Send quit = (Stmt.Send) seq.statements.get(1);
        assertFalse(quit.isVariant());
        assertEquals("quit", ((Expr.Identifier) quit.values.get(0)).name.lexeme);
    }

    @Test
    public void testVariantSendBeforeProtocolIsPlainSend() {
        String code = "c ! text; 42\n" +
                      "PROTOCOL MSG\n" +
                      "  CASE\n" +
                      "    text; INT\n" +
                      ":\n";
        Stmt.Send send = (Stmt.Send) parse(code).get(0);
        assertFalse(send.isVariant());
        assertEquals(2, send.values.size());
        assertEquals("text", ((Expr.Identifier) send.values.get(0)).name.lexeme);
    }

    @Test
    public void testTagsAreSharedAcrossProtocols() {
        String code = "PROTOCOL A\n" +
                      "  CASE\n" +
                      "    go; INT\n" +
                      ":\n" +
                      "CHAN OF INT c:\n" +
                      "c ! go; 1\n";
        Stmt.Send send = (Stmt.Send) parse(code).get(2);
        assertTrue(send.isVariant());
    }

    @Test
    public void testVariantReceive() {
        String code = "c ? CASE\n" +
                      "  text; n\n" +
                      "    out ! n\n" +
                      "  quit\n" +
                      "    STOP\n";
        Stmt.VariantReceive receive = (Stmt.VariantReceive) parse(code).get(0);
        assertEquals("c", receive.channel.lexeme);
        assertEquals(2, receive.cases.size());
        Stmt.VariantCase text = receive.cases.get(0);
        assertEquals("text", text.tag.lexeme);
        assertEquals("n", text.variables.get(0).lexeme);
        assertTrue(text.body.get(0) instanceof Stmt.Send);
        assertTrue(receive.cases.get(1).body.get(0) instanceof Stmt.Stop);
    }

    @Test
    public void testRecordDeclarationAndVariable() {
        String code = "RECORD POINT\n" +
                      "  INT x, y:\n" +
                      "  BOOL visible:\n" +
                      ":\n" +
                      "POINT p, q:\n";
        Parser parser = Parser.newFromSource(code);
        List<Stmt> stmts = parser.parseProgram().statements;
        assertTrue(parser.errors().toString(), parser.errors().isEmpty());

        Stmt.Record record = (Stmt.Record) stmts.get(0);
        assertEquals(3, record.fields.size());
        assertEquals("visible", record.fields.get(2).name.lexeme);
        assertTrue(parser.symbols().isRecord("POINT"));

        Stmt.VarDecl decl = (Stmt.VarDecl) stmts.get(1);
        assertEquals("POINT", decl.type.lexeme);
        assertEquals(2, decl.names.size());
    }

    @Test
    public void testAbbreviations() {
        List<Stmt> stmts = parse("VAL INT x IS 5:\n" +
                                 "VAL []BYTE s IS \"hi\":\n" +
                                 "VAL y IS x + 1:\n" +
                                 "INT z IS x:\n" +
                                 "INITIAL INT n IS 0:\n");
        Stmt.Abbreviation val = (Stmt.Abbreviation) stmts.get(0);
        assertTrue(val.isVal);
        assertEquals(INT_TYPE, val.type.type);

        Stmt.Abbreviation bytes = (Stmt.Abbreviation) stmts.get(1);
        assertEquals(1, bytes.openArrayDims);
        assertEquals(BYTE_TYPE, bytes.type.type);

        Stmt.Abbreviation untyped = (Stmt.Abbreviation) stmts.get(2);
        assertNull(untyped.type);
        assertTrue(untyped.value instanceof Expr.Binary);

        Stmt.Abbreviation plain = (Stmt.Abbreviation) stmts.get(3);
        assertFalse(plain.isVal);
        assertFalse(plain.isInitial);

        Stmt.Abbreviation initial = (Stmt.Abbreviation) stmts.get(4);
        assertTrue(initial.isInitial);
        assertFalse(initial.isVal);
    }

    @Test
    public void testRetypes() {
        List<Stmt> stmts = parse("VAL INT x RETYPES r:\n" +
                                 "VAL [2]INT pair RETYPES r:\n");
        Stmt.Retypes scalar = (Stmt.Retypes) stmts.get(0);
        assertFalse(scalar.isArray());
        assertEquals("r", scalar.source.lexeme);

        Stmt.Retypes array = (Stmt.Retypes) stmts.get(1);
        assertTrue(array.isArray());
        assertEquals("pair", array.name.lexeme);
    }

    @Test
    public void testSizedValAbbreviation() {
        Stmt.Abbreviation table =
            (Stmt.Abbreviation) parse("VAL [4]INT table IS [1, 2, 3, 4]:\n").get(0);
        assertTrue(table.isVal);
        assertEquals(4L, ((Expr.IntegerLiteral) table.arraySize).value);
        assertEquals(INT_TYPE, table.type.type);
        assertEquals("table", table.name.lexeme);
        assertEquals(4, ((Expr.ArrayLiteral) table.value).elements.size());
    }

    @Test
    public void testUnsizedAbbreviationHasNoArraySize() {
        assertNull(((Stmt.Abbreviation) parse("VAL []BYTE s IS \"hi\":\n").get(0)).arraySize);
    }

    @Test
    public void testValNeedsIsOrRetypes() {
        assertEquals("line 1: expected IS or RETYPES, got :",
                     errors("VAL [2]INT x:\n").get(0));
    }

    @Test
    public void testSliceAssignment() {
        List<Stmt> stmts = parse("[buf FROM 1 FOR 3] := src\n" +
                                 "[buf FOR 2] := src\n");
        Stmt.SliceAssign from = (Stmt.SliceAssign) stmts.get(0);
        assertEquals("buf", ((Expr.Identifier) from.target.array).name.lexeme);
        assertEquals(1L, ((Expr.IntegerLiteral) from.target.start).value);
        assertEquals(3L, ((Expr.IntegerLiteral) from.target.length).value);

        Stmt.SliceAssign prefix = (Stmt.SliceAssign) stmts.get(1);
        assertEquals(0L, ((Expr.IntegerLiteral) prefix.target.start).value);
    }

    @Test
    public void testMultiAssignment() {
        Stmt.MultiAssign assign = (Stmt.MultiAssign) parse("a, b[1] := b[1], a\n").get(0);
        assertEquals(2, assign.targets.size());
        assertEquals(1, assign.targets.get(1).indices.size());
        assertEquals(2, assign.values.size());
    }

    @Test
    public void testProcDeclaration() {
        String code = "PROC worker(VAL INT a, b, CHAN OF INT out!, []BYTE s, RESULT INT r)\n" +
                      "  out ! a + b\n" +
                      ":\n";
        Stmt.Proc proc = (Stmt.Proc) parse(code).get(0);
        assertEquals("worker", proc.name.lexeme);
        assertEquals(5, proc.params.size());

        Param b = proc.params.get(1);
        assertTrue(b.isVal);
        assertEquals(INT_TYPE, b.type.type);
        assertEquals("b", b.varName());

        Param out = proc.params.get(2);
        assertTrue(out.isChan);
        assertEquals("!", out.chanDir);
        assertFalse(out.isChanArray());

        assertEquals(1, proc.params.get(3).openArrayDims);
        assertTrue(proc.params.get(4).isResult);
        assertEquals(1, proc.body.size());
    }

    @Test
    public void testProcWithChannelArrayAndFixedArrayParams() {
        String code = "PROC fan([]CHAN OF INT cs?, [2]INT pair)\n" +
                      "  SKIP\n";
        Stmt.Proc proc = (Stmt.Proc) parse(code).get(0);
        Param cs = proc.params.get(0);
        assertTrue(cs.isChanArray());
        assertEquals("?", cs.chanDir);
        assertEquals(0, cs.openArrayDims);
        assertEquals("2", proc.params.get(1).arraySize.lexeme);
    }

    @Test
    public void testProcCalls() {
        List<Stmt> stmts = parse("worker(1, x, out!)\n" +
                                 "reset\n" +
                                 "tick()\n");
        Stmt.ProcCall worker = (Stmt.ProcCall) stmts.get(0);
        assertEquals(3, worker.args.size());
        assertTrue(((Stmt.ProcCall) stmts.get(1)).args.isEmpty());
        assertTrue(((Stmt.ProcCall) stmts.get(2)).args.isEmpty());
    }

    @Test
    public void testShortFunction() {
        Stmt.Function function = (Stmt.Function) parse("INT FUNCTION sq(VAL INT x) IS x * x:\n").get(0);
        assertEquals("sq", function.name.lexeme);
        assertEquals(1, function.returnTypes.size());
        assertTrue(function.body.isEmpty());
        assertEquals(1, function.results.size());
    }

    @Test
    public void testValofFunctionWithSeveralResults() {
        String code = "INT, INT FUNCTION two(INT x)\n" +
                      "  INT y:\n" +
                      "  VALOF\n" +
                      "    y := x + 1\n" +
                      "    RESULT x, y\n" +
                      ":\n" +
                      "SKIP\n";
        List<Stmt> stmts = parse(code);
        assertEquals(2, stmts.size());
        Stmt.Function function = (Stmt.Function) stmts.get(0);
        assertEquals(2, function.returnTypes.size());
        assertEquals(2, function.body.size());
        assertEquals(2, function.results.size());
        // function parameters are passed by value
        assertTrue(function.params.get(0).isVal);
        assertTrue(stmts.get(1) instanceof Stmt.Skip);
    }

    @Test
    public void testInlineFunctionWithIsOnNextLine() {
        String code = "BOOL INLINE FUNCTION pos(VAL INT x)\n" +
                      "  IS x > 0\n" +
                      ":\n";
        Stmt.Function function = (Stmt.Function) parse(code).get(0);
        assertEquals(BOOL_TYPE, function.returnTypes.get(0).type);
        assertTrue(function.results.get(0) instanceof Expr.Binary);
    }

    @Test
    public void testStatementAfterResultIsReported() {
        String code = "INT FUNCTION f()\n" +
                      "  VALOF\n" +
                      "    SKIP\n" +
                      "    RESULT 1\n" +
                      "    x := 2\n" +
                      ":\n";
        List<String> errors = errors(code);
        assertEquals(1, errors.size());
        assertEquals("line 5: unexpected IDENT after RESULT", errors.get(0));
    }

    @Test
    public void testLineAfterIsExpressionIsReported() {
        String code = "INT FUNCTION f(VAL INT x)\n" +
                      "  IS x + 1\n" +
                      "  SKIP\n" +
                      ":\n";
        assertEquals("line 3: unexpected SKIP after IS expression", errors(code).get(0));
    }

    @Test
    public void testLineAfterProtocolCasesIsReported() {
        String code = "PROTOCOL MSG\n" +
                      "  CASE\n" +
                      "    quit\n" +
                      "  extra\n" +
                      ":\n";
        List<String> errors = errors(code);
        assertEquals(1, errors.size());
        assertEquals("line 4: unexpected IDENT after variant protocol cases", errors.get(0));
    }

    @Test
    public void testLeftoverTokensOnLine() {
        List<String> errors = errors("SKIP SKIP\n");
        assertEquals(1, errors.size());
        assertEquals("line 1: unexpected SKIP at end of statement", errors.get(0));

        String code = "SEQ\n" +
                      "  x := a b c\n" +
                      "  y := 1\n";
        Parser parser = Parser.newFromSource(code);
        Program program = parser.parseProgram();
        assertEquals(1, parser.errors().size());
        assertEquals("line 2: unexpected IDENT at end of statement", parser.errors().get(0));
        // the rest of the line is dropped and parsing resumes on the next one
        Stmt.Seq seq = (Stmt.Seq) program.statements.get(0);
        assertEquals(2, seq.statements.size());
        assertEquals("y", ((Stmt.Assign) seq.statements.get(1)).name.lexeme);
    }

    @Test
    public void testMissingColon() {
        List<String> errors = errors("INT x\n");
        assertEquals(1, errors.size());
        assertEquals("line 1: expected :, got NEWLINE", errors.get(0));
    }

    @Test
    public void testErrorLineNumbers() {
        List<String> errors = errors("SEQ\n" +
                                     "  SKIP\n" +
                                     "  x := )\n");
        assertEquals("line 3: unexpected token in expression: )", errors.get(0));
    }

    @Test
    public void testIndexedStatementNeedsOperator() {
        assertEquals("line 1: expected :=, ! or ? after a[...], got NEWLINE",
                     errors("a[1]\n").get(0));
    }

    @Test
    public void testUnexpectedToken() {
        assertEquals("line 1: unexpected token: )", errors(")\n").get(0));
        assertEquals("line 1: illegal token '$'", errors("$\n").get(0));
    }

    @Test
    public void testParseErrorsCarryLines() {
        Parser parser = Parser.newFromSource("SKIP\nINT x\n");
        parser.parseProgram();
        ParseError error = parser.parseErrors().get(0);
        assertEquals(2, error.line());
        assertEquals("expected :, got NEWLINE", error.message());
    }
}
