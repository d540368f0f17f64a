package com.occamtranslator.occam;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

import static com.occamtranslator.occam.TokenType.*;

public class SymbolTableTest {

    private static Token ident(String name) {
        return new Token(IDENT, name, 1, 1);
    }

    private static Stmt.Protocol variant(String name, String... tags) {
        List<Stmt.ProtocolVariant> variants = new ArrayList<>();
        for (String tag : tags) {
            variants.add(new Stmt.ProtocolVariant(ident(tag), new ArrayList<>()));
        }
        return new Stmt.Protocol(ident(name), Stmt.Protocol.Kind.VARIANT,
                new ArrayList<>(), variants);
    }

    @Test
    public void testTimers() {
        SymbolTable symbols = new SymbolTable();
        assertFalse(symbols.isTimer("tim"));
        symbols.declareTimer("tim");
        assertTrue(symbols.isTimer("tim"));
        assertFalse(symbols.isTimer("clock"));
    }

    @Test
    public void testProtocols() {
        SymbolTable symbols = new SymbolTable();
        Stmt.Protocol msg = variant("MSG", "text", "quit");
        symbols.declareProtocol(msg);
        assertTrue(symbols.isProtocol("MSG"));
        assertSame(msg, symbols.protocol("MSG"));
        assertNull(symbols.protocol("OTHER"));
    }

    @Test
    public void testTagsLookedUpAcrossAllProtocols() {
        SymbolTable symbols = new SymbolTable();
        symbols.declareProtocol(variant("A", "start"));
        symbols.declareProtocol(variant("B", "stop"));
        assertTrue(symbols.isVariantTag("start"));
        assertTrue(symbols.isVariantTag("stop"));
        assertFalse(symbols.isVariantTag("A"));
        assertFalse(symbols.isVariantTag("pause"));
    }

    @Test
    public void testNonVariantProtocolsHaveNoTags() {
        SymbolTable symbols = new SymbolTable();
        Token intType = new Token(INT_TYPE, "INT", 1, 1);
        symbols.declareProtocol(new Stmt.Protocol(ident("P"), Stmt.Protocol.Kind.SIMPLE,
                Arrays.asList(intType), new ArrayList<>()));
        assertTrue(symbols.isProtocol("P"));
        assertFalse(symbols.isVariantTag("INT"));
        assertFalse(symbols.isVariantTag("P"));
    }

    @Test
    public void testRecords() {
        SymbolTable symbols = new SymbolTable();
        Stmt.Record point = new Stmt.Record(ident("POINT"), Collections.emptyList());
        symbols.declareRecord(point);
        assertTrue(symbols.isRecord("POINT"));
        assertSame(point, symbols.record("POINT"));
        assertFalse(symbols.isRecord("point"));
    }

    @Test
    public void testParserRegistersDeclarations() {
        String code = "TIMER a, b:\n" +
                      "PROTOCOL MSG\n" +
                      "  CASE\n" +
                      "    data; INT; BYTE\n" +
                      ":\n" +
                      "RECORD PAIR\n" +
                      "  INT l, r:\n" +
                      ":\n";
        Parser parser = Parser.newFromSource(code);
        parser.parseProgram();
        assertTrue(parser.errors().toString(), parser.errors().isEmpty());

        SymbolTable symbols = parser.symbols();
        assertTrue(symbols.isTimer("a"));
        assertTrue(symbols.isTimer("b"));
        assertTrue(symbols.isVariantTag("data"));
        assertEquals(2, symbols.protocol("MSG").variants.get(0).types.size());
        assertEquals(2, symbols.record("PAIR").fields.size());
    }

    @Test
    public void testFailedDeclarationsAreNotRegistered() {
        Parser parser = Parser.newFromSource("TIMER t\n" +
                                             "PROTOCOL P IS :\n");
        parser.parseProgram();
        assertFalse(parser.errors().isEmpty());
        assertFalse(parser.symbols().isTimer("t"));
        assertFalse(parser.symbols().isProtocol("P"));
    }

    @Test
    public void testEachParserHasItsOwnTable() {
        Parser first = Parser.newFromSource("TIMER tim:\n");
        first.parseProgram();
        Parser second = Parser.newFromSource("tim ? x\n");
        Program program = second.parseProgram();
        assertTrue(first.symbols().isTimer("tim"));
        assertFalse(second.symbols().isTimer("tim"));
        assertTrue(program.statements.get(0) instanceof Stmt.Receive);
    }
}
