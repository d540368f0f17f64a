package com.occamtranslator.occam;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;

import jline.console.ConsoleReader;

/**
 * Front-end driver: runs the parser over a source text and reports what it
 * found on stderr.
 */
public class Occam {
    static boolean hadError = false;
    public static boolean silenceParseErrors = false;
    public static Map<String, Boolean> debugKeys = new HashMap<>(); // given with -D flag, comma-separated

    static Program parse(String src) {
        Parser parser = Parser.newFromSource(src);
        Program program = parser.parseProgram();
        for (ParseError error : parser.parseErrors()) {
            error(error.line(), error.message());
        }
        return program;
    }

    static void parseDebugKeys(String keysStr) {
        for (String key : keysStr.split(",")) {
            if (!key.isEmpty()) {
                debugKeys.put(key, true);
            }
        }
    }

    static boolean isDebug(String key) {
        return debugKeys.containsKey(key);
    }

    /*
     * Reads lines until a blank one, then parses everything read so far as one
     * program and prints its tree. "exit" or "quit" leaves.
     */
    static void runPrompt() throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput());
        reader.setPrompt("> ");

        StringBuilder src = new StringBuilder();
        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            if (src.length() == 0 && (line.equals("exit") || line.equals("quit"))) {
                break;
            }
            if (!line.trim().isEmpty()) {
                src.append(line).append("\n");
                reader.setPrompt("  ");
                continue;
            }
            if (src.length() == 0) {
                continue;
            }

            if (isDebug("tokens")) {
                out.print(AstPrinter.tokensToString(src.toString()));
            }
            Program program = parse(src.toString());
            if (!hadError) {
                out.print(new AstPrinter().programToString(program));
            }
            out.flush();
            hadError = false;
            src.setLength(0);
            reader.setPrompt("> ");
        }
    }

    // lex error
    static void error(Token tok, String message) {
        if (tok.type == TokenType.EOF) {
            report(tok.line, " at end", message);
        } else {
            report(tok.line, " at '" + tok.lexeme + "'", message);
        }
    }

    // parse error
    static void error(int line, String message) {
        report(line, "", message);
    }

    private static void report(int line, String where, String message) {
        if (!silenceParseErrors) {
            System.err.println("[line " + line + "] Error" + where + ": " + message);
        }
        hadError = true;
    }
}
