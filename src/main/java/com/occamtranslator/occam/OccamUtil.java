package com.occamtranslator.occam;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

class OccamUtil {

    static String readFile(String path) throws IOException {
        byte[] encoded = Files.readAllBytes(Paths.get(path));
        return new String(encoded, StandardCharsets.UTF_8);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    // occam names may contain dots: out.string, data.ready
    static boolean isNameChar(char c) {
        return isAlpha(c) || isDigit(c) || c == '.';
    }

    // Decodes the character following the '*' escape leader. Returns -1 for
    // an unknown escape, which callers keep verbatim.
    static int escapeValue(char c) {
        switch (c) {
            case 'n': return '\n';
            case 'c': return '\r';
            case 't': return '\t';
            case 's': return ' ';
            case '*': return '*';
            case '"': return '"';
            case '\'': return '\'';
            default: return -1;
        }
    }

    // Occam escapes for display: the inverse of escapeValue, used when printing trees
    static String escape(String str) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            switch (c) {
                case '\n': builder.append("*n"); break;
                case '\r': builder.append("*c"); break;
                case '\t': builder.append("*t"); break;
                case '*': builder.append("**"); break;
                case '"': builder.append("*\""); break;
                case '\'': builder.append("*'"); break;
                default: builder.append(c);
            }
        }
        return builder.toString();
    }
}
