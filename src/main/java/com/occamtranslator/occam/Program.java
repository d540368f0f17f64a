package com.occamtranslator.occam;

import java.util.Collections;
import java.util.List;

// the top-level statements of one source file
public class Program {
    public final List<Stmt> statements;

    Program(List<Stmt> statements) {
        this.statements = Collections.unmodifiableList(statements);
    }
}
