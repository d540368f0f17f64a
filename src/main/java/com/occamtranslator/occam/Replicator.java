package com.occamtranslator.occam;

// i = start FOR count [STEP step]
public class Replicator {
    public final Token variable;
    public final Expr start;
    public final Expr count;
    public final Expr step; // null means a step of 1

    Replicator(Token variable, Expr start, Expr count, Expr step) {
        this.variable = variable;
        this.start = start;
        this.count = count;
        this.step = step;
    }
}
