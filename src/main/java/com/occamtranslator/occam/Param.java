package com.occamtranslator.occam;

// PROC or FUNCTION formal parameter
public class Param {
    public final boolean isVal;
    public final boolean isResult;
    public final Token type; // element type for channels, record name for records
    public final Token name;
    public final boolean isChan;
    public final int chanArrayDims; // []CHAN OF INT cs  -> 1
    public final int openArrayDims; // [][]INT grid      -> 2
    public final Token arraySize;   // [2]INT pair       -> 2, else null
    public final String chanDir;    // "?", "!" or "" when unrestricted

    Param(boolean isVal, boolean isResult, Token type, Token name, boolean isChan,
          int chanArrayDims, int openArrayDims, Token arraySize, String chanDir) {
        this.isVal = isVal;
        this.isResult = isResult;
        this.type = type;
        this.name = name;
        this.isChan = isChan;
        this.chanArrayDims = chanArrayDims;
        this.openArrayDims = openArrayDims;
        this.arraySize = arraySize;
        this.chanDir = chanDir;
    }

    // VAL INT a, b: b shares everything but its name and direction with a
    Param sharing(Token name, String chanDir) {
        return new Param(isVal, isResult, type, name, isChan, chanArrayDims,
                openArrayDims, arraySize, chanDir);
    }

    Param asVal() {
        return new Param(true, isResult, type, name, isChan, chanArrayDims,
                openArrayDims, arraySize, chanDir);
    }

    public String varName() {
        return name.lexeme;
    }

    public boolean isChanArray() {
        return chanArrayDims > 0;
    }
}
