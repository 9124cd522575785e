package com.pascals.compiler.semantic;

/** Per-block bookkeeping: chain head, parameter span and variable count. */
public final class BlockEntry {
    private int last = SymbolTable.NO_ENTRY;
    private int paramListOffset;
    private int paramSize;
    private int varSize;

    public int getLast() { return last; }
    public int getParamListOffset() { return paramListOffset; }
    public int getParamSize() { return paramSize; }
    public int getVarSize() { return varSize; }

    void setLast(int last) { this.last = last; }
    void setParamListOffset(int paramListOffset) { this.paramListOffset = paramListOffset; }
    void setParamSize(int paramSize) { this.paramSize = paramSize; }
    void incrementVarSize() { varSize++; }
}
