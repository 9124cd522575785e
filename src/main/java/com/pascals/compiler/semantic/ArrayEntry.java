package com.pascals.compiler.semantic;

public final class ArrayEntry {
    public final Type indexType;
    public final Type elementType;
    public final long low;
    public final long high;
    public final long elementSize;
    public final long size;

    public ArrayEntry(Type indexType, Type elementType, long low, long high, long elementSize) {
        this.indexType = indexType;
        this.elementType = elementType;
        this.low = low;
        this.high = high;
        this.elementSize = elementSize;
        this.size = (high - low + 1) * elementSize;
    }
}
