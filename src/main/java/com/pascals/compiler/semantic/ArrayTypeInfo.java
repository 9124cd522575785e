package com.pascals.compiler.semantic;

public final class ArrayTypeInfo {
    private final Type indexType;
    private final Type elementType;
    private final long low;
    private final long high;
    private final long elementSize;
    private final int refIndex;

    public ArrayTypeInfo(Type indexType, Type elementType, long low, long high, long elementSize, int refIndex) {
        this.indexType = indexType;
        this.elementType = elementType;
        this.low = low;
        this.high = high;
        this.elementSize = elementSize;
        this.refIndex = refIndex;
    }

    public Type getIndexType() { return indexType; }
    public Type getElementType() { return elementType; }
    public long getLow() { return low; }
    public long getHigh() { return high; }
    public long getElementSize() { return elementSize; }

    /** Index of the matching entry in the array table. */
    public int getRefIndex() { return refIndex; }

    public long getSize() {
        return (high - low + 1) * elementSize;
    }
}
