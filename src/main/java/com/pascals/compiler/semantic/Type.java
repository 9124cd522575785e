package com.pascals.compiler.semantic;

import java.util.Locale;

/**
 * A resolved type. Simple types are the shared constants below; array and record types
 * are created per declaration and carry their layout.
 */
public final class Type {
    public static final Type INTEGER = new Type(TypeKind.INTEGER, null, null);
    public static final Type REAL = new Type(TypeKind.REAL, null, null);
    public static final Type BOOLEAN = new Type(TypeKind.BOOLEAN, null, null);
    public static final Type CHAR = new Type(TypeKind.CHAR, null, null);
    public static final Type STRING = new Type(TypeKind.STRING, null, null);
    public static final Type VOID = new Type(TypeKind.VOID, null, null);

    private final TypeKind kind;
    private final ArrayTypeInfo arrayInfo;
    private final RecordTypeInfo recordInfo;

    private Type(TypeKind kind, ArrayTypeInfo arrayInfo, RecordTypeInfo recordInfo) {
        this.kind = kind;
        this.arrayInfo = arrayInfo;
        this.recordInfo = recordInfo;
    }

    public static Type array(ArrayTypeInfo info) {
        return new Type(TypeKind.ARRAY, info, null);
    }

    public static Type record(RecordTypeInfo info) {
        return new Type(TypeKind.RECORD, null, info);
    }

    public TypeKind getKind() { return kind; }
    public ArrayTypeInfo getArrayInfo() { return arrayInfo; }
    public RecordTypeInfo getRecordInfo() { return recordInfo; }

    public boolean isSimple() { return arrayInfo == null && recordInfo == null; }
    public boolean isArray() { return kind == TypeKind.ARRAY; }
    public boolean isRecord() { return kind == TypeKind.RECORD; }

    public boolean isNumeric() {
        return kind == TypeKind.INTEGER || kind == TypeKind.REAL;
    }

    public boolean isOrdinal() {
        return kind == TypeKind.INTEGER || kind == TypeKind.BOOLEAN || kind == TypeKind.CHAR;
    }

    /** Storage cells: 1 for simple types, the layout size for arrays and records. */
    public long size() {
        if (arrayInfo != null) return arrayInfo.getSize();
        if (recordInfo != null) return recordInfo.getSize();
        return 1;
    }

    /**
     * Whether a value of {@code other} may be stored where this type is expected. REAL
     * accepts INTEGER, not the reverse. Arrays need compatible element types in both
     * directions; records must come from the same declaration.
     */
    public boolean compatibleWith(Type other) {
        if (kind == TypeKind.REAL && other.kind == TypeKind.INTEGER) return true;
        if (kind != other.kind) return false;
        switch (kind) {
            case ARRAY:
                Type mine = arrayInfo.getElementType();
                Type theirs = other.arrayInfo.getElementType();
                return mine.compatibleWith(theirs) && theirs.compatibleWith(mine);
            case RECORD:
                return recordInfo == other.recordInfo;
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        if (arrayInfo != null) return "array of " + arrayInfo.getElementType();
        if (recordInfo != null) return "record";
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
