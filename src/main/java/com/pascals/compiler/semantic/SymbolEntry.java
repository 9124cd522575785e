package com.pascals.compiler.semantic;

/**
 * One row of the identifier table. {@code link} is the index of the previous entry of the
 * same scope, or {@link SymbolTable#NO_ENTRY} at the end of the chain. For procedures and
 * functions {@code ref} is their block index; for array variables it is the array table index.
 */
public final class SymbolEntry {
    public final String name;
    public final ObjectKind kind;
    public final Type type;
    public final int level;
    public final int address;
    public final int ref;
    public final boolean byValue;
    public final int link;

    public SymbolEntry(String name, ObjectKind kind, Type type, int level, int address, int ref, boolean byValue, int link) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.level = level;
        this.address = address;
        this.ref = ref;
        this.byValue = byValue;
        this.link = link;
    }

    @Override
    public String toString() {
        return name + ":" + kind + "(" + type + ")@" + level;
    }
}
