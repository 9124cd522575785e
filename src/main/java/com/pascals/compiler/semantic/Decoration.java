package com.pascals.compiler.semantic;

/** What analysis learned about one node: its type, the symbol it resolved to, and that symbol's level. */
public final class Decoration {
    public final Type type;
    public final int tabIndex;
    public final int level;

    public Decoration(Type type, int tabIndex, int level) {
        this.type = type;
        this.tabIndex = tabIndex;
        this.level = level;
    }

    public boolean hasSymbol() {
        return tabIndex != SymbolTable.NO_ENTRY;
    }

    @Override
    public String toString() {
        return type + (hasSymbol() ? " #" + tabIndex + "@" + level : "");
    }
}
