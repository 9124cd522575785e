package com.pascals.compiler.semantic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Block-structured symbol table with Wirth's layout: identifier table ({@code tab}), array
 * table ({@code atab}), block table ({@code btab}) and a display mapping each lexical level to
 * its active block.
 *
 * <p>Entries are never removed. Each scope is the chain starting at its block's
 * {@code last} entry and following {@code link}; leaving a scope only moves the level and
 * the address counter back, so a full dump after analysis still shows every entry.
 */
public final class SymbolTable {
    public static final int NO_ENTRY = -1;

    /** First address handed out in a fresh scope; lower slots belong to the frame header. */
    public static final int FRAME_HEADER = 3;

    private final List<SymbolEntry> tab = new ArrayList<>();
    private final List<ArrayEntry> atab = new ArrayList<>();
    private final List<BlockEntry> btab = new ArrayList<>();
    private int[] display = new int[10];
    private int level = 0;
    private int dx = 0;

    public SymbolTable() {
        btab.add(new BlockEntry());
        display[0] = 0;
    }

    public int enter(String name, ObjectKind kind, Type type) {
        return enter(name, kind, type, level, 0, true);
    }

    public int enter(String name, ObjectKind kind, Type type, int level, int ref, boolean byValue) {
        BlockEntry block = btab.get(display[level]);
        int address = 0;
        if (kind == ObjectKind.VARIABLE) {
            address = dx++;
            block.incrementVarSize();
        }
        int index = tab.size();
        tab.add(new SymbolEntry(name, kind, type, level, address, ref, byValue, block.getLast()));
        block.setLast(index);
        return index;
    }

    public int enterArray(Type indexType, Type elementType, long low, long high, long elementSize) {
        atab.add(new ArrayEntry(indexType, elementType, low, high, elementSize));
        return atab.size() - 1;
    }

    public int enterBlock() {
        btab.add(new BlockEntry());
        return btab.size() - 1;
    }

    public void enterScope() {
        level++;
        if (level == display.length) display = Arrays.copyOf(display, display.length * 2);
        display[level] = enterBlock();
        dx = FRAME_HEADER;
    }

    public void exitScope() {
        if (level == 0) return;
        level--;
        int base = level == 0 ? 0 : FRAME_HEADER;
        dx = base + btab.get(display[level]).getVarSize();
    }

    /**
     * Innermost visible entry named {@code name}, searching each scope's chain from the current
     * level out to level 0, then any level-0 entry. Returns {@link #NO_ENTRY} when absent.
     */
    public int lookup(String name) {
        for (int lev = level; lev >= 0; lev--) {
            int found = searchChain(btab.get(display[lev]).getLast(), name);
            if (found != NO_ENTRY) return found;
        }
        for (int i = tab.size() - 1; i >= 0; i--) {
            SymbolEntry e = tab.get(i);
            if (e.level == 0 && e.name.equalsIgnoreCase(name)) return i;
        }
        return NO_ENTRY;
    }

    public int lookupCurrentScope(String name) {
        return searchChain(btab.get(display[level]).getLast(), name);
    }

    private int searchChain(int head, String name) {
        for (int i = head; i != NO_ENTRY; i = tab.get(i).link) {
            if (tab.get(i).name.equalsIgnoreCase(name)) return i;
        }
        return NO_ENTRY;
    }

    /** Records the parameter span of the innermost block after its parameters were entered. */
    public void markParameters() {
        BlockEntry block = currentBlockEntry();
        block.setParamListOffset(tab.size() - 1);
        block.setParamSize(dx);
    }

    public SymbolEntry getEntry(int index) { return tab.get(index); }
    public ArrayEntry getArrayEntry(int index) { return atab.get(index); }
    public BlockEntry getBlockEntry(int index) { return btab.get(index); }

    public List<SymbolEntry> getEntries() { return Collections.unmodifiableList(tab); }
    public List<ArrayEntry> getArrayEntries() { return Collections.unmodifiableList(atab); }
    public List<BlockEntry> getBlockEntries() { return Collections.unmodifiableList(btab); }

    public int getLevel() { return level; }
    public int getAddressCounter() { return dx; }

    /** Block index active at {@code level}. */
    public int displayAt(int level) { return display[level]; }

    public BlockEntry currentBlockEntry() {
        return btab.get(display[level]);
    }
}
