package com.pascals.compiler;

import com.pascals.compiler.ast.Declaration;
import com.pascals.compiler.semantic.Decorations;
import com.pascals.compiler.semantic.SymbolTable;

public final class AnalysisResult {
    private final Declaration.Program program;
    private final SymbolTable symbolTable;
    private final Decorations decorations;

    public AnalysisResult(Declaration.Program program, SymbolTable symbolTable, Decorations decorations) {
        this.program = program;
        this.symbolTable = symbolTable;
        this.decorations = decorations;
    }

    public Declaration.Program getProgram() { return program; }
    public SymbolTable getSymbolTable() { return symbolTable; }
    public Decorations getDecorations() { return decorations; }
}
