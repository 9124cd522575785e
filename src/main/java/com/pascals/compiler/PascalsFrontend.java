package com.pascals.compiler;

import java.util.List;

import com.pascals.compiler.ast.Declaration;
import com.pascals.compiler.automaton.DfaConfig;
import com.pascals.compiler.lexer.Lexer;
import com.pascals.compiler.lexer.Token;
import com.pascals.compiler.parser.Parser;
import com.pascals.compiler.semantic.BuiltinDefinitions;
import com.pascals.compiler.semantic.SemanticVisitor;
import com.pascals.compiler.util.AstContract;

/**
 * Entry point for hosts: source text in, tokens / tree / analysis out.
 * Every stage throws a {@link com.pascals.compiler.error.CompilerException} on the first error.
 * Instances are reusable; each call gets its own parser and visitor.
 */
public class PascalsFrontend {
    private final Lexer lexer;
    private final BuiltinDefinitions builtins;

    public PascalsFrontend() {
        this(new Lexer(), BuiltinDefinitions.standard());
    }

    public PascalsFrontend(DfaConfig config) {
        this(new Lexer(config), BuiltinDefinitions.standard());
    }

    public PascalsFrontend(Lexer lexer, BuiltinDefinitions builtins) {
        this.lexer = lexer;
        this.builtins = builtins;
    }

    public List<Token> tokenize(String source) {
        return lexer.tokenize(source);
    }

    public Declaration.Program parse(String source) {
        Declaration.Program program = new Parser(tokenize(source)).parse();
        AstContract.validate(program);
        return program;
    }

    public AnalysisResult analyze(String source) {
        return analyze(parse(source));
    }

    public AnalysisResult analyze(Declaration.Program program) {
        SemanticVisitor visitor = new SemanticVisitor(builtins);
        visitor.analyze(program);
        return new AnalysisResult(program, visitor.getSymbolTable(), visitor.getDecorations());
    }
}
