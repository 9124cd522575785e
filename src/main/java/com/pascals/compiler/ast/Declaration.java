package com.pascals.compiler.ast;

import java.util.List;
import java.util.Map;

public class Declaration {

    /** Anything that may appear in a block's declaration part. */
    public interface Decl extends Node {}

    public static final class Program implements Node {
        public final String name;
        public final Block block;

        public Program(String name, Block block) {
            this.name = name;
            this.block = block;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitProgram(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Program", this, a);
            m.put("name", name);
            m.put("block", block.toMap(a));
            return m;
        }
    }

    public static final class Block implements Node {
        public final List<Decl> declarations;
        public final Statement.CompoundStatement body;

        public Block(List<Decl> declarations, Statement.CompoundStatement body) {
            this.declarations = List.copyOf(declarations);
            this.body = body;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBlock(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Block", this, a);
            m.put("declarations", Maps.of(declarations, a));
            m.put("compound_statement", body.toMap(a));
            return m;
        }
    }

    public static final class VarDeclaration implements Decl {
        public final List<String> names;
        public final TypeSpec.TypeNode typeSpec;

        public VarDeclaration(List<String> names, TypeSpec.TypeNode typeSpec) {
            this.names = List.copyOf(names);
            this.typeSpec = typeSpec;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitVarDeclaration(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("VarDeclaration", this, a);
            m.put("identifiers", names);
            m.put("type_spec", typeSpec.toMap(a));
            return m;
        }
    }

    /** {@code value} is a Long, Double, String (unquoted) or Boolean. */
    public static final class ConstDeclaration implements Decl {
        public final String name;
        public final Object value;

        public ConstDeclaration(String name, Object value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitConstDeclaration(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("ConstDeclaration", this, a);
            m.put("name", name);
            m.put("value", value);
            return m;
        }
    }

    public static final class TypeDeclaration implements Decl {
        public final String name;
        public final TypeSpec.TypeNode typeSpec;

        public TypeDeclaration(String name, TypeSpec.TypeNode typeSpec) {
            this.name = name;
            this.typeSpec = typeSpec;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitTypeDeclaration(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("TypeDeclaration", this, a);
            m.put("name", name);
            m.put("type_spec", typeSpec.toMap(a));
            return m;
        }
    }

    public static final class ProcedureDeclaration implements Decl {
        public final String name;
        public final List<Parameter> parameters;
        public final Block block;

        public ProcedureDeclaration(String name, List<Parameter> parameters, Block block) {
            this.name = name;
            this.parameters = List.copyOf(parameters);
            this.block = block;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitProcedureDeclaration(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("ProcedureDeclaration", this, a);
            m.put("name", name);
            m.put("parameters", Maps.of(parameters, a));
            m.put("block", block.toMap(a));
            return m;
        }
    }

    public static final class FunctionDeclaration implements Decl {
        public final String name;
        public final List<Parameter> parameters;
        public final TypeSpec.TypeNode returnType;
        public final Block block;

        public FunctionDeclaration(String name, List<Parameter> parameters, TypeSpec.TypeNode returnType, Block block) {
            this.name = name;
            this.parameters = List.copyOf(parameters);
            this.returnType = returnType;
            this.block = block;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitFunctionDeclaration(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("FunctionDeclaration", this, a);
            m.put("name", name);
            m.put("parameters", Maps.of(parameters, a));
            m.put("return_type", returnType.toMap(a));
            m.put("block", block.toMap(a));
            return m;
        }
    }

    /** One parameter group: {@code [variabel] a, b : T}. */
    public static final class Parameter implements Node {
        public final List<String> names;
        public final TypeSpec.TypeNode typeSpec;
        public final boolean byReference;

        public Parameter(List<String> names, TypeSpec.TypeNode typeSpec, boolean byReference) {
            this.names = List.copyOf(names);
            this.typeSpec = typeSpec;
            this.byReference = byReference;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitParameter(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Parameter", this, a);
            m.put("identifiers", names);
            m.put("type_spec", typeSpec.toMap(a));
            m.put("by_reference", byReference);
            return m;
        }
    }
}
