package com.pascals.compiler.ast;

public interface NodeVisitor<R> {
    R visitProgram(Declaration.Program node);
    R visitBlock(Declaration.Block node);
    R visitVarDeclaration(Declaration.VarDeclaration node);
    R visitConstDeclaration(Declaration.ConstDeclaration node);
    R visitTypeDeclaration(Declaration.TypeDeclaration node);
    R visitProcedureDeclaration(Declaration.ProcedureDeclaration node);
    R visitFunctionDeclaration(Declaration.FunctionDeclaration node);
    R visitParameter(Declaration.Parameter node);

    R visitSimpleType(TypeSpec.SimpleType node);
    R visitArrayType(TypeSpec.ArrayType node);
    R visitRecordType(TypeSpec.RecordType node);
    R visitSubrangeType(TypeSpec.SubrangeType node);

    R visitCompoundStatement(Statement.CompoundStatement node);
    R visitAssignmentStatement(Statement.AssignmentStatement node);
    R visitIfStatement(Statement.IfStatement node);
    R visitWhileStatement(Statement.WhileStatement node);
    R visitForStatement(Statement.ForStatement node);
    R visitRepeatStatement(Statement.RepeatStatement node);
    R visitCaseStatement(Statement.CaseStatement node);
    R visitProcedureCall(Statement.ProcedureCall node);
    R visitEmptyStatement(Statement.EmptyStatement node);

    R visitBinaryOp(Expr.BinaryOp node);
    R visitUnaryOp(Expr.UnaryOp node);
    R visitVariable(Expr.Variable node);
    R visitNumberLiteral(Expr.NumberLiteral node);
    R visitStringLiteral(Expr.StringLiteral node);
    R visitCharLiteral(Expr.CharLiteral node);
    R visitBooleanLiteral(Expr.BooleanLiteral node);
    R visitFunctionCall(Expr.FunctionCall node);
}
