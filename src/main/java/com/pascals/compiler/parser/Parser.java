package com.pascals.compiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.pascals.compiler.ast.Declaration.Block;
import com.pascals.compiler.ast.Declaration.ConstDeclaration;
import com.pascals.compiler.ast.Declaration.Decl;
import com.pascals.compiler.ast.Declaration.FunctionDeclaration;
import com.pascals.compiler.ast.Declaration.Parameter;
import com.pascals.compiler.ast.Declaration.ProcedureDeclaration;
import com.pascals.compiler.ast.Declaration.Program;
import com.pascals.compiler.ast.Declaration.TypeDeclaration;
import com.pascals.compiler.ast.Declaration.VarDeclaration;
import com.pascals.compiler.ast.Expr.BinaryOp;
import com.pascals.compiler.ast.Expr.BooleanLiteral;
import com.pascals.compiler.ast.Expr.CharLiteral;
import com.pascals.compiler.ast.Expr.Expression;
import com.pascals.compiler.ast.Expr.FunctionCall;
import com.pascals.compiler.ast.Expr.NumberLiteral;
import com.pascals.compiler.ast.Expr.StringLiteral;
import com.pascals.compiler.ast.Expr.UnaryOp;
import com.pascals.compiler.ast.Expr.Variable;
import com.pascals.compiler.ast.Statement.AssignmentStatement;
import com.pascals.compiler.ast.Statement.CaseBranch;
import com.pascals.compiler.ast.Statement.CaseStatement;
import com.pascals.compiler.ast.Statement.CompoundStatement;
import com.pascals.compiler.ast.Statement.EmptyStatement;
import com.pascals.compiler.ast.Statement.ForStatement;
import com.pascals.compiler.ast.Statement.IfStatement;
import com.pascals.compiler.ast.Statement.ProcedureCall;
import com.pascals.compiler.ast.Statement.RepeatStatement;
import com.pascals.compiler.ast.Statement.Stmt;
import com.pascals.compiler.ast.Statement.WhileStatement;
import com.pascals.compiler.ast.TypeSpec.ArrayType;
import com.pascals.compiler.ast.TypeSpec.RecordType;
import com.pascals.compiler.ast.TypeSpec.SimpleType;
import com.pascals.compiler.ast.TypeSpec.SubrangeType;
import com.pascals.compiler.ast.TypeSpec.TypeNode;
import com.pascals.compiler.error.SyntaxException;
import com.pascals.compiler.error.UnexpectedEndOfInputException;
import com.pascals.compiler.error.UnexpectedTokenException;
import com.pascals.compiler.lexer.Token;
import com.pascals.compiler.lexer.TokenType;

/**
 * Recursive-descent parser. Whitespace and comment tokens are dropped on construction;
 * the first grammar violation is thrown and no tree is returned.
 *
 * <p>{@link #match} only looks, {@link #expect} consumes or throws, {@link #advance}
 * consumes unconditionally and throws past the last token.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            if (!t.type.isTrivia()) this.tokens.add(t);
        }
    }

    public Program parse() {
        Program program = program();
        if (!isAtEnd()) throw new UnexpectedTokenException("end of input", peek());
        return program;
    }

    // -------------------------
    // Declarations
    // -------------------------

    private Program program() {
        expect(TokenType.KEYWORD, Keyword.PROGRAM);
        Token name = expect(TokenType.IDENTIFIER, null);
        expect(TokenType.SEMICOLON, null);
        Block block = block();
        expect(TokenType.DOT, null);
        return new Program(name.text, block);
    }

    private Block block() {
        List<Decl> declarations = new ArrayList<>();

        if (matchKeyword(Keyword.CONST)) {
            advance();
            do {
                Token name = expect(TokenType.IDENTIFIER, null);
                expect(TokenType.RELATIONAL_OPERATOR, "=");
                Object value = constant();
                expect(TokenType.SEMICOLON, null);
                declarations.add(new ConstDeclaration(name.text, value));
            } while (match(TokenType.IDENTIFIER, null));
        }

        if (matchKeyword(Keyword.TYPE)) {
            advance();
            do {
                Token name = expect(TokenType.IDENTIFIER, null);
                expect(TokenType.RELATIONAL_OPERATOR, "=");
                TypeNode spec = typeSpec();
                expect(TokenType.SEMICOLON, null);
                declarations.add(new TypeDeclaration(name.text, spec));
            } while (match(TokenType.IDENTIFIER, null));
        }

        if (matchKeyword(Keyword.VAR)) {
            advance();
            do {
                List<String> names = identifierList();
                expect(TokenType.COLON, null);
                TypeNode spec = typeSpec();
                expect(TokenType.SEMICOLON, null);
                declarations.add(new VarDeclaration(names, spec));
            } while (match(TokenType.IDENTIFIER, null));
        }

        while (matchKeyword(Keyword.PROCEDURE) || matchKeyword(Keyword.FUNCTION)) {
            declarations.add(matchKeyword(Keyword.PROCEDURE) ? procedureDeclaration() : functionDeclaration());
        }

        return new Block(declarations, compoundStatement());
    }

    private ProcedureDeclaration procedureDeclaration() {
        expect(TokenType.KEYWORD, Keyword.PROCEDURE);
        Token name = expect(TokenType.IDENTIFIER, null);
        List<Parameter> params = formalParameters();
        expect(TokenType.SEMICOLON, null);
        Block body = block();
        expect(TokenType.SEMICOLON, null);
        return new ProcedureDeclaration(name.text, params, body);
    }

    private FunctionDeclaration functionDeclaration() {
        expect(TokenType.KEYWORD, Keyword.FUNCTION);
        Token name = expect(TokenType.IDENTIFIER, null);
        List<Parameter> params = formalParameters();
        expect(TokenType.COLON, null);
        TypeNode returnType = typeSpec();
        expect(TokenType.SEMICOLON, null);
        Block body = block();
        expect(TokenType.SEMICOLON, null);
        return new FunctionDeclaration(name.text, params, returnType, body);
    }

    private List<Parameter> formalParameters() {
        List<Parameter> params = new ArrayList<>();
        if (!match(TokenType.LPARENTHESIS, null)) return params;
        advance();
        if (match(TokenType.RPARENTHESIS, null)) {
            advance();
            return params;
        }
        while (true) {
            boolean byReference = false;
            if (matchKeyword(Keyword.VAR)) {
                advance();
                byReference = true;
            }
            List<String> names = identifierList();
            expect(TokenType.COLON, null);
            params.add(new Parameter(names, typeSpec(), byReference));
            if (!match(TokenType.SEMICOLON, null)) break;
            advance();
        }
        expect(TokenType.RPARENTHESIS, null);
        return params;
    }

    private List<String> identifierList() {
        List<String> names = new ArrayList<>();
        names.add(expect(TokenType.IDENTIFIER, null).text);
        while (match(TokenType.COMMA, null)) {
            advance();
            names.add(expect(TokenType.IDENTIFIER, null).text);
        }
        return names;
    }

    // -------------------------
    // Types
    // -------------------------

    private TypeNode typeSpec() {
        Token t = peekOrFail("type");

        if (t.type == TokenType.KEYWORD && Keyword.isTypeName(t.text)) {
            advance();
            return new SimpleType(t.text.toLowerCase(Locale.ROOT));
        }
        if (t.type == TokenType.IDENTIFIER) {
            advance();
            return new SimpleType(t.text);
        }
        if (t.is(TokenType.KEYWORD, Keyword.ARRAY)) return arrayType();
        if (t.is(TokenType.KEYWORD, Keyword.RECORD)) return recordType();
        if (t.type == TokenType.NUMBER || t.type == TokenType.CHAR_LITERAL) {
            Expression low = bound();
            expect(TokenType.RANGE_OPERATOR, null);
            return new SubrangeType(low, bound());
        }
        throw new UnexpectedTokenException("type", t);
    }

    private ArrayType arrayType() {
        expect(TokenType.KEYWORD, Keyword.ARRAY);
        expect(TokenType.LBRACKET, null);

        Token t = peekOrFail("array index");
        boolean namedIndex = (t.type == TokenType.IDENTIFIER
                || (t.type == TokenType.KEYWORD && Keyword.isTypeName(t.text)))
                && peekNextIs(TokenType.RBRACKET);

        ArrayType array;
        if (namedIndex) {
            SimpleType index = (SimpleType) typeSpec();
            expect(TokenType.RBRACKET, null);
            expect(TokenType.KEYWORD, Keyword.OF);
            array = new ArrayType(index, typeSpec());
        } else {
            Expression low = expression();
            expect(TokenType.RANGE_OPERATOR, null);
            Expression high = expression();
            expect(TokenType.RBRACKET, null);
            expect(TokenType.KEYWORD, Keyword.OF);
            array = new ArrayType(low, high, typeSpec());
        }
        return array;
    }

    private RecordType recordType() {
        expect(TokenType.KEYWORD, Keyword.RECORD);
        List<VarDeclaration> fields = new ArrayList<>();
        while (match(TokenType.IDENTIFIER, null)) {
            List<String> names = identifierList();
            expect(TokenType.COLON, null);
            fields.add(new VarDeclaration(names, typeSpec()));
            if (!match(TokenType.SEMICOLON, null)) break;
            advance();
        }
        expect(TokenType.KEYWORD, Keyword.END);
        return new RecordType(fields);
    }

    private Expression bound() {
        Token t = advance();
        if (t.type == TokenType.NUMBER) return new NumberLiteral(number(t));
        if (t.type == TokenType.CHAR_LITERAL) return new CharLiteral(unquote(t.text).charAt(0));
        throw new UnexpectedTokenException("subrange bound", t);
    }

    // -------------------------
    // Statements
    // -------------------------

    private CompoundStatement compoundStatement() {
        expect(TokenType.KEYWORD, Keyword.BEGIN);
        List<Stmt> statements = statementList();
        expect(TokenType.KEYWORD, Keyword.END);
        return new CompoundStatement(statements);
    }

    private List<Stmt> statementList() {
        List<Stmt> statements = new ArrayList<>();
        statements.add(statement());
        while (match(TokenType.SEMICOLON, null)) {
            advance();
            statements.add(statement());
        }
        return statements;
    }

    private Stmt statement() {
        if (matchKeyword(Keyword.BEGIN)) return compoundStatement();
        if (matchKeyword(Keyword.IF)) return ifStatement();
        if (matchKeyword(Keyword.WHILE)) return whileStatement();
        if (matchKeyword(Keyword.FOR)) return forStatement();
        if (matchKeyword(Keyword.REPEAT)) return repeatStatement();
        if (matchKeyword(Keyword.CASE)) return caseStatement();
        if (match(TokenType.IDENTIFIER, null)) {
            if (peekNextIs(TokenType.ASSIGN_OPERATOR) || peekNextIs(TokenType.LBRACKET) || peekNextIs(TokenType.DOT)) {
                return assignment();
            }
            return procedureCall();
        }
        return new EmptyStatement();
    }

    private AssignmentStatement assignment() {
        Variable target = variable();
        expect(TokenType.ASSIGN_OPERATOR, null);
        return new AssignmentStatement(target, expression());
    }

    private ProcedureCall procedureCall() {
        Token name = expect(TokenType.IDENTIFIER, null);
        return new ProcedureCall(name.text, match(TokenType.LPARENTHESIS, null) ? arguments() : List.of());
    }

    private IfStatement ifStatement() {
        expect(TokenType.KEYWORD, Keyword.IF);
        Expression condition = expression();
        expect(TokenType.KEYWORD, Keyword.THEN);
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (matchKeyword(Keyword.ELSE)) {
            advance();
            elseBranch = statement();
        }
        return new IfStatement(condition, thenBranch, elseBranch);
    }

    private WhileStatement whileStatement() {
        expect(TokenType.KEYWORD, Keyword.WHILE);
        Expression condition = expression();
        expect(TokenType.KEYWORD, Keyword.DO);
        return new WhileStatement(condition, statement());
    }

    private ForStatement forStatement() {
        expect(TokenType.KEYWORD, Keyword.FOR);
        Token variable = expect(TokenType.IDENTIFIER, null);
        expect(TokenType.ASSIGN_OPERATOR, null);
        Expression start = expression();

        String direction;
        if (matchKeyword(Keyword.TO)) {
            direction = ForStatement.UP;
        } else if (matchKeyword(Keyword.DOWNTO)) {
            direction = ForStatement.DOWN;
        } else {
            throw new UnexpectedTokenException("'" + Keyword.TO + "' or '" + Keyword.DOWNTO + "'", peekOrFail("loop direction"));
        }
        advance();

        Expression end = expression();
        expect(TokenType.KEYWORD, Keyword.DO);
        return new ForStatement(variable.text, start, direction, end, statement());
    }

    private RepeatStatement repeatStatement() {
        expect(TokenType.KEYWORD, Keyword.REPEAT);
        List<Stmt> body = statementList();
        expect(TokenType.KEYWORD, Keyword.UNTIL);
        return new RepeatStatement(body, expression());
    }

    private CaseStatement caseStatement() {
        expect(TokenType.KEYWORD, Keyword.CASE);
        Expression selector = expression();
        expect(TokenType.KEYWORD, Keyword.OF);

        List<CaseBranch> branches = new ArrayList<>();
        while (!matchKeyword(Keyword.END)) {
            List<Object> constants = new ArrayList<>();
            constants.add(constant());
            while (match(TokenType.COMMA, null)) {
                advance();
                constants.add(constant());
            }
            expect(TokenType.COLON, null);
            branches.add(new CaseBranch(constants, statement()));
            if (!match(TokenType.SEMICOLON, null)) break;
            advance();
        }
        expect(TokenType.KEYWORD, Keyword.END);
        return new CaseStatement(selector, branches);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Expression expression() {
        Expression left = simpleExpression();
        if (match(TokenType.RELATIONAL_OPERATOR, null)) {
            String op = advance().text;
            return new BinaryOp(left, op, simpleExpression());
        }
        return left;
    }

    private Expression simpleExpression() {
        Expression expr = term();
        while (match(TokenType.ARITHMETIC_OPERATOR, "+") || match(TokenType.ARITHMETIC_OPERATOR, "-")
                || match(TokenType.LOGICAL_OPERATOR, Keyword.OR)) {
            String op = advance().text.toLowerCase(Locale.ROOT);
            expr = new BinaryOp(expr, op, term());
        }
        return expr;
    }

    private Expression term() {
        Expression expr = factor();
        while (match(TokenType.ARITHMETIC_OPERATOR, "*") || match(TokenType.ARITHMETIC_OPERATOR, "/")
                || match(TokenType.ARITHMETIC_OPERATOR, Keyword.DIV) || match(TokenType.ARITHMETIC_OPERATOR, Keyword.MOD)
                || match(TokenType.LOGICAL_OPERATOR, Keyword.AND)) {
            String op = advance().text.toLowerCase(Locale.ROOT);
            expr = new BinaryOp(expr, op, factor());
        }
        return expr;
    }

    private Expression factor() {
        Token t = peekOrFail("expression");

        switch (t.type) {
            case NUMBER:
                advance();
                return new NumberLiteral(number(t));
            case STRING_LITERAL:
                advance();
                return new StringLiteral(unquote(t.text));
            case CHAR_LITERAL:
                advance();
                return new CharLiteral(unquote(t.text).charAt(0));
            case LPARENTHESIS: {
                advance();
                Expression inner = expression();
                expect(TokenType.RPARENTHESIS, null);
                return inner;
            }
            case LOGICAL_OPERATOR:
                if (t.is(TokenType.LOGICAL_OPERATOR, Keyword.NOT)) {
                    advance();
                    return new UnaryOp(Keyword.NOT, factor());
                }
                break;
            case ARITHMETIC_OPERATOR:
                if (t.text.equals("+") || t.text.equals("-")) {
                    advance();
                    return new UnaryOp(t.text, factor());
                }
                break;
            case KEYWORD:
                if (t.is(TokenType.KEYWORD, Keyword.TRUE) || t.is(TokenType.KEYWORD, Keyword.FALSE)) {
                    advance();
                    return new BooleanLiteral(t.is(TokenType.KEYWORD, Keyword.TRUE));
                }
                break;
            case IDENTIFIER:
                if (peekNextIs(TokenType.LPARENTHESIS)) {
                    advance();
                    return new FunctionCall(t.text, arguments());
                }
                return variable();
            default:
                break;
        }
        throw new UnexpectedTokenException("expression", t);
    }

    private Variable variable() {
        Token name = expect(TokenType.IDENTIFIER, null);
        return new Variable(name.text, accessSteps());
    }

    /** Index and field steps after a variable name, first step at the head; null when there are none. */
    private Variable accessSteps() {
        if (match(TokenType.LBRACKET, null)) {
            advance();
            List<Expression> indices = new ArrayList<>();
            indices.add(expression());
            while (match(TokenType.COMMA, null)) {
                advance();
                indices.add(expression());
            }
            expect(TokenType.RBRACKET, null);
            return Variable.indexStep(indices, accessSteps());
        }
        if (match(TokenType.DOT, null) && peekNextIs(TokenType.IDENTIFIER)) {
            advance();
            String field = advance().text;
            return Variable.fieldStep(field, accessSteps());
        }
        return null;
    }

    private List<Expression> arguments() {
        expect(TokenType.LPARENTHESIS, null);
        List<Expression> args = new ArrayList<>();
        if (!match(TokenType.RPARENTHESIS, null)) {
            args.add(expression());
            while (match(TokenType.COMMA, null)) {
                advance();
                args.add(expression());
            }
        }
        expect(TokenType.RPARENTHESIS, null);
        return args;
    }

    private Object constant() {
        Token t = peekOrFail("constant");
        switch (t.type) {
            case NUMBER:
                advance();
                return number(t);
            case STRING_LITERAL:
            case CHAR_LITERAL:
                advance();
                return unquote(t.text);
            case KEYWORD:
                if (t.is(TokenType.KEYWORD, Keyword.TRUE) || t.is(TokenType.KEYWORD, Keyword.FALSE)) {
                    advance();
                    return t.is(TokenType.KEYWORD, Keyword.TRUE);
                }
                break;
            default:
                break;
        }
        throw new UnexpectedTokenException("constant", t);
    }

    private static Number number(Token t) {
        String text = t.text;
        try {
            if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Malformed number '" + text + "'", t);
        }
    }

    private static String unquote(String raw) {
        return raw.substring(1, raw.length() - 1).replace("''", "'");
    }

    // -------------------------
    // Token cursor
    // -------------------------

    boolean match(TokenType type, String value) {
        return !isAtEnd() && peek().is(type, value);
    }

    Token expect(TokenType type, String value) {
        String expected = value != null ? "'" + value + "'" : type.name();
        if (isAtEnd()) throw new UnexpectedEndOfInputException(expected);
        if (!peek().is(type, value)) throw new UnexpectedTokenException(expected, peek());
        return advance();
    }

    Token advance() {
        if (isAtEnd()) throw new UnexpectedEndOfInputException("more input");
        return tokens.get(current++);
    }

    private boolean matchKeyword(String keyword) {
        return match(TokenType.KEYWORD, keyword);
    }

    private boolean peekNextIs(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type == type;
    }

    private Token peekOrFail(String expected) {
        if (isAtEnd()) throw new UnexpectedEndOfInputException(expected);
        return peek();
    }

    private boolean isAtEnd() { return current >= tokens.size(); }
    private Token peek() { return tokens.get(current); }
}
