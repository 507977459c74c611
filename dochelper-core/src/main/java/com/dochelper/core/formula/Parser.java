package com.dochelper.core.formula;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for formulas.
 *
 * Grammar (lowest to highest precedence):
 * expression     = logical_or
 * logical_or     = logical_and ( "or" logical_and )*
 * logical_and    = logical_not ( "and" logical_not )*
 * logical_not    = "not" logical_not | equality
 * equality       = relational ( ( "==" | "!=" ) relational )*
 * relational     = additive ( ( "<" | "<=" | ">" | ">=" ) additive )*
 * additive       = multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative = power ( ( "*" | "/" | "%" ) power )*
 * power          = unary ( "**" power )?
 * unary          = ( "+" | "-" ) unary | primary
 * primary        = NUMBER | STRING | "true" | "false" | "null"
 *                | IDENTIFIER "(" ( expression ( "," expression )* )? ")"
 *                | IDENTIFIER | "(" expression ")"
 *
 * The parser does not check that fields or functions exist. Trees taller than the depth limit
 * are rejected, so a flat chain such as {@code a + b + c} counts one level per operator. An
 * instance keeps parse state, so use one per thread.
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final int maxDepth;
    private List<Token> tokens = new ArrayList<>();
    private int position = 0;
    private int depth = 0;
    private final Map<AstNode, Integer> heights = new IdentityHashMap<>();

    public Parser() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth tallest tree accepted, also the deepest nesting of parentheses and calls
     */
    public Parser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Parse source string into an AST
     */
    public ParseResult parse(String source) {
        Lexer.TokenizeResult lexed = Lexer.tokenize(source);
        if (!lexed.success()) {
            Lexer.LexError lexError = lexed.error();
            return ParseResult.failed(new ParseError("valid token", lexError.found(), lexError.position()));
        }
        return parse(lexed.tokens());
    }

    /**
     * Parse an already tokenized formula. The list must end with an EOF token.
     */
    public ParseResult parse(List<Token> tokenList) {
        this.tokens = tokenList;
        this.position = 0;
        this.depth = 0;
        heights.clear();
        try {
            if (check(TokenType.EOF)) {
                throw error("expression");
            }

            AstNode ast = expression();

            // Ensure we consumed all tokens
            if (!check(TokenType.EOF)) {
                throw error("end of formula");
            }

            return ParseResult.ok(ast);
        } catch (ParserException e) {
            return ParseResult.failed(e.error());
        } finally {
            heights.clear();
        }
    }

    // ========== Parser Methods ==========

    private AstNode expression() {
        enter();
        try {
            return logicalOr();
        } finally {
            depth--;
        }
    }

    private AstNode logicalOr() {
        AstNode left = logicalAnd();

        while (check(TokenType.OR)) {
            advance();
            AstNode right = logicalAnd();
            left = measured(new AstNode.BinaryOp("or", left, right), left, right);
        }

        return left;
    }

    private AstNode logicalAnd() {
        AstNode left = logicalNot();

        while (check(TokenType.AND)) {
            advance();
            AstNode right = logicalNot();
            left = measured(new AstNode.BinaryOp("and", left, right), left, right);
        }

        return left;
    }

    private AstNode logicalNot() {
        if (check(TokenType.NOT)) {
            advance();
            enter();
            try {
                AstNode operand = logicalNot();
                return measured(new AstNode.UnaryOp("not", operand), operand);
            } finally {
                depth--;
            }
        }
        return equality();
    }

    private AstNode equality() {
        AstNode left = relational();

        while (check(TokenType.EQ) || check(TokenType.NE)) {
            String operator = advance().value();
            AstNode right = relational();
            left = measured(new AstNode.BinaryOp(operator, left, right), left, right);
        }

        return left;
    }

    private AstNode relational() {
        AstNode left = additive();

        while (check(TokenType.LT) || check(TokenType.LE) ||
               check(TokenType.GT) || check(TokenType.GE)) {
            String operator = advance().value();
            AstNode right = additive();
            left = measured(new AstNode.BinaryOp(operator, left, right), left, right);
        }

        return left;
    }

    private AstNode additive() {
        AstNode left = multiplicative();

        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            String operator = advance().value();
            AstNode right = multiplicative();
            left = measured(new AstNode.BinaryOp(operator, left, right), left, right);
        }

        return left;
    }

    private AstNode multiplicative() {
        AstNode left = power();

        while (check(TokenType.MULTIPLY) || check(TokenType.DIVIDE) || check(TokenType.MODULO)) {
            String operator = advance().value();
            AstNode right = power();
            left = measured(new AstNode.BinaryOp(operator, left, right), left, right);
        }

        return left;
    }

    private AstNode power() {
        AstNode left = unary();

        if (check(TokenType.POWER)) {
            advance();
            enter();
            try {
                // right-associative: 2 ** 3 ** 2 == 2 ** (3 ** 2)
                AstNode right = power();
                return measured(new AstNode.BinaryOp("**", left, right), left, right);
            } finally {
                depth--;
            }
        }

        return left;
    }

    private AstNode unary() {
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            String operator = advance().value();
            enter();
            try {
                AstNode operand = unary();
                return measured(new AstNode.UnaryOp(operator, operand), operand);
            } finally {
                depth--;
            }
        }
        return primary();
    }

    private AstNode primary() {
        Token token = current();

        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new AstNode.Literal(Value.of(Double.parseDouble(token.value())));
            }
            case STRING -> {
                advance();
                return new AstNode.Literal(Value.of(token.value()));
            }
            case TRUE -> {
                advance();
                return new AstNode.Literal(Value.of(true));
            }
            case FALSE -> {
                advance();
                return new AstNode.Literal(Value.of(false));
            }
            case NULL -> {
                advance();
                return new AstNode.Literal(Value.nullValue());
            }
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LPAREN)) {
                    return functionCall(token.value());
                }
                return new AstNode.FieldReference(token.value());
            }
            case LPAREN -> {
                advance();
                AstNode expr = expression();
                expect(TokenType.RPAREN, "')'");
                return expr;
            }
            default -> throw error("expression");
        }
    }

    private AstNode.FunctionCall functionCall(String name) {
        expect(TokenType.LPAREN, "'('");
        List<AstNode> args = new ArrayList<>();

        if (!check(TokenType.RPAREN)) {
            args.add(expression());
            while (check(TokenType.COMMA)) {
                advance();
                args.add(expression());
            }
        }

        expect(TokenType.RPAREN, "')' or ','");
        return measured(new AstNode.FunctionCall(name, args), args.toArray(new AstNode[0]));
    }

    // ========== Helper Methods ==========

    private Token current() {
        if (position >= tokens.size()) {
            int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position();
            return Token.eof(end);
        }
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private Token advance() {
        Token token = current();
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String expected) {
        if (!check(type)) {
            throw error(expected);
        }
        advance();
    }

    private void enter() {
        if (++depth > maxDepth) {
            depth = 0;
            throw tooDeep();
        }
    }

    /**
     * Record the height of a new interior node; leaves count as height 1.
     */
    private <T extends AstNode> T measured(T node, AstNode... children) {
        int height = 1;
        for (AstNode child : children) {
            height = Math.max(height, heights.getOrDefault(child, 1) + 1);
        }
        if (height > maxDepth) {
            throw tooDeep();
        }
        heights.put(node, height);
        return node;
    }

    private ParserException tooDeep() {
        Token token = current();
        return new ParserException(new ParseError("nesting depth <= " + maxDepth, describe(token), token.position()));
    }

    private ParserException error(String expected) {
        Token token = current();
        return new ParserException(new ParseError(expected, describe(token), token.position()));
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of formula" : "'" + token.value() + "'";
    }

    // ========== Result Types ==========

    /**
     * Parse failure: what the parser expected, what it found and where.
     */
    public record ParseError(String expected, String found, int position) {
        public String message() {
            return "Expected " + expected + " but found " + found + " at position " + position;
        }
    }

    /**
     * Result of parsing; exactly one of {@code ast} and {@code error} is set.
     */
    public record ParseResult(boolean success, AstNode ast, ParseError error) {
        public static ParseResult ok(AstNode ast) {
            return new ParseResult(true, ast, null);
        }

        public static ParseResult failed(ParseError error) {
            return new ParseResult(false, null, error);
        }

        public Integer errorPosition() {
            return error != null ? error.position() : null;
        }
    }

    /**
     * Exception thrown during parsing
     */
    public static class ParserException extends RuntimeException {
        private final transient ParseError error;

        public ParserException(ParseError error) {
            super(error.message());
            this.error = error;
        }

        public ParseError error() {
            return error;
        }
    }
}
