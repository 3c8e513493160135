package com.spreadsheet.transpiler.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Executes generated programs.
 * <p>
 * Grammar:
 * <pre>
 *   program    := statement*
 *   statement  := "var" NAME "=" expression ";"
 *   expression := term (("+" | "-") term)*
 *   term       := unary (("*" | "/") unary)*
 *   unary      := ("+" | "-")* primary
 *   primary    := NUMBER | NAME | NAME "(" [expression ("," expression)*] ")" | "(" expression ")"
 * </pre>
 * Arithmetic is IEEE double. The whole program is parsed before anything runs,
 * so one malformed statement fails the run. Declared names are known from the
 * start: a name read before its statement ran is NaN, an undeclared name is an error.
 * <p>
 * Operator chains are parsed into flat operand lists and evaluated in a loop, so a
 * range sum over a whole row costs no stack. Parentheses and call arguments may nest
 * at most 256 levels; deeper input fails as a syntax error.
 */
@Component
public class ProgramInterpreter implements ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ProgramInterpreter.class);

    private static final String KEYWORD = "var";

    // Callable functions; Math.min() is +Infinity and Math.max() is -Infinity, as in JavaScript
    private static final Map<String, Function> FUNCTIONS = Map.of(
            "Math.min", args -> fold(args, Double.POSITIVE_INFINITY, Math::min),
            "Math.max", args -> fold(args, Double.NEGATIVE_INFINITY, Math::max)
    );

    @Override
    public EvaluationResult evaluate(String program, String identifier) {
        try (InterpreterScope scope = new InterpreterScope()) {
            List<Statement> statements = new Parser(new Lexer(program == null ? "" : program).tokenize()).parseProgram();
            statements.forEach(s -> scope.declare(s.name));
            for (Statement statement : statements) {
                scope.assign(statement.name, statement.expression.eval(scope));
            }
            return EvaluationResult.of(scope.read(identifier));
        } catch (ProgramEvaluationException e) {
            log.debug("Evaluation of {} failed: {}", identifier, e.getMessage());
            return EvaluationResult.failure(e.getMessage());
        }
    }

    private static double fold(double[] args, double identity, DoubleBinaryOperator op) {
        double result = identity;
        for (double arg : args) {
            result = op.applyAsDouble(result, arg);
        }
        return result;
    }

    // =========================================================
    // AST
    // =========================================================

    @FunctionalInterface
    private interface Function {
        double apply(double[] args);
    }

    @FunctionalInterface
    private interface Node {
        double eval(InterpreterScope scope);
    }

    private static final class Statement {
        final String name;
        final Node expression;

        Statement(String name, Node expression) {
            this.name = name;
            this.expression = expression;
        }
    }

    // =========================================================
    // Lexer
    // =========================================================

    private enum TokenType {
        NUMBER, NAME, PLUS, MINUS, STAR, SLASH, LPAREN, RPAREN, COMMA, ASSIGN, SEMICOLON, EOF
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }

    private static final class Lexer {
        private final String source;
        private int pos;

        Lexer(String source) {
            this.source = source;
        }

        List<Token> tokenize() {
            List<Token> tokens = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (pos >= source.length()) {
                    tokens.add(new Token(TokenType.EOF, "", pos));
                    return tokens;
                }
                char c = source.charAt(pos);
                if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                    tokens.add(number());
                } else if (isNameStart(c)) {
                    tokens.add(name());
                } else {
                    tokens.add(symbol(c));
                }
            }
        }

        private void skipWhitespace() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }

        private Token number() {
            int start = pos;
            digits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                digits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    digits();
                } else {
                    pos = mark;
                }
            }
            if (pos < source.length() && isNameStart(source.charAt(pos))) {
                throw new ProgramEvaluationException("Invalid number at position " + start);
            }
            return new Token(TokenType.NUMBER, source.substring(start, pos), start);
        }

        private void digits() {
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }

        // Dotted names such as Math.min are read as one token
        private Token name() {
            int start = pos;
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (isNamePart(c)) {
                    pos++;
                } else if (c == '.' && pos + 1 < source.length() && isNameStart(source.charAt(pos + 1))) {
                    pos++;
                } else {
                    break;
                }
            }
            return new Token(TokenType.NAME, source.substring(start, pos), start);
        }

        private Token symbol(char c) {
            int start = pos++;
            switch (c) {
                case '+': return new Token(TokenType.PLUS, "+", start);
                case '-': return new Token(TokenType.MINUS, "-", start);
                case '*': return new Token(TokenType.STAR, "*", start);
                case '/': return new Token(TokenType.SLASH, "/", start);
                case '(': return new Token(TokenType.LPAREN, "(", start);
                case ')': return new Token(TokenType.RPAREN, ")", start);
                case ',': return new Token(TokenType.COMMA, ",", start);
                case '=': return new Token(TokenType.ASSIGN, "=", start);
                case ';': return new Token(TokenType.SEMICOLON, ";", start);
                default:
                    throw new ProgramEvaluationException("Unexpected character '" + c + "' at position " + start);
            }
        }

        private static boolean isNameStart(char c) {
            return Character.isLetter(c) || c == '_' || c == '$';
        }

        private static boolean isNamePart(char c) {
            return isNameStart(c) || Character.isDigit(c);
        }
    }

    // =========================================================
    // Parser
    // =========================================================

    private static final class Parser {
        private static final int MAX_NESTING = 256;

        private final List<Token> tokens;
        private int index;
        private int nesting;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        List<Statement> parseProgram() {
            List<Statement> statements = new ArrayList<>();
            while (peek().type != TokenType.EOF) {
                statements.add(parseStatement());
            }
            return statements;
        }

        private Statement parseStatement() {
            Token keyword = expect(TokenType.NAME, "'" + KEYWORD + "'");
            if (!KEYWORD.equals(keyword.text)) {
                throw error("Expected '" + KEYWORD + "'", keyword);
            }
            Token name = expect(TokenType.NAME, "variable name");
            expect(TokenType.ASSIGN, "'='");
            Node expression = parseExpression();
            expect(TokenType.SEMICOLON, "';'");
            return new Statement(name.text, expression);
        }

        // "a + b - c ..." is kept as one flat operand list, so long sums never nest
        private Node parseExpression() {
            Node first = parseTerm();
            if (peek().type != TokenType.PLUS && peek().type != TokenType.MINUS) {
                return first;
            }
            List<Node> operands = new ArrayList<>();
            List<Boolean> subtract = new ArrayList<>();
            operands.add(first);
            while (peek().type == TokenType.PLUS || peek().type == TokenType.MINUS) {
                subtract.add(next().type == TokenType.MINUS);
                operands.add(parseTerm());
            }
            Node[] nodes = operands.toArray(new Node[0]);
            boolean[] minus = toArray(subtract);
            return scope -> {
                double result = nodes[0].eval(scope);
                for (int i = 1; i < nodes.length; i++) {
                    double value = nodes[i].eval(scope);
                    result = minus[i - 1] ? result - value : result + value;
                }
                return result;
            };
        }

        private Node parseTerm() {
            Node first = parseUnary();
            if (peek().type != TokenType.STAR && peek().type != TokenType.SLASH) {
                return first;
            }
            List<Node> operands = new ArrayList<>();
            List<Boolean> divide = new ArrayList<>();
            operands.add(first);
            while (peek().type == TokenType.STAR || peek().type == TokenType.SLASH) {
                divide.add(next().type == TokenType.SLASH);
                operands.add(parseUnary());
            }
            Node[] nodes = operands.toArray(new Node[0]);
            boolean[] slash = toArray(divide);
            return scope -> {
                double result = nodes[0].eval(scope);
                for (int i = 1; i < nodes.length; i++) {
                    double value = nodes[i].eval(scope);
                    result = slash[i - 1] ? result / value : result * value;
                }
                return result;
            };
        }

        // Leading signs are counted, not recursed into
        private Node parseUnary() {
            boolean negate = false;
            while (peek().type == TokenType.MINUS || peek().type == TokenType.PLUS) {
                if (next().type == TokenType.MINUS) {
                    negate = !negate;
                }
            }
            Node operand = parsePrimary();
            return negate ? scope -> -operand.eval(scope) : operand;
        }

        private Node parsePrimary() {
            Token token = next();
            switch (token.type) {
                case NUMBER: {
                    double value = Double.parseDouble(token.text);
                    return scope -> value;
                }
                case NAME:
                    if (peek().type == TokenType.LPAREN) {
                        return parseCall(token);
                    }
                    return scope -> scope.read(token.text);
                case LPAREN: {
                    Node inner = parseNested(token);
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                }
                default:
                    throw error("Unexpected " + describe(token), token);
            }
        }

        // Parentheses and call arguments are the only recursion; their depth is capped
        private Node parseNested(Token opening) {
            if (++nesting > MAX_NESTING) {
                throw error("Expression nested more than " + MAX_NESTING + " levels deep", opening);
            }
            Node inner = parseExpression();
            nesting--;
            return inner;
        }

        private static boolean[] toArray(List<Boolean> flags) {
            boolean[] result = new boolean[flags.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = flags.get(i);
            }
            return result;
        }

        private Node parseCall(Token name) {
            expect(TokenType.LPAREN, "'('");
            List<Node> args = new ArrayList<>();
            if (peek().type != TokenType.RPAREN) {
                args.add(parseNested(name));
                while (peek().type == TokenType.COMMA) {
                    next();
                    args.add(parseNested(name));
                }
            }
            expect(TokenType.RPAREN, "')'");
            return scope -> {
                Function function = FUNCTIONS.get(name.text);
                if (function == null) {
                    throw new ProgramEvaluationException(name.text + " is not a function");
                }
                double[] values = new double[args.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = args.get(i).eval(scope);
                }
                return function.apply(values);
            };
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token token = tokens.get(index);
            if (token.type != TokenType.EOF) {
                index++;
            }
            return token;
        }

        private Token expect(TokenType type, String what) {
            Token token = next();
            if (token.type != type) {
                throw error("Expected " + what + " but found " + describe(token), token);
            }
            return token;
        }

        private static String describe(Token token) {
            return token.type == TokenType.EOF ? "end of program" : "'" + token.text + "'";
        }

        private static ProgramEvaluationException error(String message, Token token) {
            return new ProgramEvaluationException("SyntaxError: " + message + " at position " + token.position);
        }
    }
}
