package com.herzen.ink.markup;

import com.herzen.ink.markup.MarkupModels.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for the expression language used inside braces and choice conditions.
 *
 * <pre>
 * or         := and (("or" | "||") and)*
 * and        := not (("and" | "&amp;&amp;") not)*
 * not        := ("not" | "!") not | comparison
 * comparison := additive (("==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") additive)?
 * additive   := term (("+" | "-") term)*
 * term       := unary (("*" | "/" | "%" | "mod") unary)*
 * unary      := "-" unary | primary
 * primary    := number | string | "true" | "false" | name ("." name)? | "(" or ")"
 * </pre>
 */
public class ExpressionParser {
    private static final Map<String, BinaryOp> COMPARISONS = Map.of(
            "==", BinaryOp.EQUAL, "!=", BinaryOp.NOT_EQUAL,
            "<", BinaryOp.LESS, "<=", BinaryOp.LESS_OR_EQUAL,
            ">", BinaryOp.GREATER, ">=", BinaryOp.GREATER_OR_EQUAL);

    private final List<Token> tokens;
    private int pos;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Expression parse(String source) {
        if (source.isBlank()) {
            throw new MarkupSyntaxException("EMPTY_EXPRESSION", "Expression is empty");
        }
        ExpressionParser parser = new ExpressionParser(tokenize(source));
        Expression expression = parser.or();
        if (parser.pos < parser.tokens.size()) {
            throw new MarkupSyntaxException("INVALID_EXPRESSION",
                    "Unexpected '" + parser.tokens.get(parser.pos).text() + "' in expression: " + source.trim());
        }
        return expression;
    }

    private Expression or() {
        Expression left = and();
        while (accept("or", "||")) {
            left = new Binary(BinaryOp.OR, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = not();
        while (accept("and", "&&")) {
            left = new Binary(BinaryOp.AND, left, not());
        }
        return left;
    }

    private Expression not() {
        if (accept("not", "!")) {
            return new Unary(UnaryOp.NOT, not());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = additive();
        Token next = peek();
        if (next != null && next.kind() == Kind.OPERATOR && COMPARISONS.containsKey(next.text())) {
            pos++;
            return new Binary(COMPARISONS.get(next.text()), left, additive());
        }
        return left;
    }

    private Expression additive() {
        Expression left = term();
        while (true) {
            if (accept("+")) left = new Binary(BinaryOp.ADD, left, term());
            else if (accept("-")) left = new Binary(BinaryOp.SUBTRACT, left, term());
            else return left;
        }
    }

    private Expression term() {
        Expression left = unary();
        while (true) {
            if (accept("*")) left = new Binary(BinaryOp.MULTIPLY, left, unary());
            else if (accept("/")) left = new Binary(BinaryOp.DIVIDE, left, unary());
            else if (accept("%", "mod")) left = new Binary(BinaryOp.REMAINDER, left, unary());
            else return left;
        }
    }

    private Expression unary() {
        if (accept("-")) {
            return new Unary(UnaryOp.NEGATE, unary());
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        if (token == null) {
            throw new MarkupSyntaxException("INVALID_EXPRESSION", "Expression ends unexpectedly");
        }
        pos++;
        switch (token.kind()) {
            case NUMBER -> {
                InkValue number = InkValue.parseLiteral(token.text());
                if (number == null) {
                    throw new MarkupSyntaxException("INVALID_EXPRESSION", "Number out of range: " + token.text());
                }
                return new Constant(number);
            }
            case STRING -> {
                return new Constant(new InkValue.Text(token.text()));
            }
            case NAME -> {
                return switch (token.text()) {
                    case "true" -> new Constant(new InkValue.Bool(true));
                    case "false" -> new Constant(new InkValue.Bool(false));
                    case "and", "or", "not", "mod" -> throw new MarkupSyntaxException("INVALID_EXPRESSION",
                            "Unexpected keyword '" + token.text() + "'");
                    default -> new Reference(token.text());
                };
            }
            default -> {
                if (token.text().equals("(")) {
                    Expression inner = or();
                    if (!accept(")")) {
                        throw new MarkupSyntaxException("INVALID_EXPRESSION", "Missing ')' in expression");
                    }
                    return inner;
                }
                throw new MarkupSyntaxException("INVALID_EXPRESSION", "Unexpected '" + token.text() + "' in expression");
            }
        }
    }

    private boolean accept(String... texts) {
        Token token = peek();
        if (token == null || token.kind() == Kind.STRING) return false;
        for (String text : texts) {
            if (token.text().equals(text)) {
                pos++;
                return true;
            }
        }
        return false;
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < source.length() && Character.isDigit(source.charAt(i))) i++;
                if (i + 1 < source.length() && source.charAt(i) == '.' && Character.isDigit(source.charAt(i + 1))) {
                    i++;
                    while (i < source.length() && Character.isDigit(source.charAt(i))) i++;
                }
                tokens.add(new Token(Kind.NUMBER, source.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < source.length() && isNameChar(source.charAt(i))) i++;
                tokens.add(new Token(Kind.NAME, source.substring(start, i)));
            } else if (c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < source.length() && source.charAt(i) != '"') {
                    if (source.charAt(i) == '\\' && i + 1 < source.length()) i++;
                    sb.append(source.charAt(i++));
                }
                if (i >= source.length()) {
                    throw new MarkupSyntaxException("INVALID_EXPRESSION", "Unterminated string in expression");
                }
                i++;
                tokens.add(new Token(Kind.STRING, sb.toString()));
            } else {
                String two = i + 1 < source.length() ? source.substring(i, i + 2) : "";
                if (List.of("==", "!=", "<=", ">=", "&&", "||").contains(two)) {
                    tokens.add(new Token(Kind.OPERATOR, two));
                    i += 2;
                } else if ("+-*/%<>!()".indexOf(c) >= 0) {
                    tokens.add(new Token(Kind.OPERATOR, String.valueOf(c)));
                    i++;
                } else {
                    throw new MarkupSyntaxException("INVALID_EXPRESSION", "Unexpected character '" + c + "' in expression");
                }
            }
        }
        return tokens;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    enum Kind { NUMBER, STRING, NAME, OPERATOR }

    record Token(Kind kind, String text) {}
}
