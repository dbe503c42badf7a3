package com.challenges.tslgen.parser;

import com.challenges.tslgen.model.Expression;
import com.challenges.tslgen.model.Property;
import com.challenges.tslgen.parser.TslParseException.ErrorType;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Parses the boolean expression of an {@code [if ...]} constraint.
 *
 * <pre>
 * or    := and ('||' and)*
 * and   := unary ('&amp;&amp;' unary)*
 * unary := '!' unary | atom
 * atom  := '(' or ')' | property
 * </pre>
 *
 * Every property must already be known to the parser. Columns in errors are 1-based
 * positions within the expression text.
 */
public class ExpressionParser {
    private final MapIterable<String, Property> properties;

    public ExpressionParser(MapIterable<String, Property> properties) {
        this.properties = properties;
    }

    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new TslParseException(ErrorType.EXPRESSION, "Empty expression");
        }

        Cursor cursor = new Cursor(tokenize(text));
        Expression expression = parseOr(cursor);
        if (cursor.hasNext()) {
            Token extra = cursor.peek();
            if (extra.kind() == Kind.RPAREN) {
                throw error("Unmatched closing parenthesis", extra.column());
            }
            throw error("Unexpected '" + extra.text() + "', expected && or ||", extra.column());
        }
        return expression;
    }

    private Expression parseOr(Cursor cursor) {
        Expression left = parseAnd(cursor);
        while (cursor.at(Kind.OR)) {
            Token operator = cursor.next();
            requireOperand(cursor, operator);
            left = Expression.or(left, parseAnd(cursor));
        }
        return left;
    }

    private Expression parseAnd(Cursor cursor) {
        Expression left = parseUnary(cursor);
        while (cursor.at(Kind.AND)) {
            Token operator = cursor.next();
            requireOperand(cursor, operator);
            left = Expression.and(left, parseUnary(cursor));
        }
        return left;
    }

    private Expression parseUnary(Cursor cursor) {
        if (cursor.at(Kind.NOT)) {
            Token not = cursor.next();
            if (!cursor.hasNext()) {
                throw error("Missing operand after negation (!)", not.column());
            }
            return parseUnary(cursor).negate();
        }
        return parseAtom(cursor);
    }

    private Expression parseAtom(Cursor cursor) {
        Token token = cursor.next();
        switch (token.kind()) {
            case LPAREN -> {
                if (cursor.at(Kind.RPAREN)) {
                    throw error("Empty parentheses", token.column());
                }
                if (!cursor.hasNext()) {
                    throw error("Unmatched opening parenthesis", token.column());
                }
                Expression inner = parseOr(cursor);
                if (!cursor.at(Kind.RPAREN)) {
                    throw error("Unmatched opening parenthesis", token.column());
                }
                cursor.next();
                return inner;
            }
            case IDENTIFIER -> {
                Property property = properties.get(token.text());
                if (property == null) {
                    throw new TslParseException(ErrorType.PROPERTY,
                            "The property \"" + token.text() + "\" is not defined", 0, token.column(), null);
                }
                return Expression.of(property);
            }
            case RPAREN -> throw error("Unmatched closing parenthesis", token.column());
            default -> throw error("Missing operand before '" + token.text() + "'", token.column());
        }
    }

    private void requireOperand(Cursor cursor, Token operator) {
        if (!cursor.hasNext()) {
            throw error("Missing operand after '" + operator.text() + "'", operator.column());
        }
    }

    private MutableList<Token> tokenize(String text) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int column = i + 1;
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '!') {
                tokens.add(new Token(Kind.NOT, "!", column));
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", column));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", column));
                i++;
            } else if (c == '&' || c == '|') {
                if (i + 1 >= text.length() || text.charAt(i + 1) != c) {
                    throw error("Expected '" + c + c + "'", column);
                }
                tokens.add(c == '&' ? new Token(Kind.AND, "&&", column) : new Token(Kind.OR, "||", column));
                i += 2;
            } else {
                // Property names run up to the next operator or parenthesis and may contain blanks.
                int start = i;
                while (i < text.length() && "!()&|".indexOf(text.charAt(i)) < 0) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, text.substring(start, i).trim(), column));
            }
        }
        return tokens;
    }

    private static TslParseException error(String message, int column) {
        return new TslParseException(ErrorType.EXPRESSION, message, 0, column, null);
    }

    private enum Kind {
        IDENTIFIER, NOT, AND, OR, LPAREN, RPAREN
    }

    private record Token(Kind kind, String text, int column) {
    }

    private static final class Cursor {
        private final MutableList<Token> tokens;
        private int position;

        Cursor(MutableList<Token> tokens) {
            this.tokens = tokens;
        }

        boolean hasNext() {
            return position < tokens.size();
        }

        boolean at(Kind kind) {
            return hasNext() && tokens.get(position).kind() == kind;
        }

        Token peek() {
            return tokens.get(position);
        }

        Token next() {
            if (!hasNext()) {
                int column = tokens.isEmpty() ? 1 : tokens.getLast().column() + tokens.getLast().text().length();
                throw error("Missing operand at end of expression", column);
            }
            return tokens.get(position++);
        }
    }
}
