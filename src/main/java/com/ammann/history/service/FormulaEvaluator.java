/* (C)2026 */
package com.ammann.history.service;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates unit conversion formulas such as {@code value * 1.94384} or
 * {@code (x - 273.15) * 9 / 5 + 32}.
 *
 * <p>Grammar: numbers, the variable {@code value} (or {@code x}), binary {@code + - * /},
 * unary minus and parentheses. Formulas are parsed once into an expression tree and
 * cached; nothing is ever executed as code.
 */
@ApplicationScoped
public class FormulaEvaluator {

    private final Map<String, Expression> compiled = new ConcurrentHashMap<>();

    /**
     * Applies a formula to one value.
     *
     * @throws IllegalArgumentException when the formula is not valid
     */
    public double evaluate(String formula, double value) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula is missing");
        }
        return compiled.computeIfAbsent(formula, f -> new Parser(f).parse()).evaluate(value);
    }

    int compiledFormulas() {
        return compiled.size();
    }

    @FunctionalInterface
    interface Expression {
        double evaluate(double value);
    }

    private static final class Parser {
        private final String input;
        private int position;

        Parser(String input) {
            this.input = input;
        }

        Expression parse() {
            Expression expression = parseSum();
            skipWhitespace();
            if (position < input.length()) {
                throw error("Unexpected '" + input.charAt(position) + "'");
            }
            return expression;
        }

        private Expression parseSum() {
            Expression left = parseProduct();
            while (true) {
                if (accept('+')) {
                    Expression l = left;
                    Expression r = parseProduct();
                    left = v -> l.evaluate(v) + r.evaluate(v);
                } else if (accept('-')) {
                    Expression l = left;
                    Expression r = parseProduct();
                    left = v -> l.evaluate(v) - r.evaluate(v);
                } else {
                    return left;
                }
            }
        }

        private Expression parseProduct() {
            Expression left = parseUnary();
            while (true) {
                if (accept('*')) {
                    Expression l = left;
                    Expression r = parseUnary();
                    left = v -> l.evaluate(v) * r.evaluate(v);
                } else if (accept('/')) {
                    Expression l = left;
                    Expression r = parseUnary();
                    left = v -> l.evaluate(v) / r.evaluate(v);
                } else {
                    return left;
                }
            }
        }

        private Expression parseUnary() {
            if (accept('-')) {
                Expression operand = parseUnary();
                return v -> -operand.evaluate(v);
            }
            if (accept('+')) {
                return parseUnary();
            }
            return parsePrimary();
        }

        private Expression parsePrimary() {
            skipWhitespace();
            if (accept('(')) {
                Expression inner = parseSum();
                if (!accept(')')) {
                    throw error("Missing ')'");
                }
                return inner;
            }
            if (position >= input.length()) {
                throw error("Unexpected end of formula");
            }
            char c = input.charAt(position);
            if (Character.isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (Character.isLetter(c)) {
                int start = position;
                while (position < input.length() && Character.isLetterOrDigit(input.charAt(position))) {
                    position++;
                }
                String identifier = input.substring(start, position).toLowerCase(Locale.ROOT);
                if (identifier.equals("value") || identifier.equals("x")) {
                    return v -> v;
                }
                throw error("Unknown identifier '" + input.substring(start, position) + "'");
            }
            throw error("Unexpected '" + c + "'");
        }

        private Expression parseNumber() {
            int start = position;
            while (position < input.length()
                    && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '.')) {
                position++;
            }
            if (position < input.length() && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
                int mark = position++;
                if (position < input.length() && (input.charAt(position) == '+' || input.charAt(position) == '-')) {
                    position++;
                }
                if (position >= input.length() || !Character.isDigit(input.charAt(position))) {
                    position = mark;
                } else {
                    while (position < input.length() && Character.isDigit(input.charAt(position))) {
                        position++;
                    }
                }
            }
            String literal = input.substring(start, position);
            try {
                double constant = Double.parseDouble(literal);
                return v -> constant;
            } catch (NumberFormatException e) {
                throw error("Invalid number '" + literal + "'");
            }
        }

        private boolean accept(char expected) {
            skipWhitespace();
            if (position < input.length() && input.charAt(position) == expected) {
                position++;
                return true;
            }
            return false;
        }

        private void skipWhitespace() {
            while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
                position++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(
                    message + " at position " + position + " in formula '" + input + "'");
        }
    }
}
