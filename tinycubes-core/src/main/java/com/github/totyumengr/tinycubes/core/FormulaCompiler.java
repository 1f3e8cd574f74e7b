/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.tinycubes.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Turns formula strings into native {@link Rule}s.
 * 
 * <pre>
 * [Profit] = [Sales] - [Cost]          ALL_LEVELS rule on Profit
 * A:[Margin] = [Profit] / [Sales]      AGGREGATION_LEVEL rule on Margin
 * P:[Cost] = [Sales] * 0.75            ON_ENTRY rule on Sales writing Cost
 * </pre>
 * 
 * Expressions support {@code + - * /}, unary minus, parentheses, decimal literals and {@code [token]} references,
 * a token is any cell modifier accepted by {@link Cell#get(String...)}. A push-down formula emits one rule per
 * distinct referenced token, each writes the target whenever that token is written.
 * 
 * @author mengran
 *
 */
public final class FormulaCompiler {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaCompiler.class);
    
    private FormulaCompiler() {
    }
    
    /**
     * Compiled expression.
     */
    @FunctionalInterface
    interface Expression {
        double evaluate(Cell cell);
    }
    
    /**
     * @return the emitted rules, not yet registered
     * @throws InvalidKeyException if the formula refers to an unknown member or measure
     * @throws IllegalArgumentException on syntax errors
     */
    public static List<Rule> compile(Cube cube, String formula) {
        
        Assert.notNull(cube, "Cube can not null.");
        Assert.hasText(formula, "Formula can not empty.");
        String text = formula.trim();
        RuleScope scope = RuleScope.ALL_LEVELS;
        if (text.regionMatches(true, 0, "P:", 0, 2)) {
            scope = RuleScope.ON_ENTRY;
            text = text.substring(2);
        } else if (text.regionMatches(true, 0, "A:", 0, 2)) {
            scope = RuleScope.AGGREGATION_LEVEL;
            text = text.substring(2);
        }
        
        Parser parser = new Parser(cube, formula, text);
        String target = parser.reference();
        parser.expect('=');
        Expression expression = parser.expression();
        parser.end();
        
        List<Rule> rules = new ArrayList<Rule>();
        if (scope == RuleScope.ON_ENTRY) {
            List<String> references = new ArrayList<String>(parser.references);
            for (String token : parser.references) {
                String[] targetModifier = new String[] {target};
                boolean rounding = cube.isRuleRounding();
                rules.add(Rules.of(formula + " @" + token, RuleScope.ON_ENTRY, cube.trigger(token), cell -> {
                    Cell targetCell = cell.alter(targetModifier);
                    if (!anyPresent(cell, references)) {
                        // Every operand deleted, the pushed value goes with them
                        targetCell.setValue(null);
                        return Outcome.proceed();
                    }
                    double value = expression.evaluate(cell);
                    targetCell.setValue(rounding ? Rules.round(value) : value);
                    return Outcome.proceed();
                }));
            }
        } else {
            rules.add(Rules.of(formula, scope, cube.trigger(target), cell -> expression.evaluate(cell)));
        }
        LOGGER.debug("Compiled formula {} into {}", formula, rules);
        return rules;
    }
    
    /**
     * @return true if one referenced cell holds a value. Aggregated cells always count as present.
     */
    private static boolean anyPresent(Cell cell, List<String> references) {
        
        for (String reference : references) {
            Cell operand = cell.alter(reference);
            if (!operand.isBaseLevel() || operand.isStored()) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * Compiles the formula and registers the emitted rules on the cube.
     */
    public static List<Rule> register(Cube cube, String formula) {
        
        List<Rule> rules = compile(cube, formula);
        for (Rule rule : rules) {
            cube.registerRule(rule);
        }
        return rules;
    }
    
    private static class Parser {
        
        private final Cube cube;
        private final String formula;
        private final String text;
        private int pos = 0;
        private final Set<String> references = new LinkedHashSet<String>();
        
        private Parser(Cube cube, String formula, String text) {
            this.cube = cube;
            this.formula = formula;
            this.text = text;
        }
        
        private Expression expression() {
            
            Expression left = term();
            while (true) {
                char c = peek();
                if (c == '+') {
                    pos++;
                    Expression l = left;
                    Expression r = term();
                    left = cell -> l.evaluate(cell) + r.evaluate(cell);
                } else if (c == '-') {
                    pos++;
                    Expression l = left;
                    Expression r = term();
                    left = cell -> l.evaluate(cell) - r.evaluate(cell);
                } else {
                    return left;
                }
            }
        }
        
        private Expression term() {
            
            Expression left = factor();
            while (true) {
                char c = peek();
                if (c == '*') {
                    pos++;
                    Expression l = left;
                    Expression r = factor();
                    left = cell -> l.evaluate(cell) * r.evaluate(cell);
                } else if (c == '/') {
                    pos++;
                    Expression l = left;
                    Expression r = factor();
                    left = cell -> {
                        double divisor = r.evaluate(cell);
                        if (divisor == 0.0) {
                            throw new ArithmeticException("Division by zero in formula " + formula);
                        }
                        return l.evaluate(cell) / divisor;
                    };
                } else {
                    return left;
                }
            }
        }
        
        private Expression factor() {
            
            char c = peek();
            if (c == '-') {
                pos++;
                Expression operand = factor();
                return cell -> -operand.evaluate(cell);
            }
            if (c == '(') {
                pos++;
                Expression inner = expression();
                expect(')');
                return inner;
            }
            if (c == '[') {
                String token = reference();
                references.add(token);
                String[] modifier = new String[] {token};
                return cell -> cell.getDouble(modifier);
            }
            if (Character.isDigit(c) || c == '.') {
                int start = pos;
                while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                    pos++;
                }
                String literal = text.substring(start, pos);
                try {
                    double value = Double.parseDouble(literal);
                    return cell -> value;
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid number '" + literal + "' in formula " + formula, e);
                }
            }
            throw syntaxError("unexpected " + (c == 0 ? "end" : "'" + c + "'"));
        }
        
        /**
         * Reads {@code [token]} and checks the token against the cube.
         */
        private String reference() {
            
            expect('[');
            int end = text.indexOf(']', pos);
            if (end < 0) {
                throw syntaxError("missing ']'");
            }
            String token = text.substring(pos, end).trim();
            pos = end + 1;
            try {
                cube.resolveToken(token);
            } catch (InvalidCellAddressException | IllegalArgumentException e) {
                throw new InvalidKeyException("Formula " + formula + " refers to unknown '" + token + "'.");
            }
            return token;
        }
        
        private void expect(char expected) {
            
            if (peek() != expected) {
                throw syntaxError("expected '" + expected + "'");
            }
            pos++;
        }
        
        private void end() {
            if (peek() != 0) {
                throw syntaxError("unexpected '" + peek() + "'");
            }
        }
        
        /**
         * @return next non-blank character, 0 at the end.
         */
        private char peek() {
            
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            return pos < text.length() ? text.charAt(pos) : 0;
        }
        
        private IllegalArgumentException syntaxError(String detail) {
            return new IllegalArgumentException("Syntax error in formula " + formula + " at " + pos + ": " + detail);
        }
    }
    
}
