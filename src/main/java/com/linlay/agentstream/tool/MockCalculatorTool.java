package com.linlay.agentstream.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Four-operation arithmetic with parentheses and unary minus. Nothing is evaluated
 * beyond that grammar.
 */
@Component
public class MockCalculatorTool extends AbstractDeterministicTool {

    public static final String NAME = "calculator";

    private static final MathContext PRECISION = new MathContext(16, RoundingMode.HALF_UP);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Perform basic arithmetic calculations";
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        Object raw = args.get("expression");
        if (raw == null || String.valueOf(raw).isBlank()) {
            throw new IllegalArgumentException("expression is required");
        }
        String expression = String.valueOf(raw).trim();
        BigDecimal value = new Parser(expression).parse();

        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("expression", expression);
        root.put("result", format(value));
        return root;
    }

    static String format(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
    }

    private static final class Parser {

        private final String text;
        private int pos;

        private Parser(String text) {
            this.text = text;
        }

        private BigDecimal parse() {
            BigDecimal value = expression();
            skipSpaces();
            if (pos < text.length()) {
                throw error("unexpected '" + text.charAt(pos) + "'");
            }
            return value;
        }

        private BigDecimal expression() {
            BigDecimal value = term();
            while (true) {
                if (consume('+')) {
                    value = value.add(term(), PRECISION);
                } else if (consume('-')) {
                    value = value.subtract(term(), PRECISION);
                } else {
                    return value;
                }
            }
        }

        private BigDecimal term() {
            BigDecimal value = factor();
            while (true) {
                if (consume('*')) {
                    value = value.multiply(factor(), PRECISION);
                } else if (consume('/')) {
                    BigDecimal divisor = factor();
                    if (divisor.signum() == 0) {
                        throw error("division by zero");
                    }
                    value = value.divide(divisor, PRECISION);
                } else {
                    return value;
                }
            }
        }

        private BigDecimal factor() {
            if (consume('-')) {
                return factor().negate();
            }
            if (consume('+')) {
                return factor();
            }
            if (consume('(')) {
                BigDecimal value = expression();
                if (!consume(')')) {
                    throw error("missing ')'");
                }
                return value;
            }
            return number();
        }

        private BigDecimal number() {
            skipSpaces();
            int start = pos;
            while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                pos++;
            }
            if (start == pos) {
                throw error(pos < text.length() ? "unexpected '" + text.charAt(pos) + "'" : "unexpected end");
            }
            try {
                return new BigDecimal(text.substring(start, pos));
            } catch (NumberFormatException ex) {
                throw error("invalid number '" + text.substring(start, pos) + "'");
            }
        }

        private boolean consume(char expected) {
            skipSpaces();
            if (pos < text.length() && text.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipSpaces() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException("Invalid expression: " + message);
        }
    }
}
