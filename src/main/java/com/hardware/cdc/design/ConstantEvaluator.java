package com.hardware.cdc.design;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.ast.IntConstNode;
import com.hardware.cdc.ast.SyntaxNode;
import com.hardware.cdc.ast.WidthNode;

/**
 * Evaluates integer literals used as widths and bit indices.
 *
 * Only literal nodes are constants here. Parameters, expressions and
 * literals with x/z digits evaluate to unknown, which callers treat as
 * "width or index not known".
 */
public class ConstantEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConstantEvaluator.class);

    static final long MAX_BIT_COUNT = 1L << 20;

    private static final Map<Character, Integer> RADIX_BY_BASE = Map.of(
            'b', 2,
            'h', 16,
            'o', 8,
            'd', 10
    );

    public OptionalInt evaluate(SyntaxNode node) {
        if (node instanceof IntConstNode literal) {
            return parseLiteral(literal.getText());
        }
        return OptionalInt.empty();
    }

    /**
     * Parses {@code <width>'<base><digits>}, {@code 'b1}, {@code 0x1F} or a
     * plain decimal. An unknown base character means the text after the
     * apostrophe is decimal.
     */
    public OptionalInt parseLiteral(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        String value = text.replace("_", "");
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }

        int apostrophe = value.indexOf('\'');
        if (apostrophe >= 0) {
            String literal = value.substring(apostrophe + 1);
            if (!literal.isEmpty() && Character.toLowerCase(literal.charAt(0)) == 's') {
                literal = literal.substring(1);
            }
            if (literal.isEmpty()) {
                return OptionalInt.empty();
            }
            Integer radix = RADIX_BY_BASE.get(Character.toLowerCase(literal.charAt(0)));
            String digits = radix != null ? literal.substring(1) : literal;
            return parseDigits(digits.isEmpty() ? "0" : digits, radix != null ? radix : 10, text);
        }

        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            return parseDigits(value.substring(2), 16, text);
        }
        if (lower.startsWith("0b")) {
            return parseDigits(value.substring(2), 2, text);
        }
        if (lower.startsWith("0o")) {
            return parseDigits(value.substring(2), 8, text);
        }
        return parseDigits(value, 10, text);
    }

    /**
     * Bit positions of a declared range, from msb to lsb inclusive in
     * declaration order. Empty when there is no range or a bound is not a
     * constant.
     */
    public Optional<List<Integer>> bitIndices(WidthNode width) {
        if (width == null) {
            return Optional.empty();
        }
        OptionalInt msb = evaluate(width.getMsb());
        OptionalInt lsb = evaluate(width.getLsb());
        if (msb.isEmpty() || lsb.isEmpty()) {
            log.debug("Width at line {} is not constant", width.getLine());
            return Optional.empty();
        }

        int from = msb.getAsInt();
        int to = lsb.getAsInt();
        long bitCount = Math.abs((long) to - from) + 1;
        if (bitCount > MAX_BIT_COUNT) {
            log.debug("Width [{}:{}] at line {} spans {} bits, treating it as unknown",
                    from, to, width.getLine(), bitCount);
            return Optional.empty();
        }
        int step = to >= from ? 1 : -1;
        List<Integer> indices = new ArrayList<>((int) bitCount);
        for (int i = 0; i < bitCount; i++) {
            indices.add(from + i * step);
        }
        return Optional.of(indices);
    }

    private OptionalInt parseDigits(String digits, int radix, String original) {
        if (digits.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(digits, radix));
        } catch (NumberFormatException e) {
            log.debug("Literal '{}' is not a known constant: {}", original, e.getMessage());
            return OptionalInt.empty();
        }
    }
}
