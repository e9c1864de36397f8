package com.iotwatch.anomaly.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Threshold comparators. Accepts either the symbol ({@code ">"}) or the name ({@code "GT"}).
 */
public enum ComparisonOperator {

    GT(">") {
        @Override
        public boolean test(double value, double threshold) { return value > threshold; }
    },
    GTE(">=") {
        @Override
        public boolean test(double value, double threshold) { return value >= threshold; }
    },
    LT("<") {
        @Override
        public boolean test(double value, double threshold) { return value < threshold; }
    },
    LTE("<=") {
        @Override
        public boolean test(double value, double threshold) { return value <= threshold; }
    },
    EQ("==") {
        @Override
        public boolean test(double value, double threshold) { return Double.compare(value, threshold) == 0; }
    },
    NEQ("!=") {
        @Override
        public boolean test(double value, double threshold) { return Double.compare(value, threshold) != 0; }
    };

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public abstract boolean test(double value, double threshold);

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    @JsonCreator
    public static ComparisonOperator parse(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        return null;
    }
}
