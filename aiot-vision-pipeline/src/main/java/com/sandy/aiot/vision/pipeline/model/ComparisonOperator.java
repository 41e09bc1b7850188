package com.sandy.aiot.vision.pipeline.model;

public enum ComparisonOperator {
    GT,
    GTE,
    LT,
    LTE,
    EQ,
    NEQ,
    /** lower &lt;= v &lt;= upper */
    BETWEEN,
    /** v &lt; lower or v &gt; upper */
    OUTSIDE;

    public boolean needsUpperThreshold() {
        return this == BETWEEN || this == OUTSIDE;
    }

    public boolean test(double v, double threshold, Double upper) {
        switch (this) {
            case GT:
                return v > threshold;
            case GTE:
                return v >= threshold;
            case LT:
                return v < threshold;
            case LTE:
                return v <= threshold;
            case EQ:
                return Double.compare(v, threshold) == 0;
            case NEQ:
                return Double.compare(v, threshold) != 0;
            case BETWEEN:
                return v >= threshold && v <= upper;
            case OUTSIDE:
                return v < threshold || v > upper;
            default:
                throw new IllegalStateException("Unexpected value: " + this);
        }
    }

    public String symbol() {
        switch (this) {
            case GT:
                return ">";
            case GTE:
                return ">=";
            case LT:
                return "<";
            case LTE:
                return "<=";
            case EQ:
                return "==";
            case NEQ:
                return "!=";
            case BETWEEN:
                return "between";
            case OUTSIDE:
                return "outside";
            default:
                throw new IllegalStateException("Unexpected value: " + this);
        }
    }
}
