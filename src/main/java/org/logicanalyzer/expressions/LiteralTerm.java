package org.logicanalyzer.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 一个文字：变量及其极性。
 * 排序规则：变量索引升序，同一变量的正文字排在反文字之前。
 * 此类是不可变的。
 */
@Getter
public final class LiteralTerm implements Comparable<LiteralTerm> {

    private final int variable;
    private final boolean positive;

    private final int hashCode;

    private LiteralTerm(int variable, boolean positive) {
        if (variable < 0) {
            throw new IllegalArgumentException("Variable index cannot be negative: " + variable);
        }
        this.variable = variable;
        this.positive = positive;
        this.hashCode = Objects.hash(variable, positive);
    }

    public static LiteralTerm of(int variable, boolean positive) {
        return new LiteralTerm(variable, positive);
    }

    public static LiteralTerm positive(int variable) {
        return new LiteralTerm(variable, true);
    }

    public static LiteralTerm negative(int variable) {
        return new LiteralTerm(variable, false);
    }

    public LiteralTerm negate() {
        return new LiteralTerm(variable, !positive);
    }

    public Expression toExpression() {
        return Expression.literal(variable, positive);
    }

    @Override
    public int compareTo(LiteralTerm other) {
        int cmp = Integer.compare(this.variable, other.variable);
        if (cmp != 0) {
            return cmp;
        }
        return Boolean.compare(other.positive, this.positive);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LiteralTerm that = (LiteralTerm) o;
        return variable == that.variable && positive == that.positive;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return Expression.defaultName(variable) + (positive ? "" : "'");
    }
}
