package org.logicanalyzer.expressions.minimize;

import lombok.Getter;

import java.util.Objects;

/**
 * 选择要最简化的列：某个输出位，或某个状态位的 J / K 激励信号。
 * 此类是不可变的。
 */
@Getter
public final class ColumnSelector implements Comparable<ColumnSelector> {

    public enum Kind {
        OUTPUT,
        EXCITATION_J,
        EXCITATION_K
    }

    private final Kind kind;
    private final int index;

    private ColumnSelector(Kind kind, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index cannot be negative: " + index);
        }
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null.");
        this.index = index;
    }

    public static ColumnSelector output(int index) {
        return new ColumnSelector(Kind.OUTPUT, index);
    }

    public static ColumnSelector excitationJ(int stateBit) {
        return new ColumnSelector(Kind.EXCITATION_J, stateBit);
    }

    public static ColumnSelector excitationK(int stateBit) {
        return new ColumnSelector(Kind.EXCITATION_K, stateBit);
    }

    public boolean isExcitation() {
        return kind != Kind.OUTPUT;
    }

    /**
     * 输出列在前，其次按状态位排列，同一状态位的 J 在 K 之前。
     */
    @Override
    public int compareTo(ColumnSelector other) {
        int cmp = Boolean.compare(isExcitation(), other.isExcitation());
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(index, other.index);
        if (cmp != 0) {
            return cmp;
        }
        return kind.compareTo(other.kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnSelector that = (ColumnSelector) o;
        return index == that.index && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OUTPUT -> "output[" + index + "]";
            case EXCITATION_J -> "J[" + index + "]";
            case EXCITATION_K -> "K[" + index + "]";
        };
    }
}
