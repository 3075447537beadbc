package org.logicanalyzer.expressions.minimize;

import lombok.Getter;
import org.logicanalyzer.expressions.Expression;
import org.logicanalyzer.expressions.LiteralTerm;

import java.util.*;

/**
 * 部分指定的位模式：mask 中为 1 的位是确定位，其取值由 value 给出，其余位为无关位。
 * value 在无关位上恒为 0，因此 (width, mask, value) 唯一确定一个立方体，相等性也只由它决定。
 * 覆盖的最小项不随对象保存，需要时由 {@link #minterms()} 展开。
 * 此类是不可变的。
 */
@Getter
public final class Implicant implements Comparable<Implicant> {

    private final int width;
    private final int mask;
    private final int value;
    private final boolean prime;

    private final int hashCode;

    private Implicant(int width, int mask, int value, boolean prime) {
        this.width = width;
        this.mask = mask;
        this.value = value;
        this.prime = prime;
        this.hashCode = Objects.hash(width, mask, value);
    }

    /**
     * 工厂方法：单个最小项构成的蕴涵项，所有位都确定。
     */
    public static Implicant ofMinterm(int minterm, int width) {
        return of(width, fullMask(width), minterm);
    }

    /**
     * 工厂方法：任意位模式。
     * @throws IllegalArgumentException 位宽非法，或 value 在无关位或位宽之外有 1 时。
     */
    public static Implicant of(int width, int mask, int value) {
        int full = fullMask(width);
        if ((mask & ~full) != 0) {
            throw new IllegalArgumentException("mask " + Integer.toBinaryString(mask) + " 超出 " + width + " 位的范围");
        }
        if ((value & ~mask) != 0) {
            throw new IllegalArgumentException("value " + Integer.toBinaryString(value) + " 在无关位上不为 0");
        }
        return new Implicant(width, mask, value, false);
    }

    private static int fullMask(int width) {
        if (width < 0 || width > 30) {
            throw new IllegalArgumentException("Illegal implicant width: " + width);
        }
        return (1 << width) - 1;
    }

    /**
     * 确定位的个数，即对应积项的文字数。
     */
    public int specifiedCount() {
        return Integer.bitCount(mask);
    }

    /**
     * 无关位的个数；覆盖的最小项数为 2 的该次幂。
     */
    public int freeCount() {
        return width - specifiedCount();
    }

    public boolean isSpecified(int bit) {
        return ((mask >> bit) & 1) == 1;
    }

    /**
     * 只在确定位 bit 上取值相反的蕴涵项，即 Quine–McCluskey 中唯一可与本项合并于该位的伙伴。
     */
    public Implicant neighbor(int bit) {
        requireSpecified(bit);
        int flipped = value ^ (1 << bit);
        return new Implicant(width, mask, flipped, false);
    }

    /**
     * 本项与 {@link #neighbor(int)} 合并的结果：bit 成为无关位。
     */
    public Implicant expand(int bit) {
        requireSpecified(bit);
        int b = 1 << bit;
        return new Implicant(width, mask & ~b, value & ~b, false);
    }

    private void requireSpecified(int bit) {
        if (bit < 0 || bit >= width || !isSpecified(bit)) {
            throw new IllegalArgumentException("第 " + bit + " 位不是 " + pattern() + " 的确定位");
        }
    }

    public boolean covers(int minterm) {
        return (minterm & mask) == value;
    }

    /**
     * 覆盖的全部最小项，升序。按需展开，只用于诊断与测试。
     */
    public SortedSet<Integer> minterms() {
        SortedSet<Integer> result = new TreeSet<>();
        int free = ~mask & fullMask(width);
        int sub = free;
        while (true) {
            result.add(value | sub);
            if (sub == 0) {
                return result;
            }
            sub = (sub - 1) & free;
        }
    }

    public Implicant asPrime() {
        return prime ? this : new Implicant(width, mask, value, true);
    }

    /**
     * 确定位对应的文字，按变量索引升序。
     */
    public SortedSet<LiteralTerm> literals() {
        SortedSet<LiteralTerm> result = new TreeSet<>();
        for (int i = 0; i < width; i++) {
            if (((mask >> i) & 1) == 1) {
                result.add(LiteralTerm.of(i, ((value >> i) & 1) == 1));
            }
        }
        return result;
    }

    /**
     * 对应的积项；没有确定位时为常量真。
     */
    public Expression toExpression() {
        return Expression.product(literals());
    }

    /**
     * 最高位在前的模式串，例如 "1-0"。
     */
    public String pattern() {
        StringBuilder sb = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            if (((mask >> i) & 1) == 0) {
                sb.append('-');
            } else {
                sb.append(((value >> i) & 1) == 1 ? '1' : '0');
            }
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Implicant other) {
        int cmp = Integer.compare(specifiedCount(), other.specifiedCount());
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(value, other.value);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(mask, other.mask);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Implicant that = (Implicant) o;
        return width == that.width && mask == that.mask && value == that.value;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return pattern();
    }
}
