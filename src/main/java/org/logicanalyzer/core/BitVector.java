package org.logicanalyzer.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 定宽的二进制向量，用于表示电路的输入、输出以及触发器状态。
 * 第 i 位对应 (value >> i) & 1，字符串形式按最高位在前输出。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class BitVector implements Comparable<BitVector> {

    /** 支持的最大位宽 */
    public static final int MAX_WIDTH = 63;

    /** 零位宽的空向量，用于没有触发器的纯组合电路 */
    public static final BitVector EMPTY = new BitVector(0L, 0);

    private final long value;
    private final int width;

    private final int hashCode;

    private BitVector(long value, int width) {
        this.value = value;
        this.width = width;
        this.hashCode = Objects.hash(value, width);
    }

    /**
     * 工厂方法：以数值和位宽创建向量。
     * @param value 数值，必须能用 width 位表示。
     * @param width 位宽，0 到 {@link #MAX_WIDTH}。
     * @return BitVector 实例。
     */
    public static BitVector of(long value, int width) {
        if (width < 0 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("位宽必须在 0 到 " + MAX_WIDTH + " 之间: " + width);
        }
        if (value < 0 || (width < MAX_WIDTH && value >= (1L << width))) {
            throw new IllegalArgumentException("数值 " + value + " 超出了 " + width + " 位的表示范围");
        }
        if (width == 0) {
            return EMPTY;
        }
        return new BitVector(value, width);
    }

    /**
     * 工厂方法：全零向量。
     */
    public static BitVector zero(int width) {
        return of(0L, width);
    }

    /**
     * 工厂方法：按位构造，bits[0] 为第 0 位。
     */
    public static BitVector fromBits(boolean... bits) {
        long v = 0L;
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                v |= 1L << i;
            }
        }
        return of(v, bits.length);
    }

    /**
     * 工厂方法：解析最高位在前的二进制字符串，例如 "0110"。
     */
    public static BitVector parse(String binary) {
        Objects.requireNonNull(binary, "Binary string cannot be null.");
        long v = 0L;
        for (int i = 0; i < binary.length(); i++) {
            char c = binary.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("非法的二进制字符 '" + c + "' 出现在 \"" + binary + "\" 中");
            }
            v = (v << 1) | (c - '0');
        }
        return of(v, binary.length());
    }

    /**
     * 读取第 i 位。
     */
    public boolean get(int index) {
        checkIndex(index);
        return ((value >> index) & 1L) == 1L;
    }

    /**
     * 返回将第 i 位设置为 bit 后的新向量。
     */
    public BitVector with(int index, boolean bit) {
        checkIndex(index);
        long v = bit ? (value | (1L << index)) : (value & ~(1L << index));
        return new BitVector(v, width);
    }

    /**
     * 将 high 拼接到本向量的高位之上，本向量占据低 width 位。
     */
    public BitVector concat(BitVector high) {
        Objects.requireNonNull(high, "High part cannot be null.");
        return of(value | (high.value << width), width + high.width);
    }

    public int bitCount() {
        return Long.bitCount(value);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= width) {
            throw new IndexOutOfBoundsException("位索引 " + index + " 超出位宽 " + width);
        }
    }

    /**
     * 表示 n 个不同取值所需的最少位数，n &lt;= 1 时为 0。
     */
    public static int bitsFor(int n) {
        if (n <= 1) {
            return 0;
        }
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }

    @Override
    public int compareTo(BitVector other) {
        int cmp = Integer.compare(this.width, other.width);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compare(this.value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BitVector that = (BitVector) o;
        return value == that.value && width == that.width;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            sb.append(((value >> i) & 1L) == 1L ? '1' : '0');
        }
        return sb.toString();
    }
}
