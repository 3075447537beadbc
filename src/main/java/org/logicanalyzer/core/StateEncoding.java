package org.logicanalyzer.core;

/**
 * 求解时为每个已发现状态分配二进制编码的方式。
 */
public enum StateEncoding {

    /**
     * 直接使用设备报告的触发器取值，位宽等于触发器个数。
     */
    OBSERVED,

    /**
     * 使用发现顺序分配的状态索引，位宽为 ceil(log2(状态数))。
     */
    DISCOVERY_ORDER;

    /**
     * 计算编码位宽。
     * @param shape      电路规模。
     * @param stateCount 已发现的状态数。
     * @return 状态编码占用的变量位数。
     */
    public int width(CircuitShape shape, int stateCount) {
        return switch (this) {
            case OBSERVED -> shape.getFlipFlops();
            case DISCOVERY_ORDER -> BitVector.bitsFor(stateCount);
        };
    }

    /**
     * 为单个状态生成编码。
     * @param index    状态的发现序号。
     * @param observed 设备报告的触发器取值。
     * @param width    由 {@link #width(CircuitShape, int)} 得到的位宽。
     * @return 状态编码。
     */
    public BitVector encode(int index, BitVector observed, int width) {
        return switch (this) {
            case OBSERVED -> observed;
            case DISCOVERY_ORDER -> BitVector.of(index, width);
        };
    }
}
