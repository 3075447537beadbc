package org.logicanalyzer.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 描述被测电路的引脚规模：输入数、输出数以及 JK 触发器数。
 * 此类是不可变的。
 */
@Getter
public final class CircuitShape {

    private static final Logger logger = LoggerFactory.getLogger(CircuitShape.class);

    /** 输入与触发器的总位数上限，求解时的变量空间为 2 的该次方 */
    public static final int MAX_VARIABLES = 16;

    private final int inputs;
    private final int outputs;
    private final int flipFlops;

    private final int hashCode;

    private CircuitShape(int inputs, int outputs, int flipFlops) {
        this.inputs = inputs;
        this.outputs = outputs;
        this.flipFlops = flipFlops;
        this.hashCode = Objects.hash(inputs, outputs, flipFlops);
    }

    /**
     * 工厂方法：创建电路规模描述。
     * @param inputs    输入位数，必须大于 0。
     * @param outputs   输出位数，必须大于 0。
     * @param flipFlops 触发器个数，可以为 0（纯组合电路）。
     * @return CircuitShape 实例。
     */
    public static CircuitShape of(int inputs, int outputs, int flipFlops) {
        if (inputs <= 0 || outputs <= 0 || flipFlops < 0) {
            logger.error("非法的电路规模: inputs={}, outputs={}, flipFlops={}", inputs, outputs, flipFlops);
            throw new IllegalArgumentException("非法的电路规模: " + inputs + ", " + outputs + ", " + flipFlops);
        }
        if (inputs + flipFlops > MAX_VARIABLES) {
            throw new IllegalArgumentException("输入与触发器总数不能超过 " + MAX_VARIABLES + ": " + (inputs + flipFlops));
        }
        return new CircuitShape(inputs, outputs, flipFlops);
    }

    /**
     * 不同输入向量的个数，即 2^inputs。
     */
    public int inputSpace() {
        return 1 << inputs;
    }

    public boolean isStateful() {
        return flipFlops > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CircuitShape that = (CircuitShape) o;
        return inputs == that.inputs && outputs == that.outputs && flipFlops == that.flipFlops;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "CircuitShape(inputs=" + inputs + ", outputs=" + outputs + ", flipFlops=" + flipFlops + ")";
    }
}
