package org.logicanalyzer.automata.base;

import lombok.Getter;
import org.logicanalyzer.core.BitVector;

import java.util.Objects;

/**
 * 一次观测到的迁移：(源状态, 输入) -> (输出, 目标状态)。
 * 设备被假定为确定性的，因此同一 (源状态, 输入) 最多只有一条迁移，记录后不可更改。
 */
@Getter
public final class Transition {

    private final State source;
    private final BitVector input;
    private final BitVector outputs;
    private final State target;

    private final int hashCode;

    /**
     * @param source  源状态 (q)
     * @param input   施加的输入向量 (a)
     * @param outputs 时钟沿之后观测到的输出向量 (o)
     * @param target  目标状态 (q')
     */
    public Transition(State source, BitVector input, BitVector outputs, State target) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.input = Objects.requireNonNull(input, "Input cannot be null.");
        this.outputs = Objects.requireNonNull(outputs, "Outputs cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(source, input, outputs, target);
    }

    /**
     * 判断另一条迁移是否与本迁移具有相同的结果（输出与目标状态）。
     */
    public boolean sameOutcome(BitVector otherOutputs, State otherTarget) {
        return outputs.equals(otherOutputs) && target.equals(otherTarget);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source.equals(that.source) &&
                input.equals(that.input) &&
                outputs.equals(that.outputs) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%s / %s]--> %s",
                source.getLabel(),
                input,
                outputs,
                target.getLabel());
    }
}
