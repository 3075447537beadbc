package org.logicanalyzer.exploration;

import lombok.Getter;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.core.BitVector;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 路径规划的结果：从当前状态到目标状态的步骤序列，以及到达后要施加的未测试输入。
 * 代价 = 路径代价 + 1（施加未测试输入本身）。
 * 此类是不可变的。
 */
@Getter
public final class ProbePlan {

    private final State target;
    private final List<Step> steps;
    private final BitVector untestedInput;
    private final int cost;
    private final boolean usesReset;

    public ProbePlan(State target, List<Step> steps, BitVector untestedInput, int cost) {
        this.target = Objects.requireNonNull(target, "Target cannot be null.");
        this.steps = List.copyOf(Objects.requireNonNull(steps, "Steps cannot be null."));
        this.untestedInput = Objects.requireNonNull(untestedInput, "Untested input cannot be null.");
        this.cost = cost;
        this.usesReset = this.steps.stream().anyMatch(Step::isReset);
    }

    /**
     * 路径中施加的输入序列，不含复位与最后的未测试输入。
     */
    public List<BitVector> inputSequence() {
        return steps.stream()
                .filter(s -> !s.isReset())
                .map(Step::getInput)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ProbePlan(target=" + target + ", steps=" + steps + ", then " + untestedInput + ", cost=" + cost + ")";
    }

    /**
     * 路径中的一步：复位，或施加一个已测试过的输入到达预期状态。
     */
    @Getter
    public static final class Step {

        private final boolean reset;
        private final BitVector input;
        private final State expected;

        private Step(boolean reset, BitVector input, State expected) {
            this.reset = reset;
            this.input = input;
            this.expected = expected;
        }

        /**
         * @param origin 复位后预期到达的原点状态。
         */
        public static Step reset(State origin) {
            return new Step(true, null, Objects.requireNonNull(origin, "Origin cannot be null."));
        }

        public static Step apply(BitVector input, State expected) {
            return new Step(false,
                    Objects.requireNonNull(input, "Input cannot be null."),
                    Objects.requireNonNull(expected, "Expected state cannot be null."));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Step step = (Step) o;
            return reset == step.reset && Objects.equals(input, step.input) && expected.equals(step.expected);
        }

        @Override
        public int hashCode() {
            return Objects.hash(reset, input, expected);
        }

        @Override
        public String toString() {
            return reset ? "RESET->" + expected.getLabel() : input + "->" + expected.getLabel();
        }
    }
}
