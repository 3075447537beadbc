package org.logicanalyzer.table;

import lombok.Getter;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.automata.base.Transition;
import org.logicanalyzer.core.BitVector;

import java.util.Objects;

/**
 * 真值表的一行：(状态, 输入) -> (输出, 下一状态)。
 * 此类是不可变的。
 */
@Getter
public final class TableRow {

    private final State state;
    private final BitVector input;
    private final BitVector outputs;
    private final State nextState;

    private final int hashCode;

    public TableRow(State state, BitVector input, BitVector outputs, State nextState) {
        this.state = Objects.requireNonNull(state, "State cannot be null.");
        this.input = Objects.requireNonNull(input, "Input cannot be null.");
        this.outputs = Objects.requireNonNull(outputs, "Outputs cannot be null.");
        this.nextState = Objects.requireNonNull(nextState, "Next state cannot be null.");
        this.hashCode = Objects.hash(state, input, outputs, nextState);
    }

    public static TableRow of(Transition transition) {
        return new TableRow(transition.getSource(), transition.getInput(),
                transition.getOutputs(), transition.getTarget());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableRow that = (TableRow) o;
        return state.equals(that.state) && input.equals(that.input)
                && outputs.equals(that.outputs) && nextState.equals(that.nextState);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "[" + state + ", " + input + "] -> [" + outputs + ", " + nextState + "]";
    }
}
