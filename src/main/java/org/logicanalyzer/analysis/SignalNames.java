package org.logicanalyzer.analysis;

import lombok.Getter;
import org.logicanalyzer.expressions.Expression;
import org.logicanalyzer.expressions.minimize.ColumnSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 电路信号的名称：输入、状态位与输出。
 * 最简化变量依次为输入位与状态位，{@link #variables()} 按该顺序给出变量名。
 * 默认名：输入 A, B, C…，状态位 Q0, Q1…，输出 Z0, Z1…，激励信号 Q0_J、Q0_K。
 */
@Getter
public final class SignalNames {

    private final List<String> inputs;
    private final List<String> states;
    private final List<String> outputs;

    public SignalNames(List<String> inputs, List<String> states, List<String> outputs) {
        this.inputs = List.copyOf(Objects.requireNonNull(inputs, "Input names cannot be null."));
        this.states = List.copyOf(Objects.requireNonNull(states, "State names cannot be null."));
        this.outputs = List.copyOf(Objects.requireNonNull(outputs, "Output names cannot be null."));
    }

    public static SignalNames defaults(int inputCount, int stateCount, int outputCount) {
        List<String> in = new ArrayList<>();
        for (int i = 0; i < inputCount; i++) {
            in.add(Expression.defaultName(i));
        }
        List<String> st = new ArrayList<>();
        for (int i = 0; i < stateCount; i++) {
            st.add("Q" + i);
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < outputCount; i++) {
            out.add("Z" + i);
        }
        return new SignalNames(in, st, out);
    }

    /**
     * 最简化变量名：先输入，后状态位。
     */
    public List<String> variables() {
        List<String> all = new ArrayList<>(inputs);
        all.addAll(states);
        return all;
    }

    public String nameOf(ColumnSelector selector) {
        return switch (selector.getKind()) {
            case OUTPUT -> outputs.get(selector.getIndex());
            case EXCITATION_J -> states.get(selector.getIndex()) + "_J";
            case EXCITATION_K -> states.get(selector.getIndex()) + "_K";
        };
    }

    @Override
    public String toString() {
        return "SignalNames(inputs=" + inputs + ", states=" + states + ", outputs=" + outputs + ")";
    }
}
