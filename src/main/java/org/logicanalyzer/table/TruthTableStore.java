package org.logicanalyzer.table;

import lombok.Getter;
import org.logicanalyzer.automata.base.InputAlphabet;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.automata.base.Transition;
import org.logicanalyzer.automata.models.StateGraph;
import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.core.CircuitShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 稀疏真值表：(状态, 输入) -> (输出, 下一状态)。
 * 只由探测引擎写入，探测结束后供最简化器只读使用。
 * 每条已测试条目的目标状态都存在于已发现状态集合中（可能由同一条记录创建）。
 */
public final class TruthTableStore {

    private static final Logger logger = LoggerFactory.getLogger(TruthTableStore.class);

    @Getter
    private final CircuitShape shape;
    @Getter
    private final InputAlphabet alphabet;
    @Getter
    private final StateGraph graph;

    public TruthTableStore(CircuitShape shape) {
        this.shape = Objects.requireNonNull(shape, "CircuitShape cannot be null.");
        this.alphabet = InputAlphabet.of(shape.getInputs());
        this.graph = new StateGraph(shape.getFlipFlops());
    }

    /**
     * 返回编码对应的状态，首次出现时创建。
     */
    public State discover(BitVector encoding) {
        return graph.addStateIfAbsent(encoding);
    }

    /**
     * 记录一次观测。
     * 若该 (状态, 输入) 已以相同结果记录，直接返回原记录；结果不同则抛出 {@link ConsistencyException}。
     * @param state     施加输入时的状态。
     * @param input     输入向量。
     * @param outputs   观测到的输出向量。
     * @param nextState 观测到的下一状态，必须已被发现。
     * @return 对应的迁移。
     */
    public Transition record(State state, BitVector input, BitVector outputs, State nextState) {
        Objects.requireNonNull(state, "State cannot be null.");
        Objects.requireNonNull(nextState, "Next state cannot be null.");
        if (!alphabet.contains(input)) {
            throw new IllegalArgumentException("输入位宽应为 " + shape.getInputs() + ": " + input);
        }
        if (outputs == null || outputs.getWidth() != shape.getOutputs()) {
            throw new IllegalArgumentException("输出位宽应为 " + shape.getOutputs() + ": " + outputs);
        }
        if (!graph.contains(state) || !graph.contains(nextState)) {
            throw new IllegalArgumentException("记录引用了未发现的状态: " + state + " -> " + nextState);
        }

        Optional<Transition> existing = graph.getTransition(state, input);
        if (existing.isPresent()) {
            Transition recorded = existing.get();
            if (recorded.sameOutcome(outputs, nextState)) {
                logger.debug("重复观测与已有记录一致: {}", recorded);
                return recorded;
            }
            TableRow before = TableRow.of(recorded);
            TableRow after = new TableRow(state, input, outputs, nextState);
            logger.error("一致性错误：{} 与已记录的 {} 不一致", after, before);
            throw new ConsistencyException("同一 (状态, 输入) 观测到不同结果: 已记录 " + before + "，本次 " + after,
                    before, after);
        }

        Transition transition = new Transition(state, input, outputs, nextState);
        graph.addTransition(transition);
        return transition;
    }

    public boolean isTested(State state, BitVector input) {
        return graph.getTransition(state, input).isPresent();
    }

    /**
     * 按状态编码查询条目状态；从未发现的状态返回 {@link EntryStatus#DONT_CARE}。
     */
    public EntryStatus status(BitVector stateEncoding, BitVector input) {
        Optional<State> state = graph.findState(stateEncoding);
        if (state.isEmpty()) {
            return EntryStatus.DONT_CARE;
        }
        return isTested(state.get(), input) ? EntryStatus.TESTED : EntryStatus.UNTESTED;
    }

    /**
     * 状态尚未测试的输入，按数值升序。
     */
    public List<BitVector> untestedInputs(State state) {
        return alphabet.getInputs().stream()
                .filter(input -> !isTested(state, input))
                .collect(Collectors.toList());
    }

    /**
     * 数值最小的未测试输入。
     */
    public Optional<BitVector> firstUntestedInput(State state) {
        for (BitVector input : alphabet.getInputs()) {
            if (!isTested(state, input)) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    public boolean hasUntestedInputs(State state) {
        return graph.getOutgoing(state).size() < alphabet.size();
    }

    /**
     * 仍有未测试输入的已发现状态，按索引升序。
     */
    public List<State> statesWithUntestedInputs() {
        return graph.getStates().stream()
                .filter(this::hasUntestedInputs)
                .collect(Collectors.toList());
    }

    /**
     * 全部已测试的行，按状态索引、再按输入升序。
     */
    public List<TableRow> allRows() {
        List<TableRow> rows = new ArrayList<>(graph.transitionCount());
        for (Transition t : graph.getTransitions()) {
            rows.add(TableRow.of(t));
        }
        return rows;
    }

    public int testedCount() {
        return graph.transitionCount();
    }

    public int stateCount() {
        return graph.stateCount();
    }

    @Override
    public String toString() {
        return "TruthTableStore(" + shape + ", states=" + stateCount() + ", tested=" + testedCount() + ")";
    }
}
