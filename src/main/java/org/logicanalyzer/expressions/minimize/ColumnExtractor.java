package org.logicanalyzer.expressions.minimize;

import lombok.Getter;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.core.AnalyzerConfig;
import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.core.CircuitShape;
import org.logicanalyzer.core.StateEncoding;
import org.logicanalyzer.expressions.ExcitationMode;
import org.logicanalyzer.table.TableRow;
import org.logicanalyzer.table.TruthTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 把真值表转换为最简化器使用的最小项列。
 * <p>
 * 变量编号：0..N-1 为输入位，N.. 为状态编码位。最小项 = input | (encoding << N)。
 * 对 J / K 列，每行根据当前状态位与下一状态位求出可接受的激励方式集合，
 * 集合内取值一致时为必需值，否则为无关项。
 * 未测试的最小项按配置视为无关项或 0。
 */
public final class ColumnExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ColumnExtractor.class);

    private final TruthTableStore store;
    private final StateEncoding encoding;
    private final boolean unobservedAsDontCare;

    @Getter
    private final int inputWidth;
    @Getter
    private final int stateWidth;
    private final Map<State, BitVector> codes = new HashMap<>();

    public ColumnExtractor(TruthTableStore store, AnalyzerConfig config) {
        this.store = Objects.requireNonNull(store, "Store cannot be null.");
        Objects.requireNonNull(config, "Config cannot be null.");
        this.encoding = config.getStateEncoding();
        this.unobservedAsDontCare = config.isUnobservedAsDontCare();

        CircuitShape shape = store.getShape();
        this.inputWidth = shape.getInputs();
        this.stateWidth = encoding.width(shape, store.stateCount());
        if (inputWidth + stateWidth > CircuitShape.MAX_VARIABLES) {
            throw new IllegalStateException("变量总数 " + (inputWidth + stateWidth) + " 超过上限 " + CircuitShape.MAX_VARIABLES);
        }
        for (State state : store.getGraph().getStates()) {
            codes.put(state, encoding.encode(state.getIndex(), state.getEncoding(), stateWidth));
        }
        logger.debug("列提取：{} 个输入位，{} 个状态位，编码方式 {}", inputWidth, stateWidth, encoding);
    }

    public int variableCount() {
        return inputWidth + stateWidth;
    }

    /**
     * 状态在最简化变量空间中的编码。
     */
    public BitVector codeOf(State state) {
        BitVector code = codes.get(state);
        if (code == null) {
            throw new IllegalArgumentException("未知状态: " + state);
        }
        return code;
    }

    public int minterm(TableRow row) {
        return (int) (row.getInput().getValue() | (codeOf(row.getState()).getValue() << inputWidth));
    }

    /**
     * 本电路可以最简化的全部列：先是各输出位，再是各状态位的 J、K。
     */
    public List<ColumnSelector> selectors() {
        List<ColumnSelector> result = new ArrayList<>();
        for (int i = 0; i < store.getShape().getOutputs(); i++) {
            result.add(ColumnSelector.output(i));
        }
        for (int i = 0; i < stateWidth; i++) {
            result.add(ColumnSelector.excitationJ(i));
            result.add(ColumnSelector.excitationK(i));
        }
        return result;
    }

    /**
     * 提取一列。
     * @param selector 列选择。
     * @param name     列名，用于日志与结果。
     * @return 最小项列。
     */
    public MintermColumn extract(ColumnSelector selector, String name) {
        Objects.requireNonNull(selector, "Selector cannot be null.");
        int limit = selector.isExcitation() ? stateWidth : store.getShape().getOutputs();
        if (selector.getIndex() >= limit) {
            throw new IllegalArgumentException("列 " + selector + " 超出范围，上限为 " + limit);
        }

        SortedSet<Integer> on = new TreeSet<>();
        SortedSet<Integer> dc = new TreeSet<>();
        Set<Integer> observed = new HashSet<>();
        for (TableRow row : store.allRows()) {
            int m = minterm(row);
            observed.add(m);
            Optional<Boolean> bit = required(selector, row);
            if (bit.isEmpty()) {
                dc.add(m);
            } else if (bit.get()) {
                on.add(m);
            }
        }

        if (unobservedAsDontCare) {
            int space = 1 << variableCount();
            for (int m = 0; m < space; m++) {
                if (!observed.contains(m)) {
                    dc.add(m);
                }
            }
        }
        logger.debug("列 {}: {} 个必需项，{} 个无关项", name, on.size(), dc.size());
        return new MintermColumn(name, variableCount(), on, dc);
    }

    private Optional<Boolean> required(ColumnSelector selector, TableRow row) {
        if (selector.getKind() == ColumnSelector.Kind.OUTPUT) {
            return Optional.of(row.getOutputs().get(selector.getIndex()));
        }
        boolean q = codeOf(row.getState()).get(selector.getIndex());
        boolean qNext = codeOf(row.getNextState()).get(selector.getIndex());
        Set<ExcitationMode> modes = ExcitationMode.acceptable(q, qNext);
        return selector.getKind() == ColumnSelector.Kind.EXCITATION_J
                ? ExcitationMode.requiredJ(modes)
                : ExcitationMode.requiredK(modes);
    }
}
