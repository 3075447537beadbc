package org.logicanalyzer.analysis;

import org.logicanalyzer.automata.models.StateGraph;
import org.logicanalyzer.core.AnalyzerConfig;
import org.logicanalyzer.exploration.CircuitDevice;
import org.logicanalyzer.exploration.ExplorationEngine;
import org.logicanalyzer.exploration.ExplorationReport;
import org.logicanalyzer.expressions.Expression;
import org.logicanalyzer.expressions.factor.FactoringEngine;
import org.logicanalyzer.expressions.minimize.ColumnExtractor;
import org.logicanalyzer.expressions.minimize.ColumnSelector;
import org.logicanalyzer.expressions.minimize.MinimizationResult;
import org.logicanalyzer.expressions.minimize.Minimizer;
import org.logicanalyzer.symbolic.Z3Oracle;
import org.logicanalyzer.table.TruthTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 对外的分析入口：探测设备、最简化各信号并做因式分解。
 * <pre>
 *     LogicAnalyzer analyzer = LogicAnalyzer.of(device, AnalyzerConfig.defaults());
 *     analyzer.explore();
 *     for (SolvedSignal s : analyzer.solveAll()) {
 *         System.out.println(s.render(analyzer.getSignalNames().variables()));
 *     }
 * </pre>
 */
public final class LogicAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LogicAnalyzer.class);

    private final AnalyzerConfig config;
    private final ExplorationEngine engine;
    private final Minimizer minimizer = new Minimizer();
    private final FactoringEngine factoring;

    private TruthTableStore store;
    private ColumnExtractor extractor;
    private SignalNames signalNames;

    private LogicAnalyzer(ExplorationEngine engine, TruthTableStore store, AnalyzerConfig config) {
        this.engine = engine;
        this.config = Objects.requireNonNull(config, "Config cannot be null.");
        this.factoring = new FactoringEngine(config.getMinFactorSize());
        if (store != null) {
            attach(store);
        }
    }

    /**
     * 分析一个尚未探测的设备。
     */
    public static LogicAnalyzer of(CircuitDevice device, AnalyzerConfig config) {
        return new LogicAnalyzer(new ExplorationEngine(device, config), null, config);
    }

    /**
     * 直接分析一张已有的真值表，不再探测。
     */
    public static LogicAnalyzer ofStore(TruthTableStore store, AnalyzerConfig config) {
        return new LogicAnalyzer(null, Objects.requireNonNull(store, "Store cannot be null."), config);
    }

    /**
     * 探测设备直到 DONE。
     * @throws org.logicanalyzer.table.ConsistencyException 设备表现出非确定性时。
     */
    public TruthTableStore explore() {
        if (store != null) {
            return store;
        }
        if (engine == null) {
            throw new IllegalStateException("没有可探测的设备。");
        }
        attach(engine.explore());
        return store;
    }

    private void attach(TruthTableStore explored) {
        this.store = explored;
        this.extractor = new ColumnExtractor(explored, config);
        if (signalNames == null) {
            signalNames = SignalNames.defaults(extractor.getInputWidth(), extractor.getStateWidth(),
                    explored.getShape().getOutputs());
        }
    }

    public ExplorationReport getReport() {
        if (engine == null) {
            throw new IllegalStateException("分析的是现成的真值表，没有探测报告。");
        }
        return engine.getReport();
    }

    public StateGraph getStateGraph() {
        return requireStore().getGraph();
    }

    public SignalNames getSignalNames() {
        requireStore();
        return signalNames;
    }

    /**
     * 使用自定义的信号名，个数必须与电路一致。
     */
    public void setSignalNames(SignalNames names) {
        Objects.requireNonNull(names, "Names cannot be null.");
        requireStore();
        if (names.getInputs().size() != extractor.getInputWidth()
                || names.getStates().size() != extractor.getStateWidth()
                || names.getOutputs().size() != store.getShape().getOutputs()) {
            throw new IllegalArgumentException("信号名个数与电路不符: " + names);
        }
        this.signalNames = names;
    }

    /**
     * 全部可求解的列：各输出位，以及各状态位的 J、K。
     */
    public List<ColumnSelector> selectors() {
        requireStore();
        return extractor.selectors();
    }

    /**
     * 某一列的最简积之和式。
     */
    public Expression minimize(ColumnSelector selector) {
        return minimizeColumn(selector).getExpression();
    }

    public MinimizationResult minimizeColumn(ColumnSelector selector) {
        requireStore();
        return minimizer.minimize(extractor.extract(selector, signalNames.nameOf(selector)));
    }

    public Expression factor(Expression expression) {
        return factoring.factor(expression);
    }

    public SolvedSignal solve(ColumnSelector selector) {
        MinimizationResult minimal = minimizeColumn(selector);
        Expression factored = factor(minimal.getExpression());
        if (config.isVerifyFactoring()) {
            verify(minimal.getColumn().getName(), minimal.getExpression(), factored);
        }
        SolvedSignal solved = new SolvedSignal(signalNames.nameOf(selector), selector, minimal, factored);
        logger.info("求解 {}", solved.render(signalNames.variables()));
        return solved;
    }

    /**
     * 求解全部输出与激励信号。
     */
    public List<SolvedSignal> solveAll() {
        List<SolvedSignal> result = new ArrayList<>();
        for (ColumnSelector selector : selectors()) {
            result.add(solve(selector));
        }
        return result;
    }

    private void verify(String name, Expression minimal, Expression factored) {
        try (Z3Oracle oracle = new Z3Oracle(signalNames.variables())) {
            if (!oracle.isEquivalent(minimal, factored)) {
                long witness = oracle.counterexample(minimal, factored).orElse(-1L);
                logger.error("{} 的因式分解结果与最简式不等价，反例 {}", name, Long.toBinaryString(witness));
                throw new IllegalStateException("因式分解改变了 " + name + " 的取值: " + minimal + " vs " + factored);
            }
            logger.debug("{} 的因式分解结果已由 Z3 验证", name);
        }
    }

    private TruthTableStore requireStore() {
        if (store == null) {
            throw new IllegalStateException("尚未探测，请先调用 explore()。");
        }
        return store;
    }
}
