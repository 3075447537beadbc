package org.logicanalyzer.analysis;

import org.logicanalyzer.core.AnalyzerConfig;
import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.core.CircuitShape;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.exploration.DeviceResponse;
import org.logicanalyzer.exploration.SimulatedCircuit;
import org.logicanalyzer.expressions.Expression;
import org.logicanalyzer.expressions.minimize.ColumnExtractor;
import org.logicanalyzer.expressions.minimize.ColumnSelector;
import org.logicanalyzer.expressions.minimize.MintermColumn;
import org.logicanalyzer.table.TruthTableStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LogicAnalyzerTest {

    private static LogicAnalyzer explored(SimulatedCircuit circuit, AnalyzerConfig config) {
        LogicAnalyzer analyzer = LogicAnalyzer.of(circuit, config);
        analyzer.explore();
        return analyzer;
    }

    private static void assertMatchesColumn(MintermColumn column, Expression e) {
        for (int m = 0; m < (1 << column.getWidth()); m++) {
            MintermColumn.Label label = column.label(m);
            if (label == MintermColumn.Label.ON) {
                assertTrue(e.evaluate(m), column.getName() + " should be 1 at " + m);
            } else if (label == MintermColumn.Label.OFF) {
                assertFalse(e.evaluate(m), column.getName() + " should be 0 at " + m);
            }
        }
    }

    @Nested
    @DisplayName("JK 计数器 (Counter)")
    class CounterTests {

        private final LogicAnalyzer analyzer = explored(SimulatedCircuit.counter(), AnalyzerConfig.defaults());

        @Test
        @DisplayName("输出与全部激励信号的最简式")
        void testSolveAll() {
            List<SolvedSignal> solved = analyzer.solveAll();
            List<String> vars = analyzer.getSignalNames().variables();

            assertAll(
                    () -> assertEquals(List.of("Z0", "Q0_J", "Q0_K", "Q1_J", "Q1_K"),
                            solved.stream().map(SolvedSignal::getName).collect(Collectors.toList())),
                    () -> assertEquals(List.of("A", "Q0", "Q1"), vars),
                    () -> assertEquals("Z0 = AQ0Q1", solved.get(0).render(vars)),
                    () -> assertEquals("Q0_J = A", solved.get(1).render(vars)),
                    () -> assertEquals("Q0_K = A", solved.get(2).render(vars)),
                    () -> assertEquals("Q1_J = AQ0", solved.get(3).render(vars)),
                    () -> assertEquals("Q1_K = AQ0", solved.get(4).render(vars))
            );
        }

        @Test
        @DisplayName("最简式与分解式都与真值表一致")
        void testSolve_AgreesWithTable() {
            ColumnExtractor extractor = new ColumnExtractor(analyzer.explore(), AnalyzerConfig.defaults());

            for (SolvedSignal signal : analyzer.solveAll()) {
                MintermColumn column = extractor.extract(signal.getSelector(), signal.getName());
                assertMatchesColumn(column, signal.getMinimal());
                assertMatchesColumn(column, signal.getFactored());
            }
        }

        @Test
        @DisplayName("探测报告与状态图")
        void testReportAndGraph() {
            assertAll(
                    () -> assertTrue(analyzer.getReport().isComplete()),
                    () -> assertEquals(4, analyzer.getStateGraph().getStates().size()),
                    () -> assertEquals(analyzer.explore(), analyzer.explore())
            );
        }

        @Test
        @DisplayName("自定义信号名参与输出")
        void testCustomSignalNames() {
            LogicAnalyzer named = explored(SimulatedCircuit.counter(), AnalyzerConfig.defaults());
            named.setSignalNames(new SignalNames(List.of("EN"), List.of("L", "H"), List.of("CARRY")));

            SolvedSignal carry = named.solve(ColumnSelector.output(0));

            assertAll(
                    () -> assertEquals("CARRY", carry.getName()),
                    () -> assertEquals("CARRY = ENLH", carry.render(named.getSignalNames().variables())),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> named.setSignalNames(new SignalNames(List.of("EN"), List.of("L"), List.of("CARRY"))))
            );
        }

        @Test
        @DisplayName("开启 Z3 验证后结果不变")
        void testVerifyFactoring() {
            AnalyzerConfig config = AnalyzerConfig.builder().verifyFactoring(true).build();
            LogicAnalyzer verified = explored(SimulatedCircuit.counter(), config);

            List<SolvedSignal> solved = verified.solveAll();

            assertEquals(5, solved.size());
            for (SolvedSignal signal : solved) {
                assertTrue(signal.getFactored().literalCount() <= signal.getMinimal().literalCount());
            }
        }
    }

    @Nested
    @DisplayName("组合电路 (Combinational)")
    class CombinationalTests {

        @Test
        @DisplayName("异或只有一个输出列，没有激励信号")
        void testXor() {
            LogicAnalyzer analyzer = explored(SimulatedCircuit.xor(), AnalyzerConfig.defaults());

            List<SolvedSignal> solved = analyzer.solveAll();

            assertAll(
                    () -> assertEquals(List.of(ColumnSelector.output(0)), analyzer.selectors()),
                    () -> assertEquals(1, solved.size()),
                    () -> assertEquals("AB' + A'B", analyzer.minimize(ColumnSelector.output(0)).toString()),
                    () -> assertEquals("Z0 = AB' + A'B", solved.get(0).toString())
            );
        }
    }

    @Nested
    @DisplayName("宽电路 (Wide circuits)")
    class WideCircuitTests {

        /**
         * 四个输入、触发器始终为 0 的电路，Z0 = A·B。除状态 0 以外的最小项都未观测。
         */
        private SimulatedCircuit stuckAtZero(int flipFlops) {
            return new SimulatedCircuit(CircuitShape.of(4, 1, flipFlops), BitVector.zero(flipFlops),
                    (state, input) -> new DeviceResponse(BitVector.fromBits(input.get(0) && input.get(1)), state));
        }

        @Test
        @DisplayName("12 个变量：全部 17 列在时限内求解")
        void testSolveAll_TwelveVariables() {
            LogicAnalyzer analyzer = explored(stuckAtZero(8), AnalyzerConfig.defaults());

            List<SolvedSignal> solved = assertTimeoutPreemptively(Duration.ofSeconds(30), analyzer::solveAll);
            List<String> vars = analyzer.getSignalNames().variables();

            assertAll(
                    () -> assertEquals(12, vars.size()),
                    () -> assertEquals(17, solved.size()),
                    () -> assertEquals("Z0 = AB", solved.get(0).render(vars)),
                    () -> assertTrue(solved.subList(1, solved.size()).stream()
                            .allMatch(signal -> signal.getFactored().isFalse()))
            );
        }

        @Test
        @DisplayName("16 个变量（上限）：输出列在时限内求解")
        void testMinimize_MaximumVariables() {
            LogicAnalyzer analyzer = explored(stuckAtZero(12), AnalyzerConfig.defaults());

            Expression z0 = assertTimeoutPreemptively(Duration.ofSeconds(30),
                    () -> analyzer.minimize(ColumnSelector.output(0)));

            assertAll(
                    () -> assertEquals(CircuitShape.MAX_VARIABLES, analyzer.getSignalNames().variables().size()),
                    () -> assertEquals("AB", z0.toString())
            );
        }
    }

    @Nested
    @DisplayName("生命周期 (Lifecycle)")
    class LifecycleTests {

        @Test
        @DisplayName("探测之前调用求解会失败")
        void testBeforeExplore_ShouldThrow() {
            LogicAnalyzer analyzer = LogicAnalyzer.of(SimulatedCircuit.counter(), AnalyzerConfig.defaults());

            assertAll(
                    () -> assertThrows(IllegalStateException.class, analyzer::selectors),
                    () -> assertThrows(IllegalStateException.class, () -> analyzer.minimize(ColumnSelector.output(0))),
                    () -> assertThrows(IllegalStateException.class, analyzer::getSignalNames),
                    () -> assertThrows(IllegalStateException.class, analyzer::getStateGraph)
            );
        }

        @Test
        @DisplayName("直接分析已有真值表，没有探测报告")
        void testOfStore() {
            TruthTableStore store = new TruthTableStore(CircuitShape.of(1, 1, 1));
            State low = store.discover(BitVector.parse("0"));
            State high = store.discover(BitVector.parse("1"));
            store.record(low, BitVector.parse("0"), BitVector.parse("0"), low);
            store.record(low, BitVector.parse("1"), BitVector.parse("0"), high);
            store.record(high, BitVector.parse("0"), BitVector.parse("1"), high);
            store.record(high, BitVector.parse("1"), BitVector.parse("1"), low);

            LogicAnalyzer analyzer = LogicAnalyzer.ofStore(store, AnalyzerConfig.defaults());
            List<SolvedSignal> solved = analyzer.solveAll();
            List<String> vars = analyzer.getSignalNames().variables();

            assertAll(
                    () -> assertSame(store, analyzer.explore()),
                    () -> assertThrows(IllegalStateException.class, analyzer::getReport),
                    () -> assertEquals("Z0 = Q0", solved.get(0).render(vars)),
                    () -> assertEquals("Q0_J = A", solved.get(1).render(vars)),
                    () -> assertEquals("Q0_K = A", solved.get(2).render(vars))
            );
        }
    }
}
