package org.logicanalyzer.expressions.minimize;

import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.core.AnalyzerConfig;
import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.core.CircuitShape;
import org.logicanalyzer.core.StateEncoding;
import org.logicanalyzer.exploration.ExplorationEngine;
import org.logicanalyzer.exploration.SimulatedCircuit;
import org.logicanalyzer.table.TruthTableStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ColumnExtractorTest {

    // 变量 0 = E，变量 1 = Q0，变量 2 = Q1
    private static TruthTableStore counterStore;

    @BeforeAll
    static void setUp() {
        counterStore = new ExplorationEngine(SimulatedCircuit.counter(), AnalyzerConfig.defaults()).explore();
    }

    @Nested
    @DisplayName("计数器的列 (Counter columns)")
    class CounterTests {

        private final ColumnExtractor extractor = new ColumnExtractor(counterStore, AnalyzerConfig.defaults());

        @Test
        @DisplayName("变量空间为输入位加状态位，列依次为输出与各状态位的 J、K")
        void testSelectors() {
            assertAll(
                    () -> assertEquals(3, extractor.variableCount()),
                    () -> assertEquals(List.of(ColumnSelector.output(0),
                            ColumnSelector.excitationJ(0), ColumnSelector.excitationK(0),
                            ColumnSelector.excitationJ(1), ColumnSelector.excitationK(1)), extractor.selectors())
            );
        }

        @Test
        @DisplayName("输出列：进位只在 E=1 且状态为 11 时为 1，全部最小项已观测")
        void testOutputColumn() {
            MintermColumn z = extractor.extract(ColumnSelector.output(0), "Z0");

            assertAll(
                    () -> assertEquals(Set.of(7), z.getOnSet()),
                    () -> assertTrue(z.getDontCares().isEmpty())
            );
        }

        @Test
        @DisplayName("J0：0->1 必需 1，0->0 必需 0，Q0=1 的行为无关项")
        void testExcitationJ0() {
            MintermColumn j0 = extractor.extract(ColumnSelector.excitationJ(0), "Q0_J");

            assertAll(
                    () -> assertEquals(Set.of(1, 5), j0.getOnSet()),
                    () -> assertEquals(Set.of(2, 3, 6, 7), j0.getDontCares()),
                    () -> assertEquals(MintermColumn.Label.OFF, j0.label(0)),
                    () -> assertEquals(MintermColumn.Label.OFF, j0.label(4))
            );
        }

        @Test
        @DisplayName("K1：只在 E·Q0 且 Q1=1 时必需 1，Q1=0 的行为无关项")
        void testExcitationK1() {
            MintermColumn k1 = extractor.extract(ColumnSelector.excitationK(1), "Q1_K");

            assertAll(
                    () -> assertEquals(Set.of(7), k1.getOnSet()),
                    () -> assertEquals(Set.of(0, 1, 2, 3), k1.getDontCares())
            );
        }

        @Test
        @DisplayName("超出范围的列被拒绝")
        void testExtract_OutOfRange_ShouldThrow() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> extractor.extract(ColumnSelector.output(1), "Z1")),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> extractor.extract(ColumnSelector.excitationJ(2), "Q2_J"))
            );
        }
    }

    @Nested
    @DisplayName("状态编码与未观测项 (Encoding and unobserved rows)")
    class EncodingTests {

        private TruthTableStore sparse() {
            TruthTableStore store = new TruthTableStore(CircuitShape.of(1, 1, 2));
            State first = store.discover(BitVector.parse("11"));
            State second = store.discover(BitVector.parse("00"));
            store.record(first, BitVector.parse("0"), BitVector.parse("1"), second);
            store.record(second, BitVector.parse("1"), BitVector.parse("0"), first);
            return store;
        }

        @Test
        @DisplayName("按发现顺序编码：两个状态只需一位")
        void testDiscoveryOrderEncoding() {
            AnalyzerConfig config = AnalyzerConfig.builder().stateEncoding(StateEncoding.DISCOVERY_ORDER).build();
            TruthTableStore store = sparse();
            ColumnExtractor extractor = new ColumnExtractor(store, config);

            MintermColumn z = extractor.extract(ColumnSelector.output(0), "Z0");

            assertAll(
                    () -> assertEquals(1, extractor.getStateWidth()),
                    () -> assertEquals(BitVector.parse("0"), extractor.codeOf(store.getGraph().getState(0))),
                    () -> assertEquals(BitVector.parse("1"), extractor.codeOf(store.getGraph().getState(1))),
                    () -> assertEquals(Set.of(0), z.getOnSet()),
                    () -> assertEquals(Set.of(1, 2), z.getDontCares())
            );
        }

        @Test
        @DisplayName("未观测项视为 0 时不产生无关项")
        void testUnobservedAsZero() {
            AnalyzerConfig config = AnalyzerConfig.builder().unobservedAsDontCare(false).build();
            ColumnExtractor extractor = new ColumnExtractor(sparse(), config);

            MintermColumn z = extractor.extract(ColumnSelector.output(0), "Z0");

            assertAll(
                    () -> assertEquals(Set.of(0b110), z.getOnSet()),
                    () -> assertTrue(z.getDontCares().isEmpty()),
                    () -> assertEquals(MintermColumn.Label.OFF, z.label(0b111))
            );
        }
    }
}
