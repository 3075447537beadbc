package org.logicanalyzer.expressions.factor;

import org.logicanalyzer.expressions.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FactoringEngineTest {

    private static final int A = 0, B = 1, C = 2, D = 3, E = 4, F = 5, G = 6, H = 7;

    private final FactoringEngine engine = new FactoringEngine(2);

    private static Expression pos(int v) {
        return Expression.literal(v, true);
    }

    private static Expression neg(int v) {
        return Expression.literal(v, false);
    }

    /**
     * 由正文字变量组成的积项之和，例如 sop(new int[]{A, B}, new int[]{C})。
     */
    private static Expression sop(int[]... terms) {
        List<Expression> products = new java.util.ArrayList<>();
        for (int[] term : terms) {
            List<Expression> literals = new java.util.ArrayList<>();
            for (int v : term) {
                literals.add(pos(v));
            }
            products.add(Expression.and(literals));
        }
        return Expression.or(products);
    }

    private static void assertSameFunction(Expression expected, Expression actual, int variables) {
        for (long m = 0; m < (1L << variables); m++) {
            assertEquals(expected.evaluate(m), actual.evaluate(m), "assignment " + Long.toBinaryString(m));
        }
    }

    @Nested
    @DisplayName("候选选择 (Candidate selection)")
    class CandidateTests {

        @Test
        @DisplayName("ABC + ABD 提取 AB")
        void testFactor_CommonPair() {
            Expression e = sop(new int[]{A, B, C}, new int[]{A, B, D});

            Expression factored = engine.factor(e);

            assertAll(
                    () -> assertEquals("AB(C + D)", factored.toString()),
                    () -> assertTrue(factored.literalCount() < e.literalCount())
            );
        }

        @Test
        @DisplayName("出现次数更多的因子得分更高")
        void testFactor_HigherCountWins() {
            Expression e = sop(new int[]{A, B, C}, new int[]{A, B, D}, new int[]{A, B, E});

            assertEquals("AB(C + D + E)", engine.factor(e).toString());
        }

        @Test
        @DisplayName("同分时文字数多者优先：ABCD×2 与 AB×4 同为 8 分")
        void testFactor_TieBreakLargerSize() {
            Expression e = sop(new int[]{A, B, C, D, E}, new int[]{A, B, C, D, F},
                    new int[]{A, B, G}, new int[]{A, B, H});

            assertEquals("ABCD(E + F) + AB(G + H)", engine.factor(e).toString());
        }

        @Test
        @DisplayName("同分同大小时文字集合字典序小者优先，其余积项继续分解")
        void testFactor_TieBreakLexicographic() {
            Expression e = sop(new int[]{C, D, E}, new int[]{C, D, F}, new int[]{A, B, C}, new int[]{A, B, D});

            assertEquals("AB(C + D) + CD(E + F)", engine.factor(e).toString());
        }

        @Test
        @DisplayName("正文字排在同一变量的反文字之前")
        void testFactor_PolarityOrder() {
            Expression e = Expression.or(
                    Expression.and(neg(A), pos(B), pos(C)),
                    Expression.and(neg(A), pos(B), pos(D)),
                    Expression.and(pos(A), pos(B), pos(E)),
                    Expression.and(pos(A), pos(B), pos(F)));

            assertEquals("AB(E + F) + A'B(C + D)", engine.factor(e).toString());
        }
    }

    @Nested
    @DisplayName("终止与不变形 (Fixed points)")
    class FixedPointTests {

        @Test
        @DisplayName("没有公共的多文字子合取式时保持原样")
        void testFactor_NoCandidate_ShouldKeepTerms() {
            Expression e = Expression.or(pos(A), Expression.and(neg(B), pos(C)));

            assertEquals(e, engine.factor(e));
        }

        @Test
        @DisplayName("对已分解的表达式再次分解得到结构等价的结果")
        void testFactor_Idempotent() {
            List<Expression> inputs = List.of(
                    sop(new int[]{A, B, C}, new int[]{A, B, D}),
                    sop(new int[]{A, B, C, D, E}, new int[]{A, B, C, D, F}, new int[]{A, B, G}, new int[]{A, B, H}),
                    sop(new int[]{C, D, E}, new int[]{C, D, F}, new int[]{A, B, C}, new int[]{A, B, D}, new int[]{G}),
                    Expression.or(Expression.and(pos(A), pos(B), Expression.or(pos(C), pos(D))), pos(E)));

            for (Expression input : inputs) {
                Expression once = engine.factor(input);
                Expression twice = engine.factor(once);
                assertTrue(once.isStructurallyEquivalent(twice), once + " became " + twice);
                assertEquals(once.literalCount(), twice.literalCount());
            }
        }

        @Test
        @DisplayName("常量保持不变")
        void testFactor_Constants() {
            assertAll(
                    () -> assertTrue(engine.factor(Expression.TRUE).isTrue()),
                    () -> assertTrue(engine.factor(Expression.FALSE).isFalse()),
                    () -> assertEquals(pos(A), engine.factor(pos(A)))
            );
        }

        @Test
        @DisplayName("吸收律：AB + ABC = AB")
        void testFactor_Absorption() {
            Expression e = sop(new int[]{A, B}, new int[]{A, B, C});

            assertEquals(Expression.and(pos(A), pos(B)), engine.factor(e));
        }
    }

    @Nested
    @DisplayName("语义保持 (Semantics)")
    class SemanticTests {

        @Test
        @DisplayName("分解前后在全部赋值下取值相同")
        void testFactor_PreservesFunction() {
            Expression e = Expression.or(
                    Expression.and(pos(A), pos(B), neg(C)),
                    Expression.and(pos(A), pos(B), pos(D)),
                    Expression.and(neg(C), pos(D), pos(E)),
                    Expression.and(neg(C), pos(D), neg(A)),
                    Expression.and(pos(F), pos(B), pos(A), neg(C)));

            assertSameFunction(e, engine.factor(e), 6);
        }

        @Test
        @DisplayName("最小因子为 1 时也提取单个文字")
        void testFactor_SingleLiteralFactors() {
            Expression e = sop(new int[]{A, B}, new int[]{A, C});

            Expression factored = new FactoringEngine(1).factor(e);

            assertAll(
                    () -> assertEquals("A(B + C)", factored.toString()),
                    () -> assertSameFunction(e, factored, 3)
            );
        }

        @Test
        @DisplayName("最小因子必须至少为 1")
        void testConstruction_InvalidMinSize_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> new FactoringEngine(0));
        }
    }
}
