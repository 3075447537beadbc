package org.logicanalyzer.expressions.minimize;

import org.logicanalyzer.expressions.LiteralTerm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class QuineMcCluskeyTest {

    private static List<String> patterns(List<Implicant> implicants) {
        return implicants.stream().map(Implicant::pattern).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("蕴涵项 (Implicant)")
    class ImplicantTests {

        @Test
        @DisplayName("只差一位的蕴涵项合并后该位成为无关位")
        void testExpand() {
            Implicant m5 = Implicant.ofMinterm(0b101, 3);

            Implicant merged = m5.expand(1);

            assertAll(
                    () -> assertEquals(Implicant.ofMinterm(0b111, 3), m5.neighbor(1)),
                    () -> assertEquals(merged, m5.neighbor(1).expand(1)),
                    () -> assertEquals("1-1", merged.pattern()),
                    () -> assertEquals(Set.of(5, 7), merged.minterms()),
                    () -> assertTrue(merged.covers(0b101)),
                    () -> assertFalse(merged.covers(0b100)),
                    () -> assertEquals(2, merged.specifiedCount()),
                    () -> assertEquals(1, merged.freeCount()),
                    () -> assertEquals(List.of(LiteralTerm.positive(0), LiteralTerm.positive(2)),
                            List.copyOf(merged.literals()))
            );
        }

        @Test
        @DisplayName("无关位不能再合并，非规范的位模式被拒绝")
        void testExpand_FreeBit_ShouldThrow() {
            Implicant dash = Implicant.of(2, 0b10, 0b00);

            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> dash.expand(0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> dash.neighbor(0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Implicant.of(2, 0b10, 0b01)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Implicant.of(2, 0b100, 0))
            );
        }

        @Test
        @DisplayName("相等性只看模式，不看本原标记")
        void testEquality() {
            Implicant a = Implicant.ofMinterm(1, 2).expand(1);
            Implicant b = Implicant.ofMinterm(3, 2).expand(1).asPrime();

            assertAll(
                    () -> assertEquals(a, b),
                    () -> assertEquals(a.hashCode(), b.hashCode()),
                    () -> assertTrue(b.isPrime()),
                    () -> assertFalse(a.isPrime())
            );
        }
    }

    @Nested
    @DisplayName("本原蕴涵项 (Prime implicants)")
    class PrimeTests {

        @Test
        @DisplayName("全部四个最小项合并为一个没有确定位的本原蕴涵项")
        void testPrimes_FullSpace() {
            MintermColumn column = new MintermColumn("f", 2, List.of(0, 1, 2, 3), List.of());

            List<Implicant> primes = QuineMcCluskey.primeImplicants(column);

            assertAll(
                    () -> assertEquals(List.of("--"), patterns(primes)),
                    () -> assertTrue(primes.get(0).isPrime()),
                    () -> assertEquals(0, primes.get(0).specifiedCount())
            );
        }

        @Test
        @DisplayName("循环覆盖问题 m(0,1,2,5,6,7) 有六个本原蕴涵项")
        void testPrimes_CyclicFunction() {
            MintermColumn column = new MintermColumn("f", 3, List.of(0, 1, 2, 5, 6, 7), List.of());

            List<Implicant> primes = QuineMcCluskey.primeImplicants(column);

            assertEquals(Set.of("00-", "0-0", "-01", "-10", "1-1", "11-"), Set.copyOf(patterns(primes)));
        }

        @Test
        @DisplayName("无关项参与合并")
        void testPrimes_WithDontCares() {
            MintermColumn column = new MintermColumn("f", 2, List.of(1), List.of(3));

            assertEquals(List.of("-1"), patterns(QuineMcCluskey.primeImplicants(column)));
        }

        @Test
        @DisplayName("只由无关项组成的本原蕴涵项不会生成")
        void testPrimes_DontCareOnlyPrimesSkipped() {
            // m(0) + d(3)：11 本身是只含无关项的本原蕴涵项，对覆盖没有用处
            MintermColumn column = new MintermColumn("f", 2, List.of(0), List.of(3));

            assertEquals(List.of("00"), patterns(QuineMcCluskey.primeImplicants(column)));
        }

        @Test
        @DisplayName("稀疏的 16 变量列：几乎全是无关项时仍能很快求出本原蕴涵项")
        void testPrimes_WideSparseColumn() {
            // 变量 0..3 为输入，4..15 为状态位；状态全 0 时 AB 为 1，其余输入为 0，其他状态未观测
            List<Integer> on = new ArrayList<>();
            List<Integer> dc = new ArrayList<>();
            for (int m = 0; m < (1 << 16); m++) {
                if ((m >> 4) != 0) {
                    dc.add(m);
                } else if ((m & 0b11) == 0b11) {
                    on.add(m);
                }
            }
            MintermColumn column = new MintermColumn("Z0", 16, on, dc);

            List<Implicant> primes = assertTimeoutPreemptively(Duration.ofSeconds(30),
                    () -> QuineMcCluskey.primeImplicants(column));

            // 含必需项的立方体必须固定 A=B=1，否则会包含状态全 0 时的 0 项
            assertEquals(List.of("------------" + "--11"), patterns(primes));
        }

        @Test
        @DisplayName("无法合并的最小项本身就是本原蕴涵项")
        void testPrimes_Isolated() {
            MintermColumn column = new MintermColumn("f", 2, List.of(0, 3), List.of());

            assertEquals(List.of("00", "11"), patterns(QuineMcCluskey.primeImplicants(column)));
        }
    }
}
