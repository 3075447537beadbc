package org.logicanalyzer.expressions.minimize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Quine–McCluskey 本原蕴涵项生成。
 * <p>
 * 第 k 轮的蕴涵项都有 k 个无关位。两个蕴涵项可合并当且仅当 mask 相同且只差一个确定位，
 * 因此每个蕴涵项的合并伙伴只有 {@link Implicant#neighbor(int)} 给出的那几个，直接按哈希查找，
 * 不做两两比较。某一轮中没有任何可合并伙伴的蕴涵项即为本原蕴涵项。
 * <p>
 * 只有覆盖至少一个必需项的本原蕴涵项会进入覆盖选择，所以只从必需项出发扩展：
 * 包含必需项的立方体总能由包含同一必需项的一半与另一半合并得到，
 * 另一半若不在当前轮中，就直接检查它是否与 0 项相交。
 * 全由无关项组成的立方体不会被枚举。
 */
public final class QuineMcCluskey {

    private static final Logger logger = LoggerFactory.getLogger(QuineMcCluskey.class);

    private QuineMcCluskey() {
    }

    /**
     * 计算列中覆盖至少一个必需项的全部本原蕴涵项。
     * @param column 待最简化的列。
     * @return 本原蕴涵项，按 {@link Implicant#compareTo} 排序；列中没有必需项时为空。
     */
    public static List<Implicant> primeImplicants(MintermColumn column) {
        Objects.requireNonNull(column, "Column cannot be null.");
        int width = column.getWidth();
        OffSet off = new OffSet(column);

        Set<Implicant> level = new HashSet<>();
        for (Integer m : column.getOnSet()) {
            level.add(Implicant.ofMinterm(m, width));
        }

        SortedSet<Implicant> primes = new TreeSet<>();
        int round = 0;
        while (!level.isEmpty()) {
            Set<Implicant> next = new HashSet<>();
            for (Implicant implicant : level) {
                boolean merged = false;
                for (int bit = 0; bit < width; bit++) {
                    if (!implicant.isSpecified(bit)) {
                        continue;
                    }
                    Implicant partner = implicant.neighbor(bit);
                    if (level.contains(partner) || off.isDisjointFrom(partner)) {
                        next.add(implicant.expand(bit));
                        merged = true;
                    }
                }
                if (!merged) {
                    primes.add(implicant.asPrime());
                }
            }
            logger.debug("{} 第 {} 轮：{} 个蕴涵项，合并出 {} 个", column.getName(), round, level.size(), next.size());
            level = next;
            round++;
        }

        logger.debug("{} 的本原蕴涵项: {}", column.getName(), primes);
        return new ArrayList<>(primes);
    }

    /**
     * 列中标为 0 的最小项。
     */
    private static final class OffSet {

        private final BitSet bits;
        private final int[] minterms;
        private final int count;

        OffSet(MintermColumn column) {
            int space = 1 << column.getWidth();
            this.bits = new BitSet(space);
            bits.set(0, space);
            for (Integer m : column.careOrFree()) {
                bits.clear(m);
            }
            this.minterms = bits.stream().toArray();
            this.count = minterms.length;
        }

        /**
         * 立方体不含任何 0 项时返回 true。按立方体大小与 0 项个数中较小的一方枚举。
         */
        boolean isDisjointFrom(Implicant cube) {
            if (count == 0) {
                return true;
            }
            if ((1L << cube.freeCount()) <= count) {
                int free = ~cube.getMask() & ((1 << cube.getWidth()) - 1);
                int sub = free;
                while (true) {
                    if (bits.get(cube.getValue() | sub)) {
                        return false;
                    }
                    if (sub == 0) {
                        return true;
                    }
                    sub = (sub - 1) & free;
                }
            }
            for (int m : minterms) {
                if (cube.covers(m)) {
                    return false;
                }
            }
            return true;
        }
    }
}
