package org.logicanalyzer.expressions.factor;

import lombok.Getter;
import org.logicanalyzer.expressions.LiteralTerm;

import java.util.*;

/**
 * 因式分解时的候选公共子合取式，以及包含它的积项个数。
 * 得分 = 文字数 × 出现次数。
 */
@Getter
public final class FactorCandidate {

    /**
     * 得分高者在前；同分时文字数多者在前；再按文字集合的字典序，小者在前。
     */
    public static final Comparator<FactorCandidate> PREFERENCE = Comparator
            .comparingInt(FactorCandidate::score).reversed()
            .thenComparing(Comparator.comparingInt(FactorCandidate::size).reversed())
            .thenComparing(FactorCandidate::getLiterals, FactorCandidate::compareLiteralSets);

    private final SortedSet<LiteralTerm> literals;
    private final int count;

    public FactorCandidate(SortedSet<LiteralTerm> literals, int count) {
        this.literals = Collections.unmodifiableSortedSet(new TreeSet<>(literals));
        this.count = count;
    }

    public int size() {
        return literals.size();
    }

    public int score() {
        return size() * count;
    }

    public boolean isContainedIn(Set<LiteralTerm> term) {
        return term.containsAll(literals);
    }

    /**
     * 逐个元素比较，较短的前缀在前。
     */
    static int compareLiteralSets(SortedSet<LiteralTerm> a, SortedSet<LiteralTerm> b) {
        Iterator<LiteralTerm> ia = a.iterator();
        Iterator<LiteralTerm> ib = b.iterator();
        while (ia.hasNext() && ib.hasNext()) {
            int cmp = ia.next().compareTo(ib.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(ia.hasNext(), ib.hasNext());
    }

    @Override
    public String toString() {
        return literals + "x" + count + "(score=" + score() + ")";
    }
}
