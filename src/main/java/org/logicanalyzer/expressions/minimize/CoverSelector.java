package org.logicanalyzer.expressions.minimize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 从本原蕴涵项中选出覆盖全部必需最小项的子集。
 * <p>
 * 先选必要项：只被唯一一个本原蕴涵项覆盖的必需项迫使该项入选，移除其覆盖的必需项后重复；
 * 之后贪心选择，每次取覆盖剩余必需项最多者，
 * 并列时依次取确定位更少、value 更小、mask 更小者。无关项只用于合并，不要求被覆盖。
 */
public final class CoverSelector {

    private static final Logger logger = LoggerFactory.getLogger(CoverSelector.class);

    private CoverSelector() {
    }

    /**
     * @param primes   本原蕴涵项。
     * @param required 必须被覆盖的最小项。
     * @return 按入选顺序排列的蕴涵项。
     * @throws IllegalArgumentException 存在任何本原蕴涵项都不覆盖的必需项时。
     */
    public static List<Implicant> select(List<Implicant> primes, Collection<Integer> required) {
        Objects.requireNonNull(primes, "Primes cannot be null.");
        SortedSet<Integer> remaining = new TreeSet<>(required);
        List<Implicant> selected = new ArrayList<>();

        for (Integer m : remaining) {
            if (primes.stream().noneMatch(p -> p.covers(m))) {
                throw new IllegalArgumentException("必需项 " + m + " 不被任何本原蕴涵项覆盖");
            }
        }

        boolean found = true;
        while (found && !remaining.isEmpty()) {
            found = false;
            for (Integer m : remaining) {
                Implicant only = null;
                int count = 0;
                for (Implicant p : primes) {
                    if (p.covers(m)) {
                        only = p;
                        count++;
                    }
                }
                if (count == 1 && !selected.contains(only)) {
                    logger.debug("必要蕴涵项 {}（唯一覆盖 {}）", only.pattern(), m);
                    take(only, selected, remaining);
                    found = true;
                    break;
                }
            }
        }

        Comparator<Implicant> preference = Comparator
                .comparingInt((Implicant p) -> -coveredCount(p, remaining))
                .thenComparingInt(Implicant::specifiedCount)
                .thenComparingInt(Implicant::getValue)
                .thenComparingInt(Implicant::getMask);
        while (!remaining.isEmpty()) {
            Implicant best = primes.stream()
                    .filter(p -> !selected.contains(p))
                    .min(preference)
                    .orElseThrow(() -> new IllegalStateException("蕴涵项已用尽，仍有未覆盖的必需项: " + remaining));
            logger.debug("贪心选择 {}，覆盖剩余 {} 个必需项", best.pattern(), coveredCount(best, remaining));
            take(best, selected, remaining);
        }
        return selected;
    }

    private static void take(Implicant implicant, List<Implicant> selected, SortedSet<Integer> remaining) {
        selected.add(implicant);
        remaining.removeIf(implicant::covers);
    }

    private static int coveredCount(Implicant implicant, Set<Integer> remaining) {
        int count = 0;
        for (Integer m : remaining) {
            if (implicant.covers(m)) {
                count++;
            }
        }
        return count;
    }
}
