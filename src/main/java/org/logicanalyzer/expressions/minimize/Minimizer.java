package org.logicanalyzer.expressions.minimize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 对单列做两级最简化：Quine–McCluskey 生成本原蕴涵项，再选出覆盖。
 * 没有必需项的列直接得到常量假。
 */
public final class Minimizer {

    private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

    public MinimizationResult minimize(MintermColumn column) {
        Objects.requireNonNull(column, "Column cannot be null.");
        if (column.getOnSet().isEmpty()) {
            logger.info("列 {} 没有必需项，结果为常量 0", column.getName());
            return new MinimizationResult(column, List.of(), List.of());
        }
        List<Implicant> primes = QuineMcCluskey.primeImplicants(column);
        List<Implicant> selected = CoverSelector.select(primes, column.getOnSet());
        MinimizationResult result = new MinimizationResult(column, primes, selected);
        logger.info("最简化 {}: {} 个本原蕴涵项，选出 {}", column.getName(), primes.size(), result.patterns());
        return result;
    }
}
