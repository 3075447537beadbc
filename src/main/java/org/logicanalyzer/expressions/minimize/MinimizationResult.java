package org.logicanalyzer.expressions.minimize;

import lombok.Getter;
import org.logicanalyzer.expressions.Expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一列的最简化结果：全部本原蕴涵项、入选的蕴涵项及对应的积之和表达式。
 */
@Getter
public final class MinimizationResult {

    private final MintermColumn column;
    private final List<Implicant> primes;
    private final List<Implicant> selected;
    private final Expression expression;

    public MinimizationResult(MintermColumn column, List<Implicant> primes, List<Implicant> selected) {
        this.column = Objects.requireNonNull(column, "Column cannot be null.");
        this.primes = List.copyOf(primes);
        this.selected = List.copyOf(selected);
        this.expression = Expression.disjunction(this.selected.stream()
                .map(Implicant::toExpression)
                .collect(Collectors.toList()));
    }

    /**
     * 入选蕴涵项的模式串，例如 ["1-", "-1"]。
     */
    public List<String> patterns() {
        return selected.stream().map(Implicant::pattern).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return column.getName() + " = " + expression + " " + patterns();
    }
}
