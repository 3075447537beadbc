package org.logicanalyzer.analysis;

import lombok.Getter;
import org.logicanalyzer.expressions.Expression;
import org.logicanalyzer.expressions.minimize.ColumnSelector;
import org.logicanalyzer.expressions.minimize.MinimizationResult;

import java.util.List;
import java.util.Objects;

/**
 * 一个信号的求解结果：最简积之和式及其因式分解形式。
 */
@Getter
public final class SolvedSignal {

    private final String name;
    private final ColumnSelector selector;
    private final MinimizationResult minimization;
    private final Expression factored;

    public SolvedSignal(String name, ColumnSelector selector, MinimizationResult minimization, Expression factored) {
        this.name = Objects.requireNonNull(name, "Name cannot be null.");
        this.selector = Objects.requireNonNull(selector, "Selector cannot be null.");
        this.minimization = Objects.requireNonNull(minimization, "Minimization cannot be null.");
        this.factored = Objects.requireNonNull(factored, "Factored expression cannot be null.");
    }

    public Expression getMinimal() {
        return minimization.getExpression();
    }

    /**
     * 形如 "Z0 = AB' + C" 的文本。
     * @param variables 变量名，下标即变量索引。
     */
    public String render(List<String> variables) {
        return name + " = " + factored.format(variables);
    }

    @Override
    public String toString() {
        return name + " = " + factored;
    }
}
