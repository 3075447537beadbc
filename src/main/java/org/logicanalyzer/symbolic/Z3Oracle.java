package org.logicanalyzer.symbolic;

import com.microsoft.z3.*;
import lombok.Getter;
import org.logicanalyzer.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * 基于 Z3 的布尔表达式判定：等价性证明与反例生成。
 * 持有一个 Z3 Context，使用完毕必须 {@link #close()}。
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    @Getter
    private final Context context;
    @Getter
    private final Z3VariableManager varManager;

    public Z3Oracle() {
        this(List.of());
    }

    /**
     * @param names 变量名，仅用于 Z3 中的常量命名与日志。
     */
    public Z3Oracle(List<String> names) {
        this.context = new Context();
        this.varManager = new Z3VariableManager(context, names);
    }

    /**
     * 检查公式的可满足性。
     */
    public Status check(BoolExpr formula) {
        Solver solver = context.mkSolver();
        solver.add(formula);
        Status status = solver.check();
        logger.debug("Z3 检查 {} 结果 {}", formula, status);
        return status;
    }

    /**
     * 两个表达式在全部赋值下取值相同时返回 true。
     */
    public boolean isEquivalent(Expression a, Expression b) {
        Status status = check(difference(a, b));
        if (status == Status.UNKNOWN) {
            logger.error("Z3 无法判定 {} 与 {} 是否等价", a, b);
            throw new IllegalStateException("Z3 returned UNKNOWN for equivalence of " + a + " and " + b);
        }
        return status == Status.UNSATISFIABLE;
    }

    /**
     * 求一个使两个表达式取值不同的赋值，第 i 位为变量 i 的取值。
     * @return 等价时为空。
     */
    public Optional<Long> counterexample(Expression a, Expression b) {
        Solver solver = context.mkSolver();
        solver.add(difference(a, b));
        Status status = solver.check();
        if (status != Status.SATISFIABLE) {
            return Optional.empty();
        }
        Model model = solver.getModel();
        SortedSet<Integer> variables = a.variables();
        variables.addAll(b.variables());
        long assignment = 0L;
        for (Integer v : variables) {
            Expr<BoolSort> value = model.eval(varManager.getZ3Var(v), true);
            if (value.isTrue()) {
                assignment |= 1L << v;
            }
        }
        logger.info("反例: {} 下 {} 与 {} 取值不同", Long.toBinaryString(assignment), a, b);
        return Optional.of(assignment);
    }

    private BoolExpr difference(Expression a, Expression b) {
        Objects.requireNonNull(a, "Expression cannot be null.");
        Objects.requireNonNull(b, "Expression cannot be null.");
        return context.mkXor(a.toZ3BoolExpr(varManager), b.toZ3BoolExpr(varManager));
    }

    @Override
    public void close() {
        context.close();
    }
}
