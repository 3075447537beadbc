package org.logicanalyzer.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.logicanalyzer.symbolic.Z3VariableManager;

/**
 * 可以编码为 Z3 布尔公式的逻辑对象。变量 i 对应 varManager 中第 i 个布尔常量。
 */
public interface ToZ3BoolExpr {

    /**
     * @param ctx        Z3 Context 实例，必须与 varManager 创建变量时使用的相同。
     * @param varManager 变量索引到 Z3 布尔常量的映射。
     * @return 对应的 Z3 BoolExpr。
     */
    BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager);

    /**
     * 使用 varManager 自身的 Context 编码。
     */
    default BoolExpr toZ3BoolExpr(Z3VariableManager varManager) {
        return toZ3BoolExpr(varManager.getCtx(), varManager);
    }
}
