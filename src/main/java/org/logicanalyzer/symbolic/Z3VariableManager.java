package org.logicanalyzer.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicanalyzer.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理变量索引到 Z3 布尔常量的映射。
 * 确保每个变量在 Z3 Context 中有唯一的对应 Z3 变量。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final List<String> names;
    // 实例只在单线程中使用，HashMap 即可
    private final Map<Integer, BoolExpr> boolZ3Vars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param names 变量名，下标即变量索引；缺失的变量使用默认名。
     */
    public Z3VariableManager(Context ctx, List<String> names) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.names = List.copyOf(Objects.requireNonNull(names, "Names cannot be null."));
        this.boolZ3Vars = new HashMap<>();
        logger.debug("Z3VariableManager 初始化完成，已知 {} 个变量名。", this.names.size());
    }

    /**
     * 获取变量索引对应的 Z3 布尔变量，尚未创建时创建并缓存。
     * @param variable 变量索引。
     * @return 对应的 Z3 BoolExpr 变量。
     */
    public BoolExpr getZ3Var(int variable) {
        return boolZ3Vars.computeIfAbsent(variable, v -> {
            String name = nameOf(v);
            logger.debug("创建 Z3 布尔变量: {}", name);
            return ctx.mkBoolConst(name);
        });
    }

    public String nameOf(int variable) {
        return variable < names.size() ? names.get(variable) : Expression.defaultName(variable);
    }
}
