package org.logicanalyzer.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicanalyzer.symbolic.Z3VariableManager;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 布尔表达式树，节点是带标签的变体 {LITERAL, AND, OR}。
 * 没有子节点的 AND 表示常量真，没有子节点的 OR 表示常量假。
 * 所有变换都构造新树而不修改已有子树，因此子树可以被多个父节点共享。
 * 此类是不可变的。
 */
@Getter
public final class Expression implements ToZ3BoolExpr {

    public enum Kind {
        LITERAL,
        AND,
        OR
    }

    /** 常量真：空积项 */
    public static final Expression TRUE = new Expression(Kind.AND, -1, true, List.of());
    /** 常量假：空和式 */
    public static final Expression FALSE = new Expression(Kind.OR, -1, true, List.of());

    private final Kind kind;
    /** 仅对 LITERAL 有意义，其余为 -1 */
    private final int variable;
    /** 仅对 LITERAL 有意义 */
    private final boolean positive;
    private final List<Expression> children;

    private final int hashCode;

    private Expression(Kind kind, int variable, boolean positive, List<Expression> children) {
        this.kind = kind;
        this.variable = variable;
        this.positive = positive;
        this.children = children;
        this.hashCode = Objects.hash(kind, variable, positive, children);
    }

    // --- 工厂方法 ---

    public static Expression literal(int variable, boolean positive) {
        if (variable < 0) {
            throw new IllegalArgumentException("Variable index cannot be negative: " + variable);
        }
        return new Expression(Kind.LITERAL, variable, positive, List.of());
    }

    /**
     * 原样构造 AND 节点，不做任何化简。
     */
    public static Expression and(List<Expression> children) {
        return new Expression(Kind.AND, -1, true, List.copyOf(children));
    }

    public static Expression and(Expression... children) {
        return and(Arrays.asList(children));
    }

    /**
     * 原样构造 OR 节点，不做任何化简。
     */
    public static Expression or(List<Expression> children) {
        return new Expression(Kind.OR, -1, true, List.copyOf(children));
    }

    public static Expression or(Expression... children) {
        return or(Arrays.asList(children));
    }

    /**
     * 构造合取：展开嵌套的 AND，去掉常量真；含常量假时结果为假；只剩一个子项时直接返回它。
     */
    public static Expression conjunction(List<Expression> parts) {
        List<Expression> flat = new ArrayList<>();
        for (Expression part : parts) {
            if (part.isFalse()) {
                return FALSE;
            }
            if (part.kind == Kind.AND) {
                flat.addAll(part.children);
            } else {
                flat.add(part);
            }
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return and(flat);
    }

    /**
     * 构造析取：展开嵌套的 OR，去掉常量假；含常量真时结果为真；只剩一个子项时直接返回它。
     */
    public static Expression disjunction(List<Expression> parts) {
        List<Expression> flat = new ArrayList<>();
        for (Expression part : parts) {
            if (part.isTrue()) {
                return TRUE;
            }
            if (part.kind == Kind.OR) {
                flat.addAll(part.children);
            } else {
                flat.add(part);
            }
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return or(flat);
    }

    /**
     * 由文字集合构造积项，空集合为常量真。
     */
    public static Expression product(Collection<LiteralTerm> literals) {
        return conjunction(literals.stream().map(LiteralTerm::toExpression).collect(Collectors.toList()));
    }

    // --- 查询 ---

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isTrue() {
        return kind == Kind.AND && children.isEmpty();
    }

    public boolean isFalse() {
        return kind == Kind.OR && children.isEmpty();
    }

    public boolean isConstant() {
        return isTrue() || isFalse();
    }

    /**
     * 是否为文字的合取（包括单个文字和常量真）。
     */
    public boolean isProductTerm() {
        if (kind == Kind.LITERAL) {
            return true;
        }
        return kind == Kind.AND && children.stream().allMatch(Expression::isLiteral);
    }

    /**
     * 是否为积之和形式（包括常量、单个积项）。
     */
    public boolean isSumOfProducts() {
        if (isProductTerm()) {
            return true;
        }
        return kind == Kind.OR && children.stream().allMatch(Expression::isProductTerm);
    }

    /**
     * 对积项返回其文字集合；不是积项时抛出异常。
     */
    public SortedSet<LiteralTerm> literals() {
        if (kind == Kind.LITERAL) {
            return new TreeSet<>(Set.of(LiteralTerm.of(variable, positive)));
        }
        if (!isProductTerm()) {
            throw new IllegalStateException("不是积项: " + this);
        }
        SortedSet<LiteralTerm> result = new TreeSet<>();
        for (Expression child : children) {
            result.add(LiteralTerm.of(child.variable, child.positive));
        }
        return result;
    }

    /**
     * 以 assignment 的第 i 位作为变量 i 的取值求值。
     */
    public boolean evaluate(long assignment) {
        return switch (kind) {
            case LITERAL -> (((assignment >> variable) & 1L) == 1L) == positive;
            case AND -> children.stream().allMatch(c -> c.evaluate(assignment));
            case OR -> children.stream().anyMatch(c -> c.evaluate(assignment));
        };
    }

    /**
     * 文字出现次数，用于衡量表达式大小。
     */
    public int literalCount() {
        if (kind == Kind.LITERAL) {
            return 1;
        }
        int count = 0;
        for (Expression child : children) {
            count += child.literalCount();
        }
        return count;
    }

    /**
     * 表达式中出现的变量索引。
     */
    public SortedSet<Integer> variables() {
        SortedSet<Integer> result = new TreeSet<>();
        collectVariables(result);
        return result;
    }

    private void collectVariables(Set<Integer> into) {
        if (kind == Kind.LITERAL) {
            into.add(variable);
            return;
        }
        for (Expression child : children) {
            child.collectVariables(into);
        }
    }

    /**
     * 子节点按规范顺序递归排序后的等价树，用于忽略顺序的结构比较。
     */
    public Expression canonical() {
        if (kind == Kind.LITERAL) {
            return this;
        }
        List<Expression> sorted = children.stream()
                .map(Expression::canonical)
                .sorted(Comparator.comparing(Expression::toString))
                .collect(Collectors.toList());
        return new Expression(kind, -1, true, List.copyOf(sorted));
    }

    /**
     * 忽略子节点顺序的结构相等。
     */
    public boolean isStructurallyEquivalent(Expression other) {
        return other != null && canonical().equals(other.canonical());
    }

    // --- 输出 ---

    /**
     * 默认变量名：0..25 为 A..Z，其余为 x{i}。
     */
    public static String defaultName(int variable) {
        if (variable < 26) {
            return String.valueOf((char) ('A' + variable));
        }
        return "x" + variable;
    }

    /**
     * 以给定变量名输出：和式用 " + " 连接，积项直接并列，反变量后缀 "'"，
     * 积项中的和式加括号，常量输出为 1 / 0。
     * @param names 变量名，下标即变量索引；缺失时使用默认名。
     */
    public String format(List<String> names) {
        Objects.requireNonNull(names, "Names cannot be null.");
        return switch (kind) {
            case LITERAL -> nameOf(variable, names) + (positive ? "" : "'");
            case OR -> children.isEmpty() ? "0" : children.stream()
                    .map(c -> c.format(names))
                    .collect(Collectors.joining(" + "));
            case AND -> children.isEmpty() ? "1" : children.stream()
                    .map(c -> c.kind == Kind.OR && !c.children.isEmpty() ? "(" + c.format(names) + ")" : c.format(names))
                    .collect(Collectors.joining());
        };
    }

    private static String nameOf(int variable, List<String> names) {
        return variable < names.size() ? names.get(variable) : defaultName(variable);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return switch (kind) {
            case LITERAL -> positive ? varManager.getZ3Var(variable) : ctx.mkNot(varManager.getZ3Var(variable));
            case AND -> children.isEmpty() ? ctx.mkTrue() : ctx.mkAnd(children.stream()
                    .map(c -> c.toZ3BoolExpr(ctx, varManager))
                    .toArray(BoolExpr[]::new));
            case OR -> children.isEmpty() ? ctx.mkFalse() : ctx.mkOr(children.stream()
                    .map(c -> c.toZ3BoolExpr(ctx, varManager))
                    .toArray(BoolExpr[]::new));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Expression that = (Expression) o;
        return kind == that.kind
                && variable == that.variable
                && positive == that.positive
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return format(List.of());
    }
}
