package org.logicanalyzer.expressions.factor;

import lombok.Getter;
import org.logicanalyzer.expressions.Expression;
import org.logicanalyzer.expressions.LiteralTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 对积之和表达式递归提取公共子合取式。
 * <p>
 * 每一层在当前积项中寻找出现在至少两个积项中、文字数不少于 minFactorSize 的子合取式，
 * 取得分（文字数 × 出现次数）最高者 c，改写为
 * {@code c·factor(商) + factor(其余积项)}，其中商是包含 c 的积项去掉 c 后的部分。
 * 没有候选时原样输出。每次递归的文字总数严格减少，因此必然终止。
 * <p>
 * 输入不是积之和形式时，逐个子节点分解后重建，已分解过的表达式因此保持不变。
 */
public final class FactoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(FactoringEngine.class);

    @Getter
    private final int minFactorSize;

    public FactoringEngine(int minFactorSize) {
        if (minFactorSize < 1) {
            throw new IllegalArgumentException("minFactorSize must be >= 1");
        }
        this.minFactorSize = minFactorSize;
    }

    public Expression factor(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null.");
        if (expression.isSumOfProducts()) {
            return factorTerms(termsOf(expression));
        }
        List<Expression> children = expression.getChildren().stream()
                .map(this::factor)
                .collect(Collectors.toList());
        return expression.getKind() == Expression.Kind.AND
                ? Expression.conjunction(children)
                : Expression.disjunction(children);
    }

    private static List<SortedSet<LiteralTerm>> termsOf(Expression sop) {
        List<SortedSet<LiteralTerm>> terms = new ArrayList<>();
        if (sop.isProductTerm()) {
            terms.add(sop.literals());
            return terms;
        }
        for (Expression child : sop.getChildren()) {
            terms.add(child.literals());
        }
        return terms;
    }

    /**
     * 分解一组积项（每个积项是文字集合）。
     */
    public Expression factorTerms(List<SortedSet<LiteralTerm>> input) {
        List<SortedSet<LiteralTerm>> terms = absorb(input);
        if (terms.isEmpty()) {
            return Expression.FALSE;
        }
        if (terms.get(0).isEmpty()) {
            return Expression.TRUE;
        }

        Optional<FactorCandidate> best = bestCandidate(terms);
        if (best.isEmpty()) {
            return Expression.disjunction(terms.stream()
                    .map(Expression::product)
                    .collect(Collectors.toList()));
        }

        FactorCandidate candidate = best.get();
        logger.debug("提取公共因子 {}", candidate);
        List<SortedSet<LiteralTerm>> quotients = new ArrayList<>();
        List<SortedSet<LiteralTerm>> leftover = new ArrayList<>();
        for (SortedSet<LiteralTerm> term : terms) {
            if (candidate.isContainedIn(term)) {
                SortedSet<LiteralTerm> quotient = new TreeSet<>(term);
                quotient.removeAll(candidate.getLiterals());
                quotients.add(quotient);
            } else {
                leftover.add(term);
            }
        }

        List<Expression> factored = new ArrayList<>();
        for (LiteralTerm literal : candidate.getLiterals()) {
            factored.add(literal.toExpression());
        }
        factored.add(factorTerms(quotients));
        return Expression.disjunction(List.of(Expression.conjunction(factored), factorTerms(leftover)));
    }

    /**
     * 去重并应用吸收律（x + xy = x），保持原有顺序。
     */
    private static List<SortedSet<LiteralTerm>> absorb(List<SortedSet<LiteralTerm>> input) {
        List<SortedSet<LiteralTerm>> unique = new ArrayList<>(new LinkedHashSet<>(input));
        List<SortedSet<LiteralTerm>> result = new ArrayList<>();
        for (SortedSet<LiteralTerm> term : unique) {
            boolean absorbed = false;
            for (SortedSet<LiteralTerm> other : unique) {
                if (other != term && other.size() < term.size() && term.containsAll(other)) {
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                result.add(term);
            }
        }
        // 常量真吸收一切
        if (result.stream().anyMatch(Set::isEmpty)) {
            return List.of(new TreeSet<>());
        }
        return result;
    }

    /**
     * 候选集合为两两积项交集在求交运算下的闭包：
     * 对任一子合取式 s，包含它的全部积项之交同样出现在这些积项中，且文字数不少于 s，
     * 所以最优候选必在闭包内。
     */
    private Optional<FactorCandidate> bestCandidate(List<SortedSet<LiteralTerm>> terms) {
        Set<SortedSet<LiteralTerm>> closure = new LinkedHashSet<>();
        Deque<SortedSet<LiteralTerm>> work = new ArrayDeque<>();
        for (int i = 0; i < terms.size(); i++) {
            for (int j = i + 1; j < terms.size(); j++) {
                SortedSet<LiteralTerm> common = new TreeSet<>(terms.get(i));
                common.retainAll(terms.get(j));
                if (common.size() >= minFactorSize && closure.add(common)) {
                    work.add(common);
                }
            }
        }
        while (!work.isEmpty()) {
            SortedSet<LiteralTerm> current = work.poll();
            for (SortedSet<LiteralTerm> term : terms) {
                SortedSet<LiteralTerm> common = new TreeSet<>(current);
                common.retainAll(term);
                if (common.size() >= minFactorSize && closure.add(common)) {
                    work.add(common);
                }
            }
        }

        List<FactorCandidate> candidates = new ArrayList<>();
        for (SortedSet<LiteralTerm> literals : closure) {
            int count = (int) terms.stream().filter(t -> t.containsAll(literals)).count();
            if (count >= 2) {
                candidates.add(new FactorCandidate(literals, count));
            }
        }
        return candidates.stream()
                .filter(c -> c.score() > 1)
                .min(FactorCandidate.PREFERENCE);
    }
}
