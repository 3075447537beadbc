package org.logicanalyzer.exploration;

import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.automata.base.Transition;
import org.logicanalyzer.automata.models.StateGraph;
import org.logicanalyzer.table.TruthTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 在已发现的状态图上用 Dijkstra 算法寻找代价最小的“下一次探测”。
 * <p>
 * 图的节点是全部已发现状态加上一个合成的原点节点。边包括：
 * 每条已发现迁移（权重 1）、每个状态到原点节点的复位边（权重 C），
 * 以及原点节点到原点状态的零权边（原点状态已知时）。
 * 目标是任意仍有未测试输入的状态，其总代价为路径代价加 1。
 * 并列时依次比较：复位次数更少、目标索引更小。
 */
public final class PathPlanner {

    private static final Logger logger = LoggerFactory.getLogger(PathPlanner.class);

    private static final int UNREACHED = Integer.MAX_VALUE;

    private final int resetCost;
    private final boolean resetEnabled;

    public PathPlanner(int resetCost, boolean resetEnabled) {
        if (resetCost < 1) {
            throw new IllegalArgumentException("resetCost must be >= 1");
        }
        this.resetCost = resetCost;
        this.resetEnabled = resetEnabled;
    }

    /**
     * 规划从 live 出发的下一次探测。
     * @param store  当前真值表。
     * @param live   设备当前所处的状态。
     * @param origin 复位后到达的原点状态，尚未知时为 null。
     * @return 最优计划；没有任何可达的未测试输入时为空。
     */
    public Optional<ProbePlan> plan(TruthTableStore store, State live, State origin) {
        Objects.requireNonNull(store, "Store cannot be null.");
        Objects.requireNonNull(live, "Live state cannot be null.");
        StateGraph graph = store.getGraph();

        int n = graph.stateCount();
        int originNode = n;
        int[] dist = new int[n + 1];
        int[] resets = new int[n + 1];
        int[] prev = new int[n + 1];
        ProbePlan.Step[] via = new ProbePlan.Step[n + 1];
        Arrays.fill(dist, UNREACHED);
        Arrays.fill(prev, -1);

        PriorityQueue<int[]> queue = new PriorityQueue<>(
                Comparator.<int[]>comparingInt(e -> e[1])
                        .thenComparingInt(e -> e[2])
                        .thenComparingInt(e -> e[0]));
        dist[live.getIndex()] = 0;
        queue.add(new int[]{live.getIndex(), 0, 0});

        while (!queue.isEmpty()) {
            int[] entry = queue.poll();
            int u = entry[0];
            if (entry[1] != dist[u] || entry[2] != resets[u]) {
                continue;
            }
            if (u == originNode) {
                if (origin != null) {
                    relax(u, origin.getIndex(), 0, 0, ProbePlan.Step.reset(origin), dist, resets, prev, via, queue);
                }
                continue;
            }
            for (Transition t : graph.getOutgoing(graph.getState(u))) {
                relax(u, t.getTarget().getIndex(), 1, 0,
                        ProbePlan.Step.apply(t.getInput(), t.getTarget()), dist, resets, prev, via, queue);
            }
            if (resetEnabled) {
                relax(u, originNode, resetCost, 1, null, dist, resets, prev, via, queue);
            }
        }

        State best = null;
        for (State candidate : store.statesWithUntestedInputs()) {
            int i = candidate.getIndex();
            if (dist[i] == UNREACHED) {
                continue;
            }
            if (best == null
                    || dist[i] < dist[best.getIndex()]
                    || (dist[i] == dist[best.getIndex()] && resets[i] < resets[best.getIndex()])) {
                best = candidate;
            }
        }
        if (best == null) {
            logger.debug("从 {} 出发没有可达的未测试输入。", live);
            return Optional.empty();
        }

        LinkedList<ProbePlan.Step> steps = new LinkedList<>();
        for (int v = best.getIndex(); v != live.getIndex(); v = prev[v]) {
            if (via[v] != null) {
                steps.addFirst(via[v]);
            }
        }
        ProbePlan plan = new ProbePlan(best, steps, store.firstUntestedInput(best).orElseThrow(),
                dist[best.getIndex()] + 1);
        logger.info("规划路径: {}", plan);
        return Optional.of(plan);
    }

    private static void relax(int u, int v, int weight, int resetWeight, ProbePlan.Step step,
                              int[] dist, int[] resets, int[] prev, ProbePlan.Step[] via,
                              PriorityQueue<int[]> queue) {
        int nd = dist[u] + weight;
        int nr = resets[u] + resetWeight;
        if (nd < dist[v] || (nd == dist[v] && nr < resets[v])) {
            dist[v] = nd;
            resets[v] = nr;
            prev[v] = u;
            via[v] = step;
            queue.add(new int[]{v, nd, nr});
        }
    }
}
