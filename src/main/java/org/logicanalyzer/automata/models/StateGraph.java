package org.logicanalyzer.automata.models;

import org.apache.commons.lang3.tuple.Pair;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.automata.base.Transition;
import org.logicanalyzer.core.BitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 探测过程中动态发现的状态迁移图。
 * 状态保存在按索引寻址的列表中，索引即身份；迁移按源状态索引和输入向量组织。
 * 图只增不减：状态与迁移一旦加入就不会被删除或修改。
 */
public final class StateGraph implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(StateGraph.class);

    private final int stateWidth;
    private final List<State> states = new ArrayList<>();
    private final Map<BitVector, State> statesByEncoding = new HashMap<>();
    private final Map<Integer, SortedMap<BitVector, Transition>> outgoing = new HashMap<>();
    private int transitionCount = 0;
    private State origin;

    /**
     * @param stateWidth 状态编码（触发器个数）的位宽。
     */
    public StateGraph(int stateWidth) {
        if (stateWidth < 0) {
            throw new IllegalArgumentException("State width cannot be negative: " + stateWidth);
        }
        this.stateWidth = stateWidth;
    }

    /**
     * 返回编码对应的状态；若尚未发现，则以下一个索引创建之。
     * @param encoding 设备报告的触发器取值。
     * @return 已有的或新建的状态。
     */
    public State addStateIfAbsent(BitVector encoding) {
        Objects.requireNonNull(encoding, "State encoding cannot be null.");
        if (encoding.getWidth() != stateWidth) {
            throw new IllegalArgumentException("状态编码位宽应为 " + stateWidth + "，实际为 " + encoding.getWidth());
        }
        State existing = statesByEncoding.get(encoding);
        if (existing != null) {
            return existing;
        }
        State created = new State(states.size(), encoding);
        states.add(created);
        statesByEncoding.put(encoding, created);
        logger.info("发现新状态 {}，当前共 {} 个状态。", created, states.size());
        return created;
    }

    public Optional<State> findState(BitVector encoding) {
        return Optional.ofNullable(statesByEncoding.get(encoding));
    }

    public State getState(int index) {
        return states.get(index);
    }

    public boolean contains(State state) {
        return state != null && state.getIndex() < states.size() && states.get(state.getIndex()).equals(state);
    }

    /**
     * 加入一条新迁移。调用方负责确保该 (源状态, 输入) 尚未记录。
     */
    public void addTransition(Transition transition) {
        Objects.requireNonNull(transition, "Transition cannot be null.");
        if (!contains(transition.getSource()) || !contains(transition.getTarget())) {
            throw new IllegalArgumentException("迁移引用了未发现的状态: " + transition);
        }
        SortedMap<BitVector, Transition> bySource =
                outgoing.computeIfAbsent(transition.getSource().getIndex(), k -> new TreeMap<>());
        if (bySource.containsKey(transition.getInput())) {
            throw new IllegalStateException("迁移已存在: " + bySource.get(transition.getInput()));
        }
        bySource.put(transition.getInput(), transition);
        transitionCount++;
        logger.debug("加入迁移 {}", transition);
    }

    public Optional<Transition> getTransition(State source, BitVector input) {
        SortedMap<BitVector, Transition> bySource = outgoing.get(source.getIndex());
        return bySource == null ? Optional.empty() : Optional.ofNullable(bySource.get(input));
    }

    /**
     * 源状态的全部出边，按输入向量升序。
     */
    public List<Transition> getOutgoing(State source) {
        SortedMap<BitVector, Transition> bySource = outgoing.get(source.getIndex());
        return bySource == null ? List.of() : List.copyOf(bySource.values());
    }

    public int getStateWidth() {
        return stateWidth;
    }

    public int stateCount() {
        return states.size();
    }

    public int transitionCount() {
        return transitionCount;
    }

    @Override
    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    /**
     * 全部迁移，按源状态索引、再按输入向量升序。
     */
    @Override
    public List<Transition> getTransitions() {
        List<Transition> all = new ArrayList<>(transitionCount);
        for (State state : states) {
            all.addAll(getOutgoing(state));
        }
        return all;
    }

    /**
     * 记录探测的起点：设备可复位时为复位后到达的原点，否则为上电状态。
     * 起点一旦确定就不能改为其他状态。
     */
    public void markOrigin(State state) {
        Objects.requireNonNull(state, "Origin cannot be null.");
        if (!contains(state)) {
            throw new IllegalArgumentException("原点不是已发现的状态: " + state);
        }
        if (origin != null && !origin.equals(state)) {
            throw new IllegalStateException("原点已是 " + origin + "，不能改为 " + state);
        }
        if (origin == null) {
            origin = state;
            logger.info("原点状态为 {}", state);
        }
    }

    @Override
    public Optional<State> getInitialState() {
        return Optional.ofNullable(origin);
    }

    @Override
    public Set<State> successors(State state) {
        Set<State> result = new TreeSet<>();
        for (Transition t : getOutgoing(state)) {
            result.add(t.getTarget());
        }
        return result;
    }

    /**
     * 从 start 出发沿已发现迁移可达的状态集合（包含 start 本身）。
     */
    public Set<State> reachableFrom(State start) {
        Set<State> visited = new TreeSet<>();
        Deque<State> todo = new ArrayDeque<>();
        todo.push(start);
        while (!todo.isEmpty()) {
            State cur = todo.pop();
            if (!visited.add(cur)) {
                continue;
            }
            for (State next : successors(cur)) {
                if (!visited.contains(next)) {
                    todo.push(next);
                }
            }
        }
        return visited;
    }

    /**
     * 按 (源状态, 目标状态) 分组的边标签，用于外部绘制状态图。
     * 每组中的输入向量按升序排列；分组按源索引、再按目标索引排列。
     */
    public SortedMap<Pair<State, State>, List<BitVector>> groupedEdges() {
        SortedMap<Pair<State, State>, List<BitVector>> grouped = new TreeMap<>();
        for (Transition t : getTransitions()) {
            grouped.computeIfAbsent(Pair.of(t.getSource(), t.getTarget()), k -> new ArrayList<>())
                    .add(t.getInput());
        }
        return grouped;
    }

    @Override
    public String toString() {
        return "StateGraph(states=" + states.size() + ", transitions=" + transitionCount + ")";
    }
}
