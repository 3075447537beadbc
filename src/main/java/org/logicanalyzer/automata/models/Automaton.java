package org.logicanalyzer.automata.models;

import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.automata.base.Transition;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 有限状态机的只读视图，供外部渲染或分析使用。
 */
public interface Automaton {

    List<State> getStates();

    List<Transition> getTransitions();

    /**
     * 初始状态：复位后到达的原点；设备不能复位时为上电状态。尚未确定时为空。
     */
    Optional<State> getInitialState();

    /**
     * 从 state 出发经一条迁移可达的全部状态。
     */
    Set<State> successors(State state);
}
