package org.logicanalyzer.exploration;

import lombok.Getter;
import org.logicanalyzer.automata.base.State;

import java.util.List;

/**
 * 一次探测的统计结果。
 * 若存在无法到达的、仍有未测试输入的状态，则覆盖不完整。
 */
@Getter
public final class ExplorationReport {

    private final int probes;
    private final int resets;
    private final int resetCost;
    private final int statesDiscovered;
    private final int testedEntries;
    private final List<State> unreachableStates;

    public ExplorationReport(int probes, int resets, int resetCost, int statesDiscovered,
                             int testedEntries, List<State> unreachableStates) {
        this.probes = probes;
        this.resets = resets;
        this.resetCost = resetCost;
        this.statesDiscovered = statesDiscovered;
        this.testedEntries = testedEntries;
        this.unreachableStates = List.copyOf(unreachableStates);
    }

    /**
     * 以探测次数计的总代价：探测数 + 复位数 * C。
     */
    public int totalCost() {
        return probes + resets * resetCost;
    }

    public boolean isComplete() {
        return unreachableStates.isEmpty();
    }

    @Override
    public String toString() {
        return "ExplorationReport(probes=" + probes
                + ", resets=" + resets
                + ", totalCost=" + totalCost()
                + ", states=" + statesDiscovered
                + ", tested=" + testedEntries
                + ", unreachable=" + unreachableStates + ")";
    }
}
