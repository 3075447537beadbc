package org.logicanalyzer.exploration;

/**
 * 探测引擎的阶段。
 */
public enum ExplorationPhase {

    /** 在当前状态上依次施加最小的未测试输入 */
    WALK,

    /** 规划并执行到最近的、仍有未测试输入的状态的路径 */
    PATHFIND,

    /** 从任何已发现状态（包括经复位）都无法再到达未测试输入 */
    DONE
}
