package org.logicanalyzer.table;

/**
 * 真值表中一个 (状态, 输入) 条目的状态。
 */
public enum EntryStatus {

    /** 状态已发现，但该输入尚未施加过 */
    UNTESTED,

    /** 已施加并记录了结果 */
    TESTED,

    /** 状态从未被发现，求解时作为无关项处理 */
    DONT_CARE
}
