package org.logicanalyzer.expressions.minimize;

import lombok.Getter;

import java.util.*;

/**
 * 一个待最简化的输出列：变量空间中每个最小项标记为 1（必需）、无关项，或 0。
 * 未出现在 onSet 与 dontCares 中的最小项都视为 0。
 * 此类是不可变的。
 */
@Getter
public final class MintermColumn {

    public enum Label {
        ON,
        OFF,
        DONT_CARE
    }

    private final String name;
    private final int width;
    private final SortedSet<Integer> onSet;
    private final SortedSet<Integer> dontCares;

    public MintermColumn(String name, int width, Collection<Integer> onSet, Collection<Integer> dontCares) {
        this.name = Objects.requireNonNull(name, "Name cannot be null.");
        if (width < 0 || width > 30) {
            throw new IllegalArgumentException("Illegal column width: " + width);
        }
        this.width = width;
        TreeSet<Integer> on = new TreeSet<>(onSet);
        TreeSet<Integer> dc = new TreeSet<>(dontCares);
        int limit = 1 << width;
        for (Integer m : on) {
            if (m < 0 || m >= limit) {
                throw new IllegalArgumentException("最小项 " + m + " 超出 " + width + " 位的范围");
            }
            if (dc.contains(m)) {
                throw new IllegalArgumentException("最小项 " + m + " 不能同时为必需项与无关项");
            }
        }
        for (Integer m : dc) {
            if (m < 0 || m >= limit) {
                throw new IllegalArgumentException("最小项 " + m + " 超出 " + width + " 位的范围");
            }
        }
        this.onSet = Collections.unmodifiableSortedSet(on);
        this.dontCares = Collections.unmodifiableSortedSet(dc);
    }

    public Label label(int minterm) {
        if (onSet.contains(minterm)) {
            return Label.ON;
        }
        if (dontCares.contains(minterm)) {
            return Label.DONT_CARE;
        }
        return Label.OFF;
    }

    /**
     * 必需项与无关项的并集，即 Quine–McCluskey 的起始最小项。
     */
    public SortedSet<Integer> careOrFree() {
        SortedSet<Integer> all = new TreeSet<>(onSet);
        all.addAll(dontCares);
        return all;
    }

    @Override
    public String toString() {
        return name + "(width=" + width + ", on=" + onSet + ", dc=" + dontCares.size() + ")";
    }
}
