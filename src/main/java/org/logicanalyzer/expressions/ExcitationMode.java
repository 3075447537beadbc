package org.logicanalyzer.expressions;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * JK 触发器的四种工作方式及其对应的 (J, K) 取值。
 */
public enum ExcitationMode {

    SET(true, false, "S"),
    RESET(false, true, "R"),
    HOLD(false, false, "H"),
    TOGGLE(true, true, "T");

    private final boolean j;
    private final boolean k;
    private final String symbol;

    ExcitationMode(boolean j, boolean k, String symbol) {
        this.j = j;
        this.k = k;
        this.symbol = symbol;
    }

    public boolean getJ() {
        return j;
    }

    public boolean getK() {
        return k;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 当前值为 q 时，以此方式触发后的下一值。
     */
    public boolean next(boolean q) {
        return switch (this) {
            case SET -> true;
            case RESET -> false;
            case HOLD -> q;
            case TOGGLE -> !q;
        };
    }

    /**
     * 能使触发器从 q 变为 qNext 的全部方式。
     * 例如 0 -> 1 可以是 SET 或 TOGGLE，即 J=1、K 任意。
     */
    public static Set<ExcitationMode> acceptable(boolean q, boolean qNext) {
        Set<ExcitationMode> result = EnumSet.noneOf(ExcitationMode.class);
        for (ExcitationMode mode : values()) {
            if (mode.next(q) == qNext) {
                result.add(mode);
            }
        }
        return result;
    }

    /**
     * 在给定方式集合下 J 的必需取值；集合中各方式的 J 不一致时为空，表示无关项。
     */
    public static Optional<Boolean> requiredJ(Set<ExcitationMode> modes) {
        return agreed(modes, true);
    }

    /**
     * 在给定方式集合下 K 的必需取值；集合中各方式的 K 不一致时为空，表示无关项。
     */
    public static Optional<Boolean> requiredK(Set<ExcitationMode> modes) {
        return agreed(modes, false);
    }

    private static Optional<Boolean> agreed(Set<ExcitationMode> modes, boolean forJ) {
        if (modes.isEmpty()) {
            throw new IllegalArgumentException("Excitation modes cannot be empty.");
        }
        Boolean value = null;
        for (ExcitationMode mode : modes) {
            boolean bit = forJ ? mode.j : mode.k;
            if (value == null) {
                value = bit;
            } else if (value != bit) {
                return Optional.empty();
            }
        }
        return Optional.of(value);
    }
}
