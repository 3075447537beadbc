package org.logicanalyzer.automata.base;

import lombok.Getter;
import org.logicanalyzer.core.BitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表被测电路的一个已发现状态。
 * 索引在首次发现时按顺序分配，之后保持不变；状态以索引作为身份。
 * 编码是设备报告的触发器取值。
 * 此类是不可变的。
 */
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private final int index;
    @Getter
    private final BitVector encoding;
    @Getter
    private final String label;

    private final int hashCode;

    /**
     * 由 {@link org.logicanalyzer.automata.models.StateGraph} 在发现新状态时调用。
     * @param index    发现序号。
     * @param encoding 设备报告的触发器取值。
     */
    public State(int index, BitVector encoding) {
        if (index < 0) {
            throw new IllegalArgumentException("State index cannot be negative: " + index);
        }
        this.index = index;
        this.encoding = Objects.requireNonNull(encoding, "State encoding cannot be null.");
        this.label = "S" + index;
        this.hashCode = Objects.hash(index);
        logger.debug("创建了一个State: {} with encoding {}", label, encoding);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return index == state.index;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return encoding.getWidth() == 0 ? label : label + "[" + encoding + "]";
    }

    @Override
    public int compareTo(State other) {
        return Integer.compare(this.index, other.index);
    }
}
