package org.logicanalyzer.automata.base;

import lombok.Getter;
import org.logicanalyzer.core.BitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 电路的输入字母表：N 个输入引脚对应的全部 2^N 个输入向量，按数值升序排列。
 * 此类是不可变的。
 */
public final class InputAlphabet {

    private static final Logger logger = LoggerFactory.getLogger(InputAlphabet.class);

    @Getter
    private final int width;
    @Getter
    private final List<BitVector> inputs;

    private final int hashCode;

    private InputAlphabet(int width) {
        this.width = width;
        List<BitVector> all = new ArrayList<>(1 << width);
        for (long v = 0; v < (1L << width); v++) {
            all.add(BitVector.of(v, width));
        }
        this.inputs = Collections.unmodifiableList(all);
        this.hashCode = Objects.hash(width);
        logger.debug("创建 InputAlphabet，包含 {} 个输入向量。", inputs.size());
    }

    /**
     * 工厂方法：为 width 个输入引脚创建字母表。
     */
    public static InputAlphabet of(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("输入位宽必须大于 0: " + width);
        }
        return new InputAlphabet(width);
    }

    /**
     * 按数值取输入向量。
     */
    public BitVector get(int value) {
        return inputs.get(value);
    }

    /**
     * 检查某个向量是否属于该字母表。
     */
    public boolean contains(BitVector input) {
        return input != null && input.getWidth() == width;
    }

    public int size() {
        return inputs.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return width == ((InputAlphabet) o).width;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "InputAlphabet{width=" + width + ", size=" + inputs.size() + "}";
    }
}
