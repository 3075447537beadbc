package org.logicanalyzer.exploration;

import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.core.CircuitShape;

/**
 * 被测电路（实物或仿真）的访问接口。
 * 所有方法都是阻塞的；对固定的当前状态，{@link #applyInput(BitVector)} 必须是确定性的。
 */
public interface CircuitDevice {

    /**
     * 电路的引脚规模。
     */
    CircuitShape shape();

    /**
     * 设置输入、产生一个时钟沿，并读回输出与触发器取值。
     * @param input 输入向量，位宽等于输入引脚数。
     * @return 时钟沿之后的输出与状态。
     */
    DeviceResponse applyInput(BitVector input);

    /**
     * 复位（断电重启），使电路回到唯一的已知原点配置。
     */
    void reset();

    /**
     * 读取当前的触发器取值，不改变电路状态。
     */
    BitVector observeState();
}
