package org.logicanalyzer.exploration;

import lombok.Getter;
import org.logicanalyzer.core.BitVector;

import java.util.Objects;

/**
 * 施加一次输入后设备的响应：输出向量与新的触发器取值。
 */
@Getter
public final class DeviceResponse {

    private final BitVector outputs;
    private final BitVector state;

    public DeviceResponse(BitVector outputs, BitVector state) {
        this.outputs = Objects.requireNonNull(outputs, "Outputs cannot be null.");
        this.state = Objects.requireNonNull(state, "State cannot be null.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DeviceResponse that = (DeviceResponse) o;
        return outputs.equals(that.outputs) && state.equals(that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputs, state);
    }

    @Override
    public String toString() {
        return "DeviceResponse(outputs=" + outputs + ", state=" + state + ")";
    }
}
