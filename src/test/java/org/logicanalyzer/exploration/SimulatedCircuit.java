package org.logicanalyzer.exploration;

import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.core.CircuitShape;

import java.util.Objects;

/**
 * 测试用的确定性同步电路：状态与输出由一个纯函数给出。
 */
public class SimulatedCircuit implements CircuitDevice {

    @FunctionalInterface
    public interface Logic {
        DeviceResponse step(BitVector state, BitVector input);
    }

    private final CircuitShape shape;
    private final BitVector origin;
    private final Logic logic;

    private BitVector current;
    private int applied;
    private int resets;

    public SimulatedCircuit(CircuitShape shape, BitVector origin, Logic logic) {
        this.shape = Objects.requireNonNull(shape);
        this.origin = Objects.requireNonNull(origin);
        this.logic = Objects.requireNonNull(logic);
        this.current = origin;
    }

    /**
     * 上电后处于 origin 以外的状态，复位后才回到 origin。
     */
    public SimulatedCircuit startingAt(BitVector state) {
        this.current = state;
        return this;
    }

    /**
     * JK 触发器的下一状态：Q' = J·Q' + K'·Q，逐位计算。
     */
    public static BitVector jkNext(BitVector state, boolean[] j, boolean[] k) {
        BitVector next = state;
        for (int i = 0; i < state.getWidth(); i++) {
            boolean q = state.get(i);
            next = next.with(i, (j[i] && !q) || (!k[i] && q));
        }
        return next;
    }

    /**
     * 带使能的两位 JK 计数器：J0 = K0 = E，J1 = K1 = E·Q0；输出进位 Z0 = E·Q0·Q1。
     */
    public static SimulatedCircuit counter() {
        return new SimulatedCircuit(CircuitShape.of(1, 1, 2), BitVector.zero(2), (state, input) -> {
            boolean e = input.get(0);
            boolean q0 = state.get(0);
            boolean q1 = state.get(1);
            boolean[] j = {e, e && q0};
            boolean[] k = {e, e && q0};
            BitVector out = BitVector.fromBits(e && q0 && q1);
            return new DeviceResponse(out, jkNext(state, j, k));
        });
    }

    /**
     * 两输入异或，无触发器。
     */
    public static SimulatedCircuit xor() {
        return new SimulatedCircuit(CircuitShape.of(2, 1, 0), BitVector.EMPTY, (state, input) ->
                new DeviceResponse(BitVector.fromBits(input.get(0) ^ input.get(1)), state));
    }

    @Override
    public CircuitShape shape() {
        return shape;
    }

    @Override
    public DeviceResponse applyInput(BitVector input) {
        DeviceResponse response = logic.step(current, input);
        current = response.getState();
        applied++;
        return response;
    }

    @Override
    public void reset() {
        current = origin;
        resets++;
    }

    @Override
    public BitVector observeState() {
        return current;
    }

    public int getApplied() {
        return applied;
    }

    public int getResets() {
        return resets;
    }
}
