package org.logicanalyzer.table;

import java.util.Optional;

/**
 * 设备违反确定性假设时抛出：同一 (状态, 输入) 两次观测到不同的结果，
 * 或复位后没有回到已知的原点状态。该错误是致命的，探测随即中止。
 */
public class ConsistencyException extends IllegalStateException {

    private final transient TableRow recorded;
    private final transient TableRow observed;

    public ConsistencyException(String message) {
        this(message, null, null);
    }

    /**
     * @param message  描述信息。
     * @param recorded 先前记录的行。
     * @param observed 与之冲突的新观测。
     */
    public ConsistencyException(String message, TableRow recorded, TableRow observed) {
        super(message);
        this.recorded = recorded;
        this.observed = observed;
    }

    public Optional<TableRow> getRecorded() {
        return Optional.ofNullable(recorded);
    }

    public Optional<TableRow> getObserved() {
        return Optional.ofNullable(observed);
    }
}
