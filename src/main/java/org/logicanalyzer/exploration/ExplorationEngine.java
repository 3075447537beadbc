package org.logicanalyzer.exploration;

import lombok.Getter;
import org.logicanalyzer.automata.base.State;
import org.logicanalyzer.core.AnalyzerConfig;
import org.logicanalyzer.core.BitVector;
import org.logicanalyzer.table.ConsistencyException;
import org.logicanalyzer.table.TruthTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 主动探测被测电路，直到每个可达的 (状态, 输入) 组合都被测试过。
 * <p>
 * 引擎在 WALK、PATHFIND、DONE 三个阶段之间切换：
 * WALK 在当前状态上施加最小的未测试输入并跟随电路前进；
 * 当前状态的输入全部测试完后进入 PATHFIND，由 {@link PathPlanner} 选出代价最小的目标，
 * 执行路径（必要时复位）并施加目标处的未测试输入，然后回到 WALK；
 * 规划不到任何目标时进入 DONE。
 * <p>
 * 单线程、同步执行；对设备的每次调用都是阻塞的。
 */
public final class ExplorationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExplorationEngine.class);

    private final CircuitDevice device;
    private final AnalyzerConfig config;
    private final PathPlanner planner;

    @Getter
    private final TruthTableStore store;
    @Getter
    private ExplorationPhase phase = ExplorationPhase.WALK;

    private State live;
    private State origin;
    private int probes;
    private int resets;
    private ExplorationReport report;
    private ConsistencyException failure;

    public ExplorationEngine(CircuitDevice device, AnalyzerConfig config) {
        this.device = Objects.requireNonNull(device, "Device cannot be null.");
        this.config = Objects.requireNonNull(config, "Config cannot be null.");
        this.planner = new PathPlanner(config.getResetCost(), config.isResetEnabled());
        this.store = new TruthTableStore(device.shape());
    }

    /**
     * 运行探测直到 DONE。
     * @return 填充完毕的真值表。
     * @throws ConsistencyException 设备表现出非确定性时。
     * @throws IllegalStateException 之前的一次探测已因 ConsistencyException 中止时；中止的探测不能继续。
     */
    public TruthTableStore explore() {
        if (failure != null) {
            throw new IllegalStateException("探测已因设备不一致而中止: " + failure.getMessage(), failure);
        }
        if (report != null) {
            return store;
        }
        try {
            run();
        } catch (ConsistencyException e) {
            failure = e;
            throw e;
        }
        return store;
    }

    private void run() {
        logger.info("开始探测 {}，配置: {}", device.shape(), config);

        if (config.isResetOnStart() && config.isResetEnabled()) {
            device.reset();
            resets++;
            origin = store.discover(device.observeState());
            store.getGraph().markOrigin(origin);
            live = origin;
            logger.info("初始复位完成，原点状态为 {}", origin);
        } else {
            live = store.discover(device.observeState());
            if (!config.isResetEnabled()) {
                store.getGraph().markOrigin(live);
            }
            logger.info("从当前状态 {} 开始探测，原点状态未知。", live);
        }

        while (phase != ExplorationPhase.DONE) {
            switch (phase) {
                case WALK -> walk();
                case PATHFIND -> pathfind();
                default -> throw new IllegalStateException("未知阶段: " + phase);
            }
        }

        List<State> unreachable = store.statesWithUntestedInputs();
        if (!unreachable.isEmpty()) {
            logger.warn("探测结束，但以下状态仍有未测试输入且不可达，覆盖不完整: {}", unreachable);
        }
        report = new ExplorationReport(probes, resets, config.getResetCost(),
                store.stateCount(), store.testedCount(), unreachable);
        logger.info("探测完成: {}", report);
    }

    /**
     * 探测结束后的统计结果。
     */
    public ExplorationReport getReport() {
        if (report == null) {
            throw new IllegalStateException("探测尚未完成。");
        }
        return report;
    }

    private void walk() {
        Optional<BitVector> next = store.firstUntestedInput(live);
        if (next.isPresent()) {
            live = probe(live, next.get());
        } else {
            logger.debug("状态 {} 的输入已全部测试，进入 PATHFIND。", live);
            phase = ExplorationPhase.PATHFIND;
        }
    }

    private void pathfind() {
        Optional<ProbePlan> plan = planner.plan(store, live, origin);
        if (plan.isPresent()) {
            execute(plan.get());
            live = probe(live, plan.get().getUntestedInput());
            phase = ExplorationPhase.WALK;
            return;
        }
        if (origin == null && config.isResetEnabled()) {
            logger.info("当前可达范围已穷尽，复位以确定原点状态。");
            reset();
            phase = ExplorationPhase.WALK;
            return;
        }
        phase = ExplorationPhase.DONE;
    }

    private void execute(ProbePlan plan) {
        for (ProbePlan.Step step : plan.getSteps()) {
            if (step.isReset()) {
                reset();
            } else {
                live = probe(live, step.getInput());
            }
            if (!live.equals(step.getExpected())) {
                // 已记录的迁移在 record 中校验，这里只可能是复位落点与原点不符
                logger.error("执行路径时到达 {}，预期为 {}", live, step.getExpected());
                throw new ConsistencyException("执行路径时到达 " + live + "，预期为 " + step.getExpected());
            }
        }
        if (!live.equals(plan.getTarget())) {
            throw new IllegalStateException("路径执行结束于 " + live + "，目标为 " + plan.getTarget());
        }
    }

    private void reset() {
        device.reset();
        resets++;
        State landed = store.discover(device.observeState());
        if (origin == null) {
            origin = landed;
            store.getGraph().markOrigin(origin);
            logger.info("复位后确定原点状态为 {}", origin);
        } else if (!landed.equals(origin)) {
            logger.error("复位后到达 {}，与原点状态 {} 不一致", landed, origin);
            throw new ConsistencyException("复位后到达 " + landed + "，与原点状态 " + origin + " 不一致");
        }
        live = landed;
        logger.debug("复位完成，当前状态 {}", live);
    }

    private State probe(State from, BitVector input) {
        DeviceResponse response = device.applyInput(input);
        probes++;
        State next = store.discover(response.getState());
        store.record(from, input, response.getOutputs(), next);
        logger.debug("探测 {} + {} -> {} / {}", from, input, next, response.getOutputs());
        return next;
    }
}
