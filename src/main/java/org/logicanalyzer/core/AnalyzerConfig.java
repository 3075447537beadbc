package org.logicanalyzer.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 分析器的全部可调参数：探测代价模型、状态编码、无关项处理以及因式分解选项。
 * 通过 {@link Builder} 创建，构造时校验取值范围。
 * 此类是不可变的。
 */
@Getter
public final class AnalyzerConfig {

    /** 一次复位（断电重启）折合的探测次数，即复位边的权重 C */
    private final int resetCost;

    /** 设备是否支持复位；为 false 时路径规划中不存在复位边 */
    private final boolean resetEnabled;

    /** 探测开始前是否先复位一次，使原点状态立即已知 */
    private final boolean resetOnStart;

    private final StateEncoding stateEncoding;

    /** 未测试的 (状态, 输入) 组合是否作为无关项；为 false 时视为 0 */
    private final boolean unobservedAsDontCare;

    /** 因式分解时提取的公共子合取式的最小文字数 */
    private final int minFactorSize;

    /** 是否用 Z3 证明因式分解结果与最简式等价 */
    private final boolean verifyFactoring;

    private AnalyzerConfig(Builder b) {
        if (b.resetCost < 1) {
            throw new IllegalArgumentException("resetCost must be >= 1");
        }
        if (b.minFactorSize < 1) {
            throw new IllegalArgumentException("minFactorSize must be >= 1");
        }
        this.resetCost = b.resetCost;
        this.resetEnabled = b.resetEnabled;
        this.resetOnStart = b.resetOnStart;
        this.stateEncoding = Objects.requireNonNull(b.stateEncoding, "stateEncoding cannot be null.");
        this.unobservedAsDontCare = b.unobservedAsDontCare;
        this.minFactorSize = b.minFactorSize;
        this.verifyFactoring = b.verifyFactoring;
    }

    public static AnalyzerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .resetCost(resetCost)
                .resetEnabled(resetEnabled)
                .resetOnStart(resetOnStart)
                .stateEncoding(stateEncoding)
                .unobservedAsDontCare(unobservedAsDontCare)
                .minFactorSize(minFactorSize)
                .verifyFactoring(verifyFactoring);
    }

    @Override
    public String toString() {
        return "AnalyzerConfig(resetCost=" + resetCost
                + ", resetEnabled=" + resetEnabled
                + ", resetOnStart=" + resetOnStart
                + ", stateEncoding=" + stateEncoding
                + ", unobservedAsDontCare=" + unobservedAsDontCare
                + ", minFactorSize=" + minFactorSize
                + ", verifyFactoring=" + verifyFactoring + ")";
    }

    public static final class Builder {
        private int resetCost = 5;
        private boolean resetEnabled = true;
        private boolean resetOnStart = true;
        private StateEncoding stateEncoding = StateEncoding.OBSERVED;
        private boolean unobservedAsDontCare = true;
        private int minFactorSize = 2;
        private boolean verifyFactoring = false;

        private Builder() {
        }

        public Builder resetCost(int v) { this.resetCost = v; return this; }
        public Builder resetEnabled(boolean v) { this.resetEnabled = v; return this; }
        public Builder resetOnStart(boolean v) { this.resetOnStart = v; return this; }
        public Builder stateEncoding(StateEncoding v) { this.stateEncoding = v; return this; }
        public Builder unobservedAsDontCare(boolean v) { this.unobservedAsDontCare = v; return this; }
        public Builder minFactorSize(int v) { this.minFactorSize = v; return this; }
        public Builder verifyFactoring(boolean v) { this.verifyFactoring = v; return this; }

        public AnalyzerConfig build() {
            return new AnalyzerConfig(this);
        }
    }
}
