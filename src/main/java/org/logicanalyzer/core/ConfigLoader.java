package org.logicanalyzer.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

/**
 * 从 JSON 读取 {@link AnalyzerConfig}。
 * 缺失的键回退到 Builder 默认值并记录警告，未知的键记录警告后忽略。
 */
public final class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    /** 类路径上的默认配置文件 */
    public static final String DEFAULT_RESOURCE = "logic-analyzer.json";

    private static final Set<String> KNOWN_KEYS = Set.of(
            "resetCost", "resetEnabled", "resetOnStart", "stateEncoding",
            "unobservedAsDontCare", "minFactorSize", "verifyFactoring");

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper cannot be null.");
    }

    /**
     * 读取文件系统中的配置文件。
     */
    public AnalyzerConfig load(Path configFile) throws IOException {
        Objects.requireNonNull(configFile, "Config file cannot be null.");
        try (InputStream in = Files.newInputStream(configFile)) {
            return parse(mapper.readTree(in), configFile.toString());
        }
    }

    /**
     * 读取类路径上的 {@value #DEFAULT_RESOURCE}，不存在时直接使用默认值。
     */
    public AnalyzerConfig loadDefault() throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.warn("类路径上没有找到 {}，使用默认配置。", DEFAULT_RESOURCE);
                return AnalyzerConfig.defaults();
            }
            return parse(mapper.readTree(in), DEFAULT_RESOURCE);
        }
    }

    /**
     * 解析 JSON 字符串。
     */
    public AnalyzerConfig parse(String json) throws IOException {
        return parse(mapper.readTree(json), "<string>");
    }

    private AnalyzerConfig parse(JsonNode root, String source) {
        AnalyzerConfig.Builder builder = AnalyzerConfig.builder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            logger.warn("配置 {} 为空，使用默认配置。", source);
            return builder.build();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("配置的根节点必须是 JSON 对象: " + source);
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                logger.warn("配置 {} 中存在未知的键 '{}'，已忽略。", source, name);
            }
        }
        for (String key : KNOWN_KEYS) {
            if (!root.has(key)) {
                logger.warn("配置 {} 缺少 '{}'，使用默认值。", source, key);
            }
        }

        if (root.has("resetCost")) {
            builder.resetCost(requireInt(root, "resetCost"));
        }
        if (root.has("resetEnabled")) {
            builder.resetEnabled(requireBoolean(root, "resetEnabled"));
        }
        if (root.has("resetOnStart")) {
            builder.resetOnStart(requireBoolean(root, "resetOnStart"));
        }
        if (root.has("stateEncoding")) {
            String text = root.get("stateEncoding").asText();
            try {
                builder.stateEncoding(StateEncoding.valueOf(text.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("stateEncoding 的取值无效: " + text, e);
            }
        }
        if (root.has("unobservedAsDontCare")) {
            builder.unobservedAsDontCare(requireBoolean(root, "unobservedAsDontCare"));
        }
        if (root.has("minFactorSize")) {
            builder.minFactorSize(requireInt(root, "minFactorSize"));
        }
        if (root.has("verifyFactoring")) {
            builder.verifyFactoring(requireBoolean(root, "verifyFactoring"));
        }

        AnalyzerConfig config = builder.build();
        logger.info("从 {} 读取配置: {}", source, config);
        return config;
    }

    private static int requireInt(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isInt()) {
            throw new IllegalArgumentException(key + " 必须是整数: " + node);
        }
        return node.intValue();
    }

    private static boolean requireBoolean(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(key + " 必须是布尔值: " + node);
        }
        return node.booleanValue();
    }
}
