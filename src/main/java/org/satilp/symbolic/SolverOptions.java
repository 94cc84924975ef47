package org.satilp.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Properties;

/**
 * 求解相关的配置。此类是不可变的，with* 方法返回新实例。
 */
@Getter
public final class SolverOptions {

    private static final Logger logger = LoggerFactory.getLogger(SolverOptions.class);

    public static final String TIMEOUT_MILLIS_KEY = "satilp.solver.timeout-millis";
    public static final String VERIFY_RESULT_KEY = "satilp.solver.verify-result";
    public static final String EXHAUSTIVE_LIMIT_KEY = "satilp.solver.exhaustive-variable-limit";

    public static final int DEFAULT_EXHAUSTIVE_VARIABLE_LIMIT = 24;

    /** Z3 求解超时，0 表示不限制 */
    private final int timeoutMillis;

    /** 是否用求值器验证解码得到的赋值 */
    private final boolean verifyResult;

    /** 穷举后端允许的最大变量数 */
    private final int exhaustiveVariableLimit;

    private SolverOptions(int timeoutMillis, boolean verifyResult, int exhaustiveVariableLimit) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis 不能为负数: " + timeoutMillis);
        }
        if (exhaustiveVariableLimit < 0 || exhaustiveVariableLimit > 62) {
            throw new IllegalArgumentException("exhaustiveVariableLimit 必须在 [0, 62] 内: " + exhaustiveVariableLimit);
        }
        this.timeoutMillis = timeoutMillis;
        this.verifyResult = verifyResult;
        this.exhaustiveVariableLimit = exhaustiveVariableLimit;
    }

    public static SolverOptions defaults() {
        return new SolverOptions(0, true, DEFAULT_EXHAUSTIVE_VARIABLE_LIMIT);
    }

    /**
     * 从 Properties 读取配置，缺失的键使用默认值。
     * @param properties 配置来源，例如 System.getProperties()。
     * @return SolverOptions 实例。
     * @throws IllegalArgumentException 如果某个值无法解析。
     */
    public static SolverOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null");
        SolverOptions defaults = defaults();
        int timeout = parseInt(properties, TIMEOUT_MILLIS_KEY, defaults.timeoutMillis);
        boolean verify = Boolean.parseBoolean(
                properties.getProperty(VERIFY_RESULT_KEY, Boolean.toString(defaults.verifyResult)).trim());
        int limit = parseInt(properties, EXHAUSTIVE_LIMIT_KEY, defaults.exhaustiveVariableLimit);
        SolverOptions options = new SolverOptions(timeout, verify, limit);
        logger.debug("从 Properties 读取求解配置: {}", options);
        return options;
    }

    private static int parseInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.error("配置项 {} 的值 '{}' 不是整数", key, raw);
            throw new IllegalArgumentException("配置项 " + key + " 的值不是整数: " + raw, e);
        }
    }

    public SolverOptions withTimeoutMillis(int timeoutMillis) {
        return new SolverOptions(timeoutMillis, verifyResult, exhaustiveVariableLimit);
    }

    public SolverOptions withVerifyResult(boolean verifyResult) {
        return new SolverOptions(timeoutMillis, verifyResult, exhaustiveVariableLimit);
    }

    public SolverOptions withExhaustiveVariableLimit(int exhaustiveVariableLimit) {
        return new SolverOptions(timeoutMillis, verifyResult, exhaustiveVariableLimit);
    }

    @Override
    public String toString() {
        return "SolverOptions{timeoutMillis=" + timeoutMillis
                + ", verifyResult=" + verifyResult
                + ", exhaustiveVariableLimit=" + exhaustiveVariableLimit + "}";
    }
}
