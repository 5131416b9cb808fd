package org.kleis.verify.config;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.kleis.verify.KleisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * 验证核心的运行配置。先读取类路径上的 {@code kleis.properties}，再用同名系统属性覆盖。
 * 加载后不可变。
 * @author Ayalyt
 */
@Getter
public final class KleisConfig {

    private static final Logger logger = LoggerFactory.getLogger(KleisConfig.class);

    public static final String RESOURCE = "kleis.properties";

    public static final String Z3_TIMEOUT_MS = "kleis.z3.timeoutMs";
    public static final String ISABELLE_HOST = "kleis.isabelle.host";
    public static final String ISABELLE_PORT = "kleis.isabelle.port";
    public static final String ISABELLE_SESSION = "kleis.isabelle.session";
    public static final String ISABELLE_EXECUTABLE = "kleis.isabelle.executable";
    public static final String ISABELLE_THEORY_DIR = "kleis.isabelle.theoryDir";
    public static final String ISABELLE_COMMAND_TIMEOUT = "kleis.isabelle.commandTimeoutSeconds";
    public static final String ISABELLE_SESSION_START_TIMEOUT = "kleis.isabelle.sessionStartTimeoutSeconds";
    public static final String ISABELLE_THEORY_TIMEOUT = "kleis.isabelle.theoryTimeoutSeconds";

    private final long z3TimeoutMs;
    private final String isabelleHost;
    // 0 表示自动启动本地服务器并从其首行读取端口
    private final int isabellePort;
    private final String isabelleSession;
    private final String isabelleExecutable;
    // 为空时使用系统临时目录
    private final String isabelleTheoryDir;
    private final Duration isabelleCommandTimeout;
    private final Duration isabelleSessionStartTimeout;
    private final Duration isabelleTheoryTimeout;

    private KleisConfig(Properties props) {
        this.z3TimeoutMs = positiveLong(props, Z3_TIMEOUT_MS, 5_000L);
        this.isabelleHost = props.getProperty(ISABELLE_HOST, "127.0.0.1").trim();
        this.isabellePort = (int) nonNegativeLong(props, ISABELLE_PORT, 0L);
        this.isabelleSession = props.getProperty(ISABELLE_SESSION, "HOL").trim();
        this.isabelleExecutable = props.getProperty(ISABELLE_EXECUTABLE, "isabelle").trim();
        this.isabelleTheoryDir = StringUtils.trimToEmpty(props.getProperty(ISABELLE_THEORY_DIR));
        this.isabelleCommandTimeout = Duration.ofSeconds(positiveLong(props, ISABELLE_COMMAND_TIMEOUT, 30L));
        this.isabelleSessionStartTimeout = Duration.ofSeconds(positiveLong(props, ISABELLE_SESSION_START_TIMEOUT, 120L));
        this.isabelleTheoryTimeout = Duration.ofSeconds(positiveLong(props, ISABELLE_THEORY_TIMEOUT, 600L));
    }

    /**
     * 读取类路径资源与系统属性。资源缺失时使用默认值。
     */
    public static KleisConfig load() {
        Properties props = new Properties();
        try (InputStream in = KleisConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.info("类路径上没有 {}，使用默认配置", RESOURCE);
            } else {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new KleisException("Failed to read " + RESOURCE + ": " + e.getMessage(), e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("kleis.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        KleisConfig config = new KleisConfig(props);
        logger.debug("加载配置: {}", config);
        return config;
    }

    /**
     * 只用给定属性构造（未给出的键取默认值），不读取资源和系统属性。
     */
    public static KleisConfig of(Properties props) {
        Objects.requireNonNull(props, "KleisConfig-of: props 不能为 null");
        return new KleisConfig(props);
    }

    public static KleisConfig defaults() {
        return new KleisConfig(new Properties());
    }

    private static long positiveLong(Properties props, String key, long fallback) {
        long value = nonNegativeLong(props, key, fallback);
        if (value == 0) {
            throw new KleisException("Configuration '" + key + "' must be positive");
        }
        return value;
    }

    private static long nonNegativeLong(Properties props, String key, long fallback) {
        String raw = StringUtils.trimToNull(props.getProperty(key));
        if (raw == null) {
            return fallback;
        }
        if (!NumberUtils.isDigits(raw)) {
            throw new KleisException("Configuration '" + key + "' is not a non-negative integer: " + raw);
        }
        return Long.parseLong(raw);
    }

    @Override
    public String toString() {
        return "KleisConfig{z3TimeoutMs=" + z3TimeoutMs
                + ", isabelle=" + isabelleHost + ":" + isabellePort
                + ", session=" + isabelleSession
                + ", timeouts=" + isabelleCommandTimeout.getSeconds() + "/" + isabelleSessionStartTimeout.getSeconds()
                + "/" + isabelleTheoryTimeout.getSeconds() + "s}";
    }
}
