package org.kleis.verify.config;

import org.kleis.verify.KleisException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KleisConfigTest {

    @Test
    @DisplayName("默认配置 (Defaults)")
    void testDefaults() {
        KleisConfig config = KleisConfig.defaults();

        assertAll("Default values",
                () -> assertEquals(5_000L, config.getZ3TimeoutMs()),
                () -> assertEquals("127.0.0.1", config.getIsabelleHost()),
                () -> assertEquals(0, config.getIsabellePort(), "0 means start a local server"),
                () -> assertEquals("HOL", config.getIsabelleSession()),
                () -> assertEquals("isabelle", config.getIsabelleExecutable()),
                () -> assertEquals("", config.getIsabelleTheoryDir()),
                () -> assertEquals(Duration.ofSeconds(30), config.getIsabelleCommandTimeout()),
                () -> assertEquals(Duration.ofSeconds(120), config.getIsabelleSessionStartTimeout()),
                () -> assertEquals(Duration.ofSeconds(600), config.getIsabelleTheoryTimeout())
        );
    }

    @Test
    @DisplayName("属性覆盖默认值")
    void testOverrides() {
        Properties props = new Properties();
        props.setProperty(KleisConfig.Z3_TIMEOUT_MS, " 250 ");
        props.setProperty(KleisConfig.ISABELLE_PORT, "4711");
        props.setProperty(KleisConfig.ISABELLE_SESSION, "HOL-Analysis");

        KleisConfig config = KleisConfig.of(props);

        assertAll("Overridden values",
                () -> assertEquals(250L, config.getZ3TimeoutMs()),
                () -> assertEquals(4711, config.getIsabellePort()),
                () -> assertEquals("HOL-Analysis", config.getIsabelleSession())
        );
    }

    @Test
    @DisplayName("非法数值应抛出 KleisException")
    void testInvalidValues() {
        Properties notANumber = new Properties();
        notANumber.setProperty(KleisConfig.Z3_TIMEOUT_MS, "fast");
        Properties zeroTimeout = new Properties();
        zeroTimeout.setProperty(KleisConfig.ISABELLE_THEORY_TIMEOUT, "0");
        Properties negative = new Properties();
        negative.setProperty(KleisConfig.ISABELLE_PORT, "-1");

        assertAll("Rejected values",
                () -> assertThrows(KleisException.class, () -> KleisConfig.of(notANumber)),
                () -> assertThrows(KleisException.class, () -> KleisConfig.of(zeroTimeout)),
                () -> assertThrows(KleisException.class, () -> KleisConfig.of(negative))
        );
    }

    @Test
    @DisplayName("类路径资源可以加载")
    void testLoadFromClasspath() {
        KleisConfig config = KleisConfig.load();
        assertTrue(config.getZ3TimeoutMs() > 0);
        assertFalse(config.getIsabelleSession().isBlank());
    }
}
