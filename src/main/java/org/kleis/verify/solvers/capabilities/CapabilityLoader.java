package org.kleis.verify.solvers.capabilities;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * 从类路径上的 JSON 清单加载 {@link SolverCapabilities}。
 */
public final class CapabilityLoader {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityLoader.class);

    public static final String Z3_MANIFEST = "capabilities/z3.json";
    public static final String ISABELLE_MANIFEST = "capabilities/isabelle.json";

    private static final Gson GSON = new Gson();

    private CapabilityLoader() {
    }

    /**
     * @param resourcePath 类路径资源，例如 "capabilities/z3.json"。
     * @throws CapabilityException 资源不存在或格式错误。
     */
    public static SolverCapabilities load(String resourcePath) {
        InputStream in = CapabilityLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new CapabilityException("Capability manifest not found on classpath: " + resourcePath);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            SolverCapabilities caps = parse(reader, resourcePath);
            logger.info("加载能力清单 {}: {}", resourcePath, caps);
            return caps;
        } catch (IOException e) {
            throw new CapabilityException("Failed to read capability manifest " + resourcePath, e);
        }
    }

    public static SolverCapabilities fromJson(String json) {
        return parse(new StringReader(json), "<inline>");
    }

    private static SolverCapabilities parse(Reader reader, String source) {
        SolverCapabilities caps;
        try {
            caps = GSON.fromJson(reader, SolverCapabilities.class);
        } catch (JsonParseException e) {
            throw new CapabilityException("Malformed capability manifest " + source + ": " + e.getMessage(), e);
        }
        if (caps == null) {
            throw new CapabilityException("Empty capability manifest " + source);
        }
        caps.validate(source);
        return caps;
    }
}
