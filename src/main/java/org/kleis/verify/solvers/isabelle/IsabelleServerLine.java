package org.kleis.verify.solvers.isabelle;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.kleis.verify.solvers.SolverException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code isabelle server} 启动后输出的首行，形如
 * {@code server "isabelle" = 127.0.0.1:58865 (password "1c199aff-...")}。
 */
@Getter
public final class IsabelleServerLine {

    private static final Pattern LINE = Pattern.compile(
            "server\\s+\"([^\"]*)\"\\s*=\\s*([^\\s:]+):(\\d+)\\s*\\(password\\s+\"([^\"]*)\"\\)?");

    private final String name;
    private final String host;
    private final int port;
    private final String password;

    private IsabelleServerLine(String name, String host, int port, String password) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.password = password;
    }

    /**
     * @throws SolverException 行格式不符（Kind.PROTOCOL）。
     */
    public static IsabelleServerLine parse(String line) {
        Objects.requireNonNull(line, "IsabelleServerLine-parse: line 不能为 null");
        Matcher m = LINE.matcher(line.trim());
        if (!m.find()) {
            throw new SolverException(SolverException.Kind.PROTOCOL,
                    "Failed to parse Isabelle server line: " + StringUtils.abbreviate(line, 200));
        }
        int port = Integer.parseInt(m.group(3));
        if (port <= 0 || port > 65_535) {
            throw new SolverException(SolverException.Kind.PROTOCOL, "Invalid Isabelle server port: " + port);
        }
        return new IsabelleServerLine(m.group(1), m.group(2), port, m.group(4));
    }

    @Override
    public String toString() {
        return "server \"" + name + "\" = " + host + ":" + port;
    }
}
