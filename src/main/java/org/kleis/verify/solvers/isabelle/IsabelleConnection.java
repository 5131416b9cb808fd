package org.kleis.verify.solvers.isabelle;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import lombok.Getter;
import org.kleis.verify.solvers.SolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * 到 Isabelle 服务器的 TCP 连接：口令认证、命令发送和消息读取。
 * <p>
 * 消息按行传输；较长的消息先发送一行十进制字节数，再发送恰好该长度的消息体。
 * 读取超时时已读到的半行会保留到下一次读取。
 * @author Ayalyt
 */
public class IsabelleConnection implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(IsabelleConnection.class);

    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration READ_TIMEOUT = Duration.ofSeconds(30);

    private static final Gson GSON = new Gson();

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    @Getter
    private JsonObject serverInfo;
    @Getter
    private boolean authenticated = false;

    private IsabelleConnection(Socket socket) throws IOException {
        this.socket = socket;
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    /**
     * 建立连接并认证。
     * @throws SolverException 连接失败（Kind.CONNECTION）或认证被拒绝（Kind.PROTOCOL）。
     */
    public static IsabelleConnection connect(String host, int port, String password) {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) CONNECT_TIMEOUT.toMillis());
            socket.setSoTimeout((int) READ_TIMEOUT.toMillis());
            IsabelleConnection conn = new IsabelleConnection(socket);
            conn.authenticate(password);
            logger.info("已连接 Isabelle 服务器 {}:{}", host, port);
            return conn;
        } catch (IOException e) {
            closeQuietly(socket);
            throw new SolverException(SolverException.Kind.CONNECTION,
                    "Failed to connect to Isabelle server at " + host + ":" + port + ": " + e.getMessage(), e);
        } catch (SolverException e) {
            closeQuietly(socket);
            throw e;
        }
    }

    private void authenticate(String password) throws IOException {
        writeLine(password);
        String reply = readLineBlocking();
        IsabelleMessage message = IsabelleMessage.parse(reply);
        if (message == null) {
            throw new SolverException(SolverException.Kind.PROTOCOL, "Unexpected authentication reply: " + reply);
        }
        switch (message.getKind()) {
            case OK -> {
                serverInfo = message.asObject();
                authenticated = true;
                logger.debug("Isabelle 服务器信息: {}", serverInfo);
            }
            case ERROR -> throw new SolverException(SolverException.Kind.PROTOCOL,
                    "Authentication failed: " + message.text());
            default -> throw new SolverException(SolverException.Kind.PROTOCOL, "Unexpected authentication reply: " + reply);
        }
    }

    /**
     * 发送 {@code <command> <json>} 并读取同步回复（OK、ERROR 或 RUNNING）。
     * 期间到达的其他任务的异步消息会被丢弃。
     */
    public IsabelleMessage sendCommand(String command, JsonObject args) {
        requireAuthenticated();
        String line = args == null ? command : command + " " + GSON.toJson(args);
        logger.debug(">> {}", line);
        try {
            writeLine(line);
            while (true) {
                String frame = readFrame();
                if (frame == null) {
                    throw new IOException("Isabelle server closed the connection");
                }
                IsabelleMessage reply = IsabelleMessage.parse(frame);
                if (reply == null) {
                    continue;
                }
                switch (reply.getKind()) {
                    case OK, ERROR, RUNNING, UNKNOWN -> {
                        logger.debug("<< {}", reply);
                        return reply;
                    }
                    default -> logger.debug("丢弃异步消息: {}", reply);
                }
            }
        } catch (SocketTimeoutException e) {
            throw new SolverException(SolverException.Kind.TIMEOUT,
                    "No reply from Isabelle server to '" + command + "'", e);
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.CONNECTION,
                    "Isabelle connection failed during '" + command + "': " + e.getMessage(), e);
        }
    }

    /**
     * 读取下一条消息，读超时或连接结束时返回 null。用于轮询异步任务。
     */
    public IsabelleMessage readMessage() {
        requireAuthenticated();
        try {
            String frame = readFrame();
            return frame == null ? null : IsabelleMessage.parse(frame);
        } catch (SocketTimeoutException e) {
            return null;
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.CONNECTION,
                    "Isabelle connection failed: " + e.getMessage(), e);
        }
    }

    public void setReadTimeout(Duration timeout) {
        try {
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.CONNECTION, "Failed to set read timeout: " + e.getMessage(), e);
        }
    }

    public boolean isOpen() {
        return !socket.isClosed();
    }

    @Override
    public void close() {
        authenticated = false;
        closeQuietly(socket);
    }

    // --- 底层读写 ---

    private void requireAuthenticated() {
        if (!authenticated) {
            throw new SolverException(SolverException.Kind.CONNECTION, "Not authenticated with Isabelle server");
        }
    }

    private void writeLine(String line) throws IOException {
        out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private String readLineBlocking() throws IOException {
        String line = readLine();
        if (line == null) {
            throw new IOException("Isabelle server closed the connection");
        }
        return line;
    }

    /**
     * 读取一条消息：普通的一行，或长度行加消息体。跳过空行。
     */
    private String readFrame() throws IOException {
        String line = readLine();
        while (line != null && line.isEmpty()) {
            line = readLine();
        }
        if (line != null && !line.isEmpty() && line.chars().allMatch(Character::isDigit)) {
            return readExactly(Integer.parseInt(line));
        }
        return line;
    }

    /**
     * @return 去掉首尾空白的一行；连接结束时返回 null。
     */
    private String readLine() throws IOException {
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                String line = pending.toString(StandardCharsets.UTF_8).trim();
                pending.reset();
                return line;
            }
            pending.write(b);
        }
        if (pending.size() > 0) {
            String line = pending.toString(StandardCharsets.UTF_8).trim();
            pending.reset();
            return line;
        }
        return null;
    }

    private String readExactly(int length) throws IOException {
        byte[] buffer = new byte[length];
        int read = 0;
        while (read < length) {
            int n = in.read(buffer, read, length - read);
            if (n == -1) {
                throw new IOException("Isabelle server closed the connection inside a " + length + "-byte message");
            }
            read += n;
        }
        return new String(buffer, StandardCharsets.UTF_8).trim();
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("关闭套接字失败: {}", e.getMessage());
        }
    }
}
