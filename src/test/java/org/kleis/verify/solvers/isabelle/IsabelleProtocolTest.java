package org.kleis.verify.solvers.isabelle;

import com.google.gson.JsonObject;
import org.kleis.verify.solvers.SolverException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IsabelleProtocolTest {

    @Nested
    @DisplayName("服务器启动行 (Server line)")
    class ServerLineTests {

        @Test
        @DisplayName("解析名字、地址、端口和口令")
        void testParse() {
            IsabelleServerLine line = IsabelleServerLine.parse(
                    "server \"isabelle\" = 127.0.0.1:4711 (password \"b2f1-aa\")");

            assertAll("Server line",
                    () -> assertEquals("isabelle", line.getName()),
                    () -> assertEquals("127.0.0.1", line.getHost()),
                    () -> assertEquals(4711, line.getPort()),
                    () -> assertEquals("b2f1-aa", line.getPassword())
            );
        }

        @Test
        @DisplayName("格式错误或端口越界应报 PROTOCOL")
        void testParse_Invalid() {
            SolverException garbage = assertThrows(SolverException.class,
                    () -> IsabelleServerLine.parse("Isabelle2024: starting"));
            SolverException badPort = assertThrows(SolverException.class,
                    () -> IsabelleServerLine.parse("server \"s\" = localhost:70000 (password \"p\")"));

            assertEquals(SolverException.Kind.PROTOCOL, garbage.getKind());
            assertEquals(SolverException.Kind.PROTOCOL, badPort.getKind());
        }
    }

    @Nested
    @DisplayName("消息解析 (Message parsing)")
    class MessageTests {

        @Test
        @DisplayName("带前缀的 JSON 消息")
        void testParse_Prefixed() {
            IsabelleMessage finished = IsabelleMessage.parse("FINISHED {\"task\":\"t1\",\"ok\":true}");
            IsabelleMessage running = IsabelleMessage.parse("OK {\"task\":\"t2\"}");

            assertAll("Prefixed messages",
                    () -> assertEquals(IsabelleMessage.Kind.FINISHED, finished.getKind()),
                    () -> assertTrue(finished.isObject()),
                    () -> assertEquals("t1", finished.taskId()),
                    () -> assertEquals("t2", running.taskId())
            );
        }

        @Test
        @DisplayName("RUNNING 的消息体是任务编号文本")
        void testParse_RunningPlainText() {
            IsabelleMessage running = IsabelleMessage.parse("RUNNING task-42");
            assertEquals(IsabelleMessage.Kind.RUNNING, running.getKind());
            assertEquals("task-42", running.taskId());
        }

        @Test
        @DisplayName("ERROR 的文本取 message 字段或纯文本")
        void testParse_ErrorText() {
            assertEquals("bad password", IsabelleMessage.parse("ERROR bad password").text());
            assertEquals("no such session",
                    IsabelleMessage.parse("ERROR {\"kind\":\"error\",\"message\":\"no such session\"}").text());
        }

        @Test
        @DisplayName("空行、无前缀 JSON 与无法识别的行")
        void testParse_Edges() {
            assertNull(IsabelleMessage.parse("   "));
            assertEquals(IsabelleMessage.Kind.UNKNOWN, IsabelleMessage.parse("{\"x\":1}").getKind());
            assertNull(IsabelleMessage.parse("{broken"));
            assertEquals("OK", IsabelleMessage.parse("OK").toString());
        }
    }

    @Nested
    @DisplayName("连接 (Connection)")
    class ConnectionTests {

        @Test
        @DisplayName("认证、丢弃异步消息并读取带长度前缀的消息")
        void testConnection_AgainstScriptedServer() throws Exception {
            String longReply = "OK {\"session_id\":\"s-1\",\"tmp_dir\":\"/tmp/isabelle\"}";
            String finished = "FINISHED {\"task\":\"t-9\",\"ok\":true,\"nodes\":[]}";
            List<String> received = Collections.synchronizedList(new ArrayList<>());

            try (ServerSocket server = new ServerSocket(0)) {
                CompletableFuture<Void> script = CompletableFuture.runAsync(() -> {
                    try (Socket client = server.accept()) {
                        BufferedReader reader = new BufferedReader(
                                new InputStreamReader(client.getInputStream(), StandardCharsets.UTF_8));
                        OutputStream out = client.getOutputStream();
                        received.add(reader.readLine());
                        write(out, "OK {\"isabelle_id\":\"test\"}\n");
                        received.add(reader.readLine());
                        write(out, "NOTE {\"message\":\"loading\"}\n");
                        write(out, longReply.getBytes(StandardCharsets.UTF_8).length + "\n" + longReply + "\n");
                        write(out, finished.getBytes(StandardCharsets.UTF_8).length + "\n" + finished + "\n");
                        reader.readLine();
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                });

                try (IsabelleConnection conn = IsabelleConnection.connect("127.0.0.1", server.getLocalPort(), "secret")) {
                    JsonObject args = new JsonObject();
                    args.addProperty("session", "HOL");
                    IsabelleMessage reply = conn.sendCommand("session_start", args);
                    IsabelleMessage async = conn.readMessage();

                    assertAll("Scripted exchange",
                            () -> assertTrue(conn.isAuthenticated()),
                            () -> assertEquals("test", conn.getServerInfo().get("isabelle_id").getAsString()),
                            () -> assertEquals(IsabelleMessage.Kind.OK, reply.getKind()),
                            () -> assertEquals("s-1", reply.getString("session_id")),
                            () -> assertEquals(IsabelleMessage.Kind.FINISHED, async.getKind()),
                            () -> assertEquals("t-9", async.taskId()),
                            () -> assertEquals("secret", received.get(0)),
                            () -> assertEquals("session_start {\"session\":\"HOL\"}", received.get(1))
                    );
                }
                script.get(5, TimeUnit.SECONDS);
            }
        }

        @Test
        @DisplayName("认证被拒绝应报 PROTOCOL")
        void testConnection_AuthenticationRejected() throws Exception {
            try (ServerSocket server = new ServerSocket(0)) {
                CompletableFuture<Void> script = CompletableFuture.runAsync(() -> {
                    try (Socket client = server.accept()) {
                        new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.UTF_8)).readLine();
                        write(client.getOutputStream(), "ERROR Bad password\n");
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                });

                SolverException e = assertThrows(SolverException.class,
                        () -> IsabelleConnection.connect("127.0.0.1", server.getLocalPort(), "wrong"));
                assertEquals(SolverException.Kind.PROTOCOL, e.getKind());
                script.get(5, TimeUnit.SECONDS);
            }
        }

        @Test
        @DisplayName("没有服务器时应报 CONNECTION")
        void testConnection_Refused() throws Exception {
            int port;
            try (ServerSocket free = new ServerSocket(0)) {
                port = free.getLocalPort();
            }
            SolverException e = assertThrows(SolverException.class,
                    () -> IsabelleConnection.connect("127.0.0.1", port, "secret"));
            assertEquals(SolverException.Kind.CONNECTION, e.getKind());
        }
    }

    private static void write(OutputStream out, String text) throws java.io.IOException {
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
