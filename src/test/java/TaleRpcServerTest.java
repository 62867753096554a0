import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tale.script.TaleScript;
import com.tale.script.ai.GeneratedCodeService;
import com.tale.script.rpc.TaleRpcServer;
import com.tale.script.sandbox.TaleSettings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TaleRpcServerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final TaleScript engine = new TaleScript(TaleSettings.defaults());

    private TaleRpcServer server() {
        return new TaleRpcServer(0, 1, engine, new GeneratedCodeService(null, engine));
    }

    private ObjectNode call(String json) throws IOException {
        return server().process(om.readTree(json));
    }

    @Test
    void run_returns_output_and_echoes_id() throws IOException {
        ObjectNode resp = call("{\"id\":7,\"method\":\"run\",\"args\":{\"code\":\"ask n\\nsay n * 2\",\"inputs\":[\"21\"]}}");
        assertEquals(7, resp.get("id").asInt());
        assertTrue(resp.get("ok").asBoolean());
        JsonNode result = resp.get("result");
        assertTrue(result.get("ok").asBoolean());
        assertEquals("42\n", result.get("output").asText());
        assertEquals("n = ask(); result = n\nprint(n * 2)\n", result.get("translated").asText());
    }

    @Test
    void run_accepts_an_inputs_box_and_files() throws IOException {
        ObjectNode resp = call("{\"method\":\"run\",\"params\":{"
                + "\"code\":\"ask a\\nask b\\nopen \\\"in.txt\\\" as f\\nsay a, b, read f\","
                + "\"inputs\":\"x\\ny\\n\","
                + "\"files\":{\"in.txt\":\"z\"}}}");
        JsonNode result = resp.get("result");
        assertTrue(result.get("ok").asBoolean(), result.toString());
        assertEquals("x y z\n", result.get("output").asText());
    }

    @Test
    void failed_program_is_still_a_successful_call() throws IOException {
        ObjectNode resp = call("{\"method\":\"run\",\"args\":{\"code\":\"say 1 / 0\"}}");
        assertTrue(resp.get("ok").asBoolean());
        JsonNode result = resp.get("result");
        assertFalse(result.get("ok").asBoolean());
        assertEquals("Line 1: Cannot divide by zero", result.get("error").asText());
        assertEquals(1, result.get("errorLine").asInt());
        assertEquals("RUNTIME", result.get("kind").asText());
    }

    @Test
    void blank_code_is_rejected() throws IOException {
        ObjectNode resp = call("{\"method\":\"run\",\"args\":{\"code\":\"  \"}}");
        assertFalse(resp.get("ok").asBoolean());
        assertEquals("No code provided.", resp.get("error").asText());
    }

    @Test
    void analyze_and_version() throws IOException {
        TaleRpcServer s = server();
        ObjectNode first = s.process(om.readTree("{\"method\":\"analyze\",\"args\":{\"code\":\"x = 1\"}}"));
        JsonNode report = first.get("result");
        assertFalse(report.get("ok").asBoolean());
        assertEquals(1, report.get("diagnostics").get(0).get("line").asInt());
        assertEquals("TRANSFORM", report.get("diagnostics").get(0).get("kind").asText());
        long v = report.get("version").asLong();

        ObjectNode latest = s.process(om.readTree("{\"method\":\"version\",\"args\":{\"version\":" + v + "}}"));
        assertTrue(latest.get("result").get("latest").asBoolean());

        s.process(om.readTree("{\"method\":\"analyze\",\"args\":{\"code\":\"say 1\"}}"));
        ObjectNode stale = s.process(om.readTree("{\"method\":\"version\",\"args\":{\"version\":" + v + "}}"));
        assertFalse(stale.get("result").get("latest").asBoolean());
        assertEquals(v + 1, stale.get("result").get("version").asLong());
    }

    @Test
    void generate_without_a_model_fails_cleanly() throws IOException {
        ObjectNode resp = call("{\"method\":\"generate\",\"args\":{\"prompt\":\"count to ten\"}}");
        assertFalse(resp.get("ok").asBoolean());
        assertEquals("AI not configured", resp.get("error").asText());

        ObjectNode unsafe = call("{\"method\":\"generate\",\"args\":{\"prompt\":\"open a bash shell\"}}");
        assertEquals("Unsafe request", unsafe.get("error").asText());

        ObjectNode blank = call("{\"method\":\"generate\",\"args\":{}}");
        assertEquals("Prompt is required.", blank.get("error").asText());
    }

    @Test
    void ping_and_unknown_method() throws IOException {
        assertEquals("pong", call("{\"method\":\"ping\"}").get("result").asText());
        ObjectNode resp = call("{\"id\":\"a\",\"method\":\"explode\"}");
        assertFalse(resp.get("ok").asBoolean());
        assertEquals("a", resp.get("id").asText());
        assertEquals("Unknown method: explode", resp.get("error").asText());
    }

    @Test
    void frames_round_trip() throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        TaleRpcServer.writeFrame(buf, "{}".getBytes(StandardCharsets.UTF_8));
        TaleRpcServer.writeFrame(buf, new byte[0]);
        byte[] bytes = buf.toByteArray();
        assertEquals(4 + 2 + 4, bytes.length);
        assertEquals(2, bytes[3]);

        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        assertEquals("{}", new String(TaleRpcServer.readFrame(in), StandardCharsets.UTF_8));
        assertEquals(0, TaleRpcServer.readFrame(in).length);
        assertNull(TaleRpcServer.readFrame(in));
    }

    @Test
    void truncated_and_oversized_frames_are_errors() {
        assertThrows(EOFException.class, () -> TaleRpcServer.readFrame(new ByteArrayInputStream(new byte[] {0, 0})));
        assertThrows(EOFException.class,
                () -> TaleRpcServer.readFrame(new ByteArrayInputStream(new byte[] {0, 0, 0, 5, 'a'})));
        assertThrows(IOException.class,
                () -> TaleRpcServer.readFrame(new ByteArrayInputStream(new byte[] {(byte) 0x7f, 0, 0, 0})));
    }

    @Test
    void serves_requests_over_a_socket() throws Exception {
        TaleRpcServer s = server();
        CountDownLatch stopped = new CountDownLatch(1);
        Thread t = new Thread(() -> {
            try {
                s.start();
            } catch (IOException e) {
                throw new RuntimeException(e);
            } finally {
                stopped.countDown();
            }
        }, "tale-rpc-test");
        t.setDaemon(true);
        t.start();

        try {
            long deadline = System.currentTimeMillis() + 5000;
            while (s.localPort() <= 0 && System.currentTimeMillis() < deadline) Thread.sleep(10);
            assertTrue(s.localPort() > 0, "server did not bind");

            try (Socket broken = new Socket("127.0.0.1", s.localPort())) {
                broken.setSoTimeout(10_000);
                DataOutputStream out = new DataOutputStream(broken.getOutputStream());
                out.write(new byte[] {(byte) 0x7f, 0, 0, 0});
                out.flush();
                // an unreadable frame ends the session and frees the worker
                assertEquals(-1, broken.getInputStream().read());
            }

            try (Socket socket = new Socket("127.0.0.1", s.localPort())) {
                socket.setSoTimeout(10_000);
                DataOutputStream out = new DataOutputStream(socket.getOutputStream());
                DataInputStream in = new DataInputStream(socket.getInputStream());

                TaleRpcServer.writeFrame(out, "{\"id\":1,\"method\":\"run\",\"args\":{\"code\":\"say \\\"hi\\\"\"}}"
                        .getBytes(StandardCharsets.UTF_8));
                out.flush();
                JsonNode resp = om.readTree(TaleRpcServer.readFrame(in));
                assertEquals(1, resp.get("id").asInt());
                assertEquals("hi\n", resp.get("result").get("output").asText());

                TaleRpcServer.writeFrame(out, "not json".getBytes(StandardCharsets.UTF_8));
                out.flush();
                JsonNode bad = om.readTree(TaleRpcServer.readFrame(in));
                assertFalse(bad.get("ok").asBoolean());
                assertEquals("Request is not valid JSON", bad.get("error").asText());
            }
        } finally {
            s.close();
        }
        assertTrue(stopped.await(5, TimeUnit.SECONDS));
    }
}
