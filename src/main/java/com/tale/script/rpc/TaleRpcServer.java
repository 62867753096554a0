package com.tale.script.rpc;

import com.tale.debug.Debug;
import com.tale.script.AnalysisReport;
import com.tale.script.TaleScript;
import com.tale.script.ai.AiServiceException;
import com.tale.script.ai.GeneratedCodeService;
import com.tale.script.ai.UnsafeRequestException;
import com.tale.script.sandbox.ExecutionResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.*;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Minimal framed-JSON RPC server:
 * Frame = uint32_be length + UTF-8 JSON payload
 *
 * Supports:
 *  - {"id":..,"method":"run","args":{"code":"...","inputs":[...],"files":{...}}}
 *  - {"id":..,"method":"analyze","args":{"code":"..."}}
 *  - {"id":..,"method":"generate","args":{"prompt":"..."}}
 *  - {"id":..,"method":"version","args":{"version":N}}
 *  - {"id":..,"method":"ping"}
 *
 * Response: {"id":..,"ok":true,"result":...} or {"id":..,"ok":false,"error":"..."}
 */
public final class TaleRpcServer implements Closeable {

    private static final String TAG = "tale.rpc";
    static final int MAX_FRAME = 32 * 1024 * 1024;

    private final ObjectMapper om = new ObjectMapper();
    private final int port;
    private final ExecutorService pool;
    private volatile boolean running = true;
    private ServerSocket serverSocket;

    private final TaleScript engine;
    private final GeneratedCodeService generator;

    public TaleRpcServer(int port, int threads, TaleScript engine, GeneratedCodeService generator) {
        this.port = port;
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        this.engine = engine;
        this.generator = generator;
    }

    public void start() throws IOException {
        serverSocket = new ServerSocket(port);
        Debug.get().i(TAG, "RPC listening on 127.0.0.1:" + serverSocket.getLocalPort());

        while (running) {
            Socket s;
            try {
                s = serverSocket.accept();
            } catch (IOException e) {
                if (!running) break;
                throw e;
            }
            s.setTcpNoDelay(true);
            pool.execute(() -> handleClient(s));
        }
    }

    /** Port actually bound; differs from the constructor's when that was 0. */
    public int localPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    private void handleClient(Socket s) {
        String peer = String.valueOf(s.getRemoteSocketAddress());

        try (Socket socket = s;
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {
            Debug.get().d(TAG, "client connected: " + peer);

            while (running) {
                byte[] payload = readFrame(in);
                if (payload == null) break; // EOF

                ObjectNode resp;
                try {
                    resp = process(om.readTree(payload));
                } catch (IOException e) {
                    resp = om.createObjectNode();
                    resp.put("ok", false);
                    resp.put("error", "Request is not valid JSON");
                }

                writeFrame(out, om.writeValueAsBytes(resp));
                out.flush();
            }

        } catch (IOException e) {
            Debug.get().w(TAG, "client error " + peer + " : " + e.getMessage());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "client handler failed " + peer, e);
        } finally {
            Debug.get().d(TAG, "client disconnected: " + peer);
        }
    }

    /** Handles one decoded request. Never throws; failures become {@code ok:false}. */
    public ObjectNode process(JsonNode req) {
        ObjectNode resp = om.createObjectNode();
        JsonNode id = req.get("id");
        if (id != null) resp.set("id", id);

        try {
            String method = req.path("method").asText("");

            // Support both "args" and "params"
            JsonNode args = req.has("args") ? req.get("args") : req.get("params");
            if (args == null) args = om.createObjectNode();

            switch (method) {
                case "run": {
                    String code = args.path("code").asText("");
                    if (code.isBlank()) return fail(resp, "No code provided.");
                    ExecutionResult result = engine.run(code, inputs(args.get("inputs")), files(args.get("files")));
                    resp.put("ok", true);
                    resp.set("result", om.valueToTree(result.toMap()));
                    break;
                }

                case "analyze": {
                    AnalysisReport report = engine.analyze(args.path("code").asText(""));
                    resp.put("ok", true);
                    resp.set("result", om.valueToTree(report.toMap()));
                    break;
                }

                case "generate": {
                    String prompt = args.path("prompt").asText("");
                    if (prompt.isBlank()) return fail(resp, "Prompt is required.");
                    try {
                        resp.set("result", om.valueToTree(generator.generate(prompt).toMap()));
                        resp.put("ok", true);
                    } catch (UnsafeRequestException | AiServiceException e) {
                        return fail(resp, e.getMessage());
                    }
                    break;
                }

                case "version": {
                    ObjectNode result = om.createObjectNode();
                    long current = engine.currentVersion();
                    result.put("version", current);
                    if (args.has("version")) result.put("latest", engine.isLatest(args.path("version").asLong(-1)));
                    resp.put("ok", true);
                    resp.set("result", result);
                    break;
                }

                case "ping": {
                    resp.put("ok", true);
                    resp.put("result", "pong");
                    break;
                }

                default: {
                    return fail(resp, "Unknown method: " + method);
                }
            }

        } catch (RuntimeException e) {
            Debug.get().e(TAG, "request failed", e);
            return fail(resp, e.toString());
        }

        return resp;
    }

    private static ObjectNode fail(ObjectNode resp, String error) {
        resp.put("ok", false);
        resp.put("error", error);
        return resp;
    }

    /** Accepts an array of values or one text block with a value per line. */
    private static List<String> inputs(JsonNode node) {
        if (node == null || node.isNull()) return new ArrayList<>();
        if (node.isTextual()) return TaleScript.splitInputs(node.asText());
        List<String> out = new ArrayList<>();
        for (JsonNode n : node) out.add(n.asText());
        return out;
    }

    private static Map<String, String> files(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }

    // -------------------------------
    // Framing helpers
    // -------------------------------

    /** @return the payload, or null on a clean EOF before the header */
    public static byte[] readFrame(InputStream in) throws IOException {
        byte[] lenBuf = in.readNBytes(4);
        if (lenBuf.length == 0) return null;
        if (lenBuf.length < 4) throw new EOFException("partial length header");

        int len = ByteBuffer.wrap(lenBuf).order(ByteOrder.BIG_ENDIAN).getInt();
        if (len < 0 || len > MAX_FRAME) {
            throw new IOException("bad frame length: " + len);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length < len) throw new EOFException("partial frame payload");
        return payload;
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        byte[] lenBuf = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(lenBuf);
        out.write(payload);
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (serverSocket != null) serverSocket.close();
        pool.shutdownNow();
    }

    public static void main(String[] args) throws Exception {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 7777;
        int threads = args.length > 1 ? Integer.parseInt(args[1]) : 4;
        Debug.useSysOut();
        TaleScript engine = new TaleScript();
        try (TaleRpcServer server = new TaleRpcServer(port, threads, engine, new GeneratedCodeService(null, engine))) {
            server.start();
        }
    }
}
