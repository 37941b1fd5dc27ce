package com.questrail.guider.protocol.phd2.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * ScriptedGuiderServer
 * -----------------------------------------------------------------------------
 * Loopback stand-in for the guiding controller, for end-to-end tests over
 * the real Netty transport.
 *
 * <ul>
 *   <li>Sends a {@code Version} greeting and an {@code AppState} event to
 *       every new client.</li>
 *   <li>Answers each request with the scripted result for its method; a
 *       method scripted as {@link #SILENT} gets no answer at all.</li>
 *   <li>Unscripted methods get error {@code -32601}.</li>
 * </ul>
 */
public final class ScriptedGuiderServer implements AutoCloseable {

    /** Marker result: never answer this method. */
    public static final JsonNode SILENT = new ObjectMapper().createObjectNode().put("__silent", true);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ServerSocket serverSocket;
    private final Thread acceptThread;
    private final List<Socket> clients = new CopyOnWriteArrayList<>();
    private final List<JsonNode> received = new CopyOnWriteArrayList<>();
    private final Map<String, Function<JsonNode, JsonNode>> script = new ConcurrentHashMap<>();
    private final AtomicInteger accepted = new AtomicInteger();
    private volatile String version = "2.6.13";
    private volatile boolean greet = true;

    public ScriptedGuiderServer() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        acceptThread = new Thread(this::acceptLoop, "scripted-guider-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public ScriptedGuiderServer respond(String method, JsonNode result) {
        script.put(method, request -> result);
        return this;
    }

    public ScriptedGuiderServer respond(String method, Function<JsonNode, JsonNode> handler) {
        script.put(method, handler);
        return this;
    }

    public ScriptedGuiderServer withVersion(String version) {
        this.version = version;
        return this;
    }

    public ScriptedGuiderServer withoutGreeting() {
        this.greet = false;
        return this;
    }

    /** Send one raw line to every connected client. */
    public void broadcast(String line) {
        for (Socket s : clients) {
            write(s, line);
        }
    }

    /** Close every client connection, keep listening. */
    public void dropClients() {
        for (Socket s : clients) {
            closeQuietly(s);
        }
        clients.clear();
    }

    public List<JsonNode> received() {
        return List.copyOf(received);
    }

    public int acceptedCount() {
        return accepted.get();
    }

    /** Wait until {@code count} connections have been accepted. */
    public void awaitAccepted(int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (accepted.get() < count) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Expected " + count + " connections, got " + accepted.get());
            }
            Thread.sleep(10);
        }
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        dropClients();
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                clients.add(socket);
                accepted.incrementAndGet();
                Thread reader = new Thread(() -> serve(socket), "scripted-guider-client");
                reader.setDaemon(true);
                reader.start();
            } catch (SocketException e) {
                return;
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    private void serve(Socket socket) {
        if (greet) {
            write(socket, "{\"Event\":\"Version\",\"Timestamp\":1.0,\"Host\":\"test\",\"Inst\":1,"
                    + "\"PHDVersion\":\"" + version + "\",\"PHDSubver\":\"\",\"MsgVersion\":1}");
            write(socket, "{\"Event\":\"AppState\",\"Timestamp\":1.0,\"Host\":\"test\",\"Inst\":1,\"State\":\"Stopped\"}");
        }

        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode request = mapper.readTree(line);
                received.add(request);
                answer(socket, request);
            }
        } catch (IOException e) {
            // client went away
        } finally {
            clients.remove(socket);
            closeQuietly(socket);
        }
    }

    private void answer(Socket socket, JsonNode request) {
        String method = request.path("method").asText();
        JsonNode id = request.get("id");
        Function<JsonNode, JsonNode> handler = script.get(method);

        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        if (handler == null) {
            response.putObject("error").put("code", -32601).put("message", "method not found");
        } else {
            JsonNode result = handler.apply(request);
            if (result == SILENT) {
                return;
            }
            response.set("result", result);
        }
        response.set("id", id);
        write(socket, response.toString());
    }

    private static void write(Socket socket, String line) {
        try {
            OutputStream out = socket.getOutputStream();
            synchronized (socket) {
                out.write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException e) {
            closeQuietly(socket);
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException ignored) {
            // test helper
        }
    }
}
