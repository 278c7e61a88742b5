package io.github.drompincen.chatrelay.client;

import io.github.drompincen.chatrelay.protocol.ws.ChatRequest;
import io.github.drompincen.chatrelay.protocol.ws.ChatResponse;
import io.github.drompincen.chatrelay.protocol.ws.EnvelopeCodec;
import io.github.drompincen.chatrelay.protocol.ws.Progress;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionConfig;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionState;
import io.github.drompincen.chatrelay.runtime.connection.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Line-oriented chat against a running gateway.
 *
 * <pre>
 * java ... ChatConsole [ws://localhost:8080/ws] [OPENAI|CLAUDE] [model]
 * </pre>
 *
 * Lines starting with {@code /} are commands: {@code /provider X}, {@code /model X},
 * {@code /status}, {@code /reconnect}, {@code /quit}.
 */
public class ChatConsole implements ChatClientListener {

    private static final Logger log = LoggerFactory.getLogger(ChatConsole.class);

    static final String DEFAULT_URL = "ws://localhost:8080/ws";

    private final PrintStream out;
    private ChatClient client;
    private String provider;
    private String model;

    ChatConsole(PrintStream out, String provider, String model) {
        this.out = out;
        this.provider = provider;
        this.model = model;
    }

    public static void main(String[] args) throws IOException {
        URI uri = URI.create(args.length > 0 ? args[0] : DEFAULT_URL);
        String provider = args.length > 1 ? args[1] : "OPENAI";
        String model = args.length > 2 ? args[2] : "";

        ChatConsole console = new ChatConsole(System.out, provider, model);
        try (ChatClient client = new ChatClient("console-" + UUID.randomUUID(), new WebSocketConnector(uri),
                ConnectionConfig.DEFAULT, new EnvelopeCodec(), console)) {
            console.attach(client);
            log.info("Connecting to {}", uri);
            client.connect();
            console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
    }

    void run(BufferedReader in) throws IOException {
        out.println("Connected as provider " + provider + ". Type /quit to exit.");
        String line;
        while ((line = in.readLine()) != null) {
            if (!handle(line.strip())) {
                return;
            }
        }
    }

    /** Returns false when the console should exit. */
    boolean handle(String line) {
        if (line.isEmpty()) {
            return true;
        }
        if (line.startsWith("/")) {
            return command(line);
        }
        SendResult result = client.send(new ChatRequest(provider, model, line, List.of(), List.of()));
        if (result == SendResult.QUEUED) {
            out.println("[queued, will be sent when the connection is back]");
        } else if (result == SendResult.REJECTED) {
            out.println("[not sent: select a provider with /provider and make sure the client is open]");
        }
        return true;
    }

    private boolean command(String line) {
        String[] parts = line.split("\\s+", 2);
        String arg = parts.length > 1 ? parts[1] : "";
        switch (parts[0]) {
            case "/quit" -> {
                return false;
            }
            case "/provider" -> {
                provider = arg;
                out.println("[provider: " + provider + "]");
            }
            case "/model" -> {
                model = arg;
                out.println("[model: " + (model.isEmpty() ? "default" : model) + "]");
            }
            case "/status" -> out.println("[state: " + client.getState()
                    + ", queued: " + client.connection().getRetryQueue().size() + "]");
            case "/reconnect" -> client.connect();
            default -> out.println("[unknown command " + parts[0] + "]");
        }
        return true;
    }

    @Override
    public void onResponse(ChatResponse response) {
        if (response.isError()) {
            out.println("! " + response.response());
        } else {
            out.println();
            out.println(response.response());
            out.println();
        }
    }

    @Override
    public void onProgress(Progress progress) {
        out.println("[" + progress.percentage() + "%] " + progress.message());
    }

    @Override
    public void onStateChange(ConnectionState from, ConnectionState to) {
        if (to == ConnectionState.RECONNECTING || (to == ConnectionState.CONNECTED && from != ConnectionState.CONNECTING)) {
            out.println("[" + to.name().toLowerCase() + "]");
        }
    }

    @Override
    public void onReloadRequired() {
        out.println("[connection lost for good, type /reconnect to try again]");
    }

    void attach(ChatClient client) {
        this.client = client;
    }
}
