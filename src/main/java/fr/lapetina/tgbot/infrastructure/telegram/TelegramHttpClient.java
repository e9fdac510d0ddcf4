package fr.lapetina.tgbot.infrastructure.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.tgbot.dispatch.CancellationToken;
import fr.lapetina.tgbot.domain.model.BotCommand;
import fr.lapetina.tgbot.domain.model.GetUpdatesRequest;
import fr.lapetina.tgbot.domain.model.Message;
import fr.lapetina.tgbot.domain.model.SendMessage;
import fr.lapetina.tgbot.domain.model.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Bot API client over {@code java.net.http.HttpClient}.
 *
 * All methods are POSTs with a JSON body to {@code <apiUrl>/bot<token>/<method>}.
 * The in-flight request future is cancelled when the caller's token fires, which unblocks
 * a pending long poll immediately on shutdown.
 */
public class TelegramHttpClient implements TelegramApi, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelegramHttpClient.class);

    public static final String DEFAULT_API_URL = "https://api.telegram.org";

    // Added to the long-poll timeout so the server answers before the client gives up
    private static final Duration POLL_GRACE = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    public TelegramHttpClient(
            String apiUrl,
            String botToken,
            HttpClient httpClient,
            Duration requestTimeout
    ) {
        Objects.requireNonNull(botToken, "Bot token is required");
        if (botToken.isBlank()) {
            throw new IllegalArgumentException("Bot token must not be blank");
        }
        String root = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
        if (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        this.baseUrl = root + "/bot" + botToken + "/";
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient is required");
        this.requestTimeout = requestTimeout;

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public TelegramHttpClient(String apiUrl, String botToken, Duration connectTimeout, Duration requestTimeout) {
        this(apiUrl, botToken,
                HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                requestTimeout);
    }

    public TelegramHttpClient(String botToken) {
        this(DEFAULT_API_URL, botToken, Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    @Override
    public List<Update> getUpdates(GetUpdatesRequest request, CancellationToken token) throws TelegramApiException {
        Duration timeout = Duration.ofSeconds(request.timeout()).plus(POLL_GRACE);
        JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, Update.class);
        List<Update> updates = call("getUpdates", request, type, timeout, token);
        log.debug("Updates fetched: offset={}, count={}", request.offset(), updates == null ? 0 : updates.size());
        return updates == null ? List.of() : updates;
    }

    @Override
    public void setMyCommands(List<BotCommand> commands, CancellationToken token) throws TelegramApiException {
        JavaType type = objectMapper.getTypeFactory().constructType(Boolean.class);
        call("setMyCommands", Map.of("commands", commands), type, requestTimeout, token);
        log.info("Bot commands registered: count={}", commands.size());
    }

    @Override
    public Message send(SendMessage message, CancellationToken token) throws TelegramApiException {
        JavaType type = objectMapper.getTypeFactory().constructType(Message.class);
        Message sent = call("sendMessage", message, type, requestTimeout, token);
        log.debug("Message sent: chatId={}, messageId={}", message.chatId(), sent != null ? sent.messageId() : null);
        return sent;
    }

    private <T> T call(
            String method,
            Object body,
            JavaType resultType,
            Duration timeout,
            CancellationToken token
    ) throws TelegramApiException {
        if (token.isCancelled()) {
            throw TelegramApiException.cancelled(method, null);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + method))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(writeBody(method, body)))
                .build();

        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());

        HttpResponse<String> response;
        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            response = future.get();
        } catch (CancellationException e) {
            throw TelegramApiException.cancelled(method, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw TelegramApiException.cancelled(method, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (token.isCancelled()) {
                throw TelegramApiException.cancelled(method, cause);
            }
            throw new TelegramApiException(method + " failed: " + cause.getClass().getSimpleName()
                    + ": " + cause.getMessage(), cause);
        }

        return readResult(method, response, resultType);
    }

    private String writeBody(String method, Object body) throws TelegramApiException {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TelegramApiException("Failed to encode " + method + " request", e);
        }
    }

    private <T> T readResult(String method, HttpResponse<String> response, JavaType resultType)
            throws TelegramApiException {
        ApiResponse envelope;
        try {
            envelope = objectMapper.readValue(response.body(), ApiResponse.class);
        } catch (JsonProcessingException e) {
            throw new TelegramApiException(method + " returned an unreadable body, status "
                    + response.statusCode(), e);
        }

        if (!envelope.ok() || response.statusCode() >= 400) {
            int code = envelope.errorCode() != null ? envelope.errorCode() : response.statusCode();
            String description = envelope.description() != null ? envelope.description() : "HTTP " + response.statusCode();
            log.warn("Bot API call failed: method={}, status={}, errorCode={}, description={}",
                    method, response.statusCode(), code, description);
            throw new TelegramApiException(method + " failed: " + description, code);
        }

        return objectMapper.convertValue(envelope.result(), resultType);
    }

    @Override
    public void close() {
        // HttpClient holds no resources that need explicit release on JDK 17
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ApiResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("result") Object result,
            @JsonProperty("error_code") Integer errorCode,
            @JsonProperty("description") String description
    ) {
    }
}
