package fr.lapetina.tgbot.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the bot.
 * Designed to be populated from YAML.
 */
public class BotConfig {

    private TelegramConfig telegram = new TelegramConfig();
    private DispatcherSection dispatcher = new DispatcherSection();
    private AdminConfig admin = new AdminConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public TelegramConfig getTelegram() { return telegram; }
    public void setTelegram(TelegramConfig telegram) { this.telegram = telegram; }

    public DispatcherSection getDispatcher() { return dispatcher; }
    public void setDispatcher(DispatcherSection dispatcher) { this.dispatcher = dispatcher; }

    public AdminConfig getAdmin() { return admin; }
    public void setAdmin(AdminConfig admin) { this.admin = admin; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Bot API connection settings.
     */
    public static class TelegramConfig {
        private String token = "";
        private String apiUrl = "https://api.telegram.org";
        private long connectTimeoutMs = 5_000;
        private long requestTimeoutMs = 30_000;

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Polling and worker settings. Zero for {@code workerNum}, {@code bufferSize} and
     * {@code timeoutMs} means "use the default".
     */
    public static class DispatcherSection {
        private long timeoutMs = 0;
        private int pollTimeoutSeconds = 50;
        private int workerNum = 0;
        private boolean autoSetupCommands = true;
        private int bufferSize = 0;
        private int limit = 100;
        private List<String> allowedUpdates = new ArrayList<>();
        private long fetchRetryDelayMs = 3_000;
        private String waitStrategy = "blocking";

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getPollTimeoutSeconds() { return pollTimeoutSeconds; }
        public void setPollTimeoutSeconds(int pollTimeoutSeconds) { this.pollTimeoutSeconds = pollTimeoutSeconds; }

        public int getWorkerNum() { return workerNum; }
        public void setWorkerNum(int workerNum) { this.workerNum = workerNum; }

        public boolean isAutoSetupCommands() { return autoSetupCommands; }
        public void setAutoSetupCommands(boolean autoSetupCommands) { this.autoSetupCommands = autoSetupCommands; }

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }

        public List<String> getAllowedUpdates() { return allowedUpdates; }
        public void setAllowedUpdates(List<String> allowedUpdates) { this.allowedUpdates = allowedUpdates; }

        public long getFetchRetryDelayMs() { return fetchRetryDelayMs; }
        public void setFetchRetryDelayMs(long fetchRetryDelayMs) { this.fetchRetryDelayMs = fetchRetryDelayMs; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Admin HTTP endpoint configuration.
     */
    public static class AdminConfig {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 8081;
        private int backlog = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "tgbot";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
