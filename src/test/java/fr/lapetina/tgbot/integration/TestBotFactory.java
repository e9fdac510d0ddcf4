package fr.lapetina.tgbot.integration;

import fr.lapetina.tgbot.BotFactory;
import fr.lapetina.tgbot.dispatch.DispatcherConfig;

import java.util.function.Consumer;

/**
 * Test extension of BotFactory wired to a {@link StubTelegramApi}.
 */
public final class TestBotFactory extends BotFactory {

    private final StubTelegramApi stubApi;

    private TestBotFactory(String configPath, StubTelegramApi stubApi, Consumer<DispatcherConfig.Builder> customizer) {
        super(configPath, stubApi, customizer);
        this.stubApi = stubApi;
    }

    /**
     * Creates a test factory from the default test configuration. Not started.
     */
    public static TestBotFactory create() {
        return create((Consumer<DispatcherConfig.Builder>) null);
    }

    public static TestBotFactory create(Consumer<DispatcherConfig.Builder> customizer) {
        return new TestBotFactory("test-config.yaml", new StubTelegramApi(), customizer);
    }

    public StubTelegramApi stub() {
        return stubApi;
    }
}
