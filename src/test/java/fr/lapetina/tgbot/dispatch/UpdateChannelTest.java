package fr.lapetina.tgbot.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.tgbot.integration.StubTelegramApi.textUpdate;
import static org.assertj.core.api.Assertions.assertThat;

class UpdateChannelTest {

    @Test
    @DisplayName("should hold exactly bufferSize plus workerNum updates")
    void shouldHoldExactBound() {
        assertThat(new UpdateChannel(1, 1, "blocking").capacity()).isEqualTo(2);
        assertThat(new UpdateChannel(100, 8, "yielding").capacity()).isEqualTo(108);
        assertThat(new UpdateChannel(4, 4, "sleeping").capacity()).isEqualTo(8);
        assertThat(new UpdateChannel(100, 29, "blocking").remainingCapacity()).isEqualTo(129);
    }

    @Test
    @DisplayName("should block the producer once the bound is reached, even with free ring slots")
    void shouldBlockAtExactBound() throws Exception {
        UpdateChannel channel = new UpdateChannel(2, 1, "blocking");
        CancellationToken token = CancellationToken.create();

        assertThat(channel.publish(textUpdate(1, 5, "a"), token)).isTrue();
        assertThat(channel.publish(textUpdate(2, 5, "b"), token)).isTrue();
        assertThat(channel.publish(textUpdate(3, 5, "c"), token)).isTrue();
        assertThat(channel.remainingCapacity()).isZero();
        assertThat(channel.ringBuffer().remainingCapacity()).isEqualTo(1);

        CompletableFuture<Boolean> fourth = CompletableFuture.supplyAsync(
                () -> channel.publish(textUpdate(4, 5, "d"), token));
        Thread.sleep(100);
        assertThat(fourth).isNotDone();

        token.cancel();
        assertThat(fourth.get(5, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    @DisplayName("should unblock the producer when a handled update is released")
    void shouldUnblockOnRelease() throws Exception {
        UpdateChannel channel = new UpdateChannel(1, 1, "blocking");
        CancellationToken token = CancellationToken.create();

        assertThat(channel.publish(textUpdate(1, 5, "a"), token)).isTrue();
        assertThat(channel.publish(textUpdate(2, 5, "b"), token)).isTrue();
        assertThat(channel.remainingCapacity()).isZero();

        CompletableFuture<Boolean> third = CompletableFuture.supplyAsync(
                () -> channel.publish(textUpdate(3, 5, "c"), token));
        Thread.sleep(100);
        assertThat(third).isNotDone();

        channel.release();

        assertThat(third.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(channel.ringBuffer().get(2).take().updateId()).isEqualTo(3);
        assertThat(channel.remainingCapacity()).isZero();
    }

    @Test
    @DisplayName("should refuse to publish on a cancelled token and keep the permit")
    void shouldRefuseWhenCancelled() {
        UpdateChannel channel = new UpdateChannel(1, 1, "blocking");
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThat(channel.publish(textUpdate(1, 5, "a"), token)).isFalse();
        assertThat(channel.remainingCapacity()).isEqualTo(2);
    }

    @Test
    @DisplayName("should fall back to blocking for an unknown wait strategy")
    void shouldFallBackForUnknownStrategy() {
        UpdateChannel channel = new UpdateChannel(2, 2, "unknown");

        assertThat(channel.capacity()).isEqualTo(4);
    }
}
