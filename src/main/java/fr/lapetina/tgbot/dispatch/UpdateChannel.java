package fr.lapetina.tgbot.dispatch;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.Util;
import fr.lapetina.tgbot.domain.event.UpdateEvent;
import fr.lapetina.tgbot.domain.event.UpdateEventFactory;
import fr.lapetina.tgbot.domain.model.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO between the poller and the workers, backed by a Disruptor ring buffer.
 *
 * SINGLE PRODUCER: only the poller thread publishes, so the cheaper single-producer
 * sequencer is used. A single consumer drains the ring in order and hands each update to
 * an idle worker, which frees the slot at once.
 *
 * CAPACITY: an update holds one of {@code bufferSize + workerNum} permits from publish until
 * its handler has finished ({@link #release()}), so queued plus in-flight updates never
 * exceed that bound. The ring itself is the next power of two above it and never fills.
 *
 * BACKPRESSURE: publishing without a free permit blocks the poller until a handler finishes
 * or the token is cancelled. Nothing is ever dropped on a full channel.
 */
public final class UpdateChannel {

    private static final Logger log = LoggerFactory.getLogger(UpdateChannel.class);

    private static final long PERMIT_WAIT_MILLIS = 1;

    private final Disruptor<UpdateEvent> disruptor;
    private final RingBuffer<UpdateEvent> ringBuffer;
    private final Semaphore permits;
    private final int capacity;

    public UpdateChannel(int bufferSize, int workerNum, String waitStrategy) {
        this.capacity = bufferSize + workerNum;
        this.permits = new Semaphore(capacity);
        int ringSize = Util.ceilingNextPowerOfTwo(capacity);
        this.disruptor = new Disruptor<>(
                new UpdateEventFactory(),
                ringSize,
                new DispatcherThreadFactory("update-distributor", false),
                ProducerType.SINGLE,
                createWaitStrategy(waitStrategy));
        this.ringBuffer = disruptor.getRingBuffer();
        log.debug("UpdateChannel created: bufferSize={}, workerNum={}, capacity={}, ringSize={}, waitStrategy={}",
                bufferSize, workerNum, capacity, ringSize, waitStrategy);
    }

    public UpdateChannel(DispatcherConfig config) {
        this(config.getBufferSize(), config.getWorkerNum(), config.getWaitStrategy());
    }

    /**
     * Starts the consumer thread draining the ring.
     */
    void start(EventHandler<UpdateEvent> consumer, ExceptionHandler<UpdateEvent> exceptionHandler) {
        disruptor.handleEventsWith(consumer);
        disruptor.setDefaultExceptionHandler(exceptionHandler);
        disruptor.start();
    }

    /**
     * Stops the consumer without draining; queued updates are abandoned.
     */
    void halt() {
        disruptor.halt();
    }

    /**
     * Publishes an update, blocking while the channel is full.
     *
     * @return false if the token was cancelled before a permit could be taken
     */
    public boolean publish(Update update, CancellationToken token) {
        try {
            while (!permits.tryAcquire(PERMIT_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled()) {
                    return false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (token.isCancelled()) {
            permits.release();
            return false;
        }

        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initialize(update, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.trace("Update published: updateId={}, sequence={}", update.updateId(), sequence);
        return true;
    }

    /**
     * Gives back the permit of an update that was handled or dropped.
     */
    public void release() {
        permits.release();
    }

    /**
     * Maximum number of queued plus in-flight updates.
     */
    public int capacity() {
        return capacity;
    }

    /**
     * Free permits; updates still being handled count as occupied.
     */
    public long remainingCapacity() {
        return permits.availablePermits();
    }

    RingBuffer<UpdateEvent> ringBuffer() {
        return ringBuffer;
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            case "blocking" -> new BlockingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }
}
