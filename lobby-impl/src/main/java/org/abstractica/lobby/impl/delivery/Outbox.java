package org.abstractica.lobby.impl.delivery;

import org.abstractica.lobby.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of messages waiting to be sent to one client.
 *
 * <p>Any thread may enqueue; exactly one consumer drains. When the outbox
 * is full, new messages are dropped rather than blocking the producer, so
 * a slow or dead peer cannot stall the coordinator.</p>
 */
public class Outbox
{
    private static final Logger LOG = LoggerFactory.getLogger(Outbox.class);

    /**
     * Default maximum number of undelivered messages.
     */
    public static final int DEFAULT_CAPACITY = 256;

    private final String owner;
    private final int capacity;
    private final BlockingQueue<ServerMessage> queue;
    private final AtomicLong dropped;
    private final Runnable dropListener;

    /**
     * Creates an outbox with default capacity.
     *
     * @param owner the player the messages are addressed to
     */
    public Outbox(String owner)
    {
        this(owner, DEFAULT_CAPACITY, () -> {});
    }

    /**
     * Creates an outbox.
     *
     * @param owner        the player the messages are addressed to
     * @param capacity     maximum number of undelivered messages
     * @param dropListener invoked once for every dropped message
     */
    public Outbox(String owner, int capacity, Runnable dropListener)
    {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.dropListener = Objects.requireNonNull(dropListener, "dropListener");
        if (capacity <= 0)
        {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.dropped = new AtomicLong(0);
    }

    /**
     * Enqueues a message without blocking.
     *
     * @param message the message
     * @return true if queued, false if the outbox was full and the message dropped
     */
    public boolean offer(ServerMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!queue.offer(message))
        {
            dropped.incrementAndGet();
            dropListener.run();
            LOG.warn("Outbox of {} full, dropping {}", owner, message.getClass().getSimpleName());
            return false;
        }
        return true;
    }

    /**
     * Removes the oldest message, waiting until one is available.
     *
     * @return the next message
     * @throws InterruptedException if interrupted while waiting
     */
    public ServerMessage take() throws InterruptedException
    {
        return queue.take();
    }

    /**
     * Removes the oldest message, waiting up to the given time.
     *
     * @param timeout maximum wait
     * @return the next message, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public ServerMessage poll(Duration timeout) throws InterruptedException
    {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Returns the number of queued messages.
     */
    public int size()
    {
        return queue.size();
    }

    /**
     * Returns whether nothing is queued.
     */
    public boolean isEmpty()
    {
        return queue.isEmpty();
    }

    /**
     * Returns the maximum number of queued messages.
     */
    public int getCapacity()
    {
        return capacity;
    }

    /**
     * Returns how many messages this outbox has dropped.
     */
    public long getDroppedCount()
    {
        return dropped.get();
    }

    /**
     * Returns the player this outbox belongs to.
     */
    public String getOwner()
    {
        return owner;
    }
}
