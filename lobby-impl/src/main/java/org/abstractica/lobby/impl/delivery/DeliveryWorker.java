package org.abstractica.lobby.impl.delivery;

import org.abstractica.lobby.MessageSink;
import org.abstractica.lobby.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The single consumer of an {@link Outbox}.
 *
 * <p>Runs on its own daemon thread, hands messages to the sink in enqueue
 * order and stops on the first I/O failure.</p>
 */
public class DeliveryWorker
{
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryWorker.class);

    private final Outbox outbox;
    private final MessageSink sink;
    private final Consumer<IOException> failureHandler;

    private Thread thread;
    private volatile boolean running;

    /**
     * Creates a delivery worker.
     *
     * @param outbox         the outbox to drain
     * @param sink           the network-side writer
     * @param failureHandler called once if the sink fails
     */
    public DeliveryWorker(Outbox outbox, MessageSink sink, Consumer<IOException> failureHandler)
    {
        this.outbox = Objects.requireNonNull(outbox, "outbox");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.running = false;
    }

    /**
     * Starts the delivery thread.
     */
    public synchronized void start()
    {
        if (running)
        {
            return;
        }
        running = true;
        thread = new Thread(this::deliverLoop, "deliver-" + outbox.getOwner());
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stops the delivery thread. Undelivered messages are discarded.
     *
     * <p>Called from the delivery thread itself, for example by the failure
     * handler, it only ends the loop and leaves the interrupt flag clear.</p>
     */
    public synchronized void stop()
    {
        running = false;
        if (thread != null && thread != Thread.currentThread())
        {
            thread.interrupt();
        }
    }

    /**
     * Returns whether the worker is still delivering.
     */
    public boolean isRunning()
    {
        return running;
    }

    private void deliverLoop()
    {
        LOG.debug("Delivery to {} started", outbox.getOwner());

        while (running)
        {
            ServerMessage message;
            try
            {
                message = outbox.take();
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }

            try
            {
                sink.deliver(message);
            }
            catch (IOException e)
            {
                LOG.warn("Delivery to {} failed: {}", outbox.getOwner(), e.getMessage());
                running = false;
                try
                {
                    failureHandler.accept(e);
                }
                catch (RuntimeException e2)
                {
                    LOG.error("Failure handler for {} threw", outbox.getOwner(), e2);
                }
            }
            catch (RuntimeException e)
            {
                LOG.error("Message sink for {} threw on {}",
                        outbox.getOwner(), message.getClass().getSimpleName(), e);
            }
        }

        LOG.debug("Delivery to {} stopped", outbox.getOwner());
    }
}
