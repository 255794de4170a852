package org.tweann.runtime;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Base class for the actors of a network.
 * <p>
 * Each actor owns a mailbox and runs on its own thread, taking one message at a time and handing
 * it to {@link #handle(Message)}. Actor state is confined to that thread; other actors interact
 * with it only through {@link #send(Message)}.
 * <p>
 * An exception escaping {@link #handle(Message)} fails the whole network; an interrupt stops the
 * actor silently, since it is how a failed or aborted network tears its actors down.
 */
public abstract class AbstractActor implements Runnable {

    private final String id;
    private final Network network;
    private final BlockingQueue<Message> mailbox = new LinkedBlockingQueue<>();

    protected AbstractActor(String id, Network network) {
        this.id = id;
        this.network = network;
    }

    public String getId() {
        return id;
    }

    /**
     * Enqueues a message. Never blocks.
     */
    void send(Message message) {
        mailbox.add(message);
    }

    /**
     * Sends the same message to every actor in the list.
     */
    static void broadcast(List<? extends AbstractActor> targets, Message message) {
        for (AbstractActor target : targets) {
            target.send(message);
        }
    }

    @Override
    public final void run() {
        try {
            boolean running = true;
            while (running) {
                running = handle(mailbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            network.fail(id, e);
        }
    }

    /**
     * Processes one message.
     *
     * @param message The next message in the mailbox.
     * @return {@code false} to stop the actor.
     */
    protected abstract boolean handle(Message message);

    protected IllegalStateException unexpected(Message message) {
        return new IllegalStateException(getClass().getSimpleName() + " '" + id + "' received unexpected " + message);
    }
}
