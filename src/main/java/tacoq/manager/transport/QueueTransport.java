package tacoq.manager.transport;

import tacoq.manager.exception.PublishFailureException;

import java.time.Duration;
import java.util.Optional;

/**
 * Named-queue message transport between the manager and workers.
 * Delivery is at-least-once: an unacknowledged message may be handed out again.
 */
public interface QueueTransport extends AutoCloseable {

    /** Name of the queue workers publish results to */
    String RESULTS_QUEUE = "results";

    /**
     * Declare a queue. Declaring an existing queue is a no-op.
     */
    void declareQueue(String queue);

    /**
     * Publish a message. The queue is declared on demand.
     *
     * @throws PublishFailureException if the transport cannot accept the message
     */
    void publish(String queue, byte[] body);

    /**
     * Take the next message, waiting up to the given timeout.
     *
     * @return the delivery, or empty on timeout
     */
    Optional<Delivery> poll(String queue, Duration timeout) throws InterruptedException;

    /**
     * Settle a delivery. Unknown or already settled tags return false.
     */
    boolean ack(long tag);

    /**
     * Reject a delivery; with requeue the message goes back to the head of its queue.
     */
    boolean nack(long tag, boolean requeue);

    /** Number of ready (not yet delivered) messages in a queue */
    int depth(String queue);

    @Override
    void close();
}
