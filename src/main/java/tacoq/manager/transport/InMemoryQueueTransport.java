package tacoq.manager.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.exception.PublishFailureException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local queue transport.
 * Messages survive until acked or until the process exits.
 */
public class InMemoryQueueTransport implements QueueTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueTransport.class);

    private record Message(byte[] body, boolean redelivered) {
    }

    private final Map<String, LinkedBlockingDeque<Message>> queues = new ConcurrentHashMap<>();
    private final Map<Long, Delivery> unacked = new ConcurrentHashMap<>();
    private final AtomicLong nextTag = new AtomicLong(1);
    private volatile boolean closed = false;

    @Override
    public void declareQueue(String queue) {
        if (queues.putIfAbsent(queue, new LinkedBlockingDeque<>()) == null) {
            log.debug("Queue declared: {}", queue);
        }
    }

    @Override
    public void publish(String queue, byte[] body) {
        if (closed) {
            throw new PublishFailureException("Transport is closed, cannot publish to " + queue);
        }
        queueFor(queue).offerLast(new Message(body, false));
    }

    @Override
    public Optional<Delivery> poll(String queue, Duration timeout) throws InterruptedException {
        if (closed) {
            return Optional.empty();
        }
        Message message = queueFor(queue).pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message == null) {
            return Optional.empty();
        }
        Delivery delivery = new Delivery(nextTag.getAndIncrement(), queue, message.body(), message.redelivered());
        unacked.put(delivery.tag(), delivery);
        return Optional.of(delivery);
    }

    @Override
    public boolean ack(long tag) {
        return unacked.remove(tag) != null;
    }

    @Override
    public boolean nack(long tag, boolean requeue) {
        Delivery delivery = unacked.remove(tag);
        if (delivery == null) {
            return false;
        }
        if (requeue) {
            queueFor(delivery.queue()).offerFirst(new Message(delivery.body(), true));
        } else {
            log.warn("Delivery {} from {} rejected without requeue", tag, delivery.queue());
        }
        return true;
    }

    /**
     * Requeue every outstanding delivery, as a broker does when consumers disconnect.
     *
     * @return number of requeued messages
     */
    public int recoverUnacked() {
        int count = 0;
        for (Long tag : unacked.keySet()) {
            if (nack(tag, true)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public int depth(String queue) {
        LinkedBlockingDeque<Message> deque = queues.get(queue);
        return deque == null ? 0 : deque.size();
    }

    public int unackedCount() {
        return unacked.size();
    }

    private LinkedBlockingDeque<Message> queueFor(String queue) {
        return queues.computeIfAbsent(queue, q -> new LinkedBlockingDeque<>());
    }

    @Override
    public void close() {
        closed = true;
        log.info("Queue transport closed ({} unacked deliveries dropped)", unacked.size());
    }
}
