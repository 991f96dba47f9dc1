package tacoq.manager.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.StoreException;
import tacoq.manager.model.ReportOutcome;
import tacoq.manager.service.ResultReconciler;
import tacoq.manager.transport.Delivery;
import tacoq.manager.transport.MessageCodec;
import tacoq.manager.transport.QueueTransport;
import tacoq.manager.transport.ResultMessage;

import java.io.IOException;
import java.util.Optional;

/**
 * Consumes the results queue and hands each report to the reconciler.
 * A delivery is acked only once its outcome is durable; store failures
 * put the message back for another attempt.
 */
public class ResultConsumer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResultConsumer.class);

    private final QueueTransport transport;
    private final ResultReconciler reconciler;
    private final ManagerConfig config;

    private volatile boolean running = false;

    public ResultConsumer(QueueTransport transport, ResultReconciler reconciler, ManagerConfig config) {
        this.transport = transport;
        this.reconciler = reconciler;
        this.config = config;
        transport.declareQueue(QueueTransport.RESULTS_QUEUE);
    }

    @Override
    public void run() {
        running = true;
        log.info("Result consumer started");

        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                processNext();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("Result consumer error", e);
            }
        }

        running = false;
        log.info("Result consumer stopped");
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Take at most one delivery from the results queue and settle it.
     *
     * @return the outcome, or empty if nothing arrived or the delivery was not settled with one
     */
    public Optional<ReportOutcome> processNext() throws InterruptedException {
        Optional<Delivery> next = transport.poll(QueueTransport.RESULTS_QUEUE, config.resultPollTimeout());
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Delivery delivery = next.get();

        ResultMessage message;
        try {
            message = MessageCodec.decodeResult(delivery.body());
        } catch (IOException e) {
            log.error("Dropping undecodable result message (delivery {})", delivery.tag(), e);
            transport.ack(delivery.tag());
            return Optional.empty();
        }

        ReportOutcome outcome;
        try {
            outcome = reconciler.reconcile(message.toReport());
        } catch (IllegalArgumentException e) {
            log.error("Dropping invalid result for task {}: {}", message.taskId(), e.getMessage());
            transport.ack(delivery.tag());
            return Optional.empty();
        } catch (StoreException e) {
            log.error("Store failure while recording result for task {}, requeueing", message.taskId(), e);
            requeue(delivery);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Unexpected failure while recording result for task {}, requeueing", message.taskId(), e);
            requeue(delivery);
            return Optional.empty();
        }

        // every outcome is final for this message, including unknown task IDs
        transport.ack(delivery.tag());
        return Optional.of(outcome);
    }

    private void requeue(Delivery delivery) throws InterruptedException {
        transport.nack(delivery.tag(), true);
        Thread.sleep(config.publishBackoff().toMillis());
    }
}
