package tacoq.manager.transport;

/**
 * A message handed to a consumer and awaiting ack or nack.
 *
 * @param tag         delivery tag, unique per transport instance
 * @param queue       queue the message was taken from
 * @param body        encoded message
 * @param redelivered true if the message was requeued at least once
 */
public record Delivery(long tag, String queue, byte[] body, boolean redelivered) {
}
