package tacoq.manager.transport;

import tacoq.manager.exception.PublishFailureException;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryQueueTransportTest {

    private InMemoryQueueTransport transport;

    @BeforeEach
    void setUp() {
        transport = new InMemoryQueueTransport();
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    private static byte[] body(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(Delivery d) {
        return new String(d.body(), StandardCharsets.UTF_8);
    }

    @Test
    void deliversInPublishOrder() throws Exception {
        transport.publish("tasks.render", body("a"));
        transport.publish("tasks.render", body("b"));

        assertEquals("a", text(transport.poll("tasks.render", Duration.ZERO).orElseThrow()));
        assertEquals("b", text(transport.poll("tasks.render", Duration.ZERO).orElseThrow()));
        assertTrue(transport.poll("tasks.render", Duration.ZERO).isEmpty());
    }

    @Test
    void queuesAreIndependent() throws Exception {
        transport.declareQueue("tasks.encode");
        transport.publish("tasks.render", body("a"));

        assertEquals(0, transport.depth("tasks.encode"));
        assertEquals(1, transport.depth("tasks.render"));
        assertTrue(transport.poll("tasks.encode", Duration.ZERO).isEmpty());
    }

    @Test
    void ackSettlesOnce() throws Exception {
        transport.publish("q", body("a"));
        Delivery d = transport.poll("q", Duration.ZERO).orElseThrow();
        assertEquals(1, transport.unackedCount());

        assertTrue(transport.ack(d.tag()));
        assertFalse(transport.ack(d.tag()));
        assertFalse(transport.nack(d.tag(), true));
        assertEquals(0, transport.unackedCount());
    }

    @Test
    void nackWithRequeueRedeliversFirst() throws Exception {
        transport.publish("q", body("a"));
        transport.publish("q", body("b"));
        Delivery first = transport.poll("q", Duration.ZERO).orElseThrow();
        assertFalse(first.redelivered());

        transport.nack(first.tag(), true);

        Delivery again = transport.poll("q", Duration.ZERO).orElseThrow();
        assertEquals("a", text(again));
        assertTrue(again.redelivered());
        assertNotEquals(first.tag(), again.tag());
    }

    @Test
    void nackWithoutRequeueDiscards() throws Exception {
        transport.publish("q", body("a"));
        Delivery d = transport.poll("q", Duration.ZERO).orElseThrow();

        assertTrue(transport.nack(d.tag(), false));
        assertEquals(0, transport.depth("q"));
        assertEquals(0, transport.unackedCount());
    }

    @Test
    void recoverUnackedRequeuesOutstandingDeliveries() throws Exception {
        transport.publish("q", body("a"));
        transport.publish("q", body("b"));
        transport.poll("q", Duration.ZERO);
        transport.poll("q", Duration.ZERO);

        assertEquals(2, transport.recoverUnacked());
        assertEquals(2, transport.depth("q"));
    }

    @Test
    void pollWaitsForPublish() throws Exception {
        Thread publisher = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            transport.publish("q", body("late"));
        });
        publisher.start();

        Optional<Delivery> d = transport.poll("q", Duration.ofSeconds(5));
        publisher.join();

        assertEquals("late", text(d.orElseThrow()));
    }

    @Test
    void closedTransportRejectsPublish() throws Exception {
        transport.close();

        assertThrows(PublishFailureException.class, () -> transport.publish("q", body("a")));
        assertTrue(transport.poll("q", Duration.ZERO).isEmpty());
    }
}
