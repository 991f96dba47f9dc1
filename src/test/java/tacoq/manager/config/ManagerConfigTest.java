package tacoq.manager.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ManagerConfigTest {

    @Test
    void defaultsAreValid() {
        ManagerConfig config = ManagerConfig.defaults();

        assertDoesNotThrow(config::validate);
        assertEquals(Duration.ofSeconds(30), config.heartbeatTimeout());
        assertEquals(Duration.ofSeconds(90), config.deathTimeout());
        assertFalse(config.hasAgentKey());
        assertFalse(config.autoCreateTaskTypes());
    }

    @Test
    void sweepIntervalFollowsHeartbeatTimeoutUnlessSet() {
        ManagerConfig config = ManagerConfig.defaults().withHeartbeatTimeout(Duration.ofSeconds(10));
        assertEquals(Duration.ofSeconds(5), config.livenessSweepInterval());

        config.withLivenessSweepInterval(Duration.ofMillis(250));
        assertEquals(Duration.ofMillis(250), config.livenessSweepInterval());
    }

    @Test
    void deathTimeoutMustExceedHeartbeatTimeout() {
        ManagerConfig config = ManagerConfig.defaults()
                .withHeartbeatTimeout(Duration.ofSeconds(30))
                .withDeathTimeout(Duration.ofSeconds(30));

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void publishRetryMustAllowOneAttempt() {
        ManagerConfig config = ManagerConfig.defaults().withPublishRetry(0, Duration.ofMillis(10));

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void agentKey() {
        ManagerConfig config = ManagerConfig.defaults().withAgentKey("secret");

        assertTrue(config.hasAgentKey());
        assertEquals("secret", config.agentKey());
    }
}
