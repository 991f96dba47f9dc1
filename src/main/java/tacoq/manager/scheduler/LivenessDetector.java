package tacoq.manager.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.repository.WorkerRepository;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Background sweep that classifies workers from their last heartbeat.
 *
 * ALIVE workers silent for longer than the heartbeat timeout become SUSPECTED
 * and stop receiving work. Workers silent for longer than the death timeout are
 * declared DEAD and their QUEUED and RUNNING tasks go back to PENDING.
 *
 * All state is in the store and every change is conditional, so several
 * detectors may sweep at the same time.
 */
public class LivenessDetector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LivenessDetector.class);

    /**
     * Outcome of one sweep.
     */
    public record SweepResult(int suspected, int dead, int reclaimed) {
    }

    private final WorkerRepository workerRepository;
    private final ManagerConfig config;

    public LivenessDetector(WorkerRepository workerRepository, ManagerConfig config) {
        this.workerRepository = workerRepository;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Liveness sweep error", e);
        }
    }

    public SweepResult sweep() {
        Instant now = config.clock().instant();

        List<UUID> suspected = workerRepository.markSuspected(now.minus(config.heartbeatTimeout()));
        for (UUID id : suspected) {
            log.warn("Worker {} missed heartbeats, now SUSPECTED", id);
        }

        Instant deathCutoff = now.minus(config.deathTimeout());
        int dead = 0;
        int reclaimed = 0;

        for (UUID id : workerRepository.findDeathCandidates(deathCutoff)) {
            try {
                OptionalInt result = workerRepository.markDeadAndReclaim(id, deathCutoff);
                if (result.isPresent()) {
                    dead++;
                    reclaimed += result.getAsInt();
                    log.info("Worker {} declared DEAD, {} tasks returned to PENDING", id, result.getAsInt());
                }
            } catch (Exception e) {
                log.error("Failed to declare worker {} dead", id, e);
            }
        }

        if (!suspected.isEmpty() || dead > 0) {
            log.info("Liveness sweep: {} suspected, {} dead, {} tasks reclaimed", suspected.size(), dead, reclaimed);
        }
        return new SweepResult(suspected.size(), dead, reclaimed);
    }
}
