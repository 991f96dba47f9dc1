package tacoq.manager.exception;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registration referenced task types that do not exist. Rejected, not retried.
 */
public class InvalidCapabilityException extends ManagerException {

    private final Set<String> unknown;

    public InvalidCapabilityException(Collection<?> unknown) {
        super("unknown task types: " + unknown);
        this.unknown = unknown.stream()
                .map(String::valueOf)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<String> unknown() {
        return unknown;
    }
}
