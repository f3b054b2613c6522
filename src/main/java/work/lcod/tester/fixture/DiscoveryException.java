package work.lcod.tester.fixture;

/**
 * A test file or module could not be found or understood.
 */
public final class DiscoveryException extends TesterException {
    public DiscoveryException(String message) {
        super("discovery_failed", message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super("discovery_failed", message, cause);
    }
}
