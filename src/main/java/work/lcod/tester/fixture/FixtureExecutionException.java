package work.lcod.tester.fixture;

/**
 * A fixture raised during its setup or teardown phase.
 */
public final class FixtureExecutionException extends TesterException {
    private final String fixture;
    private final Phase phase;

    public FixtureExecutionException(String fixture, Phase phase, Throwable cause) {
        super("fixture_failed", describe(fixture, phase, cause), cause);
        this.fixture = fixture;
        this.phase = phase;
    }

    public String fixture() {
        return fixture;
    }

    public Phase phase() {
        return phase;
    }

    private static String describe(String fixture, Phase phase, Throwable cause) {
        String reason = cause == null || cause.getMessage() == null || cause.getMessage().isBlank()
            ? (cause == null ? "unknown error" : cause.getClass().getSimpleName())
            : cause.getMessage();
        return "Fixture '" + fixture + "' failed during " + phase.label() + ": " + reason;
    }

    public enum Phase {
        SETUP("setup"),
        TEARDOWN("teardown");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
