package work.lcod.tester.fixture;

/**
 * Fixture resolution nested deeper than the configured limit.
 */
public final class RecursionLimitExceededException extends TesterException {
    private final int limit;

    public RecursionLimitExceededException(int limit, String fixture) {
        super(
            "recursion_limit",
            "Fixture resolution exceeded " + limit + " nested levels at '" + fixture
                + "'; the fixture graph is probably cyclic"
        );
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
