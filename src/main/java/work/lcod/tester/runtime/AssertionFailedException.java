package work.lcod.tester.runtime;

/**
 * Raised by the {@code assert/*} step functions, carrying what was compared.
 */
public final class AssertionFailedException extends RuntimeException {
    private final Object expected;
    private final Object actual;

    public AssertionFailedException(String message, Object expected, Object actual) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    public String code() {
        return "assertion_failed";
    }

    public Object expected() {
        return expected;
    }

    public Object actual() {
        return actual;
    }
}
