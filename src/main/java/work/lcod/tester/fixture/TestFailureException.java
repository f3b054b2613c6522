package work.lcod.tester.fixture;

/**
 * The body of a test raised (failed assertion or any other exception).
 */
public final class TestFailureException extends TesterException {
    private final String test;

    public TestFailureException(String test, Throwable cause) {
        super("test_failed", "Test '" + test + "' failed: " + reason(cause), cause);
        this.test = test;
    }

    public String test() {
        return test;
    }

    private static String reason(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
