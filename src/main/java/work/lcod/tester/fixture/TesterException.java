package work.lcod.tester.fixture;

/**
 * Base of every error the engine raises. Carries a stable machine-readable code.
 */
public class TesterException extends RuntimeException {
    private final String code;

    public TesterException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TesterException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
