package work.lcod.tester.fixture;

/**
 * A required parameter has no default value and no fixture of the same name.
 */
public final class UnresolvedParameterException extends TesterException {
    private final String parameter;
    private final String requester;

    public UnresolvedParameterException(String parameter, String requester) {
        super(
            "unresolved_parameter",
            "Missing required parameter '" + parameter + "' of '" + requester
                + "'. No fixture of that name is defined and no default value is given."
        );
        this.parameter = parameter;
        this.requester = requester;
    }

    public String parameter() {
        return parameter;
    }

    public String requester() {
        return requester;
    }
}
