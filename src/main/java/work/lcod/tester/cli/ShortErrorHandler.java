package work.lcod.tester.cli;

import picocli.CommandLine;
import work.lcod.tester.fixture.TesterException;

/**
 * Prints command failures as one {@code <code>: <message>} line on stderr.
 * Set {@code -Dlcod.tester.debug=true} to get the stack trace as well.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "lcod.tester.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        report(commandLine, codeOf(ex), messageOf(ex));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    /**
     * Writes a failure line; also used for failed runs, which do not reach this handler.
     */
    static void report(CommandLine commandLine, String code, String message) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(code + ": " + message));
        err.flush();
    }

    static String codeOf(Throwable ex) {
        if (ex instanceof TesterException tester) {
            return tester.code();
        }
        if (ex instanceof IllegalArgumentException) {
            return "invalid_argument";
        }
        return "unexpected_error";
    }

    private static String messageOf(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
