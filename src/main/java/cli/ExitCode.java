package cli;

/** Process exit status of a command. */
public enum ExitCode {
    /** Nothing to report. */
    OK(0),
    /** Lint/check/test findings. */
    ISSUES(1),
    /** Parse, graph, database or IO failure. */
    FAILURE(10),
    /** Bad command line or missing configuration. */
    USAGE(12);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
