package com.arenasync.fetch;

/**
 * Outcome of one git invocation. Exactly one of {@code timedOut}, {@code interrupted} and
 * {@code launchFailed} may be set; when none is, {@code exitCode} is the process exit value.
 */
public record GitCommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public GitCommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr.strip();
    }

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    /**
     * Describes a failed run of {@code git <subcommand>} for error messages.
     */
    public String describeFailure(String subcommand) {
        StringBuilder description = new StringBuilder("git ").append(subcommand);
        if (launchFailed) {
            description.append(" could not be started");
        } else if (timedOut) {
            description.append(" timed out");
        } else {
            description.append(" exited with ").append(exitCode);
        }
        if (!stderr.isEmpty()) {
            description.append(": ").append(stderr);
        }
        return description.toString();
    }
}
