package jobhub.backend.compute;

/** Outcome of {@link Compute#runShell}: exit code and combined stdout/stderr. */
public record ShellResult(int exitCode, String output) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
