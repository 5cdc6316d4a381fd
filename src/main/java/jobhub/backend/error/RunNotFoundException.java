package jobhub.backend.error;

public class RunNotFoundException extends NotFoundException {

    private final String runName;

    public RunNotFoundException(String repoId, String runName) {
        super("Run not found: " + repoId + "/" + runName);
        this.runName = runName;
    }

    public String runName() {
        return runName;
    }
}
