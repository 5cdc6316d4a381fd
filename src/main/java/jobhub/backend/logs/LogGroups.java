package jobhub.backend.logs;

/**
 * Log group naming shared by writers (compute) and readers.
 */
public final class LogGroups {

    private LogGroups() {
    }

    /** Job output of one repository; streams are run names */
    public static String jobs(String namespace, String repoId) {
        return "jobs/" + namespace + "/" + repoId;
    }

    /** Runner diagnostics; streams are job ids */
    public static String runners(String namespace) {
        return "runners/" + namespace;
    }
}
