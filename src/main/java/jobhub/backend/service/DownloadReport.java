package jobhub.backend.service;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch artifact download. A batch never fails as a whole: objects that
 * vanished are listed as missing, objects that could not be written as failed.
 *
 * @param downloaded object keys written to disk
 * @param missing    object keys listed but absent when fetched
 * @param failed     object key to error message
 */
public record DownloadReport(List<String> downloaded, List<String> missing, Map<String, String> failed) {

    public DownloadReport {
        downloaded = List.copyOf(downloaded);
        missing = List.copyOf(missing);
        failed = Map.copyOf(failed);
    }

    public boolean isComplete() {
        return missing.isEmpty() && failed.isEmpty();
    }
}
