package jobhub.backend.model;

import java.util.List;

/**
 * Files uploaded by one job under one artifact name.
 */
public record Artifact(String jobId, String name, List<ArtifactFile> files) {

    public Artifact {
        files = List.copyOf(files);
    }
}
