package jobhub.backend.model;

/**
 * A file (or, in non-recursive listings, a directory) inside an artifact.
 *
 * @param path      path relative to the artifact name, directories end with {@code /}
 * @param size      size in bytes; for directories the sum of the contained files
 * @param directory true for grouped directory entries
 */
public record ArtifactFile(String path, long size, boolean directory) {

    public static ArtifactFile file(String path, long size) {
        return new ArtifactFile(path, size, false);
    }

    public static ArtifactFile directory(String path, long size) {
        return new ArtifactFile(path, size, true);
    }
}
