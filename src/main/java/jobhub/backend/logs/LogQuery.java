package jobhub.backend.logs;

import java.time.Instant;
import java.util.Objects;

/**
 * One page request against a {@link LogSink}.
 *
 * @param group      log group, for example {@code jobs/<namespace>/<repoId>}
 * @param stream     stream inside the group
 * @param start      inclusive lower bound
 * @param end        exclusive upper bound, null for open-ended
 * @param descending newest first when true
 * @param token      continuation token from the previous page, null for the first page
 * @param limit      maximum events per page
 */
public record LogQuery(
        String group,
        String stream,
        Instant start,
        Instant end,
        boolean descending,
        String token,
        int limit) {

    public LogQuery {
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(stream, "stream is required");
        Objects.requireNonNull(start, "start is required");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }

    public LogQuery withToken(String nextToken) {
        return new LogQuery(group, stream, start, end, descending, nextToken, limit);
    }
}
