package jobhub.backend.logs;

/**
 * Read side of a log store organised as groups of streams.
 * Events of one stream are returned ordered by timestamp, page by page.
 */
public interface LogSink {

    /**
     * @throws jobhub.backend.error.LogGroupNotFoundException when the group does not exist
     */
    LogPage query(LogQuery query);
}
