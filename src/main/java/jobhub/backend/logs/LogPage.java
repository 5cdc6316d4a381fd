package jobhub.backend.logs;

import jobhub.backend.model.LogEvent;

import java.util.List;

/**
 * @param nextToken token for the following page, null when this is the last one
 */
public record LogPage(List<LogEvent> events, String nextToken) {

    public LogPage {
        events = List.copyOf(events);
    }

    public boolean hasMore() {
        return nextToken != null;
    }
}
