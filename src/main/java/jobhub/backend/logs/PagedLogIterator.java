package jobhub.backend.logs;

import jobhub.backend.error.LogGroupNotFoundException;
import jobhub.backend.model.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates one stream of a {@link LogSink}, fetching the next page only when the current
 * one is exhausted.
 */
class PagedLogIterator implements Iterator<LogEvent> {

    private static final Logger log = LoggerFactory.getLogger(PagedLogIterator.class);

    private final LogSink sink;
    private final boolean missingGroupIsEmpty;
    private LogQuery nextQuery;
    private Iterator<LogEvent> page = Collections.emptyIterator();

    /**
     * @param missingGroupIsEmpty treat a missing log group as an empty stream instead of failing
     */
    PagedLogIterator(LogSink sink, LogQuery query, boolean missingGroupIsEmpty) {
        this.sink = sink;
        this.nextQuery = query;
        this.missingGroupIsEmpty = missingGroupIsEmpty;
    }

    @Override
    public boolean hasNext() {
        while (!page.hasNext() && nextQuery != null) {
            LogQuery query = nextQuery;
            LogPage result;
            try {
                result = sink.query(query);
            } catch (LogGroupNotFoundException e) {
                if (!missingGroupIsEmpty) {
                    throw e;
                }
                log.debug("Log group {} not found, skipping stream {}", query.group(), query.stream());
                nextQuery = null;
                return false;
            }
            page = result.events().iterator();
            nextQuery = result.hasMore() ? query.withToken(result.nextToken()) : null;
        }
        return page.hasNext();
    }

    @Override
    public LogEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return page.next();
    }
}
