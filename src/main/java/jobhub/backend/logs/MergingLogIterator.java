package jobhub.backend.logs;

import jobhub.backend.model.LogEvent;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * K-way merge of individually ordered log iterators into one ordered iterator.
 * Events with equal timestamps come out in source order.
 */
class MergingLogIterator implements Iterator<LogEvent> {

    private final PriorityQueue<Head> heads;

    MergingLogIterator(List<? extends Iterator<LogEvent>> sources, boolean descending) {
        Comparator<Head> byTime = Comparator.comparing(h -> h.event.timestamp());
        if (descending) {
            byTime = byTime.reversed();
        }
        this.heads = new PriorityQueue<>(Math.max(1, sources.size()), byTime.thenComparingInt(h -> h.sourceIndex));
        for (int i = 0; i < sources.size(); i++) {
            advance(sources.get(i), i);
        }
    }

    @Override
    public boolean hasNext() {
        return !heads.isEmpty();
    }

    @Override
    public LogEvent next() {
        Head head = heads.poll();
        if (head == null) {
            throw new NoSuchElementException();
        }
        advance(head.source, head.sourceIndex);
        return head.event;
    }

    private void advance(Iterator<LogEvent> source, int index) {
        if (source.hasNext()) {
            heads.add(new Head(source.next(), source, index));
        }
    }

    private record Head(LogEvent event, Iterator<LogEvent> source, int sourceIndex) {
    }
}
