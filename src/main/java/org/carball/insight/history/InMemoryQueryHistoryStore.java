package org.carball.insight.history;

import java.time.Clock;

/**
 * History kept for the lifetime of the process only.
 */
public class InMemoryQueryHistoryStore extends AbstractQueryHistoryStore {

    public InMemoryQueryHistoryStore() {
        this(Clock.systemUTC());
    }

    public InMemoryQueryHistoryStore(Clock clock) {
        super(clock);
    }

    @Override
    public void close() {
        patterns.clear();
    }
}
