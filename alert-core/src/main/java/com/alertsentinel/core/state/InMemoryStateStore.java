package com.alertsentinel.core.state;

import java.util.Optional;

/**
 * Keeps the last snapshot in memory only. State survives pipeline
 * re-creation within one process, not a restart.
 */
public class InMemoryStateStore implements StateStore {

    private volatile StateSnapshot last;

    public InMemoryStateStore() {
    }

    /**
     * @param initial snapshot returned by the first {@link #load()}
     */
    public InMemoryStateStore(StateSnapshot initial) {
        this.last = initial;
    }

    @Override
    public Optional<StateSnapshot> load() {
        return Optional.ofNullable(last);
    }

    @Override
    public void save(StateSnapshot snapshot) {
        this.last = snapshot;
    }
}
