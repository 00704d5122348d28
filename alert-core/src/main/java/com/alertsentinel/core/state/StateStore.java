package com.alertsentinel.core.state;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable backend for {@link StateSnapshot}s.
 *
 * <p>
 * The pipeline treats persistence as best effort: it logs and swallows
 * whatever these methods throw.
 * </p>
 */
public interface StateStore {

    /**
     * @return the last saved snapshot, or empty on a cold start
     * @throws IOException if a snapshot exists but cannot be read
     */
    Optional<StateSnapshot> load() throws IOException;

    /**
     * @param snapshot full current state, replacing whatever was saved before
     * @throws IOException if the snapshot cannot be written
     */
    void save(StateSnapshot snapshot) throws IOException;
}
