package com.snuffles.pricewatch.persistence;

import java.io.IOException;
import java.util.Optional;

public interface SnapshotRepository {

    void save(StateSnapshot snapshot) throws IOException;

    /**
     * @return the stored snapshot, or empty when nothing has been saved yet
     */
    Optional<StateSnapshot> load() throws IOException;
}
