package com.example.healthrag;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

public interface VectorIndex {

    /** Inserts or replaces the record with the same id. */
    void upsert(IndexedRecord record);

    boolean remove(String id);

    /**
     * Owner-scoped search. Returns hits ascending by distance, at most {@code limit}, never null.
     */
    List<ScoredRecord> search(VectorSearchRequest request);

    /** Every category the owner has at least one indexed record for. */
    Set<String> categories(String ownerId);

    long size();

    void rebuildFromDatabase() throws Exception;

    default void persistTo(Path file) throws Exception { }

    default void loadFrom(Path file) throws Exception { }
}
