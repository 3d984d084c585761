package com.promptstability.storage;

import java.io.IOException;
import java.util.List;

public interface ResponseStore {
    /**
     * Returns stored records in insertion order; entries that could not be read are {@code null}.
     */
    List<ResponseRecord> loadAll() throws IOException;

    void append(ResponseRecord record) throws IOException;

    void clear() throws IOException;
}
