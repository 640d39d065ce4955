package com.wf.stress.loader;

import com.wf.stress.store.BatchEntry;

import java.util.List;

/**
 * Entries for one bulk write plus their serialized size in bytes.
 */
public final class Batch {

    private final List<BatchEntry> entries;
    private final long serializedSize;

    public Batch(List<BatchEntry> entries, long serializedSize) {
        this.entries = entries;
        this.serializedSize = serializedSize;
    }

    public List<BatchEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public long getSerializedSize() {
        return serializedSize;
    }
}
