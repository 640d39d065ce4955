package com.wf.stress.store;

import com.wf.stress.generator.GeneratedDocument;

/**
 * One write within a batch: a document bound for a container.
 */
public final class BatchEntry {

    private final String container;
    private final GeneratedDocument document;

    public BatchEntry(String container, GeneratedDocument document) {
        this.container = container;
        this.document = document;
    }

    public String getContainer() {
        return container;
    }

    public GeneratedDocument getDocument() {
        return document;
    }
}
