package com.wf.stress.generator;

import java.util.List;

/**
 * Fixed set of pre-generated documents, read concurrently by all workers.
 */
public final class DocumentPool {

    private final List<GeneratedDocument> documents;
    private final int baseCount;

    public DocumentPool(List<GeneratedDocument> documents, int baseCount) {
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("Document pool must not be empty");
        }
        this.documents = List.copyOf(documents);
        this.baseCount = baseCount;
    }

    public List<GeneratedDocument> getDocuments() {
        return documents;
    }

    public int size() {
        return documents.size();
    }

    public int getBaseCount() {
        return baseCount;
    }

    public int getVariantCount() {
        return documents.size() - baseCount;
    }
}
