package com.wf.stress.loader;

import com.wf.stress.generator.DocumentPool;
import com.wf.stress.generator.GeneratedDocument;
import com.wf.stress.generator.RandomDataProvider;
import com.wf.stress.store.BatchEntry;
import org.bson.Document;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws containers and documents uniformly, with replacement, into batches.
 *
 * <p>A batch is sized as its newline-delimited bulk form: one action line naming the
 * target container and one document line per entry.
 */
public class BatchAssembler {

    private final List<String> containers;
    private final DocumentPool pool;
    private final int batchSize;
    private final RandomDataProvider random;
    private final Map<String, Integer> actionLineSizes;

    public BatchAssembler(List<String> containers, DocumentPool pool, int batchSize, RandomDataProvider random) {
        if (containers.isEmpty()) {
            throw new IllegalArgumentException("At least one container is required");
        }
        this.containers = List.copyOf(containers);
        this.pool = pool;
        this.batchSize = batchSize;
        this.random = random;

        Map<String, Integer> sizes = new HashMap<>();
        for (String container : this.containers) {
            sizes.put(container, actionLineSize(container));
        }
        this.actionLineSizes = sizes;
    }

    static int actionLineSize(String container) {
        String action = new Document("index", new Document("_index", container)).toJson();
        return action.getBytes(StandardCharsets.UTF_8).length + 1;
    }

    public Batch next() {
        List<BatchEntry> entries = new ArrayList<>(batchSize);
        long bytes = 0;

        for (int i = 0; i < batchSize; i++) {
            String container = random.randomElement(containers);
            GeneratedDocument document = random.randomElement(pool.getDocuments());
            entries.add(new BatchEntry(container, document));
            bytes += actionLineSizes.get(container) + document.getSerializedSize() + 1;
        }

        return new Batch(entries, bytes);
    }

    public int getBatchSize() {
        return batchSize;
    }
}
