package com.wf.stress.loader;

import com.wf.stress.generator.DocumentGenerator;
import com.wf.stress.generator.DocumentPool;
import com.wf.stress.generator.GeneratedDocument;
import com.wf.stress.generator.RandomDataProvider;
import com.wf.stress.store.BatchEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchAssemblerTest {

    private final RandomDataProvider random = new RandomDataProvider();
    private DocumentPool pool;

    @BeforeEach
    void setUp() {
        pool = new DocumentGenerator(random).buildPool(10, 2, 5, 20);
    }

    @Test
    void shouldBuildBatchOfConfiguredSize() {
        BatchAssembler assembler = new BatchAssembler(List.of("c1", "c2"), pool, 250, random);

        Batch batch = assembler.next();

        assertThat(batch.size()).isEqualTo(250);
        assertThat(batch.getEntries())
            .allMatch(e -> e.getContainer().equals("c1") || e.getContainer().equals("c2"))
            .allMatch(e -> pool.getDocuments().contains(e.getDocument()));
    }

    @Test
    void shouldDrawFromAllContainersOverManyEntries() {
        BatchAssembler assembler = new BatchAssembler(List.of("a", "b", "c"), pool, 500, random);

        Set<String> seen = new HashSet<>();
        for (BatchEntry entry : assembler.next().getEntries()) {
            seen.add(entry.getContainer());
        }

        assertThat(seen).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void shouldSizeBatchAsActionLinePlusDocumentPerEntry() {
        GeneratedDocument doc = new GeneratedDocument(Map.of("field", "value"));
        DocumentPool single = new DocumentPool(List.of(doc), 1);
        BatchAssembler assembler = new BatchAssembler(List.of("only"), single, 4, random);

        Batch batch = assembler.next();

        long perEntry = BatchAssembler.actionLineSize("only") + doc.getSerializedSize() + 1;
        assertThat(batch.getSerializedSize()).isEqualTo(perEntry * 4);
    }

    @Test
    void shouldRequireContainers() {
        assertThatThrownBy(() -> new BatchAssembler(List.of(), pool, 10, random))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
