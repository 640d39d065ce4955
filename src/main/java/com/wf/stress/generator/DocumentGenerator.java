package com.wf.stress.generator;

import com.wf.stress.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesizes documents with random field sets and random lowercase content.
 */
public class DocumentGenerator {

    private static final Logger log = LoggerFactory.getLogger(DocumentGenerator.class);

    static final int MAX_FIELD_NAME_LENGTH = 10;

    private final RandomDataProvider random;

    public DocumentGenerator(RandomDataProvider random) {
        this.random = random;
    }

    /**
     * Generate one document with between 1 and {@code maxFields} distinct fields.
     * Keys are 1 to 10 lowercase chars; values are 1 to {@code maxFieldSize} lowercase chars.
     *
     * @throws ConfigException if either bound is below 1
     */
    public GeneratedDocument generate(int maxFields, int maxFieldSize) {
        checkBounds(maxFields, maxFieldSize);
        return newDocument(maxFields, maxFieldSize);
    }

    /**
     * Build a pool of {@code count} base documents plus {@code variants} documents that
     * reuse a base document's field names with fresh values.
     *
     * @throws ConfigException if any bound is invalid; nothing is generated in that case
     */
    public DocumentPool buildPool(int count, int variants, int maxFields, int maxFieldSize) {
        if (count < 1) {
            throw new ConfigException("Document count must be >= 1 (was " + count + ")");
        }
        if (variants < 0) {
            throw new ConfigException("Variant count must be >= 0 (was " + variants + ")");
        }
        checkBounds(maxFields, maxFieldSize);

        List<GeneratedDocument> bases = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bases.add(newDocument(maxFields, maxFieldSize));
        }

        List<GeneratedDocument> all = new ArrayList<>(count + variants);
        all.addAll(bases);
        for (int i = 0; i < variants; i++) {
            all.add(deriveVariant(random.randomElement(bases), maxFieldSize));
        }

        log.debug("Built document pool: {} base documents, {} variants", count, variants);
        return new DocumentPool(all, count);
    }

    /**
     * Same field names as {@code template}, freshly randomized values.
     */
    public GeneratedDocument deriveVariant(GeneratedDocument template, int maxFieldSize) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String name : template.getFields().keySet()) {
            fields.put(name, random.randomLowercase(maxFieldSize));
        }
        return new GeneratedDocument(fields);
    }

    private GeneratedDocument newDocument(int maxFields, int maxFieldSize) {
        int fieldCount = random.randomSize(maxFields);
        Map<String, String> fields = new LinkedHashMap<>(fieldCount * 2);
        for (int i = 0; i < fieldCount; i++) {
            fields.put(random.randomLowercase(MAX_FIELD_NAME_LENGTH), random.randomLowercase(maxFieldSize));
        }
        return new GeneratedDocument(fields);
    }

    private static void checkBounds(int maxFields, int maxFieldSize) {
        if (maxFields < 1) {
            throw new ConfigException("Max fields per document must be >= 1 (was " + maxFields + ")");
        }
        if (maxFieldSize < 1) {
            throw new ConfigException("Max size per field must be >= 1 (was " + maxFieldSize + ")");
        }
    }
}
