package com.wf.stress.generator;

import org.bson.Document;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable synthetic document: field name to field value.
 * Shared between batches and threads without copying.
 */
public final class GeneratedDocument {

    private final Map<String, String> fields;
    private final int serializedSize;

    public GeneratedDocument(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.serializedSize = toBson().toJson().getBytes(StandardCharsets.UTF_8).length;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public int getFieldCount() {
        return fields.size();
    }

    /**
     * Size of the JSON form of this document in bytes.
     */
    public int getSerializedSize() {
        return serializedSize;
    }

    /**
     * Fresh BSON copy; the driver adds an {@code _id} to what it inserts.
     */
    public Document toBson() {
        return new Document(new LinkedHashMap<String, Object>(fields));
    }

    @Override
    public String toString() {
        return "GeneratedDocument{fields=" + fields.size() + ", bytes=" + serializedSize + "}";
    }
}
