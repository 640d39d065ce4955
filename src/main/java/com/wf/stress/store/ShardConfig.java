package com.wf.stress.store;

/**
 * Distribution settings applied when a container is created.
 */
public final class ShardConfig {

    public static final int DEFAULT_SHARDS = 3;

    private final int numberOfShards;

    public ShardConfig(int numberOfShards) {
        if (numberOfShards < 1) {
            throw new IllegalArgumentException("numberOfShards must be >= 1");
        }
        this.numberOfShards = numberOfShards;
    }

    public static ShardConfig defaults() {
        return new ShardConfig(DEFAULT_SHARDS);
    }

    public int getNumberOfShards() {
        return numberOfShards;
    }

    public boolean isSharded() {
        return numberOfShards > 1;
    }

    @Override
    public String toString() {
        return "ShardConfig{shards=" + numberOfShards + "}";
    }
}
