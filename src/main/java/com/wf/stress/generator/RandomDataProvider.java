package com.wf.stress.generator;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Provides random values for document synthesis.
 * Thread-safe implementation using ThreadLocalRandom.
 */
public class RandomDataProvider {

    private static final char[] LOWERCASE = "abcdefghijklmnopqrstuvwxyz".toCharArray();

    /**
     * Uniform int in {@code [1, max]}.
     */
    public int randomSize(int max) {
        if (max < 1) {
            throw new IllegalArgumentException("Not supporting " + max + " as a valid size");
        }
        return ThreadLocalRandom.current().nextInt(1, max + 1);
    }

    /**
     * Lowercase ASCII string with a uniformly random length in {@code [1, maxLength]}.
     */
    public String randomLowercase(int maxLength) {
        return randomLowercaseOfLength(randomSize(maxLength));
    }

    public String randomLowercaseOfLength(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = LOWERCASE[random.nextInt(LOWERCASE.length)];
        }
        return new String(chars);
    }

    public <T> T randomElement(List<T> list) {
        return list.get(ThreadLocalRandom.current().nextInt(list.size()));
    }
}
