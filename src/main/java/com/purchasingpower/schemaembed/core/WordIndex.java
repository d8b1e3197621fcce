package com.purchasingpower.schemaembed.core;

import com.purchasingpower.schemaembed.exception.WordNotFoundException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional word/index vocabulary.
 *
 * Indices are handed out in first-seen order starting at 0 and are never
 * reused or removed. One instance is meant to live for a single embedding
 * request (or batch); it is never persisted.
 *
 * Not thread-safe. Use {@link SynchronizedWordIndex} when several threads
 * share one vocabulary.
 *
 * @since 1.0.0
 */
public class WordIndex {

    private final Map<String, Integer> indexByWord = new HashMap<>();
    private final List<String> words = new ArrayList<>();

    /**
     * Return the index of {@code word}, registering it under the next
     * sequential index if it was never seen.
     */
    public int getOrAdd(String word) {
        if (word == null) {
            throw new IllegalArgumentException("Word cannot be null");
        }
        Integer existing = indexByWord.get(word);
        if (existing != null) {
            return existing;
        }
        int index = words.size();
        words.add(word);
        indexByWord.put(word, index);
        return index;
    }

    /**
     * @throws WordNotFoundException if {@code index} was never assigned
     */
    public String getWord(int index) {
        if (index < 0 || index >= words.size()) {
            throw new WordNotFoundException(index);
        }
        return words.get(index);
    }

    public boolean contains(String word) {
        return word != null && indexByWord.containsKey(word);
    }

    /**
     * Number of distinct words ever inserted.
     */
    public int count() {
        return words.size();
    }
}
