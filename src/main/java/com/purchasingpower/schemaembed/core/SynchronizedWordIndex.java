package com.purchasingpower.schemaembed.core;

/**
 * WordIndex whose operations are serialized on the instance monitor.
 *
 * Concurrent inserts into a plain WordIndex race on index assignment; this
 * variant keeps the single-writer discipline when one vocabulary is shared
 * across threads.
 *
 * @since 1.0.0
 */
public class SynchronizedWordIndex extends WordIndex {

    @Override
    public synchronized int getOrAdd(String word) {
        return super.getOrAdd(word);
    }

    @Override
    public synchronized String getWord(int index) {
        return super.getWord(index);
    }

    @Override
    public synchronized boolean contains(String word) {
        return super.contains(word);
    }

    @Override
    public synchronized int count() {
        return super.count();
    }
}
