package com.crowelang.compiler.compiler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 编译管道各阶段的调用计数，用于观察缓存复用情况
 */
public final class CompileStats {
    private final AtomicLong lexRuns = new AtomicLong();
    private final AtomicLong parseRuns = new AtomicLong();
    private final AtomicLong lowerRuns = new AtomicLong();
    private final AtomicLong generateRuns = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    void recordLex() {
        lexRuns.incrementAndGet();
    }

    void recordParse() {
        parseRuns.incrementAndGet();
    }

    void recordLower() {
        lowerRuns.incrementAndGet();
    }

    void recordGenerate() {
        generateRuns.incrementAndGet();
    }

    void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    public long getLexRuns() {
        return lexRuns.get();
    }

    public long getParseRuns() {
        return parseRuns.get();
    }

    public long getLowerRuns() {
        return lowerRuns.get();
    }

    public long getGenerateRuns() {
        return generateRuns.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    @Override
    public String toString() {
        return "CompileStats{lex=" + lexRuns + ", parse=" + parseRuns + ", lower=" + lowerRuns
                + ", generate=" + generateRuns + ", hits=" + cacheHits + ", misses=" + cacheMisses + "}";
    }
}
