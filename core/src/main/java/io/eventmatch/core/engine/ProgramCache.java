package io.eventmatch.core.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.cel.common.CelAbstractSyntaxTree;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded cache of checked syntax trees keyed by (expression text, environment signature). An
 * entry is only reused for an environment whose signature is identical to the one it was compiled
 * against; any difference in variable names or kinds is a different key.
 *
 * <p>
 * Only the checked tree is cached. The runnable program is planned per call, because its accessor
 * functions are bound to the current document.
 *
 * <p>
 * Thread-safe: backed by Caffeine.
 */
public final class ProgramCache {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramCache.class);

    private final Cache<Key, CelAbstractSyntaxTree> cache;

    public ProgramCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got: " + maximumSize);
        }
        this.cache = Caffeine.newBuilder().maximumSize(maximumSize).build();
    }

    /**
     * Returns the cached tree for this expression and signature, compiling and storing it on a
     * miss. Compilation runs at most once per key at a time. Compilation failures propagate and
     * are not cached.
     */
    public CelAbstractSyntaxTree getOrCompile(String expression, String signature, Supplier<CelAbstractSyntaxTree> compiler) {
        Key key = new Key(expression, signature);
        CelAbstractSyntaxTree cached = cache.getIfPresent(key);
        if (cached != null) {
            LOG.debug("Program cache hit: signature={}", signature);
            return cached;
        }
        // concurrent misses on one key compile once
        return cache.get(key, k -> compiler.get());
    }

    /** Returns the cached tree, if any. */
    public Optional<CelAbstractSyntaxTree> get(String expression, String signature) {
        return Optional.ofNullable(cache.getIfPresent(new Key(expression, signature)));
    }

    /** Approximate number of cached entries. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private record Key(String expression, String signature) {}
}
