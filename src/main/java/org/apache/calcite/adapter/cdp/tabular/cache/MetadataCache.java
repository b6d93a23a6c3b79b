package org.apache.calcite.adapter.cdp.tabular.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Key-addressed cache of in-flight or completed metadata fetches.
 *
 * <p>Each entry is the result of one fetch for its key, complete or still running.
 * No entry means nothing is known about the key yet and the first caller to ask
 * triggers the fetch. The slot is claimed with an atomic put-if-absent of an unstarted
 * future <em>before</em> the fetch is submitted, so N concurrent callers for one key
 * cause exactly one fetch and all of them observe the same stage.</p>
 *
 * <p><b>Policies:</b></p>
 * <ul>
 *   <li>A failed fetch is removed from the cache before its error is published;
 *       every waiter of that fetch sees the error and the next call fetches again.</li>
 *   <li>The published stage cannot be cancelled or completed by callers. A caller stops
 *       waiting by cancelling its own dependent future; the shared fetch always runs to
 *       completion and a successful result stays cached even if every waiter left.</li>
 *   <li>{@link #clear()} never touches the network and does not cancel running fetches.
 *       Their waiters still get the result, but it is not stored back.</li>
 *   <li>The number of entries is bounded; the least valuable entries are evicted first.</li>
 * </ul>
 *
 * @param <T> cached payload type
 */
public class MetadataCache<T> {

    private static final Logger logger = LoggerFactory.getLogger(MetadataCache.class);

    public static final int DEFAULT_MAXIMUM_SIZE = 1000;

    private final Cache<String, CompletionStage<T>> cache;
    private final Executor executor;

    /**
     * @param maximumSize upper bound of cached entries
     * @param executor    runs the fetches; callers never block on the fetch itself
     */
    public MetadataCache(int maximumSize, Executor executor) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .build();
        this.executor = executor;
    }

    /**
     * Returns the shared stage for {@code key}, starting {@code fetch} if nobody did yet.
     *
     * @param key   cache key
     * @param fetch fetch operation, invoked at most once per installed entry
     * @return the stage shared by every caller of this key
     */
    public CompletionStage<T> getOrFetch(String key, Supplier<T> fetch) {
        CompletionStage<T> existing = cache.getIfPresent(key);
        if (existing != null) {
            logger.debug("getOrFetch({}): found entry in the cache", key);
            return existing;
        }

        CompletableFuture<T> mine = new CompletableFuture<>();
        CompletionStage<T> published = mine.minimalCompletionStage();
        existing = cache.asMap().putIfAbsent(key, published);
        if (existing != null) {
            logger.debug("getOrFetch({}): another caller started the fetch first", key);
            return existing;
        }

        logger.debug("getOrFetch({}): fetching", key);
        try {
            executor.execute(() -> runFetch(key, published, mine, fetch));
        } catch (RejectedExecutionException e) {
            fail(key, published, mine, e);
        }
        return published;
    }

    private void runFetch(String key, CompletionStage<T> published, CompletableFuture<T> mine, Supplier<T> fetch) {
        T value;
        try {
            value = fetch.get();
        } catch (RuntimeException | Error e) {
            fail(key, published, mine, e);
            return;
        }
        logger.debug("Loaded entry for {}", key);
        mine.complete(value);
    }

    private void fail(String key, CompletionStage<T> published, CompletableFuture<T> mine, Throwable error) {
        logger.debug("Error while loading {} ({})", key, error.getMessage());
        // only our own entry, a newer one installed after clear() stays
        cache.asMap().remove(key, published);
        mine.completeExceptionally(error);
    }

    /**
     * @return the stage cached for {@code key}, or null
     */
    public CompletionStage<T> getIfPresent(String key) {
        return cache.getIfPresent(key);
    }

    public boolean contains(String key) {
        return cache.asMap().containsKey(key);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    /** Removes all entries. */
    public void clear() {
        cache.invalidateAll();
    }

    public int size() {
        return cache.asMap().size();
    }

    public boolean isEmpty() {
        return cache.asMap().isEmpty();
    }
}
