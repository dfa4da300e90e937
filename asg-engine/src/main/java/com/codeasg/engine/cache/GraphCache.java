package com.codeasg.engine.cache;

import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.graph.Asg;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide map from unit identity to its current ASG.
 *
 * <p>At most one build runs per identity: the first caller to insert an entry builds it,
 * concurrent callers with the same content hash wait on the same future. A different hash
 * replaces the entry. Builds that fail remove only their own entry, so a later call starts
 * afresh. Least recently used completed entries are evicted above {@code maxEntries}; evicted
 * graphs stay valid for whoever still holds them. Async callers get their own copy of the
 * future, so cancelling it abandons only that caller's wait.
 */
public class GraphCache {

    /** Runs the build pipeline for one unit. */
    @FunctionalInterface
    public interface Builder {
        Asg build(String identity, String contentHash, String source, Language language);
    }

    private final int maxEntries;
    private final Builder builder;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong clock = new AtomicLong();

    public GraphCache(int maxEntries, Builder builder) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        this.maxEntries = maxEntries;
        this.builder = builder;
    }

    public Asg getOrBuild(String identity, String source, Language language) {
        String hash = contentHash(source);
        Entry fresh = new Entry(hash, language);
        Entry current = claim(identity, fresh);
        if (current == fresh) {
            build(identity, fresh, source, language);
        }
        current.touch(clock.incrementAndGet());
        return await(identity, current, source, language);
    }

    /** Same as {@link #getOrBuild} but runs a needed build on {@code executor}. */
    public CompletableFuture<Asg> getOrBuildAsync(String identity, String source, Language language, Executor executor) {
        String hash = contentHash(source);
        Entry fresh = new Entry(hash, language);
        Entry current = claim(identity, fresh);
        if (current == fresh) {
            try {
                executor.execute(() -> build(identity, fresh, source, language));
            } catch (RuntimeException e) {
                entries.remove(identity, fresh);
                fresh.future.completeExceptionally(e);
            }
        }
        current.touch(clock.incrementAndGet());
        // callers get their own view so cancelling it cannot complete the shared entry
        return current.future.copy();
    }

    public void invalidate(String identity) {
        entries.remove(identity);
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String identity, String contentHash) {
        Entry entry = entries.get(identity);
        return entry != null && entry.hash.equals(contentHash);
    }

    private Entry claim(String identity, Entry fresh) {
        return entries.compute(identity, (key, existing) ->
            existing != null && existing.hash.equals(fresh.hash) && existing.language == fresh.language
                && !existing.future.isCancelled()
                ? existing
                : fresh);
    }

    private void build(String identity, Entry entry, String source, Language language) {
        try {
            Asg built = builder.build(identity, entry.hash, source, language);
            if (!entry.future.complete(built)) {
                // cancelled while building
                entries.remove(identity, entry);
                return;
            }
        } catch (RuntimeException | Error e) {
            entries.remove(identity, entry);
            entry.future.completeExceptionally(e);
            return;
        }
        evictOverflow(identity);
    }

    /** Evicts completed entries only; builds in flight may leave the cache over capacity for a while. */
    private void evictOverflow(String keep) {
        while (entries.size() > maxEntries) {
            String victim = null;
            Entry victimEntry = null;
            for (Map.Entry<String, Entry> candidate : entries.entrySet()) {
                if (candidate.getKey().equals(keep)) continue;
                Entry entry = candidate.getValue();
                if (!entry.future.isDone()) continue;
                if (victimEntry == null || entry.lastAccess < victimEntry.lastAccess) {
                    victim = candidate.getKey();
                    victimEntry = entry;
                }
            }
            if (victim == null) return;
            if (entries.remove(victim, victimEntry)) {
                System.err.println("[asg-engine] Evicted " + victim + " from graph cache (capacity " + maxEntries + ")");
            }
        }
    }

    private Asg await(String identity, Entry entry, String source, Language language) {
        try {
            return entry.future.join();
        } catch (CancellationException e) {
            // a cancelled entry is dropped and the caller builds afresh
            entries.remove(identity, entry);
            return getOrBuild(identity, source, language);
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    public static String contentHash(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "sha256:" + HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class Entry {
        final String hash;
        final Language language;
        final CompletableFuture<Asg> future = new CompletableFuture<>();
        volatile long lastAccess;

        Entry(String hash, Language language) {
            this.hash = hash;
            this.language = language;
        }

        void touch(long tick) {
            lastAccess = tick;
        }
    }
}
