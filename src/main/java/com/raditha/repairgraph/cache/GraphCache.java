package com.raditha.repairgraph.cache;

import com.raditha.repairgraph.cfg.BlockPolicy;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.ProgramGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Built graphs keyed by a SHA-256 digest of (kind, block policy, source). Safe to share between
 * batch workers: a graph is published only once its build completed, and a build that throws
 * leaves nothing behind, so the next request builds again.
 */
public class GraphCache {
    private static final Logger logger = LoggerFactory.getLogger(GraphCache.class);

    private final ConcurrentMap<String, ProgramGraph> graphs = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Builds one graph. May fail with a build exception.
     */
    @FunctionalInterface
    public interface GraphSupplier {
        ProgramGraph build() throws GraphBuildException;
    }

    /**
     * The cached graph for this source, building it if absent.
     *
     * @param source text identifying the input; file paths should be part of it when they
     *               appear in the graph
     * @throws GraphBuildException if the build fails; nothing is cached in that case
     */
    public ProgramGraph get(GraphKind kind, BlockPolicy policy, String source, GraphSupplier builder)
            throws GraphBuildException {
        String key = key(kind, policy, source);
        ProgramGraph cached = graphs.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        try {
            return graphs.computeIfAbsent(key, k -> {
                misses.incrementAndGet();
                try {
                    return builder.build();
                } catch (GraphBuildException e) {
                    throw new BuildFailure(e);
                }
            });
        } catch (BuildFailure failure) {
            logger.debug("Not caching failed {} build: {}", kind, failure.getCause().getMessage());
            throw (GraphBuildException) failure.getCause();
        }
    }

    public int size() {
        return graphs.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void clear() {
        graphs.clear();
    }

    static String key(GraphKind kind, BlockPolicy policy, String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(kind.key().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(policy.name().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(source.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Carries a checked build failure out of the mapping function.
     */
    private static final class BuildFailure extends RuntimeException {
        BuildFailure(GraphBuildException cause) {
            super(cause);
        }
    }
}
