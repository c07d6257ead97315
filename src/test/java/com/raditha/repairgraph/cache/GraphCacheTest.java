package com.raditha.repairgraph.cache;

import com.raditha.repairgraph.cfg.BlockPolicy;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.SourcePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GraphCacheTest {

    private GraphCache cache;
    private ProgramGraph graph;

    @BeforeEach
    void setUp() {
        cache = new GraphCache();
        graph = ProgramGraph.builder(GraphKind.CFG, "cached").build();
    }

    @Test
    void testSecondRequestIsAHit() throws GraphBuildException {
        GraphCache.GraphSupplier builder = mock(GraphCache.GraphSupplier.class);
        when(builder.build()).thenReturn(graph);

        assertSame(graph, cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "int f() {}", builder));
        assertSame(graph, cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "int f() {}", builder));

        verify(builder, times(1)).build();
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
        assertEquals(1, cache.size());
    }

    @Test
    void testKeyIncludesKindPolicyAndSource() throws GraphBuildException {
        GraphCache.GraphSupplier builder = mock(GraphCache.GraphSupplier.class);
        when(builder.build()).thenReturn(graph);

        cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "a", builder);
        cache.get(GraphKind.DFG, BlockPolicy.STATEMENT, "a", builder);
        cache.get(GraphKind.CFG, BlockPolicy.BASIC_BLOCK, "a", builder);
        cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "b", builder);

        verify(builder, times(4)).build();
        assertEquals(4, cache.size());
        assertNotEquals(GraphCache.key(GraphKind.CFG, BlockPolicy.STATEMENT, "ab"),
                GraphCache.key(GraphKind.CFG, BlockPolicy.STATEMENT, "a\u0000b"));
        assertEquals(64, GraphCache.key(GraphKind.CPG, BlockPolicy.STATEMENT, "").length());
    }

    @Test
    void testFailedBuildIsNotCached() throws GraphBuildException {
        GraphCache.GraphSupplier builder = mock(GraphCache.GraphSupplier.class);
        GraphBuildException failure = new GraphBuildException("boom", GraphKind.CFG, SourcePosition.UNKNOWN);
        when(builder.build()).thenThrow(failure).thenReturn(graph);

        GraphBuildException thrown = assertThrows(GraphBuildException.class,
                () -> cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "src", builder));
        assertSame(failure, thrown);
        assertEquals(0, cache.size());

        assertSame(graph, cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "src", builder));
        verify(builder, times(2)).build();
    }

    @Test
    void testClear() throws GraphBuildException {
        cache.get(GraphKind.CFG, BlockPolicy.STATEMENT, "src", () -> graph);
        cache.clear();

        assertEquals(0, cache.size());
    }

    @Test
    void testConcurrentRequestsBuildOnce() throws Exception {
        AtomicInteger builds = new AtomicInteger();
        GraphCache.GraphSupplier slow = () -> {
            builds.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return graph;
        };

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ProgramGraph>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> cache.get(GraphKind.DFG, BlockPolicy.STATEMENT, "shared", slow));
            }
            for (Future<ProgramGraph> future : pool.invokeAll(tasks)) {
                assertSame(graph, future.get());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, builds.get());
        assertEquals(1, cache.misses());
    }
}
