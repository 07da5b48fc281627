package de.bsommerfeld.topiccorpus.core.corpus;

import de.bsommerfeld.topiccorpus.core.domain.Post;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CorpusTest {

    @Test
    void merge_shouldKeepFirstOccurrence() {
        var corpus = new Corpus();

        assertEquals(2, corpus.merge(List.of(post("a", "community"), post("b", "community"))));
        assertEquals(1, corpus.merge(List.of(post("a", "keyword"), post("c", "keyword"))));

        List<Post> snapshot = corpus.snapshot();
        assertEquals(List.of("a", "b", "c"), snapshot.stream().map(Post::id).toList());
        assertEquals("community", snapshot.get(0).source());
    }

    @Test
    void merge_shouldSkipPostsWithoutId() {
        var corpus = new Corpus();

        assertEquals(0, corpus.merge(List.of(post(null, "x"))));
        assertEquals(0, corpus.size());
    }

    @Test
    void snapshot_shouldBeImmutable() {
        var corpus = new Corpus();
        corpus.merge(List.of(post("a", "x")));

        assertThrows(UnsupportedOperationException.class, () -> corpus.snapshot().add(post("b", "x")));
    }

    @Test
    void merge_shouldStayUniqueUnderConcurrentWriters() throws Exception {
        var corpus = new Corpus();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 4; t++) {
                pool.submit(() -> {
                    start.await();
                    List<Post> batch = new ArrayList<>();
                    for (int i = 0; i < 500; i++) {
                        batch.add(post("id-" + i, "x"));
                    }
                    return corpus.merge(batch);
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        List<Post> snapshot = corpus.snapshot();
        assertEquals(500, snapshot.size());
        assertEquals(500, new HashSet<>(snapshot.stream().map(Post::id).toList()).size());
    }

    static Post post(String id, String source) {
        return new Post(id, "r/test", 1_700_000_000L, "title " + id, "", "https://example.org/" + id,
                10, 0, source, Instant.EPOCH);
    }
}
