package de.bsommerfeld.topiccorpus.core.corpus;

import de.bsommerfeld.topiccorpus.core.domain.Post;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates posts across passes, keyed by id. The first post seen for an
 * id is kept and insertion order is preserved. Merging is synchronized so
 * that independent fetches may feed one corpus from several threads.
 */
public class Corpus {

    private final Map<String, Post> posts = new LinkedHashMap<>();

    /**
     * Adds every post whose id is not present yet.
     *
     * @return number of posts actually added
     */
    public synchronized int merge(Collection<Post> incoming) {
        int added = 0;
        for (Post post : incoming) {
            if (post.id() != null && posts.putIfAbsent(post.id(), post) == null) {
                added++;
            }
        }
        return added;
    }

    public synchronized int size() {
        return posts.size();
    }

    /** Immutable copy of the current contents in accumulation order. */
    public synchronized List<Post> snapshot() {
        return List.copyOf(new ArrayList<>(posts.values()));
    }
}
