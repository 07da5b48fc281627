package de.bsommerfeld.topiccorpus.core.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.domain.Post;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Writes a finalized corpus as newline-delimited JSON, one post per line.
 * Field order is fixed: id, subreddit, created_utc, title, selftext, url,
 * upvotes, num_comments, source, fetched_at.
 */
@Singleton
public class CorpusWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusWriter.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Replaces {@code target} with the given posts. Missing parent
     * directories are created.
     */
    public void write(List<Post> posts, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Post post : posts) {
                writer.write(toJsonLine(post));
                writer.newLine();
            }
        }
        LOG.info("Wrote {} posts to {}", posts.size(), target);
    }

    String toJsonLine(Post post) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", post.id());
        node.put("subreddit", post.subreddit());
        node.put("created_utc", post.createdUtc());
        node.put("title", post.title());
        node.put("selftext", post.selftext());
        node.put("url", post.url());
        node.put("upvotes", post.upvotes());
        node.put("num_comments", post.numComments());
        node.put("source", post.source());
        node.put("fetched_at", formatInstant(post.fetchedAt()));
        return mapper.writeValueAsString(node);
    }

    /** ISO-8601 UTC with second precision, e.g. {@code 2024-05-01T12:00:00Z}. */
    static String formatInstant(Instant instant) {
        if (instant == null) {
            return null;
        }
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
