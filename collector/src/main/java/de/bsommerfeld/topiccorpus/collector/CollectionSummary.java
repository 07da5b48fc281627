package de.bsommerfeld.topiccorpus.collector;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one acquisition run.
 *
 * @param communities communities scanned
 * @param strategies  number of keyword strategies used
 * @param rawCount    unique posts gathered before filtering
 * @param finalCount  posts written
 * @param output      corpus file
 */
public record CollectionSummary(List<String> communities, int strategies, int rawCount, int finalCount,
        Path output) {

    public CollectionSummary {
        communities = List.copyOf(communities);
    }
}
