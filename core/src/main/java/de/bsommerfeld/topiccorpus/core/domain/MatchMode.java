package de.bsommerfeld.topiccorpus.core.domain;

/** How the include terms of a {@link FilterSpec} must match a post. */
public enum MatchMode {
    /** At least one term must occur. */
    ANY,
    /** Every term must occur. */
    ALL
}
