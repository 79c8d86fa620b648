package com.expecta.analyzer.engine;

import java.util.Optional;

/**
 * Word to initial packet lookup. Implementations may compile their packets
 * lazily and raise {@link ErrorKind#MALFORMED_REQUEST} for a badly shaped
 * definition at lookup time.
 */
@FunctionalInterface
public interface Lexicon {
    Optional<Packet> lookup(String word);
}
