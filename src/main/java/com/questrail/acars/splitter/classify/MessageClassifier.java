package com.questrail.acars.splitter.classify;

import java.util.Optional;

/**
 * MessageClassifier
 * -----------------------------------------------------------------------------
 * Pure text transform from one reassembled message to its classification key.
 *
 * <p>Implementations are stateless and deterministic: the same message text
 * always yields the same key. They carry no lifecycle and are safe to call from
 * any thread.</p>
 *
 * <p>An empty result means "no key could be extracted"; the router sends such
 * messages to the unclassified bucket.</p>
 */
@FunctionalInterface
public interface MessageClassifier
{
    Optional<String> classify(String message);
}
