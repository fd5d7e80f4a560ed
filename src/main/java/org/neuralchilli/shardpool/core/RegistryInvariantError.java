package org.neuralchilli.shardpool.core;

/**
 * The registry's own index is inconsistent.
 * Not meant to be caught: continuing would operate on a corrupted index.
 */
public class RegistryInvariantError extends Error {

    public RegistryInvariantError(String message) {
        super(message);
    }
}
