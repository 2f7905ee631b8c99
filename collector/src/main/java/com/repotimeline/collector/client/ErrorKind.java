package com.repotimeline.collector.client;

/**
 * Structural classification of a collection failure.
 */
public enum ErrorKind {

    /** The identity or repository does not exist on the platform. */
    NOT_FOUND,

    /** The platform signalled quota exhaustion. */
    RATE_LIMITED,

    /** Any other HTTP or network failure, including timeouts. */
    PROVIDER_ERROR,

    /** A run produced no usable repository series. */
    NO_DATA
}
