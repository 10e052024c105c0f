package org.fluxgen.config;

/**
 * What generation does when a block turns out to be cyclic. Both policies log a warning.
 */
public enum CyclePolicy {
    /** Fail the whole definition with a cyclic-block error. */
    ABORT,
    /** Leave the cyclic block empty, record an error diagnostic and keep going. */
    SKIP_BLOCK
}
