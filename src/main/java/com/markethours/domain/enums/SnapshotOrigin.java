package com.markethours.domain.enums;

/**
 * Where the currently published calendar snapshot came from.
 *
 * <p>EMPTY and BOOTSTRAP are only seen before the first successful refresh has ever been
 * committed; queries then fall back to the regular weekday rules (plus any configured
 * bootstrap holidays).
 */
public enum SnapshotOrigin {
    EMPTY,
    BOOTSTRAP,
    STORE,
    REFRESH
}
