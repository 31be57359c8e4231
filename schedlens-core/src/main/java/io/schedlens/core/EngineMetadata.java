package io.schedlens.core;

import java.time.Instant;

/**
 * Engine-level facts reported alongside a snapshot.
 *
 * @param runningSince null when the engine has never been started
 */
public record EngineMetadata(
        boolean remote,
        int jobsExecuted,
        Instant runningSince,
        String schedulerType
) {
}
