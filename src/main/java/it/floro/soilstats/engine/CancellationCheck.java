package it.floro.soilstats.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Predicato di cancellazione cooperativa, interrogato tra una riga e l'altra
 * e tra un raster e l'altro.
 */
@FunctionalInterface
public interface CancellationCheck {

    /** Nessuna cancellazione. */
    CancellationCheck NEVER = () -> false;

    boolean shouldStop();

    /**
     * Cancellazione a scadenza: segnala lo stop quando il timeout è trascorso.
     * Un timeout nullo, zero o negativo equivale a {@link #NEVER}.
     */
    static CancellationCheck deadline(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return NEVER;
        }
        Instant deadline = clock.instant().plus(timeout);
        return () -> !clock.instant().isBefore(deadline);
    }
}
