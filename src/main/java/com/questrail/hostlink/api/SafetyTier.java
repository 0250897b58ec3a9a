package com.questrail.hostlink.api;

/**
 * SafetyTier
 * -----------------------------------------------------------------------------
 * Declares which transports may legally carry a command.
 *
 * <p>Every registered command makes this decision explicitly. There is no
 * default tier.</p>
 *
 * <h2>Choosing a tier</h2>
 * A command may be {@link #LOSSY_ELIGIBLE} only if repeated application
 * converges regardless of which intermediate submissions are dropped:
 * <ul>
 *   <li>idempotent, last-write-wins value setters</li>
 *   <li>reversible toggles</li>
 *   <li>trigger-style fires</li>
 * </ul>
 * Everything else is {@link #NEVER_LOSSY}: creation and deletion, any query that
 * returns a value, transport control (record/play/stop), undo/redo and anything
 * with an unrecoverable side effect.
 */
public enum SafetyTier
{
    NEVER_LOSSY,
    LOSSY_ELIGIBLE;

    /**
     * Returns {@code true} if a command of this tier may be executed when it
     * arrived over the given transport.
     */
    public boolean permits(Transport transport) {
        return transport == Transport.RELIABLE || this == LOSSY_ELIGIBLE;
    }
}
