package fr.lapetina.hotswap.domain.model;

import java.util.Locale;

/**
 * One of the two fixed process identities a model name can run as.
 */
public enum SlotId {
    A,
    B;

    /**
     * Returns the opposite slot.
     */
    public SlotId other() {
        return this == A ? B : A;
    }

    /**
     * Lowercase form used in supervisor group names and slot directories.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
