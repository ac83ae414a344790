package de.mirkosertic.mcp.papersearch.store;

import java.io.IOException;

/**
 * Thrown when the persisted paper index is missing, unreadable or inconsistent.
 * Without a loaded corpus the server cannot start.
 */
public class StoreLoadException extends IOException {

    public StoreLoadException(final String message) {
        super(message);
    }

    public StoreLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
