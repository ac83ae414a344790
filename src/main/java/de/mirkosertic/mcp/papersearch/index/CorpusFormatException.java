package de.mirkosertic.mcp.papersearch.index;

import java.io.IOException;

/**
 * Thrown when the corpus cannot be turned into an index: unexpected top-level shape,
 * or a record without a valid, unique id. The build is aborted before anything is written.
 */
public class CorpusFormatException extends IOException {

    public CorpusFormatException(final String message) {
        super(message);
    }

    public CorpusFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
