package org.calista.chainhal.brain;

import java.io.IOException;

/**
 * A byte stream could not be decoded as a brain snapshot: wrong magic, wrong chain length
 * or a malformed chain record. A failed load never touches an existing brain.
 */
public final class BrainFormatException extends IOException {

    public BrainFormatException(String message) {
        super(message);
    }

    public BrainFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
