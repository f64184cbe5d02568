package software.amazon.ahocorasick;

import java.io.IOException;

/**
 * Thrown when a persisted automaton is structurally inconsistent: truncated, not gzip, or carrying counts or state ids
 * that cannot describe a valid automaton.
 */
public class CorruptAutomatonException extends IOException {

    public CorruptAutomatonException(String msg) {
        super(msg);
    }

    public CorruptAutomatonException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
