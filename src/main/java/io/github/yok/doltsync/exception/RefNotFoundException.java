package io.github.yok.doltsync.exception;

import lombok.Getter;

/**
 * A commit, branch or tag reference could not be resolved. Fatal.
 */
@Getter
public class RefNotFoundException extends SyncException {

    private static final long serialVersionUID = 1L;

    private final String ref;

    /**
     * Creates an exception.
     *
     * @param ref unresolvable reference
     * @param cause driver error
     */
    public RefNotFoundException(String ref, Throwable cause) {
        super("Commit reference not found: " + ref, cause);
        this.ref = ref;
    }

    /**
     * Creates an exception with a custom message.
     *
     * @param ref unresolvable reference
     * @param message detail message
     */
    public RefNotFoundException(String ref, String message) {
        super(message);
        this.ref = ref;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
