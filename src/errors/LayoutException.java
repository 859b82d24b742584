package errors;

/**
 * Base class of every failure raised while laying out a tree.
 *
 * Layout runs are deterministic, so none of these are retried: any of them
 * aborts the run and no partial result is produced.
 */
public class LayoutException extends RuntimeException {

    public LayoutException(String message) {
        super(message);
    }
}
