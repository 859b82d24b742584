package errors;

/**
 * No leaves remain to lay out after root selection, unclassified extraction
 * and pruning.
 */
public class EmptyTreeException extends LayoutException {

    public EmptyTreeException(String message) {
        super(message);
    }
}
