package errors;

/**
 * A node breaks the input contract: it is reachable twice (cycle or shared
 * child), carries a negative branch length, or duplicates another node's name.
 */
public class MalformedNodeException extends LayoutException {

    public MalformedNodeException(String message) {
        super(message);
    }
}
