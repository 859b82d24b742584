package errors;

public class InvalidDisplayLevelException extends LayoutException {

    private final int displayLevel;

    public InvalidDisplayLevelException(int displayLevel) {
        super("Display level must be non-negative, got " + displayLevel);
        this.displayLevel = displayLevel;
    }

    public int getDisplayLevel() {
        return displayLevel;
    }
}
