package trace;

/**
 * Margin of the figure the root is drawn against.
 *
 * LEFT and RIGHT draw depth along the screen x-axis and rank along y;
 * TOP and BOTTOM transpose the two.
 */
public enum Orientation {
    TOP(false, -1),
    RIGHT(true, -1),
    BOTTOM(false, 1),
    LEFT(true, 1);

    private final boolean depthOnX;
    private final AxisSigns signs;

    Orientation(boolean depthOnX, int depthSign) {
        this.depthOnX = depthOnX;
        this.signs = new AxisSigns(depthSign, 1);
    }

    public boolean isDepthOnX() {
        return depthOnX;
    }

    public AxisSigns getSigns() {
        return signs;
    }

    public static Orientation fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid orientation '" + value + "', expected one of top, right, bottom, left", e);
        }
    }
}
