package trace;

/**
 * Drawable element of a laid out tree, in screen coordinates.
 *
 * The set of primitives is closed: a {@link NodeMarker} for every node and a
 * {@link BranchSegment} for each half of an elbow connector. The private
 * constructor keeps other subclasses out, and {@link Visitor} gives consumers
 * an exhaustive dispatch over both kinds.
 */
public abstract class Primitive {

    private Primitive() {
    }

    public interface Visitor<R> {
        R visitNodeMarker(NodeMarker marker);

        R visitBranchSegment(BranchSegment segment);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Marker at a node position. Leaves show their label permanently,
     * internal nodes only as hover text.
     */
    public static final class NodeMarker extends Primitive {

        public final double x;
        public final double y;
        public final String label;
        public final boolean isLeaf;

        public NodeMarker(double x, double y, String label, boolean isLeaf) {
            this.x = x;
            this.y = y;
            this.label = label;
            this.isLeaf = isLeaf;
        }

        /** Text drawn next to the marker, or null for internal nodes. */
        public String getVisibleText() {
            return isLeaf ? label : null;
        }

        public String getHoverText() {
            return label;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNodeMarker(this);
        }

        @Override
        public String toString() {
            return "NodeMarker{" + label + " @ (" + x + ", " + y + ")" + (isLeaf ? ", leaf" : "") + "}";
        }
    }

    /**
     * Straight segment from (x0, y0) to (x1, y1). Always axis-parallel.
     */
    public static final class BranchSegment extends Primitive {

        public final double x0;
        public final double y0;
        public final double x1;
        public final double y1;

        public BranchSegment(double x0, double y0, double x1, double y1) {
            this.x0 = x0;
            this.y0 = y0;
            this.x1 = x1;
            this.y1 = y1;
        }

        public boolean isHorizontal() {
            return y0 == y1;
        }

        public boolean isVertical() {
            return x0 == x1;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBranchSegment(this);
        }

        @Override
        public String toString() {
            return "BranchSegment{(" + x0 + ", " + y0 + ") -> (" + x1 + ", " + y1 + ")}";
        }
    }
}
