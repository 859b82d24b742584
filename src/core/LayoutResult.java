package core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import trace.AxisSigns;
import trace.Orientation;
import trace.Primitive;

/**
 * Output of one layout run, handed to whatever assembles the figure.
 *
 * {@code orderedLabels} and {@code leafNames} always have the same length
 * and order; an unclassified pseudo-leaf, when present, is their last entry.
 */
public class LayoutResult {

    private final List<Primitive> primitives;
    private final List<String> orderedLabels;
    private final List<String> leafNames;
    private final Orientation orientation;
    private final NodePositions positions;

    public LayoutResult(List<Primitive> primitives, List<String> orderedLabels, List<String> leafNames,
                        Orientation orientation, NodePositions positions) {
        if (orderedLabels.size() != leafNames.size()) {
            throw new IllegalArgumentException("Labels and leaves differ in length: "
                    + orderedLabels.size() + " vs " + leafNames.size());
        }
        this.primitives = Collections.unmodifiableList(new ArrayList<>(primitives));
        this.orderedLabels = Collections.unmodifiableList(new ArrayList<>(orderedLabels));
        this.leafNames = Collections.unmodifiableList(new ArrayList<>(leafNames));
        this.orientation = orientation;
        this.positions = new NodePositions(positions);
    }

    public List<Primitive> getPrimitives() {
        return primitives;
    }

    public List<String> getOrderedLabels() {
        return orderedLabels;
    }

    public List<String> getLeafNames() {
        return leafNames;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public AxisSigns getAxisSigns() {
        return orientation.getSigns();
    }

    /**
     * Layout-space positions (unsigned), including the unclassified node if
     * any. Each call returns a fresh copy.
     */
    public NodePositions getPositions() {
        return new NodePositions(positions);
    }

    /**
     * Rank of each entry of {@link #getLeafNames()}, in the same order.
     * These are the tick positions of the label axis before the sign is applied.
     */
    public List<Double> getLeafRanks() {
        List<Double> ranks = new ArrayList<>(leafNames.size());
        for (String leaf : leafNames) {
            ranks.add(positions.rank(leaf));
        }
        return ranks;
    }

    public List<Primitive.NodeMarker> getMarkers() {
        List<Primitive.NodeMarker> markers = new ArrayList<>();
        for (Primitive p : primitives) {
            if (p instanceof Primitive.NodeMarker) {
                markers.add((Primitive.NodeMarker) p);
            }
        }
        return markers;
    }

    public List<Primitive.BranchSegment> getSegments() {
        List<Primitive.BranchSegment> segments = new ArrayList<>();
        for (Primitive p : primitives) {
            if (p instanceof Primitive.BranchSegment) {
                segments.add((Primitive.BranchSegment) p);
            }
        }
        return segments;
    }
}
