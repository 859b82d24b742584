package core;

import java.util.ArrayList;
import java.util.List;

import trace.AxisSigns;
import trace.Orientation;
import trace.Primitive;
import tree.Tree;
import tree.TreeNode;

/**
 * TraceEmitter: turns a positioned tree into drawable primitives.
 *
 * Nodes are visited in level order. Each node yields a marker, and each
 * parent to child edge yields an elbow made of two segments: one along the
 * rank axis at the parent's depth, one along the depth axis at the child's
 * rank. The orientation decides which screen axis carries depth and mirrors
 * it through {@link AxisSigns}.
 */
public class TraceEmitter {

    private final Orientation orientation;
    private final AxisSigns signs;

    public TraceEmitter(Orientation orientation){
        this.orientation = orientation;
        this.signs = orientation.getSigns();
    }

    private double screenX(double depth, double rank){
        return orientation.isDepthOnX() ? signs.applyDepth(depth) : signs.applyRank(rank);
    }

    private double screenY(double depth, double rank){
        return orientation.isDepthOnX() ? signs.applyRank(rank) : signs.applyDepth(depth);
    }

    private Primitive.NodeMarker marker(double depth, double rank, String label, boolean isLeaf){
        return new Primitive.NodeMarker(screenX(depth, rank), screenY(depth, rank), label, isLeaf);
    }

    private Primitive.BranchSegment segment(double depth0, double rank0, double depth1, double rank1){
        return new Primitive.BranchSegment(screenX(depth0, rank0), screenY(depth0, rank0),
                                           screenX(depth1, rank1), screenY(depth1, rank1));
    }

    /**
     * Emits the primitives of {@code tree}, then the detached marker of the
     * unclassified node if one was extracted.
     *
     * @param positions depth and rank of every node of {@code tree}; left
     *                  unchanged
     * @param unclassified node set aside by preprocessing, or null; its
     *                     position is added to the result's positions
     */
    public LayoutResult emit(Tree tree, NodePositions positions, TreeNode unclassified){
        List<Primitive> primitives = new ArrayList<>();
        List<String> orderedLabels = new ArrayList<>();
        List<String> leafNames = new ArrayList<>();

        for(var leaf : tree.getTerminals()){
            leafNames.add(leaf.name);
            orderedLabels.add(leaf.name);
        }

        for(var node : tree.levelOrder()){
            double depth = positions.depth(node.name);
            double rank = positions.rank(node.name);
            primitives.add(marker(depth, rank, node.name, node.isLeaf()));

            if(node.isLeaf()) continue;
            for(var child : node.childs){
                double childDepth = positions.depth(child.name);
                double childRank = positions.rank(child.name);
                primitives.add(segment(depth, rank, depth, childRank));
                primitives.add(segment(depth, childRank, childDepth, childRank));
            }
        }

        NodePositions placed = new NodePositions(positions);
        if(unclassified != null){
            double rank = positions.rank(tree.root.name) - 1;
            placed.put(unclassified.name, 0.0, rank);
            primitives.add(marker(0.0, rank, unclassified.name, true));
            orderedLabels.add(unclassified.name);
            leafNames.add(unclassified.name);
        }

        return new LayoutResult(primitives, orderedLabels, leafNames, orientation, placed);
    }
}
