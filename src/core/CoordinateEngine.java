package core;

import java.util.List;

import errors.EmptyTreeException;
import tree.Tree;
import tree.TreeNode;

/**
 * CoordinateEngine: assigns a depth and a rank to every node of a
 * preprocessed tree.
 *
 * The layout is leaf-anchored:
 *
 * 1. Leaves are ranked 0, 1, 2, ... in the order a depth-first traversal
 *    reaches them, which fixes their visual order.
 * 2. The depth of a node is the sum of the branch lengths on the path from
 *    the root down to it, its own incoming edge included. Missing lengths
 *    count as 1, explicit zeros stay 0. The root sits at depth 0.
 * 3. In post order, an internal node's rank is the plain mean of its
 *    children's ranks, whatever their number or subtree sizes.
 *
 * Nodes are looked up by name, so the tree must have gone through
 * {@link preprocessing.TreePreprocessor} first.
 */
public class CoordinateEngine {

    public NodePositions computePositions(Tree tree){
        if(tree == null || tree.root == null){
            throw new EmptyTreeException("Tree has no root");
        }

        NodePositions positions = new NodePositions();

        List<TreeNode> terminals = tree.getTerminals();
        if(terminals.isEmpty()){
            throw new EmptyTreeException("Tree has no leaves to lay out");
        }
        for(int idx = 0; idx < terminals.size(); ++idx){
            positions.putRank(terminals.get(idx).name, idx);
        }

        // Level order visits parents first, so the parent's depth is the
        // path sum up to it.
        for(var node : tree.levelOrder()){
            if(node == tree.root){
                positions.putDepth(node.name, 0.0);
            }
            else{
                positions.putDepth(node.name, positions.depth(node.parent.name) + node.getBranchLengthOrDefault());
            }
        }

        for(var node : tree.postOrder()){
            if(node.isLeaf()) continue;
            double sum = 0;
            for(var child : node.childs){
                sum += positions.rank(child.name);
            }
            positions.putRank(node.name, sum / node.childs.size());
        }

        return positions;
    }
}
