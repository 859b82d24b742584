package preprocessing;

import tree.Tree;
import tree.TreeNode;

/**
 * Normalized private copy of an input tree, plus the unclassified clade set
 * aside from it (null when the root had none).
 */
public class PreprocessedTree {

    public final Tree tree;
    public final TreeNode unclassified;

    public PreprocessedTree(Tree tree, TreeNode unclassified){
        this.tree = tree;
        this.unclassified = unclassified;
    }

    public boolean hasUnclassified(){
        return unclassified != null;
    }
}
