package tree;

import java.util.ArrayList;

import utils.Config;

/**
 * TreeNode: a single clade of a phylogenetic tree.
 *
 * A node carries an optional name, an optional branch length (the weight of
 * the edge to its parent) and an ordered list of children. Leaves are the
 * nodes without children; the flag is structural and never stored.
 */
public class TreeNode {

    public int index;                       // Position in the owning tree's node list
    public String name;                     // null until named by the parser or the preprocessor
    public Double branchLength;             // null means "missing", counted as the default length
    public ArrayList<TreeNode> childs;      // null or empty for leaves
    public TreeNode parent;

    public TreeNode setIndex(int index){
        this.index = index;
        return this;
    }

    public TreeNode setName(String name){
        this.name = name;
        return this;
    }

    public TreeNode setBranchLength(Double branchLength){
        this.branchLength = branchLength;
        return this;
    }

    public TreeNode setChilds(ArrayList<TreeNode> childs){
        this.childs = childs;
        return this;
    }

    public TreeNode setParent(TreeNode parent){
        this.parent = parent;
        return this;
    }

    public boolean isLeaf(){
        return childs == null || childs.isEmpty();
    }

    public boolean isRoot(){
        return parent == null;
    }

    public boolean hasName(){
        return name != null && !name.isEmpty();
    }

    /**
     * Branch length used for layout: an explicit 0 stays 0, a missing
     * length counts as {@link Config#DEFAULT_BRANCH_LENGTH}.
     */
    public double getBranchLengthOrDefault(){
        return branchLength != null ? branchLength : Config.DEFAULT_BRANCH_LENGTH;
    }

    public int childCount(){
        return childs == null ? 0 : childs.size();
    }

    @Override
    public String toString(){
        return hasName() ? name : "#" + index;
    }
}
