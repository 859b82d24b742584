package preprocessing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

import errors.EmptyTreeException;
import errors.InvalidDisplayLevelException;
import errors.MalformedNodeException;
import tree.Tree;
import tree.TreeNode;
import utils.Config;

/**
 * TreePreprocessor: normalizes a parsed tree before it is laid out.
 *
 * The preprocessor never touches the caller's tree. It works on a deep copy
 * and performs, in order:
 *
 * 1. Input validation (display level, branch lengths, shared or cyclic nodes)
 * 2. Name normalization (spaces become underscores)
 * 3. Root canonicalization: a node named "root" anywhere in the tree becomes
 *    the root, otherwise an unnamed structural root is named "root"
 * 4. Unclassified extraction: a root child named "unclassified" is removed
 *    and its children are appended to the root's children
 * 5. Depth pruning to the display level
 * 6. Synthetic names for the remaining unnamed nodes
 *
 * After preprocessing every node has a unique name, which is what the
 * coordinate engine keys its positions by.
 */
public class TreePreprocessor {

    /**
     * Runs all preprocessing steps on a private copy of {@code tree}.
     *
     * @param tree the parsed input tree, left unchanged
     * @param displayLevel deepest level kept (root is level 0), or
     *                     {@link Config#UNBOUNDED_DISPLAY_LEVEL}
     * @return the normalized copy and the extracted unclassified node, if any
     */
    public PreprocessedTree preprocess(Tree tree, int displayLevel){
        if(displayLevel < 0){
            throw new InvalidDisplayLevelException(displayLevel);
        }
        if(tree == null || tree.root == null){
            throw new EmptyTreeException("Tree has no root");
        }

        Tree copy = tree.copy();
        validateBranchLengths(copy);
        if(Config.REPLACE_SPACES_IN_NAMES){
            normalizeNames(copy);
        }

        canonicalizeRoot(copy);
        TreeNode unclassified = extractUnclassified(copy);

        int removed = prune(copy, displayLevel);
        if(removed > 0 && Config.VERBOSE){
            System.out.println("Pruned " + removed + " nodes below display level " + displayLevel);
        }

        assignNames(copy, unclassified, new NameCounter());
        checkUniqueNames(copy, unclassified);

        return new PreprocessedTree(copy, unclassified);
    }

    private void validateBranchLengths(Tree tree){
        for(var x : tree.nodes){
            if(x.branchLength == null) continue;
            if(!Double.isFinite(x.branchLength) || x.branchLength < 0){
                throw new MalformedNodeException("Node " + x + " has invalid branch length " + x.branchLength);
            }
        }
    }

    private void normalizeNames(Tree tree){
        for(var x : tree.nodes){
            if(x.name != null && x.name.indexOf(' ') >= 0){
                x.name = x.name.replace(' ', '_');
            }
        }
    }

    /**
     * Selects the designated root. Only the subtree below a node named
     * {@link Config#ROOT_NAME} is kept when such a node exists.
     */
    void canonicalizeRoot(Tree tree){
        TreeNode designated = tree.findByName(Config.ROOT_NAME);
        if(designated != null && designated != tree.root){
            int level = tree.getPath(designated).size();
            int before = tree.size();
            tree.setRoot(designated);
            System.err.println("Warning: re-rooted at node '" + Config.ROOT_NAME + "' (level " + level
                + "), dropping " + (before - tree.size()) + " nodes outside its clade");
        }
        if(!tree.root.hasName()){
            tree.root.setName(Config.ROOT_NAME);
        }
    }

    /**
     * Removes the first root child named {@link Config#UNCLASSIFIED_NAME},
     * splices its children into the root after the existing children, and
     * returns it without children. Returns null when there is none. A root
     * left without children stays in the tree as its only leaf.
     */
    TreeNode extractUnclassified(Tree tree){
        TreeNode root = tree.root;
        if(root.isLeaf()) return null;

        TreeNode unclassified = null;
        for(var child : root.childs){
            if(Config.UNCLASSIFIED_NAME.equals(child.name)){
                unclassified = child;
                break;
            }
        }
        if(unclassified == null) return null;

        root.childs.remove(unclassified);
        if(!unclassified.isLeaf()){
            for(var grandChild : unclassified.childs){
                grandChild.setParent(root);
                root.childs.add(grandChild);
            }
        }
        unclassified.setChilds(new ArrayList<>()).setParent(null);
        tree.reindex();
        return unclassified;
    }

    private int countDescendants(TreeNode clade){
        int count = 0;
        ArrayDeque<TreeNode> stack = new ArrayDeque<>();
        stack.push(clade);
        while(!stack.isEmpty()){
            TreeNode node = stack.pop();
            if(node.isLeaf()) continue;
            for(var child : node.childs){
                stack.push(child);
                count++;
            }
        }
        return count;
    }

    /**
     * Discards the children of every node at level {@code displayLevel} or
     * deeper; those nodes stay as leaves. Running it again with the same
     * level changes nothing.
     *
     * @return number of nodes removed
     */
    public int prune(Tree tree, int displayLevel){
        if(displayLevel < 0){
            throw new InvalidDisplayLevelException(displayLevel);
        }
        if(displayLevel == Config.UNBOUNDED_DISPLAY_LEVEL || tree.root == null){
            return 0;
        }
        int removed = 0;
        ArrayDeque<TreeNode> stack = new ArrayDeque<>();
        ArrayDeque<Integer> levels = new ArrayDeque<>();
        stack.push(tree.root);
        levels.push(0);
        while(!stack.isEmpty()){
            TreeNode clade = stack.pop();
            int level = levels.pop();
            if(clade.isLeaf()) continue;
            if(level >= displayLevel){
                removed += countDescendants(clade);
                clade.setChilds(new ArrayList<>());
                continue;
            }
            for(var child : clade.childs){
                stack.push(child);
                levels.push(level + 1);
            }
        }
        if(removed > 0){
            tree.reindex();
        }
        return removed;
    }

    /**
     * Names unnamed leaves first, in leaf order, then every other unnamed
     * node in level order.
     */
    void assignNames(Tree tree, TreeNode unclassified, NameCounter counter){
        for(var x : tree.nodes){
            if(x.hasName())
                counter.reserve(x.name);
        }
        if(unclassified != null){
            counter.reserve(unclassified.name);
        }
        for(var leaf : tree.getTerminals()){
            if(!leaf.hasName())
                leaf.setName(counter.next());
        }
        for(var x : tree.levelOrder()){
            if(!x.hasName())
                x.setName(counter.next());
        }
    }

    private void checkUniqueNames(Tree tree, TreeNode unclassified){
        Set<String> names = new HashSet<>();
        for(var x : tree.nodes){
            if(!names.add(x.name)){
                throw new MalformedNodeException("Duplicate node name '" + x.name + "'");
            }
        }
        if(unclassified != null && names.contains(unclassified.name)){
            throw new MalformedNodeException("Duplicate node name '" + unclassified.name + "'");
        }
    }
}
