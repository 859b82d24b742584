package tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import errors.MalformedNodeException;

/**
 * Tree: rooted, possibly multifurcating phylogenetic tree consumed by the layout.
 *
 * Trees are materialized by an external Newick parser through the
 * {@link #addLeaf(String, Double)} / {@link #addInternalNode(ArrayList)} API,
 * the same bottom-up way gene trees are assembled elsewhere in the project:
 * children are created first, then grouped under a new internal node, and
 * the last node created becomes the root.
 *
 * Besides construction, the tree exposes the traversals the layout relies on:
 * 1. Level order (breadth-first, root first)
 * 2. Post order (children before their parent)
 * 3. Terminals in depth-first order, which fixes the visual order of leaves
 * 4. Path from the root to a node, used for cumulative branch lengths
 *
 * Every traversal refuses to visit a node twice, so a cycle or a node shared
 * between two parents is reported as a {@link MalformedNodeException}.
 */
public class Tree {

    public ArrayList<TreeNode> nodes;               // All nodes in tree (internal + leaves)
    public TreeNode root;                           // Root node of the tree

    public Tree(){
        nodes = new ArrayList<>();
    }

    public TreeNode addNode(ArrayList<TreeNode> children, TreeNode parent){
        TreeNode nd = new TreeNode().setIndex(nodes.size()).setChilds(children).setParent(parent);
        nodes.add(nd);
        root = nd;
        return nd;
    }

    /**
     * Creates a new internal node grouping the given children, in order.
     */
    public TreeNode addInternalNode(ArrayList<TreeNode> children){
        var nd = addNode(children, null);
        for (var x : children)
            x.setParent(nd);
        return nd;
    }

    /**
     * Creates a named internal node with the given incoming branch length.
     */
    public TreeNode addInternalNode(String name, Double branchLength, ArrayList<TreeNode> children){
        return addInternalNode(children).setName(name).setBranchLength(branchLength);
    }

    /**
     * Creates a leaf. A null branch length means the length is missing.
     */
    public TreeNode addLeaf(String name, Double branchLength){
        return addNode(new ArrayList<>(), null).setName(name).setBranchLength(branchLength);
    }

    public int size(){
        return nodes.size();
    }

    /**
     * Nodes in breadth-first order, root first, children in their given order.
     * A node reached a second time raises {@link MalformedNodeException}.
     */
    public List<TreeNode> levelOrder(){
        List<TreeNode> order = new ArrayList<>();
        if(root == null) return order;

        Set<TreeNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ArrayDeque<TreeNode> queue = new ArrayDeque<>();
        queue.add(root);
        seen.add(root);
        while(!queue.isEmpty()){
            TreeNode node = queue.poll();
            order.add(node);
            if(node.isLeaf()) continue;
            for(var child : node.childs){
                if(!seen.add(child)){
                    throw new MalformedNodeException("Node " + child + " is reachable more than once (below " + node + ")");
                }
                queue.add(child);
            }
        }
        return order;
    }

    /**
     * Nodes in post order: every node comes after all of its descendants.
     * Walks with an explicit stack, so deep ladder-shaped trees are fine.
     */
    public List<TreeNode> postOrder(){
        List<TreeNode> order = new ArrayList<>();
        if(root == null) return order;

        Set<TreeNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ArrayDeque<TreeNode> stack = new ArrayDeque<>();
        ArrayDeque<Integer> nextChild = new ArrayDeque<>();
        seen.add(root);
        stack.push(root);
        nextChild.push(0);
        while(!stack.isEmpty()){
            TreeNode node = stack.peek();
            int i = nextChild.pop();
            if(!node.isLeaf() && i < node.childs.size()){
                nextChild.push(i + 1);
                TreeNode child = node.childs.get(i);
                if(!seen.add(child)){
                    throw new MalformedNodeException("Node " + child + " is reachable more than once (below " + node + ")");
                }
                stack.push(child);
                nextChild.push(0);
            }
            else{
                stack.pop();
                order.add(node);
            }
        }
        return order;
    }

    /**
     * Leaves in the order a depth-first traversal reaches them.
     */
    public List<TreeNode> getTerminals(){
        List<TreeNode> terminals = new ArrayList<>();
        for(var x : postOrder()){
            if(x.isLeaf())
                terminals.add(x);
        }
        return terminals;
    }

    /**
     * Ancestor chain from the first node below the root down to and
     * including {@code node}. The path of the root itself is empty.
     */
    public List<TreeNode> getPath(TreeNode node){
        ArrayList<TreeNode> path = new ArrayList<>();
        TreeNode curr = node;
        while(curr != null && curr != root){
            path.add(curr);
            if(path.size() > nodes.size()){
                throw new MalformedNodeException("Cyclic parentage detected above node " + node);
            }
            curr = curr.parent;
        }
        if(curr == null){
            throw new MalformedNodeException("Node " + node + " is not attached to the root");
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * First node with the given name in level order, or null.
     */
    public TreeNode findByName(String name){
        for(var x : levelOrder()){
            if(name.equals(x.name))
                return x;
        }
        return null;
    }

    /**
     * Makes {@code newRoot} the root of this tree, detaching it from its
     * parent and dropping everything outside its subtree.
     */
    public void setRoot(TreeNode newRoot){
        if(newRoot.parent != null){
            newRoot.parent.childs.remove(newRoot);
            newRoot.parent = null;
        }
        this.root = newRoot;
        reindex();
    }

    /**
     * Rebuilds the node list from the root after structural edits, so that
     * {@link #nodes} holds exactly the reachable nodes, indexed in level order.
     */
    public void reindex(){
        List<TreeNode> order = levelOrder();
        nodes = new ArrayList<>(order.size());
        for(var x : order){
            x.setIndex(nodes.size());
            nodes.add(x);
            if(!x.isLeaf()){
                for(var child : x.childs)
                    child.setParent(x);
            }
        }
    }

    /**
     * Deep copy of the tree. Edits on the copy never reach this tree.
     */
    public Tree copy(){
        Tree copy = new Tree();
        if(root == null) return copy;

        // post order creates every child before its parent
        Map<TreeNode, TreeNode> copies = new IdentityHashMap<>();
        for(var node : postOrder()){
            ArrayList<TreeNode> children = new ArrayList<>();
            if(!node.isLeaf()){
                for(var x : node.childs)
                    children.add(copies.get(x));
            }
            copies.put(node, copy.addInternalNode(children).setName(node.name).setBranchLength(node.branchLength));
        }
        copy.root = copies.get(root);
        copy.reindex();
        return copy;
    }

    private static String formatLength(double length){
        if(length == Math.rint(length) && !Double.isInfinite(length))
            return Long.toString((long) length);
        return Double.toString(length);
    }

    private void appendLabel(StringBuilder sb, TreeNode node){
        if(node.hasName())
            sb.append(node.name);
        if(node.branchLength != null)
            sb.append(':').append(formatLength(node.branchLength));
    }

    /**
     * Newick text of the tree: names and {@code :length} suffixes, integral
     * lengths without a fraction.
     */
    public String getNewickFormat(){
        if(root == null) return "";

        StringBuilder sb = new StringBuilder();
        Set<TreeNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ArrayDeque<TreeNode> stack = new ArrayDeque<>();
        ArrayDeque<Integer> nextChild = new ArrayDeque<>();
        seen.add(root);
        stack.push(root);
        nextChild.push(0);
        while(!stack.isEmpty()){
            TreeNode node = stack.peek();
            int i = nextChild.pop();
            if(!node.isLeaf() && i < node.childs.size()){
                sb.append(i == 0 ? '(' : ',');
                nextChild.push(i + 1);
                TreeNode child = node.childs.get(i);
                if(!seen.add(child)){
                    throw new MalformedNodeException("Node " + child + " is reachable more than once (below " + node + ")");
                }
                stack.push(child);
                nextChild.push(0);
            }
            else{
                stack.pop();
                if(!node.isLeaf())
                    sb.append(')');
                appendLabel(sb, node);
            }
        }
        return sb.append(';').toString();
    }

    /**
     * True when some node has more than two children.
     */
    public boolean checkIfNonBinary(){
        for(var x : nodes){
            if(x.childCount() > 2)
                return true;
        }
        return false;
    }
}
