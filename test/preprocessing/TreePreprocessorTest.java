package preprocessing;

import static org.junit.Assert.*;
import static tree.TreeFixtures.list;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import errors.EmptyTreeException;
import errors.InvalidDisplayLevelException;
import errors.MalformedNodeException;
import tree.Tree;
import tree.TreeFixtures;
import tree.TreeNode;
import utils.Config;

public class TreePreprocessorTest {

    private final TreePreprocessor preprocessor = new TreePreprocessor();

    private static List<String> childNames(TreeNode node) {
        List<String> names = new ArrayList<>();
        for (TreeNode x : node.childs) {
            names.add(x.name);
        }
        return names;
    }

    /** (((A,B),(C,D)),E); with every internal node unnamed. */
    private static Tree deepTree() {
        Tree tree = new Tree();
        TreeNode n1 = tree.addInternalNode(list(tree.addLeaf("A", null), tree.addLeaf("B", null)));
        TreeNode n2 = tree.addInternalNode(list(tree.addLeaf("C", null), tree.addLeaf("D", null)));
        TreeNode n3 = tree.addInternalNode(list(n1, n2));
        tree.addInternalNode(list(n3, tree.addLeaf("E", null)));
        return tree;
    }

    @Test
    public void unnamedRootIsNamedRoot() {
        PreprocessedTree prepared = preprocessor.preprocess(TreeFixtures.threeLeafPolytomy(), Config.UNBOUNDED_DISPLAY_LEVEL);
        assertEquals("root", prepared.tree.root.name);
        assertFalse(prepared.hasUnclassified());
    }

    @Test
    public void unnamedLeavesAreNamedBeforeInternalNodes() {
        Tree tree = new Tree();
        TreeNode ab = tree.addInternalNode(list(tree.addLeaf("A", null), tree.addLeaf("B", null)));
        TreeNode blanks = tree.addInternalNode(list(tree.addLeaf(null, null), tree.addLeaf(null, null)));
        tree.addInternalNode(list(ab, blanks));

        Tree named = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL).tree;

        assertEquals(List.of("A", "B", "internal_1", "internal_2"), leafNames(named));
        assertEquals(List.of("internal_3", "internal_4"), childNames(named.root));
    }

    private static List<String> leafNames(Tree tree) {
        List<String> names = new ArrayList<>();
        for (TreeNode x : tree.getTerminals()) {
            names.add(x.name);
        }
        return names;
    }

    @Test
    public void namingRestartsForEveryRun() {
        Tree tree = TreeFixtures.unnamedInternals();
        String first = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL).tree.getNewickFormat();
        String second = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL).tree.getNewickFormat();
        assertEquals("((A,B)internal_1,(C,(D,E)internal_3)internal_2)root;", first);
        assertEquals(first, second);
    }

    @Test
    public void synthesizedNamesSkipExistingNames() {
        Tree tree = new Tree();
        tree.addInternalNode(list(tree.addLeaf("internal_1", null), tree.addLeaf(null, null)));
        Tree named = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL).tree;
        assertEquals(List.of("internal_1", "internal_2"), childNames(named.root));
    }

    @Test
    public void inputTreeIsNotModified() {
        Tree tree = TreeFixtures.withUnclassified();
        String before = tree.getNewickFormat();
        preprocessor.preprocess(tree, 1);
        assertEquals(before, tree.getNewickFormat());
        assertEquals(3, tree.root.childs.size());
    }

    @Test
    public void nodeNamedRootBecomesTheRoot() {
        Tree tree = new Tree();
        TreeNode x = tree.addLeaf("X", 4.0);
        TreeNode root = tree.addInternalNode("root", 2.0, list(tree.addLeaf("C", null), tree.addLeaf("D", null)));
        tree.addInternalNode(list(x, root));

        Tree prepared = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL).tree;

        assertEquals("root", prepared.root.name);
        assertNull(prepared.root.parent);
        assertEquals(List.of("C", "D"), childNames(prepared.root));
        assertNull(prepared.findByName("X"));
        assertEquals(3, prepared.size());
    }

    @Test
    public void unclassifiedChildrenAreSplicedIntoRoot() {
        PreprocessedTree prepared = preprocessor.preprocess(TreeFixtures.withUnclassified(), Config.UNBOUNDED_DISPLAY_LEVEL);

        assertEquals(List.of("A", "B", "X", "Y"), childNames(prepared.tree.root));
        assertTrue(prepared.hasUnclassified());
        assertEquals("unclassified", prepared.unclassified.name);
        assertTrue(prepared.unclassified.isLeaf());
        assertNull(prepared.tree.findByName("unclassified"));
        for (TreeNode child : prepared.tree.root.childs) {
            assertSame(prepared.tree.root, child.parent);
        }
    }

    @Test
    public void onlyDirectRootChildIsExtracted() {
        Tree tree = new Tree();
        TreeNode inner = tree.addInternalNode(list(
            tree.addLeaf("A", null),
            tree.addInternalNode("unclassified", null, list(tree.addLeaf("X", null)))));
        tree.addInternalNode(list(inner, tree.addLeaf("B", null)));

        PreprocessedTree prepared = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL);

        assertFalse(prepared.hasUnclassified());
        assertNotNull(prepared.tree.findByName("unclassified"));
    }

    @Test
    public void rootLeftWithoutChildrenBecomesALeaf() {
        Tree tree = new Tree();
        tree.addInternalNode("root", null, list(tree.addLeaf("unclassified", null)));

        PreprocessedTree prepared = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL);

        assertTrue(prepared.tree.root.isLeaf());
        assertEquals(1, prepared.tree.size());
        assertEquals("unclassified", prepared.unclassified.name);
    }

    @Test(expected = EmptyTreeException.class)
    public void treeWithoutRootIsEmpty() {
        preprocessor.preprocess(new Tree(), Config.UNBOUNDED_DISPLAY_LEVEL);
    }

    @Test
    public void pruningCutsChildrenAtDisplayLevel() {
        Tree tree = deepTree();
        Tree pruned = preprocessor.preprocess(tree, 2).tree;
        // n1 and n2 sit at level 2 and become leaves
        assertEquals("((internal_1,internal_2)internal_3,E)root;", pruned.getNewickFormat());
        assertEquals(5, pruned.size());
    }

    @Test
    public void pruningIsIdempotent() {
        Tree tree = deepTree();
        int first = preprocessor.prune(tree, 1);
        String once = tree.getNewickFormat();
        int second = preprocessor.prune(tree, 1);

        assertEquals(6, first);
        assertEquals(0, second);
        assertEquals(once, tree.getNewickFormat());
        assertEquals(3, tree.size());
    }

    @Test
    public void displayLevelZeroLeavesOnlyTheRoot() {
        Tree pruned = preprocessor.preprocess(deepTree(), 0).tree;
        assertTrue(pruned.root.isLeaf());
        assertEquals("root;", pruned.getNewickFormat());
    }

    @Test
    public void unboundedLevelKeepsEverything() {
        Tree tree = deepTree();
        assertEquals(0, preprocessor.prune(tree, Config.UNBOUNDED_DISPLAY_LEVEL));
        assertEquals(9, tree.size());
    }

    @Test
    public void negativeDisplayLevelIsRejected() {
        try {
            preprocessor.preprocess(deepTree(), -1);
            fail("negative display level accepted");
        } catch (InvalidDisplayLevelException e) {
            assertEquals(-1, e.getDisplayLevel());
        }
    }

    @Test(expected = MalformedNodeException.class)
    public void negativeBranchLengthIsRejected() {
        Tree tree = new Tree();
        tree.addInternalNode(list(tree.addLeaf("A", -1.0), tree.addLeaf("B", 1.0)));
        preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL);
    }

    @Test(expected = MalformedNodeException.class)
    public void infiniteBranchLengthIsRejected() {
        Tree tree = new Tree();
        tree.addInternalNode(list(tree.addLeaf("A", Double.POSITIVE_INFINITY), tree.addLeaf("B", 1.0)));
        preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL);
    }

    @Test
    public void deepLadderIsPrunedWithoutRecursion() {
        Tree tree = TreeFixtures.caterpillar(20000);
        Tree pruned = preprocessor.preprocess(tree, 3).tree;
        // levels 0..3 survive: root, two ladder steps, the step cut at level 3
        // and one leaf per level below the root
        assertEquals(4, pruned.getTerminals().size());
        assertEquals(7, pruned.size());
    }

    @Test(expected = MalformedNodeException.class)
    public void duplicateNamesAreRejected() {
        Tree tree = new Tree();
        tree.addInternalNode(list(tree.addLeaf("A", null), tree.addLeaf("A", null)));
        preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL);
    }

    @Test
    public void spacesInNamesBecomeUnderscores() {
        Tree tree = new Tree();
        tree.addInternalNode(list(tree.addLeaf("Homo sapiens", null), tree.addLeaf("Pan troglodytes", null)));
        Tree prepared = preprocessor.preprocess(tree, Config.UNBOUNDED_DISPLAY_LEVEL).tree;
        assertEquals("(Homo_sapiens,Pan_troglodytes)root;", prepared.getNewickFormat());
    }
}
