package core;

import preprocessing.PreprocessedTree;
import preprocessing.TreePreprocessor;
import trace.Orientation;
import tree.Tree;
import utils.Config;

/**
 * Entry point of the layout: preprocess, position, emit.
 *
 * Each call works on its own copy of the tree with its own name counter and
 * position maps, so the same parsed tree can be laid out repeatedly or from
 * several threads at once with identical results.
 */
public class PhylogeneticTreeLayout {

    private final TreePreprocessor preprocessor = new TreePreprocessor();
    private final CoordinateEngine engine = new CoordinateEngine();

    public LayoutResult layout(Tree tree){
        return layout(tree, Config.DISPLAY_LEVEL, Config.ORIENTATION);
    }

    public LayoutResult layout(Tree tree, int displayLevel){
        return layout(tree, displayLevel, Config.ORIENTATION);
    }

    public LayoutResult layout(Tree tree, int displayLevel, Orientation orientation){
        long startTime = System.nanoTime();

        PreprocessedTree prepared = preprocessor.preprocess(tree, displayLevel);
        NodePositions positions = engine.computePositions(prepared.tree);
        LayoutResult result = new TraceEmitter(orientation).emit(prepared.tree, positions, prepared.unclassified);

        if(Config.VERBOSE){
            double duration = (System.nanoTime() - startTime) / 1_000_000.0;
            System.out.println("Laid out " + prepared.tree.size() + " nodes, "
                + result.getLeafNames().size() + " leaves"
                + (prepared.hasUnclassified() ? " (including '" + prepared.unclassified.name + "')" : "")
                + (prepared.tree.checkIfNonBinary() ? ", polytomies present" : "")
                + ", orientation " + orientation + " in " + duration + " ms");
        }
        return result;
    }
}
