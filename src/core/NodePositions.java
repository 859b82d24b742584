package core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Depth (x) and rank (y) of every node, keyed by node name.
 *
 * Values are layout coordinates: depth grows away from the root and rank
 * counts leaf slots from 0. Orientation is applied only when primitives are
 * emitted.
 */
public class NodePositions {

    private final Map<String, Double> xByName = new LinkedHashMap<>();
    private final Map<String, Double> yByName = new LinkedHashMap<>();

    public NodePositions(){
    }

    /** Independent copy of {@code other}. */
    public NodePositions(NodePositions other){
        xByName.putAll(other.xByName);
        yByName.putAll(other.yByName);
    }

    /** Records both coordinates of a node, replacing earlier values. */
    public void put(String name, double depth, double rank){
        xByName.put(name, depth);
        yByName.put(name, rank);
    }

    public void putDepth(String name, double depth){
        xByName.put(name, depth);
    }

    public void putRank(String name, double rank){
        yByName.put(name, rank);
    }

    /**
     * Depth of the named node.
     *
     * @throws IllegalStateException if no depth was recorded for it
     */
    public double depth(String name){
        Double depth = xByName.get(name);
        if(depth == null){
            throw new IllegalStateException("No depth computed for node '" + name + "'");
        }
        return depth;
    }

    /**
     * Rank of the named node.
     *
     * @throws IllegalStateException if no rank was recorded for it
     */
    public double rank(String name){
        Double rank = yByName.get(name);
        if(rank == null){
            throw new IllegalStateException("No rank computed for node '" + name + "'");
        }
        return rank;
    }

    /** True when both coordinates of the node are known. */
    public boolean contains(String name){
        return xByName.containsKey(name) && yByName.containsKey(name);
    }

    /** Read-only view of the depths, in insertion order. */
    public Map<String, Double> getXByName(){
        return Collections.unmodifiableMap(xByName);
    }

    /** Read-only view of the ranks, in insertion order. */
    public Map<String, Double> getYByName(){
        return Collections.unmodifiableMap(yByName);
    }

    public int size(){
        return xByName.size();
    }
}
