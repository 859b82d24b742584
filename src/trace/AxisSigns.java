package trace;

/**
 * Direction of the depth and rank axes for one orientation: +1 keeps the
 * layout coordinate, -1 mirrors it.
 */
public final class AxisSigns {

    public final int depthSign;
    public final int rankSign;

    public AxisSigns(int depthSign, int rankSign) {
        if (Math.abs(depthSign) != 1 || Math.abs(rankSign) != 1) {
            throw new IllegalArgumentException("Axis signs must be +1 or -1, got " + depthSign + "/" + rankSign);
        }
        this.depthSign = depthSign;
        this.rankSign = rankSign;
    }

    // "+ 0.0" folds -0.0 into 0.0
    public double applyDepth(double depth) {
        return depth * depthSign + 0.0;
    }

    public double applyRank(double rank) {
        return rank * rankSign + 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxisSigns)) return false;
        AxisSigns other = (AxisSigns) o;
        return depthSign == other.depthSign && rankSign == other.rankSign;
    }

    @Override
    public int hashCode() {
        return 31 * depthSign + rankSign;
    }

    @Override
    public String toString() {
        return "AxisSigns{depth=" + depthSign + ", rank=" + rankSign + "}";
    }
}
