package axis;

import java.util.ArrayList;
import java.util.List;

import core.LayoutResult;
import trace.AxisSigns;

/**
 * Builds the two axis settings of a tree figure from a layout result.
 *
 * The rank axis gets one tick per leaf label, placed at the leaf's signed
 * rank, shown on the right-hand side, and an inverted range so the first
 * leaf is drawn at the top. The depth axis is left bare.
 */
public class AxisLayoutBuilder {

    public static final String LABEL_SIDE = "right";

    public static class FigureAxes {
        public final AxisLayout xAxis;
        public final AxisLayout yAxis;

        FigureAxes(AxisLayout xAxis, AxisLayout yAxis){
            this.xAxis = xAxis;
            this.yAxis = yAxis;
        }

        public AxisLayout depthAxis(){
            return xAxis.role == AxisLayout.Role.DEPTH ? xAxis : yAxis;
        }

        public AxisLayout rankAxis(){
            return xAxis.role == AxisLayout.Role.RANK ? xAxis : yAxis;
        }
    }

    public FigureAxes build(LayoutResult result){
        AxisSigns signs = result.getAxisSigns();
        boolean depthOnX = result.getOrientation().isDepthOnX();

        AxisLayout depthAxis = new AxisLayout(depthOnX ? "x" : "y", AxisLayout.Role.DEPTH, signs.depthSign);
        AxisLayout rankAxis = new AxisLayout(depthOnX ? "y" : "x", AxisLayout.Role.RANK, signs.rankSign);

        List<String> labels = result.getOrderedLabels();
        if(!labels.isEmpty()){
            List<Double> tickValues = new ArrayList<>(labels.size());
            for(double rank : result.getLeafRanks()){
                tickValues.add(signs.applyRank(rank));
            }
            rankAxis.setTicks(tickValues, labels);
            rankAxis.tickMode = "array";
            rankAxis.side = LABEL_SIDE;
            rankAxis.showTickLabels = true;
            rankAxis.range = new double[]{ labels.size() + 1, -1 };
        }

        return depthOnX ? new FigureAxes(depthAxis, rankAxis) : new FigureAxes(rankAxis, depthAxis);
    }
}
