package axis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings of one screen axis of a tree figure, independent of any charting
 * library. The figure assembler copies these into its own axis objects.
 */
public class AxisLayout {

    public enum Role {
        DEPTH,
        RANK
    }

    public final String screenAxis;         // "x" or "y"
    public final Role role;
    public final int sign;

    public String type = "linear";
    public String ticks = "";
    public String mirror = "allticks";
    public String rangeMode = "tozero";
    public boolean showTickLabels = false;
    public boolean zeroLine = false;
    public boolean showGrid = false;
    public boolean showLine = false;

    // Only set on the axis carrying the leaf labels
    public String tickMode;
    public String side;
    public List<Double> tickValues = Collections.emptyList();
    public List<String> tickText = Collections.emptyList();
    public double[] range;

    public AxisLayout(String screenAxis, Role role, int sign){
        this.screenAxis = screenAxis;
        this.role = role;
        this.sign = sign;
    }

    /** True once tick positions have been set, which marks the label axis. */
    public boolean hasTicks(){
        return !tickValues.isEmpty();
    }

    /** Tick positions and the text shown at each, stored as read-only copies. */
    void setTicks(List<Double> values, List<String> text){
        this.tickValues = Collections.unmodifiableList(new ArrayList<>(values));
        this.tickText = Collections.unmodifiableList(new ArrayList<>(text));
    }

    @Override
    public String toString(){
        return screenAxis + "axis{" + role + ", sign=" + sign + ", ticks=" + tickText.size() + "}";
    }
}
