package utils;

import trace.Orientation;

/**
 * Configuration class for tree layout settings.
 * This class holds the default parameters used when a layout call does not pass its own.
 */
public class Config {

    /**
     * Display level meaning "do not prune"
     */
    public static final int UNBOUNDED_DISPLAY_LEVEL = Integer.MAX_VALUE;

    /**
     * Maximum tree level to display (root is level 0)
     */
    public static int DISPLAY_LEVEL = UNBOUNDED_DISPLAY_LEVEL;

    /**
     * Margin the root is drawn against
     */
    public static Orientation ORIENTATION = Orientation.RIGHT;

    /**
     * Length used for branches without an explicit length
     */
    public static double DEFAULT_BRANCH_LENGTH = 1.0;

    /**
     * Prefix of the names synthesized for unnamed nodes
     */
    public static String INTERNAL_NAME_PREFIX = "internal_";

    /**
     * Name that designates the root, and the name given to an unnamed root
     */
    public static String ROOT_NAME = "root";

    /**
     * Name of the root-level clade drawn detached from the tree
     */
    public static String UNCLASSIFIED_NAME = "unclassified";

    /**
     * Whether spaces inside node names are turned into underscores
     */
    public static boolean REPLACE_SPACES_IN_NAMES = true;

    /**
     * Print progress information to standard output
     */
    public static boolean VERBOSE = false;
}
