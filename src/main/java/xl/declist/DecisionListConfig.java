package xl.declist;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable settings shared by training, list emission and inference.  Training and testing must
 * use the same stop tokens or the features they produce will not line up.
 */
public final class DecisionListConfig
{
    public static final Set<String> DEFAULT_STOP_TOKENS = Collections.unmodifiableSet(new LinkedHashSet<String>(
            Arrays.asList("a", "an", "the", "to", "of", "and",
                    ".", ",", "'", "\"", ";", ":", "-", "(", ")", "&")));

    // Nothing we have tested against reaches past this point in the list
    public static final double DEFAULT_THRESHOLD = 2.5;

    public static final int DEFAULT_HYBRID_CAP = 2;

    public static final int DEFAULT_FEATURE_WIDTH = 40;

    public static final boolean DEFAULT_CLASSIFICATION = false;

    public static final DecisionListConfig DEFAULT = new DecisionListConfig(DEFAULT_STOP_TOKENS, DEFAULT_THRESHOLD,
            DEFAULT_HYBRID_CAP, DEFAULT_FEATURE_WIDTH, DEFAULT_CLASSIFICATION);

    private final Set<String> stopTokens;
    private final double threshold;
    private final int hybridCap;
    private final int featureWidth;
    private final boolean defaultClassification;

    public DecisionListConfig(Set<String> stopTokens, double threshold, int hybridCap, int featureWidth,
                              boolean defaultClassification)
    {
        if (hybridCap < 1)
        {
            throw new IllegalArgumentException("Hybrid cap must be at least 1, got " + hybridCap);
        }
        this.stopTokens = Collections.unmodifiableSet(new LinkedHashSet<String>(stopTokens));
        this.threshold = threshold;
        this.hybridCap = hybridCap;
        this.featureWidth = featureWidth;
        this.defaultClassification = defaultClassification;
    }

    public Set<String> getStopTokens()
    {
        return stopTokens;
    }

    /**
     * Minimum log-likelihood a decision needs to be written to the list file
     */
    public double getThreshold()
    {
        return threshold;
    }

    /**
     * Maximum contribution of one document to a feature count under hybrid counting
     */
    public int getHybridCap()
    {
        return hybridCap;
    }

    public int getFeatureWidth()
    {
        return featureWidth;
    }

    /**
     * Class assigned to a document when no feature in the list matches it
     */
    public boolean getDefaultClassification()
    {
        return defaultClassification;
    }

    public DecisionListConfig withThreshold(double threshold)
    {
        return new DecisionListConfig(stopTokens, threshold, hybridCap, featureWidth, defaultClassification);
    }

    public DecisionListConfig withHybridCap(int hybridCap)
    {
        return new DecisionListConfig(stopTokens, threshold, hybridCap, featureWidth, defaultClassification);
    }

    public DecisionListConfig withDefaultClassification(boolean defaultClassification)
    {
        return new DecisionListConfig(stopTokens, threshold, hybridCap, featureWidth, defaultClassification);
    }
}
