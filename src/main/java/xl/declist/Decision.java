package xl.declist;

import java.util.Locale;

/**
 * One entry of a decision list.  During training it accumulates per-class counts for its feature until it is
 * scored; a decision read back from a list file only carries the feature and its classification.
 */
public class Decision
{
    private final String feature;
    private double positiveCount;
    private double negativeCount;
    private double logLikelihood;
    private boolean classification;
    private boolean scored;

    public Decision(String feature)
    {
        this.feature = feature;
    }

    public Decision(String feature, boolean classification)
    {
        this.feature = feature;
        this.classification = classification;
        this.scored = true;
    }

    public Decision(String feature, double logLikelihood, boolean classification)
    {
        this(feature, classification);
        this.logLikelihood = logLikelihood;
    }

    public String getFeature()
    {
        return feature;
    }

    public double getPositiveCount()
    {
        return positiveCount;
    }

    public double getNegativeCount()
    {
        return negativeCount;
    }

    public double getCount(boolean positive)
    {
        return positive ? positiveCount : negativeCount;
    }

    public void incrementCount(boolean positive)
    {
        if (positive)
        {
            positiveCount++;
        }
        else
        {
            negativeCount++;
        }
    }

    /**
     * Add the counts of another decision for the same feature to this one
     */
    public void mergeCount(Decision other)
    {
        if (!feature.equals(other.feature))
        {
            throw new IllegalArgumentException("Cannot merge counts of '" + other.feature + "' into '" + feature + "'");
        }
        positiveCount += other.positiveCount;
        negativeCount += other.negativeCount;
    }

    /**
     * Store a signed log-likelihood.  The class is taken from the sign first, and only then is the score
     * replaced by its magnitude.  A score of exactly zero is negative.
     */
    void setScore(double signedLogLikelihood)
    {
        if (scored)
        {
            throw new IllegalStateException("Decision for '" + feature + "' has already been scored");
        }
        classification = signedLogLikelihood > 0;
        logLikelihood = Math.abs(signedLogLikelihood);
        scored = true;
    }

    public boolean isScored()
    {
        return scored;
    }

    public double getLogLikelihood()
    {
        checkScored();
        return logLikelihood;
    }

    public boolean getClassification()
    {
        checkScored();
        return classification;
    }

    private void checkScored()
    {
        if (!scored)
        {
            throw new IllegalStateException("Decision for '" + feature + "' read before scoring");
        }
    }

    @Override
    public String toString()
    {
        return feature + "\t" + String.format(Locale.ROOT, "%.4f", logLikelihood) + "\t" + (classification ? 1 : 0);
    }
}
