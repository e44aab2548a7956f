package xl.declist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the class counts of a feature into a log-likelihood (base 2) of positive over negative evidence.
 * Must only run once counting has finished, and only once per decision.
 */
public class LogLikelihoodScorer
{
    private static final Logger log = LoggerFactory.getLogger(LogLikelihoodScorer.class);

    private static final double LN_2 = Math.log(2);

    public enum Smoothing
    {
        /**
         * Add one to the empty side only, leaving features seen in both classes unsmoothed
         */
        LAPLACE,
        /**
         * Set the empty side to one and replace the other count c by (c - 1)^2 + 1, so features seen only
         * a couple of times get little confidence while frequent ones are barely affected
         */
        SQUARED
    }

    private final Smoothing smoothing;

    public LogLikelihoodScorer()
    {
        this(Smoothing.LAPLACE);
    }

    public LogLikelihoodScorer(Smoothing smoothing)
    {
        this.smoothing = smoothing;
    }

    public Smoothing getSmoothing()
    {
        return smoothing;
    }

    static double log2(double x)
    {
        return Math.log(x) / LN_2;
    }

    /**
     * The signed score; positive means the feature favours the positive class
     */
    public double signedScore(double positiveCount, double negativeCount)
    {
        if (smoothing == Smoothing.SQUARED)
        {
            return squared(positiveCount, negativeCount);
        }

        double total;
        if (positiveCount == 0)
        {
            total = 1 + negativeCount + 1;
            return log2((1 / total) / ((negativeCount + 1) / total));
        }
        if (negativeCount == 0)
        {
            total = positiveCount + 1 + 1;
            return log2(((positiveCount + 1) / total) / (1 / total));
        }
        total = positiveCount + negativeCount;
        return log2((positiveCount / total) / (negativeCount / total));
    }

    private double squared(double positiveCount, double negativeCount)
    {
        double pos = positiveCount;
        double neg = negativeCount;
        if (pos == 0)
        {
            pos = 1;
            neg = Math.pow(neg - 1, 2) + 1;
        }
        else if (neg == 0)
        {
            pos = Math.pow(pos - 1, 2) + 1;
            neg = 1;
        }
        double total = pos + neg;
        return log2((pos / total) / (neg / total));
    }

    public void score(Decision decision)
    {
        double signed = signedScore(decision.getPositiveCount(), decision.getNegativeCount());
        decision.setScore(signed);
    }

    public void scoreAll(FeatureTable table)
    {
        for (Decision decision : table.decisions())
        {
            score(decision);
        }
        log.info("Scored {} features with {} smoothing", table.size(), smoothing);
    }
}
