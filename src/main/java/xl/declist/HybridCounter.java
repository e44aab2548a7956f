package xl.declist;

import java.util.List;

/**
 * Frequency counting with a per-document ceiling.  Sub-counts are kept in a table local to the document and
 * summed into the global table afterwards.  A cap of 1 behaves like {@link PresenceCounter}.
 */
public class HybridCounter implements FeatureCounter
{
    private final NGramBuilder nGramBuilder = new NGramBuilder();
    private final int cap;

    public HybridCounter(int cap)
    {
        if (cap < 1)
        {
            throw new IllegalArgumentException("Cap must be at least 1, got " + cap);
        }
        this.cap = cap;
    }

    public int getCap()
    {
        return cap;
    }

    @Override
    public void count(FeatureTable table, List<List<String>> sentences, boolean positive)
    {
        FeatureTable local = new FeatureTable();
        for (List<String> tokens : sentences)
        {
            for (String gram : nGramBuilder.unigramsAndBigrams(tokens))
            {
                Decision decision = local.lookupOrCreate(gram);
                if (decision.getCount(positive) < cap)
                {
                    decision.incrementCount(positive);
                }
            }
        }

        for (Decision decision : local.decisions())
        {
            table.merge(decision);
        }
    }

    @Override
    public CountingMode getMode()
    {
        return CountingMode.HYBRID;
    }
}
