package xl.declist;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counts documents rather than occurrences: each distinct n-gram of a document adds exactly one to its class
 * count, once the whole document has been seen.
 */
public class PresenceCounter implements FeatureCounter
{
    private final NGramBuilder nGramBuilder = new NGramBuilder();

    @Override
    public void count(FeatureTable table, List<List<String>> sentences, boolean positive)
    {
        Set<String> present = new LinkedHashSet<String>();
        for (List<String> tokens : sentences)
        {
            present.addAll(nGramBuilder.unigramsAndBigrams(tokens));
        }

        for (String feature : present)
        {
            table.lookupOrCreate(feature).incrementCount(positive);
        }
    }

    @Override
    public CountingMode getMode()
    {
        return CountingMode.PRESENCE;
    }
}
