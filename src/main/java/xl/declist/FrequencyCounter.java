package xl.declist;

import java.util.List;

/**
 * Every occurrence of an n-gram counts once toward the document's class
 */
public class FrequencyCounter implements FeatureCounter
{
    private final NGramBuilder nGramBuilder = new NGramBuilder();

    @Override
    public void count(FeatureTable table, List<List<String>> sentences, boolean positive)
    {
        for (List<String> tokens : sentences)
        {
            for (String gram : nGramBuilder.unigramsAndBigrams(tokens))
            {
                table.lookupOrCreate(gram).incrementCount(positive);
            }
        }
    }

    @Override
    public CountingMode getMode()
    {
        return CountingMode.FREQUENCY;
    }
}
