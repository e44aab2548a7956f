package xl.declist;

import java.util.List;

/**
 * Folds the n-grams of one tokenized document into the global feature table.  One counter governs a whole
 * training run, see {@link Trainer#counterFor(String, DecisionListConfig)}.
 */
public interface FeatureCounter
{
    enum CountingMode { FREQUENCY, PRESENCE, HYBRID }

    /**
     * @param table     The global feature table
     * @param sentences Filtered, negation-tagged tokens of each sentence of the document
     * @param positive  The known class of the document
     */
    void count(FeatureTable table, List<List<String>> sentences, boolean positive);

    CountingMode getMode();
}
