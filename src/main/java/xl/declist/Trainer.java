package xl.declist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Learns a decision list from labeled reviews.  Every document is tokenized, negation-scoped and counted before
 * any feature is scored; scoring and sorting happen once, after the last document.
 */
public class Trainer
{
    private static final Logger log = LoggerFactory.getLogger(Trainer.class);

    private final Tokenizer tokenizer;
    private final FeatureCounter counter;
    private final LogLikelihoodScorer scorer;

    private long numPositiveTrainingExamples = 0;
    private long numNegativeTrainingExamples = 0;

    public Trainer(DecisionListConfig config, FeatureCounter counter, LogLikelihoodScorer scorer)
    {
        this(new Tokenizer(config), counter, scorer);
    }

    public Trainer(Tokenizer tokenizer, FeatureCounter counter, LogLikelihoodScorer scorer)
    {
        this.tokenizer = tokenizer;
        this.counter = counter;
        this.scorer = scorer;
    }

    public static FeatureCounter counterFor(String mode, DecisionListConfig config)
    {
        return counterFor(FeatureCounter.CountingMode.valueOf(mode.toUpperCase()), config);
    }

    public static FeatureCounter counterFor(FeatureCounter.CountingMode mode, DecisionListConfig config)
    {
        log.info("Using " + mode.toString() + " feature counting");
        switch (mode)
        {
            case FREQUENCY:
                return new FrequencyCounter();
            case HYBRID:
                return new HybridCounter(config.getHybridCap());
            default:
                return new PresenceCounter();
        }
    }

    /**
     * Get the total number of training examples seen
     */
    public long getNumTrainingExamples()
    {
        return numPositiveTrainingExamples + numNegativeTrainingExamples;
    }

    public long getNumPositiveTrainingExamples()
    {
        return numPositiveTrainingExamples;
    }

    public long getNumNegativeTrainingExamples()
    {
        return numNegativeTrainingExamples;
    }

    /**
     * Count the features of every document in the corpus
     */
    public FeatureTable count(Iterator<Document> corpus)
    {
        FeatureTable table = new FeatureTable();
        long start = System.currentTimeMillis();
        while (corpus.hasNext())
        {
            Document document = corpus.next();
            boolean positive = document.isPositive();
            if (positive)
            {
                numPositiveTrainingExamples++;
            }
            else
            {
                numNegativeTrainingExamples++;
            }
            counter.count(table, tokenizer.tokenize(document.getText()), positive);
        }
        double seconds = (System.currentTimeMillis() - start) / 1000.0;
        log.info(String.format("%d features from %d documents (%d positive, %d negative), counted in %.02fs",
                table.size(), getNumTrainingExamples(), numPositiveTrainingExamples, numNegativeTrainingExamples,
                seconds));
        return table;
    }

    /**
     * Score a fully counted table and sort it into a decision list
     */
    public DecisionList score(FeatureTable table)
    {
        scorer.scoreAll(table);
        return DecisionList.sortedFrom(table.decisions());
    }

    public DecisionList train(Iterator<Document> corpus)
    {
        return score(count(corpus));
    }
}
