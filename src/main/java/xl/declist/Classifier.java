package xl.declist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classifies documents with a decision list: the class of the highest-ranked feature found in the document
 * wins.  Documents with no matching feature get the configured default class.
 */
public class Classifier
{
    private static final Logger log = LoggerFactory.getLogger(Classifier.class);

    private final DecisionList decisionList;
    private final Tokenizer tokenizer;
    private final boolean defaultClassification;

    private long defaulted = 0;

    public Classifier(DecisionList decisionList, DecisionListConfig config)
    {
        this(decisionList, new Tokenizer(config), config.getDefaultClassification());
    }

    public Classifier(DecisionList decisionList, Tokenizer tokenizer, boolean defaultClassification)
    {
        this.decisionList = decisionList;
        this.tokenizer = tokenizer;
        this.defaultClassification = defaultClassification;
    }

    /**
     * Number of documents so far that matched no feature
     */
    public long getDefaulted()
    {
        return defaulted;
    }

    /**
     * Find the first decision whose feature occurs in the document
     *
     * @param paddedDocument Preprocessed document text, see {@link Tokenizer#flatten(String)}
     * @return The matching decision, or null if none matches
     */
    public Decision firstMatch(String paddedDocument)
    {
        for (Decision decision : decisionList)
        {
            if (paddedDocument.contains(" " + decision.getFeature() + " "))
            {
                return decision;
            }
        }
        return null;
    }

    public boolean classify(String paddedDocument)
    {
        Decision decision = firstMatch(paddedDocument);
        if (decision == null)
        {
            defaulted++;
            return defaultClassification;
        }
        return decision.getClassification();
    }

    /**
     * Preprocess raw review text and classify it
     */
    public boolean classifyText(String text)
    {
        return classify(tokenizer.flatten(text));
    }

    /**
     * Classify every document, keeping input order in the result
     */
    public Map<String, Boolean> classifyAll(Iterable<Document> documents)
    {
        long start = System.currentTimeMillis();
        Map<String, Boolean> labels = new LinkedHashMap<String, Boolean>();
        for (Document document : documents)
        {
            labels.put(document.getId(), classifyText(document.getText()));
        }
        double seconds = (System.currentTimeMillis() - start) / 1000.0;
        log.info(String.format("Classified %d documents in %.02fs, %d fell through to the default class",
                labels.size(), seconds, defaulted));
        return labels;
    }

    public DecisionList getDecisionList()
    {
        return decisionList;
    }
}
