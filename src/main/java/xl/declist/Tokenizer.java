package xl.declist;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits raw review text into sentences and sentences into tokens, dropping stop tokens and applying
 * negation scoping per sentence.  Tokens are kept as-is: no case folding, no stemming.
 */
public class Tokenizer
{
    // Split after sentence-final punctuation, leaving it on the sentence it ends
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.?!])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Set<String> stopTokens;
    private final NegationScoper negationScoper;

    public Tokenizer(DecisionListConfig config)
    {
        this(config.getStopTokens(), new NegationScoper());
    }

    public Tokenizer(Set<String> stopTokens, NegationScoper negationScoper)
    {
        this.stopTokens = stopTokens;
        this.negationScoper = negationScoper;
    }

    public List<String> sentences(String text)
    {
        List<String> sentences = new ArrayList<String>();
        for (String sentence : SENTENCE_END.split(text))
        {
            if (!sentence.trim().isEmpty())
            {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    /**
     * Whitespace-split a sentence and drop the stop tokens.  No negation handling is done here.
     */
    public List<String> tokens(String sentence)
    {
        List<String> tokens = new ArrayList<String>();
        for (String token : WHITESPACE.split(sentence))
        {
            if (!token.isEmpty() && !stopTokens.contains(token))
            {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Full preprocessing of one document
     *
     * @param text Raw text of the document
     * @return One filtered, negation-tagged token list per sentence
     */
    public List<List<String>> tokenize(String text)
    {
        List<List<String>> tokenized = new ArrayList<List<String>>();
        for (String sentence : sentences(text))
        {
            List<String> tokens = tokens(sentence);
            negationScoper.scope(tokens);
            tokenized.add(tokens);
        }
        return tokenized;
    }

    /**
     * Render a document the way the classifier searches it: all sentences joined by single spaces, with a
     * space on either end so that a padded feature can only match whole tokens.
     */
    public String flatten(String text)
    {
        StringBuilder sb = new StringBuilder(" ");
        for (List<String> sentence : tokenize(text))
        {
            for (String token : sentence)
            {
                sb.append(token).append(' ');
            }
        }
        return sb.toString();
    }
}
