package xl.declist;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds word n-grams from one sentence's tokens.  Every window is yielded, repeats included.
 */
public class NGramBuilder
{
    public static final int MAX_ORDER = 2;

    public List<String> build(List<String> tokens, int n)
    {
        if (n < 1 || n > MAX_ORDER)
        {
            throw new IllegalArgumentException("Unsupported n-gram order: " + n);
        }
        List<String> grams = new ArrayList<String>();
        for (int i = 0, sz = tokens.size(); i <= sz - n; ++i)
        {
            StringBuilder sb = new StringBuilder(tokens.get(i));
            for (int j = 1; j < n; ++j)
            {
                sb.append(' ').append(tokens.get(i + j));
            }
            grams.add(sb.toString());
        }
        return grams;
    }

    /**
     * All unigrams in order, followed by all bigrams in order
     */
    public List<String> unigramsAndBigrams(List<String> tokens)
    {
        List<String> grams = build(tokens, 1);
        grams.addAll(build(tokens, 2));
        return grams;
    }
}
