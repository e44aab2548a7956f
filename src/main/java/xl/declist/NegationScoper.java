package xl.declist;

import java.util.List;

/**
 * Marks the tokens following a negation cue with a {@code NOT_} prefix, up to the end of the sentence.
 * Only the first cue in a sentence opens a scope; later cues are tagged like any other token.
 */
public class NegationScoper
{
    public static final String NEGATION_PREFIX = "NOT_";

    public static boolean isCue(String token)
    {
        return "not".equals(token) || token.endsWith("n't");
    }

    /**
     * Rewrite one sentence's tokens in place.  The list must belong to the caller alone.
     *
     * @param tokens filtered tokens of a single sentence
     * @return the index of the cue that opened the scope, or -1 if the sentence has none
     */
    public int scope(List<String> tokens)
    {
        // A cue in last position has nothing to scope over
        for (int i = 0, sz = tokens.size(); i < sz - 1; ++i)
        {
            if (isCue(tokens.get(i)))
            {
                for (int j = i + 1; j < sz; ++j)
                {
                    tokens.set(j, NEGATION_PREFIX + tokens.get(j));
                }
                return i;
            }
        }
        return -1;
    }
}
