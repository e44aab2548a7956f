package xl.declist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Decisions ordered by descending log-likelihood.  The order is both the file order and the order in which the
 * classifier tries the features.  Never modified once built.
 */
public class DecisionList implements Iterable<Decision>
{
    private static final Comparator<Decision> BY_LIKELIHOOD_DESCENDING = new Comparator<Decision>()
    {
        @Override
        public int compare(Decision o1, Decision o2)
        {
            return Double.compare(o2.getLogLikelihood(), o1.getLogLikelihood());
        }
    };

    private final List<Decision> decisions;

    private DecisionList(List<Decision> decisions)
    {
        this.decisions = Collections.unmodifiableList(decisions);
    }

    /**
     * Sort scored decisions.  Collections.sort is stable, so ties keep their arrival order.
     */
    public static DecisionList sortedFrom(Collection<Decision> scored)
    {
        List<Decision> sorted = new ArrayList<Decision>(scored);
        Collections.sort(sorted, BY_LIKELIHOOD_DESCENDING);
        return new DecisionList(sorted);
    }

    /**
     * Wrap decisions that are already in priority order, e.g. read back from a list file
     */
    public static DecisionList inOrder(List<Decision> ordered)
    {
        return new DecisionList(new ArrayList<Decision>(ordered));
    }

    public int size()
    {
        return decisions.size();
    }

    public Decision get(int i)
    {
        return decisions.get(i);
    }

    public List<Decision> asList()
    {
        return decisions;
    }

    /**
     * The leading decisions whose log-likelihood is at least the threshold
     */
    public List<Decision> aboveThreshold(double threshold)
    {
        List<Decision> kept = new ArrayList<Decision>();
        for (Decision decision : decisions)
        {
            if (decision.getLogLikelihood() < threshold)
            {
                break;
            }
            kept.add(decision);
        }
        return kept;
    }

    @Override
    public Iterator<Decision> iterator()
    {
        return decisions.iterator();
    }
}
