package xl.declist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature string to decision mapping built up over a training run.  Arrival order is kept so the stable sort
 * breaks ties the same way on every run.
 */
public class FeatureTable
{
    private final Map<String, Decision> decisions = new LinkedHashMap<String, Decision>();

    public Decision lookupOrCreate(String feature)
    {
        Decision decision = decisions.get(feature);
        if (decision == null)
        {
            decision = new Decision(feature);
            decisions.put(feature, decision);
        }
        return decision;
    }

    public Decision get(String feature)
    {
        return decisions.get(feature);
    }

    public boolean contains(String feature)
    {
        return decisions.containsKey(feature);
    }

    /**
     * Fold a document-local decision into the table, taking it over if the feature is new
     */
    public void merge(Decision local)
    {
        Decision existing = decisions.get(local.getFeature());
        if (existing == null)
        {
            decisions.put(local.getFeature(), local);
        }
        else
        {
            existing.mergeCount(local);
        }
    }

    public int size()
    {
        return decisions.size();
    }

    public Collection<Decision> decisions()
    {
        return decisions.values();
    }

    public List<Decision> toList()
    {
        return new ArrayList<Decision>(decisions.values());
    }
}
