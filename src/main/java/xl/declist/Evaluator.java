package xl.declist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Compares system labels with gold labels.  Both must cover exactly the same ids.
 */
public class Evaluator
{
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    public Evaluation evaluate(Map<String, Boolean> gold, Map<String, Boolean> system)
    {
        Evaluation evaluation = new Evaluation();
        for (Map.Entry<String, Boolean> entry : gold.entrySet())
        {
            Boolean predicted = system.get(entry.getKey());
            if (predicted == null)
            {
                throw new IllegalArgumentException("No system label for id " + entry.getKey());
            }
            evaluation.add(entry.getKey(), entry.getValue(), predicted);
        }

        if (system.size() != gold.size())
        {
            for (String id : system.keySet())
            {
                if (!gold.containsKey(id))
                {
                    throw new IllegalArgumentException("No gold label for id " + id);
                }
            }
        }

        log.info("TP: {} FP: {} FN: {} TN: {}", evaluation.getTruePositives(), evaluation.getFalsePositives(),
                evaluation.getFalseNegatives(), evaluation.getTrueNegatives());
        return evaluation;
    }
}
