package xl.declist;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Confusion counts and metrics of one system output against gold labels.  A metric whose denominator is zero
 * (no positive predictions for precision, no positive gold labels for recall) is NaN and printed as
 * {@value #UNDEFINED}.
 */
public class Evaluation
{
    public static final String UNDEFINED = "undefined";

    /**
     * One compared document
     */
    public static class Outcome
    {
        private final String id;
        private final boolean gold;
        private final boolean system;

        Outcome(String id, boolean gold, boolean system)
        {
            this.id = id;
            this.gold = gold;
            this.system = system;
        }

        public String getId()
        {
            return id;
        }

        public boolean getGold()
        {
            return gold;
        }

        public boolean getSystem()
        {
            return system;
        }

        @Override
        public String toString()
        {
            return id + " " + (gold ? 1 : 0) + " " + (system ? 1 : 0);
        }
    }

    private final List<Outcome> outcomes = new ArrayList<Outcome>();
    private int tp = 0;
    private int fp = 0;
    private int fn = 0;
    private int tn = 0;

    void add(String id, boolean gold, boolean system)
    {
        outcomes.add(new Outcome(id, gold, system));
        if (system)
        {
            if (gold)
            {
                tp++;
            }
            else
            {
                fp++;
            }
        }
        else if (gold)
        {
            fn++;
        }
        else
        {
            tn++;
        }
    }

    public List<Outcome> getOutcomes()
    {
        return Collections.unmodifiableList(outcomes);
    }

    public int getTruePositives()
    {
        return tp;
    }

    public int getFalsePositives()
    {
        return fp;
    }

    public int getFalseNegatives()
    {
        return fn;
    }

    public int getTrueNegatives()
    {
        return tn;
    }

    public double getAccuracy()
    {
        return ratio(tp + tn, tp + fp + tn + fn);
    }

    public double getPrecision()
    {
        return ratio(tp, tp + fp);
    }

    public double getRecall()
    {
        return ratio(tp, tp + fn);
    }

    private static double ratio(int num, int denom)
    {
        return denom == 0 ? Double.NaN : num / (double) denom;
    }

    public static double round4(double value)
    {
        if (Double.isNaN(value))
        {
            return value;
        }
        return Math.round(value * 10000.0) / 10000.0;
    }

    public static String format4(double value)
    {
        if (Double.isNaN(value))
        {
            return UNDEFINED;
        }
        return String.format(Locale.ROOT, "%.4f", round4(value));
    }

    /**
     * Write one {@code id gold system} line per document in gold order, then accuracy, precision and recall
     */
    public void write(Writer writer) throws IOException
    {
        for (Outcome outcome : outcomes)
        {
            writer.write(outcome.toString());
            writer.write('\n');
        }
        writer.write("Accuracy: " + format4(getAccuracy()) + "\n");
        writer.write("Precision: " + format4(getPrecision()) + "\n");
        writer.write("Recall: " + format4(getRecall()) + "\n");
        writer.flush();
    }
}
