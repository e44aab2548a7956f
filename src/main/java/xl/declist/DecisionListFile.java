package xl.declist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flat text form of a decision list, one decision per line:
 *
 * <pre>
 * seagal                                     5.7549    0
 * jackie brown                               5.4594    1
 * </pre>
 *
 * Only decisions at or above the threshold are written.  When reading, the score is checked but dropped and the
 * file order is taken as the priority order.
 */
public class DecisionListFile
{
    private static final Logger log = LoggerFactory.getLogger(DecisionListFile.class);

    private static final Pattern LINE = Pattern.compile("^(.*?)\\s+(\\d*\\.\\d{4})\\s+([01])\\s*$");

    private final DecisionListConfig config;

    public DecisionListFile(DecisionListConfig config)
    {
        this.config = config;
    }

    public String format(Decision decision)
    {
        return String.format(Locale.ROOT, "%-" + config.getFeatureWidth() + "s %8.4f %4d",
                decision.getFeature(), decision.getLogLikelihood(), decision.getClassification() ? 1 : 0);
    }

    /**
     * @return the number of decisions written
     */
    public int write(DecisionList decisionList, Writer writer) throws IOException
    {
        List<Decision> kept = decisionList.aboveThreshold(config.getThreshold());
        for (Decision decision : kept)
        {
            writer.write(format(decision));
            writer.write('\n');
        }
        writer.flush();
        return kept.size();
    }

    public int write(DecisionList decisionList, File file) throws IOException
    {
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)))
        {
            int written = write(decisionList, writer);
            log.info("Wrote {} of {} decisions to {} (threshold {})", written, decisionList.size(), file,
                    config.getThreshold());
            return written;
        }
        catch (IOException ex)
        {
            throw new IOException("Failed writing decision list to " + file + ": " + ex.getMessage(), ex);
        }
    }

    public DecisionList read(File file) throws IOException
    {
        List<Decision> decisions = new ArrayList<Decision>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)))
        {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null)
            {
                ++lineNumber;
                if (line.trim().isEmpty())
                {
                    continue;
                }
                Matcher matcher = LINE.matcher(line);
                if (!matcher.matches() || matcher.group(1).trim().isEmpty())
                {
                    throw new MalformedInputException(file, lineNumber,
                            "expected <feature> <score> <0|1> but got '" + line + "'");
                }
                decisions.add(new Decision(matcher.group(1).trim(), "1".equals(matcher.group(3))));
            }
        }
        catch (IOException ex)
        {
            throw new IOException("Failed reading decision list from " + file + ": " + ex.getMessage(), ex);
        }
        log.info("Read {} decisions from {}", decisions.size(), file);
        return DecisionList.inOrder(decisions);
    }
}
