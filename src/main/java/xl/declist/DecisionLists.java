package xl.declist;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sentiment classification with decision lists.  Three commands cover the whole workflow:
 *
 * <pre>
 * train [--mode presence|frequency|hybrid] [--smoothing laplace|squared] reviews.train decisions.txt
 * test decisions.txt reviews.test labels.txt
 * eval gold.txt labels.txt report.txt
 * </pre>
 *
 * Features are unigrams and bigrams of the review tokens, with stop tokens removed and everything after a
 * negation cue in a sentence prefixed with NOT_.  Each feature is scored by the log-likelihood of positive over
 * negative evidence, and a review is given the class of the strongest feature it contains.
 * <p>
 * For more information, the original paper:
 * David Yarowsky. "Decision lists for lexical ambiguity resolution"
 * </p>
 */
public class DecisionLists
{
    private static final Logger log = LoggerFactory.getLogger(DecisionLists.class);

    public static final String TRAIN = "train";
    public static final String TEST = "test";
    public static final String EVAL = "eval";

    @Parameters(commandDescription = "Learn a decision list from labeled reviews")
    public static class TrainParams
    {
        @Parameter(description = "<trainingFile> <outFile>")
        public List<String> files = new ArrayList<String>();

        // Presence has done best on movie reviews so far
        @Parameter(description = "Feature counting (presence|frequency|hybrid)", names = {"--mode", "-m"})
        public String mode = FeatureCounter.CountingMode.PRESENCE.toString().toLowerCase();

        @Parameter(description = "Smoothing of zero counts (laplace|squared)", names = {"--smoothing"})
        public String smoothing = LogLikelihoodScorer.Smoothing.LAPLACE.toString().toLowerCase();
    }

    @Parameters(commandDescription = "Classify unlabeled reviews with a decision list")
    public static class TestParams
    {
        @Parameter(description = "<decisionListFile> <testFile> <outFile>")
        public List<String> files = new ArrayList<String>();
    }

    @Parameters(commandDescription = "Score system labels against gold labels")
    public static class EvalParams
    {
        @Parameter(description = "<goldFile> <systemFile> <outFile>")
        public List<String> files = new ArrayList<String>();
    }

    private final DecisionListConfig config;

    public DecisionLists(DecisionListConfig config)
    {
        this.config = config;
    }

    public void train(File trainingFile, File outFile, FeatureCounter counter, LogLikelihoodScorer scorer)
            throws IOException
    {
        Trainer trainer = new Trainer(config, counter, scorer);
        DecisionList decisionList;
        try (DocumentIterator corpus = new DocumentIterator(trainingFile, DocumentIterator.Format.TRAINING))
        {
            decisionList = trainer.train(corpus);
        }
        catch (UncheckedIOException ex)
        {
            throw ex.getCause();
        }
        new DecisionListFile(config).write(decisionList, outFile);
    }

    public void test(File decisionListFile, File testFile, File outFile) throws IOException
    {
        DecisionList decisionList = new DecisionListFile(config).read(decisionListFile);
        Classifier classifier = new Classifier(decisionList, config);
        Map<String, Boolean> labels;
        try (DocumentIterator documents = new DocumentIterator(testFile, DocumentIterator.Format.TEST))
        {
            labels = classifier.classifyAll(documents);
        }
        catch (UncheckedIOException ex)
        {
            throw ex.getCause();
        }
        LabelFile.write(labels, outFile);
    }

    public Evaluation eval(File goldFile, File systemFile, File outFile) throws IOException
    {
        Map<String, Boolean> gold = LabelFile.read(goldFile);
        Map<String, Boolean> system = LabelFile.read(systemFile);
        Evaluation evaluation = new Evaluator().evaluate(gold, system);

        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8)))
        {
            evaluation.write(writer);
        }
        catch (IOException ex)
        {
            throw new IOException("Failed writing evaluation to " + outFile + ": " + ex.getMessage(), ex);
        }
        log.info("Accuracy {} Precision {} Recall {}", Evaluation.format4(evaluation.getAccuracy()),
                Evaluation.format4(evaluation.getPrecision()), Evaluation.format4(evaluation.getRecall()));
        return evaluation;
    }

    /**
     * Parse and run one command.  Usage problems print the usage and count as success; anything that stops a
     * command part way is logged and reported as failure.
     *
     * @return the process exit status
     */
    public static int run(String[] args)
    {
        TrainParams trainParams = new TrainParams();
        TestParams testParams = new TestParams();
        EvalParams evalParams = new EvalParams();
        JCommander jc = new JCommander();
        jc.setProgramName("declist");
        jc.addCommand(TRAIN, trainParams);
        jc.addCommand(TEST, testParams);
        jc.addCommand(EVAL, evalParams);

        String command;
        try
        {
            jc.parse(args);
            command = jc.getParsedCommand();
        }
        catch (ParameterException ex)
        {
            System.out.println(ex.getMessage());
            jc.usage();
            return 0;
        }

        if (command == null)
        {
            jc.usage();
            return 0;
        }

        DecisionLists decisionLists = new DecisionLists(DecisionListConfig.DEFAULT);
        try
        {
            if (TRAIN.equals(command))
            {
                if (trainParams.files.size() != 2)
                {
                    return usage(jc, command, "Incorrect number of arguments");
                }
                FeatureCounter counter;
                LogLikelihoodScorer scorer;
                try
                {
                    counter = Trainer.counterFor(trainParams.mode, decisionLists.config);
                    scorer = new LogLikelihoodScorer(
                            LogLikelihoodScorer.Smoothing.valueOf(trainParams.smoothing.toUpperCase()));
                }
                catch (IllegalArgumentException ex)
                {
                    return usage(jc, command, "Unknown mode or smoothing: " + trainParams.mode + ", "
                            + trainParams.smoothing);
                }
                decisionLists.train(new File(trainParams.files.get(0)), new File(trainParams.files.get(1)),
                        counter, scorer);
            }
            else if (TEST.equals(command))
            {
                if (testParams.files.size() != 3)
                {
                    return usage(jc, command, "Incorrect number of arguments");
                }
                decisionLists.test(new File(testParams.files.get(0)), new File(testParams.files.get(1)),
                        new File(testParams.files.get(2)));
            }
            else
            {
                if (evalParams.files.size() != 3)
                {
                    return usage(jc, command, "Incorrect number of arguments");
                }
                decisionLists.eval(new File(evalParams.files.get(0)), new File(evalParams.files.get(1)),
                        new File(evalParams.files.get(2)));
            }
        }
        catch (Exception ex)
        {
            log.error(command + " failed: " + ex.getMessage(), ex);
            return 1;
        }
        return 0;
    }

    private static int usage(JCommander jc, String command, String problem)
    {
        System.out.println(problem);
        jc.usage(command);
        return 0;
    }

    public static void main(String[] args)
    {
        int status = run(args);
        if (status != 0)
        {
            System.exit(status);
        }
    }
}
