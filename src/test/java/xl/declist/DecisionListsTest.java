package xl.declist;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DecisionListsTest
{
    @TempDir
    Path tmp;

    private File trainFile;
    private File testFile;
    private File goldFile;

    @BeforeEach
    void setup() throws IOException
    {
        trainFile = tmp.resolve("reviews.train").toFile();
        Files.write(trainFile.toPath(), Arrays.asList(
                "r1.txt 1 great movie . loved it .",
                "r2.txt 1 great acting .",
                "r3.txt 0 boring movie . i did not like it .",
                "r4.txt 0 boring plot ."), StandardCharsets.UTF_8);

        testFile = tmp.resolve("reviews.test").toFile();
        Files.write(testFile.toPath(), Arrays.asList(
                "t1.txt __ a great film .",
                "t2.txt __ so boring .",
                "t3.txt __ nothing here"), StandardCharsets.UTF_8);

        goldFile = tmp.resolve("gold.txt").toFile();
        Files.write(goldFile.toPath(), Arrays.asList("t1.txt 1", "t2.txt 0", "t3.txt 1"), StandardCharsets.UTF_8);
    }

    @Test
    void trainTestEval() throws IOException
    {
        DecisionLists decisionLists = new DecisionLists(DecisionListConfig.DEFAULT.withThreshold(1.5));
        File listFile = tmp.resolve("decisions.txt").toFile();
        File labelFile = tmp.resolve("labels.txt").toFile();
        File reportFile = tmp.resolve("report.txt").toFile();

        decisionLists.train(trainFile, listFile, new PresenceCounter(), new LogLikelihoodScorer());
        List<String> list = Files.readAllLines(listFile.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, list.size());
        assertTrue(list.get(0).startsWith("great "));
        assertTrue(list.get(0).endsWith("1.5850    1"));
        assertTrue(list.get(1).startsWith("boring "));
        assertTrue(list.get(1).endsWith("1.5850    0"));

        decisionLists.test(listFile, testFile, labelFile);
        assertEquals(Arrays.asList("t1.txt 1", "t2.txt 0", "t3.txt 0"),
                Files.readAllLines(labelFile.toPath(), StandardCharsets.UTF_8));

        Evaluation evaluation = decisionLists.eval(goldFile, labelFile, reportFile);
        assertEquals(1, evaluation.getFalseNegatives());
        assertEquals(Arrays.asList("t1.txt 1 1", "t2.txt 0 0", "t3.txt 1 0",
                "Accuracy: 0.6667", "Precision: 1.0000", "Recall: 0.5000"),
                Files.readAllLines(reportFile.toPath(), StandardCharsets.UTF_8));
    }

    @Test
    void frequencyCountingRanksRepeatedFeaturesHigher() throws IOException
    {
        Files.write(trainFile.toPath(), Arrays.asList(
                "r1.txt 1 superb superb superb superb superb superb",
                "r2.txt 0 awful"), StandardCharsets.UTF_8);
        DecisionLists decisionLists = new DecisionLists(DecisionListConfig.DEFAULT);
        File listFile = tmp.resolve("decisions.txt").toFile();

        decisionLists.train(trainFile, listFile, new FrequencyCounter(), new LogLikelihoodScorer());
        List<String> list = Files.readAllLines(listFile.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, list.size());
        assertTrue(list.get(0).startsWith("superb "));
        assertTrue(list.get(0).endsWith("2.8074    1"));
        assertTrue(list.get(1).startsWith("superb superb "));
        assertTrue(list.get(1).endsWith("2.5850    1"));
    }

    @Test
    void wrongArgumentCountPrintsUsage()
    {
        assertEquals(0, DecisionLists.run(new String[] {}));
        assertEquals(0, DecisionLists.run(new String[] {"train", trainFile.getPath()}));
        assertEquals(0, DecisionLists.run(new String[] {"test", "a", "b"}));
        assertEquals(0, DecisionLists.run(new String[] {"eval", "a", "b", "c", "d"}));
        assertEquals(0, DecisionLists.run(new String[] {"train", "--mode", "sometimes", trainFile.getPath(), "out"}));
        assertFalse(new File("out").exists());
    }

    @Test
    void runsFromCommandLine() throws IOException
    {
        File listFile = tmp.resolve("decisions.txt").toFile();
        assertEquals(0, DecisionLists.run(new String[] {"train", "--mode", "hybrid", trainFile.getPath(),
                listFile.getPath()}));
        assertTrue(listFile.exists());
        // nothing in a four review corpus clears the default threshold
        assertTrue(Files.readAllLines(listFile.toPath(), StandardCharsets.UTF_8).isEmpty());

        File labelFile = tmp.resolve("labels.txt").toFile();
        assertEquals(0, DecisionLists.run(new String[] {"test", listFile.getPath(), testFile.getPath(),
                labelFile.getPath()}));
        assertEquals(Arrays.asList("t1.txt 0", "t2.txt 0", "t3.txt 0"),
                Files.readAllLines(labelFile.toPath(), StandardCharsets.UTF_8));
    }

    @Test
    void failuresAreReported() throws IOException
    {
        File missing = tmp.resolve("missing.train").toFile();
        assertEquals(1, DecisionLists.run(new String[] {"train", missing.getPath(),
                tmp.resolve("out.txt").toString()}));

        File system = tmp.resolve("system.txt").toFile();
        Files.write(system.toPath(), Arrays.asList("t1.txt 1", "t2.txt 0"), StandardCharsets.UTF_8);
        assertEquals(1, DecisionLists.run(new String[] {"eval", goldFile.getPath(), system.getPath(),
                tmp.resolve("report.txt").toString()}));

        Files.write(trainFile.toPath(), Arrays.asList("r1.txt positive great"), StandardCharsets.UTF_8);
        assertEquals(1, DecisionLists.run(new String[] {"train", trainFile.getPath(),
                tmp.resolve("out.txt").toString()}));
    }
}
