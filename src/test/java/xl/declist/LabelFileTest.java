package xl.declist;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LabelFileTest
{
    @TempDir
    Path tmp;

    @Test
    void writeThenReadKeepsOrder() throws IOException
    {
        Map<String, Boolean> labels = new LinkedHashMap<String, Boolean>();
        labels.put("cv909.txt", true);
        labels.put("cv100.txt", false);
        labels.put("cv500.txt", true);
        File file = tmp.resolve("labels.txt").toFile();
        LabelFile.write(labels, file);

        assertEquals(Arrays.asList("cv909.txt 1", "cv100.txt 0", "cv500.txt 1"),
                Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
        Map<String, Boolean> read = LabelFile.read(file);
        assertEquals(Arrays.asList("cv909.txt", "cv100.txt", "cv500.txt"), Arrays.asList(read.keySet().toArray()));
        assertEquals(labels, read);
    }

    @Test
    void malformedAndDuplicateLinesFail() throws IOException
    {
        Path bad = tmp.resolve("bad.txt");
        Files.write(bad, Arrays.asList("a.txt 1", "b.txt yes"), StandardCharsets.UTF_8);
        assertEquals(2, assertThrows(MalformedInputException.class, () -> LabelFile.read(bad.toFile())).getLineNumber());

        Path dup = tmp.resolve("dup.txt");
        Files.write(dup, Arrays.asList("a.txt 1", "a.txt 0"), StandardCharsets.UTF_8);
        assertThrows(MalformedInputException.class, () -> LabelFile.read(dup.toFile()));
    }
}
