package xl.declist;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentIteratorTest
{
    @TempDir
    Path tmp;

    private Path write(String name, String... lines) throws IOException
    {
        Path path = tmp.resolve(name);
        Files.write(path, Arrays.asList(lines), StandardCharsets.UTF_8);
        return path;
    }

    private static List<Document> readAll(DocumentIterator iterator)
    {
        List<Document> documents = new ArrayList<Document>();
        for (Document document : iterator)
        {
            documents.add(document);
        }
        return documents;
    }

    @Test
    void readsTrainingLines() throws IOException
    {
        Path path = write("train.txt",
                "cv000_29416.txt 0 plot : two teen couples go to a church party .",
                "",
                "cv001_19502.txt 1 the happy bastard's quick movie review");
        try (DocumentIterator iterator = new DocumentIterator(path.toFile(), DocumentIterator.Format.TRAINING))
        {
            List<Document> documents = readAll(iterator);
            assertEquals(2, documents.size());
            assertEquals("cv000_29416.txt", documents.get(0).getId());
            assertFalse(documents.get(0).isPositive());
            assertEquals("plot : two teen couples go to a church party .", documents.get(0).getText());
            assertTrue(documents.get(1).isPositive());
            assertEquals(3, iterator.getLineNumber());
        }
    }

    @Test
    void readsTestLines() throws IOException
    {
        Path path = write("test.txt", "cv900_10331.txt __ a sharp , funny script .", "cv901_11017.txt __");
        try (DocumentIterator iterator = new DocumentIterator(path.toFile(), DocumentIterator.Format.TEST))
        {
            List<Document> documents = readAll(iterator);
            assertEquals(2, documents.size());
            assertFalse(documents.get(0).isLabeled());
            assertEquals("a sharp , funny script .", documents.get(0).getText());
            assertEquals("", documents.get(1).getText());
            assertThrows(IllegalStateException.class, documents.get(0)::isPositive);
        }
    }

    @Test
    void malformedTrainingLineStopsTheRun() throws IOException
    {
        Path path = write("train.txt", "ok.txt 1 fine", "broken.txt 2 what class is this");
        DocumentIterator iterator = new DocumentIterator(path.toFile(), DocumentIterator.Format.TRAINING);
        try
        {
            // the next line is read ahead, so the bad line surfaces with the first document
            MalformedInputException ex = assertThrows(MalformedInputException.class, iterator::next);
            assertEquals(2, ex.getLineNumber());
            assertEquals(path.toFile(), ex.getFile());
        }
        finally
        {
            iterator.close();
        }
    }

    @Test
    void testFormatNeedsPlaceholder() throws IOException
    {
        Path path = write("test.txt", "cv900_10331.txt 1 already labeled");
        assertThrows(MalformedInputException.class,
                () -> new DocumentIterator(path.toFile(), DocumentIterator.Format.TEST));
    }

    @Test
    void duplicateTestIdsAreRejected() throws IOException
    {
        Path path = write("test.txt", "a.txt __ one", "a.txt __ two");
        DocumentIterator iterator = new DocumentIterator(path.toFile(), DocumentIterator.Format.TEST);
        try
        {
            assertThrows(MalformedInputException.class, iterator::next);
        }
        finally
        {
            iterator.close();
        }
    }
}
