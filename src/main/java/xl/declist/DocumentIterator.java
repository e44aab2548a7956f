package xl.declist;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Iterator that reads reviews from a file, one per line.  Training data looks like
 *
 * <pre>
 * cv000_29416.txt 0 plot : two teen couples go to a church party ...
 * </pre>
 *
 * and test data replaces the class with a double underscore:
 *
 * <pre>
 * cv000_29416.txt __ plot : two teen couples go to a church party ...
 * </pre>
 *
 * Blank lines are skipped.  Any other line that does not fit the format, or a repeated id in test data, stops
 * the run with a {@link MalformedInputException}.
 */
public class DocumentIterator implements Iterator<Document>, Iterable<Document>, Closeable
{
    public enum Format
    {
        TRAINING(Pattern.compile("^(\\S+)\\s+([01])(?:\\s+(.*))?$")),
        TEST(Pattern.compile("^(\\S+)\\s+__(?:\\s+(.*))?$"));

        private final Pattern pattern;

        Format(Pattern pattern)
        {
            this.pattern = pattern;
        }
    }

    private static final int MAX_QUOTED = 60;

    private final File file;
    private final Format format;
    private final BufferedReader reader;
    private final Set<String> seenIds = new HashSet<String>();
    private Document document;
    private int lineNumber = 0;

    public DocumentIterator(File file, Format format) throws IOException
    {
        this.file = file;
        this.format = format;
        this.reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
        try
        {
            advance();
        }
        catch (RuntimeException ex)
        {
            reader.close();
            throw ex;
        }
    }

    @Override
    public boolean hasNext()
    {
        return document != null;
    }

    @Override
    public Document next()
    {
        if (document == null)
        {
            throw new NoSuchElementException();
        }
        Document last = document;
        advance();
        return last;
    }

    @Override
    public Iterator<Document> iterator()
    {
        return this;
    }

    public int getLineNumber()
    {
        return lineNumber;
    }

    public File getFile()
    {
        return file;
    }

    private void advance()
    {
        String line;
        try
        {
            do
            {
                line = reader.readLine();
                if (line == null)
                {
                    document = null;
                    return;
                }
                ++lineNumber;
            }
            while (line.trim().isEmpty());
        }
        catch (IOException ex)
        {
            throw new UncheckedIOException("Failed reading " + file + " at line " + lineNumber, ex);
        }

        document = parse(line);
        // Test output is keyed by id, training ignores it
        if (format == Format.TEST && !seenIds.add(document.getId()))
        {
            throw new MalformedInputException(file, lineNumber, "duplicate id " + document.getId());
        }
    }

    private Document parse(String line)
    {
        Matcher matcher = format.pattern.matcher(line);
        if (!matcher.matches())
        {
            String quoted = line.length() > MAX_QUOTED ? line.substring(0, MAX_QUOTED) + "..." : line;
            throw new MalformedInputException(file, lineNumber,
                    "expected " + (format == Format.TRAINING ? "<id> <0|1> <text>" : "<id> __ <text>")
                            + " but got '" + quoted + "'");
        }
        String id = matcher.group(1);
        if (format == Format.TRAINING)
        {
            return new Document(id, "1".equals(matcher.group(2)), textOf(matcher.group(3)));
        }
        return new Document(id, null, textOf(matcher.group(2)));
    }

    private static String textOf(String group)
    {
        return group == null ? "" : group;
    }

    @Override
    public void close() throws IOException
    {
        reader.close();
    }
}
