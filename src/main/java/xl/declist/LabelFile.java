package xl.declist;

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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes {@code <id> <0|1>} label files, as produced by classification and used as gold standard
 */
public final class LabelFile
{
    private static final Pattern LINE = Pattern.compile("^(\\S+)\\s+([01])\\s*$");

    private LabelFile()
    {
    }

    /**
     * @return labels in file order
     */
    public static Map<String, Boolean> read(File file) throws IOException
    {
        Map<String, Boolean> labels = new LinkedHashMap<String, Boolean>();
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
                if (!matcher.matches())
                {
                    throw new MalformedInputException(file, lineNumber, "expected <id> <0|1> but got '" + line + "'");
                }
                if (labels.put(matcher.group(1), "1".equals(matcher.group(2))) != null)
                {
                    throw new MalformedInputException(file, lineNumber, "duplicate id " + matcher.group(1));
                }
            }
        }
        catch (IOException ex)
        {
            throw new IOException("Failed reading labels from " + file + ": " + ex.getMessage(), ex);
        }
        return labels;
    }

    public static void write(Map<String, Boolean> labels, Writer writer) throws IOException
    {
        for (Map.Entry<String, Boolean> entry : labels.entrySet())
        {
            writer.write(entry.getKey() + " " + (entry.getValue() ? 1 : 0) + "\n");
        }
        writer.flush();
    }

    public static void write(Map<String, Boolean> labels, File file) throws IOException
    {
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)))
        {
            write(labels, writer);
        }
        catch (IOException ex)
        {
            throw new IOException("Failed writing labels to " + file + ": " + ex.getMessage(), ex);
        }
    }
}
