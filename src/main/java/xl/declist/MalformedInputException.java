package xl.declist;

import java.io.File;

/**
 * A line of an input file does not have the expected fields
 */
public class MalformedInputException extends RuntimeException
{
    private final File file;
    private final int lineNumber;

    public MalformedInputException(File file, int lineNumber, String message)
    {
        super(file + ", line " + lineNumber + ": " + message);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public File getFile()
    {
        return file;
    }

    public int getLineNumber()
    {
        return lineNumber;
    }
}
