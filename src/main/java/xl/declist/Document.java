package xl.declist;

/**
 * A review as read from a training or test file.  The label is null for unlabeled test documents.
 */
public class Document
{
    private final String id;
    private final Boolean label;
    private final String text;

    public Document(String id, Boolean label, String text)
    {
        this.id = id;
        this.label = label;
        this.text = text;
    }

    public String getId()
    {
        return id;
    }

    public boolean isLabeled()
    {
        return label != null;
    }

    public boolean isPositive()
    {
        if (label == null)
        {
            throw new IllegalStateException("Document " + id + " has no label");
        }
        return label;
    }

    public String getText()
    {
        return text;
    }
}
