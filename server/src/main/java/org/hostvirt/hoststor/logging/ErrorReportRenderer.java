package org.hostvirt.hoststor.logging;

import org.hostvirt.hoststor.annotation.Nullable;

/**
 * Accumulates the text of an error report, indenting multi-line content
 */
public class ErrorReportRenderer
{
    public static final int DFLT_INDENT_INCREMENT = 4;

    private final StringBuilder result = new StringBuilder();
    private final int indentIncr;

    private int indent = 0;

    public ErrorReportRenderer()
    {
        this(DFLT_INDENT_INCREMENT);
    }

    public ErrorReportRenderer(int indentIncrRef)
    {
        indentIncr = indentIncrRef;
    }

    public void increaseIndent()
    {
        indent += indentIncr;
    }

    public void decreaseIndent()
    {
        indent = Math.max(0, indent - indentIncr);
    }

    public String getErrorReport()
    {
        return result.toString();
    }

    public ErrorReportRenderer println()
    {
        result.append('\n');
        return this;
    }

    public ErrorReportRenderer println(String format, Object... data)
    {
        String text = data == null || data.length == 0 ? format : String.format(format, data);
        for (String line : text.split("\n", -1))
        {
            if (!line.isEmpty())
            {
                result.append(" ".repeat(indent)).append(line);
            }
            result.append('\n');
        }
        return this;
    }

    /**
     * Prints a labeled section, skipped entirely if the text is null or empty
     */
    public ErrorReportRenderer printSection(String label, @Nullable String text)
    {
        if (text != null && !text.isEmpty())
        {
            println("%s:", label);
            increaseIndent();
            println("%s", text);
            decreaseIndent();
        }
        return this;
    }
}
