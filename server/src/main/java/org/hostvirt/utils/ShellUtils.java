package org.hostvirt.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;

public class ShellUtils
{
    /**
     * Matches any character that needs quoting in Unix shells, same character set as Python's shlex.quote
     */
    private static final Pattern UNSAFE_FOR_SHELL = Pattern.compile("[^\\w@%+=:,./-]");

    private ShellUtils()
    {
    }

    /**
     * Splits a command line into its arguments, honoring single quotes, double quotes and
     * backslash escapes the way a POSIX shell does for simple words.
     */
    public static List<String> shellSplit(final CharSequence cmdLine)
    {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        boolean escaping = false;
        char quoteChar = 0;
        for (int idx = 0; idx < cmdLine.length(); ++idx)
        {
            final char chr = cmdLine.charAt(idx);
            if (escaping)
            {
                current.append(chr);
                escaping = false;
            }
            else
            if (quoteChar != 0)
            {
                if (chr == quoteChar)
                {
                    quoteChar = 0;
                }
                else
                if (chr == '\\' && quoteChar == '"')
                {
                    escaping = true;
                }
                else
                {
                    current.append(chr);
                }
            }
            else
            if (Character.isWhitespace(chr))
            {
                if (inToken)
                {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            }
            else
            {
                inToken = true;
                if (chr == '\\')
                {
                    escaping = true;
                }
                else
                if (chr == '\'' || chr == '"')
                {
                    quoteChar = chr;
                }
                else
                {
                    current.append(chr);
                }
            }
        }
        if (inToken)
        {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Returns a shell-escaped version of the string
     */
    public static String shellQuote(String str)
    {
        String result;
        if (str.isEmpty())
        {
            result = "''";
        }
        else
        if (UNSAFE_FOR_SHELL.matcher(str).find())
        {
            result = "'" + str.replace("'", "'\"'\"'") + "'";
        }
        else
        {
            result = str;
        }
        return result;
    }

    /**
     * Returns the arguments quoted and joined into a single line that can be pasted into a shell,
     * used for logging executed commands
     */
    public static String joinShellQuote(String... args)
    {
        StringJoiner joiner = new StringJoiner(" ");
        for (String arg : args)
        {
            joiner.add(shellQuote(arg));
        }
        return joiner.toString();
    }
}
