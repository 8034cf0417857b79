package io.dagport.standards.mapper;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

final class ShellQuoting
{
    private static final Pattern SAFE = Pattern.compile("[\\w@%+=:,./-]+");

    private ShellQuoting()
    { }

    /**
     * Quotes a word for a POSIX shell. Words made of safe characters only are
     * returned unchanged.
     */
    static String quote(String word)
    {
        if (word.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(word).matches()) {
            return word;
        }
        return "'" + word.replace("'", "'\"'\"'") + "'";
    }

    static String join(List<String> words)
    {
        return words.stream()
            .map(ShellQuoting::quote)
            .collect(Collectors.joining(" "));
    }
}
