package com.xpdustry.tokentrie.tokenizer;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits strings into extended grapheme clusters, the user-perceived characters of a string.
 */
public final class Graphemes {

    private static final Pattern GRAPHEME = Pattern.compile("\\X");

    private Graphemes() {}

    public static List<String> split(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");

        final List<String> graphemes = new ArrayList<>();
        final var matcher = GRAPHEME.matcher(chars);
        while (matcher.find()) {
            graphemes.add(matcher.group());
        }
        return graphemes;
    }
}
