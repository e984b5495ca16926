package com.phillippitts.voicejukebox.service.rank;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for normalizing spoken queries and catalog names before comparison.
 *
 * <p>Normalization rules:
 * <ul>
 *   <li>Convert to lowercase</li>
 *   <li>Strip punctuation and symbols</li>
 *   <li>Collapse runs of whitespace to a single space and trim</li>
 *   <li>Drop a single leading article "the "</li>
 * </ul>
 */
public final class TextNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String LEADING_ARTICLE = "the ";

    private TextNormalizer() {
        // Prevent instantiation
    }

    /**
     * Normalizes text for similarity scoring.
     *
     * @param text input text (may be null)
     * @return normalized text, empty if input is null or blank
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String s = text.toLowerCase(Locale.ROOT);
        s = PUNCTUATION.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        if (s.startsWith(LEADING_ARTICLE) && s.length() > LEADING_ARTICLE.length()) {
            s = s.substring(LEADING_ARTICLE.length());
        }
        return s;
    }

    /**
     * Splits already normalized text into word tokens.
     *
     * @param normalized output of {@link #normalize(String)}
     * @return immutable list of tokens (empty if no tokens)
     */
    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : WHITESPACE.split(normalized)) {
            if (!part.isBlank()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }
}
