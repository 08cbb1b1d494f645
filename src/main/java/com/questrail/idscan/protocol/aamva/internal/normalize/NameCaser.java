package com.questrail.idscan.protocol.aamva.internal.normalize;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * NameCaser
 * -----------------------------------------------------------------------------
 * Renders AAMVA names, which are transmitted in upper case, in conventional
 * mixed case.
 *
 * <ul>
 *   <li>Tokens are separated by whitespace and hyphens. Hyphens are kept and
 *       each whitespace run becomes one space.</li>
 *   <li>Each token is title-cased: {@code SMITH-JONES} → {@code Smith-Jones}.</li>
 *   <li>{@code MC} prefixes capitalize the following letter:
 *       {@code MCDONALD} → {@code McDonald}.</li>
 *   <li>The letter after an apostrophe is capitalized:
 *       {@code O'BRIEN} → {@code O'Brien}.</li>
 *   <li>After the first token, surname particles stay lower case
 *       ({@code DE LA CRUZ} → {@code De la Cruz}) and generational suffixes
 *       stay upper case ({@code SMITH III} → {@code Smith III},
 *       {@code SMITH JR} → {@code Smith JR}).</li>
 * </ul>
 *
 * <p>{@link #normalize(String)} lower-cases its input first, so applying it to
 * an already normalized name returns the same name.</p>
 */
public final class NameCaser
{
    private static final Set<String> PARTICLES = Set.of("de", "la", "van", "von", "del", "der");

    private static final Set<String> GENERATIONAL_SUFFIXES = Set.of("ii", "iii", "iv", "jr", "sr");

    /** Cases one lower-cased token given its position among the tokens. */
    @FunctionalInterface
    interface TokenCaser {
        String apply(String lowerToken, int index);
    }

    private NameCaser() {}

    /**
     * Normalizes an upper-case AAMVA name.
     *
     * @param rawUpperName name as read from the payload
     * @return the name in mixed case, trimmed
     */
    public static String normalize(String rawUpperName) {
        Objects.requireNonNull(rawUpperName, "rawUpperName");
        return caseTokens(rawUpperName, NameCaser::caseNameToken);
    }

    /**
     * Lower-cases {@code raw}, splits it on whitespace and hyphens and applies
     * {@code caser} to each token. Hyphens are preserved and whitespace runs
     * collapse to a single space.
     */
    static String caseTokens(String raw, TokenCaser caser) {
        final String lower = raw.strip().toLowerCase(Locale.ROOT);
        final StringBuilder out = new StringBuilder(lower.length());

        int index = 0;
        int i = 0;
        while (i < lower.length()) {
            final char c = lower.charAt(i);
            if (Character.isWhitespace(c)) {
                // A whitespace run becomes a single space.
                out.append(' ');
                while (i < lower.length() && Character.isWhitespace(lower.charAt(i))) {
                    i++;
                }
                continue;
            }
            if (c == '-') {
                out.append(c);
                i++;
                continue;
            }
            int end = i;
            while (end < lower.length() && !isSeparator(lower.charAt(end))) {
                end++;
            }
            out.append(caser.apply(lower.substring(i, end), index++));
            i = end;
        }
        return out.toString();
    }

    /**
     * Title-cases a lower-cased token, honouring apostrophes and the
     * {@code Mc} prefix.
     */
    static String capitalize(String lowerToken) {
        if (lowerToken.indexOf('\'') >= 0) {
            final String[] parts = lowerToken.split("'", -1);
            final StringBuilder out = new StringBuilder(lowerToken.length());
            for (int p = 0; p < parts.length; p++) {
                if (p > 0) {
                    out.append('\'');
                }
                out.append(capitalizeWord(parts[p]));
            }
            return out.toString();
        }
        return capitalizeWord(lowerToken);
    }

    private static String caseNameToken(String lowerToken, int index) {
        if (index > 0 && PARTICLES.contains(lowerToken)) {
            return lowerToken;
        }
        if (index > 0 && GENERATIONAL_SUFFIXES.contains(lowerToken)) {
            return lowerToken.toUpperCase(Locale.ROOT);
        }
        return capitalize(lowerToken);
    }

    private static String capitalizeWord(String word) {
        if (word.isEmpty()) {
            return word;
        }
        if (word.length() > 2 && word.startsWith("mc")) {
            return "Mc" + upperFirst(word.substring(2));
        }
        return upperFirst(word);
    }

    private static String upperFirst(String word) {
        final int first = word.codePointAt(0);
        return new StringBuilder(word.length())
                .appendCodePoint(Character.toTitleCase(first))
                .append(word, Character.charCount(first), word.length())
                .toString();
    }

    private static boolean isSeparator(char c) {
        return c == '-' || Character.isWhitespace(c);
    }
}
