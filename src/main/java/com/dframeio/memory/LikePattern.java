package com.dframeio.memory;

import java.util.regex.Pattern;

/**
 * Translates SQL LIKE patterns to regular expressions.
 * {@code %} matches any run of characters, {@code _} exactly one character.
 * Matching is case-sensitive and there is no escape character.
 */
public final class LikePattern {

    private LikePattern() {
    }

    public static Pattern compile(String like) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();

        for (int i = 0; i < like.length(); i++) {
            char c = like.charAt(i);
            if (c == '%' || c == '_') {
                flush(literal, regex);
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flush(literal, regex);

        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void flush(StringBuilder literal, StringBuilder regex) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
