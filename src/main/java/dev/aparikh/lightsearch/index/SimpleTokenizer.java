package dev.aparikh.lightsearch.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lower-cases text and splits it on every run of characters that are neither letters nor
 * digits. Tokens shorter than the minimum length are dropped and duplicates are removed,
 * keeping first-seen order.
 *
 * <p>Example: {@code "Hello, hello World-2"} becomes {@code [hello, world, 2]}.</p>
 */
public class SimpleTokenizer implements Tokenizer {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 1;

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int minTokenLength;

    public SimpleTokenizer() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    public SimpleTokenizer(int minTokenLength) {
        if (minTokenLength <= 0) {
            throw new IllegalArgumentException("minTokenLength must be positive, got: " + minTokenLength);
        }
        this.minTokenLength = minTokenLength;
    }

    @Override
    public List<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String part : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (part.length() >= minTokenLength) {
                tokens.add(part);
            }
        }
        return new ArrayList<>(tokens);
    }
}
