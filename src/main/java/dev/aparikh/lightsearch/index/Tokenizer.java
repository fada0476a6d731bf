package dev.aparikh.lightsearch.index;

import java.util.List;

/**
 * Turns a string field value into the tokens it is indexed under.
 * The query side must tokenize search terms the same way.
 */
@FunctionalInterface
public interface Tokenizer {

    List<String> tokenize(String text);
}
