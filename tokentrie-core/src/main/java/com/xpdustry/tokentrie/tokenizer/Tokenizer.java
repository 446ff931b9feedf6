package com.xpdustry.tokentrie.tokenizer;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts a key into the ordered tokens stored along a trie path, and back.
 *
 * <p>Implementations are immutable and shared by reference between a trie, its nodes and the empty tries derived
 * from it.
 */
public sealed interface Tokenizer permits Tokenizer.Slice, Tokenizer.Delimiter, Tokenizer.Custom {

    Tokenizer DEFAULT = new Slice(1);

    static Tokenizer slice(final int length) {
        return new Slice(length);
    }

    static Tokenizer delimiter(final String delimiter) {
        return new Delimiter(delimiter);
    }

    static Tokenizer custom(
            final Function<String, List<String>> tokenizer, final Function<List<String>, String> detokenizer) {
        return new Custom(tokenizer, detokenizer);
    }

    List<String> tokenize(final String key);

    String detokenize(final List<String> tokens);

    /**
     * Groups the grapheme clusters of a key by {@code length}, the last token may be shorter.
     */
    record Slice(int length) implements Tokenizer {

        public Slice {
            Preconditions.checkArgument(length > 0, "The slice length must be positive, got %s", length);
        }

        @Override
        public List<String> tokenize(final String key) {
            Preconditions.checkNotNull(key, "key");
            final var graphemes = Graphemes.split(key);
            if (this.length == 1) {
                return List.copyOf(graphemes);
            }
            final List<String> tokens = new ArrayList<>((graphemes.size() + this.length - 1) / this.length);
            for (final var partition : Lists.partition(graphemes, this.length)) {
                tokens.add(String.join("", partition));
            }
            return List.copyOf(tokens);
        }

        @Override
        public String detokenize(final List<String> tokens) {
            Preconditions.checkNotNull(tokens, "tokens");
            return String.join("", tokens);
        }
    }

    /**
     * Splits a key on a literal delimiter. Leading, trailing and repeated delimiters produce empty tokens.
     */
    record Delimiter(String delimiter) implements Tokenizer {

        public Delimiter {
            Preconditions.checkNotNull(delimiter, "delimiter");
            Preconditions.checkArgument(!delimiter.isEmpty(), "The delimiter cannot be empty");
        }

        @Override
        public List<String> tokenize(final String key) {
            Preconditions.checkNotNull(key, "key");
            if (key.isEmpty()) {
                return List.of();
            }
            return List.copyOf(Splitter.on(this.delimiter).splitToList(key));
        }

        @Override
        public String detokenize(final List<String> tokens) {
            Preconditions.checkNotNull(tokens, "tokens");
            return Joiner.on(this.delimiter).join(tokens);
        }
    }

    /**
     * Delegates to caller supplied functions.
     *
     * <p>The functions must satisfy {@code detokenize(tokenize(key)).equals(key)} for every key stored in the trie.
     * This is not verified: when it does not hold, the keys reconstructed by trie queries are undefined.
     */
    record Custom(Function<String, List<String>> tokenizer, Function<List<String>, String> detokenizer)
            implements Tokenizer {

        public Custom {
            Preconditions.checkNotNull(tokenizer, "tokenizer");
            Preconditions.checkNotNull(detokenizer, "detokenizer");
        }

        @Override
        public List<String> tokenize(final String key) {
            Preconditions.checkNotNull(key, "key");
            final var tokens = this.tokenizer.apply(key);
            if (tokens == null) {
                throw new InvalidTokenizationException("The custom tokenizer returned null for the key \"" + key + "\"");
            }
            for (final var token : tokens) {
                if (token == null) {
                    throw new InvalidTokenizationException(
                            "The custom tokenizer returned a null token for the key \"" + key + "\"");
                }
            }
            return List.copyOf(tokens);
        }

        @Override
        public String detokenize(final List<String> tokens) {
            Preconditions.checkNotNull(tokens, "tokens");
            final var key = this.detokenizer.apply(List.copyOf(tokens));
            if (key == null) {
                throw new InvalidTokenizationException("The custom detokenizer returned null for the tokens " + tokens);
            }
            return key;
        }
    }
}
