package com.xpdustry.tokentrie.collection;

import com.xpdustry.tokentrie.tokenizer.Tokenizer;
import java.util.List;
import java.util.SortedMap;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * A prefix tree whose levels are the tokens produced by a {@link Tokenizer}.
 *
 * <p>Every node is a trie in its own right: keys given to and returned by a node are relative to it. Results listing
 * several keys or nodes are sorted. Not thread-safe.
 */
public interface TokenTrie<V> {

    static <V> TokenTrie.Mutable<V> create() {
        return create(Tokenizer.DEFAULT);
    }

    static <V> TokenTrie.Mutable<V> create(final Tokenizer tokenizer) {
        return new TokenTrieImpl<>(tokenizer);
    }

    static <V> TokenTrie.Mutable<V> withSlice(final int length) {
        return create(Tokenizer.slice(length));
    }

    static <V> TokenTrie.Mutable<V> withDelimiter(final String delimiter) {
        return create(Tokenizer.delimiter(delimiter));
    }

    static <V> TokenTrie.Mutable<V> withCustomTokenization(
            final Function<String, List<String>> tokenizer, final Function<List<String>, String> detokenizer) {
        return create(Tokenizer.custom(tokenizer, detokenizer));
    }

    Tokenizer tokenizer();

    String token();

    @Nullable V value();

    boolean isKey();

    boolean isOccupied();

    SortedMap<String, TokenTrie<V>> children();

    List<String> path();

    String key();

    int size();

    default boolean isEmpty() {
        return this.size() == 0;
    }

    boolean exists(final CharSequence key);

    boolean contains(final CharSequence key, final boolean partial);

    @Nullable TokenTrie<V> get(final CharSequence key);

    @Nullable V getValue(final CharSequence key);

    List<String> getKeysUnderPrefix(final CharSequence prefix);

    List<TokenTrie<V>> fuzzyGet(final CharSequence key);

    List<String> getKeysByPartialPath(final CharSequence fragment);

    TokenTrie.Mutable<V> newFromCurrent();

    interface Mutable<V> extends TokenTrie<V> {

        @Nullable V add(final CharSequence key, final @Nullable V value);

        boolean remove(final CharSequence key);

        TokenTrie.@Nullable Mutable<V> getMutable(final CharSequence key);
    }
}
