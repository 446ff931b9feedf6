package com.xpdustry.tokentrie.collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.xpdustry.tokentrie.tokenizer.Tokenizer;
import gnu.trove.map.hash.THashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class TokenTrieImpl<V> implements TokenTrie.Mutable<V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenTrieImpl.class);

    private final Tokenizer tokenizer;
    private final String token;
    private @Nullable TokenTrieImpl<V> parent;
    private @Nullable THashMap<String, TokenTrieImpl<V>> children = null;
    private @Nullable V value = null;
    private boolean key = false;

    TokenTrieImpl(final Tokenizer tokenizer) {
        this(Preconditions.checkNotNull(tokenizer, "tokenizer"), "", null);
    }

    private TokenTrieImpl(final Tokenizer tokenizer, final String token, final @Nullable TokenTrieImpl<V> parent) {
        this.tokenizer = tokenizer;
        this.token = token;
        this.parent = parent;
    }

    @Override
    public Tokenizer tokenizer() {
        return this.tokenizer;
    }

    @Override
    public String token() {
        return this.token;
    }

    @Override
    public @Nullable V value() {
        return this.value;
    }

    @Override
    public boolean isKey() {
        return this.key;
    }

    @Override
    public boolean isOccupied() {
        return this.key || this.value != null || this.children != null;
    }

    @Override
    public SortedMap<String, TokenTrie<V>> children() {
        if (this.children == null) {
            return ImmutableSortedMap.of();
        }
        return ImmutableSortedMap.<String, TokenTrie<V>>copyOf(this.children);
    }

    @Override
    public List<String> path() {
        final List<String> path = new ArrayList<>();
        for (var node = this; node.parent != null; node = node.parent) {
            path.add(node.token);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    @Override
    public String key() {
        return this.tokenizer.detokenize(this.path());
    }

    @Override
    public int size() {
        int size = 0;
        final Deque<TokenTrieImpl<V>> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            final var node = stack.pop();
            if (node.key) {
                size++;
            }
            if (node.children != null) {
                for (final var child : node.children.values()) {
                    stack.push(child);
                }
            }
        }
        return size;
    }

    @Override
    public boolean exists(final CharSequence key) {
        return this.contains(key, false);
    }

    @Override
    public boolean contains(final CharSequence key, final boolean partial) {
        final var node = this.resolve(this.tokenize(key));
        return node != null && (node.key || partial);
    }

    @Override
    public @Nullable TokenTrie<V> get(final CharSequence key) {
        return this.resolve(this.tokenize(key));
    }

    @Override
    public @Nullable V getValue(final CharSequence key) {
        final var node = this.resolve(this.tokenize(key));
        return node == null ? null : node.value;
    }

    @Override
    public TokenTrie.@Nullable Mutable<V> getMutable(final CharSequence key) {
        return this.resolve(this.tokenize(key));
    }

    @Override
    public @Nullable V add(final CharSequence key, final @Nullable V value) {
        TokenTrieImpl<V> node = this;

        for (final var token : this.tokenize(key)) {
            if (node.children == null) {
                node.children = new THashMap<>();
            }
            var next = node.children.get(token);
            if (next == null) {
                next = new TokenTrieImpl<>(this.tokenizer, token, node);
                node.children.put(token, next);
            }
            node = next;
        }

        final var previous = node.value;
        node.value = value;
        node.key = true;
        return previous;
    }

    @Override
    public boolean remove(final CharSequence key) {
        final var node = this.resolve(this.tokenize(key));
        if (node == null || !node.key) {
            return false;
        }

        node.value = null;
        node.key = false;

        int pruned = 0;
        var current = node;
        while (current.parent != null && !current.isOccupied()) {
            final var parent = current.parent;
            parent.detach(current);
            current = parent;
            pruned++;
        }

        LOGGER.debug("Removed key \"{}\", pruned {} node(s)", key, pruned);
        return true;
    }

    @Override
    public List<String> getKeysUnderPrefix(final CharSequence prefix) {
        final var tokens = this.tokenize(prefix);
        final var node = this.resolve(tokens);
        if (node == null) {
            return List.of();
        }

        final List<String> keys = new ArrayList<>();
        node.collectKeys(tokens, keys);
        keys.sort(Comparator.naturalOrder());
        return List.copyOf(keys);
    }

    @Override
    public List<TokenTrie<V>> fuzzyGet(final CharSequence key) {
        final var tokens = this.tokenize(key);
        if (tokens.isEmpty()) {
            return List.of();
        }

        final var parent = this.resolve(tokens.subList(0, tokens.size() - 1));
        if (parent == null || parent.children == null) {
            return List.of();
        }

        final var last = tokens.get(tokens.size() - 1);
        return parent.children.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(last))
                .sorted(Map.Entry.comparingByKey())
                .<TokenTrie<V>>map(Map.Entry::getValue)
                .toList();
    }

    @Override
    public List<String> getKeysByPartialPath(final CharSequence fragment) {
        Preconditions.checkNotNull(fragment, "fragment");
        final var needle = fragment.toString();

        final List<String> keys = new ArrayList<>();
        this.collectKeys(List.of(), keys);
        keys.removeIf(key -> !key.contains(needle));
        keys.sort(Comparator.naturalOrder());
        return List.copyOf(keys);
    }

    @Override
    public TokenTrie.Mutable<V> newFromCurrent() {
        return new TokenTrieImpl<>(this.tokenizer);
    }

    private List<String> tokenize(final CharSequence key) {
        Preconditions.checkNotNull(key, "key");
        return this.tokenizer.tokenize(key.toString());
    }

    private @Nullable TokenTrieImpl<V> resolve(final List<String> tokens) {
        var node = this;
        for (final var token : tokens) {
            if (node.children == null) {
                return null;
            }
            node = node.children.get(token);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private void collectKeys(final List<String> prefix, final List<String> keys) {
        final List<String> path = new ArrayList<>(prefix);
        final Deque<Frame<V>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(this, path.size()));

        while (!stack.isEmpty()) {
            final var frame = stack.pop();
            path.subList(frame.depth(), path.size()).clear();
            if (frame.node() != this) {
                path.add(frame.node().token);
            }
            if (frame.node().key) {
                keys.add(this.tokenizer.detokenize(path));
            }
            if (frame.node().children != null) {
                for (final var child : frame.node().children.values()) {
                    stack.push(new Frame<>(child, path.size()));
                }
            }
        }
    }

    private void detach(final TokenTrieImpl<V> child) {
        if (this.children != null && this.children.remove(child.token, child)) {
            if (this.children.isEmpty()) {
                this.children = null;
            }
        }
        child.parent = null;
    }

    // depth is the path length before the node token is appended
    private record Frame<V>(TokenTrieImpl<V> node, int depth) {}
}
