package com.docpublish.core.writer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Named output accumulator of a {@link Writer}: an ordered sequence of string fragments.
 *
 * <p>Fragments are appended at the end or prepended at the front while the tree is walked. Once
 * the writer freezes the part, its content is fixed in forward order and further writes fail.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Part part = new Part("body");
 * part.append("a");
 * part.append("b");
 * part.prepend("c");
 * part.content();   // "cab"
 * }</pre>
 */
public final class Part {

    private final String name;
    private final Deque<String> fragments = new ArrayDeque<>();
    private boolean frozen;

    public Part(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    public void append(String fragment) {
        checkWritable();
        fragments.addLast(Objects.requireNonNull(fragment, "fragment must not be null"));
    }

    public void prepend(String fragment) {
        checkWritable();
        fragments.addFirst(Objects.requireNonNull(fragment, "fragment must not be null"));
    }

    /**
     * Returns the fragments in forward order.
     *
     * @return snapshot of the fragments
     */
    public List<String> fragments() {
        return List.copyOf(fragments);
    }

    /**
     * Returns the concatenated fragments.
     *
     * @return part content
     */
    public String content() {
        return String.join("", fragments);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    void freeze() {
        frozen = true;
    }

    void reset() {
        fragments.clear();
        frozen = false;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Part '" + name + "' is finalised");
        }
    }

    @Override
    public String toString() {
        return "Part[" + name + ", " + fragments.size() + " fragment(s)" + (frozen ? ", frozen" : "") + "]";
    }
}
