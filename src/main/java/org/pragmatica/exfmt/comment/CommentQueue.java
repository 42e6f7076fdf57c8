package org.pragmatica.exfmt.comment;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Persistent queue of comments ordered by line. Taking a prefix shares the remaining
 * cells with the original queue, so a queue can be kept aside and restored cheaply.
 */
public final class CommentQueue implements Iterable<GatheredComment> {
    public static final CommentQueue EMPTY = new CommentQueue(null, null);

    private final GatheredComment head;
    private final CommentQueue tail;

    private CommentQueue(GatheredComment head, CommentQueue tail) {
        this.head = head;
        this.tail = tail;
    }

    public static CommentQueue of(List<GatheredComment> comments) {
        return EMPTY.prependAll(comments);
    }

    /**
     * Result of {@link #splitWhile}: the taken prefix in order and the queue after it.
     */
    public record Split(List<GatheredComment> taken, CommentQueue rest) {}

    public boolean isEmpty() {
        return this == EMPTY;
    }

    public Optional<GatheredComment> peek() {
        return isEmpty() ? Optional.empty() : Optional.of(head);
    }

    public GatheredComment head() {
        if (isEmpty()) {
            throw new NoSuchElementException("Comment queue is empty");
        }
        return head;
    }

    public CommentQueue tail() {
        if (isEmpty()) {
            throw new NoSuchElementException("Comment queue is empty");
        }
        return tail;
    }

    public CommentQueue prepend(GatheredComment comment) {
        return new CommentQueue(comment, this);
    }

    /**
     * Put the comments in front of this queue, keeping their order.
     */
    public CommentQueue prependAll(List<GatheredComment> comments) {
        var result = this;
        for (int i = comments.size() - 1; i >= 0; i--) {
            result = result.prepend(comments.get(i));
        }
        return result;
    }

    public Split splitWhile(IntPredicate linePredicate) {
        var taken = new ArrayList<GatheredComment>();
        var current = this;

        while (!current.isEmpty() && linePredicate.test(current.head.line())) {
            taken.add(current.head);
            current = current.tail;
        }
        return new Split(taken, current);
    }

    public CommentQueue dropWhile(IntPredicate linePredicate) {
        return splitWhile(linePredicate).rest();
    }

    public boolean anyLine(IntPredicate linePredicate) {
        for (var comment : this) {
            if (linePredicate.test(comment.line())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<GatheredComment> iterator() {
        return new Iterator<>() {
            private CommentQueue current = CommentQueue.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public GatheredComment next() {
                if (current.isEmpty()) {
                    throw new NoSuchElementException();
                }
                var result = current.head;
                current = current.tail;
                return result;
            }
        };
    }
}
