/**
 * ADT Library
 * Copyright (c) 2026 The ADT Library Authors.
 * All rights reserved.
 */

package com.adtlib.data;

import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.base.Joiner;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Lists;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A mutable ordered set backed by an AVL tree.</p>
 *
 * <p>The set does not store an ordering. Every operation that needs one takes
 * a comparator, and the caller must pass comparators that agree on a strict
 * total order over all elements ever stored in one set. Passing inconsistent
 * comparators is not detected and leaves the set in an unspecified state.</p>
 *
 * <p>Elements that compare equal are never stored twice: pushing an element
 * equal to a stored one replaces the stored element.</p>
 *
 * <p>This class is not thread safe. Iterators are fail-fast with respect to
 * structural modification.</p>
 *
 * @param <E> the type of set elements
 */
public final class AVLSet<E> implements Iterable<E> {
    private static final Logger logger = Logger.getLogger(AVLSet.class.getName());

    private AVLTree.Node<E> root;
    private int modCount;

    // Construction

    /**
     * Construct an empty set.
     */
    public AVLSet() {}

    private AVLSet(AVLTree.Node<E> root) {
        this.root = root;
    }

    /**
     * Construct an empty set.
     */
    public static <E> AVLSet<E> empty() {
        return new AVLSet<>();
    }

    /**
     * Construct a set by pushing the given values in iteration order.
     *
     * @param values the values to be pushed
     * @param c the comparator that orders the values
     * @throws NullPointerException if <tt>values</tt> or <tt>c</tt> is null
     */
    public static <E> AVLSet<E> fromSequence(Iterable<? extends E> values, Comparator<? super E> c) {
        checkNotNull(values);
        checkNotNull(c);

        AVLSet<E> set = new AVLSet<>();
        int count = 0;
        for (E v : values) {
            set.push(v, c);
            count++;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("built set of " + set.size() + " elements from " + count + " values");
        }
        return set;
    }

    /**
     * Construct a set with given elements.
     *
     * @param c the comparator that orders the elements
     * @throws NullPointerException if <tt>c</tt> is null
     */
    @SafeVarargs
    public static <E> AVLSet<E> of(Comparator<? super E> c, E... elements) {
        return fromSequence(Lists.newArrayList(elements), c);
    }

    // Query Operations

    /**
     * Returns {@code true} if this set contains no elements.
     */
    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Returns the number of elements in this set.
     */
    public int size() {
        return AVLTree.size(root);
    }

    /**
     * Returns the height of the underlying tree, 0 for an empty set.
     */
    public int height() {
        return AVLTree.height(root);
    }

    /**
     * Returns {@code true} if this set contains an element that compares
     * equal to the given element.
     *
     * @param e element whose presence in this set is to be tested
     * @param c the comparator that orders this set
     * @throws NullPointerException if <tt>c</tt> is null
     */
    public boolean contains(E e, Comparator<? super E> c) {
        checkNotNull(c);
        return AVLTree.contains(root, e, c);
    }

    /**
     * Returns {@code true} if this set contains an element equal to the given
     * object as defined by {@link Object#equals(Object)}. Unlike the ordered
     * lookup this visits every element.
     *
     * @param o object whose presence in this set is to be tested
     */
    public boolean contains(Object o) {
        return AVLTree.containsEqual(root, o);
    }

    /**
     * Returns the lowest element in this set, or {@code Optional.empty()} if
     * this set is empty or the lowest element is null.
     */
    public Optional<E> min() {
        return root == null ? Optional.empty() : Optional.ofNullable(AVLTree.leftmost(root).value);
    }

    /**
     * Returns the highest element in this set, or {@code Optional.empty()} if
     * this set is empty or the highest element is null.
     */
    public Optional<E> max() {
        return root == null ? Optional.empty() : Optional.ofNullable(AVLTree.rightmost(root).value);
    }

    /**
     * Returns a new list holding the elements of this set in ascending order.
     * The returned list is not backed by this set.
     */
    public List<E> toList() {
        List<E> list = Lists.newArrayListWithCapacity(size());
        AVLTree.collect(root, list);
        return list;
    }

    /**
     * Invokes every procedure on each element in ascending order. For each
     * element all procedures run, in argument order, before the next element
     * is visited. Procedures must not change how elements compare.
     *
     * @param procedures the procedures to invoke
     * @throws NullPointerException if any procedure is null
     */
    @SafeVarargs
    public final void forEachInOrder(Consumer<? super E>... procedures) {
        checkNotNull(procedures);
        for (Consumer<? super E> p : procedures) {
            checkNotNull(p);
        }
        if (procedures.length > 0) {
            AVLTree.inOrder(root, procedures);
        }
    }

    /**
     * Returns a deep copy of this set. The copy has the same tree shape and
     * shares no nodes with this set.
     */
    @Override
    public AVLSet<E> clone() {
        return new AVLSet<>(AVLTree.copy(root));
    }

    /**
     * Returns an iterator over the elements in ascending order. The iterator
     * does not support removal.
     */
    @Override
    public Iterator<E> iterator() {
        AVLTree.InOrder<E> walk = new AVLTree.InOrder<>(root);
        int expected = modCount;
        return new AbstractIterator<E>() {
            @Override
            protected E computeNext() {
                if (modCount != expected)
                    throw new ConcurrentModificationException();
                return walk.hasNext() ? walk.next() : endOfData();
            }
        };
    }

    /**
     * Returns a sequential {@code Stream} over the elements in ascending order.
     */
    public Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    // Modification Operations

    /**
     * Adds the given element, or replaces the stored element that compares
     * equal to it.
     *
     * @param e element to be added to this set
     * @param c the comparator that orders this set
     * @throws NullPointerException if <tt>c</tt> is null
     */
    public void push(E e, Comparator<? super E> c) {
        checkNotNull(c);
        int before = size();
        root = AVLTree.insert(root, e, c);
        if (size() != before) {
            modCount++;
        }
    }

    /**
     * Removes the element that compares equal to the given element.
     *
     * @param e element to be removed from this set, if present
     * @param c the comparator that orders this set
     * @return {@code true} if an element was removed
     * @throws NullPointerException if <tt>c</tt> is null
     */
    public boolean remove(E e, Comparator<? super E> c) {
        checkNotNull(c);
        int before = size();
        root = AVLTree.delete(root, e, c);
        if (size() == before) {
            return false;
        }
        modCount++;
        return true;
    }

    /**
     * Removes all of the elements from this set.
     */
    public void clear() {
        if (root != null) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("discarding " + root.size + " elements");
            }
            root = null;
            modCount++;
        }
    }

    // Diagnostics

    /**
     * Returns {@code true} if the underlying tree is ordered by the given
     * comparator, height balanced, and every node caches its correct height
     * and subtree size.
     *
     * @param c the comparator that orders this set
     * @throws NullPointerException if <tt>c</tt> is null
     */
    public boolean valid(Comparator<? super E> c) {
        checkNotNull(c);
        return AVLTree.valid(root, c);
    }

    /**
     * Returns a drawing of the underlying tree, one node per line. A left
     * child is drawn before its sibling and {@code @} marks a missing child.
     */
    public String showTree() {
        return AVLTree.showTree(root);
    }

    /**
     * Returns the elements in ascending order, separated by a single space
     * and enclosed in square brackets.
     */
    @Override
    public String toString() {
        return Joiner.on(' ').useForNull("null")
                     .appendTo(new StringBuilder("["), this)
                     .append(']')
                     .toString();
    }
}
