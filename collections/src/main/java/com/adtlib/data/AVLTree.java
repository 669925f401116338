/**
 * ADT Library
 * Copyright (c) 2026 The ADT Library Authors.
 * All rights reserved.
 */

package com.adtlib.data;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The underlying implementation for AVLSet.
 *
 * <p>Every recursive operation takes a subtree and returns the (possibly
 * rebalanced) subtree that replaces it, so nodes never need a reference
 * to their parent.</p>
 */
final class AVLTree {
    private AVLTree() {}

    private static final Logger logger = Logger.getLogger(AVLTree.class.getName());

    /**
     * A tree node that contains a value and exclusively owns its child nodes.
     */
    static final class Node<E> {
        E value;
        Node<E> left;
        Node<E> right;
        int height;
        int size;

        Node(E value) {
            this.value  = value;
            this.height = 1;
            this.size   = 1;
        }

        private Node(E value, Node<E> left, Node<E> right, int height, int size) {
            this.value  = value;
            this.left   = left;
            this.right  = right;
            this.height = height;
            this.size   = size;
        }
    }

    static int height(Node<?> n) {
        return n == null ? 0 : n.height;
    }

    static int size(Node<?> n) {
        return n == null ? 0 : n.size;
    }

    static int balance(Node<?> n) {
        return n == null ? 0 : height(n.left) - height(n.right);
    }

    /**
     * Recomputes the cached height and size from the children. The
     * children must already hold their final values.
     */
    static void update(Node<?> n) {
        n.height = 1 + Math.max(height(n.left), height(n.right));
        n.size   = 1 + size(n.left) + size(n.right);
    }

    // Rotations

    static <E> Node<E> rotateLeft(Node<E> n) {
        Node<E> root = n.right;
        n.right = root.left;
        root.left = n;
        update(n);
        update(root);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("rotate left at " + n.value);
        }
        return root;
    }

    static <E> Node<E> rotateRight(Node<E> n) {
        Node<E> root = n.left;
        n.left = root.right;
        root.right = n;
        update(n);
        update(root);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("rotate right at " + n.value);
        }
        return root;
    }

    // Modification

    static <E> Node<E> insert(Node<E> n, E v, Comparator<? super E> c) {
        if (n == null) {
            return new Node<>(v);
        }

        int cmp = c.compare(v, n.value);
        if (cmp < 0) {
            n.left = insert(n.left, v, c);
        } else if (cmp > 0) {
            n.right = insert(n.right, v, c);
        } else {
            n.value = v;
            return n;
        }

        update(n);

        // the inserted value tells which grandchild grew
        int bf = balance(n);
        if (bf > 1) {
            if (c.compare(v, n.left.value) < 0) {
                return rotateRight(n);
            } else {
                n.left = rotateLeft(n.left);
                return rotateRight(n);
            }
        }
        if (bf < -1) {
            if (c.compare(v, n.right.value) > 0) {
                return rotateLeft(n);
            } else {
                n.right = rotateRight(n.right);
                return rotateLeft(n);
            }
        }
        return n;
    }

    static <E> Node<E> delete(Node<E> n, E v, Comparator<? super E> c) {
        if (n == null) {
            return null;
        }

        int cmp = c.compare(v, n.value);
        if (cmp < 0) {
            n.left = delete(n.left, v, c);
        } else if (cmp > 0) {
            n.right = delete(n.right, v, c);
        } else if (n.left == null || n.right == null) {
            return n.left != null ? n.left : n.right;
        } else {
            E succ = leftmost(n.right).value;
            n.value = succ;
            n.right = delete(n.right, succ, c);
        }

        update(n);

        int bf = balance(n);
        if (bf > 1) {
            if (balance(n.left) >= 0) {
                return rotateRight(n);
            } else {
                n.left = rotateLeft(n.left);
                return rotateRight(n);
            }
        }
        if (bf < -1) {
            if (balance(n.right) <= 0) {
                return rotateLeft(n);
            } else {
                n.right = rotateRight(n.right);
                return rotateLeft(n);
            }
        }
        return n;
    }

    // Query

    static <E> boolean contains(Node<E> n, E v, Comparator<? super E> c) {
        while (n != null) {
            int cmp = c.compare(v, n.value);
            if (cmp == 0)
                return true;
            n = cmp < 0 ? n.left : n.right;
        }
        return false;
    }

    static boolean containsEqual(Node<?> n, Object o) {
        if (n == null) {
            return false;
        }
        return Objects.equals(n.value, o)
            || containsEqual(n.left, o)
            || containsEqual(n.right, o);
    }

    static <E> Node<E> leftmost(Node<E> n) {
        while (n.left != null)
            n = n.left;
        return n;
    }

    static <E> Node<E> rightmost(Node<E> n) {
        while (n.right != null)
            n = n.right;
        return n;
    }

    static <E> Node<E> copy(Node<E> n) {
        if (n == null) {
            return null;
        }
        return new Node<>(n.value, copy(n.left), copy(n.right), n.height, n.size);
    }

    // Traversal

    static <E> void collect(Node<E> n, Collection<? super E> out) {
        if (n != null) {
            collect(n.left, out);
            out.add(n.value);
            collect(n.right, out);
        }
    }

    static <E> void inOrder(Node<E> n, Consumer<? super E>[] procedures) {
        if (n != null) {
            inOrder(n.left, procedures);
            for (Consumer<? super E> p : procedures) {
                p.accept(n.value);
            }
            inOrder(n.right, procedures);
        }
    }

    /**
     * Walks the tree in ascending order keeping the pending ancestors
     * on an explicit stack.
     */
    static final class InOrder<E> {
        private final Deque<Node<E>> stack = new ArrayDeque<>();

        InOrder(Node<E> root) {
            pushLeft(root);
        }

        private void pushLeft(Node<E> n) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
        }

        boolean hasNext() {
            return !stack.isEmpty();
        }

        E next() {
            Node<E> n = stack.pop();
            pushLeft(n.right);
            return n.value;
        }
    }

    // Show

    static String showTree(Node<?> root) {
        StringBuilder buf = new StringBuilder();
        showTree(buf, root, "", true, false);
        return buf.toString();
    }

    private static void showTree(StringBuilder buf, Node<?> t, String bars, boolean top, boolean hasSibling) {
        if (!top) {
            buf.append(bars).append("+--");
        }
        if (t == null) {
            buf.append("@\n");
            return;
        }

        buf.append(t.value).append('\n');
        if (t.left != null || t.right != null) {
            String next = top ? "" : bars + (hasSibling ? "|  " : "   ");
            showTree(buf, t.left, next, false, true);
            showTree(buf, t.right, next, false, false);
        }
    }

    // Assertions

    static <E> boolean valid(Node<E> t, Comparator<? super E> c) {
        return ordered(t, null, null, c) && balanced(t) && validsize(t);
    }

    // lo and hi are the nodes bounding the subtree, null when unbounded
    private static <E> boolean ordered(Node<E> t, Node<E> lo, Node<E> hi, Comparator<? super E> c) {
        if (t == null) {
            return true;
        }
        return (lo == null || c.compare(lo.value, t.value) < 0)
            && (hi == null || c.compare(t.value, hi.value) < 0)
            && ordered(t.left, lo, t, c)
            && ordered(t.right, t, hi, c);
    }

    private static boolean balanced(Node<?> t) {
        if (t == null) {
            return true;
        }
        return Math.abs(balance(t)) <= 1
            && t.height == 1 + Math.max(height(t.left), height(t.right))
            && balanced(t.left) && balanced(t.right);
    }

    private static boolean validsize(Node<?> t) {
        if (t == null) {
            return true;
        }
        return t.size == 1 + size(t.left) + size(t.right)
            && validsize(t.left) && validsize(t.right);
    }
}
