/**
 * ADT Library
 * Copyright (c) 2026 The ADT Library Authors.
 * All rights reserved.
 */

package com.adtlib.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.adtlib.data.AVLTree.Node;

public class AVLTreeTest {
    private static final Comparator<Integer> ORD = Ordering.natural();

    private static Node<Integer> leaf(int v) {
        return new Node<>(v);
    }

    private static Node<Integer> node(int v, Node<Integer> l, Node<Integer> r) {
        Node<Integer> n = new Node<>(v);
        n.left = l;
        n.right = r;
        AVLTree.update(n);
        return n;
    }

    private static List<Integer> values(Node<Integer> root) {
        List<Integer> out = new ArrayList<>();
        AVLTree.collect(root, out);
        return out;
    }

    @Test
    public void rotateLeft_recomputes_child_then_root() {
        //   10               20
        //  /  \             /  \
        // 5    20    =>   10    30
        //     /  \       /  \     \
        //   15    30    5   15     40
        //           \
        //            40
        Node<Integer> n = node(10, leaf(5), node(20, leaf(15), node(30, null, leaf(40))));
        Node<Integer> root = AVLTree.rotateLeft(n);

        assertThat(root.value, is(20));
        assertSame(n, root.left);
        assertThat(n.right.value, is(15));
        assertThat(n.height, is(2));
        assertThat(n.size, is(3));
        assertThat(root.height, is(3));
        assertThat(root.size, is(6));
        assertTrue(AVLTree.valid(root, ORD));
        assertEquals(ImmutableList.of(5, 10, 15, 20, 30, 40), values(root));
    }

    @Test
    public void rotateRight_recomputes_child_then_root() {
        Node<Integer> n = node(30, node(20, node(10, leaf(5), null), leaf(25)), leaf(40));
        Node<Integer> root = AVLTree.rotateRight(n);

        assertThat(root.value, is(20));
        assertSame(n, root.right);
        assertThat(n.left.value, is(25));
        assertThat(n.height, is(2));
        assertThat(n.size, is(3));
        assertThat(root.height, is(3));
        assertThat(root.size, is(6));
        assertTrue(AVLTree.valid(root, ORD));
        assertEquals(ImmutableList.of(5, 10, 20, 25, 30, 40), values(root));
    }

    @Test
    public void insert_into_empty_creates_leaf() {
        Node<Integer> n = AVLTree.insert(null, 7, ORD);
        assertThat(n.value, is(7));
        assertThat(n.height, is(1));
        assertThat(n.size, is(1));
        assertNull(n.left);
        assertNull(n.right);
    }

    @Test
    public void delete_missing_returns_same_tree() {
        Node<Integer> root = node(2, leaf(1), leaf(3));
        assertSame(root, AVLTree.delete(root, 4, ORD));
        assertThat(root.size, is(3));
        assertNull(AVLTree.delete(null, 4, ORD));
    }

    @Test
    public void copy_shares_no_nodes() {
        Node<Integer> root = node(2, leaf(1), leaf(3));
        Node<Integer> copy = AVLTree.copy(root);
        assertNotSame(root, copy);
        assertNotSame(root.left, copy.left);
        assertNotSame(root.right, copy.right);
        assertEquals(AVLTree.showTree(root), AVLTree.showTree(copy));
        assertThat(copy.height, is(2));
        assertThat(copy.size, is(3));
    }

    @Test
    public void valid_detects_wrong_order() {
        assertFalse(AVLTree.valid(node(2, leaf(3), leaf(1)), ORD));
        // 4 hangs below 1 on the left side of 3
        assertFalse(AVLTree.valid(node(3, node(1, null, leaf(4)), leaf(5)), ORD));
    }

    @Test
    public void valid_detects_wrong_balance() {
        assertFalse(AVLTree.valid(node(3, node(2, leaf(1), null), null), ORD));
    }

    @Test
    public void valid_detects_stale_cache() {
        Node<Integer> root = node(2, leaf(1), leaf(3));
        root.size = 2;
        assertFalse(AVLTree.valid(root, ORD));

        root = node(2, leaf(1), leaf(3));
        root.left.height = 0;
        assertFalse(AVLTree.valid(root, ORD));
    }

    @Test
    public void valid_rejects_duplicates() {
        assertFalse(AVLTree.valid(node(2, leaf(2), null), ORD));
    }

    @Test
    public void showTree_empty() {
        assertEquals("@\n", AVLTree.showTree(null));
    }

    @Test
    public void showTree_marks_missing_child() {
        assertEquals("2\n+--@\n+--3\n", AVLTree.showTree(node(2, null, leaf(3))));
    }

    @Test
    public void inOrder_walk() {
        AVLTree.InOrder<Integer> walk = new AVLTree.InOrder<>(node(4, node(2, leaf(1), leaf(3)), leaf(5)));
        List<Integer> out = new ArrayList<>();
        while (walk.hasNext()) {
            out.add(walk.next());
        }
        assertEquals(ImmutableList.of(1, 2, 3, 4, 5), out);
        assertFalse(new AVLTree.InOrder<Integer>(null).hasNext());
    }

    @Test
    public void rotations_traced_at_finest() {
        Logger logger = Logger.getLogger("com.adtlib.data");
        Level saved = logger.getLevel();
        List<String> messages = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel() == Level.FINEST)
                    messages.add(record.getMessage());
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };

        logger.setLevel(Level.FINEST);
        logger.addHandler(handler);
        try {
            Node<Integer> root = null;
            for (int v : new int[] {1, 2, 3, 5, 4}) {
                root = AVLTree.insert(root, v, ORD);
            }
            assertTrue(AVLTree.valid(root, ORD));
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(saved);
        }

        // 1 rotates left, then 5 right and 3 left for the right-left case
        assertEquals(ImmutableList.of("rotate left at 1",
                                      "rotate right at 5",
                                      "rotate left at 3"),
                     messages);
    }
}
