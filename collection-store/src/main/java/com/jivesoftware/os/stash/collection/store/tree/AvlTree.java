/*
 * Copyright 2015 Jive Software.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.jivesoftware.os.stash.collection.store.tree;

import com.google.common.base.Preconditions;
import com.jivesoftware.os.stash.collection.store.CollectionConfig;
import com.jivesoftware.os.stash.collection.store.FreeList;
import com.jivesoftware.os.stash.collection.store.LazyOption;
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import com.jivesoftware.os.stash.io.primative.IntMarshaller;
import java.util.Comparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Height balanced binary search tree of keys whose nodes live in a {@link FreeList} under {@code prefix ++ 'n'} and
 * whose root index lives under {@code prefix ++ 'r'}. Every node touched by an insert or remove is written back
 * through the node list, so a mutation costs O(log n) storage round trips.
 *
 * The comparator must not change once keys are stored.
 *
 * @param <K>
 * @author jonathan.colt
 */
public class AvlTree<K> implements WriteBack {

    private static final Logger LOG = LoggerFactory.getLogger(AvlTree.class);

    private final byte[] prefix;
    private final FreeList<AvlNode<K>> nodes;
    private final LazyOption<Integer> root;
    private final Comparator<K> comparator;

    public AvlTree(KeyValueStorage storage, CollectionConfig config, Marshaller<K> keyMarshaller, Comparator<K> comparator) {
        this.prefix = config.getPrefix();
        this.nodes = new FreeList<>(storage, config.nested((byte) 'n'), new AvlNodeMarshaller<>(keyMarshaller));
        this.root = new LazyOption<>(storage, StashIO.concat(prefix, new byte[] { 'r' }), IntMarshaller.INSTANCE);
        this.comparator = Preconditions.checkNotNull(comparator, "comparator");
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return height of the whole tree, 0 when empty
     */
    public int height() {
        return height(rootId());
    }

    public boolean contains(K key) {
        int id = rootId();
        while (id != AvlNode.NIL) {
            AvlNode<K> node = node(id);
            int c = comparator.compare(key, node.key);
            if (c == 0) {
                return true;
            }
            id = c < 0 ? node.left : node.right;
        }
        return false;
    }

    /**
     * @return true if the key was not already in the tree
     */
    public boolean insert(K key) {
        Preconditions.checkNotNull(key, "key");
        if (contains(key)) {
            return false;
        }
        setRoot(insert(rootId(), key));
        return true;
    }

    /**
     * @return true if the key was in the tree
     */
    public boolean remove(K key) {
        if (!contains(key)) {
            return false;
        }
        setRoot(remove(rootId(), key));
        return true;
    }

    public void clear() {
        nodes.clear();
        root.set(null);
    }

    public K min() {
        int id = rootId();
        if (id == AvlNode.NIL) {
            return null;
        }
        return node(minId(id)).key;
    }

    public K max() {
        int id = rootId();
        if (id == AvlNode.NIL) {
            return null;
        }
        AvlNode<K> node = node(id);
        while (node.right != AvlNode.NIL) {
            node = node(node.right);
        }
        return node.key;
    }

    /**
     * @return the greatest key less than or equal to {@code key}
     */
    public K floor(K key) {
        return below(key, true);
    }

    /**
     * @return the greatest key strictly less than {@code key}
     */
    public K lower(K key) {
        return below(key, false);
    }

    /**
     * @return the least key greater than or equal to {@code key}
     */
    public K ceiling(K key) {
        return above(key, true);
    }

    /**
     * @return the least key strictly greater than {@code key}
     */
    public K higher(K key) {
        return above(key, false);
    }

    /**
     * Checks ordering, stored heights, balance and node count.
     *
     * @throws InconsistentStateException on the first violation
     */
    public void checkInvariants() {
        int[] count = new int[1];
        check(rootId(), null, null, count);
        if (count[0] != nodes.size()) {
            throw new InconsistentStateException("Tree reaches " + count[0] + " nodes but " + nodes.size() + " are allocated in " + new IBA(prefix));
        }
    }

    @Override
    public void flush() {
        nodes.flush();
        root.flush();
    }

    private int check(int id, K lo, K hi, int[] count) {
        if (id == AvlNode.NIL) {
            return 0;
        }
        count[0]++;
        AvlNode<K> node = node(id);
        if (lo != null && comparator.compare(node.key, lo) <= 0 || hi != null && comparator.compare(node.key, hi) >= 0) {
            throw new InconsistentStateException("Node " + id + " with key " + node.key + " is out of order in " + new IBA(prefix));
        }
        int leftHeight = check(node.left, lo, node.key, count);
        int rightHeight = check(node.right, node.key, hi, count);
        if (Math.abs(leftHeight - rightHeight) > 1) {
            throw new InconsistentStateException("Node " + id + " is unbalanced " + leftHeight + " vs " + rightHeight + " in " + new IBA(prefix));
        }
        int height = 1 + Math.max(leftHeight, rightHeight);
        if (node.height != height) {
            throw new InconsistentStateException("Node " + id + " stores height " + node.height + " but is " + height + " high in " + new IBA(prefix));
        }
        return height;
    }

    private K below(K key, boolean inclusive) {
        K found = null;
        int id = rootId();
        while (id != AvlNode.NIL) {
            AvlNode<K> node = node(id);
            int c = comparator.compare(node.key, key);
            if (c == 0 && inclusive) {
                return node.key;
            }
            if (c < 0) {
                found = node.key;
                id = node.right;
            } else {
                id = node.left;
            }
        }
        return found;
    }

    private K above(K key, boolean inclusive) {
        K found = null;
        int id = rootId();
        while (id != AvlNode.NIL) {
            AvlNode<K> node = node(id);
            int c = comparator.compare(node.key, key);
            if (c == 0 && inclusive) {
                return node.key;
            }
            if (c > 0) {
                found = node.key;
                id = node.left;
            } else {
                id = node.right;
            }
        }
        return found;
    }

    private int insert(int id, K key) {
        if (id == AvlNode.NIL) {
            return nodes.allocate(AvlNode.leaf(key));
        }
        AvlNode<K> node = node(id);
        if (comparator.compare(key, node.key) < 0) {
            node.left = insert(node.left, key);
        } else {
            node.right = insert(node.right, key);
        }
        return rebalance(id, node);
    }

    private int remove(int id, K key) {
        AvlNode<K> node = node(id);
        int c = comparator.compare(key, node.key);
        if (c < 0) {
            node.left = remove(node.left, key);
        } else if (c > 0) {
            node.right = remove(node.right, key);
        } else if (node.left == AvlNode.NIL || node.right == AvlNode.NIL) {
            int child = node.left != AvlNode.NIL ? node.left : node.right;
            nodes.free(id);
            return child;
        } else {
            K successor = node(minId(node.right)).key;
            node.key = successor;
            node.right = remove(node.right, successor);
        }
        return rebalance(id, node);
    }

    private int rebalance(int id, AvlNode<K> node) {
        updateHeight(node);
        int balance = height(node.left) - height(node.right);
        if (balance > 1) {
            AvlNode<K> left = node(node.left);
            if (height(left.left) < height(left.right)) {
                node.left = rotateLeft(node.left, left);
            }
            return rotateRight(id, node);
        } else if (balance < -1) {
            AvlNode<K> right = node(node.right);
            if (height(right.right) < height(right.left)) {
                node.right = rotateRight(node.right, right);
            }
            return rotateLeft(id, node);
        }
        nodes.replace(id, node);
        return id;
    }

    private int rotateRight(int id, AvlNode<K> node) {
        int pivotId = node.left;
        AvlNode<K> pivot = node(pivotId);
        node.left = pivot.right;
        updateHeight(node);
        nodes.replace(id, node);
        pivot.right = id;
        updateHeight(pivot);
        nodes.replace(pivotId, pivot);
        return pivotId;
    }

    private int rotateLeft(int id, AvlNode<K> node) {
        int pivotId = node.right;
        AvlNode<K> pivot = node(pivotId);
        node.right = pivot.left;
        updateHeight(node);
        nodes.replace(id, node);
        pivot.left = id;
        updateHeight(pivot);
        nodes.replace(pivotId, pivot);
        return pivotId;
    }

    private void updateHeight(AvlNode<K> node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
    }

    private int height(int id) {
        return id == AvlNode.NIL ? 0 : node(id).height;
    }

    private int minId(int id) {
        AvlNode<K> node = node(id);
        while (node.left != AvlNode.NIL) {
            id = node.left;
            node = node(id);
        }
        return id;
    }

    private AvlNode<K> node(int id) {
        AvlNode<K> node = nodes.get(id);
        if (node == null) {
            throw new InconsistentStateException("Tree links to vacant node " + id + " in " + new IBA(prefix));
        }
        return node;
    }

    private int rootId() {
        Integer id = root.get();
        return id == null ? AvlNode.NIL : id;
    }

    private void setRoot(int id) {
        if (id == AvlNode.NIL) {
            root.set(null);
        } else {
            root.set(id);
        }
        LOG.trace("Root of {} is now {}", new IBA(prefix), id);
    }
}
