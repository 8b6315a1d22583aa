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

/**
 * A tree node. Children are slot indices into the node list, -1 when missing.
 *
 * @param <K>
 */
class AvlNode<K> {

    static final int NIL = -1;

    K key;
    int left;
    int right;
    int height;

    AvlNode(K key, int left, int right, int height) {
        this.key = key;
        this.left = left;
        this.right = right;
        this.height = height;
    }

    static <K> AvlNode<K> leaf(K key) {
        return new AvlNode<>(key, NIL, NIL, 1);
    }

    @Override
    public String toString() {
        return "AvlNode{" + "key=" + key + ", left=" + left + ", right=" + right + ", height=" + height + '}';
    }
}
