package org.csu.reldb.storage.index;

import org.csu.reldb.common.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * B 树节点。keys 与 slots 一一对应；内部节点的 children 数量总是 keys 数量加一。
 */
class BTreeNode {

    final List<Value> keys = new ArrayList<>();
    final List<Integer> slots = new ArrayList<>();
    final List<BTreeNode> children = new ArrayList<>();
    private final boolean leaf;

    BTreeNode(boolean leaf) {
        this.leaf = leaf;
    }

    boolean isLeaf() {
        return leaf;
    }

    int getKeyCount() {
        return keys.size();
    }

    void insertEntry(int index, Value key, int slot) {
        keys.add(index, key);
        slots.add(index, slot);
    }

    void removeEntry(int index) {
        keys.remove(index);
        slots.remove(index);
    }
}
