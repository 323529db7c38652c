package org.csu.reldb.storage.index;

import org.csu.reldb.common.model.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 内存 B 树索引，阶数为 t：每个节点最多 2t-1 条记录。
 *
 * 插入采用预分裂：根满时先分裂根，下降途中遇到满的子节点先分裂再进入，中位记录上移到父节点。
 * 相等的键放到右侧，因此重复键可能同时出现在分隔键两侧的子树中，查找会进入所有可能包含该键的子树。
 *
 * 删除是简化的单条摘除：不合并、不重新平衡。内部节点上的记录用左子树的前驱（或右子树的后继）替换，
 * 两侧子树都为空时连同一个空子树一起去掉。树因此可能变得不平衡，但仍保持有序。
 */
public class BTreeIndex implements Index {

    public static final int DEFAULT_ORDER = 3;

    private final String columnName;
    private final int order;
    private BTreeNode root = new BTreeNode(true);
    private int size = 0;

    public BTreeIndex(String columnName) {
        this(columnName, DEFAULT_ORDER);
    }

    public BTreeIndex(String columnName, int order) {
        if (order < 2) {
            throw new IllegalArgumentException("B-tree order must be at least 2, got " + order);
        }
        this.columnName = columnName;
        this.order = order;
    }

    public int getOrder() {
        return order;
    }

    @Override
    public String getColumnName() {
        return columnName;
    }

    @Override
    public IndexType getType() {
        return IndexType.BTREE;
    }

    @Override
    public int size() {
        return size;
    }

    private int maxKeys() {
        return 2 * order - 1;
    }

    // ------------------------------------------------------------------ 插入

    @Override
    public void insert(Value key, int slot) {
        if (root.getKeyCount() == maxKeys()) {
            BTreeNode newRoot = new BTreeNode(false);
            newRoot.children.add(root);
            splitChild(newRoot, 0);
            root = newRoot;
        }
        insertNonFull(root, key, slot);
        size++;
    }

    private void insertNonFull(BTreeNode node, Value key, int slot) {
        int i = upperBound(node, key);
        if (node.isLeaf()) {
            node.insertEntry(i, key, slot);
            return;
        }
        if (node.children.get(i).getKeyCount() == maxKeys()) {
            splitChild(node, i);
            if (key.compareTo(node.keys.get(i)) >= 0) {
                i++;
            }
        }
        insertNonFull(node.children.get(i), key, slot);
    }

    /**
     * 分裂 parent 的第 index 个子节点，中位记录上移。
     */
    private void splitChild(BTreeNode parent, int index) {
        BTreeNode full = parent.children.get(index);
        BTreeNode sibling = new BTreeNode(full.isLeaf());
        int mid = order - 1;

        for (int j = mid + 1; j < full.getKeyCount(); j++) {
            sibling.insertEntry(sibling.getKeyCount(), full.keys.get(j), full.slots.get(j));
        }
        if (!full.isLeaf()) {
            sibling.children.addAll(full.children.subList(mid + 1, full.children.size()));
            full.children.subList(mid + 1, full.children.size()).clear();
        }
        Value medianKey = full.keys.get(mid);
        int medianSlot = full.slots.get(mid);
        full.keys.subList(mid, full.keys.size()).clear();
        full.slots.subList(mid, full.slots.size()).clear();

        parent.insertEntry(index, medianKey, medianSlot);
        parent.children.add(index + 1, sibling);
    }

    // 第一个大于 key 的位置
    private int upperBound(BTreeNode node, Value key) {
        int i = 0;
        while (i < node.getKeyCount() && key.compareTo(node.keys.get(i)) >= 0) {
            i++;
        }
        return i;
    }

    // ------------------------------------------------------------------ 查找

    @Override
    public List<Integer> search(Value key) {
        List<Integer> result = new ArrayList<>();
        collectRange(root, key, key, result);
        return result;
    }

    /**
     * 范围查找，lo 与 hi 都包含在内；为 null 的一端不设界。
     * @return 按键升序排列的槽位
     */
    public List<Integer> rangeSearch(Value lo, Value hi) {
        List<Integer> result = new ArrayList<>();
        collectRange(root, lo, hi, result);
        return result;
    }

    // 剪枝的中序遍历
    private void collectRange(BTreeNode node, Value lo, Value hi, List<Integer> result) {
        int n = node.getKeyCount();
        for (int i = 0; i <= n; i++) {
            if (!node.isLeaf() && childMayOverlap(node, i, lo, hi)) {
                collectRange(node.children.get(i), lo, hi, result);
            }
            if (i < n && inRange(node.keys.get(i), lo, hi)) {
                result.add(node.slots.get(i));
            }
        }
    }

    // 第 i 个子树的键落在 [keys[i-1], keys[i]] 内（重复键使两端都可能取到）
    private boolean childMayOverlap(BTreeNode node, int i, Value lo, Value hi) {
        boolean belowHi = i == 0 || hi == null || node.keys.get(i - 1).compareTo(hi) <= 0;
        boolean aboveLo = i == node.getKeyCount() || lo == null || node.keys.get(i).compareTo(lo) >= 0;
        return belowHi && aboveLo;
    }

    private boolean inRange(Value key, Value lo, Value hi) {
        return (lo == null || key.compareTo(lo) >= 0) && (hi == null || key.compareTo(hi) <= 0);
    }

    // ------------------------------------------------------------------ 删除

    @Override
    public boolean delete(Value key, int slot) {
        boolean removed = deleteFrom(root, key, slot);
        if (removed) {
            size--;
            // 根节点没有记录且只剩一个子节点时，树高减一
            while (!root.isLeaf() && root.getKeyCount() == 0) {
                root = root.children.get(0);
            }
        }
        return removed;
    }

    // 先序查找第一个精确匹配 (key, slot) 的节点并摘除该记录
    private boolean deleteFrom(BTreeNode node, Value key, int slot) {
        for (int i = 0; i < node.getKeyCount(); i++) {
            if (node.keys.get(i).compareTo(key) == 0 && node.slots.get(i) == slot) {
                excise(node, i);
                return true;
            }
        }
        if (node.isLeaf()) {
            return false;
        }
        for (int i = 0; i <= node.getKeyCount(); i++) {
            if (childMayOverlap(node, i, key, key) && deleteFrom(node.children.get(i), key, slot)) {
                return true;
            }
        }
        return false;
    }

    private void excise(BTreeNode node, int index) {
        if (node.isLeaf()) {
            node.removeEntry(index);
            return;
        }
        BTreeNode replacement = new BTreeNode(true);
        if (removeMax(node.children.get(index), replacement)
                || removeMin(node.children.get(index + 1), replacement)) {
            node.keys.set(index, replacement.keys.get(0));
            node.slots.set(index, replacement.slots.get(0));
            return;
        }
        // 两侧子树都没有记录
        node.removeEntry(index);
        node.children.remove(index + 1);
    }

    /**
     * 摘下子树中最大的记录放入 out。子树为空时返回 false。
     */
    private boolean removeMax(BTreeNode node, BTreeNode out) {
        int n = node.getKeyCount();
        if (!node.isLeaf() && removeMax(node.children.get(n), out)) {
            return true;
        }
        if (n == 0) {
            return false;
        }
        out.insertEntry(0, node.keys.get(n - 1), node.slots.get(n - 1));
        node.removeEntry(n - 1);
        if (!node.isLeaf()) {
            node.children.remove(n); // 该子树已为空
        }
        return true;
    }

    private boolean removeMin(BTreeNode node, BTreeNode out) {
        if (!node.isLeaf() && removeMin(node.children.get(0), out)) {
            return true;
        }
        if (node.getKeyCount() == 0) {
            return false;
        }
        out.insertEntry(0, node.keys.get(0), node.slots.get(0));
        node.removeEntry(0);
        if (!node.isLeaf()) {
            node.children.remove(0);
        }
        return true;
    }

    // ------------------------------------------------------------------ 遍历

    @Override
    public List<Map.Entry<Value, Integer>> entries() {
        List<Map.Entry<Value, Integer>> result = new ArrayList<>(size);
        collectEntries(root, result);
        return result;
    }

    private void collectEntries(BTreeNode node, List<Map.Entry<Value, Integer>> result) {
        for (int i = 0; i <= node.getKeyCount(); i++) {
            if (!node.isLeaf()) {
                collectEntries(node.children.get(i), result);
            }
            if (i < node.getKeyCount()) {
                result.add(Map.entry(node.keys.get(i), node.slots.get(i)));
            }
        }
    }

    /**
     * 树高，只有根叶子时为 1。
     */
    int height() {
        int height = 1;
        BTreeNode node = root;
        while (!node.isLeaf()) {
            node = node.children.get(0);
            height++;
        }
        return height;
    }

    BTreeNode getRoot() {
        return root;
    }
}
