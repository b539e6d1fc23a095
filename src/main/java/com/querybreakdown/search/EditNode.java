package com.querybreakdown.search;

import com.querybreakdown.location.Position;

/**
 * 搜索树上的一步编辑。
 *
 * <p>节点只持有父节点引用，兄弟节点不保存；从叶子沿父链回溯即可得到完整编辑路径。
 * 位置均为原始查询中的闭区间。
 */
public final class EditNode {
    private static final EditNode ROOT = new EditNode(null, null, null, null, null, null, 0);

    private final EditNode parent;
    private final Position start;
    private final Position end;
    private final EditType type;
    private final String replacedFrom;
    private final String replacedTo;
    private final int cost;

    private EditNode(EditNode parent, Position start, Position end, EditType type,
                     String replacedFrom, String replacedTo, int cost) {
        this.parent = parent;
        this.start = start;
        this.end = end;
        this.type = type;
        this.replacedFrom = replacedFrom;
        this.replacedTo = replacedTo;
        this.cost = cost;
    }

    /**
     * 表示“尚未应用任何编辑”的根节点。
     */
    public static EditNode root() {
        return ROOT;
    }

    public static EditNode deletion(EditNode parent, Position start, Position end, int cost) {
        return new EditNode(parent, start, end, EditType.DELETION, null, null, cost);
    }

    public static EditNode replacement(EditNode parent, Position start, Position end,
                                       String replacedFrom, String replacedTo, int cost) {
        return new EditNode(parent, start, end, EditType.REPLACEMENT, replacedFrom, replacedTo, cost);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public EditNode getParent() {
        return parent;
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    public EditType getType() {
        return type;
    }

    public String getReplacedFrom() {
        return replacedFrom;
    }

    public String getReplacedTo() {
        return replacedTo;
    }

    /**
     * 受影响的字符数；跨行删除额外计 1，对应编辑时插入的换行。
     */
    public int getCost() {
        return cost;
    }

    /**
     * 从根到当前节点的编辑步数。
     */
    public int depth() {
        int depth = 0;
        for (EditNode node = this; !node.isRoot(); node = node.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "EditNode[root]";
        }
        return "EditNode[" + type + " " + start + "-" + end
            + (type == EditType.REPLACEMENT ? " " + replacedFrom + "->" + replacedTo : "")
            + ", cost=" + cost + "]";
    }
}
