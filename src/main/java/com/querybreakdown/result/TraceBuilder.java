package com.querybreakdown.result;

import com.querybreakdown.search.EditNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 从最优叶子沿父链回溯，按应用顺序还原编辑路径。
 */
public final class TraceBuilder {
    private TraceBuilder() {
    }

    public static List<EditNode> trace(EditNode leaf) {
        if (leaf == null || leaf.isRoot()) {
            return List.of();
        }
        Deque<EditNode> stack = new ArrayDeque<>();
        for (EditNode current = leaf; !current.isRoot(); current = current.getParent()) {
            stack.push(current);
        }
        return List.copyOf(stack);
    }

    public static List<EditDescriptor> build(EditNode leaf) {
        List<EditDescriptor> edits = new ArrayList<>();
        for (EditNode node : trace(leaf)) {
            edits.add(EditDescriptor.from(node));
        }
        return List.copyOf(edits);
    }
}
