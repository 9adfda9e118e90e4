package dev.stepwise.engine;

import dev.stepwise.error.GraphValidationException;
import dev.stepwise.model.StepGraph;
import dev.stepwise.model.StepNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks for step graphs. Run by {@link StepGraph#seal()}, and usable on its own for
 * node lists rebuilt from serialized form.
 */
public final class GraphValidator {

    private GraphValidator() {}

    public static void validate(StepGraph graph) {
        validate(graph.nodes());
    }

    /**
     * Check, in order: ids are unique, every dependency names a node in the list, and the
     * dependency relation has no cycle.
     *
     * @throws GraphValidationException on the first violation found
     */
    public static void validate(List<StepNode> nodes) {
        var byId = new HashMap<String, StepNode>();
        for (StepNode node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new GraphValidationException("duplicate node id '%s'".formatted(node.id()));
            }
        }

        for (StepNode node : nodes) {
            for (String dependency : node.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    throw new GraphValidationException(
                        "node '%s' depends on unknown node '%s'".formatted(node.id(), dependency));
                }
            }
        }

        checkAcyclic(nodes, byId);
    }

    /**
     * Depth-first walk with an explicit stack, so very long chains from untrusted input cannot
     * overflow the call stack. A dependency already on the current path closes a cycle.
     */
    private static void checkAcyclic(List<StepNode> nodes, Map<String, StepNode> byId) {
        Set<String> done = new HashSet<>();
        Set<String> onPath = new HashSet<>();

        for (StepNode root : nodes) {
            if (done.contains(root.id())) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root));
            onPath.add(root.id());

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.pending.hasNext()) {
                    String next = frame.pending.next();
                    if (onPath.contains(next)) {
                        throw new GraphValidationException(
                            "dependency cycle through '%s' and '%s'".formatted(frame.node.id(), next));
                    }
                    if (!done.contains(next)) {
                        stack.push(new Frame(byId.get(next)));
                        onPath.add(next);
                    }
                } else {
                    stack.pop();
                    onPath.remove(frame.node.id());
                    done.add(frame.node.id());
                }
            }
        }
    }

    private static final class Frame {
        final StepNode node;
        final Iterator<String> pending;

        Frame(StepNode node) {
            this.node = node;
            this.pending = node.dependencies().iterator();
        }
    }
}
