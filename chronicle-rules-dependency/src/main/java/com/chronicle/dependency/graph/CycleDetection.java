package com.chronicle.dependency.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cycle detection over a {@link DependencyGraph}. Both passes are iterative, so deep graphs do not
 * overflow the stack.
 * <ul>
 *   <li>three-colour DFS (white, grey, black): every edge into a grey node closes a cycle, reported as a path</li>
 *   <li>strongly connected components (Tarjan): exact membership, since a back-edge path does not name every
 *       node of a component reached through cross edges</li>
 * </ul>
 */
public final class CycleDetection {

    private enum Colour { WHITE, GREY, BLACK }

    private CycleDetection() {
    }

    public static CycleReport detect(DependencyGraph graph) {
        return new CycleReport(membership(graph), cyclePaths(graph));
    }

    static List<List<String>> cyclePaths(DependencyGraph graph) {
        Map<String, Colour> colour = new HashMap<>();
        for (String id : graph.nodeIds()) colour.put(id, Colour.WHITE);
        List<List<String>> cycles = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (String root : graph.nodeIds()) {
            if (colour.get(root) != Colour.WHITE) continue;
            List<String> path = new ArrayList<>();
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, graph.dependenciesOf(root)));
            colour.put(root, Colour.GREY);
            path.add(root);
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.next < top.targets.size()) {
                    String target = top.targets.get(top.next++);
                    Colour c = colour.get(target);
                    if (c == Colour.WHITE) {
                        colour.put(target, Colour.GREY);
                        path.add(target);
                        stack.push(new Frame(target, graph.dependenciesOf(target)));
                    } else if (c == Colour.GREY) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                        cycle.add(target);
                        if (seen.add(String.join("\u0000", cycle))) cycles.add(cycle);
                    }
                } else {
                    stack.pop();
                    colour.put(top.nodeId, Colour.BLACK);
                    path.remove(path.size() - 1);
                }
            }
        }
        return cycles;
    }

    static Set<String> membership(DependencyGraph graph) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> low = new HashMap<>();
        Deque<String> sccStack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        Set<String> inCycle = new LinkedHashSet<>();
        int counter = 0;

        for (String root : graph.nodeIds()) {
            if (index.containsKey(root)) continue;
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, graph.dependenciesOf(root)));
            index.put(root, counter);
            low.put(root, counter);
            counter++;
            sccStack.push(root);
            onStack.add(root);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.next < top.targets.size()) {
                    String target = top.targets.get(top.next++);
                    if (!index.containsKey(target)) {
                        index.put(target, counter);
                        low.put(target, counter);
                        counter++;
                        sccStack.push(target);
                        onStack.add(target);
                        stack.push(new Frame(target, graph.dependenciesOf(target)));
                    } else if (onStack.contains(target)) {
                        low.put(top.nodeId, Math.min(low.get(top.nodeId), index.get(target)));
                    }
                    continue;
                }
                stack.pop();
                if (!stack.isEmpty()) {
                    String parent = stack.peek().nodeId;
                    low.put(parent, Math.min(low.get(parent), low.get(top.nodeId)));
                }
                if (low.get(top.nodeId).equals(index.get(top.nodeId))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = sccStack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(top.nodeId));
                    if (component.size() > 1 || graph.dependenciesOf(top.nodeId).contains(top.nodeId)) {
                        inCycle.addAll(component);
                    }
                }
            }
        }
        return inCycle;
    }

    private static final class Frame {
        final String nodeId;
        final List<String> targets;
        int next;

        Frame(String nodeId, Set<String> targets) {
            this.nodeId = nodeId;
            this.targets = new ArrayList<>(targets);
        }
    }
}
