package com.tickframe.core.resolver;

import com.tickframe.api.exception.CircularDependencyException;
import com.tickframe.api.exception.MissingDependencyException;
import com.tickframe.api.plugin.FailureKind;
import com.tickframe.api.plugin.PluginFailure;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 依赖解析器
 * <p>
 * 职责：
 * 1. 硬依赖成环检测（环上成员全部失败，其余插件不受影响）
 * 2. 缺失依赖检测，并沿依赖链传递失败
 * 3. 硬依赖 + 软依赖（提供方 -> 消费方）的确定性拓扑排序
 * </p>
 * 同一输入永远得到同一输出：平局按注册顺序，再按名称。
 * 无状态，可重复调用。
 */
@Slf4j
public class DependencyResolver {

    /**
     * 解析
     *
     * @param nodes 按注册顺序排列的插件
     */
    public Resolution resolve(List<ResolverNode> nodes) {
        Map<String, ResolverNode> byName = new LinkedHashMap<>();
        Map<String, Integer> index = new HashMap<>();
        for (ResolverNode node : nodes) {
            byName.put(node.name(), node);
            index.put(node.name(), index.size());
        }
        Comparator<String> registrationOrder = Comparator
                .<String>comparingInt(index::get)
                .thenComparing(Comparator.naturalOrder());

        Map<String, PluginFailure> failures = new LinkedHashMap<>();

        // 1. 硬依赖成环
        List<List<String>> cycles = findHardCycles(byName, registrationOrder);
        Map<String, Integer> cycleOf = new HashMap<>();
        for (List<String> cycle : cycles) {
            for (String member : cycle) {
                cycleOf.put(member, cycles.indexOf(cycle));
            }
            CircularDependencyException ex = new CircularDependencyException(cycle);
            log.error("{}", ex.getMessage());
            for (String member : cycle) {
                if (!byName.get(member).initialized()) {
                    failures.put(member, new PluginFailure(FailureKind.CIRCULAR_DEPENDENCY, ex.getMessage(), ex, cycle));
                }
            }
        }

        // 2. 缺失依赖，迭代到不动点实现级联
        boolean changed = true;
        while (changed) {
            changed = false;
            for (ResolverNode node : byName.values()) {
                if (node.initialized() || node.failed() || failures.containsKey(node.name())) {
                    continue;
                }
                PluginFailure failure = checkDependencies(node, byName, failures);
                if (failure != null) {
                    failures.put(node.name(), failure);
                    log.error("[{}] {}", node.name(), failure.message());
                    changed = true;
                }
            }
        }

        // 3. 排序
        List<String> survivors = new ArrayList<>();
        for (ResolverNode node : byName.values()) {
            if (!node.failed() && !failures.containsKey(node.name())) {
                survivors.add(node.name());
            }
        }
        List<String> loadOrder = sort(survivors, byName, cycleOf, registrationOrder);

        log.debug("Resolved load order: {}", loadOrder);
        return new Resolution(loadOrder, cycles, failures);
    }

    private PluginFailure checkDependencies(ResolverNode node, Map<String, ResolverNode> byName,
                                            Map<String, PluginFailure> failures) {
        for (String dep : node.metadata().getDependencies()) {
            ResolverNode target = byName.get(dep);
            String message = null;
            if (target == null) {
                message = "Hard dependency '" + dep + "' is not registered";
            } else if (target.failed()) {
                message = "Hard dependency '" + dep + "' has failed";
            } else if (failures.containsKey(dep)) {
                message = "Hard dependency '" + dep + "' has failed (" + failures.get(dep).kind() + ")";
            }
            if (message != null) {
                return new PluginFailure(FailureKind.MISSING_DEPENDENCY, message,
                        new MissingDependencyException(message), List.of(dep));
            }
        }
        return null;
    }

    // ==================== 成环检测 (Tarjan SCC) ====================

    private List<List<String>> findHardCycles(Map<String, ResolverNode> byName, Comparator<String> order) {
        Map<String, List<String>> successors = new HashMap<>();
        for (String name : byName.keySet()) {
            successors.put(name, new ArrayList<>());
        }
        for (ResolverNode node : byName.values()) {
            for (String dep : node.metadata().getDependencies()) {
                if (byName.containsKey(dep)) {
                    // 边方向：依赖 -> 依赖方
                    successors.get(dep).add(node.name());
                }
            }
        }
        successors.values().forEach(list -> list.sort(order));

        List<List<String>> components = new Tarjan(successors).run(byName.keySet());
        List<List<String>> cycles = new ArrayList<>();
        for (List<String> component : components) {
            if (component.size() > 1) {
                List<String> members = new ArrayList<>(component);
                members.sort(order);
                cycles.add(members);
            }
        }
        cycles.sort(Comparator.comparing(c -> c.get(0), order));
        return cycles;
    }

    // ==================== 拓扑排序 ====================

    private List<String> sort(List<String> survivors, Map<String, ResolverNode> byName,
                              Map<String, Integer> cycleOf, Comparator<String> order) {
        Set<String> alive = new LinkedHashSet<>(survivors);

        // 前驱表：硬边 + 软边
        Map<String, Set<String>> hardPreds = new HashMap<>();
        Map<String, Set<String>> softPreds = new HashMap<>();
        for (String name : alive) {
            hardPreds.put(name, new LinkedHashSet<>());
            softPreds.put(name, new LinkedHashSet<>());
        }

        // 提供方索引：只统计启用的存活插件
        Map<String, List<String>> providersByKey = new HashMap<>();
        for (String name : alive) {
            ResolverNode node = byName.get(name);
            if (!node.enabled()) {
                continue;
            }
            for (String key : node.metadata().getProvides()) {
                providersByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(name);
            }
        }

        for (String name : alive) {
            ResolverNode node = byName.get(name);
            for (String dep : node.metadata().getDependencies()) {
                // 已初始化的环成员之间不再约束顺序
                if (alive.contains(dep) && !sameCycle(cycleOf, dep, name)) {
                    hardPreds.get(name).add(dep);
                }
            }
            for (String key : node.metadata().getConsumes()) {
                for (String provider : providersByKey.getOrDefault(key, List.of())) {
                    if (!provider.equals(name) && !hardPreds.get(name).contains(provider)) {
                        softPreds.get(name).add(provider);
                    }
                }
            }
        }

        // 软边只影响偏序：落在合并图强连通分量内部的软边全部丢弃
        Map<String, List<String>> combinedSuccessors = new HashMap<>();
        for (String name : alive) {
            combinedSuccessors.put(name, new ArrayList<>());
        }
        for (String name : alive) {
            for (String p : hardPreds.get(name)) combinedSuccessors.get(p).add(name);
            for (String p : softPreds.get(name)) combinedSuccessors.get(p).add(name);
        }
        Map<String, Integer> component = new HashMap<>();
        List<List<String>> components = new Tarjan(combinedSuccessors).run(alive);
        for (int i = 0; i < components.size(); i++) {
            for (String member : components.get(i)) {
                component.put(member, i);
            }
        }

        Map<String, List<String>> preds = new HashMap<>();
        for (String name : alive) {
            List<String> list = new ArrayList<>(hardPreds.get(name));
            for (String p : softPreds.get(name)) {
                if (!component.get(p).equals(component.get(name))) {
                    list.add(p);
                } else {
                    log.debug("Dropping soft edge {} -> {} (cycle through data keys)", p, name);
                }
            }
            list.sort(order);
            preds.put(name, list);
        }

        // 深度优先：先访问全部前驱再输出自身
        List<String> result = new ArrayList<>(alive.size());
        Set<String> visited = new HashSet<>();
        List<String> roots = new ArrayList<>(alive);
        roots.sort(order);
        for (String root : roots) {
            visit(root, preds, visited, result);
        }
        return result;
    }

    private boolean sameCycle(Map<String, Integer> cycleOf, String a, String b) {
        Integer ca = cycleOf.get(a);
        return ca != null && ca.equals(cycleOf.get(b));
    }

    private void visit(String name, Map<String, List<String>> preds, Set<String> visited, List<String> out) {
        if (!visited.add(name)) {
            return;
        }
        for (String p : preds.get(name)) {
            visit(p, preds, visited, out);
        }
        out.add(name);
    }

    /**
     * Tarjan 强连通分量
     */
    private static final class Tarjan {
        private final Map<String, List<String>> successors;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter = 0;

        Tarjan(Map<String, List<String>> successors) {
            this.successors = successors;
        }

        List<List<String>> run(Iterable<String> nodes) {
            for (String node : nodes) {
                if (!index.containsKey(node)) {
                    strongConnect(node);
                }
            }
            return components;
        }

        private void strongConnect(String v) {
            index.put(v, counter);
            lowLink.put(v, counter);
            counter++;
            stack.push(v);
            onStack.add(v);

            for (String w : successors.getOrDefault(v, List.of())) {
                if (!index.containsKey(w)) {
                    strongConnect(w);
                    lowLink.put(v, Math.min(lowLink.get(v), lowLink.get(w)));
                } else if (onStack.contains(w)) {
                    lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                }
            }

            if (lowLink.get(v).equals(index.get(v))) {
                List<String> component = new ArrayList<>();
                String w;
                do {
                    w = stack.pop();
                    onStack.remove(w);
                    component.add(w);
                } while (!w.equals(v));
                components.add(component);
            }
        }
    }
}
