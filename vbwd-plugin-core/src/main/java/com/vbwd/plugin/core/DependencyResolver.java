package com.vbwd.plugin.core;

import com.vbwd.plugin.api.CircularDependencyException;
import com.vbwd.plugin.api.PluginMetadata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders plugins so that every plugin comes after the plugins it depends on. Depth-first topological
 * sort with three-color marking; reaching an in-progress plugin again means a cycle. Plugins without an
 * ordering constraint between them keep input (registration) order. Dependencies on plugins that are not
 * in the input are ignored: resolution only orders what exists.
 * <p>
 * Stateless; callers pass the current registry every time.
 */
public final class DependencyResolver {

    private enum Mark { IN_PROGRESS, DONE }

    /**
     * @param plugins metadata in registration order; names must be unique
     * @return plugin names in dependency order
     * @throws CircularDependencyException if the dependency graph has a cycle
     */
    public List<String> resolve(List<PluginMetadata> plugins) {
        Objects.requireNonNull(plugins, "plugins");
        Map<String, PluginMetadata> byName = new LinkedHashMap<>();
        for (PluginMetadata m : plugins) {
            if (byName.putIfAbsent(m.name(), m) != null) {
                throw new IllegalArgumentException("Duplicate plugin name in resolution input: " + m.name());
            }
        }
        Map<String, Mark> marks = new HashMap<>();
        List<String> order = new ArrayList<>(byName.size());
        List<String> path = new ArrayList<>();
        for (String name : byName.keySet()) {
            visit(name, byName, marks, path, order);
        }
        return order;
    }

    private void visit(String name, Map<String, PluginMetadata> byName, Map<String, Mark> marks,
                       List<String> path, List<String> order) {
        Mark mark = marks.get(name);
        if (mark == Mark.DONE) {
            return;
        }
        if (mark == Mark.IN_PROGRESS) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw new CircularDependencyException(cycle);
        }
        marks.put(name, Mark.IN_PROGRESS);
        path.add(name);
        for (String dep : byName.get(name).dependencies()) {
            if (byName.containsKey(dep)) {
                visit(dep, byName, marks, path, order);
            }
        }
        path.remove(path.size() - 1);
        marks.put(name, Mark.DONE);
        order.add(name);
    }
}
