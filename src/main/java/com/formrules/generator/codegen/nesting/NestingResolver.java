package com.formrules.generator.codegen.nesting;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.ToolDiagnostics;
import com.formrules.generator.codegen.model.form.RepeatingGroup;

/**
 * Assigns nesting depth and parent to every repeating group of a form.
 *
 * Rules:
 * - The declared parent is the override table entry, else the parent named in the input.
 * - Without a declared parent a group is depth 1 under {@link RepeatingGroup#ROOT_PARENT},
 *   unless it is the form's only top-level structure (no root fields, single undeclared
 *   group), which makes it depth 0.
 * - With a declared parent the depth is the parent's depth plus one. A parent that does
 *   not exist is assumed to sit at depth 1, so the child is depth 2; the submit generator
 *   reports it as unresolved.
 * - Parent cycles are broken by re-attaching every group of the cycle to the root.
 *
 * Children lists are the inverse of the parent links, in input order.
 */
public class NestingResolver {

    private static final Logger log = LoggerFactory.getLogger(NestingResolver.class);

    public List<RepeatingGroup> resolve(List<RepeatingGroup> groups,
                                        Map<String, String> overrides,
                                        boolean formHasRootFields,
                                        ToolDiagnostics diagnostics,
                                        String formName) {
        if (groups == null || groups.isEmpty()) {
            log.debug("Nesting resolution skipped: form {} has no repeating groups", formName);
            return List.of();
        }

        Map<String, RepeatingGroup> byName = new LinkedHashMap<>();
        groups.forEach(g -> byName.putIfAbsent(g.getName(), g));

        Map<String, String> declared = new LinkedHashMap<>();
        for (RepeatingGroup group : byName.values()) {
            String parent = overrides != null ? overrides.get(group.getName()) : null;
            if (parent == null) {
                parent = group.getDeclaredParent().orElse(null);
            }
            if (parent != null && !parent.equals(group.getName())) {
                declared.put(group.getName(), parent);
            }
        }

        Set<String> cyclic = findCycles(byName.keySet(), declared);
        for (String name : cyclic) {
            diagnostics.report(DiagnosticKind.UNRESOLVED_PARENT, formName,
                    "Group " + name + " is part of a parent cycle; attached to the form root");
            declared.remove(name);
        }

        long undeclaredCount = byName.keySet().stream().filter(n -> !declared.containsKey(n)).count();
        boolean singleTopLevel = !formHasRootFields && undeclaredCount == 1;

        Map<String, Integer> depths = new HashMap<>();
        for (String name : byName.keySet()) {
            depthOf(name, byName, declared, singleTopLevel, depths);
        }

        Map<String, List<String>> children = new LinkedHashMap<>();
        declared.forEach((child, parent) -> children.computeIfAbsent(parent, k -> new ArrayList<>()).add(child));

        List<RepeatingGroup> resolved = new ArrayList<>(byName.size());
        for (RepeatingGroup group : byName.values()) {
            String name = group.getName();
            int depth = depths.get(name);
            String parent = declared.containsKey(name)
                    ? declared.get(name)
                    : (depth == 0 ? null : RepeatingGroup.ROOT_PARENT);

            RepeatingGroup.RepeatingGroupBuilder builder = group.toBuilder()
                    .depth(depth)
                    .parentName(parent)
                    .clearChildNames();
            children.getOrDefault(name, List.of()).forEach(builder::childName);
            resolved.add(builder.build());

            log.info("Group {}: depth {}, parent {}", name, depth, parent == null ? "-" : parent);
        }
        return resolved;
    }

    private int depthOf(String name,
                        Map<String, RepeatingGroup> byName,
                        Map<String, String> declared,
                        boolean singleTopLevel,
                        Map<String, Integer> depths) {
        Integer known = depths.get(name);
        if (known != null) {
            return known;
        }

        int depth;
        String parent = declared.get(name);
        if (parent == null) {
            depth = singleTopLevel ? 0 : 1;
        } else if (!byName.containsKey(parent)) {
            depth = 2;
        } else {
            depth = depthOf(parent, byName, declared, singleTopLevel, depths) + 1;
        }
        depths.put(name, depth);
        return depth;
    }

    private static Set<String> findCycles(Set<String> names, Map<String, String> declared) {
        Set<String> cyclic = new HashSet<>();
        for (String start : names) {
            Set<String> path = new HashSet<>();
            String current = start;
            while (current != null && names.contains(current) && path.add(current)) {
                current = declared.get(current);
            }
            if (current != null && path.contains(current)) {
                // Walk the loop once to collect its members
                String member = current;
                do {
                    cyclic.add(member);
                    member = declared.get(member);
                } while (member != null && !member.equals(current));
            }
        }
        return cyclic;
    }
}
