package com.formrules.generator.codegen.segment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.form.Control;
import com.formrules.generator.codegen.model.form.Segment;

/**
 * Splits the ordered control list of one view into regular and repeating-group
 * segments.
 *
 * Rules:
 * - Grouped controls are buffered per group name, so every group yields exactly one segment.
 * - Ungrouped controls extend the current regular run; a grouped control closes it.
 * - Groups are placed by the row of their first control. A regular run goes before a
 *   group when its last row is lower, or equal and it comes first in document order.
 * - Without any group the input comes back as a single regular segment.
 *
 * Group names must already be normalized by the caller.
 */
public class ControlSegmenter {

    private static final Logger log = LoggerFactory.getLogger(ControlSegmenter.class);

    public List<Segment> segment(List<Control> controls) {
        if (controls == null || controls.isEmpty()) {
            return List.of();
        }

        Map<String, List<Control>> groups = new LinkedHashMap<>();
        Map<String, Integer> groupFirstIndex = new LinkedHashMap<>();
        List<Run> regularRuns = new ArrayList<>();

        List<Control> currentRun = new ArrayList<>();
        int currentRunStart = -1;

        for (int i = 0; i < controls.size(); i++) {
            Control control = controls.get(i);
            if (control.isInGroup()) {
                String groupName = control.getGroupName().orElseThrow();
                groups.computeIfAbsent(groupName, k -> new ArrayList<>()).add(control);
                groupFirstIndex.putIfAbsent(groupName, i);
                if (!currentRun.isEmpty()) {
                    regularRuns.add(new Run(Segment.regular(currentRun), currentRunStart));
                    currentRun = new ArrayList<>();
                }
            } else {
                if (currentRun.isEmpty()) {
                    currentRunStart = i;
                }
                currentRun.add(control);
            }
        }
        if (!currentRun.isEmpty()) {
            regularRuns.add(new Run(Segment.regular(currentRun), currentRunStart));
        }

        if (groups.isEmpty()) {
            return List.of(Segment.regular(controls));
        }

        List<Run> groupRuns = new ArrayList<>();
        groups.forEach((name, members) ->
                groupRuns.add(new Run(Segment.group(name, members), groupFirstIndex.get(name))));
        groupRuns.sort(Comparator.comparingInt((Run r) -> r.segment.getFirstRow())
                .thenComparingInt(r -> r.firstIndex));

        List<Segment> result = interleave(regularRuns, groupRuns);
        log.debug("Segmented {} control(s) into {} segment(s) with {} group(s)",
                controls.size(), result.size(), groups.size());
        return result;
    }

    private List<Segment> interleave(List<Run> regularRuns, List<Run> groupRuns) {
        Deque<Run> regular = new ArrayDeque<>(regularRuns);
        Deque<Run> grouped = new ArrayDeque<>(groupRuns);
        List<Segment> result = new ArrayList<>(regularRuns.size() + groupRuns.size());

        while (!regular.isEmpty() && !grouped.isEmpty()) {
            if (placesBefore(regular.peekFirst(), grouped.peekFirst())) {
                result.add(regular.pollFirst().segment);
            } else {
                result.add(grouped.pollFirst().segment);
            }
        }
        regular.forEach(r -> result.add(r.segment));
        grouped.forEach(g -> result.add(g.segment));
        return result;
    }

    private static boolean placesBefore(Run run, Run group) {
        int runLast = run.segment.getLastRow();
        int groupFirst = group.segment.getFirstRow();
        if (runLast != groupFirst) {
            return runLast < groupFirst;
        }
        return run.firstIndex < group.firstIndex;
    }

    private static final class Run {
        private final Segment segment;
        private final int firstIndex;

        private Run(Segment segment, int firstIndex) {
            this.segment = segment;
            this.firstIndex = firstIndex;
        }
    }
}
