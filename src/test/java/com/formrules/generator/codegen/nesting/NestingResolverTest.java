package com.formrules.generator.codegen.nesting;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.ToolDiagnostics;
import com.formrules.generator.codegen.model.form.RepeatingGroup;

/**
 * Unit tests for NestingResolver.
 */
class NestingResolverTest {

    private final NestingResolver resolver = new NestingResolver();
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    private static RepeatingGroup group(String name) {
        return group(name, null);
    }

    private static RepeatingGroup group(String name, String declaredParent) {
        return RepeatingGroup.builder().name(name).sourceViewName("Main").declaredParent(declaredParent).build();
    }

    private List<RepeatingGroup> resolve(List<RepeatingGroup> groups, Map<String, String> overrides) {
        return resolver.resolve(groups, overrides, true, diagnostics, "Orders");
    }

    private static RepeatingGroup find(List<RepeatingGroup> groups, String name) {
        return groups.stream().filter(g -> g.getName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void testNoGroups() {
        assertThat(resolve(List.of(), Map.of())).isEmpty();
    }

    @Test
    void testUndeclaredGroupsAreChildrenOfRoot() {
        List<RepeatingGroup> resolved = resolve(List.of(group("LineItems"), group("Notes")), Map.of());

        assertThat(resolved).extracting(RepeatingGroup::getName).containsExactly("LineItems", "Notes");
        assertThat(resolved).allSatisfy(g -> {
            assertThat(g.getDepth()).isEqualTo(1);
            assertThat(g.isChildOfRoot()).isTrue();
            assertThat(g.getChildNames()).isEmpty();
        });
    }

    @Test
    void testOverrideNestsGroupAtDepthTwo() {
        List<RepeatingGroup> resolved = resolve(List.of(group("LineItems"), group("LineItemDetails")),
                Map.of("LineItemDetails", "LineItems"));

        RepeatingGroup parent = find(resolved, "LineItems");
        RepeatingGroup child = find(resolved, "LineItemDetails");
        assertThat(child.getDepth()).isEqualTo(2);
        assertThat(child.getParentName()).contains("LineItems");
        assertThat(child.hasGroupParent()).isTrue();
        assertThat(parent.getChildNames()).containsExactly("LineItemDetails");
    }

    @Test
    void testOverrideTakesPrecedenceOverDeclaredParent() {
        List<RepeatingGroup> resolved = resolve(List.of(group("A"), group("B"), group("C", "A")),
                Map.of("C", "B"));

        assertThat(find(resolved, "C").getParentName()).contains("B");
        assertThat(find(resolved, "A").getChildNames()).isEmpty();
    }

    @Test
    void testDeclaredChainResolvesArbitraryDepth() {
        List<RepeatingGroup> resolved = resolve(List.of(
                group("Level3", "Level2"), group("Level2", "Level1"), group("Level1")), Map.of());

        assertThat(find(resolved, "Level1").getDepth()).isEqualTo(1);
        assertThat(find(resolved, "Level2").getDepth()).isEqualTo(2);
        assertThat(find(resolved, "Level3").getDepth()).isEqualTo(3);
        assertThat(resolved).extracting(RepeatingGroup::getName).containsExactly("Level3", "Level2", "Level1");
    }

    @Test
    void testMissingParentAssumesDepthTwo() {
        List<RepeatingGroup> resolved = resolve(List.of(group("Orphan", "Nowhere")), Map.of());

        RepeatingGroup orphan = resolved.get(0);
        assertThat(orphan.getDepth()).isEqualTo(2);
        assertThat(orphan.getParentName()).contains("Nowhere");
    }

    @Test
    void testCycleIsAttachedToRoot() {
        List<RepeatingGroup> resolved = resolve(List.of(group("A", "B"), group("B", "A"), group("C", "A")),
                Map.of());

        assertThat(find(resolved, "A").isChildOfRoot()).isTrue();
        assertThat(find(resolved, "B").isChildOfRoot()).isTrue();
        assertThat(find(resolved, "C").getDepth()).isEqualTo(2);
        assertThat(diagnostics.ofKind(DiagnosticKind.UNRESOLVED_PARENT)).hasSize(2);
    }

    @Test
    void testSelfParentIsIgnored() {
        List<RepeatingGroup> resolved = resolve(List.of(group("A", "A")), Map.of());

        assertThat(resolved.get(0).getDepth()).isEqualTo(1);
        assertThat(resolved.get(0).isChildOfRoot()).isTrue();
    }

    @Test
    void testSingleGroupWithoutRootFieldsIsDepthZero() {
        List<RepeatingGroup> resolved = resolver.resolve(List.of(group("Rows")), Map.of(), false, diagnostics, "Orders");

        assertThat(resolved.get(0).getDepth()).isZero();
        assertThat(resolved.get(0).getParentName()).isEmpty();
    }

    @Test
    void testResolutionIsDeterministic() {
        List<RepeatingGroup> input = List.of(group("A"), group("B", "A"), group("C", "B"), group("D"));

        List<RepeatingGroup> first = resolve(input, Map.of("D", "A"));
        List<RepeatingGroup> second = resolve(input, Map.of("D", "A"));

        assertThat(first).isEqualTo(second);
        assertThat(find(first, "A").getChildNames()).containsExactly("B", "D");
    }
}
