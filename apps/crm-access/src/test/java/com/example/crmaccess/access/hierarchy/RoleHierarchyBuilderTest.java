package com.example.crmaccess.access.hierarchy;

import com.example.crmaccess.directory.model.CrmRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.crmaccess.util.DirectoryTestBuilders.aRole;
import static com.example.crmaccess.util.DirectoryTestBuilders.aRootRole;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleHierarchyBuilder")
class RoleHierarchyBuilderTest {

    private RoleHierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new RoleHierarchyBuilder();
    }

    @Nested
    @DisplayName("Levels")
    class Levels {

        @Test
        @DisplayName("should assign depth from the root")
        void shouldAssignDepthFromRoot() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRootRole("ceo"),
                    aRole("vp", "ceo"),
                    aRole("manager", "vp"),
                    aRole("rep", "manager")));

            assertThat(hierarchy.levelOf("ceo")).hasValue(0);
            assertThat(hierarchy.levelOf("vp")).hasValue(1);
            assertThat(hierarchy.levelOf("manager")).hasValue(2);
            assertThat(hierarchy.levelOf("rep")).hasValue(3);
        }

        @Test
        @DisplayName("should compute levels when children precede their parents in the input")
        void shouldHandleChildrenBeforeParents() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRole("rep", "manager"),
                    aRole("manager", "ceo"),
                    aRootRole("ceo")));

            assertThat(hierarchy.levelOf("rep")).hasValue(2);
            assertThat(hierarchy.levelOf("manager")).hasValue(1);
            assertThat(hierarchy.levelOf("ceo")).hasValue(0);
        }

        @Test
        @DisplayName("should level every tree of a forest from its own root")
        void shouldLevelForest() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRootRole("sales"),
                    aRootRole("support"),
                    aRole("sales-rep", "sales"),
                    aRole("support-agent", "support")));

            assertThat(hierarchy.levelOf("sales")).hasValue(0);
            assertThat(hierarchy.levelOf("support")).hasValue(0);
            assertThat(hierarchy.levelOf("sales-rep")).hasValue(1);
            assertThat(hierarchy.levelOf("support-agent")).hasValue(1);
        }

        @Test
        @DisplayName("should treat a role reporting to an unknown role as a root")
        void shouldTreatDanglingParentAsRoot() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRole("orphan", "deleted-role"),
                    aRole("child", "orphan")));

            assertThat(hierarchy.levelOf("orphan")).hasValue(0);
            assertThat(hierarchy.levelOf("child")).hasValue(1);
            assertThat(hierarchy.node("orphan")).get()
                    .extracting(HierarchyNode::reportsTo)
                    .isEqualTo("deleted-role");
        }
    }

    @Nested
    @DisplayName("Children")
    class Children {

        @Test
        @DisplayName("should list direct subordinates in input order")
        void shouldListChildrenInInputOrder() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRootRole("ceo"),
                    aRole("vp-b", "ceo"),
                    aRole("vp-a", "ceo"),
                    aRole("manager", "vp-a")));

            assertThat(hierarchy.node("ceo")).get()
                    .extracting(HierarchyNode::children)
                    .isEqualTo(List.of("vp-b", "vp-a"));
            assertThat(hierarchy.node("manager")).get()
                    .extracting(HierarchyNode::children)
                    .isEqualTo(List.of());
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("should terminate on a two-role cycle and keep both roles at level 0")
        void shouldTolerateCycle() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRole("a", "b"),
                    aRole("b", "a")));

            assertThat(hierarchy.size()).isEqualTo(2);
            assertThat(hierarchy.levelOf("a")).hasValue(0);
            assertThat(hierarchy.levelOf("b")).hasValue(0);
        }

        @Test
        @DisplayName("should keep a self-reporting role")
        void shouldTolerateSelfReference() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRootRole("ceo"),
                    aRole("loop", "loop")));

            assertThat(hierarchy.contains("loop")).isTrue();
            assertThat(hierarchy.levelOf("loop")).hasValue(0);
        }

        @Test
        @DisplayName("should not disturb roles reachable from a root when a cycle exists elsewhere")
        void shouldIsolateCycleFromValidTree() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRootRole("ceo"),
                    aRole("vp", "ceo"),
                    aRole("x", "y"),
                    aRole("y", "x")));

            assertThat(hierarchy.size()).isEqualTo(4);
            assertThat(hierarchy.levelOf("vp")).hasValue(1);
            assertThat(hierarchy.levelOf("x")).hasValue(0);
        }

        @Test
        @DisplayName("should keep the first occurrence of a duplicated role id")
        void shouldKeepFirstDuplicate() {
            CrmRole first = new CrmRole("dup", "First", null, "org-1");
            CrmRole second = new CrmRole("dup", "Second", "other", "org-1");

            RoleHierarchy hierarchy = builder.build(List.of(first, second));

            assertThat(hierarchy.size()).isEqualTo(1);
            assertThat(hierarchy.node("dup")).get()
                    .extracting(HierarchyNode::displayLabel)
                    .isEqualTo("First");
        }

        @Test
        @DisplayName("should return an empty hierarchy for empty or null input")
        void shouldHandleEmptyInput() {
            assertThat(builder.build(List.of()).size()).isZero();
            assertThat(builder.build(null).size()).isZero();
        }
    }

    @Nested
    @DisplayName("rolesAtOrAbove")
    class RolesAtOrAbove {

        @Test
        @DisplayName("should include every role with a level not deeper than the given one")
        void shouldIncludeShallowerAndEqualLevels() {
            RoleHierarchy hierarchy = builder.build(List.of(
                    aRootRole("ceo"),
                    aRole("vp", "ceo"),
                    aRole("manager-a", "vp"),
                    aRole("manager-b", "vp"),
                    aRole("rep", "manager-a")));

            assertThat(hierarchy.rolesAtOrAbove(2))
                    .containsExactly("ceo", "vp", "manager-a", "manager-b");
            assertThat(hierarchy.rolesAtOrAbove(0)).containsExactly("ceo");
        }
    }
}
