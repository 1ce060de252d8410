package com.lattice.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeException;
import com.lattice.hierarchy.testing.InMemoryHierarchyQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HierarchyValidator")
class HierarchyValidatorTest {

    private static final Hierarchy H1 = new Hierarchy("h1", "Learning", List.of(
            new HierarchyLevel("h1-l1", "h1", 1, "Concepts", Set.of("concept")),
            new HierarchyLevel("h1-l2", "h1", 2, "Examples", Set.of("example"))));

    private static final Hierarchy H2 = new Hierarchy("h2", "Open", List.of(
            new HierarchyLevel("h2-l1", "h2", 1, "Anything", Set.of()),
            new HierarchyLevel("h2-l2", "h2", 2, "Anything below", Set.of())));

    private InMemoryHierarchyQuery query;
    private HierarchyValidator validator;

    @BeforeEach
    void setUp() {
        query = new InMemoryHierarchyQuery().withHierarchy(H1).withHierarchy(H2);
        validator = new HierarchyValidator(query);
    }

    private static ErrorKind kindOf(Throwable e) {
        return ((LatticeException) e).kind();
    }

    private static NodeInput node(String id, String type) {
        return new NodeInput(id, id + " label", type);
    }

    @Nested
    @DisplayName("resolveAndValidate()")
    class Single {

        @Test
        @DisplayName("root node, child node and disallowed child type")
        void parentChildScenario() {
            assertThat(validator.resolveAndValidate(node("A", "concept"), "h1", null, null)).isEqualTo("h1-l1");
            query.withAssignment("A", "h1", "h1-l1");

            assertThat(validator.resolveAndValidate(node("B", "example"), "h1", null, "A")).isEqualTo("h1-l2");

            assertThatThrownBy(() -> validator.resolveAndValidate(node("C", "concept"), "h1", null, "A"))
                    .isInstanceOf(LatticeException.class)
                    .satisfies(e -> {
                        LatticeException le = (LatticeException) e;
                        assertThat(le.kind()).isEqualTo(ErrorKind.NODE_TYPE_NOT_ALLOWED);
                        assertThat(le.error().attributes())
                                .containsEntry("type", "concept")
                                .containsEntry("levelId", "h1-l2")
                                .containsEntry("allowedTypes", List.of("example"));
                    });
        }

        @Test
        @DisplayName("explicit level wins over parent")
        void explicitLevel() {
            assertThat(validator.resolveAndValidate(node("B", "example"), "h1", "h1-l2", "unknown-parent"))
                    .isEqualTo("h1-l2");
            assertThat(query.assignmentLookups()).isEmpty();
        }

        @Test
        @DisplayName("explicit level of another hierarchy is INVALID_LEVEL")
        void foreignLevel() {
            assertThatThrownBy(() -> validator.resolveAndValidate(node("A", "concept"), "h1", "h2-l1", null))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_LEVEL));
        }

        @Test
        @DisplayName("unknown explicit level is INVALID_LEVEL")
        void unknownLevel() {
            assertThatThrownBy(() -> validator.resolveAndValidate(node("A", "concept"), "h1", "nope", null))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_LEVEL));
        }

        @Test
        @DisplayName("parent without assignment in the hierarchy is INVALID_LEVEL")
        void parentWithoutAssignment() {
            assertThatThrownBy(() -> validator.resolveAndValidate(node("B", "example"), "h1", null, "orphan"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_LEVEL));
        }

        @Test
        @DisplayName("child of the deepest level is INVALID_LEVEL")
        void noDeeperLevel() {
            query.withAssignment("B", "h1", "h1-l2");

            assertThatThrownBy(() -> validator.resolveAndValidate(node("X", "example"), "h1", null, "B"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_LEVEL))
                    .hasMessageContaining("No level below level 2");
        }

        @Test
        @DisplayName("hierarchy without level 1 is INVALID_LEVEL for root nodes")
        void noRootLevel() {
            query.withHierarchy(new Hierarchy("h3", "Sparse", List.of(
                    new HierarchyLevel("h3-l2", "h3", 2, "Two", Set.of()))));

            assertThatThrownBy(() -> validator.resolveAndValidate(node("A", "concept"), "h3", null, null))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_LEVEL));
        }

        @Test
        @DisplayName("unknown hierarchy is HIERARCHY_NOT_FOUND")
        void unknownHierarchy() {
            assertThatThrownBy(() -> validator.resolveAndValidate(node("A", "concept"), "missing", null, null))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.HIERARCHY_NOT_FOUND));
        }

        @Test
        @DisplayName("node without type is INVALID_NODE_INPUT")
        void missingType() {
            assertThatThrownBy(() -> validator.resolveAndValidate(new NodeInput("A", "A", " "), "h1", null, null))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT));
        }
    }

    @Nested
    @DisplayName("resolveBatch()")
    class Batch {

        @Test
        @DisplayName("in-batch child gets parent level + 1 without looking up the parent")
        void inBatchParent() {
            List<ResolvedNode> resolved = validator.resolveBatch(List.of(
                    new BatchNode(node("child", "example"), List.of(AssignmentRequest.under("h1", "parent"))),
                    new BatchNode(node("parent", "concept"), List.of(AssignmentRequest.root("h1")))));

            assertThat(resolved).extracting(r -> r.node().id()).containsExactly("parent", "child");
            assertThat(resolved.get(0).assignments()).containsExactly(new ResolvedAssignment("h1", "h1-l1", 1));
            assertThat(resolved.get(1).assignments()).containsExactly(new ResolvedAssignment("h1", "h1-l2", 2));
            assertThat(query.assignmentLookups()).doesNotContain("parent");
        }

        @Test
        @DisplayName("persisted parents are still looked up")
        void persistedParent() {
            query.withAssignment("A", "h1", "h1-l1");

            List<ResolvedNode> resolved = validator.resolveBatch(List.of(
                    new BatchNode(node("B", "example"), List.of(AssignmentRequest.under("h1", "A")))));

            assertThat(resolved.get(0).assignments().get(0).levelId()).isEqualTo("h1-l2");
            assertThat(query.assignmentLookups()).containsExactly("A");
        }

        @Test
        @DisplayName("one node may be placed in several hierarchies")
        void severalHierarchies() {
            List<ResolvedNode> resolved = validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of(
                            AssignmentRequest.root("h1"),
                            AssignmentRequest.atLevel("h2", "h2-l2")))));

            assertThat(resolved.get(0).assignments()).containsExactly(
                    new ResolvedAssignment("h1", "h1-l1", 1),
                    new ResolvedAssignment("h2", "h2-l2", 2));
        }

        @Test
        @DisplayName("two placements in the same hierarchy are INVALID_NODE_INPUT")
        void duplicateHierarchy() {
            assertThatThrownBy(() -> validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of(
                            AssignmentRequest.root("h1"),
                            AssignmentRequest.atLevel("h1", "h1-l2"))))))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT));
        }

        @Test
        @DisplayName("a null assignment entry is INVALID_NODE_INPUT")
        void nullAssignmentEntry() {
            List<AssignmentRequest> assignments = new ArrayList<>();
            assignments.add(AssignmentRequest.root("h1"));
            assignments.add(null);

            assertThatThrownBy(() -> new BatchNode(node("A", "concept"), assignments))
                    .isInstanceOf(LatticeException.class)
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT))
                    .hasMessageContaining("Node A");
        }

        @Test
        @DisplayName("duplicate node ids are INVALID_NODE_INPUT")
        void duplicateIds() {
            assertThatThrownBy(() -> validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of(AssignmentRequest.root("h1"))),
                    new BatchNode(node("A", "concept"), List.of(AssignmentRequest.root("h1"))))))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT));
        }

        @Test
        @DisplayName("parent cycles are rejected")
        void cycle() {
            assertThatThrownBy(() -> validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of(AssignmentRequest.under("h2", "B"))),
                    new BatchNode(node("B", "concept"), List.of(AssignmentRequest.under("h2", "A"))))))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT))
                    .hasMessageContaining("cycle");
        }

        @Test
        @DisplayName("one invalid node fails the whole batch")
        void atomic() {
            assertThatThrownBy(() -> validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of(AssignmentRequest.root("h1"))),
                    new BatchNode(node("B", "example"), List.of(AssignmentRequest.under("h1", "A"))),
                    new BatchNode(node("C", "concept"), List.of(AssignmentRequest.under("h1", "A"))))))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.NODE_TYPE_NOT_ALLOWED));
        }

        @Test
        @DisplayName("in-batch parent placed in another hierarchy only is INVALID_LEVEL")
        void parentInOtherHierarchy() {
            assertThatThrownBy(() -> validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of(AssignmentRequest.root("h2"))),
                    new BatchNode(node("B", "example"), List.of(AssignmentRequest.under("h1", "A"))))))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_LEVEL));
        }

        @Test
        @DisplayName("node without any placement is INVALID_NODE_INPUT")
        void noPlacement() {
            assertThatThrownBy(() -> validator.resolveBatch(List.of(
                    new BatchNode(node("A", "concept"), List.of()))))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT));
        }

        @Test
        @DisplayName("empty batch resolves to nothing")
        void empty() {
            assertThat(validator.resolveBatch(List.of())).isEmpty();
        }
    }
}
