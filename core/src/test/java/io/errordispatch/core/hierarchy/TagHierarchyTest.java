package io.errordispatch.core.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.errordispatch.core.error.TagCycleException;
import io.errordispatch.core.model.Tag;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TagHierarchy")
class TagHierarchyTest {

    private static final Tag EXCEPTION = Tag.parse("app/exception");
    private static final Tag ERROR = Tag.parse("app/error");
    private static final Tag FAILURE = Tag.parse("app/failure");
    private static final Tag NOT_FOUND = Tag.parse("app/not-found");

    @Nested
    @DisplayName("derive")
    class Derive {

        @Test
        void deriveRecordsParent() {
            var hierarchy = new TagHierarchy().derive(ERROR, EXCEPTION);

            assertThat(hierarchy.parents(ERROR)).containsExactly(EXCEPTION);
            assertThat(hierarchy.parents(EXCEPTION)).isEmpty();
        }

        @Test
        void deriveIsIdempotent() {
            var hierarchy = new TagHierarchy();
            hierarchy.derive(ERROR, EXCEPTION);
            hierarchy.derive(ERROR, EXCEPTION);

            assertThat(hierarchy.parents(ERROR)).containsExactly(EXCEPTION);
            assertThat(hierarchy.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("derive(A, B) then derive(B, A) → TagCycleException, prior relation intact")
        void reverseDerivationIsRejected() {
            var hierarchy = new TagHierarchy().derive(ERROR, EXCEPTION);

            assertThatThrownBy(() -> hierarchy.derive(EXCEPTION, ERROR))
                    .isInstanceOf(TagCycleException.class)
                    .satisfies(e -> {
                        var cycle = (TagCycleException) e;
                        assertThat(cycle.child()).isEqualTo(EXCEPTION);
                        assertThat(cycle.parent()).isEqualTo(ERROR);
                    });

            assertThat(hierarchy.ancestors(ERROR)).containsExactly(EXCEPTION);
            assertThat(hierarchy.ancestors(EXCEPTION)).isEmpty();
        }

        @Test
        void transitiveCycleIsRejected() {
            var hierarchy = new TagHierarchy().derive(NOT_FOUND, ERROR).derive(ERROR, EXCEPTION);

            assertThatThrownBy(() -> hierarchy.derive(EXCEPTION, NOT_FOUND)).isInstanceOf(TagCycleException.class);
            assertThat(hierarchy.descendants(NOT_FOUND)).isEmpty();
        }

        @Test
        void selfDerivationIsRejected() {
            var hierarchy = new TagHierarchy();

            assertThatThrownBy(() -> hierarchy.derive(ERROR, ERROR)).isInstanceOf(TagCycleException.class);
            assertThat(hierarchy.size()).isZero();
        }

        @Test
        void frozenHierarchyRejectsWrites() {
            var hierarchy = new TagHierarchy().derive(ERROR, EXCEPTION);
            hierarchy.freeze();

            assertThat(hierarchy.isFrozen()).isTrue();
            assertThatThrownBy(() -> hierarchy.derive(FAILURE, EXCEPTION))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("frozen");
            assertThat(hierarchy.ancestors(ERROR)).containsExactly(EXCEPTION);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void ancestorsAreTransitiveAndNearestFirst() {
            var root = Tag.of("app", "root");
            var hierarchy = new TagHierarchy()
                    .derive(NOT_FOUND, ERROR)
                    .derive(ERROR, EXCEPTION)
                    .derive(EXCEPTION, root);

            assertThat(hierarchy.ancestors(NOT_FOUND)).containsExactly(ERROR, EXCEPTION, root);
            assertThat(hierarchy.ancestors(NOT_FOUND)).doesNotContain(NOT_FOUND);
        }

        @Test
        void ancestorsFollowEveryParent() {
            var hierarchy = new TagHierarchy().derive(NOT_FOUND, ERROR).derive(NOT_FOUND, FAILURE);

            assertThat(hierarchy.ancestors(NOT_FOUND)).containsExactly(ERROR, FAILURE);
        }

        @Test
        void sharedAncestorAppearsOnce() {
            var hierarchy = new TagHierarchy()
                    .derive(NOT_FOUND, ERROR)
                    .derive(NOT_FOUND, FAILURE)
                    .derive(ERROR, EXCEPTION)
                    .derive(FAILURE, EXCEPTION);

            assertThat(hierarchy.ancestors(NOT_FOUND)).containsExactly(ERROR, FAILURE, EXCEPTION);
        }

        @Test
        void descendantsQueryTheOppositeDirection() {
            var hierarchy = new TagHierarchy()
                    .derive(ERROR, EXCEPTION)
                    .derive(FAILURE, EXCEPTION)
                    .derive(NOT_FOUND, ERROR);

            assertThat(hierarchy.descendants(EXCEPTION)).containsExactly(ERROR, FAILURE, NOT_FOUND);
            assertThat(hierarchy.descendants(NOT_FOUND)).isEmpty();
        }

        @Test
        void isaIsReflexiveAndTransitive() {
            var hierarchy = new TagHierarchy().derive(NOT_FOUND, ERROR).derive(ERROR, EXCEPTION);

            assertThat(hierarchy.isa(NOT_FOUND, NOT_FOUND)).isTrue();
            assertThat(hierarchy.isa(NOT_FOUND, EXCEPTION)).isTrue();
            assertThat(hierarchy.isa(EXCEPTION, NOT_FOUND)).isFalse();
        }

        @Test
        void unknownTagHasNoRelations() {
            var hierarchy = new TagHierarchy();

            assertThat(hierarchy.parents(ERROR)).isEmpty();
            assertThat(hierarchy.ancestors(ERROR)).isEmpty();
            assertThat(hierarchy.descendants(ERROR)).isEmpty();
        }

        @Test
        void returnedSetsAreSnapshots() {
            var hierarchy = new TagHierarchy().derive(ERROR, EXCEPTION);
            var ancestors = hierarchy.ancestors(ERROR);

            hierarchy.derive(EXCEPTION, Tag.of("app", "root"));

            assertThat(ancestors).containsExactly(EXCEPTION);
            assertThatThrownBy(() -> ancestors.add(FAILURE)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    @DisplayName("concurrent readers see consistent ancestors while a writer derives")
    void concurrentReadsDuringWrites() throws Exception {
        var hierarchy = new TagHierarchy().derive(ERROR, EXCEPTION);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> readers = new ArrayList<>();
        try {
            for (int i = 0; i < 7; i++) {
                readers.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 2_000; n++) {
                        if (!hierarchy.ancestors(ERROR).contains(EXCEPTION)) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            Future<?> writer = pool.submit(() -> {
                start.await();
                for (int n = 0; n < 200; n++) {
                    hierarchy.derive(Tag.of("gen", "t" + n), ERROR);
                }
                return null;
            });
            start.countDown();

            writer.get(10, TimeUnit.SECONDS);
            for (Future<Boolean> reader : readers) {
                assertThat(reader.get(10, TimeUnit.SECONDS)).isTrue();
            }
            assertThat(hierarchy.descendants(EXCEPTION)).hasSize(201);
        } finally {
            pool.shutdownNow();
        }
    }
}
