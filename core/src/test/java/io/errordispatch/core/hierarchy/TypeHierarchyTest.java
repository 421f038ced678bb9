package io.errordispatch.core.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.FileNotFoundException;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class TypeHierarchyTest {

    private final TypeHierarchy types = new TypeHierarchy();

    @Test
    void superTypesAreNearestFirstAndExcludeObject() {
        assertThat(types.superTypes(IllegalArgumentException.class))
                .containsExactly(RuntimeException.class, Exception.class, Throwable.class);
    }

    @Test
    void checkedExceptionChain() {
        assertThat(types.superTypes(FileNotFoundException.class))
                .containsExactly(IOException.class, Exception.class, Throwable.class);
    }

    @Test
    void throwableHasNoSuperTypesBelowObject() {
        assertThat(types.superTypes(Throwable.class)).isEmpty();
        assertThat(types.superTypes(Object.class)).isEmpty();
    }

    @Test
    void chainIsMemoised() {
        assertThat(types.superTypes(IllegalStateException.class))
                .isSameAs(types.superTypes(IllegalStateException.class));
    }
}
