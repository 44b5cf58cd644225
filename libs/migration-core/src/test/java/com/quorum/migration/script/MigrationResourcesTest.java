package com.quorum.migration.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quorum.migration.error.DuplicateVersionException;
import com.quorum.migration.error.FailureKind;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationResources")
class MigrationResourcesTest {

    private static MigrationScript script(int version, String description) {
        return MigrationScript.of(version, description, context -> {});
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("sorts scripts by ascending version whatever the input order")
        void sortsByVersion() {
            var resources = MigrationResources.of(script(3, "c"), script(1, "a"), script(2, "b"));

            assertThat(resources.versions()).containsExactly(1, 2, 3);
            assertThat(resources.scripts()).extracting(MigrationScript::description).containsExactly("a", "b", "c");
            assertThat(resources.first().version()).isEqualTo(1);
        }

        @Test
        @DisplayName("iterates in version order")
        void iteratesInOrder() {
            var resources = MigrationResources.builder().add(script(10, "j")).add(script(2, "b")).build();

            assertThat(resources).extracting(MigrationScript::version).containsExactly(2, 10);
            assertThat(resources.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("looks up scripts by version")
        void findsByVersion() {
            var resources = MigrationResources.of(List.of(script(1, "a"), script(2, "b")));

            assertThat(resources.find(2)).map(MigrationScript::description).contains("b");
            assertThat(resources.find(7)).isEmpty();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects duplicate versions")
        void rejectsDuplicates() {
            assertThatThrownBy(() -> MigrationResources.of(script(2, "first"), script(2, "second")))
                    .isInstanceOf(DuplicateVersionException.class)
                    .hasMessageContaining("first")
                    .hasMessageContaining("second")
                    .satisfies(e -> {
                        var duplicate = (DuplicateVersionException) e;
                        assertThat(duplicate.version()).isEqualTo(2);
                        assertThat(duplicate.kind()).isEqualTo(FailureKind.DUPLICATE_VERSION);
                    });
        }

        @Test
        @DisplayName("rejects non-positive versions")
        void rejectsNonPositive() {
            assertThatThrownBy(() -> MigrationResources.of(script(0, "zero")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("positive");
        }
    }

    @Nested
    @DisplayName("empty registry")
    class Empty {

        @Test
        @DisplayName("has no scripts and no first script")
        void isEmpty() {
            var resources = MigrationResources.builder().build();

            assertThat(resources.isEmpty()).isTrue();
            assertThat(resources).isSameAs(MigrationResources.empty());
            assertThatThrownBy(resources::first).isInstanceOf(NoSuchElementException.class);
        }
    }
}
