package io.errordispatch.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TagTest {

    @Test
    void parsesNamespaceAndName() {
        Tag tag = Tag.parse("app.orders/not-found");

        assertThat(tag.namespace()).isEqualTo("app.orders");
        assertThat(tag.name()).isEqualTo("not-found");
        assertThat(tag).hasToString("app.orders/not-found");
    }

    @Test
    void leadingColonIsIgnored() {
        assertThat(Tag.parse(":error")).isEqualTo(new Tag(null, "error"));
        assertThat(Tag.parse(":app/error")).isEqualTo(Tag.of("app", "error"));
    }

    @Test
    void lastSlashSplits() {
        assertThat(Tag.parse("a/b/c")).isEqualTo(Tag.of("a/b", "c"));
    }

    @Test
    void blankNamespaceIsDropped() {
        assertThat(Tag.of(" ", "x").namespace()).isNull();
    }

    @Test
    void rejectsMissingName() {
        assertThatThrownBy(() -> Tag.parse("app/")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Tag.parse("  ")).isInstanceOf(IllegalArgumentException.class);
    }
}
