package com.eainde.extraction.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityCategoryTest {

    @Test
    @DisplayName("fromKey resolves aliases regardless of case and padding")
    void fromKey() {
        assertThat(EntityCategory.fromKey(" Organizaciones ")).contains(EntityCategory.COMPANIES);
        assertThat(EntityCategory.fromKey("individuos")).contains(EntityCategory.PERSONS);
        assertThat(EntityCategory.fromKey("Acontecimientos")).contains(EntityCategory.EVENTS);
    }

    @Test
    @DisplayName("fromKey returns empty for unknown or null keys")
    void unknown() {
        assertThat(EntityCategory.fromKey("summary")).isEmpty();
        assertThat(EntityCategory.fromKey(null)).isEmpty();
    }

    @Test
    @DisplayName("priority follows alias order and ranks unknown keys last")
    void priority() {
        assertThat(EntityCategory.PERSONS.priority("Persons")).isZero();
        assertThat(EntityCategory.PERSONS.priority("people")).isEqualTo(2);
        assertThat(EntityCategory.PERSONS.priority("empresas")).isEqualTo(Integer.MAX_VALUE);
        assertThat(EntityCategory.PERSONS.priority(null)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("canonical key is the first alias")
    void canonicalKey() {
        assertThat(EntityCategory.PERSONS.canonicalKey()).isEqualTo("persons");
        assertThat(EntityCategory.COMPANIES.aliases()).startsWith("companies", "empresas");
    }
}
