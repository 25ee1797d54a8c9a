package com.clientsync.util;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SlugUtil.
 */
class SlugUtilTest {

    @Test
    void slugify_LowercasesAndHyphenates() {
        assertThat(SlugUtil.slugify("Hockey Think Tank!")).isEqualTo("hockey-think-tank");
        assertThat(SlugUtil.slugify("  Acme -- Corp & Sons  ")).isEqualTo("acme-corp-sons");
        assertThat(SlugUtil.slugify("Café Zoë")).isEqualTo("caf-zo");
    }

    @Test
    void slugify_CanBeEmpty() {
        assertThat(SlugUtil.slugify("!!!")).isEmpty();
        assertThat(SlugUtil.slugify(null)).isEmpty();
    }

    @Test
    void slugify_TruncatesLongNames() {
        String slug = SlugUtil.slugify("word ".repeat(40));
        assertThat(slug).hasSizeLessThanOrEqualTo(100).doesNotEndWith("-");
    }

    @Test
    void stripNumericSuffix() {
        assertThat(SlugUtil.stripNumericSuffix("acme-corp-2")).isEqualTo("acme-corp");
        assertThat(SlugUtil.stripNumericSuffix("hockey-think-tank-123")).isEqualTo("hockey-think-tank");
        assertThat(SlugUtil.stripNumericSuffix("acme-corp")).isEqualTo("acme-corp");
        assertThat(SlugUtil.stripNumericSuffix("-42")).isEqualTo("-42");
    }

    @Test
    void sameBaseSlug_IgnoresNumericSuffixOnEitherSide() {
        assertThat(SlugUtil.sameBaseSlug("hockey-think-tank-123", "hockey-think-tank")).isTrue();
        assertThat(SlugUtil.sameBaseSlug("hockey-think-tank", "hockey-think-tank-2")).isTrue();
        assertThat(SlugUtil.sameBaseSlug("acme", "acme-corp")).isFalse();
        assertThat(SlugUtil.sameBaseSlug("acme", null)).isFalse();
    }

    @Test
    void firstAvailable_AppendsCounter() {
        assertThat(SlugUtil.firstAvailable("acme", Set.of())).isEqualTo("acme");
        assertThat(SlugUtil.firstAvailable("acme", Set.of("acme"))).isEqualTo("acme-2");
        assertThat(SlugUtil.firstAvailable("acme", Set.of("acme", "acme-2", "acme-3"))).isEqualTo("acme-4");
    }
}
