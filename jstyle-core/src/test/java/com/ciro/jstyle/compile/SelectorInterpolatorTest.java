package com.ciro.jstyle.compile;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SelectorInterpolatorTest {

    @Test
    void descendantJoinWithoutPlaceholder() {
        assertThat(SelectorInterpolator.interpolate(".foo", ".a")).isEqualTo(".a .foo");
    }

    @Test
    void placeholderIsReplacedVerbatim() {
        assertThat(SelectorInterpolator.interpolate("&:hover", ".a")).isEqualTo(".a:hover");
        assertThat(SelectorInterpolator.interpolate("& + &", ".a .b")).isEqualTo(".a .b + .a .b");
    }

    @Test
    void rootSelectorComposesWithClassName() {
        String nested = SelectorInterpolator.interpolate(".foo", SelectorInterpolator.ROOT_SELECTOR);
        assertThat(nested).isEqualTo("& .foo");
        assertThat(SelectorInterpolator.interpolate(nested, ".x1")).isEqualTo(".x1 .foo");
        assertThat(SelectorInterpolator.interpolate(SelectorInterpolator.ROOT_SELECTOR, ".x1")).isEqualTo(".x1");
    }
}
