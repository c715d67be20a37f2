package com.phillippitts.voicerelay.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerUtilTest {

    @Test
    void shouldSplitOnWhitespaceRuns() {
        assertThat(TokenizerUtil.words("  Can you\tconfirm   my\nappointment?  "))
                .containsExactly("Can", "you", "confirm", "my", "appointment?");
    }

    @Test
    void shouldCountNothingForBlankInput() {
        assertThat(TokenizerUtil.wordCount(null)).isZero();
        assertThat(TokenizerUtil.wordCount("   ")).isZero();
        assertThat(TokenizerUtil.words("")).isEmpty();
    }

    @Test
    void shouldKeepPunctuationAttached() {
        assertThat(TokenizerUtil.wordCount("Hello, world. Why?")).isEqualTo(3);
    }
}
