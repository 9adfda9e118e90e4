package dev.stepwise.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExplanationTest {

    @Test
    void picksVariantForVerbosity() {
        var explanation = new Explanation("short", "longer", "longest");

        assertThat(explanation.forVerbosity(Verbosity.CONCISE)).isEqualTo("short");
        assertThat(explanation.forVerbosity(Verbosity.DETAILED)).isEqualTo("longer");
        assertThat(explanation.forVerbosity(Verbosity.TEACHER)).isEqualTo("longest");
    }

    @Test
    void fallsBackToShorterVariants() {
        var onlyDetailed = new Explanation("short", "longer", null);
        var onlyConcise = Explanation.of("short");

        assertThat(onlyDetailed.forVerbosity(Verbosity.TEACHER)).isEqualTo("longer");
        assertThat(onlyConcise.forVerbosity(Verbosity.TEACHER)).isEqualTo("short");
        assertThat(onlyConcise.forVerbosity(Verbosity.DETAILED)).isEqualTo("short");
    }

    @Test
    void parsesVerbosityCaseInsensitively() {
        assertThat(Verbosity.parse("Teacher")).isEqualTo(Verbosity.TEACHER);
        assertThat(Verbosity.parse(" concise ")).isEqualTo(Verbosity.CONCISE);
        assertThat(Verbosity.DETAILED.label()).isEqualTo("detailed");
    }

    @Test
    void rejectsUnknownVerbosity() {
        assertThatThrownBy(() -> Verbosity.parse("chatty"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown verbosity 'chatty'");
    }
}
