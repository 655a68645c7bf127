package de.conciso.medcontext.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectTest {

    @Test
    void trimsAndCollapsesWhitespace() {
        assertThat(Subject.of("  Acetylsalicylic \t  acid\n").name()).isEqualTo("Acetylsalicylic acid");
    }

    @Test
    void equalityUsesNormalizedForm() {
        assertThat(Subject.of("Warfarin  sodium")).isEqualTo(Subject.of(" Warfarin sodium "));
        assertThat(Subject.of("Warfarin")).isNotEqualTo(Subject.of("warfarin"));
    }

    @Test
    void blankOrNullIsRejected() {
        assertThatThrownBy(() -> Subject.of("   ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Subject.of(null)).isInstanceOf(ValidationException.class);
    }
}
