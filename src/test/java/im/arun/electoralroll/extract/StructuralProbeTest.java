package im.arun.electoralroll.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralProbeTest {

    private final StructuralProbe probe = new StructuralProbe();

    @Test
    void count_shouldCountRecordShapedLines() {
        assertThat(probe.count("Name: A\nAge: 30\nEPIC ABC1234567\nhello")).isEqualTo(3);
    }

    @Test
    void count_shouldIgnoreLabelsWithoutValues() {
        assertThat(probe.count("Name:\nAge: x\nrenamed: 5")).isZero();
        assertThat(probe.count(null)).isZero();
    }
}
