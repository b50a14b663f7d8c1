package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class StrictLayoutMatcherTest {

    private final StrictLayoutMatcher matcher = new StrictLayoutMatcher();

    @Test
    void tryMatch_shouldReadLabelledPairs() {
        Optional<List<VoterRecord>> result = matcher.tryMatch("Name: A, Age: 30, Sl No: 1", 1);

        assertThat(result).isPresent();
        VoterRecord record = result.get().get(0);
        assertThat(record.get(VoterField.NAME)).contains("A");
        assertThat(record.get(VoterField.AGE)).contains("30");
        assertThat(record.get(VoterField.SERIAL_NO)).contains("1");
        assertThat(record.has(VoterField.GENDER)).isFalse();
        assertThat(record.getPageIndex()).isEqualTo(1);
    }

    @Test
    void tryMatch_shouldUseLeadingBareSerial() {
        VoterRecord record = matcher
            .tryMatch("12 Name: B, Husband's Name: C, Age: 41, Gender: Female", 2)
            .orElseThrow().get(0);

        assertThat(record.get(VoterField.SERIAL_NO)).contains("12");
        assertThat(record.get(VoterField.NAME)).contains("B");
        assertThat(record.get(VoterField.RELATION_NAME)).contains("C");
        assertThat(record.get(VoterField.AGE)).contains("41");
        assertThat(record.get(VoterField.GENDER)).contains("F");
    }

    @Test
    void tryMatch_shouldReturnOneRecordPerLine() {
        List<VoterRecord> records = matcher.tryMatch("Name: A, Age: 30\nName: B, Age: 52", 1).orElseThrow();

        assertThat(records).hasSize(2);
    }

    @Test
    void tryMatch_shouldRejectCoreFieldsOutOfOrder() {
        assertThat(matcher.tryMatch("Age: 30, Name: A", 1)).isEmpty();
    }

    @Test
    void tryMatch_shouldRejectPairsWithoutColon() {
        assertThat(matcher.tryMatch("Name Ramesh Kumar Age 45", 1)).isEmpty();
    }

    @Test
    void tryMatch_shouldRejectLineWithoutLeadingLabel() {
        assertThat(matcher.tryMatch("voter Name: A, Age: 30", 1)).isEmpty();
    }

    @Test
    void inCanonicalOrder_shouldAllowSerialAndEpicOnlyAtTheEdges() {
        assertThat(StrictLayoutMatcher.inCanonicalOrder(
            List.of(VoterField.EPIC, VoterField.NAME, VoterField.AGE, VoterField.SERIAL_NO))).isTrue();
        assertThat(StrictLayoutMatcher.inCanonicalOrder(
            List.of(VoterField.NAME, VoterField.SERIAL_NO, VoterField.AGE))).isFalse();
    }

    @Test
    void inCanonicalOrder_shouldRequireUniqueFieldsAndName() {
        assertThat(StrictLayoutMatcher.inCanonicalOrder(List.of(VoterField.NAME, VoterField.NAME))).isFalse();
        assertThat(StrictLayoutMatcher.inCanonicalOrder(List.of(VoterField.AGE, VoterField.GENDER))).isFalse();
    }
}
