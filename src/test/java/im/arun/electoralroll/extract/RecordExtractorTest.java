package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;
import im.arun.electoralroll.text.TextNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecordExtractorTest {

    private final RecordExtractor extractor = new RecordExtractor();

    @Test
    void extract_shouldDropDuplicateLines() {
        ExtractionResult result = extractor.extract("Name: A, Age: 30, Sl No: 1\nName: A, Age: 30, Sl No: 1", 1);

        assertThat(result.getRecords()).hasSize(1);
        assertThat(result.getDuplicatesDropped()).isEqualTo(1);
        assertThat(result.getMatcherUsage()).containsEntry("strict", 1);
    }

    @Test
    void extract_shouldKeepHouseNumberSuffixThroughNormalization() {
        String text = new TextNormalizer().normalize("Name: Ram, House No: 12B, Age: 30, Sl No: 1");

        VoterRecord record = extractor.extract(text, 1).getRecords().get(0);

        assertThat(record.get(VoterField.HOUSE_NO)).contains("12B");
        assertThat(record.get(VoterField.NAME)).contains("Ram");
        assertThat(record.get(VoterField.SERIAL_NO)).contains("1");
    }

    @Test
    void extract_shouldTreatNameCaseInsensitivelyWhenDeduplicating() {
        ExtractionResult result = extractor.extract("Name: Ravi, Sl No: 5\nName: RAVI, Sl No: 5", 1);

        assertThat(result.getRecords()).hasSize(1);
        assertThat(result.getRecords().get(0).get(VoterField.NAME)).contains("Ravi");
    }

    @Test
    void extract_shouldKeepSameNameWithDifferentSerial() {
        ExtractionResult result = extractor.extract("Name: A, Age: 30, Sl No: 1\nName: A, Age: 30, Sl No: 2", 1);

        assertThat(result.getRecords()).hasSize(2);
    }

    @Test
    void extract_shouldCountUnmatchedSegments() {
        ExtractionResult result = extractor.extract("Name: A, Age: 30, Sl No: 1\n\nrandom noise here", 1);

        assertThat(result.getSegments()).isEqualTo(2);
        assertThat(result.getUnmatchedSegments()).isEqualTo(1);
        assertThat(result.getRecords()).hasSize(1);
    }

    @Test
    void extract_shouldFallBackToLessStrictMatchers() {
        ExtractionResult result = extractor.extract("Sl No 12 EPIC ABC1234567\nName Ramesh Kumar Age 45", 1);

        assertThat(result.getRecords()).hasSize(1);
        assertThat(result.getMatcherUsage())
            .containsEntry("strict", 0)
            .containsEntry("keyword", 1)
            .containsEntry("heuristic", 0);
    }

    @Test
    void extract_shouldNeverEmitRecordWithoutNameOrSerial() {
        ExtractionResult result = extractor.extract("Age: 45, Gender: Male\n\nHouse No: 4, Age: 60", 1);

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getUnmatchedSegments()).isEqualTo(2);
    }

    @Test
    void extract_shouldHandleBlankText() {
        ExtractionResult result = extractor.extract("  ", 1);

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getSegments()).isZero();
    }

    @Test
    void extract_shouldStopAtFirstMatcherWithRecords() {
        RecordMatcher first = mock(RecordMatcher.class);
        RecordMatcher second = mock(RecordMatcher.class);
        RecordMatcher third = mock(RecordMatcher.class);
        when(first.name()).thenReturn("first");
        when(second.name()).thenReturn("second");
        when(third.name()).thenReturn("third");
        VoterRecord record = VoterRecord.builder().field(VoterField.NAME, "A").pageIndex(1).build().orElseThrow();
        when(first.tryMatch(anyString(), anyInt())).thenReturn(Optional.empty());
        when(second.tryMatch(anyString(), anyInt())).thenReturn(Optional.of(List.of(record)));

        ExtractionResult result = new RecordExtractor(List.of(first, second, third)).extract("anything", 1);

        assertThat(result.getRecords()).containsExactly(record);
        assertThat(result.getMatcherUsage()).containsEntry("second", 1).containsEntry("first", 0);
        verify(third, never()).tryMatch(anyString(), anyInt());
    }

    @Test
    void constructor_shouldRequireMatchers() {
        assertThatThrownBy(() -> new RecordExtractor(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
