package im.arun.electoralroll.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionSummaryTest {

    private static PageSummary page(int index, int records) {
        PageSummary page = new PageSummary(index);
        page.setRecordsFound(records);
        page.setZeroYield(records == 0);
        return page;
    }

    @Test
    void pages_shouldBeOrderedByIndexWhateverTheCompletionOrder() {
        ExtractionSummary summary = new ExtractionSummary("roll.pdf", 300, 3);
        summary.recordPage(page(3, 2));
        summary.recordPage(page(1, 0));
        summary.recordPage(page(2, 5));

        assertThat(summary.getPages()).extracting(PageSummary::getPageIndex).containsExactly(1, 2, 3);
        assertThat(summary.getTotalRecords()).isEqualTo(7);
        assertThat(summary.getZeroYieldPages()).containsExactly(1);
    }

    @Test
    void sampleRecords_shouldKeepFirstThree() {
        ExtractionSummary summary = new ExtractionSummary("roll.pdf", 300, 1);
        List<VoterRecord> records = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            records.add(VoterRecord.builder().field(VoterField.SERIAL_NO, String.valueOf(i)).build().orElseThrow());
        }

        summary.setSampleRecords(records);

        assertThat(summary.getSampleRecords()).containsExactlyElementsOf(records.subList(0, 3));
    }
}
