package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.RollMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RollMetadataExtractorTest {

    private final RollMetadataExtractor extractor = new RollMetadataExtractor();

    @Test
    void extract_shouldReadRollHeader() {
        String header = "Assembly Constituency No and Name: 123 - SAMPLE NAGAR Part No: 45\n"
            + "Parliamentary Constituency No and Name: 7 - CITY NORTH\n"
            + "District: PUNE\n"
            + "Pin code: 411001";

        RollMetadata metadata = extractor.extract(List.of(header));

        assertThat(metadata.getAssemblyConstituencyNo()).isEqualTo("123");
        assertThat(metadata.getAssemblyConstituencyName()).isEqualTo("SAMPLE NAGAR");
        assertThat(metadata.getPartNo()).isEqualTo("45");
        assertThat(metadata.getParliamentaryConstituencyNo()).isEqualTo("7");
        assertThat(metadata.getParliamentaryConstituencyName()).isEqualTo("CITY NORTH");
        assertThat(metadata.getDistrict()).isEqualTo("PUNE");
        assertThat(metadata.getPinCode()).isEqualTo("411001");
        assertThat(metadata.getRegion()).isEqualTo("Maharashtra");
    }

    @Test
    void extract_shouldKeepFirstValueAcrossPages() {
        RollMetadata metadata = extractor.extract(List.of(
            "Part No: 45", "Part No: 99\nDistrict: NASHIK", ""));

        assertThat(metadata.getPartNo()).isEqualTo("45");
        assertThat(metadata.getDistrict()).isEqualTo("NASHIK");
        assertThat(metadata.getRegion()).isEqualTo("Maharashtra");
    }

    @Test
    void extract_shouldReturnEmptyMetadataForPlainText() {
        assertThat(extractor.extract(List.of("Name: A, Age: 30")).isEmpty()).isTrue();
    }
}
