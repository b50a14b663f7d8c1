package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterRecord;

import java.util.List;
import java.util.Optional;

/**
 * One structural strategy for turning a block of normalized text into voter records.
 */
public interface RecordMatcher {

    /**
     * Short identifier used in logs and the extraction summary.
     */
    String name();

    /**
     * @param segment   contiguous block of normalized text
     * @param pageIndex page the block came from, used to tag records
     * @return the records found, or empty when this matcher does not recognize the block
     */
    Optional<List<VoterRecord>> tryMatch(String segment, int pageIndex);
}
