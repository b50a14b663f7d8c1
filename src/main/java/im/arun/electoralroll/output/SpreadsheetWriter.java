package im.arun.electoralroll.output;

import im.arun.electoralroll.model.RollMetadata;
import im.arun.electoralroll.model.VoterRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes voter records as a table, one row per record, in the order given.
 * Every row also carries the roll's header details.
 */
public interface SpreadsheetWriter {

    void write(List<VoterRecord> records, RollMetadata metadata, Path target) throws IOException;
}
