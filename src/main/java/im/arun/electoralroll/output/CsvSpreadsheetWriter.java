package im.arun.electoralroll.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import im.arun.electoralroll.model.AgeGroup;
import im.arun.electoralroll.model.RollMetadata;
import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link SpreadsheetWriter} producing UTF-8 CSV with a header row and a fixed column order.
 * Absent fields are written as empty cells.
 * <p>
 * Next to the records file a {@code <name>_dashboard.csv} is written with the roll header details,
 * gender counts and the age distribution.
 */
public class CsvSpreadsheetWriter implements SpreadsheetWriter {
    private static final Logger logger = LoggerFactory.getLogger(CsvSpreadsheetWriter.class);

    public static final String PAGE_COLUMN = "Page";
    public static final String AGE_GROUP_COLUMN = "Age Group";
    public static final String DASHBOARD_SUFFIX = "_dashboard.csv";

    private static final Map<String, Function<RollMetadata, String>> METADATA_COLUMNS = new LinkedHashMap<>();

    static {
        METADATA_COLUMNS.put("Part No", RollMetadata::getPartNo);
        METADATA_COLUMNS.put("Vidhan Sabha Constituency No", RollMetadata::getAssemblyConstituencyNo);
        METADATA_COLUMNS.put("Vidhan Sabha Name", RollMetadata::getAssemblyConstituencyName);
        METADATA_COLUMNS.put("Lok Sabha Constituency No", RollMetadata::getParliamentaryConstituencyNo);
        METADATA_COLUMNS.put("Lok Sabha Name", RollMetadata::getParliamentaryConstituencyName);
        METADATA_COLUMNS.put("District", RollMetadata::getDistrict);
        METADATA_COLUMNS.put("Region", RollMetadata::getRegion);
    }

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema;
    private final CsvSchema dashboardSchema;

    public CsvSpreadsheetWriter() {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : columns()) {
            builder.addColumn(column);
        }
        // the header goes out as an ordinary row so an empty run still gets one
        this.schema = builder.build().withoutHeader();
        this.dashboardSchema = CsvSchema.builder().addColumn("Field").addColumn("Value").build().withHeader();
    }

    public static List<String> columns() {
        List<String> columns = new ArrayList<>();
        columns.add(PAGE_COLUMN);
        for (VoterField field : VoterField.values()) {
            if (field == VoterField.GENDER) {
                columns.add(AGE_GROUP_COLUMN);
            }
            columns.add(field.getColumnName());
        }
        columns.addAll(METADATA_COLUMNS.keySet());
        return Collections.unmodifiableList(columns);
    }

    public static Path dashboardPath(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return target.resolveSibling(stem + DASHBOARD_SUFFIX);
    }

    @Override
    public void write(List<VoterRecord> records, RollMetadata metadata, Path target) throws IOException {
        RollMetadata roll = metadata == null ? new RollMetadata() : metadata;
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = new OutputStreamWriter(Files.newOutputStream(target), StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(out)) {
            Map<String, Object> header = new LinkedHashMap<>();
            for (String column : columns()) {
                header.put(column, column);
            }
            rows.write(header);
            for (VoterRecord record : records) {
                rows.write(toRow(record, roll));
            }
        }
        logger.info("Wrote {} records to {}", records.size(), target);

        Path dashboard = dashboardPath(target);
        try (Writer out = new OutputStreamWriter(Files.newOutputStream(dashboard), StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(dashboardSchema).writeValues(out)) {
            for (Map.Entry<String, Object> entry : dashboard(records, roll).entrySet()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("Field", entry.getKey());
                row.put("Value", entry.getValue());
                rows.write(row);
            }
        }
        logger.info("Wrote dashboard to {}", dashboard);
    }

    Map<String, Object> toRow(VoterRecord record, RollMetadata metadata) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(PAGE_COLUMN, record.getPageIndex() == null ? "" : record.getPageIndex());
        for (VoterField field : VoterField.values()) {
            row.put(field.getColumnName(), record.get(field).orElse(""));
        }
        row.put(AGE_GROUP_COLUMN, AgeGroup.of(record).map(AgeGroup::getLabel).orElse(""));
        for (Map.Entry<String, Function<RollMetadata, String>> column : METADATA_COLUMNS.entrySet()) {
            String value = column.getValue().apply(metadata);
            row.put(column.getKey(), value == null ? "" : value);
        }
        return row;
    }

    /**
     * Field/value pairs in display order. Roll details that were not found are left out.
     */
    Map<String, Object> dashboard(List<VoterRecord> records, RollMetadata metadata) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("Processing Date", LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));
        fields.put("Total Records", records.size());
        for (Map.Entry<String, Function<RollMetadata, String>> column : METADATA_COLUMNS.entrySet()) {
            String value = column.getValue().apply(metadata);
            if (value != null) {
                fields.put(column.getKey(), value);
            }
        }
        if (metadata.getPinCode() != null) {
            fields.put("Pin Code", metadata.getPinCode());
        }

        int male = 0;
        int female = 0;
        Map<String, Integer> ageGroups = new LinkedHashMap<>();
        for (AgeGroup group : AgeGroup.values()) {
            ageGroups.put(group.getLabel(), 0);
        }
        int unknownAge = 0;
        for (VoterRecord record : records) {
            String gender = record.get(VoterField.GENDER).orElse("");
            if (gender.equals("M")) {
                male++;
            } else if (gender.equals("F")) {
                female++;
            }
            AgeGroup group = AgeGroup.of(record).orElse(null);
            if (group == null) {
                unknownAge++;
            } else {
                ageGroups.merge(group.getLabel(), 1, Integer::sum);
            }
        }
        fields.put("Male Voters", male);
        fields.put("Female Voters", female);
        for (Map.Entry<String, Integer> group : ageGroups.entrySet()) {
            fields.put("Age " + group.getKey(), group.getValue());
        }
        fields.put("Age Unknown", unknownAge);
        return fields;
    }
}
