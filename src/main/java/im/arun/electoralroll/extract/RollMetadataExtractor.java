package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.RollMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the roll header (constituencies, part number, district, pin code) from the text of the
 * first pages and derives the region from the district. Patterns are tried most specific first;
 * the first match of each field wins.
 */
public class RollMetadataExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RollMetadataExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;
    private static final String DASH = "\\s*[-\u2013\u2014]\\s*";
    private static final String PLACE = "([A-Z][A-Za-z ()]*?[A-Za-z)])";

    private static final List<Pattern> ASSEMBLY = List.of(
        Pattern.compile("Assembly\\s+Constituency[^\\n\\d]*?(\\d{1,3})" + DASH + PLACE + "\\s*(?:Part\\b|GENERAL\\b|\\(|$)",
            FLAGS | Pattern.MULTILINE),
        Pattern.compile("Vidhan\\s+Sabha[^\\n\\d]*?(\\d{1,3})" + DASH + PLACE + "\\s*(?:Part\\b|GENERAL\\b|\\(|$)",
            FLAGS | Pattern.MULTILINE));

    private static final List<Pattern> PARLIAMENTARY = List.of(
        Pattern.compile("Parliamentary\\s+Constituency[^\\n\\d]*?(\\d{1,3})" + DASH + PLACE + "\\s*$",
            FLAGS | Pattern.MULTILINE),
        Pattern.compile("Lok\\s+Sabha[^\\n\\d]*?(\\d{1,3})" + DASH + PLACE + "\\s*$",
            FLAGS | Pattern.MULTILINE));

    private static final List<Pattern> PART = List.of(
        Pattern.compile("Part\\s+No\\.?\\s*:?\\s*(\\d{1,4})", FLAGS),
        Pattern.compile("Part\\s+Number\\s*:?\\s*(\\d{1,4})", FLAGS));

    private static final Pattern DISTRICT =
        Pattern.compile("District\\s*:?\\s*([A-Z][A-Za-z ]*?[A-Za-z])\\s*(?:\\d|Pin\\b|,|$)", FLAGS | Pattern.MULTILINE);
    private static final Pattern PIN_CODE = Pattern.compile("Pin\\s*code\\s*:?\\s*(\\d{6})\\b", FLAGS);

    /**
     * @param pageTexts normalized text of the leading pages, in page order
     * @return the metadata found; fields not found stay null
     */
    public RollMetadata extract(List<String> pageTexts) {
        RollMetadata metadata = new RollMetadata();
        for (String text : pageTexts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            extractFrom(text).fillMissing(metadata);
        }
        metadata.setRegion(RegionResolver.regionOf(metadata.getDistrict()));
        if (metadata.isEmpty()) {
            logger.info("No roll header details found in the first {} pages", pageTexts.size());
        } else {
            logger.info("Roll header: AC {} {}, part {}", metadata.getAssemblyConstituencyNo(),
                metadata.getAssemblyConstituencyName(), metadata.getPartNo());
        }
        return metadata;
    }

    RollMetadata extractFrom(String text) {
        RollMetadata metadata = new RollMetadata();
        firstPair(ASSEMBLY, text, (no, name) -> {
            metadata.setAssemblyConstituencyNo(no);
            metadata.setAssemblyConstituencyName(name);
        });
        firstPair(PARLIAMENTARY, text, (no, name) -> {
            metadata.setParliamentaryConstituencyNo(no);
            metadata.setParliamentaryConstituencyName(name);
        });
        for (Pattern pattern : PART) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                metadata.setPartNo(matcher.group(1));
                break;
            }
        }
        Matcher district = DISTRICT.matcher(text);
        if (district.find()) {
            metadata.setDistrict(district.group(1).strip());
        }
        Matcher pin = PIN_CODE.matcher(text);
        if (pin.find()) {
            metadata.setPinCode(pin.group(1));
        }
        return metadata;
    }

    private static void firstPair(List<Pattern> patterns, String text, BiConsumer<String, String> target) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                target.accept(matcher.group(1), matcher.group(2).strip());
                return;
            }
        }
    }
}
