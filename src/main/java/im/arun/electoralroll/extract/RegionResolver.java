package im.arun.electoralroll.extract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a district name to its state for the districts rolls are commonly printed for.
 * An unknown district is its own region.
 */
public final class RegionResolver {

    private static final Map<String, List<String>> STATE_DISTRICTS = new LinkedHashMap<>();

    static {
        STATE_DISTRICTS.put("West Bengal",
            List.of("hooghly", "kolkata", "howrah", "north 24 parganas", "south 24 parganas", "darjeeling"));
        STATE_DISTRICTS.put("Uttar Pradesh",
            List.of("agra", "lucknow", "kanpur", "allahabad", "varanasi", "meerut", "ghaziabad"));
        STATE_DISTRICTS.put("Maharashtra", List.of("mumbai", "pune", "nagpur", "thane", "nashik"));
        STATE_DISTRICTS.put("Gujarat", List.of("ahmedabad", "surat", "vadodara", "rajkot"));
        STATE_DISTRICTS.put("Rajasthan", List.of("jaipur", "jodhpur", "udaipur", "bikaner"));
        STATE_DISTRICTS.put("Bihar", List.of("patna", "gaya", "muzaffarpur", "bhagalpur"));
        STATE_DISTRICTS.put("Odisha", List.of("bhubaneswar", "cuttack", "berhampur", "sambalpur"));
    }

    private RegionResolver() {
    }

    /**
     * @return the state whose district list names part of {@code district}, the district itself
     *         when none does, or null without a district
     */
    public static String regionOf(String district) {
        if (district == null || district.isBlank()) {
            return null;
        }
        String lower = district.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> state : STATE_DISTRICTS.entrySet()) {
            for (String known : state.getValue()) {
                if (lower.contains(known)) {
                    return state.getKey();
                }
            }
        }
        return district.strip();
    }
}
