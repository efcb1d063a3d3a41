package mgnrega.tracker.util;

import mgnrega.tracker.model.District;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a reverse-geocoded place name onto a stored bilingual district name such as
 * "छत्रपति संभाजीनगर (Chh. Sambhajinagar)".
 * <p>
 * Both sides are normalised to lowercase ASCII letters and digits. A district matches when its
 * parenthesised English form is contained in the place name, or when its whole normalised name
 * equals the place name. The first matching district in iteration order wins.
 */
public final class DistrictNameMatcher {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final Pattern PARENTHESISED = Pattern.compile("\\(([^)]+)\\)");

    private DistrictNameMatcher() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Normalised content of the first parenthesised group, or empty when there is none.
     */
    public static String parentheticalForm(String districtName) {
        if (districtName == null) {
            return "";
        }
        Matcher matcher = PARENTHESISED.matcher(districtName.toLowerCase(Locale.ROOT));
        return matcher.find() ? normalize(matcher.group(1)) : "";
    }

    public static boolean matches(String normalizedCandidate, String districtName) {
        if (normalizedCandidate.isEmpty()) {
            return false;
        }
        String shortForm = parentheticalForm(districtName);
        if (!shortForm.isEmpty() && normalizedCandidate.contains(shortForm)) {
            return true;
        }
        return normalizedCandidate.equals(normalize(districtName));
    }

    public static Optional<District> findMatch(String placeName, List<District> districts) {
        String candidate = normalize(placeName);
        for (District district : districts) {
            if (matches(candidate, district.getDistrictName())) {
                return Optional.of(district);
            }
        }
        return Optional.empty();
    }
}
