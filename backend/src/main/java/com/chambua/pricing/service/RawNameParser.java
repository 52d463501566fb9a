package com.chambua.pricing.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives display fields from a supplier's free-text article name.
 *
 * Supported shapes: "Brand Model 50 мл" (leading Latin tokens are the brand, stopping at the first
 * token in another script or a gender word) and "Brand > Line > Model" hierarchies (brand from the
 * first segment, model from the last). Volume and gender markers are extracted and dropped from the
 * display name. Price lists are mostly Russian; English keywords are recognised as well.
 */
@Component
public class RawNameParser {

    /**
     * @param volumeUnit "мл", "г" or "oz"
     * @param gender     "F", "M" or "U"
     */
    public record ParsedName(String brand, String productName, String category,
                             BigDecimal volumeValue, String volumeUnit, String gender) {}

    private static final String UNIT = "(мл|ml|гр|г|g|oz)(?![\\p{L}])";
    private static final Pattern VOLUME = Pattern.compile("(\\d+(?:[.,]\\d+)?)\\s*" + UNIT,
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern TRAILING_VOLUME = Pattern.compile("[ ,]*\\d+(?:[.,]\\d+)?\\s*" + UNIT + "\\.?$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern LATIN_WORD = Pattern.compile("^[\\p{IsLatin}0-9&'.\\-]+$");
    private static final Pattern LEADING_JUNK = Pattern.compile("^[^\\p{L}]+");

    private static final Set<String> FEMALE_WORDS = Set.of("women", "woman", "female");
    private static final Set<String> MALE_WORDS = Set.of("men", "man", "male");
    private static final List<String> GENDER_MARKERS = List.of(
            "женский", "мужской", "унисекс", "women", "woman", "female", "men", "man", "male", "unisex");
    private static final List<Pattern> GENDER_MARKER_WORDS = GENDER_MARKERS.stream().map(RawNameParser::wordPattern).toList();

    // first match wins, so longer phrases come before their prefixes
    private static final List<String[]> CATEGORY_KEYWORDS = List.of(
            new String[]{"шампунь против перхоти", "Уход за волосами"},
            new String[]{"парфюмированная вода", "Парфюм"},
            new String[]{"туалетная вода", "Парфюм"},
            new String[]{"духи", "Парфюм"},
            new String[]{"шампунь", "Уход за волосами"},
            new String[]{"маска для волос", "Уход за волосами"},
            new String[]{"спрей для волос", "Уход за волосами"},
            new String[]{"губная помада", "Декоративная косметика"},
            new String[]{"тональный крем", "Декоративная косметика"},
            new String[]{"пудра", "Декоративная косметика"},
            new String[]{"сыворотка для лица", "Уход за кожей"},
            new String[]{"сыворотка для глаз", "Уход за кожей"},
            new String[]{"крем для лица", "Уход за кожей"},
            new String[]{"eau de parfum", "Парфюм"},
            new String[]{"eau de toilette", "Парфюм"},
            new String[]{"parfum", "Парфюм"},
            new String[]{"shampoo", "Уход за волосами"},
            new String[]{"hair mask", "Уход за волосами"},
            new String[]{"hair spray", "Уход за волосами"},
            new String[]{"lipstick", "Декоративная косметика"},
            new String[]{"foundation", "Декоративная косметика"},
            new String[]{"powder", "Декоративная косметика"},
            new String[]{"serum", "Уход за кожей"},
            new String[]{"face cream", "Уход за кожей"}
    );

    public ParsedName parse(String raw) {
        if (raw == null || raw.isBlank()) return new ParsedName(null, null, null, null, null, null);
        String norm = String.join(" ", raw.trim().split("\\s+"));
        String low = norm.toLowerCase(Locale.ROOT);

        BigDecimal volumeValue = null;
        String volumeUnit = null;
        Matcher volume = VOLUME.matcher(norm);
        if (volume.find()) {
            volumeValue = new BigDecimal(volume.group(1).replace(',', '.'));
            volumeUnit = canonicalUnit(volume.group(2));
        }

        String brand = detectBrand(norm);
        String productPart = norm;
        if (norm.contains(">")) {
            List<String> segments = segments(norm);
            if (!segments.isEmpty()) productPart = segments.get(segments.size() - 1);
        }
        if (brand != null && productPart.toLowerCase(Locale.ROOT).startsWith(brand.toLowerCase(Locale.ROOT))) {
            productPart = productPart.substring(brand.length()).trim();
        }
        productPart = TRAILING_VOLUME.matcher(productPart).replaceAll("");
        productPart = productPart.replaceAll("[ \\t,.]+$", "");
        for (Pattern marker : GENDER_MARKER_WORDS) {
            productPart = marker.matcher(productPart).replaceAll("");
        }
        productPart = String.join(" ", productPart.trim().split("\\s+")).trim();
        if (productPart.isEmpty()) productPart = norm;

        return new ParsedName(brand, productPart, detectCategory(low), volumeValue, volumeUnit, detectGender(low));
    }

    private String detectBrand(String text) {
        if (text.contains(">")) {
            List<String> segments = segments(text);
            if (segments.isEmpty()) return null;
            String seg = LEADING_JUNK.matcher(segments.get(0).replaceFirst("^[0-9]+\\s*", "")).replaceFirst("");
            if (seg.isEmpty()) return null;
            return titleCase(seg.split(" ")[0]);
        }
        String[] tokens = text.split(" ");
        List<String> brandTokens = new ArrayList<>();
        boolean started = false;
        for (String tok : tokens) {
            if (!started && tok.chars().allMatch(Character::isDigit)) continue;
            started = true;
            if (!LATIN_WORD.matcher(tok).matches()) break;
            if (GENDER_MARKERS.contains(tok.toLowerCase(Locale.ROOT))) break;
            if (!brandTokens.isEmpty() && Character.isDigit(tok.charAt(0))) break;
            brandTokens.add(tok);
        }
        if (!brandTokens.isEmpty()) return String.join(" ", brandTokens);
        return tokens.length > 0 ? tokens[0] : null;
    }

    private static String detectGender(String low) {
        if (low.contains("жен")) return "F";
        if (low.contains("муж")) return "M";
        if (low.contains("унис")) return "U";
        for (String tok : low.split("[^\\p{L}]+")) {
            if (FEMALE_WORDS.contains(tok)) return "F";
        }
        for (String tok : low.split("[^\\p{L}]+")) {
            if (MALE_WORDS.contains(tok)) return "M";
            if ("unisex".equals(tok)) return "U";
        }
        return null;
    }

    private static String detectCategory(String low) {
        for (String[] kw : CATEGORY_KEYWORDS) {
            if (low.contains(kw[0])) return kw[1];
        }
        return null;
    }

    private static String canonicalUnit(String unit) {
        String u = unit.toLowerCase(Locale.ROOT);
        if (u.equals("мл") || u.equals("ml")) return "мл";
        if (u.equals("oz")) return "oz";
        return "г";
    }

    private static Pattern wordPattern(String word) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static List<String> segments(String text) {
        List<String> out = new ArrayList<>();
        for (String s : text.split(">")) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    private static String titleCase(String word) {
        if (word.isEmpty()) return word;
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
