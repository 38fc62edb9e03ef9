package com.numera.backend.services.extraction;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numera.backend.enums.TransactionCategory;

/**
 * Best-effort coercion of a parsed object towards the canonical shape. Works on a copy and
 * never rejects anything: values it cannot fix are left for {@link CandidateValidator}.
 */
@Component
public class RecordRepairer {

    public static final String DESCRIPTION_PLACEHOLDER = "Unlabelled transaction";

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})[T ].*$");
    private static final Pattern DAY_FIRST = Pattern.compile("^(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{4})$");
    private static final Pattern YEAR_FIRST_SLASH = Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})$");
    private static final Pattern EPOCH = Pattern.compile("^\\d{9,13}$");

    // 10^11 seconds is year 5138; anything above is milliseconds
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    public ObjectNode repairTransaction(ObjectNode source) {
        ObjectNode node = source.deepCopy();

        repairDate(node);

        JsonNode description = node.get("description");
        if (description == null || description.isNull()) {
            node.put("description", DESCRIPTION_PLACEHOLDER);
        } else if (!description.isTextual()) {
            node.put("description", description.isValueNode() ? description.asText() : description.toString());
        } else {
            node.put("description", description.asText().trim());
        }

        repairNumber(node, "amount");

        JsonNode category = node.get("category");
        if (category == null || category.isNull()) {
            node.put("category", TransactionCategory.OTHER.name());
        } else if (category.isTextual()) {
            node.put("category", TransactionCategory.canonicalLabel(category.asText()));
        }
        return node;
    }

    public ObjectNode repairAccount(ObjectNode source) {
        ObjectNode node = source.deepCopy();

        JsonNode name = node.get("name");
        if (name != null && !name.isNull()) {
            node.put("name", name.asText().trim());
        }

        repairNumber(node, "balance");

        JsonNode currency = node.get("currency");
        if (currency != null && currency.isTextual()) {
            node.put("currency", currency.asText().trim().toUpperCase(Locale.ROOT));
        }
        return node;
    }

    private static void repairDate(ObjectNode node) {
        JsonNode date = node.get("date");
        if (date == null || date.isNull()) return;

        if (date.isIntegralNumber()) {
            LocalDate day = date.canConvertToLong() ? fromEpoch(date.asLong()) : null;
            if (day != null) {
                node.put("date", day.toString());
            }
            return;
        }
        if (!date.isTextual()) return;

        String normalized = normalizeDate(date.asText());
        if (normalized != null) {
            node.put("date", normalized);
        }
    }

    /**
     * @return the date as YYYY-MM-DD, or null when the format is not recognised
     */
    static String normalizeDate(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;

        if (ISO_DATE.matcher(s).matches()) return s;

        Matcher m = ISO_DATE_TIME.matcher(s);
        if (m.matches()) return m.group(1);

        m = DAY_FIRST.matcher(s);
        if (m.matches()) return format(m.group(3), m.group(2), m.group(1));

        m = YEAR_FIRST_SLASH.matcher(s);
        if (m.matches()) return format(m.group(1), m.group(2), m.group(3));

        if (EPOCH.matcher(s).matches()) {
            LocalDate day = fromEpoch(Long.parseLong(s));
            return day == null ? null : day.toString();
        }
        return null;
    }

    /**
     * @return the UTC day, or null when the value lies outside the supported instant range
     */
    private static LocalDate fromEpoch(long value) {
        try {
            Instant instant = value >= MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
            return instant.atZone(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static String format(String year, String month, String day) {
        return String.format(Locale.ROOT, "%04d-%02d-%02d",
                Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    }

    private static void repairNumber(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) return;

        BigDecimal parsed = parseAmount(value.asText());
        if (parsed != null) {
            node.put(field, parsed);
        }
    }

    /**
     * Parses "1 234,56", "1,234.56", "(45.00)", "12.50-", "€ -8,20" and similar.
     *
     * @return the signed amount, or null when the text holds no number
     */
    static BigDecimal parseAmount(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }
        s = s.replaceAll("[^0-9,.+\\-]", "");
        if (s.endsWith("-")) {
            negative = true;
            s = s.substring(0, s.length() - 1);
        }
        if (s.startsWith("-")) {
            negative = true;
            s = s.substring(1);
        } else if (s.startsWith("+")) {
            s = s.substring(1);
        }
        if (s.isEmpty() || s.indexOf('-') >= 0 || s.indexOf('+') >= 0) return null;

        s = normalizeSeparators(s);
        if (s == null) return null;

        try {
            BigDecimal bd = new BigDecimal(s);
            return negative ? bd.negate() : bd;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalizeSeparators(String s) {
        int lastComma = s.lastIndexOf(',');
        int lastDot = s.lastIndexOf('.');

        if (lastComma >= 0 && lastDot >= 0) {
            // whichever comes last is the decimal separator
            if (lastComma > lastDot) {
                return s.replace(".", "").replace(",", ".");
            }
            return s.replace(",", "");
        }
        if (lastComma >= 0) {
            return singleSeparator(s, ',');
        }
        if (lastDot >= 0) {
            return singleSeparator(s, '.');
        }
        return s;
    }

    private static String singleSeparator(String s, char sep) {
        String sepStr = String.valueOf(sep);
        int count = s.length() - s.replace(sepStr, "").length();
        if (count > 1) {
            return s.replace(sepStr, "");
        }
        int index = s.indexOf(sep);
        int digitsAfter = s.length() - index - 1;
        boolean zeroIntegerPart = s.substring(0, index).matches("0+");
        // "1,234" and "1.234" read as grouping, "12,5", "12.50" and "0.500" as decimals
        if (digitsAfter == 3 && index > 0 && !zeroIntegerPart) {
            return s.replace(sepStr, "");
        }
        return s.replace(sep, '.');
    }
}
