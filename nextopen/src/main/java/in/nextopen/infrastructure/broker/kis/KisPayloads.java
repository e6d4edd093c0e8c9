package in.nextopen.infrastructure.broker.kis;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Field readers for KIS JSON payloads. KIS sends every number as a string.
 */
final class KisPayloads {

    static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private KisPayloads() {}

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.asText("").trim();
    }

    static int integer(JsonNode node, String field) {
        String value = text(node, field);
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return new BigDecimal(value).intValue();
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static long longValue(JsonNode node, String field) {
        String value = text(node, field);
        if (value.isEmpty()) {
            return 0L;
        }
        try {
            return new BigDecimal(value).longValue();
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    static BigDecimal decimal(JsonNode node, String field) {
        String value = text(node, field);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static LocalDate date(JsonNode node, String field) {
        String value = text(node, field);
        if (value.length() != 8) {
            return null;
        }
        try {
            return LocalDate.parse(value, BASIC_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String basicDate(LocalDate date) {
        return date.format(BASIC_DATE);
    }
}
