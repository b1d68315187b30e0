package com.loantracker.store;

import com.loantracker.common.exception.StoreException;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

/**
 * Conversions between stored document values and Java types.
 */
public final class DocumentValues {

    private DocumentValues() {
    }

    /**
     * Bring a raw value read from a database into the normalized form
     * documented on {@link DocumentStore}.
     */
    public static Object normalize(Object value) {
        if (value instanceof ObjectId) {
            return ((ObjectId) value).toHexString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Decimal128) {
            return ((Decimal128) value).bigDecimalValue();
        }
        return value;
    }

    public static String getString(Map<String, Object> document, String field) {
        Object value = document.get(field);
        return value == null ? null : value.toString();
    }

    public static BigDecimal getDecimal(Map<String, Object> document, String field) {
        Object value = normalize(document.get(field));
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw unreadable(field, value, e);
            }
        }
        throw unreadable(field, value, null);
    }

    public static LocalDate getDate(Map<String, Object> document, String field) {
        Object value = normalize(document.get(field));
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(ZoneOffset.UTC).toLocalDate();
        }
        return LocalDate.parse(value.toString());
    }

    public static Instant getInstant(Map<String, Object> document, String field) {
        Object value = normalize(document.get(field));
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        return Instant.parse(value.toString());
    }

    /**
     * Raised for stored values of the wrong type or format.
     */
    private static StoreException unreadable(String field, Object value, Throwable cause) {
        return new StoreException(
            String.format("Stored field %s holds unreadable %s value '%s'",
                field, value.getClass().getSimpleName(), value),
            null, "read", cause);
    }

    /**
     * Dates are stored as ISO {@code yyyy-MM-dd} strings to keep documents store-agnostic.
     */
    public static String formatDate(LocalDate date) {
        return date == null ? null : date.toString();
    }
}
