package com.newswebsite.service;

import com.newswebsite.exception.ValidationException;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Shared request field checks.
 */
final class Inputs {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private Inputs() {
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    /** For partial updates: a supplied text field may not be emptied. */
    static String requireNotBlank(String value, String field) {
        if (value.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
        return value;
    }

    static boolean hasFile(MultipartFile file) {
        return file != null && !file.isEmpty();
    }

    static void requireAll(String message, String... values) {
        for (String value : values) {
            if (isBlank(value)) {
                throw new ValidationException(message);
            }
        }
    }

    /**
     * Accepts {@code 2025-06-01}, {@code 2025-06-01T18:00[:ss]} or an offset date-time such as
     * {@code 2025-06-01T18:00:00Z}; offsets are converted to the server zone.
     */
    static LocalDateTime parseDate(String value, String field) {
        if (isBlank(value)) {
            throw new ValidationException("Invalid " + field + " format");
        }
        String text = value.trim();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + " format");
        }
    }
}
