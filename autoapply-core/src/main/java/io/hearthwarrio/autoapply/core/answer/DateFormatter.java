package io.hearthwarrio.autoapply.core.answer;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Renders profile dates in the format a date field was detected to expect.
 * <p>
 * Profile dates are {@code MM/DD/YYYY} or {@code MM/YYYY} (day 01 assumed). Formats are sequences of the
 * tokens {@code MM}, {@code DD} and {@code YYYY}, e.g. {@code MMDDYYYY} or {@code MMYYYY}.
 */
public final class DateFormatter {

    private DateFormatter() {
        // utility class
    }

    public static Optional<String> format(String profileDate, String format) {
        if (profileDate == null || format == null) {
            return Optional.empty();
        }
        String[] parts = profileDate.trim().split("/");
        String month;
        String day;
        String year;
        if (parts.length == 3) {
            month = parts[0];
            day = parts[1];
            year = parts[2];
        } else if (parts.length == 2) {
            month = parts[0];
            day = "01";
            year = parts[1];
        } else {
            return Optional.empty();
        }
        if (!isNumber(month) || !isNumber(day) || !isNumber(year) || year.length() != 4) {
            return Optional.empty();
        }
        return Optional.of(render(format, pad(month), pad(day), year));
    }

    public static String today(String format, LocalDate today) {
        return render(format, pad(String.valueOf(today.getMonthValue())), pad(String.valueOf(today.getDayOfMonth())),
                String.valueOf(today.getYear()));
    }

    private static String render(String format, String month, String day, String year) {
        return format.replace("MM", month).replace("DD", day).replace("YYYY", year);
    }

    private static String pad(String s) {
        return s.length() == 1 ? "0" + s : s;
    }

    private static boolean isNumber(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
