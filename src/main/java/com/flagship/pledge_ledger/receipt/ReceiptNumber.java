package com.flagship.pledge_ledger.receipt;

import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A receipt number in its public format {@code PREFIX-YYYY-NNNNN}.
 * The sequence part is zero padded to five digits; wider sequences print unpadded.
 */
@Value
public class ReceiptNumber {

    private static final Pattern FORMAT = Pattern.compile("^(.+)-(\\d{4})-(\\d{5,})$");

    String prefix;
    int year;
    int sequence;

    public static ReceiptNumber of(String prefix, int year, int sequence) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Receipt prefix is required");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("Receipt sequence must be positive: " + sequence);
        }
        return new ReceiptNumber(prefix, year, sequence);
    }

    /**
     * Parses a stored receipt string. Anything not in the public format is
     * ignored rather than rejected, since old rows may carry free text.
     */
    public static Optional<ReceiptNumber> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ReceiptNumber(
                matcher.group(1),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean belongsTo(String expectedPrefix, int expectedYear) {
        return prefix.equals(expectedPrefix) && year == expectedYear;
    }

    public String format() {
        return String.format("%s-%04d-%05d", prefix, year, sequence);
    }

    @Override
    public String toString() {
        return format();
    }
}
