package com.lotledger.domain.vo;

import com.lotledger.exception.InvalidArgumentException;
import java.time.LocalDate;
import java.time.Month;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Indian financial year: April 1 to March 31, labelled "2024-25".
 *
 * <p>Accepted input formats: "2024-25", "2024-2025", "FY 2024-25" and the bare start year "2024".
 */
@Getter
@EqualsAndHashCode
public final class FinancialYear {

    private final int startYear;

    private FinancialYear(int startYear) {
        this.startYear = startYear;
    }

    public static FinancialYear ofStartYear(int startYear) {
        return new FinancialYear(startYear);
    }

    /** Financial year containing the given date. */
    public static FinancialYear of(LocalDate date) {
        int year = date.getYear();
        return new FinancialYear(date.getMonthValue() >= Month.APRIL.getValue() ? year : year - 1);
    }

    public static FinancialYear parse(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidArgumentException("financialYear", "Financial year is required");
        }
        String value = label.trim();
        if (value.regionMatches(true, 0, "FY", 0, 2)) {
            value = value.substring(2).trim();
        }
        String[] parts = value.split("-");
        try {
            int startYear = Integer.parseInt(parts[0].trim());
            if (parts.length == 2) {
                int endYear = Integer.parseInt(parts[1].trim());
                int expected = parts[1].trim().length() == 2 ? (startYear + 1) % 100 : startYear + 1;
                if (endYear != expected) {
                    throw new InvalidArgumentException(
                            "financialYear", "Financial year must span consecutive years: " + label);
                }
            } else if (parts.length > 2) {
                throw new InvalidArgumentException("financialYear", "Invalid financial year: " + label);
            }
            return new FinancialYear(startYear);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("financialYear", "Invalid financial year: " + label);
        }
    }

    /** April 1 of the start year. */
    public LocalDate getStart() {
        return LocalDate.of(startYear, Month.APRIL, 1);
    }

    /** March 31 of the following year. */
    public LocalDate getEnd() {
        return LocalDate.of(startYear + 1, Month.MARCH, 31);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(getStart()) && !date.isAfter(getEnd());
    }

    public FinancialYear previous() {
        return new FinancialYear(startYear - 1);
    }

    public FinancialYear next() {
        return new FinancialYear(startYear + 1);
    }

    public String getLabel() {
        return String.format("%d-%02d", startYear, (startYear + 1) % 100);
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
