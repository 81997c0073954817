package com.lotledger.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lotledger.domain.vo.FinancialYear;
import com.lotledger.exception.InvalidArgumentException;
import java.time.LocalDate;
import java.time.Month;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FinancialYearTest {

    @Test
    @DisplayName("2024-25 runs from April 1 2024 to March 31 2025")
    void boundaries() {
        FinancialYear fy = FinancialYear.parse("2024-25");

        assertThat(fy.getStart()).isEqualTo(LocalDate.of(2024, Month.APRIL, 1));
        assertThat(fy.getEnd()).isEqualTo(LocalDate.of(2025, Month.MARCH, 31));
        assertThat(fy.getLabel()).isEqualTo("2024-25");
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-25", "2024-2025", "FY 2024-25", "fy2024-25", "2024"})
    @DisplayName("Accepts the supported label formats")
    void acceptedFormats(String label) {
        assertThat(FinancialYear.parse(label)).isEqualTo(FinancialYear.ofStartYear(2024));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-26", "abcd", "2024-25-26", " "})
    @DisplayName("Rejects malformed labels")
    void rejectedFormats(String label) {
        assertThatThrownBy(() -> FinancialYear.parse(label)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Dates from April belong to the year starting that calendar year")
    void ofDate() {
        assertThat(FinancialYear.of(LocalDate.of(2024, 3, 31)).getLabel()).isEqualTo("2023-24");
        assertThat(FinancialYear.of(LocalDate.of(2024, 4, 1)).getLabel()).isEqualTo("2024-25");
        assertThat(FinancialYear.of(LocalDate.of(2024, 12, 31)).getLabel()).isEqualTo("2024-25");
    }

    @Test
    @DisplayName("Century rollover label")
    void centuryLabel() {
        assertThat(FinancialYear.ofStartYear(2099).getLabel()).isEqualTo("2099-00");
        assertThat(FinancialYear.parse("2099-00").getStartYear()).isEqualTo(2099);
    }

    @Test
    void containsAndNavigation() {
        FinancialYear fy = FinancialYear.ofStartYear(2024);

        assertThat(fy.contains(LocalDate.of(2024, 4, 1))).isTrue();
        assertThat(fy.contains(LocalDate.of(2025, 3, 31))).isTrue();
        assertThat(fy.contains(LocalDate.of(2025, 4, 1))).isFalse();
        assertThat(fy.previous().getLabel()).isEqualTo("2023-24");
        assertThat(fy.next().getLabel()).isEqualTo("2025-26");
    }
}
