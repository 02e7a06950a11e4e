package com.docverify.validation;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateParserTest {

    @Test
    void parse_isoDateWithTime_returnsDatePart() {
        assertThat(DateParser.parse("2019-03-07T10:15:00Z")).contains(LocalDate.of(2019, 3, 7));
    }

    @Test
    void parse_dayFirstWithAnySeparator_readsDayBeforeMonth() {
        assertThat(DateParser.parse("05/11/1990")).contains(LocalDate.of(1990, 11, 5));
        assertThat(DateParser.parse("05-11-1990")).contains(LocalDate.of(1990, 11, 5));
        assertThat(DateParser.parse("05.11.1990")).contains(LocalDate.of(1990, 11, 5));
    }

    @Test
    void parse_namedMonths_bothOrders() {
        assertThat(DateParser.parse("12 Jan 2001")).contains(LocalDate.of(2001, 1, 12));
        assertThat(DateParser.parse("12-Sept-2001")).contains(LocalDate.of(2001, 9, 12));
        assertThat(DateParser.parse("January 12, 2001")).contains(LocalDate.of(2001, 1, 12));
    }

    @Test
    void parse_bareYear_returnsFirstOfJanuary() {
        assertThat(DateParser.parse("2015")).contains(LocalDate.of(2015, 1, 1));
        assertThat(DateParser.parse("1850")).isEmpty();
    }

    @Test
    void parse_impossibleCalendarDay_isEmpty() {
        assertThat(DateParser.parse("31/02/2020")).isEmpty();
        assertThat(DateParser.parse("2021-13-01")).isEmpty();
    }

    @Test
    void parse_garbage_isEmpty() {
        assertThat(DateParser.parse("not a date")).isEmpty();
        assertThat(DateParser.parse("   ")).isEmpty();
        assertThat(DateParser.parse(null)).isEmpty();
    }
}
