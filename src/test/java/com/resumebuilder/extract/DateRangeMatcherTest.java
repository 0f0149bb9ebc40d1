package com.resumebuilder.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DateRangeMatcherTest {
  private final DateRangeMatcher matcher = new DateRangeMatcher(ExtractionRules.defaults());

  @Test
  void monthYearToOngoingMarker() {
    DateRange range = matcher.find("Jan 2020 - Atual");

    assertThat(range.start).isEqualTo("Jan 2020");
    assertThat(range.end).isEqualTo("Atual");
    assertThat(range.current).isTrue();
  }

  @Test
  void numericMonthsWithWordSeparator() {
    DateRange range = matcher.find("Analista (03/2018 até 12/2019)");

    assertThat(range.start).isEqualTo("03/2018");
    assertThat(range.end).isEqualTo("12/2019");
    assertThat(range.current).isFalse();
  }

  @Test
  void bareYearsWithEnDash() {
    DateRange range = matcher.find("2015 – 2019");

    assertThat(range.start).isEqualTo("2015");
    assertThat(range.end).isEqualTo("2019");
  }

  @Test
  void englishMonthsAndPresent() {
    DateRange range = matcher.find("March 2019 to Present");

    assertThat(range.start).isEqualTo("March 2019");
    assertThat(range.end).isEqualTo("Present");
    assertThat(range.current).isTrue();
  }

  @Test
  void sinceMarkerMeansOngoing() {
    DateRange range = matcher.find("Consultor desde março de 2021");

    assertThat(range.start).isEqualTo("março de 2021");
    assertThat(range.end).isNull();
    assertThat(range.current).isTrue();
  }

  @Test
  void reversedRangeIsSwapped() {
    DateRange range = matcher.find("2019 - 2015");

    assertThat(range.start).isEqualTo("2015");
    assertThat(range.end).isEqualTo("2019");
  }

  @Test
  void sameYearWithUnknownMonthsIsLeftAsWritten() {
    DateRange range = matcher.find("2020 - 2020");

    assertThat(range.start).isEqualTo("2020");
    assertThat(range.end).isEqualTo("2020");
  }

  @Test
  void textWithoutDatesHasNoRange() {
    assertThat(matcher.find("Desenvolvedor Java")).isNull();
    assertThat(matcher.find("Reduziu custos em 30%")).isNull();
  }

  @Test
  void removingTheRangeLeavesTheTitle() {
    String line = "Engenheiro - Acme (Jan 2020 - Atual)";
    DateRange range = matcher.find(line);

    assertThat(range.removeFrom(line)).isEqualTo("Engenheiro - Acme");
  }

  @Test
  void loneDateIsFoundWhenThereIsNoRange() {
    DateRange date = matcher.findDate("Bacharel em Direito, USP, 2012");

    assertThat(date.start).isEqualTo("2012");
    assertThat(date.current).isFalse();
  }
}
