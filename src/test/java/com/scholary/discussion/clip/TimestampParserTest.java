package com.scholary.discussion.clip;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TimestampParserTest {

  @Test
  void parse_shouldReadMinutesAndSeconds() {
    assertThat(TimestampParser.parse("4:05").getAsDouble()).isEqualTo(245.0);
    assertThat(TimestampParser.parse(" 12:30 ").getAsDouble()).isEqualTo(750.0);
    assertThat(TimestampParser.parse("75:00").getAsDouble()).isEqualTo(4500.0);
  }

  @Test
  void parse_shouldReadHours() {
    assertThat(TimestampParser.parse("1:02:03").getAsDouble()).isEqualTo(3723.0);
  }

  @Test
  void parse_shouldIgnoreFractionalSeconds() {
    assertThat(TimestampParser.parse("0:07.5").getAsDouble()).isEqualTo(7.0);
  }

  @Test
  void parse_shouldRejectMalformedValues() {
    assertThat(TimestampParser.parse(null)).isEmpty();
    assertThat(TimestampParser.parse("")).isEmpty();
    assertThat(TimestampParser.parse("around the middle")).isEmpty();
    assertThat(TimestampParser.parse("4:75")).isEmpty();
    assertThat(TimestampParser.parse("1:60:00")).isEmpty();
    assertThat(TimestampParser.parse("45")).isEmpty();
  }
}
