package com.consullo.standby.demo;

import java.util.OptionalLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the demo's command-line handling.
 *
 * @since 1.0
 */
public class StandbyDemoTest {

  @Test
  @DisplayName("Should read no interval when no argument is given")
  void intervalArgument_NoArgs_Empty() {
    assertThat(StandbyDemo.intervalArgument(new String[0])).isEmpty();
  }

  @Test
  @DisplayName("Should parse a numeric interval argument")
  void intervalArgument_Numeric_Parsed() {
    assertThat(StandbyDemo.intervalArgument(new String[] {" 20 "})).isEqualTo(OptionalLong.of(20L));
  }

  @Test
  @DisplayName("Should reject a non-numeric interval argument with a readable message")
  void intervalArgument_NonNumeric_Rejected() {
    assertThatThrownBy(() -> StandbyDemo.intervalArgument(new String[] {"soon"}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("intervalMinutes must be a whole number: soon")
        .hasCauseInstanceOf(NumberFormatException.class);
  }

  @Test
  @DisplayName("Should print the usage line and return without starting for a bad argument")
  void main_NonNumericArgument_ReturnsWithoutThrowing() throws Exception {
    StandbyDemo.main(new String[] {"abc"});

    assertThat(StandbyDemo.USAGE).startsWith("Usage: StandbyDemo");
  }
}
