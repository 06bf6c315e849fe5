package com.example.karma.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReputationTitlesTest {

  private final ReputationTitles titles = new ReputationTitles();

  @Test
  void titleFollowsLadderThresholds() {
    assertThat(titles.titleFor(0)).isEqualTo("Parched");
    assertThat(titles.titleFor(1)).isEqualTo("Cold Pour");
    assertThat(titles.titleFor(3)).isEqualTo("The Initiate");
    assertThat(titles.titleFor(5)).isEqualTo("Keeper of the Drip");
    assertThat(titles.titleFor(8)).isEqualTo("Roast Prophet");
    assertThat(titles.titleFor(12)).isEqualTo("Foam Scryer");
    assertThat(titles.titleFor(16)).isEqualTo("Cafe Shade Mystic");
    assertThat(titles.titleFor(20)).isEqualTo("The Last Barista");
  }

  @Test
  void valuesBetweenThresholdsKeepLowerTitle() {
    assertThat(titles.titleFor(2)).isEqualTo("Cold Pour");
    assertThat(titles.titleFor(19)).isEqualTo("Cafe Shade Mystic");
    assertThat(titles.titleFor(500)).isEqualTo("The Last Barista");
  }

  @Test
  void negativeReputationFallsBackToLowestTitle() {
    assertThat(titles.titleFor(-1)).isEqualTo("Parched");
  }
}
