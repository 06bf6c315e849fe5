/*
 * どこで: Karma アプリの設定バインド
 * 何を: 注文/オファーの期限・コスト・ボーナス抽選確率を保持する
 * なぜ: 経済パラメータをコード変更なしで調整するため
 */
package com.example.karma.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "karma.order")
public record KarmaOrderProperties(
    @NotNull Duration claimWindow,
    @NotNull Duration deliveryWindow,
    @NotNull Duration maxOfferWindow,
    String operatorId,
    @Positive int defaultCost,
    Map<String, Integer> categoryCosts,
    @Valid @NotNull Bonus bonus) {

  public KarmaOrderProperties {
    categoryCosts = categoryCosts == null ? Map.of() : Map.copyOf(categoryCosts);
  }

  /** カテゴリ別コスト。未登録カテゴリは defaultCost。 */
  public int costFor(String category) {
    if (category == null) {
      return defaultCost;
    }
    final Integer cost = categoryCosts.get(category.toLowerCase(Locale.ROOT));
    return cost == null ? defaultCost : cost;
  }

  public boolean isOperator(String playerId) {
    return operatorId != null && !operatorId.isBlank() && operatorId.equals(playerId);
  }

  public record Bonus(
      @DecimalMin("0.0") @DecimalMax("1.0") double tripleChance,
      @DecimalMin("0.0") @DecimalMax("1.0") double doubleChance) {}
}
