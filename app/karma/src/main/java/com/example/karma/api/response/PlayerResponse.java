/*
 * どこで: Karma API レスポンス DTO
 * 何を: プレイヤーの残高/評判/称号を返す
 */
package com.example.karma.api.response;

import com.example.karma.model.PlayerRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record PlayerResponse(
    String playerId,
    long karmaBalance,
    long reputationScore,
    String title,
    List<String> capabilities,
    int ordersRequestedCount,
    int deliveriesCompletedCount) {

  public static PlayerResponse from(PlayerRecord player) {
    return new PlayerResponse(
        player.playerId(),
        player.karmaBalance(),
        player.reputationScore(),
        player.title(),
        player.capabilities(),
        player.ordersRequestedCount(),
        player.deliveriesCompletedCount());
  }
}
