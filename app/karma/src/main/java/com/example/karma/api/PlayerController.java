/*
 * どこで: Karma API
 * 何を: プレイヤー参照/能力宣言/注文履歴/ランキングを提供する
 */
package com.example.karma.api;

import com.example.karma.api.request.UpdateCapabilitiesRequest;
import com.example.karma.api.response.LeaderboardResponse;
import com.example.karma.api.response.OrderHistoryResponse;
import com.example.karma.api.response.OrderResponse;
import com.example.karma.api.response.PlayerResponse;
import com.example.karma.service.KarmaErrorCode;
import com.example.karma.service.OrderQueryService;
import com.example.karma.service.PlayerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class PlayerController {

  private final PlayerService playerService;
  private final OrderQueryService orderQueryService;

  @GetMapping("/players/{player_id}")
  public PlayerResponse get(@PathVariable("player_id") String playerId) {
    return TransitionResults.unwrap(playerService.find(playerId), PlayerResponse::from);
  }

  /** 能力は本人のみ更新できる。 */
  @PutMapping("/players/{player_id}/capabilities")
  public PlayerResponse updateCapabilities(
      @PathVariable("player_id") String playerId,
      @RequestHeader(OrderController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId,
      @Valid @RequestBody UpdateCapabilitiesRequest request) {
    if (!playerId.equals(userId)) {
      throw new TransitionRejectedException(
          KarmaErrorCode.UNAUTHORIZED, "capabilities can only be updated by the player");
    }
    return TransitionResults.unwrap(
        playerService.updateCapabilities(playerId, request.capabilities()), PlayerResponse::from);
  }

  @GetMapping("/players/{player_id}/orders")
  public OrderHistoryResponse orders(
      @PathVariable("player_id") String playerId,
      @RequestParam(value = "role", defaultValue = "requester") String role,
      @RequestParam(value = "limit", defaultValue = "20") int limit) {
    return TransitionResults.unwrap(
        orderQueryService.history(playerId, role, limit),
        orders ->
            new OrderHistoryResponse(
                playerId, role, orders.stream().map(OrderResponse::from).toList()));
  }

  @GetMapping("/leaderboard")
  public LeaderboardResponse leaderboard(
      @RequestParam(value = "limit", defaultValue = "10") int limit) {
    return TransitionResults.unwrap(
        playerService.leaderboard(limit),
        players -> new LeaderboardResponse(players.stream().map(PlayerResponse::from).toList()));
  }
}
