package com.example.karma.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.karma.model.PlayerRecord;
import com.example.karma.service.KarmaErrorCode;
import com.example.karma.service.OrderQueryService;
import com.example.karma.service.PlayerService;
import com.example.karma.service.TransitionResult;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PlayerController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class PlayerControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PlayerService playerService;

  @MockitoBean private OrderQueryService orderQueryService;

  @Test
  void getPlayerReturnsBalanceAndTitle() throws Exception {
    when(playerService.find("player-1"))
        .thenReturn(TransitionResult.success(player("player-1", 7, 12, List.of("tea"))));

    mockMvc
        .perform(get("/v1/players/player-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.player_id").value("player-1"))
        .andExpect(jsonPath("$.karma_balance").value(7))
        .andExpect(jsonPath("$.reputation_score").value(12))
        .andExpect(jsonPath("$.title").value("Regular"));
  }

  @Test
  void updateCapabilitiesRequiresSamePlayer() throws Exception {
    mockMvc
        .perform(
            put("/v1/players/player-1/capabilities")
                .header("X-User-Id", "player-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"capabilities\":[\"tea\"]}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

    verifyNoInteractions(playerService);
  }

  @Test
  void updateCapabilitiesReturnsNormalisedList() throws Exception {
    when(playerService.updateCapabilities("player-1", List.of("Tea", "water")))
        .thenReturn(TransitionResult.success(player("player-1", 3, 0, List.of("tea", "water"))));

    mockMvc
        .perform(
            put("/v1/players/player-1/capabilities")
                .header("X-User-Id", "player-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"capabilities\":[\"Tea\",\"water\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.capabilities[0]").value("tea"));
  }

  @Test
  void historyRejectsUnknownRole() throws Exception {
    when(orderQueryService.history("player-1", "barista", 20))
        .thenReturn(TransitionResult.failure(KarmaErrorCode.VALIDATION_ERROR, "unknown role barista"));

    mockMvc
        .perform(get("/v1/players/player-1/orders").param("role", "barista"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void historyDefaultsToRequesterRole() throws Exception {
    when(orderQueryService.history("player-1", "requester", 20))
        .thenReturn(TransitionResult.success(List.of()));

    mockMvc
        .perform(get("/v1/players/player-1/orders"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").value("requester"))
        .andExpect(jsonPath("$.orders").isEmpty());
  }

  @Test
  void leaderboardListsPlayersInServiceOrder() throws Exception {
    when(playerService.leaderboard(2))
        .thenReturn(
            TransitionResult.success(
                List.of(player("top", 1, 40, List.of()), player("second", 9, 5, List.of()))));

    mockMvc
        .perform(get("/v1/leaderboard").param("limit", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.players[0].player_id").value("top"))
        .andExpect(jsonPath("$.players[1].player_id").value("second"));
  }

  private PlayerRecord player(String id, long karma, long reputation, List<String> capabilities) {
    return new PlayerRecord(id, karma, reputation, "Regular", capabilities, 0, 0, NOW, NOW);
  }
}
