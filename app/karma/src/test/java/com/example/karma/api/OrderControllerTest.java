package com.example.karma.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.karma.model.InitiatedBy;
import com.example.karma.model.OrderRecord;
import com.example.karma.model.OrderStatus;
import com.example.karma.service.KarmaErrorCode;
import com.example.karma.service.LifecycleEngine;
import com.example.karma.service.OrderQueryService;
import com.example.karma.service.TransitionResult;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(OrderController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class OrderControllerTest {

  private static final UUID ORDER_ID = UUID.fromString("3f1d7c2e-4d1a-4c55-9d8e-0a7f5b6c1e20");
  private static final Instant CREATED_AT = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private LifecycleEngine lifecycleEngine;

  @MockitoBean private OrderQueryService orderQueryService;

  @Test
  void placeReturns201() throws Exception {
    when(lifecycleEngine.place("requester-1", "recipient-1", "tea", null, "desk 4"))
        .thenReturn(TransitionResult.success(order(OrderStatus.ORDERED, null)));

    mockMvc
        .perform(
            post("/v1/orders")
                .header("X-User-Id", "requester-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"category":"tea","recipient_id":"recipient-1","drop_location":"desk 4"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.order_id").value(ORDER_ID.toString()))
        .andExpect(jsonPath("$.status").value("ORDERED"))
        .andExpect(jsonPath("$.karma_cost").value(2))
        .andExpect(jsonPath("$.expiry_at").value("2026-03-01T09:10:00Z"))
        .andExpect(jsonPath("$.runner_id").doesNotExist());
  }

  @Test
  void placeReturns422WhenBalanceIsShort() throws Exception {
    when(lifecycleEngine.place(eq("requester-1"), any(), eq("espresso"), eq(3), any()))
        .thenReturn(
            TransitionResult.failure(KarmaErrorCode.INSUFFICIENT_FUNDS, "karma balance is 1"));

    mockMvc
        .perform(
            post("/v1/orders")
                .header("X-User-Id", "requester-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"category":"espresso","cost":3}
                    """))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"))
        .andExpect(jsonPath("$.message").value("karma balance is 1"));
  }

  @Test
  void placeReturns400WhenHeaderMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"category":"tea"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));

    verifyNoInteractions(lifecycleEngine);
  }

  @Test
  void placeReturns400WhenValidationFails() throws Exception {
    mockMvc
        .perform(
            post("/v1/orders")
                .header("X-User-Id", "requester-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"category":"tea","cost":0}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verifyNoInteractions(lifecycleEngine);
  }

  @Test
  void claimReturnsClaimedOrder() throws Exception {
    when(lifecycleEngine.claim(ORDER_ID, "runner-1"))
        .thenReturn(TransitionResult.success(order(OrderStatus.CLAIMED, "runner-1")));

    mockMvc
        .perform(post("/v1/orders/{order_id}/claim", ORDER_ID).header("X-User-Id", "runner-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CLAIMED"))
        .andExpect(jsonPath("$.runner_id").value("runner-1"));
  }

  @Test
  void claimReturns409WhenAlreadyTaken() throws Exception {
    when(lifecycleEngine.claim(ORDER_ID, "runner-2"))
        .thenReturn(TransitionResult.failure(KarmaErrorCode.CONFLICT, "order is CLAIMED"));

    mockMvc
        .perform(post("/v1/orders/{order_id}/claim", ORDER_ID).header("X-User-Id", "runner-2"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONFLICT"));
  }

  @Test
  void deliverReturns403ForOtherRunner() throws Exception {
    when(lifecycleEngine.deliver(ORDER_ID, "intruder"))
        .thenReturn(TransitionResult.failure(KarmaErrorCode.UNAUTHORIZED, "not the runner"));

    mockMvc
        .perform(post("/v1/orders/{order_id}/deliver", ORDER_ID).header("X-User-Id", "intruder"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
  }

  @Test
  void cancelReturns409ForTerminalOrder() throws Exception {
    when(lifecycleEngine.cancel(ORDER_ID, "requester-1"))
        .thenReturn(TransitionResult.failure(KarmaErrorCode.TERMINAL_STATE, "order is EXPIRED"));

    mockMvc
        .perform(post("/v1/orders/{order_id}/cancel", ORDER_ID).header("X-User-Id", "requester-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("TERMINAL_STATE"));
  }

  @Test
  void releaseDelegatesToCancelClaimed() throws Exception {
    when(lifecycleEngine.cancelClaimed(ORDER_ID, "runner-1"))
        .thenReturn(TransitionResult.success(order(OrderStatus.CANCELLED_BY_RUNNER, "runner-1")));

    mockMvc
        .perform(post("/v1/orders/{order_id}/release", ORDER_ID).header("X-User-Id", "runner-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED_BY_RUNNER"));
  }

  @Test
  void getReturns404WhenMissing() throws Exception {
    when(orderQueryService.findOrder(ORDER_ID))
        .thenReturn(TransitionResult.failure(KarmaErrorCode.NOT_FOUND, "order not found"));

    mockMvc
        .perform(get("/v1/orders/{order_id}", ORDER_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void getReturns400ForMalformedId() throws Exception {
    mockMvc
        .perform(get("/v1/orders/not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("order_id is invalid"));
  }

  @Test
  void attachMessageRefReturnsUpdatedOrder() throws Exception {
    when(orderQueryService.attachOrderMessageRef(ORDER_ID, "chat-123"))
        .thenReturn(TransitionResult.success(order(OrderStatus.ORDERED, null)));

    mockMvc
        .perform(
            put("/v1/orders/{order_id}/message-ref", ORDER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"message_ref":"chat-123"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.order_id").value(ORDER_ID.toString()));
  }

  private OrderRecord order(OrderStatus status, String runnerId) {
    final boolean claimed = runnerId != null;
    return new OrderRecord(
        ORDER_ID,
        status,
        InitiatedBy.REQUESTER,
        null,
        "requester-1",
        "recipient-1",
        runnerId,
        "tea",
        2,
        "desk 4",
        CREATED_AT,
        CREATED_AT.plusSeconds(600),
        claimed ? CREATED_AT.plusSeconds(60) : null,
        claimed ? CREATED_AT.plusSeconds(660) : null,
        null,
        1,
        null,
        CREATED_AT);
  }
}
