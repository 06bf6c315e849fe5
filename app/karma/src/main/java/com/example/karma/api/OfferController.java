/*
 * どこで: Karma API
 * 何を: ランナー起点のオファー掲示/受注/取消/参照を提供する
 */
package com.example.karma.api;

import com.example.karma.api.request.ClaimOfferRequest;
import com.example.karma.api.request.MessageRefRequest;
import com.example.karma.api.request.PostOfferRequest;
import com.example.karma.api.response.OfferResponse;
import com.example.karma.api.response.OrderResponse;
import com.example.karma.service.LifecycleEngine;
import com.example.karma.service.OrderQueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/offers")
@RequiredArgsConstructor
@Validated
public class OfferController {

  private final LifecycleEngine lifecycleEngine;
  private final OrderQueryService orderQueryService;

  @PostMapping
  public ResponseEntity<OfferResponse> post(
      @RequestHeader(OrderController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId,
      @Valid @RequestBody PostOfferRequest request) {
    final Duration window =
        request.windowSeconds() == null ? null : Duration.ofSeconds(request.windowSeconds());
    final OfferResponse response =
        TransitionResults.unwrap(
            lifecycleEngine.offer(userId, request.capabilities(), window), OfferResponse::from);
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/{offer_id}")
  public OfferResponse get(@PathVariable("offer_id") UUID offerId) {
    return TransitionResults.unwrap(orderQueryService.findOffer(offerId), OfferResponse::from);
  }

  /** 受注に成功すると、オファーから作られた注文を返す。 */
  @PostMapping("/{offer_id}/claim")
  public ResponseEntity<OrderResponse> claim(
      @PathVariable("offer_id") UUID offerId,
      @RequestHeader(OrderController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId,
      @Valid @RequestBody ClaimOfferRequest request) {
    final OrderResponse response =
        TransitionResults.unwrap(
            lifecycleEngine.claimOffer(
                offerId, userId, request.category(), request.cost(), request.recipientId()),
            OrderResponse::from);
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PostMapping("/{offer_id}/cancel")
  public OfferResponse cancel(
      @PathVariable("offer_id") UUID offerId,
      @RequestHeader(OrderController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId) {
    return TransitionResults.unwrap(lifecycleEngine.cancelOffer(offerId, userId), OfferResponse::from);
  }

  @PutMapping("/{offer_id}/message-ref")
  public OfferResponse attachMessageRef(
      @PathVariable("offer_id") UUID offerId, @Valid @RequestBody MessageRefRequest request) {
    return TransitionResults.unwrap(
        orderQueryService.attachOfferMessageRef(offerId, request.messageRef()),
        OfferResponse::from);
  }
}
