/*
 * どこで: Karma API
 * 何を: 注文の作成/受注/取消/返却/配達/参照のエンドポイントを提供する
 * なぜ: チャット側のコマンド層から状態遷移を呼び出す入口を提供するため
 */
package com.example.karma.api;

import com.example.karma.api.request.MessageRefRequest;
import com.example.karma.api.request.PlaceOrderRequest;
import com.example.karma.api.response.OrderResponse;
import com.example.karma.service.LifecycleEngine;
import com.example.karma.service.OrderQueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
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
@RequestMapping("/v1/orders")
@RequiredArgsConstructor
@Validated
public class OrderController {

    static final String HEADER_USER_ID = "X-User-Id";

    private final LifecycleEngine lifecycleEngine;
    private final OrderQueryService orderQueryService;

    @PostMapping
    public ResponseEntity<OrderResponse> place(
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
            @Valid @RequestBody PlaceOrderRequest request) {
        final OrderResponse response = TransitionResults.unwrap(
                lifecycleEngine.place(
                        userId, request.recipientId(), request.category(), request.cost(), request.dropLocation()),
                OrderResponse::from);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{order_id}")
    public OrderResponse get(@PathVariable("order_id") UUID orderId) {
        return TransitionResults.unwrap(orderQueryService.findOrder(orderId), OrderResponse::from);
    }

    @PostMapping("/{order_id}/claim")
    public OrderResponse claim(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
        return TransitionResults.unwrap(lifecycleEngine.claim(orderId, userId), OrderResponse::from);
    }

    @PostMapping("/{order_id}/cancel")
    public OrderResponse cancel(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
        return TransitionResults.unwrap(lifecycleEngine.cancel(orderId, userId), OrderResponse::from);
    }

    @PostMapping("/{order_id}/release")
    public OrderResponse release(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
        return TransitionResults.unwrap(lifecycleEngine.cancelClaimed(orderId, userId), OrderResponse::from);
    }

    @PostMapping("/{order_id}/deliver")
    public OrderResponse deliver(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
        return TransitionResults.unwrap(lifecycleEngine.deliver(orderId, userId), OrderResponse::from);
    }

    @PutMapping("/{order_id}/message-ref")
    public OrderResponse attachMessageRef(
            @PathVariable("order_id") UUID orderId,
            @Valid @RequestBody MessageRefRequest request) {
        return TransitionResults.unwrap(
                orderQueryService.attachOrderMessageRef(orderId, request.messageRef()), OrderResponse::from);
    }
}
