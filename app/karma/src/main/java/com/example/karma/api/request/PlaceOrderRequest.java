/*
 * どこで: Karma API リクエスト DTO
 * 何を: 注文作成の入力を定義する
 * なぜ: cost/recipient を省略可能にし、既定値はサーバー側で決めるため
 */
package com.example.karma.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlaceOrderRequest(
    @NotBlank @Size(max = 64) String category,
    String recipientId,
    @Positive Integer cost,
    @Size(max = 256) String dropLocation) {}
