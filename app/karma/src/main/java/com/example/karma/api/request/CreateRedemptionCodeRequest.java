/*
 * どこで: Karma 内部 API リクエスト DTO
 * 何を: 引き換えコード発行の入力を定義する
 */
package com.example.karma.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateRedemptionCodeRequest(
    @NotNull @Positive Integer karmaValue,
    @NotNull @Positive Integer maxRedemptions,
    @NotNull @Positive Integer perUserLimit,
    Instant activeFrom,
    Instant expiresAt) {}
