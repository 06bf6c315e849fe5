/*
 * どこで: Karma API リクエスト DTO
 * 何を: オファー受注の入力を定義する
 */
package com.example.karma.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClaimOfferRequest(@NotBlank String category, @Positive Integer cost, String recipientId) {}
