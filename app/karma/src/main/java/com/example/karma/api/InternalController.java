/*
 * どこで: Karma 内部 API
 * 何を: 手動スイープと引き換えコード発行を提供する
 * なぜ: スケジューラ外から tick を起動し、運用でコードを配布できるようにするため
 */
package com.example.karma.api;

import com.example.karma.api.request.CreateRedemptionCodeRequest;
import com.example.karma.api.response.RedemptionCodeResponse;
import com.example.karma.api.response.SweepResponse;
import com.example.karma.service.ExpirySweeper;
import com.example.karma.service.RedemptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/v1")
@RequiredArgsConstructor
public class InternalController {

  private final ExpirySweeper expirySweeper;
  private final RedemptionService redemptionService;

  @PostMapping("/ticks")
  public SweepResponse tick() {
    return SweepResponse.from(expirySweeper.tick());
  }

  @PostMapping("/redemption-codes")
  public ResponseEntity<RedemptionCodeResponse> createRedemptionCode(
      @Valid @RequestBody CreateRedemptionCodeRequest request) {
    final RedemptionCodeResponse response =
        TransitionResults.unwrap(
            redemptionService.createCode(
                request.karmaValue(),
                request.maxRedemptions(),
                request.perUserLimit(),
                request.activeFrom(),
                request.expiresAt()),
            RedemptionCodeResponse::from);
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }
}
