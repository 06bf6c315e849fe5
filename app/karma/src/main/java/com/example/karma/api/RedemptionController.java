package com.example.karma.api;

import com.example.karma.api.request.RedeemRequest;
import com.example.karma.api.response.RedemptionResponse;
import com.example.karma.service.RedemptionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/redemptions")
@RequiredArgsConstructor
@Validated
public class RedemptionController {

  private final RedemptionService redemptionService;

  @PostMapping
  public RedemptionResponse redeem(
      @RequestHeader(OrderController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId,
      @Valid @RequestBody RedeemRequest request) {
    return TransitionResults.unwrap(
        redemptionService.redeem(request.code(), userId), RedemptionResponse::from);
  }
}
