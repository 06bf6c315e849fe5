package com.example.karma.api.response;

import com.example.karma.model.OfferRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record OfferResponse(
    String offerId,
    String status,
    String runnerId,
    List<String> capabilities,
    String createdAt,
    String expiryAt,
    String claimedAt,
    String externalMessageRef) {

  public static OfferResponse from(OfferRecord offer) {
    return new OfferResponse(
        offer.offerId().toString(),
        offer.status().name(),
        offer.runnerId(),
        offer.capabilities(),
        OrderResponse.format(offer.createdAt()),
        OrderResponse.format(offer.expiryAt()),
        OrderResponse.format(offer.claimedAt()),
        offer.externalMessageRef());
  }
}
