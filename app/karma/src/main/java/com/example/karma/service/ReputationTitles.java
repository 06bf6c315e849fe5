/*
 * どこで: Karma サービス層
 * 何を: reputation から表示用の称号を導出する
 * なぜ: 称号を reputation 変更時に再計算してキャッシュするため
 */
package com.example.karma.service;

import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ReputationTitles {

  private static final List<Rung> LADDER =
      List.of(
          new Rung(20, "The Last Barista"),
          new Rung(16, "Cafe Shade Mystic"),
          new Rung(12, "Foam Scryer"),
          new Rung(8, "Roast Prophet"),
          new Rung(5, "Keeper of the Drip"),
          new Rung(3, "The Initiate"),
          new Rung(1, "Cold Pour"),
          new Rung(0, "Parched"));

  public String titleFor(long reputation) {
    for (Rung rung : LADDER) {
      if (reputation >= rung.threshold()) {
        return rung.title();
      }
    }
    // 負値は DB 制約で入らないが、表示だけは最下位にそろえる
    return LADDER.get(LADDER.size() - 1).title();
  }

  private record Rung(long threshold, String title) {}
}
