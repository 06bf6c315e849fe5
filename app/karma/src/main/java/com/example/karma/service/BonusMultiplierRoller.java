/*
 * どこで: Karma サービス層
 * 何を: 配達時のボーナス倍率(1/2/3 倍)を抽選する
 * なぜ: 抽選確率を設定値で差し替え、テストでは固定できるようにするため
 */
package com.example.karma.service;

import com.example.karma.config.KarmaOrderProperties;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class BonusMultiplierRoller {

  private final KarmaOrderProperties.Bonus bonus;
  private final DoubleSupplier random;

  @Autowired
  public BonusMultiplierRoller(KarmaOrderProperties properties) {
    this(properties, () -> ThreadLocalRandom.current().nextDouble());
  }

  BonusMultiplierRoller(KarmaOrderProperties properties, DoubleSupplier random) {
    this.bonus = properties.bonus();
    this.random = random;
  }

  public int roll() {
    final double draw = random.getAsDouble();
    if (draw < bonus.tripleChance()) {
      return 3;
    }
    if (draw < bonus.tripleChance() + bonus.doubleChance()) {
      return 2;
    }
    return 1;
  }
}
