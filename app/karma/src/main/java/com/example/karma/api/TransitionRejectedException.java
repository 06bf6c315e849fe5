/*
 * どこで: Karma API
 * 何を: 失敗した TransitionResult を HTTP 層へ運ぶ例外
 * なぜ: コントローラを成功経路だけで書けるようにするため
 */
package com.example.karma.api;

import com.example.karma.service.KarmaErrorCode;

public class TransitionRejectedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final KarmaErrorCode code;

  public TransitionRejectedException(KarmaErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public KarmaErrorCode code() {
    return code;
  }
}
