/*
 * どこで: Karma 通知層
 * 何を: 外部通知先への送信失敗を表す
 * なぜ: 送信失敗をリトライ対象として記録し、確定済みの遷移には影響させないため
 */
package com.example.karma.service;

public class ExternalDispatchFailureException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ExternalDispatchFailureException(String message, Throwable cause) {
    super(message, cause);
  }

  public KarmaErrorCode code() {
    return KarmaErrorCode.EXTERNAL_DISPATCH_FAILURE;
  }
}
