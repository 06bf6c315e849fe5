/*
 * どこで: Karma サービス層
 * 何を: トランザクション内の業務エラーをコード付きで運ぶ
 * なぜ: 失敗時に台帳/注文/outbox の変更をまとめてロールバックさせるため
 */
package com.example.karma.service;

public class LifecycleException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final KarmaErrorCode code;

  public LifecycleException(KarmaErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public KarmaErrorCode code() {
    return code;
  }
}
