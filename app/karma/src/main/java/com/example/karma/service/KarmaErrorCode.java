/*
 * どこで: Karma サービス層
 * 何を: 状態遷移と台帳操作の失敗理由を定義する
 * なぜ: 呼び出し側が例外文言ではなくコードで分岐できるようにするため
 */
package com.example.karma.service;

public enum KarmaErrorCode {
  VALIDATION_ERROR,
  INSUFFICIENT_FUNDS,
  NOT_FOUND,
  CONFLICT,
  UNAUTHORIZED,
  TERMINAL_STATE,
  EXTERNAL_DISPATCH_FAILURE
}
