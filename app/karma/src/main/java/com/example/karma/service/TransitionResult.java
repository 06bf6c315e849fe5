/*
 * どこで: Karma サービス層
 * 何を: 状態遷移の成功値または失敗コードを保持する
 * なぜ: 業務エラーを例外ではなく型付きの戻り値として公開するため
 */
package com.example.karma.service;

import java.util.Objects;

public record TransitionResult<T>(T value, KarmaErrorCode error, String message) {

  public static <T> TransitionResult<T> success(T value) {
    return new TransitionResult<>(Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> TransitionResult<T> failure(KarmaErrorCode error, String message) {
    return new TransitionResult<>(null, Objects.requireNonNull(error, "error"), message);
  }

  static <T> TransitionResult<T> from(LifecycleException ex) {
    return failure(ex.code(), ex.getMessage());
  }

  public boolean isSuccess() {
    return error == null;
  }
}
