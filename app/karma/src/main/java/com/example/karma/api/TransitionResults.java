package com.example.karma.api;

import com.example.karma.service.TransitionResult;
import java.util.function.Function;

final class TransitionResults {

  private TransitionResults() {}

  /** 成功値を変換して返す。失敗は TransitionRejectedException として投げる。 */
  static <T, R> R unwrap(TransitionResult<T> result, Function<T, R> mapper) {
    if (!result.isSuccess()) {
      throw new TransitionRejectedException(result.error(), result.message());
    }
    return mapper.apply(result.value());
  }
}
