/*
 * どこで: Karma ドメインモデル
 * 何を: compare-and-swap 更新の結果と更新後レコードを表す
 * なぜ: 0 行更新の理由(不在/終端/競合)を呼び出し側で分岐できるようにするため
 */
package com.example.karma.model;

public record ConditionalUpdateResult<T>(UpdateOutcome outcome, T record) {

  public static <T> ConditionalUpdateResult<T> ok(T record) {
    return new ConditionalUpdateResult<>(UpdateOutcome.OK, record);
  }

  public static <T> ConditionalUpdateResult<T> of(UpdateOutcome outcome) {
    return new ConditionalUpdateResult<>(outcome, null);
  }

  public boolean isOk() {
    return outcome == UpdateOutcome.OK;
  }
}
