/*
 * どこで: Karma API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.karma.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    VALIDATION_ERROR,
    INSUFFICIENT_FUNDS,
    NOT_FOUND,
    CONFLICT,
    UNAUTHORIZED,
    TERMINAL_STATE,
    EXTERNAL_DISPATCH_FAILURE
}
