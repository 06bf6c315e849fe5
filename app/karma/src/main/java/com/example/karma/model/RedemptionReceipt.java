package com.example.karma.model;

/** コード消費の結果。karmaBalance は付与後の残高。 */
public record RedemptionReceipt(String code, String playerId, int karmaValue, long karmaBalance) {}
