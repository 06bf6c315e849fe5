package com.example.karma.model;

/** 注文を起票した側。RUNNER はオファー経由で作られた注文。 */
public enum InitiatedBy {
  REQUESTER,
  RUNNER
}
