/*
 * どこで: Common 共通ユーティリティ
 * 何を: リクエスト相関用 ID の採番と受信値の検証を行う
 * なぜ: X-Request-Id が無い/不正なリクエストにも安全なログ追跡キーを付与するため
 */
package com.example.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  private static final int MAX_REQUEST_ID_LENGTH = 128;
  private static final Pattern REQUEST_ID = Pattern.compile("^[A-Za-z0-9._:-]+$");

  private TraceIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString().replace("-", "");
  }

  /** ヘッダー由来の ID はログへそのまま載るため、長さと文字種を制限する。 */
  public static boolean isAcceptableRequestId(String candidate) {
    return candidate != null
        && !candidate.isBlank()
        && candidate.length() <= MAX_REQUEST_ID_LENGTH
        && REQUEST_ID.matcher(candidate).matches();
  }
}
