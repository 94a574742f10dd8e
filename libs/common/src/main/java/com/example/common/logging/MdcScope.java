/*
 * どこで: Common ログ補助
 * 何を: try-with-resources の間だけ MDC キーを設定し、close で取り除く
 * なぜ: バックグラウンド処理には MDC を片付けるリクエストインターセプタがないため
 */
package com.example.common.logging;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

public final class MdcScope implements AutoCloseable {

  private final List<String> keys = new ArrayList<>();

  private MdcScope() {}

  public static MdcScope open() {
    return new MdcScope();
  }

  public MdcScope put(String key, String value) {
    if (value == null || value.isBlank()) {
      return this;
    }
    MDC.put(key, value);
    keys.add(key);
    return this;
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
    keys.clear();
  }
}
