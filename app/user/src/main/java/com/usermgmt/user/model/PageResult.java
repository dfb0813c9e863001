/*
 * どこで: app/user/src/main/java/com/usermgmt/user/model/PageResult.java
 * 何を: 1 ページ分の結果と総件数を保持する
 * なぜ: ページング応答 (pagination/links) を件数から一意に導出するため
 */
package com.usermgmt.user.model;

import java.util.List;
import java.util.function.Function;

public record PageResult<T>(List<T> items, int page, int perPage, long total) {

  public PageResult {
    items = items == null ? List.of() : List.copyOf(items);
    page = Math.max(1, page);
    perPage = Math.max(1, perPage);
    total = Math.max(0, total);
  }

  public int lastPage() {
    return (int) Math.max(1, (total + perPage - 1) / perPage);
  }

  /** 1 始まりの先頭件番号。空ページは null。 */
  public Long from() {
    return items.isEmpty() ? null : (long) (page - 1) * perPage + 1;
  }

  public Long to() {
    return items.isEmpty() ? null : (long) (page - 1) * perPage + items.size();
  }

  public boolean hasMorePages() {
    return page < lastPage();
  }

  public long offset() {
    return offsetOf(page, perPage);
  }

  /** 大きな page でも負にならないよう long で返す。 */
  public static long offsetOf(int page, int perPage) {
    return (long) (Math.max(1, page) - 1) * Math.max(1, perPage);
  }

  public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
    return new PageResult<>(items.stream().<R>map(mapper).toList(), page, perPage, total);
  }
}
