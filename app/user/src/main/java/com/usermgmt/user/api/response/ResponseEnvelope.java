/*
 * どこで: User API 応答
 * 何を: すべての JSON 応答を包む共通エンベロープ
 * なぜ: 成功/失敗を問わずクライアントが同じ形で結果とエラーを扱えるようにするため
 */
package com.usermgmt.user.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
  "success",
  "message",
  "code",
  "data",
  "errors",
  "correlation_id",
  "links",
  "meta",
  "debug",
  "timestamp",
  "request_id"
})
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "JSON DTO record はシリアライズ用途であり、防御的コピーよりも契約互換性を優先するため")
public record ResponseEnvelope(
    boolean success,
    String message,
    int code,
    Object data,
    List<Object> errors,
    String correlationId,
    Map<String, Object> links,
    Map<String, Object> meta,
    Map<String, Object> debug,
    String timestamp,
    String requestId) {}
