package com.usermgmt.user.service;

import java.util.List;

public record BulkOperationResult(int successful, int failed, List<ItemResult> results) {

  public BulkOperationResult {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public int total() {
    return successful + failed;
  }

  public record ItemResult(long id, boolean success, String error) {}
}
