package com.usermgmt.user.logging;

import java.util.Set;

/**
 * Best-effort attribution of the component that issued a log call.
 *
 * <p>Walks at most {@value #MAX_DEPTH} frames and returns the first declaring class that is not
 * part of the logging pipeline. Only used when the caller did not pass a module explicitly.
 */
public final class CallerModuleResolver {

  static final int MAX_DEPTH = 10;
  static final String UNKNOWN = "unknown";

  private static final Set<String> IGNORED_CLASSES =
      Set.of(
          CallerModuleResolver.class.getName(),
          StructuredAuditLogger.class.getName(),
          AuditLogger.class.getName(),
          SqlStatementCollector.class.getName(),
          "com.usermgmt.user.config.HttpRequestLoggingFilter",
          "com.usermgmt.user.config.SqlLoggingFilter");

  private CallerModuleResolver() {}

  public static String resolve() {
    return StackWalker.getInstance()
        .walk(
            frames ->
                frames
                    .limit(MAX_DEPTH)
                    .map(StackWalker.StackFrame::getClassName)
                    .filter(name -> !IGNORED_CLASSES.contains(name))
                    .filter(name -> !name.contains("$$"))
                    .findFirst()
                    .orElse(UNKNOWN));
  }
}
