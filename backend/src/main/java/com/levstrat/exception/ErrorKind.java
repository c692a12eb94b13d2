package com.levstrat.exception;

/** Failure categories reported to callers. Every kind aborts the whole call. */
public enum ErrorKind {
    AUTHORIZATION,
    VALIDATION,
    SLIPPAGE,
    PROPORTIONALITY,
    EXTERNAL_CALL,
    ORACLE
}
