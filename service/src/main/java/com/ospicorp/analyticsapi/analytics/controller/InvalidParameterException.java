package com.ospicorp.analyticsapi.analytics.controller;

/** A request parameter outside its supported values; answered with a documented error code. */
public class InvalidParameterException extends RuntimeException {
  static final String ERROR_DOCS_BASE = "https://docs.analytics-api.dev/errors/";

  private final int errorCode;

  public InvalidParameterException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
