package com.ospicorp.analyticsapi.analytics.service;

public class ModelingException extends RuntimeException {

  public ModelingException(String message) {
    super(message);
  }

  public ModelingException(String message, Throwable cause) {
    super(message, cause);
  }
}
