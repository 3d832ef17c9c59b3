package com.ospicorp.heartrate.web;

/** A request parameter failed validation; rendered as a 400 with an error code and docs link. */
public class InvalidParameterException extends RuntimeException {
  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode, String moreInfo) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
