package com.ospicorp.heartrate.ingestion.load;

public class StoreNotReadyException extends RuntimeException {

  public StoreNotReadyException(String message) {
    super(message);
  }

  public StoreNotReadyException(String message, Throwable cause) {
    super(message, cause);
  }
}
