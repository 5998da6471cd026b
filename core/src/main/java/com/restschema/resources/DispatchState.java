package com.restschema.resources;

/**
 * Stages of one request passing through a {@link ResourceDispatcher}. {@link #ERROR} can be
 * entered from any stage before {@link #DONE} and is final.
 */
public enum DispatchState {
  RECEIVED,
  PARSING_PARAMS,
  PARSING_BODY,
  INVOKING,
  SERIALIZING,
  DONE,
  ERROR;

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }
}
