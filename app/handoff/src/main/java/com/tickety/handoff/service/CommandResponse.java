package com.tickety.handoff.service;

public record CommandResponse(int status, Object body, boolean replayed) {

  public static CommandResponse of(int status, Object body) {
    return new CommandResponse(status, body, false);
  }
}
