package com.obsidiandynamics.chpsim;

import java.util.*;

public enum Opcode {
  RESET("r", 0),
  H("h", 1),
  P("p", 1), // S
  X("x", 1),
  Y("y", 1),
  Z("z", 1),
  CNOT("c", 2), // control first
  MEASURE("m", 1);

  private static final Map<String, Opcode> BY_TOKEN = new HashMap<>();

  static {
    for (var opcode : values()) {
      BY_TOKEN.put(opcode.token, opcode);
    }
  }

  private final String token;

  private final int arity;

  Opcode(String token, int arity) {
    this.token = token;
    this.arity = arity;
  }

  public String getToken() {
    return token;
  }

  public int getArity() {
    return arity;
  }

  public static Opcode forToken(String token) {
    return BY_TOKEN.get(token);
  }
}
