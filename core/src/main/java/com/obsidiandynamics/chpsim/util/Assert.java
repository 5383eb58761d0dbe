package com.obsidiandynamics.chpsim.util;

import java.util.function.*;

public final class Assert {
  private Assert() {}

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static <X extends Throwable> void isNotNull(Object obj, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    that(obj != null, errorMaker, messageBuilder);
  }

  public static <X extends Throwable> void that(boolean condition, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }
}
