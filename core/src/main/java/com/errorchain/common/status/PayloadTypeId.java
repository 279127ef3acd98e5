package com.errorchain.common.status;

import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;

/**
 * Identity of the concrete type boxed into an {@link ErrorValue}. Exactly one instance exists per
 * class for the lifetime of the class loader, so ids are compared by identity and two different
 * classes never share one.
 */
public final class PayloadTypeId {
  private static final AtomicInteger NEXT_ORDINAL = new AtomicInteger();

  private static final ClassValue<PayloadTypeId> IDS =
      new ClassValue<>() {
        @Override
        protected PayloadTypeId computeValue(Class<?> type) {
          return new PayloadTypeId(type, NEXT_ORDINAL.getAndIncrement());
        }
      };

  private final Class<?> type;
  private final int ordinal;

  private PayloadTypeId(Class<?> type, int ordinal) {
    this.type = type;
    this.ordinal = ordinal;
  }

  /** Returns the id registered for {@code type}, registering it on first use. */
  @Nonnull
  public static PayloadTypeId of(@Nonnull Class<?> type) {
    return IDS.get(type);
  }

  /** Returns the id of the runtime class of {@code payload}. */
  @Nonnull
  public static PayloadTypeId ofPayload(@Nonnull Object payload) {
    return IDS.get(payload.getClass());
  }

  @Nonnull
  public Class<?> type() {
    return type;
  }

  /** Returns whether this id identifies exactly {@code candidate}. */
  public boolean identifies(@Nonnull Class<?> candidate) {
    return of(candidate) == this;
  }

  @Override
  public String toString() {
    return type.getName() + "#" + ordinal;
  }
}
