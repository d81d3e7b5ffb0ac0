/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import java.io.IOException;

/**
 * A single request that can run once, either {@link #execute() synchronously} or {@link
 * #enqueue(Callback) asynchronously}. At any time, from any thread, you can call {@linkplain
 * #cancel()}, which might stop an in-flight request or prevent one from occurring.
 *
 * <p>Input errors, such as an invalid query, should be raised when the call is created, not
 * deferred until {@linkplain #execute()}.
 *
 * <p>An instance cannot be invoked more than once, but you can {@linkplain #clone()} it to replay.
 *
 * @param <V> the success type, typically not null except when {@code V} is {@linkplain Void}.
 */
public abstract class Call<V> implements Cloneable {
  /** Returns a completed call which has the supplied value. */
  public static <V> Call<V> create(V v) {
    return new Constant<>(v);
  }

  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /**
   * Invokes a request, returning a success value or propagating an error to the caller. Invoking
   * this more than once will result in an error.
   */
  public abstract V execute() throws IOException;

  /**
   * Invokes a request asynchronously, signaling the {@code callback} when complete. Invoking this
   * more than once will result in an error.
   */
  public abstract void enqueue(Callback<V> callback);

  /**
   * Requests to cancel this call. Some implementations cancel asynchronously, or not at all when
   * already complete.
   */
  public abstract void cancel();

  /** Returns true if {@linkplain #cancel()} was called. */
  public abstract boolean isCanceled();

  /** Returns a copy of this object, so you can make an identical follow-up request. */
  @Override public abstract Call<V> clone();

  static class Constant<V> extends Base<V> { // not final for mock testing
    final V v;

    Constant(V v) {
      this.v = v;
    }

    @Override protected V doExecute() {
      return v;
    }

    @Override protected void doEnqueue(Callback<V> callback) {
      callback.onSuccess(v);
    }

    @Override public Call<V> clone() {
      return new Constant<>(v);
    }

    @Override public String toString() {
      return "ConstantCall{value=" + v + "}";
    }
  }

  /** Guards against double execution and implements cancelation state. */
  public static abstract class Base<V> extends Call<V> {
    volatile boolean canceled;
    boolean executed;

    protected Base() {
    }

    @Override public final V execute() throws IOException {
      synchronized (this) {
        if (this.executed) throw new IllegalStateException("Already Executed");
        this.executed = true;
      }

      if (isCanceled()) {
        throw new IOException("Canceled");
      } else {
        return this.doExecute();
      }
    }

    protected abstract V doExecute() throws IOException;

    @Override public final void enqueue(Callback<V> callback) {
      synchronized (this) {
        if (this.executed) throw new IllegalStateException("Already Executed");
        this.executed = true;
      }

      if (isCanceled()) {
        callback.onError(new IOException("Canceled"));
      } else {
        this.doEnqueue(callback);
      }
    }

    protected abstract void doEnqueue(Callback<V> callback);

    @Override public final void cancel() {
      this.canceled = true;
      doCancel();
    }

    protected void doCancel() {
    }

    @Override public final boolean isCanceled() {
      return this.canceled || doIsCanceled();
    }

    protected boolean doIsCanceled() {
      return false;
    }
  }
}
