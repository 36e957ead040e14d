package io.outlog.application.pipeline;

/**
 * The real send operation of an instrumented client.
 *
 * @param <R> native response type
 * @param <E> checked exception the client declares
 */
@FunctionalInterface
public interface UnderlyingCall<R, E extends Exception> {

  R call() throws E;
}
