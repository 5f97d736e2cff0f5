package com.adforge.core.guard;

/**
 * One unit of remote work. Implementations should observe the token and abort
 * their in-flight request when it is cancelled.
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T call(CancellationToken token) throws Exception;
}
