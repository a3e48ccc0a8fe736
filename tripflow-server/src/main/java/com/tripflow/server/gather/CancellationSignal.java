package com.tripflow.server.gather;

/**
 * 采集过程中轮询的取消标记。
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
