package com.sutdahub.gameservice.games.sutda.domain.repository;

/**
 * 变更订阅句柄，调用 unsubscribe 后不再回调。
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
