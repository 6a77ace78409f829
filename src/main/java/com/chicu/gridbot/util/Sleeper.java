package com.chicu.gridbot.util;

import java.time.Duration;

/**
 * Пауза потока. Отдельный интерфейс, чтобы в тестах не спать по-настоящему.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(Math.max(0L, d.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
