package com.jalarm.alarm;

/**
 * Creates the per-owner timer. {@code onFire} is invoked on a timer thread when the
 * armed instant is reached.
 */
public interface AlarmTimerFactory {

    AlarmTimer create(String ownerId, Runnable onFire);
}
