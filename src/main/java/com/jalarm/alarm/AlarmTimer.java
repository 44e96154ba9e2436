package com.jalarm.alarm;

import java.time.Instant;
import java.util.Optional;

/**
 * The single wake-up timer of one owner. Arming while armed replaces the previous
 * timer; timers never stack. A timer that has fired is no longer armed.
 */
public interface AlarmTimer {

    void arm(Instant at);

    void disarm();

    Optional<Instant> armedAt();
}
