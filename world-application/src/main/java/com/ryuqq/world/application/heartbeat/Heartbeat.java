package com.ryuqq.world.application.heartbeat;

import com.ryuqq.world.core.statemachine.HeartbeatState;

/**
 * World heartbeat.
 *
 * <p>This interface defines the recurring signal that drives world-wide simulation
 * advancement.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Invoke the tick callback at a fixed cadence, never two firings at once</li>
 *   <li>Contain failures raised by the callback so later firings keep running</li>
 *   <li>Track its lifecycle: UNINITIALIZED → SCHEDULED → TICKING → STOPPED</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Heartbeat heartbeat = new ScheduledHeartbeat(new HeartbeatConfig());
 * heartbeat.start(worldManager::updateEntities);
 * ...
 * heartbeat.stop();
 * </pre>
 *
 * @author World Team
 * @since 1.0.0
 */
public interface Heartbeat {

    /**
     * Schedules the tick callback.
     *
     * @param tick callback invoked once per firing
     * @throws IllegalArgumentException if tick is null
     * @throws IllegalStateException if the heartbeat was already started or stopped
     */
    void start(Runnable tick);

    /**
     * Stops the heartbeat and waits for an in-flight firing to finish. Calling it again once
     * stopped has no effect.
     */
    void stop();

    /**
     * @return current lifecycle state
     */
    HeartbeatState getState();

    /**
     * @return number of firings completed so far, failed ones included
     */
    long getTickCount();

    /**
     * @return number of firings whose callback raised an error
     */
    long getFailedTickCount();
}
