package com.questrail.interlock.internal.exec;

import com.questrail.interlock.internal.state.InterlockEffects;

/**
 * EffectExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure interlock reducer and the impure world of
 * relays, motor drives, watchdogs and caller futures.
 *
 * <h2>Role in the architecture</h2>
 * It is the ONLY layer allowed to:
 * <ul>
 *   <li>Write actuator outputs</li>
 *   <li>Register confirmation watchdogs</li>
 *   <li>Complete command futures</li>
 * </ul>
 * Everything above this boundary is pure, deterministic logic.
 *
 * <h2>Execution model</h2>
 * Effects are executed in order on the control-cycle thread. A failing effect
 * must not prevent the ones after it from running.
 */
public interface EffectExecutor
{
    /**
     * Executes the supplied effects.
     *
     * @param effects ordered effects of one cycle
     * @return number of effects that failed
     */
    int execute(InterlockEffects effects);
}
