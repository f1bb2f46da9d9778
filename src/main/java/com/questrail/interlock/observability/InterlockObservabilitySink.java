package com.questrail.interlock.observability;

/**
 * Receives observability events from a chamber controller.
 * Implementations can provide logging, metrics, or alerting.
 *
 * <p>Sinks are called on the control-cycle thread and must not block.</p>
 */
public interface InterlockObservabilitySink {
    /**
     * Called when the interlock state changes.
     * @param event the transition event details
     */
    void onStateTransition(InterlockTransitionEvent event);

    /**
     * Called when a fault is detected.
     * @param event the fault details
     */
    void onFault(InterlockFaultEvent event);
}
