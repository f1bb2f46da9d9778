package com.questrail.interlock.observability;

/**
 * No-op implementation of InterlockObservabilitySink.
 */
public final class NullObservabilitySink implements InterlockObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(InterlockTransitionEvent event) {}

    @Override
    public void onFault(InterlockFaultEvent event) {}
}
