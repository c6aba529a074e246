package com.questrail.acars.splitter.observability;

/**
 * No-op implementation of SplitterObservabilitySink.
 */
public final class NullObservabilitySink implements SplitterObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageRouted(MessageRoutedEvent event) {}

    @Override
    public void onSourceAnomaly(SourceAnomalyEvent event) {}

    @Override
    public void onTransportEvent(TransportStateEvent event) {}

    @Override
    public void onError(SplitterErrorEvent event) {}
}
