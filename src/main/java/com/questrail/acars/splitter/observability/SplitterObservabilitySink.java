package com.questrail.acars.splitter.observability;

/**
 * Receives everything the splitter wants an operator to know about.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks run on the thread that did the work (the transport event loop in
 * production) and should return quickly.</p>
 */
public interface SplitterObservabilitySink {
    /**
     * A message was appended to its bucket.
     */
    void onMessageRouted(MessageRoutedEvent event);

    /**
     * A source delivered undecodable or unframeable input.
     */
    void onSourceAnomaly(SourceAnomalyEvent event);

    /**
     * A source's transport came up or went down.
     */
    void onTransportEvent(TransportStateEvent event);

    /**
     * Something failed; processing continues.
     */
    void onError(SplitterErrorEvent event);
}
