package com.questrail.acars.splitter.runtime;

import com.questrail.acars.splitter.classify.Classifiers;
import com.questrail.acars.splitter.config.OutputSettings;
import com.questrail.acars.splitter.output.BucketWriter;
import com.questrail.acars.splitter.output.MessageRouter;

/**
 * Wiring shared by the UDP runtime and the offline splitter.
 */
final class RuntimeWiring {

    private RuntimeWiring() {}

    static MessageRouter router(OutputSettings output) {
        return new MessageRouter(
            output.splitBy(),
            Classifiers.forStrategy(output.splitBy(), output.keyword()),
            new BucketWriter(output.outputDirectory()));
    }
}
