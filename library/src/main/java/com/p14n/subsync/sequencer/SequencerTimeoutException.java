package com.p14n.subsync.sequencer;

import java.time.Duration;
import java.util.List;

/**
 * Raised when a sequencer could not drain its queue within the shutdown
 * timeout. Carries the descriptions of the work items that never ran.
 */
public class SequencerTimeoutException extends RuntimeException {

    private final List<String> abandoned;

    public SequencerTimeoutException(String sequencer, Duration timeout, List<String> abandoned) {
        super(String.format("Sequencer %s did not finish within %s, abandoned %d work item(s)",
                sequencer, timeout, abandoned.size()));
        this.abandoned = List.copyOf(abandoned);
    }

    public List<String> abandoned() {
        return abandoned;
    }
}
