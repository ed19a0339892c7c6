package com.whereq.scribe.model;

import lombok.Value;

/**
 * How an orchestrator run reports itself
 */
@Value
public class RunOptions {
    /**
     * Silent runs skip the global activity log and the progress snapshot; job logs are still kept
     */
    boolean silent;

    /**
     * Present only for interactive runs
     */
    CancellationToken cancellationToken;

    public static RunOptions interactive(CancellationToken token) {
        return new RunOptions(false, token);
    }

    public static RunOptions silent() {
        return new RunOptions(true, null);
    }
}
