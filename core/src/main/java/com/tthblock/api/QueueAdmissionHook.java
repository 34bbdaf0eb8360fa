package com.tthblock.api;

import com.tthblock.core.admission.Decision;

/**
 * Decision point offered to the host's download queue. Called synchronously for every
 * file the queue is about to accept, so implementations must not do any I/O.
 */
public interface QueueAdmissionHook {
    Decision decide(String tth, String displayName);
}
