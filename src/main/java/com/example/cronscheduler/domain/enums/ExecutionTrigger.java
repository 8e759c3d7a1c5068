package com.example.cronscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What caused a job function to be invoked.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionTrigger {

    /**
     * Selected as due by a run-loop pass
     */
    SCHEDULED("Scheduled"),

    /**
     * Forced single-job run
     */
    MANUAL("Manual");

    private final String displayName;
}
