package com.presentos.core.model;

public enum OutcomeStatus {
    /** The intent's primary action ran. Best-effort steps may still have left warnings. */
    ROUTED,
    /** The message could not be classified; nothing was touched. */
    UNKNOWN,
    /** A COMPLETE_TASK lookup matched no stored task. */
    NOT_FOUND,
    /** The task store rejected the create; nothing was forwarded. */
    FAILED
}
