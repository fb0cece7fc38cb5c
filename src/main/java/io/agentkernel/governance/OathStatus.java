package io.agentkernel.governance;

public enum OathStatus {
    UNSWORN,
    SWORN,
    INVALIDATED
}
