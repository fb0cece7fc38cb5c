package io.agentkernel.admission;

public enum SecurityRejection {
    MALICIOUS_INPUT,
    QUEUE_SATURATED
}
