package com.mouse.cricket.lifecycle;

public enum LifecycleAction {
    NONE,
    PROVISION,
    GO_LIVE,
    COMPLETE
}
