package io.maubotoperator.action;

public enum ActionFailure {
    PRECONDITION,
    AUTHENTICATION,
    CALL
}
