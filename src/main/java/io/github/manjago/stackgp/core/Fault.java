package io.github.manjago.stackgp.core;

/**
 * Runtime faults raised by the VM.
 * Reported as outcome values, never as exceptions.
 */
public enum Fault {
    STACK_UNDERFLOW,
    DIVISION_BY_ZERO,
    INVALID_JUMP_TARGET
}
