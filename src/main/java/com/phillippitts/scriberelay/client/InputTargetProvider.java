package com.phillippitts.scriberelay.client;

import java.util.Optional;

/**
 * Looks up the input target that currently has focus. Consulted on every send tick.
 */
@FunctionalInterface
public interface InputTargetProvider {

    Optional<InputTarget> focusedTarget();
}
