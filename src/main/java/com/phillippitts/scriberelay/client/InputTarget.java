package com.phillippitts.scriberelay.client;

/**
 * Destination for committed dictation text, such as a focused text field.
 */
@FunctionalInterface
public interface InputTarget {

    /** @return true if the text was delivered */
    boolean insert(String text);
}
