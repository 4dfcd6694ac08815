package com.phillippitts.scriberelay.client;

import org.junit.jupiter.api.Test;

import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;

import static org.assertj.core.api.Assertions.assertThat;

class ClipboardInputTargetProviderTest {

    private final Clipboard clipboard = new Clipboard("test");

    @Test
    void headlessHasNoFocusedTarget() {
        ClipboardInputTargetProvider provider = new ClipboardInputTargetProvider(() -> clipboard, () -> true);
        assertThat(provider.focusedTarget()).isEmpty();
    }

    @Test
    void appendsToExistingClipboardText() throws Exception {
        clipboard.setContents(new StringSelection("first "), null);
        ClipboardInputTargetProvider provider = new ClipboardInputTargetProvider(() -> clipboard, () -> false);

        assertThat(provider.focusedTarget()).hasValueSatisfying(t -> assertThat(t.insert("second ")).isTrue());

        assertThat(clipboard.getData(DataFlavor.stringFlavor)).isEqualTo("first second ");
    }

    @Test
    void emptyClipboardStartsFresh() throws Exception {
        ClipboardInputTargetProvider provider = new ClipboardInputTargetProvider(() -> clipboard, () -> false);

        assertThat(provider.append("hello ")).isTrue();

        assertThat(clipboard.getData(DataFlavor.stringFlavor)).isEqualTo("hello ");
    }

    @Test
    void busyClipboardReportsFailure() {
        ClipboardInputTargetProvider provider = new ClipboardInputTargetProvider(() -> {
            throw new IllegalStateException("cannot open system clipboard");
        }, () -> false);

        assertThat(provider.append("text")).isFalse();
    }
}
