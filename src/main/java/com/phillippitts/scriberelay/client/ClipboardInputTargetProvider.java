package com.phillippitts.scriberelay.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Desktop input target: committed text is appended to the system clipboard.
 *
 * <p>Headless JVMs have no clipboard, so no target is ever focused there and dictation audio is
 * discarded until a real target is supplied.
 */
@Component
class ClipboardInputTargetProvider implements InputTargetProvider {

    private static final Logger LOG = LogManager.getLogger(ClipboardInputTargetProvider.class);

    interface ClipboardFacade {
        Clipboard getSystemClipboard();
    }

    static final class AwtClipboardFacade implements ClipboardFacade {
        @Override
        public Clipboard getSystemClipboard() {
            return Toolkit.getDefaultToolkit().getSystemClipboard();
        }
    }

    private final ClipboardFacade clipboard;
    private final BooleanSupplier headless;

    @org.springframework.beans.factory.annotation.Autowired
    ClipboardInputTargetProvider() {
        this(new AwtClipboardFacade(), GraphicsEnvironment::isHeadless);
    }

    // package-private for tests
    ClipboardInputTargetProvider(ClipboardFacade clipboard, BooleanSupplier headless) {
        this.clipboard = clipboard;
        this.headless = headless;
    }

    @Override
    public Optional<InputTarget> focusedTarget() {
        if (headless.getAsBoolean()) {
            return Optional.empty();
        }
        return Optional.of(this::append);
    }

    // Package-private for tests
    boolean append(String text) {
        try {
            Clipboard cb = clipboard.getSystemClipboard();
            String prior = "";
            try {
                if (cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                    prior = String.valueOf(cb.getData(DataFlavor.stringFlavor));
                }
            } catch (UnsupportedFlavorException | IOException e) {
                LOG.debug("Could not read prior clipboard content: {}", e.toString());
            }
            cb.setContents(new StringSelection(prior + text), null);
            return true;
        } catch (IllegalStateException e) {
            // Clipboard busy in another application
            LOG.warn("Clipboard insert failed: {}", e.toString());
            return false;
        }
    }
}
