package dev.nuclr.spherify.image;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

/**
 * Shows an image in the platform's default viewer: the raster is written to a
 * temporary PNG that is opened with {@link Desktop#open}. Each call opens its
 * own window.
 *
 * <p>The file is written and handed over before {@link #show} returns, so the
 * JVM may exit right after. Only the external viewer keeps running on its own.
 * Temporary files are left to the system's temp-directory cleanup because the
 * viewer reads them after this process is gone.
 */
@Slf4j
public final class DesktopImageViewer implements ImageViewer {

    /** Launches the external viewer for a file. */
    interface Opener {

        boolean isAvailable();

        void open(File file) throws IOException;
    }

    static final Opener DESKTOP = new Opener() {
        @Override
        public boolean isAvailable() {
            return !GraphicsEnvironment.isHeadless()
                    && Desktop.isDesktopSupported()
                    && Desktop.getDesktop().isSupported(Desktop.Action.OPEN);
        }

        @Override
        public void open(File file) throws IOException {
            Desktop.getDesktop().open(file);
        }
    };

    private final ImageGateway gateway;
    private final Opener opener;

    public DesktopImageViewer(ImageGateway gateway) {
        this(gateway, DESKTOP);
    }

    DesktopImageViewer(ImageGateway gateway, Opener opener) {
        this.gateway = gateway;
        this.opener = opener;
    }

    @Override
    public void show(RgbaImage image, String title) {
        if (!opener.isAvailable()) {
            log.warn("No desktop viewer available; cannot display {}", title);
            return;
        }
        try {
            Path temp = Files.createTempFile(sanitize(title) + "-", ".png");
            gateway.save(image, temp);
            opener.open(temp.toFile());
            log.debug("Opened {} as {}", title, temp);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not display {}: {}", title, e.getMessage());
        }
    }

    static String sanitize(String title) {
        String cleaned = title.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.length() < 3 ? "img" + cleaned : cleaned;
    }
}
