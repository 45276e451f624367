package dev.nuclr.spherify.image;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import dev.nuclr.spherify.TestImages;

class DesktopImageViewerTest {

    private final ImageGateway gateway = new ImageGateway();
    private final List<File> opened = new ArrayList<>();

    @AfterEach
    void cleanUp() throws IOException {
        for (File f : opened) {
            Files.deleteIfExists(f.toPath());
        }
    }

    private DesktopImageViewer.Opener recording(boolean available) {
        return new DesktopImageViewer.Opener() {
            @Override
            public boolean isAvailable() {
                return available;
            }

            @Override
            public void open(File file) {
                opened.add(file);
            }
        };
    }

    @Test
    void imageFileIsWrittenAndOpenedBeforeShowReturns() throws Exception {
        RgbaImage image = TestImages.pattern(5, 3, 4);

        new DesktopImageViewer(gateway, recording(true)).show(image, "a.png");

        assertEquals(1, opened.size(), "The viewer must be launched on the calling thread");
        File file = opened.get(0);
        assertTrue(file.isFile(), "The file must outlive show() for the external viewer to read it");
        assertTrue(file.getName().startsWith("a.png-"));
        assertArrayEquals(image.pixels(), gateway.load(file.toPath()).pixels());
    }

    @Test
    void eachCallOpensItsOwnFile() {
        DesktopImageViewer viewer = new DesktopImageViewer(gateway, recording(true));

        viewer.show(TestImages.pattern(2, 2, 0), "same.png");
        viewer.show(TestImages.pattern(2, 2, 1), "same.png");

        assertEquals(2, opened.size());
        assertNotEquals(opened.get(0), opened.get(1));
    }

    @Test
    void unavailableDesktopOpensNothing() {
        new DesktopImageViewer(gateway, recording(false)).show(TestImages.pattern(2, 2, 0), "a.png");

        assertTrue(opened.isEmpty());
    }

    @Test
    void openerFailureIsNotPropagated() {
        DesktopImageViewer.Opener broken = new DesktopImageViewer.Opener() {
            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public void open(File file) throws IOException {
                opened.add(file);
                throw new IOException("no application registered for png");
            }
        };

        assertDoesNotThrow(() -> new DesktopImageViewer(gateway, broken).show(TestImages.pattern(2, 2, 0), "a.png"));
    }

    @Test
    void titlesAreMadeSafeForFileNames() {
        assertEquals("my_photo_1_.png", DesktopImageViewer.sanitize("my photo(1).png"));
        assertEquals("imga", DesktopImageViewer.sanitize("a"));
    }
}
