package dev.mars.cirrus.thumbnail;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ThumbnailGeneratorTest {

    @TempDir
    Path tempDir;

    private Path writeImage(String name, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.ORANGE);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        Path file = tempDir.resolve(name);
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    @Test
    void testFitKeepsAspectRatio() {
        assertArrayEquals(new int[]{300, 150}, ThumbnailGenerator.fit(1200, 600, 300));
        assertArrayEquals(new int[]{100, 300}, ThumbnailGenerator.fit(400, 1200, 300));
    }

    @Test
    void testFitNeverUpscales() {
        assertArrayEquals(new int[]{120, 80}, ThumbnailGenerator.fit(120, 80, 300));
    }

    @Test
    void testFitKeepsAtLeastOnePixel() {
        assertArrayEquals(new int[]{300, 1}, ThumbnailGenerator.fit(30_000, 10, 300));
    }

    @Test
    void testGeneratesScaledJpeg() throws IOException {
        Path png = writeImage("wide.png", 900, 300);

        byte[] jpeg = new ThumbnailGenerator(300).generate(png);

        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(jpeg));
        assertEquals(300, decoded.getWidth());
        assertEquals(100, decoded.getHeight());
    }

    @Test
    void testNonImageIsRejected() throws IOException {
        Path text = tempDir.resolve("notes.png");
        Files.writeString(text, "not really an image");

        IOException e = assertThrows(IOException.class, () -> new ThumbnailGenerator(300).generate(text));
        assertTrue(e.getMessage().contains("Unsupported image format"));
    }

    @Test
    void testDimensionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ThumbnailGenerator(0));
    }
}
