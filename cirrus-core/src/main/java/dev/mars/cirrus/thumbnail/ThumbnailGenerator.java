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


import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Produces JPEG thumbnails that fit inside a square bounding box.
 *
 * <p>The aspect ratio is preserved and images already inside the box are not enlarged.
 * Alpha is dropped since JPEG has no alpha channel.</p>
 */
public class ThumbnailGenerator {

    private static final String FORMAT = "jpg";

    private final int maxDimension;

    public ThumbnailGenerator(int maxDimension) {
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("Thumbnail dimension must be positive: " + maxDimension);
        }
        this.maxDimension = maxDimension;
    }

    /**
     * @return encoded JPEG bytes
     * @throws IOException if the file cannot be read or is not a decodable image
     */
    public byte[] generate(Path source) throws IOException {
        BufferedImage image;
        try (InputStream in = Files.newInputStream(source)) {
            image = ImageIO.read(in);
        }
        if (image == null) {
            throw new IOException("Unsupported image format: " + source.getFileName());
        }

        int[] size = fit(image.getWidth(), image.getHeight(), maxDimension);
        BufferedImage scaled = new BufferedImage(size[0], size[1], BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, size[0], size[1], null);
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(scaled, FORMAT, out)) {
            throw new IOException("No JPEG writer available");
        }
        return out.toByteArray();
    }

    /**
     * Target {width, height} for an image fitted into a {@code max x max} box.
     */
    static int[] fit(int width, int height, int max) {
        if (width <= max && height <= max) {
            return new int[]{width, height};
        }
        double scale = Math.min((double) max / width, (double) max / height);
        int w = Math.max(1, (int) Math.round(width * scale));
        int h = Math.max(1, (int) Math.round(height * scale));
        return new int[]{w, h};
    }

    public int getMaxDimension() {
        return maxDimension;
    }
}
