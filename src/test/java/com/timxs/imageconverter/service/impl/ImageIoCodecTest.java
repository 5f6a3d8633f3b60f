package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.TestImages;
import com.timxs.imageconverter.model.DecodedImage;
import com.timxs.imageconverter.model.WriteOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageIoCodecTest {

    /**
     * 最小的 TIFF 头 + 空 IFD
     */
    private static final byte[] EXIF = {
        'M', 'M', 0, 42, 0, 0, 0, 8,
        0, 0,
        0, 0, 0, 0
    };

    @TempDir
    Path tempDir;

    private final ImageIoCodec codec = new ImageIoCodec();

    @Test
    void openReportsFormatAndPixels() throws IOException {
        Path png = TestImages.writePng(tempDir, "logo.png", TestImages.transparent(8, 6));

        DecodedImage image = codec.open(png);

        assertEquals("png", image.sourceFormat());
        assertEquals(8, image.pixels().getWidth());
        assertEquals(6, image.pixels().getHeight());
        assertTrue(image.hasTransparency());
        assertFalse(image.hasExif());
    }

    @Test
    void jpegExifSurvivesSaveAndOpen() throws IOException {
        Path output = tempDir.resolve("exif.jpg");
        DecodedImage image = new DecodedImage(TestImages.opaque(16, 16), "png", null);

        codec.save(image, output, "JPEG", WriteOptions.jpeg(90).withExif(EXIF));
        DecodedImage reopened = codec.open(output);

        assertEquals("jpeg", reopened.sourceFormat());
        assertTrue(reopened.hasExif());
        assertArrayEquals(EXIF, reopened.exif());
    }

    @Test
    void jpegWithoutExifHasNone() throws IOException {
        Path output = tempDir.resolve("plain.jpg");

        codec.save(new DecodedImage(TestImages.opaque(16, 16), "png", null), output, "JPEG",
            WriteOptions.jpeg(90));

        assertNull(codec.open(output).exif());
    }

    @Test
    void lowerJpegQualityGivesSmallerFile() throws IOException {
        BufferedImage noisy = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
        Random random = new Random(42);
        for (int y = 0; y < 64; y++) {
            for (int x = 0; x < 64; x++) {
                noisy.setRGB(x, y, random.nextInt(0xFFFFFF));
            }
        }
        DecodedImage image = new DecodedImage(noisy, "png", null);
        Path low = tempDir.resolve("low.jpg");
        Path high = tempDir.resolve("high.jpg");

        codec.save(image, low, "JPEG", WriteOptions.jpeg(50));
        codec.save(image, high, "JPEG", WriteOptions.jpeg(100));

        assertTrue(Files.size(low) < Files.size(high));
    }

    @Test
    void jpegOutputIsProgressive() throws IOException {
        Path output = tempDir.resolve("progressive.jpg");

        codec.save(new DecodedImage(TestImages.opaque(32, 32), "png", null), output, "JPEG",
            WriteOptions.jpeg(90));

        byte[] data = Files.readAllBytes(output);
        assertTrue(containsMarker(data, 0xC2), "SOF2 expected");
        assertFalse(containsMarker(data, 0xC0), "baseline SOF0 not expected");
    }

    @Test
    void webpKeepsAlpha() throws IOException {
        Path output = tempDir.resolve("clear.webp");

        codec.save(new DecodedImage(TestImages.transparent(8, 8), "png", null), output, "WEBP",
            WriteOptions.webp(80));

        assertTrue(Files.size(output) > 0);
        DecodedImage reopened = codec.open(output);
        assertEquals(8, reopened.pixels().getWidth());
        assertTrue(reopened.hasTransparency());
    }

    @Test
    void webpFromOpaqueJpeg() throws IOException {
        DecodedImage photo = codec.open(TestImages.writeJpeg(tempDir, "photo.jpg"));
        Path output = tempDir.resolve("photo.webp");

        codec.save(photo, output, "WEBP", WriteOptions.webp(80));

        DecodedImage reopened = codec.open(output);
        assertEquals(16, reopened.pixels().getWidth());
        assertEquals(16, reopened.pixels().getHeight());
        assertFalse(reopened.hasTransparency());
    }

    @Test
    void exifIgnoredByCodecsWithoutMetadataSupport() throws IOException {
        Path output = tempDir.resolve("exif.bmp");

        codec.save(new DecodedImage(TestImages.opaque(8, 8), "png", null), output, "BMP",
            WriteOptions.defaults().withExif(EXIF));

        DecodedImage reopened = codec.open(output);
        assertEquals(8, reopened.pixels().getWidth());
        assertNull(reopened.exif());
    }

    @Test
    void pngKeepsAlpha() throws IOException {
        Path output = tempDir.resolve("alpha.png");

        codec.save(new DecodedImage(TestImages.transparent(4, 4), "png", null), output, "PNG",
            WriteOptions.defaults());

        BufferedImage written = ImageIO.read(output.toFile());
        assertNotNull(written);
        assertTrue(written.getColorModel().hasAlpha());
        assertEquals(0, written.getRGB(1, 1) >>> 24);
    }

    @Test
    void jpegWriterRejectsAlpha() {
        assertFalse(codec.canEncode(TestImages.transparent(2, 2), "JPEG"));
        assertTrue(codec.canEncode(TestImages.opaque(2, 2), "JPEG"));
        assertTrue(codec.canEncode(TestImages.transparent(2, 2), "PNG"));
    }

    @Test
    void saveWithoutMatchingWriterFailsAndLeavesNoFile() {
        Path output = tempDir.resolve("alpha.jpg");
        DecodedImage image = new DecodedImage(TestImages.transparent(4, 4), "png", null);

        assertThrows(IOException.class, () -> codec.save(image, output, "JPEG", WriteOptions.jpeg(90)));
        assertFalse(Files.exists(output));
    }

    @Test
    void openRejectsUndecodableFile() throws IOException {
        Path garbage = TestImages.writeGarbage(tempDir, "broken.png");

        assertThrows(IOException.class, () -> codec.open(garbage));
    }

    /**
     * 查找 JPEG 标记（0xFF 后跟标记字节），压缩数据中的 0xFF 会被填充 0x00
     */
    private static boolean containsMarker(byte[] data, int marker) {
        for (int i = 0; i + 1 < data.length; i++) {
            if ((data[i] & 0xFF) == 0xFF && (data[i + 1] & 0xFF) == marker) {
                return true;
            }
        }
        return false;
    }
}
