package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.exception.UnsupportedFormatException;
import com.timxs.imageconverter.model.ImageFormat;
import com.timxs.imageconverter.model.ResolvedFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormatResolverImplTest {

    private final FormatResolverImpl resolver = new FormatResolverImpl();

    @ParameterizedTest
    @ValueSource(strings = {"jpg", "JPG", "Jpg"})
    void jpgAliasUsesJpegCodecWithJpgExtension(String name) {
        ResolvedFormat format = resolver.resolve(name);

        assertEquals("JPEG", format.codec());
        assertEquals("jpg", format.extension());
        assertTrue(format.requiresOpaque());
    }

    @ParameterizedTest
    @ValueSource(strings = {"jpeg", "JPEG"})
    void jpegKeepsJpegExtension(String name) {
        ResolvedFormat format = resolver.resolve(name);

        assertEquals("JPEG", format.codec());
        assertEquals("jpeg", format.extension());
        assertTrue(format.requiresOpaque());
    }

    @Test
    void resolveIsCaseInsensitive() {
        assertEquals(resolver.resolve("PNG"), resolver.resolve("png"));
        assertEquals(new ResolvedFormat("PNG", "png", false), resolver.resolve("png"));
    }

    @Test
    void otherFormatsDoNotRequireOpacity() {
        for (String name : List.of("PNG", "WEBP", "TIFF", "BMP")) {
            ResolvedFormat format = resolver.resolve(name);
            assertEquals(name, format.codec());
            assertEquals(name.toLowerCase(), format.extension());
            assertFalse(format.requiresOpaque(), name);
        }
    }

    @Test
    void everyFormatLooksUpByItsOwnName() {
        for (ImageFormat format : ImageFormat.values()) {
            assertEquals(format, ImageFormat.fromName(format.name().toLowerCase()));
            assertEquals(format.toResolved(), resolver.resolve(format.name()));
        }
        assertEquals(new ResolvedFormat("TIFF", "tiff", false), ImageFormat.TIFF.toResolved());
    }

    @Test
    void unknownFormatIsRejected() {
        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class,
            () -> resolver.resolve("xyz"));
        assertEquals("xyz", e.getFormatName());
        assertThrows(UnsupportedFormatException.class, () -> resolver.resolve(""));
        assertThrows(UnsupportedFormatException.class, () -> resolver.resolve(null));
    }

    @Test
    void supportedNamesInDisplayOrder() {
        assertEquals(List.of("JPG", "JPEG", "PNG", "WEBP", "TIFF", "BMP"), resolver.supportedNames());
    }
}
