package com.timxs.imageconverter.service.impl;

import com.luciad.imageio.webp.WebPWriteParam;
import com.timxs.imageconverter.model.DecodedImage;
import com.timxs.imageconverter.model.WriteOptions;
import com.timxs.imageconverter.service.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Node;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;

/**
 * 基于 ImageIO 的编解码实现
 * WebP 读写依赖 webp-imageio 插件，其余格式使用 JDK 自带的 Reader/Writer
 * <p>
 * EXIF 数据以不带 "Exif\0\0" 头的 TIFF 结构保存，写出时：
 * JPEG 写入 APP1 段，PNG 写入 eXIf 块，其他格式忽略
 */
@Slf4j
@Service
public class ImageIoCodec implements ImageCodec {

    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final String PNG_METADATA_FORMAT = "javax_imageio_png_1.0";

    /**
     * APP1 段标记值
     */
    private static final String APP1_MARKER_TAG = "225";

    private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes(StandardCharsets.ISO_8859_1);

    private static final String PNG_EXIF_CHUNK = "eXIf";

    @Override
    public DecodedImage open(Path path) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                throw new IOException("无法打开文件: " + path);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new IOException("No image reader found for " + path.getFileName());
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                BufferedImage image = reader.read(0);
                String formatName = reader.getFormatName().toLowerCase(Locale.ROOT);
                byte[] exif = readExif(reader, path);
                log.debug("解码完成: {}, 尺寸: {}x{}, 格式: {}, 类型: {}, EXIF: {} bytes",
                    path.getFileName(), image.getWidth(), image.getHeight(), formatName,
                    image.getType(), exif == null ? 0 : exif.length);
                return new DecodedImage(image, formatName, exif);
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public void save(DecodedImage image, Path path, String codec, WriteOptions options) throws IOException {
        BufferedImage pixels = image.pixels();
        String formatName = codec.toLowerCase(Locale.ROOT);
        ImageTypeSpecifier type = ImageTypeSpecifier.createFromRenderedImage(pixels);

        // 只选择能编码当前像素类型的 Writer
        Iterator<ImageWriter> writers = ImageIO.getImageWriters(type, formatName);
        if (!writers.hasNext()) {
            throw new IOException("No " + codec + " writer can encode image type " + pixels.getType());
        }

        ImageWriter writer = writers.next();
        try (OutputStream out = Files.newOutputStream(path);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            if (ios == null) {
                throw new IOException("无法创建输出流: " + path);
            }
            writer.setOutput(ios);

            ImageWriteParam param = writer.getDefaultWriteParam();
            configureParam(param, codec, options);

            IIOMetadata metadata = null;
            if (options.hasExif()) {
                metadata = buildExifMetadata(writer, type, param, codec, options.exif());
            }

            writer.write(null, new IIOImage(pixels, null, metadata), param);
            ios.flush();
        } catch (IOException | RuntimeException e) {
            // 不保留写了一半的文件
            try {
                Files.deleteIfExists(path);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        } finally {
            writer.dispose();
        }
        log.debug("写出完成: {} ({}), 大小: {} KB", path.getFileName(), codec,
            String.format("%.2f", Files.size(path) / 1024.0));
    }

    @Override
    public boolean canEncode(BufferedImage image, String codec) {
        ImageTypeSpecifier type = ImageTypeSpecifier.createFromRenderedImage(image);
        return ImageIO.getImageWriters(type, codec.toLowerCase(Locale.ROOT)).hasNext();
    }

    /**
     * 配置编码参数
     * JPEG：质量 + 优化 Huffman 表 + 渐进式；WebP：质量 + 压缩等级 + 有损/无损；其他格式使用默认值
     */
    private void configureParam(ImageWriteParam param, String codec, WriteOptions options) {
        switch (codec.toUpperCase(Locale.ROOT)) {
            case "JPEG" -> {
                if (options.hasQuality() && param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    param.setCompressionQuality(toCompressionQuality(options.quality()));
                }
                if (options.progressive() && param.canWriteProgressive()) {
                    param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
                }
                if (options.optimize() && param instanceof JPEGImageWriteParam jpegParam) {
                    jpegParam.setOptimizeHuffmanTables(true);
                }
            }
            case "WEBP" -> {
                if (param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    // WebP 需要先设置压缩类型
                    String compressionType = findCompressionType(param, options.lossless() ? "Lossless" : "Lossy");
                    if (compressionType != null) {
                        param.setCompressionType(compressionType);
                    }
                    if (options.hasQuality()) {
                        param.setCompressionQuality(toCompressionQuality(options.quality()));
                    }
                }
                if (options.compressionEffort() >= 0 && param instanceof WebPWriteParam webpParam) {
                    // method 范围 0-6，值越大压缩越慢但文件越小
                    int method = Math.max(0, Math.min(WriteOptions.MAX_WEBP_EFFORT, options.compressionEffort()));
                    webpParam.setMethod(method);
                    log.debug("WebP 压缩等级设置为: {}", method);
                }
            }
            default -> {
                // 其他格式不需要额外参数
            }
        }
    }

    /**
     * 质量参数 0-100 转换为 0.0-1.0
     */
    private float toCompressionQuality(int quality) {
        return Math.max(0f, Math.min(1f, quality / 100.0f));
    }

    private String findCompressionType(ImageWriteParam param, String wanted) {
        String[] types = param.getCompressionTypes();
        if (types == null || types.length == 0) {
            return null;
        }
        return Arrays.stream(types)
            .filter(t -> t.equalsIgnoreCase(wanted))
            .findFirst()
            .orElse(types[0]);
    }

    // ========== EXIF 读写 ==========

    /**
     * 读取源文件的 EXIF 数据
     * 元数据损坏不影响像素解码，只记录日志
     */
    private byte[] readExif(ImageReader reader, Path path) {
        IIOMetadata metadata;
        try {
            metadata = reader.getImageMetadata(0);
        } catch (IOException | RuntimeException e) {
            log.debug("读取元数据失败，忽略 EXIF: {} - {}", path.getFileName(), e.getMessage());
            return null;
        }
        if (metadata == null || metadata.getNativeMetadataFormatName() == null) {
            return null;
        }

        String nativeFormat = metadata.getNativeMetadataFormatName();
        Node root = metadata.getAsTree(nativeFormat);
        if (JPEG_METADATA_FORMAT.equals(nativeFormat)) {
            return readJpegExif(root);
        }
        if (PNG_METADATA_FORMAT.equals(nativeFormat)) {
            return readPngExif(root);
        }
        return null;
    }

    private byte[] readJpegExif(Node root) {
        IIOMetadataNode markers = findChild(root, "markerSequence");
        if (markers == null) {
            return null;
        }
        for (Node node = markers.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (!"unknown".equals(node.getNodeName())) {
                continue;
            }
            IIOMetadataNode marker = (IIOMetadataNode) node;
            if (APP1_MARKER_TAG.equals(marker.getAttribute("MarkerTag"))
                && marker.getUserObject() instanceof byte[] data
                && startsWith(data, EXIF_HEADER)) {
                return Arrays.copyOfRange(data, EXIF_HEADER.length, data.length);
            }
        }
        return null;
    }

    private byte[] readPngExif(Node root) {
        IIOMetadataNode chunks = findChild(root, "UnknownChunks");
        if (chunks == null) {
            return null;
        }
        for (Node node = chunks.getFirstChild(); node != null; node = node.getNextSibling()) {
            IIOMetadataNode chunk = (IIOMetadataNode) node;
            if (PNG_EXIF_CHUNK.equals(chunk.getAttribute("type"))
                && chunk.getUserObject() instanceof byte[] data) {
                // 部分软件会在 eXIf 块里也写上 Exif 头
                return startsWith(data, EXIF_HEADER)
                    ? Arrays.copyOfRange(data, EXIF_HEADER.length, data.length)
                    : data.clone();
            }
        }
        return null;
    }

    /**
     * 构造携带 EXIF 的写出元数据，不支持的编码器返回 null
     */
    private IIOMetadata buildExifMetadata(ImageWriter writer, ImageTypeSpecifier type,
                                          ImageWriteParam param, String codec, byte[] exif)
        throws IOException {
        IIOMetadata metadata = writer.getDefaultImageMetadata(type, param);
        if (metadata == null || metadata.isReadOnly()) {
            log.debug("{} Writer 不支持写入元数据，忽略 EXIF", codec);
            return null;
        }

        String nativeFormat = metadata.getNativeMetadataFormatName();
        if (JPEG_METADATA_FORMAT.equals(nativeFormat)) {
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(nativeFormat);
            IIOMetadataNode markers = findChild(root, "markerSequence");
            if (markers == null) {
                markers = new IIOMetadataNode("markerSequence");
                root.appendChild(markers);
            }
            IIOMetadataNode app1 = new IIOMetadataNode("unknown");
            app1.setAttribute("MarkerTag", APP1_MARKER_TAG);
            app1.setUserObject(concat(EXIF_HEADER, exif));
            markers.insertBefore(app1, markers.getFirstChild());
            metadata.setFromTree(nativeFormat, root);
            return metadata;
        }
        if (PNG_METADATA_FORMAT.equals(nativeFormat)) {
            IIOMetadataNode root = new IIOMetadataNode(nativeFormat);
            IIOMetadataNode chunks = new IIOMetadataNode("UnknownChunks");
            IIOMetadataNode chunk = new IIOMetadataNode("UnknownChunk");
            chunk.setAttribute("type", PNG_EXIF_CHUNK);
            chunk.setUserObject(exif.clone());
            chunks.appendChild(chunk);
            root.appendChild(chunks);
            metadata.mergeTree(nativeFormat, root);
            return metadata;
        }

        log.debug("{} 格式不支持写入 EXIF，忽略", codec);
        return null;
    }

    private IIOMetadataNode findChild(Node parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (name.equals(node.getNodeName())) {
                return (IIOMetadataNode) node;
            }
        }
        return null;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }
}
