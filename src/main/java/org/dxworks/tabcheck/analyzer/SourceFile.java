package org.dxworks.tabcheck.analyzer;

import java.nio.charset.StandardCharsets;

/**
 * Source text together with its UTF-8 encoding. Tree-sitter reports byte offsets, so the
 * bytes are kept around to slice node text without re-encoding the file each time.
 */
public class SourceFile {
    private final String path;
    private final String text;
    private final byte[] bytes;

    public SourceFile(String path, String text) {
        this.path = path;
        // Remove BOM if present (common in C# files)
        this.text = text.startsWith("\uFEFF") ? text.substring(1) : text;
        this.bytes = this.text.getBytes(StandardCharsets.UTF_8);
    }

    public String getPath() {
        return path;
    }

    public String getText() {
        return text;
    }

    public String slice(int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > bytes.length) endByte = bytes.length;
        if (startByte >= endByte) return "";
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
