package com.qgistoolkit.project;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * On-disk flavours of a project document.
 */
public enum ProjectFormat {
    /** Plain XML. */
    QGS(".qgs"),
    /** Single-member compressed container, either ZIP or GZIP. */
    QGZ(".qgz");

    private final String extension;

    ProjectFormat(String extension) {
        this.extension = extension;
    }

    /**
     * Pick the format from the file extension, case-insensitively.
     *
     * @param path project path
     * @return format
     * @throws UnsupportedProjectFormatException for any other extension
     */
    public static ProjectFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        for (ProjectFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new UnsupportedProjectFormatException(path);
    }

    /**
     * Turn raw file bytes into document XML bytes.
     *
     * @param raw file content
     * @param source path, for error messages
     * @return XML bytes
     * @throws IOException when the container cannot be decompressed
     */
    public byte[] decode(byte[] raw, Path source) throws IOException {
        if (this == QGS) {
            return raw;
        }
        if (isZip(raw)) {
            return readZipMember(raw, source);
        }
        if (isGzip(raw)) {
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
                return in.readAllBytes();
            }
        }
        throw new ProjectParseException("Not a ZIP or GZIP container: " + source, source, null);
    }

    /**
     * Wrap document XML bytes in this format's container. {@code .qgz} output is a ZIP archive with
     * a single {@code .qgs} member named after the target.
     *
     * @param xml serialized document
     * @param target output path, used to name the archive member
     * @return file content
     * @throws IOException when the archive cannot be built
     */
    public byte[] encode(byte[] xml, Path target) throws IOException {
        if (this == QGS) {
            return xml;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry(memberName(target)));
            zip.write(xml);
            zip.closeEntry();
        }
        return out.toByteArray();
    }

    private static String memberName(Path target) {
        Path fileName = target.getFileName();
        String name = fileName != null ? fileName.toString() : "project" + QGZ.extension;
        return name.substring(0, name.length() - QGZ.extension.length()) + QGS.extension;
    }

    private static byte[] readZipMember(byte[] raw, Path source) throws IOException {
        byte[] firstMember = null;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(raw))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                byte[] content = zip.readAllBytes();
                if (entry.getName().toLowerCase(Locale.ROOT).endsWith(QGS.extension)) {
                    return content;
                }
                if (firstMember == null) {
                    firstMember = content;
                }
            }
        }
        if (firstMember == null) {
            throw new ProjectParseException("Compressed project contains no document: " + source, source, null);
        }
        return firstMember;
    }

    private static boolean isZip(byte[] raw) {
        return raw.length >= 4 && raw[0] == 'P' && raw[1] == 'K' && raw[2] == 3 && raw[3] == 4;
    }

    private static boolean isGzip(byte[] raw) {
        return raw.length >= 2 && (raw[0] & 0xff) == 0x1f && (raw[1] & 0xff) == 0x8b;
    }
}
