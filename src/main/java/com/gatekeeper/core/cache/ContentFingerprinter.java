package com.gatekeeper.core.cache;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives content fingerprints for cache keys: SHA-256 of the file content plus
 * its modification time. Files larger than {@code maxHashBytes} are fingerprinted
 * by size and modification time only.
 */
public class ContentFingerprinter {

    private static final int BUFFER_SIZE = 16 * 1024;

    private final long maxHashBytes;

    public ContentFingerprinter(long maxHashBytes) {
        this.maxHashBytes = maxHashBytes;
    }

    /**
     * @throws UncheckedIOException if the file cannot be read
     */
    public String fingerprint(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            long mtime = attrs.lastModifiedTime().toMillis();
            if (attrs.size() > maxHashBytes) {
                return "size:" + attrs.size() + "@" + mtime;
            }
            MessageDigest digest = sha256();
            try (InputStream in = Files.newInputStream(file)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            }
            return "sha256:" + HexFormat.of().formatHex(digest.digest()) + "@" + mtime;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot fingerprint " + file, e);
        }
    }

    /**
     * Fingerprint of a set of files: a digest over every path and its own fingerprint.
     * The caller supplies the files in a stable order.
     */
    public String fingerprintAll(List<Path> files) {
        MessageDigest digest = sha256();
        for (Path file : files) {
            digest.update(file.toString().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(fingerprint(file).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return "set:" + files.size() + ":" + HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
