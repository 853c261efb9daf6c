package com.stitchwork.core.workspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Shared, read-only content every workspace of a run is forked from.
 * <p>
 * Content is copied on construction and never handed out by reference, so the layer is
 * immutable and safe to read from any thread without locking. The {@link #ref()} is a
 * SHA-256 digest of all paths and contents.
 */
public final class BaseLayer {

    private final TreeMap<String, byte[]> files;
    private final String ref;

    private BaseLayer(TreeMap<String, byte[]> files) {
        this.files = files;
        this.ref = digest(files);
    }

    public static BaseLayer of(Map<String, byte[]> files) {
        var copy = new TreeMap<String, byte[]>();
        files.forEach((path, content) -> copy.put(normalize(path), content.clone()));
        return new BaseLayer(copy);
    }

    public static BaseLayer ofStrings(Map<String, String> files) {
        var copy = new TreeMap<String, byte[]>();
        files.forEach((path, content) -> copy.put(normalize(path), content.getBytes(StandardCharsets.UTF_8)));
        return new BaseLayer(copy);
    }

    /**
     * Loads every regular file under {@code root}, keyed by its path relative to the root.
     */
    public static BaseLayer fromDirectory(Path root) {
        var copy = new TreeMap<String, byte[]>();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path file : walk.filter(Files::isRegularFile).toList()) {
                copy.put(normalize(root.relativize(file).toString()), Files.readAllBytes(file));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load base layer from " + root, e);
        }
        return new BaseLayer(copy);
    }

    public String ref() {
        return ref;
    }

    public Optional<byte[]> read(String path) {
        byte[] content = files.get(normalize(path));
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    public boolean contains(String path) {
        return files.containsKey(normalize(path));
    }

    public NavigableSet<String> paths() {
        return Collections.unmodifiableNavigableSet(files.navigableKeySet());
    }

    public int size() {
        return files.size();
    }

    static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p;
    }

    private static String digest(TreeMap<String, byte[]> files) {
        MessageDigest md = sha256();
        files.forEach((path, content) -> {
            md.update(path.getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            md.update(content);
            md.update((byte) 0);
        });
        return HexFormat.of().formatHex(md.digest());
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
