package com.grademax.pipeline.storage;

import com.grademax.pipeline.config.PipelineProperties;
import com.grademax.pipeline.exception.ArtifactStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Component
public class ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path root;

    public ArtifactStore(PipelineProperties properties) {
        this.root = Paths.get(properties.storage().root()).toAbsolutePath().normalize();
    }

    public String put(String namespace, byte[] bytes) {
        String hash = sha256(bytes);
        Path target = root.resolve(namespace).resolve(hash.substring(0, 2)).resolve(hash + ".pdf");
        try {
            if (!Files.exists(target)) {
                Files.createDirectories(target.getParent());
                Path tmp = Files.createTempFile(target.getParent(), hash, ".tmp");
                Files.write(tmp, bytes);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.debug("Stored {} bytes at {}", bytes.length, target);
            }
            return target.toUri().toString();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to store artifact in " + namespace, e);
        }
    }

    public byte[] get(String uri) {
        Path path = resolve(uri);
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact " + uri, e);
        }
    }

    public boolean exists(String uri) {
        return uri != null && Files.exists(resolve(uri));
    }

    public static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Path resolve(String uri) {
        Path path = Paths.get(URI.create(uri)).toAbsolutePath().normalize();
        if (!path.startsWith(root)) throw new ArtifactStoreException("Artifact outside store: " + uri, null);
        return path;
    }
}
