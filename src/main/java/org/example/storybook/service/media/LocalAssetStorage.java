package org.example.storybook.service.media;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filesystem-backed asset storage. Public URLs point at the CDN when one is configured,
 * otherwise at the application's own {@code /assets/**} handler.
 */
@Service
public class LocalAssetStorage implements AssetStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalAssetStorage.class);

    @Value("${assets.storage-dir:./data/assets}")
    private String storageDir;

    @Value("${assets.cdn-base-url:}")
    private String cdnBaseUrl;

    @Value("${assets.public-path:/assets}")
    private String publicPath;

    private Path root;

    @PostConstruct
    public void init() throws IOException {
        root = Paths.get(storageDir).toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            Files.createDirectories(root);
            log.info("Created asset storage directory: {}", root);
        }
        log.info("Asset storage initialized at {} (cdn: {})", root, isCdnEnabled() ? cdnBaseUrl : "disabled");
    }

    @Override
    public String uploadFile(String key, byte[] data, String contentType) {
        if (data == null || data.length == 0) {
            throw new AssetStorageException("Refusing to store empty object: " + key);
        }
        String normalizedKey = normalizeKey(key);
        Path target = resolve(normalizedKey);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new AssetStorageException("Failed to store asset " + normalizedKey, e);
        }
        log.info("Stored asset {} ({} bytes, {})", normalizedKey, data.length, contentType);
        return normalizedKey;
    }

    @Override
    public String getPublicUrl(String key) {
        String normalizedKey = normalizeKey(key);
        String base = isCdnEnabled() ? cdnBaseUrl.trim() : (publicPath == null ? "" : publicPath.trim());
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + normalizedKey;
    }

    @Override
    public List<String> listFiles(String prefix) {
        String normalizedPrefix = prefix == null ? "" : normalizeKey(prefix);
        if (!Files.exists(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> root.relativize(path).toString().replace('\\', '/'))
                    .filter(key -> !key.contains("/.upload-") && !key.startsWith(".upload-"))
                    .filter(key -> key.startsWith(normalizedPrefix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new AssetStorageException("Failed to list assets under " + normalizedPrefix, e);
        }
    }

    @Override
    public byte[] downloadFile(String key) {
        String normalizedKey = normalizeKey(key);
        try {
            return Files.readAllBytes(resolve(normalizedKey));
        } catch (NoSuchFileException e) {
            throw new AssetStorageException("Asset not found: " + normalizedKey, e);
        } catch (IOException e) {
            throw new AssetStorageException("Failed to read asset " + normalizedKey, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private boolean isCdnEnabled() {
        return cdnBaseUrl != null && !cdnBaseUrl.isBlank();
    }

    private String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new AssetStorageException("Asset key is required");
        }
        String normalized = key.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new AssetStorageException("Asset key escapes storage root: " + key);
        }
        return resolved;
    }
}
