package dev.devanks.hlsarchive.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.hlsarchive.core.exception.HlsArchiveException;
import dev.devanks.hlsarchive.core.exception.ManifestNotFoundException;
import dev.devanks.hlsarchive.core.exception.ObjectNotFoundException;
import dev.devanks.hlsarchive.core.exception.StorageWriteException;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import dev.devanks.hlsarchive.core.model.LinkManifest;
import dev.devanks.hlsarchive.core.storage.ObjectStoreResolver;
import dev.devanks.hlsarchive.core.storage.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Reads and writes per-day link manifests under a destination root.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkManifestStore {

    private static final String CONTENT_TYPE = "application/json";
    private static final TypeReference<List<String>> LINK_LIST = new TypeReference<>() {
    };

    private final ObjectStoreResolver objectStoreResolver;
    private final ObjectMapper objectMapper;

    public boolean exists(String root, HlsCollection collection, LocalDate date) {
        var path = StorageLayout.manifestPath(root, collection, date);
        boolean exists = objectStoreResolver.forUri(path).exists(path);
        log.debug("Manifest {} exists: {}", path, exists);
        return exists;
    }

    /**
     * Overwrites the manifest for the day in a single put.
     *
     * @return the manifest location
     * @throws StorageWriteException when serialization or the put fails
     */
    public String write(String root, HlsCollection collection, LocalDate date, List<String> links) {
        var path = StorageLayout.manifestPath(root, collection, date);
        var manifest = LinkManifest.builder()
                .collection(collection.getCollectionId())
                .date(date)
                .links(links)
                .build();
        try {
            byte[] body = objectMapper.writeValueAsBytes(manifest);
            objectStoreResolver.forUri(path).write(path, body, CONTENT_TYPE);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to write manifest with {} links to {}: {}", links.size(), path, e.getMessage(), e);
            throw new StorageWriteException(path, e);
        }
        log.info("Wrote manifest with {} links to {}", links.size(), path);
        return path;
    }

    /**
     * Reads a manifest. Bare JSON arrays of links, the older manifest format, are accepted too.
     *
     * @throws ManifestNotFoundException when no manifest exists for the day
     */
    public LinkManifest read(String root, HlsCollection collection, LocalDate date) {
        var path = StorageLayout.manifestPath(root, collection, date);
        byte[] body;
        try {
            body = objectStoreResolver.forUri(path).read(path);
        } catch (ObjectNotFoundException e) {
            throw new ManifestNotFoundException(collection, date, path);
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.isArray()) {
                List<String> links = objectMapper.convertValue(node, LINK_LIST);
                return LinkManifest.builder()
                        .collection(collection.getCollectionId())
                        .date(date)
                        .links(links)
                        .build();
            }
            if (node == null || !node.path("links").isArray()) {
                throw new HlsArchiveException("Manifest at " + path + " has no links field");
            }
            return objectMapper.treeToValue(node, LinkManifest.class);
        } catch (IOException e) {
            throw new HlsArchiveException("Manifest at " + path + " is not valid JSON", e);
        }
    }
}
