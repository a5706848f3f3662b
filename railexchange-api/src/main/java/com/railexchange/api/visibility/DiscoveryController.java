package com.railexchange.api.visibility;

import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Public discovery lists.
 * GET /api/v1/discovery/{type}/map
 * GET /api/v1/discovery/{type}/directory
 */
@RestController
@RequestMapping("/api/v1/discovery")
public class DiscoveryController {

    private final DiscoveryService discoveryService;

    public DiscoveryController(DiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    @GetMapping("/{type}/map")
    public ResponseEntity<List<DiscoveryEntry>> map(@PathVariable String type) {
        Optional<EntityType> entityType = EntityType.fromValue(type);
        if (entityType.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(toEntries(discoveryService.mapEntries(entityType.get())));
    }

    @GetMapping("/{type}/directory")
    public ResponseEntity<List<DiscoveryEntry>> directory(@PathVariable String type) {
        Optional<EntityType> entityType = EntityType.fromValue(type);
        if (entityType.isEmpty() || entityType.get() == EntityType.BUYER) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(toEntries(discoveryService.directory(entityType.get())));
    }

    private static List<DiscoveryEntry> toEntries(List<EntitySnapshot> entities) {
        return entities.stream()
                .map(entity -> new DiscoveryEntry(
                        entity.id(),
                        entity.type().value(),
                        entity.type().profileUrl(entity.id().toString())))
                .toList();
    }

    public record DiscoveryEntry(UUID id, String type, String profileUrl) {}
}
