package com.makrcave.backend.modules.accesscontrol.application;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.makrcave.backend.modules.accesscontrol.domain.PermissionType;
import com.makrcave.backend.modules.accesscontrol.domain.RoleType;

/**
 * Reads the permissions and system roles every makerspace starts with.
 */
@Component
public class DefaultCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(DefaultCatalogLoader.class);

    static final String DEFAULT_CATALOG = "access-control/default-catalog.json";

    private final ObjectMapper objectMapper;
    private volatile DefaultCatalog cached;

    public DefaultCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DefaultCatalog load() {
        DefaultCatalog catalog = cached;
        if (catalog == null) {
            catalog = read(new ClassPathResource(DEFAULT_CATALOG));
            cached = catalog;
        }
        return catalog;
    }

    DefaultCatalog read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            DefaultCatalog catalog = objectMapper.readValue(in, DefaultCatalog.class);
            log.debug("Loaded default access catalog: {} permissions, {} roles",
                    catalog.permissions().size(), catalog.roles().size());
            return catalog;
        } catch (IOException ex) {
            log.error("Failed to read default access catalog {}", resource.getDescription(), ex);
            throw new UncheckedIOException("Failed to read default access catalog " + DEFAULT_CATALOG, ex);
        }
    }

    public record DefaultCatalog(List<PermissionSeed> permissions, List<RoleSeed> roles) {

        public DefaultCatalog {
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
            roles = roles == null ? List.of() : List.copyOf(roles);
        }
    }

    public record PermissionSeed(String codename, String name, String description, PermissionType permissionType) {
    }

    public record RoleSeed(
            String name,
            String description,
            RoleType roleType,
            int priorityLevel,
            boolean requiresTwoFactor,
            boolean defaultRole,
            List<String> permissions
    ) {

        public RoleSeed {
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
        }
    }
}
