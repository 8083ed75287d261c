package me.golemcore.router.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ModelDefinition;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the generation model catalog from {@code models.yml}.
 *
 * <p>
 * A filesystem file named by {@code router.catalog.models-path} takes
 * precedence over the bundled classpath resource. A missing or unreadable
 * catalog yields an empty model list.
 */
@Service
@Slf4j
public class ModelCatalogService {

    private static final String CLASSPATH_FILE = "models.yml";

    private final RouterProperties properties;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private volatile Map<String, ModelDefinition> models = Collections.emptyMap();

    public ModelCatalogService(RouterProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    public void reload() {
        ModelsFile file = loadFile();
        replaceModels(file.getModels());
        log.info("[ModelCatalog] Loaded {} models", models.size());
    }

    /**
     * Replaces the catalog, preserving declaration order. Entries without a
     * name are skipped; later duplicates win.
     */
    public void replaceModels(List<ModelDefinition> definitions) {
        Map<String, ModelDefinition> indexed = new LinkedHashMap<>();
        if (definitions != null) {
            for (ModelDefinition definition : definitions) {
                if (definition == null || definition.getName() == null || definition.getName().isBlank()) {
                    log.warn("[ModelCatalog] Skipping model entry without name");
                    continue;
                }
                if (definition.getRole() == null || definition.getRole().isBlank()) {
                    definition.setRole(ModelDefinition.DEFAULT_ROLE);
                }
                indexed.put(definition.getName(), definition);
            }
        }
        models = Collections.unmodifiableMap(indexed);
    }

    public List<ModelDefinition> getModels() {
        return new ArrayList<>(models.values());
    }

    public List<String> listModelNames() {
        return new ArrayList<>(models.keySet());
    }

    public Optional<ModelDefinition> findModel(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(models.get(name));
    }

    public boolean isKnown(String name) {
        return name != null && models.containsKey(name);
    }

    public String roleOf(String name) {
        return findModel(name).map(ModelDefinition::getRole).orElse(ModelDefinition.DEFAULT_ROLE);
    }

    private ModelsFile loadFile() {
        String override = properties.getCatalog().getModelsPath();
        if (override != null && !override.isBlank()) {
            Path path = RouterProperties.resolvePath(override);
            if (Files.isRegularFile(path)) {
                try (InputStream is = Files.newInputStream(path)) {
                    log.debug("[ModelCatalog] Reading {}", path);
                    return parse(is);
                } catch (IOException e) {
                    log.warn("[ModelCatalog] Failed to read {}: {}", path, e.getMessage());
                }
            } else {
                log.warn("[ModelCatalog] Configured models file not found: {}", path);
            }
        }

        ClassPathResource resource = new ClassPathResource(CLASSPATH_FILE);
        if (resource.exists()) {
            try (InputStream is = resource.getInputStream()) {
                return parse(is);
            } catch (IOException e) {
                log.warn("[ModelCatalog] Failed to read classpath {}: {}", CLASSPATH_FILE, e.getMessage());
            }
        }
        log.warn("[ModelCatalog] No models.yml found, using empty catalog");
        return new ModelsFile();
    }

    private ModelsFile parse(InputStream is) throws IOException {
        ModelsFile file = yamlMapper.readValue(is, ModelsFile.class);
        return file != null ? file : new ModelsFile();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsFile {
        private List<ModelDefinition> models = new ArrayList<>();
    }
}
