package com.localization.resources.loader;

import com.localization.resources.model.CultureKey;
import com.localization.resources.model.ResourceEntity;
import com.localization.resources.model.ResourceLanguage;
import com.localization.resources.model.ResourceTableConfig;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a directory of Java properties bundles into resource entities.
 *
 * <p>{@code messages.properties} is the neutral language of base name {@code messages},
 * {@code messages_de.properties} and {@code messages_de_AT.properties} are its cultures.
 * Files are read as UTF-8 and keys keep their file order. Read-only files become read-only languages. Nothing is written back.</p>
 */
@RequiredArgsConstructor
public class PropertiesBundleLoader {
    private static final Logger log = LoggerFactory.getLogger(PropertiesBundleLoader.class);

    private static final String EXTENSION = ".properties";
    private static final Pattern CULTURE_SUFFIX = Pattern.compile("[a-zA-Z]{2,3}(_[a-zA-Z0-9]+)*");

    private final ResourceTableConfig config;

    /**
     * Load all bundles of a directory, sorted by base name.
     */
    public List<ResourceEntity> loadAll(Path directory) throws IOException {
        return load(directory, null);
    }

    /**
     * Load the bundles of a directory.
     *
     * @param baseNameFilter only load this base name, or all if {@code null}
     */
    public List<ResourceEntity> load(Path directory, String baseNameFilter) throws IOException {
        List<String> stems;
        try (Stream<Path> files = Files.list(directory)) {
            stems = files
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }

        Map<String, Map<CultureKey, String>> bundles = groupByBaseName(stems);
        Path absolute = directory.toAbsolutePath().normalize();
        String projectName = absolute.getFileName() != null ? absolute.getFileName().toString() : absolute.toString();

        List<ResourceEntity> entities = new ArrayList<>();
        for (Map.Entry<String, Map<CultureKey, String>> bundle : bundles.entrySet()) {
            String baseName = bundle.getKey();
            if (baseNameFilter != null && !baseNameFilter.equals(baseName)) {
                continue;
            }

            Map<CultureKey, ResourceLanguage> languages = new LinkedHashMap<>();
            for (Map.Entry<CultureKey, String> file : bundle.getValue().entrySet()) {
                Path path = directory.resolve(file.getValue() + EXTENSION);
                languages.put(file.getKey(), readLanguage(file.getKey(), path));
            }
            entities.add(new ResourceEntity(projectName, baseName, languages, config));
        }

        log.info("Loaded {} resource bundle(s) from {}", entities.size(), directory);
        return entities;
    }

    // base name -> culture -> file stem, cultures in CultureKey order so the neutral file comes first
    private Map<String, Map<CultureKey, String>> groupByBaseName(List<String> stems) {
        Map<String, Map<CultureKey, String>> bundles = new TreeMap<>();
        for (String stem : stems) {
            String baseName = findBaseName(stem, stems);
            CultureKey culture = baseName != null
                    ? CultureKey.parse(stem.substring(baseName.length() + 1))
                    : CultureKey.NEUTRAL;
            if (culture.isNeutral()) {
                bundles.computeIfAbsent(stem, k -> new TreeMap<>()).put(CultureKey.NEUTRAL, stem);
            } else {
                bundles.computeIfAbsent(baseName, k -> new TreeMap<>()).put(culture, stem);
            }
        }
        return bundles;
    }

    // shortest stem that this stem extends with a culture suffix, so messages_de_AT belongs to messages
    private String findBaseName(String stem, List<String> stems) {
        String best = null;
        for (String candidate : stems) {
            if (stem.length() > candidate.length() + 1
                    && stem.startsWith(candidate + "_")
                    && CULTURE_SUFFIX.matcher(stem.substring(candidate.length() + 1)).matches()
                    && (best == null || candidate.length() < best.length())) {
                best = candidate;
            }
        }
        return best;
    }

    private ResourceLanguage readLanguage(CultureKey culture, Path path) throws IOException {
        // Properties is hash based, record keys in file order as load() puts them
        Map<String, String> values = new LinkedHashMap<>();
        Properties properties = new Properties() {
            private static final long serialVersionUID = 1L;

            @Override
            public synchronized Object put(Object key, Object value) {
                values.put((String) key, (String) value);
                return super.put(key, value);
            }
        };
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }

        boolean readOnly = !Files.isWritable(path);
        log.debug("Read {} keys for culture {} from {}{}", values.size(), culture, path, readOnly ? " (read-only)" : "");
        return new ResourceLanguage(culture, values, readOnly);
    }
}
