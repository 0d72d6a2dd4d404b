package com.questrail.labsim.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * TemplateCatalog
 * -----------------------------------------------------------------------------
 * Immutable set of analyzer templates keyed by id.
 *
 * <p>A template's id is its file name without {@code .json}. Ids are matched
 * case-insensitively, so {@code HEMATOLOGY} finds {@code hematology.json}.
 * {@code schema.json} is never treated as a template.</p>
 *
 * <p>Loaded once at startup and then only read, concurrently, by sessions and
 * the control surface.</p>
 */
public final class TemplateCatalog
{
    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    /** Classpath directory of bundled templates. */
    public static final String BUNDLED_DIRECTORY = "templates/";

    /** Lists bundled template ids, one per line; the classpath cannot be listed. */
    static final String BUNDLED_INDEX = BUNDLED_DIRECTORY + "index.txt";

    private static final String SUFFIX = ".json";
    private static final String SCHEMA_ID = "schema";

    private final Map<String, AnalyzerTemplate> templates;

    private TemplateCatalog(Map<String, AnalyzerTemplate> templates)
    {
        this.templates = Collections.unmodifiableMap(new TreeMap<>(templates));
    }

    public static TemplateCatalog of(List<AnalyzerTemplate> templates)
    {
        Map<String, AnalyzerTemplate> byId = new TreeMap<>();
        for (AnalyzerTemplate t : templates) {
            if (byId.put(key(t.id()), t) != null) {
                throw new TemplateException("Duplicate template id: " + t.id());
            }
        }
        return new TemplateCatalog(byId);
    }

    /**
     * Loads every {@code *.json} file in a directory.
     *
     * @throws TemplateException if the directory is unreadable, holds no
     *                           templates, or any template is invalid
     */
    public static TemplateCatalog loadDirectory(Path directory)
    {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new TemplateException("Template directory not found: " + directory);
        }

        JsonTemplateReader reader = new JsonTemplateReader();
        List<AnalyzerTemplate> loaded = new ArrayList<>();
        List<Path> files;
        try (Stream<Path> s = Files.list(directory)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TemplateException("Cannot list template directory " + directory, e);
        }

        for (Path file : files) {
            String name = file.getFileName().toString();
            String id = name.substring(0, name.length() - SUFFIX.length());
            if (SCHEMA_ID.equalsIgnoreCase(id)) {
                continue;
            }
            try (InputStream in = Files.newInputStream(file)) {
                loaded.add(reader.read(id, in));
            } catch (IOException e) {
                throw new TemplateException("Cannot read template " + file, e);
            }
        }

        if (loaded.isEmpty()) {
            throw new TemplateException("No templates found in " + directory);
        }
        log.info("Loaded {} analyzer templates from {}", loaded.size(), directory);
        return of(loaded);
    }

    /**
     * Loads the templates bundled on the classpath under {@value #BUNDLED_DIRECTORY}.
     */
    public static TemplateCatalog loadBundled()
    {
        ClassLoader cl = TemplateCatalog.class.getClassLoader();
        List<String> ids = new ArrayList<>();
        try (InputStream in = cl.getResourceAsStream(BUNDLED_INDEX)) {
            if (in == null) {
                throw new TemplateException("Bundled template index missing: " + BUNDLED_INDEX);
            }
            BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = r.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty() && !line.startsWith("#")) {
                    ids.add(line);
                }
            }
        } catch (IOException e) {
            throw new TemplateException("Cannot read " + BUNDLED_INDEX, e);
        }

        JsonTemplateReader reader = new JsonTemplateReader();
        List<AnalyzerTemplate> loaded = new ArrayList<>();
        for (String id : ids) {
            String resource = BUNDLED_DIRECTORY + id + SUFFIX;
            try (InputStream in = cl.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new TemplateException("Bundled template missing: " + resource);
                }
                loaded.add(reader.read(id, in));
            } catch (IOException e) {
                throw new TemplateException("Cannot read " + resource, e);
            }
        }
        log.debug("Loaded {} bundled analyzer templates", loaded.size());
        return of(loaded);
    }

    /**
     * @throws TemplateException if no template has this id
     */
    public AnalyzerTemplate get(String id)
    {
        return find(id).orElseThrow(() -> new TemplateException(
                "Unknown template '" + id + "'; available: " + ids()));
    }

    public Optional<AnalyzerTemplate> find(String id)
    {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(key(id)));
    }

    public boolean contains(String id)
    {
        return find(id).isPresent();
    }

    /** Template ids in sorted order. */
    public List<String> ids()
    {
        return templates.values().stream().map(AnalyzerTemplate::id).collect(Collectors.toList());
    }

    public int size()
    {
        return templates.size();
    }

    private static String key(String id)
    {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
