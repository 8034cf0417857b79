package io.dagport.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the parameters handed to node mappers from the files next to a
 * workflow definition.
 */
public class ParamsLoader
{
    private static final Logger logger = LoggerFactory.getLogger(ParamsLoader.class);

    public static final String JOB_PROPERTIES = "job.properties";
    public static final String CONFIGURATION_PROPERTIES = "configuration.properties";

    /**
     * Merges, with increasing precedence, the base params, job.properties,
     * configuration.properties and the overrides. Values read from a
     * property file may refer to params loaded before it and to other
     * entries of the same file.
     */
    public Map<String, String> load(Path inputDirectory, Map<String, String> base, Map<String, String> overrides)
        throws IOException
    {
        Map<String, String> params = new LinkedHashMap<>(base);
        mergeFile(params, inputDirectory.resolve(JOB_PROPERTIES));
        mergeFile(params, inputDirectory.resolve(CONFIGURATION_PROPERTIES));
        params.putAll(overrides);
        return params;
    }

    private void mergeFile(Map<String, String> params, Path file)
        throws IOException
    {
        if (!Files.exists(file)) {
            logger.debug("{} does not exist. Skipping", file);
            return;
        }
        Map<String, String> loaded = PropertyUtils.toMap(PropertyUtils.loadFile(file));
        Map<String, String> scope = new LinkedHashMap<>(params);
        scope.putAll(loaded);
        // entries may refer to each other; a self reference stops after loaded.size() passes
        for (int i = 0; i <= loaded.size(); i++) {
            boolean changed = false;
            for (String key : loaded.keySet()) {
                String resolved = ElResolver.resolve(scope.get(key), scope);
                if (!resolved.equals(scope.get(key))) {
                    scope.put(key, resolved);
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }
        for (String key : loaded.keySet()) {
            params.put(key, scope.get(key));
        }
        logger.debug("Loaded {} params from {}", loaded.size(), file);
    }
}
