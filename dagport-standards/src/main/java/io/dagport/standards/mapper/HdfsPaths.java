package io.dagport.standards.mapper;

import java.util.Map;
import java.util.regex.Pattern;
import io.dagport.core.config.ElResolver;
import io.dagport.spi.ConfigException;

final class HdfsPaths
{
    static final String NAME_NODE = "nameNode";
    static final String APPLICATION_PATH = "oozie.wf.application.path";

    private static final Pattern SCHEME_AND_AUTHORITY = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://[^/]*");

    private HdfsPaths()
    { }

    /**
     * Resolves parameters in a path and drops its scheme and authority, so that
     * {@code hdfs://nn:8020/tmp/x} and {@code hdfs:///tmp/x} both become
     * {@code /tmp/x}.
     */
    static String normalize(String path, Map<String, String> params)
    {
        String resolved = ElResolver.resolve(path, params);
        return SCHEME_AND_AUTHORITY.matcher(resolved).replaceFirst("");
    }

    /**
     * Absolute paths are prefixed with the name node, relative ones with the
     * workflow application path.
     */
    static String toHdfsPath(String path, Map<String, String> params)
    {
        if (path.startsWith("/")) {
            return require(params, NAME_NODE) + path;
        }
        return require(params, APPLICATION_PATH) + "/" + path;
    }

    static String require(Map<String, String> params, String name)
    {
        String value = params.get(name);
        if (value == null) {
            throw new ConfigException("Parameter '" + name + "' is required");
        }
        return value;
    }
}
