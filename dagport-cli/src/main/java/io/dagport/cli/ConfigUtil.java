package io.dagport.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    public static Path defaultConfigPath(Map<String, String> env)
    {
        return configHome(env).resolve("dagport").resolve("config");
    }

    private static Path configHome(Map<String, String> env)
    {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null) {
            return Paths.get(configHome);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }
}
