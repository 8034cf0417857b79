package io.dagport.standards.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.dagport.core.config.ElResolver;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.ConfigException;
import org.w3c.dom.Element;

/**
 * Resolves the {@code <file>} and {@code <archive>} entries of an action into
 * HDFS paths. An entry may carry a {@code #link} suffix.
 */
public final class FileArchiveExtractor
{
    public static final List<String> ARCHIVE_EXTENSIONS = ImmutableList.of(".zip", ".gz", ".tar.gz", ".tar", ".jar");

    private FileArchiveExtractor()
    { }

    public static List<String> extractFiles(Element action, Map<String, String> params)
    {
        List<String> files = new ArrayList<>();
        for (String text : XmlElements.childTexts(action, "file")) {
            String path = ElResolver.resolve(text, params);
            splitByHash(path);
            files.add(HdfsPaths.toHdfsPath(path, params));
        }
        return files;
    }

    public static List<String> extractArchives(Element action, Map<String, String> params)
    {
        List<String> archives = new ArrayList<>();
        for (String text : XmlElements.childTexts(action, "archive")) {
            String path = ElResolver.resolve(text, params);
            String archive = splitByHash(path).get(0);
            if (ARCHIVE_EXTENSIONS.stream().noneMatch(archive::endsWith)) {
                throw new ConfigException("The path " + archive
                        + " cannot be accepted as archive as it does not have one of the extensions: " + ARCHIVE_EXTENSIONS);
            }
            archives.add(HdfsPaths.toHdfsPath(path, params));
        }
        return archives;
    }

    static List<String> splitByHash(String path)
    {
        List<String> parts = Splitter.on('#').splitToList(path);
        if (parts.size() > 2) {
            throw new ConfigException("There should be maximum one '#' in the path " + path);
        }
        return parts;
    }
}
