package com.thicket.db.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the {@link PlantSdk} implementation, either on the application class path or
 * in the jars of an SDK directory.
 */
public class PlantSdkLoader {
    private static final Logger log = LoggerFactory.getLogger(PlantSdkLoader.class);

    /**
     * @param sdkPath directory holding the vendor jars, or null to search the class path only
     */
    public PlantSdk load(Path sdkPath) throws SdkLoadException {
        ClassLoader parent = PlantSdkLoader.class.getClassLoader();
        ClassLoader loader = sdkPath == null ? parent : sdkClassLoader(sdkPath, parent);

        ServiceLoader<PlantSdk> services = ServiceLoader.load(PlantSdk.class, loader);
        for (PlantSdk sdk : services) {
            log.debug("Using {} version {}", sdk.getClass().getName(), sdk.version());
            return sdk;
        }
        throw new SdkLoadException("No PlantSdk implementation found"
                + (sdkPath == null ? " on the class path" : " in " + sdkPath));
    }

    private ClassLoader sdkClassLoader(Path sdkPath, ClassLoader parent) throws SdkLoadException {
        if (!Files.isDirectory(sdkPath)) {
            throw new SdkLoadException("SDK path is not a directory: " + sdkPath);
        }
        List<URL> urls = new ArrayList<>();
        try {
            urls.add(sdkPath.toUri().toURL());
            for (Path jar : findJars(sdkPath)) {
                urls.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            throw new SdkLoadException("Invalid SDK path: " + sdkPath, e);
        }
        log.debug("SDK class path: {}", urls);
        return new URLClassLoader(urls.toArray(new URL[0]), parent);
    }

    private List<Path> findJars(Path sdkPath) throws SdkLoadException {
        try (Stream<Path> stream = Files.walk(sdkPath, 2)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SdkLoadException("Cannot list SDK path: " + sdkPath, e);
        }
    }
}
