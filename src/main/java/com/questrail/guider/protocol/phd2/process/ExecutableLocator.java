package com.questrail.guider.protocol.phd2.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Finds the controller executable in its usual install locations.
 *
 * <p>This is the only platform-specific code in the runtime.</p>
 */
public final class ExecutableLocator
{
    public enum Platform
    {
        LINUX,
        MAC_OS,
        WINDOWS,
        OTHER;

        public static Platform current()
        {
            String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
            if (os.contains("win")) {
                return WINDOWS;
            }
            if (os.contains("mac") || os.contains("darwin")) {
                return MAC_OS;
            }
            if (os.contains("linux")) {
                return LINUX;
            }
            return OTHER;
        }
    }

    static final String LINUX_EXECUTABLE_NAME = "phd2";

    private final Platform platform;
    private final String searchPath;
    private final Predicate<Path> isExecutable;

    public ExecutableLocator(Platform platform, String searchPath, Predicate<Path> isExecutable)
    {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.searchPath = searchPath == null ? "" : searchPath;
        this.isExecutable = Objects.requireNonNull(isExecutable, "isExecutable");
    }

    public static ExecutableLocator forCurrentPlatform()
    {
        return new ExecutableLocator(Platform.current(), System.getenv("PATH"), Files::isRegularFile);
    }

    /**
     * Fixed install locations for this platform, in lookup order.
     */
    public List<Path> defaultLocations()
    {
        switch (platform) {
            case LINUX:
                return List.of(Paths.get("/usr/bin/phd2"), Paths.get("/usr/local/bin/phd2"));
            case MAC_OS:
                return List.of(Paths.get("/Applications/PHD2.app/Contents/MacOS/PHD2"));
            case WINDOWS:
                return List.of(
                        Paths.get("C:\\Program Files (x86)\\PHDGuiding2\\phd2.exe"),
                        Paths.get("C:\\Program Files\\PHDGuiding2\\phd2.exe"));
            default:
                return List.of();
        }
    }

    /**
     * First existing default location; on Linux, then the first {@code phd2}
     * on the search path.
     */
    public Optional<Path> locate()
    {
        for (Path candidate : candidates()) {
            if (isExecutable.test(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<Path> candidates()
    {
        List<Path> candidates = new ArrayList<>(defaultLocations());
        if (platform == Platform.LINUX) {
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (!dir.isBlank()) {
                    candidates.add(Paths.get(dir, LINUX_EXECUTABLE_NAME));
                }
            }
        }
        return candidates;
    }
}
