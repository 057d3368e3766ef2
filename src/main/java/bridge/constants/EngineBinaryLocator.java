package bridge.constants;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Platform-specific default for the engine executable, used only when
 * neither {@code engine.path} nor {@code STOCKFISH_PATH} is set.
 */
public final class EngineBinaryLocator {

    private EngineBinaryLocator() {}

    public static Path defaultPath() {
        return Path.of("bin", executableName(System.getProperty("os.name", "")));
    }

    static String executableName(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) return "stockfish-mac";
        if (os.contains("linux"))                       return "stockfish-linux";
        if (os.contains("win"))                         return "stockfish.exe";
        return "stockfish";
    }
}
