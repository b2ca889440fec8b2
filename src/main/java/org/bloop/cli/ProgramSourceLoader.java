package org.bloop.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads BLOOP programs from disk.
 */
public final class ProgramSourceLoader {

    private ProgramSourceLoader() {
    }

    /**
     * Reads a program file. Bytes that are not valid UTF-8 are replaced rather than rejected;
     * they can never be commands anyway.
     *
     * @param path The file to read.
     * @return The program text.
     * @throws IOException if the file cannot be read.
     */
    public static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Checks a file name against the expected extension, ignoring case.
     *
     * @param path The file.
     * @param extension The extension including the dot, e.g. ".bloop".
     * @return true if the file name ends with the extension.
     */
    public static boolean hasExtension(Path path, String extension) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        return fileName.toString().toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT));
    }
}
