package com.deckinverter.util;

import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Zip handling for batches: recognising archive containers among the inputs,
 * expanding them into decks, naming outputs and writing the result archive.
 */
@Slf4j
public final class DeckArchives {

    public static final String DECK_EXTENSION = ".pptx";
    private static final String ARCHIVE_EXTENSION = ".zip";
    private static final String CONTENT_TYPES_ENTRY = "[Content_Types].xml";

    private DeckArchives() { /* utility class */ }

    /**
     * A buffer is an archive container when it is named {@code *.zip}, or when
     * it is a zip that is not itself an OOXML package.
     */
    public static boolean isArchiveContainer(String name, byte[] data) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(ARCHIVE_EXTENSION)) {
            return true;
        }
        if (lower.endsWith(DECK_EXTENSION) || !hasZipSignature(data)) {
            return false;
        }
        try (ZipArchiveInputStream zis = open(data)) {
            ZipArchiveEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (CONTENT_TYPES_ENTRY.equals(entry.getName())) {
                    return false;
                }
            }
            return true;
        } catch (IOException e) {
            log.debug("Not a readable zip: {} ({})", name, e.getMessage());
            return false;
        }
    }

    /**
     * Extract the decks of one archive, one level deep. Each deck is named
     * {@code <container>/<entry path>}; nested archives, folders and macOS
     * metadata entries are skipped.
     *
     * @throws IOException if the archive cannot be read
     */
    public static List<DocumentSource> expand(String containerName, byte[] data) throws IOException {
        List<DocumentSource> decks = new ArrayList<>();
        try (ZipArchiveInputStream zis = open(data)) {
            ZipArchiveEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                String path = normalizePath(entry.getName());
                if (entry.isDirectory() || path.isEmpty() || !isDeckEntry(path)) {
                    continue;
                }
                if (!zis.canReadEntryData(entry)) {
                    throw new IOException("Unsupported compression for entry " + path);
                }
                decks.add(DocumentSource.of(containerName + "/" + path, zis.readAllBytes()));
            }
        }
        log.debug("Expanded {} into {} deck(s)", containerName, decks.size());
        return decks;
    }

    /**
     * Zip entry paths with backslashes turned into slashes and empty,
     * {@code .} and {@code ..} segments dropped, so no output entry can point
     * outside the result folder.
     */
    static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                continue;
            }
            if (out.length() > 0) {
                out.append('/');
            }
            out.append(segment);
        }
        return out.toString();
    }

    /**
     * Archive entry name of the inverted deck: {@code "<base> <suffix>.pptx"},
     * keeping the directory part of archive-derived names with the container's
     * {@code .zip} extension dropped.
     */
    public static String outputName(String displayName, String suffix) {
        String name = normalizePath(displayName);
        if (name.isEmpty()) {
            name = "presentation";
        }
        int slash = name.lastIndexOf('/');
        String directory = slash >= 0 ? name.substring(0, slash) : "";
        String fileName = slash >= 0 ? name.substring(slash + 1) : name;

        StringBuilder out = new StringBuilder();
        if (!directory.isEmpty()) {
            for (String segment : directory.split("/")) {
                out.append(segment.toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION)
                        ? stripExtension(segment) : segment).append('/');
            }
        }
        String base = stripExtension(fileName);
        out.append(base.isEmpty() ? "presentation" : base);
        if (suffix != null && !suffix.isBlank()) {
            out.append(' ').append(suffix);
        }
        return out.append(DECK_EXTENSION).toString();
    }

    /**
     * Zip every succeeded result under {@code folder}; failed results are skipped.
     *
     * @return the archive bytes, empty when {@code results} is empty
     */
    public static byte[] buildArchive(List<ProcessingResult> results, String folder) throws IOException {
        if (results.isEmpty()) {
            return new byte[0];
        }
        String prefix = folder == null || folder.isBlank() ? "" : folder + "/";

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zipStream = new ZipArchiveOutputStream(bytes)) {
            zipStream.setEncoding(StandardCharsets.UTF_8.name());

            for (ProcessingResult result : results) {
                byte[] deck = result.getOutputBytes();
                if (!result.isSucceeded() || deck == null) {
                    continue;
                }
                ZipArchiveEntry entry = new ZipArchiveEntry(prefix + result.getOutputName());
                entry.setSize(deck.length);
                zipStream.putArchiveEntry(entry);
                zipStream.write(deck);
                zipStream.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    public static String stripExtension(String fileName) {
        return fileName.replaceFirst("[.][^.]+$", "");
    }

    static boolean isDeckEntry(String path) {
        if (path.startsWith("__MACOSX/")) {
            return false;
        }
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        return !fileName.startsWith("._") && fileName.toLowerCase(Locale.ROOT).endsWith(DECK_EXTENSION);
    }

    private static boolean hasZipSignature(byte[] data) {
        return data != null && data.length >= 4
                && data[0] == 'P' && data[1] == 'K' && data[2] == 3 && data[3] == 4;
    }

    private static ZipArchiveInputStream open(byte[] data) {
        return new ZipArchiveInputStream(new ByteArrayInputStream(data), StandardCharsets.UTF_8.name(), true, true);
    }
}
