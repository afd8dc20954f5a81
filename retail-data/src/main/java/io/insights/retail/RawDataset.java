package io.insights.retail;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Undecoded bytes of one dataset as handed over by the transport layer.
 */
public record RawDataset(DatasetKind kind, String name, byte[] data) {

    public static RawDataset of(DatasetKind kind, String csv) {
        return new RawDataset(kind, kind.fileName(), csv.getBytes(StandardCharsets.UTF_8));
    }

    public static RawDataset read(DatasetKind kind, Path file) throws IOException {
        return new RawDataset(kind, file.getFileName().toString(), Files.readAllBytes(file));
    }

    @Override
    public String toString() {
        return "RawDataset{" + kind + ", " + name + ", " + data.length + " bytes}";
    }
}
