/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.vinfo.store;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds the record files of the monitored nodes in a data directory. A node named
 * {@code Node1} stores its records in {@code Node1<suffix>}.
 */
public final class StoreLocator {

    private final Path dataDir;
    private final String suffix;

    public StoreLocator(Path dataDir, String suffix) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        if (suffix.isEmpty()) {
            throw new IllegalArgumentException("suffix must not be empty");
        }
    }

    /**
     * Lists the stores whose node name matches the selector.
     *
     * @param selector a glob over node names ({@code Node*}), or {@code null} for all nodes
     * @return matching stores sorted by name
     * @throws IOException if the directory cannot be listed
     */
    public List<StoreLocation> locate(String selector) throws IOException {
        String glob = (selector == null || selector.isBlank() ? "*" : selector) + suffix;
        List<StoreLocation> found = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            throw new IOException("Data directory " + dataDir + " does not exist");
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, glob)) {
            for (Path path : stream) {
                if (!Files.isRegularFile(path)) {
                    continue;
                }
                String fileName = path.getFileName().toString();
                found.add(new StoreLocation(fileName.substring(0, fileName.length() - suffix.length()), path));
            }
        }
        found.sort(Comparator.comparing(StoreLocation::name));
        return found;
    }

    /**
     * @param name node name
     * @param path record file
     */
    public record StoreLocation(String name, Path path) {

        public RecordStore open() throws IOException {
            return FileRecordStore.open(name, path);
        }
    }
}
