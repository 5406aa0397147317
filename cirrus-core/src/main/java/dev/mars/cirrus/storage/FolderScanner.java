package dev.mars.cirrus.storage;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lists the immediate children of a directory. Not recursive.
 */
public class FolderScanner {

    private static final Logger logger = LoggerFactory.getLogger(FolderScanner.class);

    /**
     * Returns the regular files and subdirectories of {@code folder}, each sorted by name.
     * Links to files are followed. Links to directories and special files are skipped, so a
     * link pointing back up the tree cannot make a folder upload expand forever.
     */
    public Listing scan(Path folder) throws IOException {
        List<Path> files = new ArrayList<>();
        List<Path> folders = new ArrayList<>();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path child : stream) {
                if (Files.isSymbolicLink(child) && Files.isDirectory(child)) {
                    logger.debug("Skipping linked directory {}", child);
                } else if (Files.isDirectory(child)) {
                    folders.add(child);
                } else if (Files.isRegularFile(child)) {
                    files.add(child);
                }
            }
        }

        Comparator<Path> byName = Comparator.comparing(p -> p.getFileName().toString());
        files.sort(byName);
        folders.sort(byName);
        return new Listing(List.copyOf(files), List.copyOf(folders));
    }

    public record Listing(List<Path> files, List<Path> folders) {
    }
}
