package com.bdfrenumber.core.writer;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes generated deck files to the file system.
 *
 * <p>Creates the output directory structure and writes all generated files.
 * Existing files are overwritten.
 */
public class FileSystemWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemWriter.class);

    /**
     * Writes every file of the output below a directory.
     *
     * @param output generated files
     * @param outputDirectory target directory
     * @return written paths, root first
     * @throws RenumberException if a file cannot be written
     */
    public List<Path> write(GeneratedOutput output, Path outputDirectory) {
        log.info("Writing {} files to {}", output.files().size(), outputDirectory);

        List<Path> written = new ArrayList<>();
        for (GeneratedFile file : output.files()) {
            Path targetPath = outputDirectory.resolve(file.relativePath()).normalize();
            try {
                FileUtils.writeLines(targetPath, file.lines());
                log.debug("Wrote file: {} ({} lines)", targetPath, file.lines().size());
            } catch (IOException e) {
                throw new RenumberException("Failed to write file: " + targetPath, targetPath, e);
            }
            written.add(targetPath);
        }
        return written;
    }
}
